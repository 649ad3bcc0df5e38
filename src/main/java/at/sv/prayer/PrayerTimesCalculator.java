package at.sv.prayer;

public interface PrayerTimesCalculator {

    /**
     * Calculates the prayer times of a single day. Never throws for finite inputs: events the sun does not reach at
     * the given location and date are reported as {@link at.sv.prayer.time.TimeFormatter#UNREACHABLE_PLACEHOLDER}.
     *
     * @param request the location, date and calculation conventions
     * @return the formatted times for the request
     */
    PrayerTimesResult calculate(PrayerTimesRequest request);
}
