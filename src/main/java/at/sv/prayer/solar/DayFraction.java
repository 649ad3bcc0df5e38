package at.sv.prayer.solar;

import java.time.LocalDate;

/**
 * Converts a local clock time on a calendar date into a continuous day-of-year value referenced to UTC.
 */
public final class DayFraction {

    private static final double HOURS_PER_DAY = 24.0;

    private DayFraction() {
    }

    /**
     * @param date      the local calendar date; only its day of year is used
     * @param localHour the local time of day in hours, may lie outside [0, 24)
     * @param utcOffset the offset of the local civil time from UTC in hours, e.g. 6.5
     * @return the 1-based day of year plus the fraction of the UTC day, e.g. 1.5 for Jan 1st 12:00 UTC
     */
    public static double of(LocalDate date, double localHour, double utcOffset) {
        int dayIndex = date.getDayOfYear();
        double utcHour = localHour - utcOffset;
        if (utcHour < 0 || utcHour >= HOURS_PER_DAY) {
            int dayShift = (int) Math.floor(utcHour / HOURS_PER_DAY);
            dayIndex += dayShift;
            utcHour -= dayShift * HOURS_PER_DAY;
        }
        return dayIndex + utcHour / HOURS_PER_DAY;
    }
}
