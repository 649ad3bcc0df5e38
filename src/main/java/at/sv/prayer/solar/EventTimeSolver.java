package at.sv.prayer.solar;

import java.time.LocalDate;

/**
 * Solves the local clock time at which the sun crosses a target altitude, refining the solar position at each estimate.
 */
public final class EventTimeSolver {

    /**
     * Apparent altitude of the sun's upper limb at sunrise and sunset, including standard refraction.
     */
    public static final double HORIZON_ALTITUDE = -0.833;

    private static final int EVENT_ITERATIONS = 3;
    private static final int NOON_ITERATIONS = 2;
    private static final double LOCAL_NOON = 12.0;
    private static final double DEGREES_PER_HOUR = 15.0;

    private EventTimeSolver() {
    }

    /**
     * @param latitude   observer latitude in degrees
     * @param longitude  observer longitude in degrees, positive east
     * @param utcOffset  local offset from UTC in hours
     * @param date       the local date of the event
     * @param altitude   target solar altitude in degrees, negative below the horizon
     * @param beforeNoon true for morning events (rising sun), false for afternoon and evening events
     * @return the local time in hours (may lie outside [0, 24)), or {@link Solution#UNREACHABLE}
     */
    public static Solution solve(double latitude, double longitude, double utcOffset, LocalDate date,
                                 double altitude, boolean beforeNoon) {
        SolarPosition position = positionAt(date, LOCAL_NOON, utcOffset);
        Solution time = estimate(latitude, longitude, utcOffset, position, altitude, beforeNoon);
        for (int i = 0; i < EVENT_ITERATIONS && time.isReachable(); i++) {
            position = positionAt(date, time.getValue(), utcOffset);
            time = estimate(latitude, longitude, utcOffset, position, altitude, beforeNoon);
        }
        return time;
    }

    /**
     * @return the local time in hours at which the sun crosses the meridian on the given date
     */
    public static double solarNoon(double longitude, double utcOffset, LocalDate date) {
        double noon = noonFor(longitude, utcOffset, positionAt(date, LOCAL_NOON, utcOffset));
        for (int i = 0; i < NOON_ITERATIONS; i++) {
            noon = noonFor(longitude, utcOffset, positionAt(date, noon, utcOffset));
        }
        return noon;
    }

    /**
     * @return the solar position at local noon of the given date
     */
    public static SolarPosition positionAtNoon(LocalDate date, double utcOffset) {
        return positionAt(date, LOCAL_NOON, utcOffset);
    }

    private static Solution estimate(double latitude, double longitude, double utcOffset, SolarPosition position,
                                     double altitude, boolean beforeNoon) {
        double noon = noonFor(longitude, utcOffset, position);
        return HourAngle.of(latitude, position.declination(), altitude)
                        .map(hourAngle -> beforeNoon ? noon - hourAngle / DEGREES_PER_HOUR
                                : noon + hourAngle / DEGREES_PER_HOUR);
    }

    private static double noonFor(double longitude, double utcOffset, SolarPosition position) {
        return LOCAL_NOON + utcOffset - longitude / DEGREES_PER_HOUR - position.equationOfTime() / 60.0;
    }

    private static SolarPosition positionAt(LocalDate date, double localHour, double utcOffset) {
        return SolarPosition.at(DayFraction.of(date, localHour, utcOffset));
    }
}
