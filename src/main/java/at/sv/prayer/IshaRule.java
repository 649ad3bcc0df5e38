package at.sv.prayer;

import java.time.Duration;

/**
 * How the Isha time is derived: either from a twilight angle, or as a fixed interval after Maghrib.
 *
 * @param angle                the solar altitude in degrees below the horizon, ignored for fixed intervals
 * @param intervalAfterMaghrib the fixed interval after Maghrib, or {@code null} if the angle is used
 */
public record IshaRule(double angle, Duration intervalAfterMaghrib) {

    public static IshaRule ofAngle(double angle) {
        return new IshaRule(angle, null);
    }

    public static IshaRule ofInterval(Duration intervalAfterMaghrib) {
        if (intervalAfterMaghrib.isNegative()) {
            throw new IllegalArgumentException("Isha interval after Maghrib must not be negative: " + intervalAfterMaghrib);
        }
        return new IshaRule(Double.NaN, intervalAfterMaghrib);
    }

    public boolean isFixedInterval() {
        return intervalAfterMaghrib != null;
    }

    @Override
    public String toString() {
        if (isFixedInterval()) {
            return "maghrib+" + intervalAfterMaghrib.toMinutes() + "min";
        }
        return angle + "°";
    }
}
