package at.sv.prayer.solar;

import static java.lang.Math.acos;
import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

public final class HourAngle {

    private HourAngle() {
    }

    /**
     * Returns the hour angle at which the sun passes the given altitude.
     *
     * @param latitude    observer latitude in degrees
     * @param declination solar declination in degrees
     * @param altitude    target altitude in degrees, negative below the horizon
     * @return the hour angle magnitude in degrees [0, 180], or {@link Solution#UNREACHABLE} if the sun never reaches
     * the altitude on that day
     */
    public static Solution of(double latitude, double declination, double altitude) {
        double cosH = cosHourAngle(latitude, declination, altitude);
        if (!Double.isFinite(cosH) || cosH < -1 || cosH > 1) {
            return Solution.UNREACHABLE;
        }
        return Solution.of(toDegrees(acos(cosH)));
    }

    /**
     * Best-effort variant of {@link #of(double, double, double)} which clamps the cosine into [-1, 1]. Below the
     * minimum altitude this yields 180 degrees (midnight), above the maximum 0 degrees (noon).
     */
    public static double clamped(double latitude, double declination, double altitude) {
        double cosH = cosHourAngle(latitude, declination, altitude);
        if (Double.isNaN(cosH)) {
            return 0.0;
        }
        return toDegrees(acos(Math.max(-1.0, Math.min(1.0, cosH))));
    }

    private static double cosHourAngle(double latitude, double declination, double altitude) {
        double phi = toRadians(latitude);
        double delta = toRadians(declination);
        return (sin(toRadians(altitude)) - sin(phi) * sin(delta)) / (cos(phi) * cos(delta));
    }
}
