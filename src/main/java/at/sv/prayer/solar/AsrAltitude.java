package at.sv.prayer.solar;

import static java.lang.Math.abs;
import static java.lang.Math.atan;
import static java.lang.Math.tan;
import static java.lang.Math.toDegrees;
import static java.lang.Math.toRadians;

public final class AsrAltitude {

    private AsrAltitude() {
    }

    /**
     * Returns the solar altitude at which the shadow of an object equals its noon shadow plus {@code shadowFactor}
     * times its height.
     * <p>
     * Positive whenever the sun culminates above the horizon, i.e. {@code |lat - decl| < 90}. Beyond that the result
 * is a negative altitude the sun never reaches on that day.
     *
     * @param shadowFactor 1 (Shafi, Maliki, Hanbali) or 2 (Hanafi)
     * @return the altitude in degrees above the horizon
     */
    public static double of(double latitude, double declination, int shadowFactor) {
        double zenithAtNoon = abs(toRadians(latitude - declination));
        return toDegrees(atan(1.0 / (shadowFactor + tan(zenithAtNoon))));
    }
}
