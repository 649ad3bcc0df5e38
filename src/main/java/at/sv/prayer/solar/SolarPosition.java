package at.sv.prayer.solar;

import static java.lang.Math.cos;
import static java.lang.Math.sin;
import static java.lang.Math.toRadians;

/**
 * The sun's declination and the equation of time for a moment of the year.
 *
 * @param declination    the declination in degrees, positive north of the celestial equator
 * @param equationOfTime apparent minus mean solar time in minutes
 */
public record SolarPosition(double declination, double equationOfTime) {

    private static final double MAX_DECLINATION = 23.45;

    /**
     * Short-term approximation of the sun's position, accurate to a few tenths of a degree and about a minute of time.
     * Any real day fraction is accepted, as the model is periodic.
     *
     * @param dayFraction the day of year with fraction of the UTC day, see {@link DayFraction}
     */
    public static SolarPosition at(double dayFraction) {
        double b = toRadians((360.0 / 365.0) * (dayFraction - 81));
        double declination = MAX_DECLINATION * sin(b);
        double equationOfTime = 9.87 * sin(2 * b) - 7.53 * cos(b) - 1.5 * sin(b);
        return new SolarPosition(declination, equationOfTime);
    }
}
