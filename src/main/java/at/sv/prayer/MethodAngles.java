package at.sv.prayer;

/**
 * @param fajrAngle solar altitude for Fajr in degrees, negative below the horizon
 * @param isha      the rule deriving Isha
 */
public record MethodAngles(double fajrAngle, IshaRule isha) {

    public static MethodAngles of(double fajrAngle, double ishaAngle) {
        return new MethodAngles(fajrAngle, IshaRule.ofAngle(ishaAngle));
    }
}
