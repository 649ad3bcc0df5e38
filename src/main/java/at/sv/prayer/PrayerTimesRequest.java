package at.sv.prayer;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;

import java.time.Duration;
import java.time.LocalDate;

/**
 * All inputs for a single day's calculation. Requests with equal values always produce equal results.
 */
@Data
@AllArgsConstructor
@Builder(toBuilder = true)
public final class PrayerTimesRequest {
    private final double latitude;
    private final double longitude;
    /**
     * Offset of the local civil time from UTC in hours, already resolved for daylight saving time.
     */
    private final double utcOffset;
    private final LocalDate date;
    private final CalculationMethod method;
    private final AsrShadow asrShadow;
    /**
     * Only used by {@link CalculationMethod#CUSTOM}.
     */
    private final Double fajrAngle;
    /**
     * Only used by {@link CalculationMethod#CUSTOM}.
     */
    private final Double ishaAngle;
    /**
     * Fixed interval between Maghrib and Isha, used by {@link CalculationMethod#UMM_AL_QURA} and optionally by
     * {@link CalculationMethod#CUSTOM}.
     */
    private final Duration ishaInterval;

    public MethodAngles getAngles() {
        return method.resolve(fajrAngle, ishaAngle, ishaInterval);
    }
}
