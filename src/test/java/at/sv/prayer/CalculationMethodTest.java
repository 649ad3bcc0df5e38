package at.sv.prayer;

import org.junit.jupiter.api.Test;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class CalculationMethodTest {

    @Test
    void presets_haveExpectedAngles() {
        assertThat(CalculationMethod.MWL.getDefaultAngles()).isEqualTo(MethodAngles.of(-18, -17));
        assertThat(CalculationMethod.KARACHI.getDefaultAngles()).isEqualTo(MethodAngles.of(-18, -18));
        assertThat(CalculationMethod.EGYPT.getDefaultAngles()).isEqualTo(MethodAngles.of(-19.5, -17.5));
    }

    @Test
    void ummAlQura_ishaIsFixedIntervalAfterMaghrib() {
        MethodAngles angles = CalculationMethod.UMM_AL_QURA.getDefaultAngles();

        assertThat(angles.fajrAngle()).isEqualTo(-18.5);
        assertThat(angles.isha().isFixedInterval()).isTrue();
        assertThat(angles.isha().intervalAfterMaghrib()).isEqualTo(Duration.ofMinutes(90));
        assertThat(CalculationMethod.DEFAULT_ISHA_INTERVAL).isEqualTo(Duration.ofMinutes(90));
    }

    @Test
    void resolve_preset_ignoresAngleOverrides() {
        assertThat(CalculationMethod.MWL.resolve(-10.0, -10.0, Duration.ofMinutes(60)))
                .isEqualTo(MethodAngles.of(-18, -17));
    }

    @Test
    void resolve_ummAlQura_intervalOverride() {
        MethodAngles angles = CalculationMethod.UMM_AL_QURA.resolve(null, null, Duration.ofMinutes(120));

        assertThat(angles.fajrAngle()).isEqualTo(-18.5);
        assertThat(angles.isha().intervalAfterMaghrib()).isEqualTo(Duration.ofMinutes(120));
    }

    @Test
    void resolve_custom_usesSuppliedAngles() {
        assertThat(CalculationMethod.CUSTOM.resolve(-15.0, -14.0, null)).isEqualTo(MethodAngles.of(-15, -14));
    }

    @Test
    void resolve_custom_missingAngles_fallBackToKarachi() {
        assertThat(CalculationMethod.CUSTOM.resolve(null, null, null))
                .isEqualTo(CalculationMethod.KARACHI.getDefaultAngles());
        assertThat(CalculationMethod.CUSTOM.resolve(-16.0, null, null)).isEqualTo(MethodAngles.of(-16, -18));
    }

    @Test
    void resolve_custom_intervalReplacesIshaAngle() {
        MethodAngles angles = CalculationMethod.CUSTOM.resolve(-16.0, -15.0, Duration.ofMinutes(75));

        assertThat(angles.fajrAngle()).isEqualTo(-16.0);
        assertThat(angles.isha()).isEqualTo(IshaRule.ofInterval(Duration.ofMinutes(75)));
    }

    @Test
    void parse_ignoresCaseAndUnderscores() {
        assertThat(CalculationMethod.parse("UmmAlQura")).isEqualTo(CalculationMethod.UMM_AL_QURA);
        assertThat(CalculationMethod.parse("umm_al_qura")).isEqualTo(CalculationMethod.UMM_AL_QURA);
        assertThat(CalculationMethod.parse(" karachi ")).isEqualTo(CalculationMethod.KARACHI);
        assertThat(CalculationMethod.parse("mwl")).isEqualTo(CalculationMethod.MWL);
    }

    @Test
    void parse_unknown_exception() {
        assertThrows(InvalidPropertyValue.class, () -> CalculationMethod.parse("ISNA"));
        assertThrows(InvalidPropertyValue.class, () -> CalculationMethod.parse(null));
    }

    @Test
    void ishaRule_negativeInterval_exception() {
        assertThrows(IllegalArgumentException.class, () -> IshaRule.ofInterval(Duration.ofMinutes(-1)));
    }
}
