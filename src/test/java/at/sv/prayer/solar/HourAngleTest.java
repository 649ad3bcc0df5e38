package at.sv.prayer.solar;

import org.junit.jupiter.api.Test;

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.closeTo;
import static org.hamcrest.core.Is.is;

class HourAngleTest {

    private static final double EPSILON = 1e-9;

    @Test
    void equator_equinox_horizon_isQuarterTurn() {
        Solution hourAngle = HourAngle.of(0, 0, 0);

        assertThat(hourAngle.isReachable(), is(true));
        assertThat(hourAngle.getValue(), closeTo(90.0, EPSILON));
    }

    @Test
    void equator_equinox_twilightBelowHorizon_addsDepression() {
        assertThat(HourAngle.of(0, 0, -18).getValue(), closeTo(108.0, EPSILON));
    }

    @Test
    void polarDay_horizonNeverReached_unreachable() {
        assertThat(HourAngle.of(80, 23.44, -0.833), is(Solution.UNREACHABLE));
    }

    @Test
    void polarNight_horizonNeverReached_unreachable() {
        assertThat(HourAngle.of(80, -23.44, -0.833), is(Solution.UNREACHABLE));
    }

    @Test
    void pole_noRatio_unreachable() {
        assertThat(HourAngle.of(90, 10, -18).isReachable(), is(false));
    }

    @Test
    void clamped_polarDay_returnsMidnight() {
        assertThat(HourAngle.clamped(80, 23.44, -0.833), closeTo(180.0, EPSILON));
    }

    @Test
    void clamped_polarNight_returnsNoon() {
        assertThat(HourAngle.clamped(80, -23.44, -0.833), closeTo(0.0, EPSILON));
    }

    @Test
    void clamped_reachable_sameAsSolved() {
        assertThat(HourAngle.clamped(48.2, 10, -0.833), closeTo(HourAngle.of(48.2, 10, -0.833).getValue(), EPSILON));
    }
}
