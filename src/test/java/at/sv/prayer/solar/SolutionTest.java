package at.sv.prayer.solar;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertThrows;

class SolutionTest {

    @Test
    void of_nonFiniteValue_unreachable() {
        assertThat(Solution.of(Double.NaN)).isEqualTo(Solution.UNREACHABLE);
        assertThat(Solution.of(Double.POSITIVE_INFINITY).isReachable()).isFalse();
    }

    @Test
    void map_unreachable_staysUnreachable() {
        assertThat(Solution.UNREACHABLE.map(value -> value + 1)).isEqualTo(Solution.UNREACHABLE);
    }

    @Test
    void map_reachable_appliesFunction() {
        assertThat(Solution.of(1.5).map(value -> value * 2).getValue()).isEqualTo(3.0);
    }

    @Test
    void flatMap_canTurnIntoUnreachable() {
        assertThat(Solution.of(2).flatMap(value -> Solution.UNREACHABLE).isReachable()).isFalse();
    }

    @Test
    void getValue_unreachable_exception() {
        assertThrows(IllegalStateException.class, Solution.UNREACHABLE::getValue);
    }

    @Test
    void orElse_unreachable_returnsOther() {
        assertThat(Solution.UNREACHABLE.orElse(-1)).isEqualTo(-1.0);
        assertThat(Solution.of(4).orElse(-1)).isEqualTo(4.0);
    }
}
