package at.sv.prayer.solar;

import lombok.EqualsAndHashCode;

import java.util.function.DoubleFunction;
import java.util.function.DoubleUnaryOperator;

/**
 * The outcome of solving for a solar angle or event time: either a finite value, or {@link #UNREACHABLE} if the sun
 * never reaches the requested altitude for the given latitude and declination (polar day or polar night).
 */
@EqualsAndHashCode
public final class Solution {

    public static final Solution UNREACHABLE = new Solution(0.0, false);

    private final double value;
    private final boolean reachable;

    private Solution(double value, boolean reachable) {
        this.value = value;
        this.reachable = reachable;
    }

    /**
     * @param value a finite value
     * @return the solution for the given value, or {@link #UNREACHABLE} if the value is NaN or infinite
     */
    public static Solution of(double value) {
        if (!Double.isFinite(value)) {
            return UNREACHABLE;
        }
        return new Solution(value, true);
    }

    public boolean isReachable() {
        return reachable;
    }

    /**
     * @throws IllegalStateException if this solution is unreachable
     */
    public double getValue() {
        if (!reachable) {
            throw new IllegalStateException("No value for an unreachable solution");
        }
        return value;
    }

    public double orElse(double other) {
        return reachable ? value : other;
    }

    public Solution map(DoubleUnaryOperator mapper) {
        if (!reachable) {
            return UNREACHABLE;
        }
        return of(mapper.applyAsDouble(value));
    }

    public Solution flatMap(DoubleFunction<Solution> mapper) {
        if (!reachable) {
            return UNREACHABLE;
        }
        return mapper.apply(value);
    }

    @Override
    public String toString() {
        return reachable ? String.valueOf(value) : "unreachable";
    }
}
