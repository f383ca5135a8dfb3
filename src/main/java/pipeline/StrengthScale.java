package pipeline;

import java.util.Objects;

/**
 * How a pipeline step derives its own strength from the user strength: either
 * integer division ({@code s/4}) or a coefficient truncated toward zero
 * ({@code 0.8s}).
 */
public final class StrengthScale {

    private final int divisor;
    private final double factor;

    private StrengthScale(int divisor, double factor) {
        this.divisor = divisor;
        this.factor = factor;
    }

    public static StrengthScale full() {
        return divide(1);
    }

    public static StrengthScale divide(int divisor) {
        if (divisor <= 0)
            throw new IllegalArgumentException("divisor must be positive: " + divisor);
        return new StrengthScale(divisor, 0);
    }

    public static StrengthScale times(double factor) {
        if (!(factor >= 0))
            throw new IllegalArgumentException("factor must be >= 0: " + factor);
        return new StrengthScale(0, factor);
    }

    public int apply(int strength) {
        return divisor > 0 ? strength / divisor : (int) (strength * factor);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o)
            return true;
        if (!(o instanceof StrengthScale))
            return false;
        StrengthScale other = (StrengthScale) o;
        return divisor == other.divisor && Double.compare(factor, other.factor) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(divisor, factor);
    }

    @Override
    public String toString() {
        if (divisor == 1)
            return "s";
        return divisor > 0 ? "s/" + divisor : factor + "s";
    }
}
