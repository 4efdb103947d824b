package work.lcod.assertkit.comparers;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.temporal.Temporal;
import java.util.Objects;

/**
 * Immutable deviation window applied to the expected side of a comparison.
 */
public final class Tolerance {
    /** Used when the caller did not specify any tolerance. */
    public static final Tolerance DEFAULT = new Tolerance(0, ToleranceMode.UNSET);

    /** Explicit exact comparison. */
    public static final Tolerance EXACT = new Tolerance(0, ToleranceMode.NONE);

    private final Object amount;
    private final ToleranceMode mode;

    private Tolerance(Object amount, ToleranceMode mode) {
        this.amount = Objects.requireNonNull(amount, "amount");
        this.mode = Objects.requireNonNull(mode, "mode");
        checkNotNegative(amount);
    }

    public static Tolerance of(Number amount) {
        return new Tolerance(amount, ToleranceMode.LINEAR);
    }

    public static Tolerance of(Duration amount) {
        return new Tolerance(amount, ToleranceMode.DURATION);
    }

    public ToleranceMode mode() {
        return mode;
    }

    public Object amount() {
        return amount;
    }

    public boolean isUnsetOrDefault() {
        return mode == ToleranceMode.UNSET;
    }

    public boolean isExact() {
        return mode == ToleranceMode.UNSET || mode == ToleranceMode.NONE;
    }

    public Tolerance percent() {
        return new Tolerance(checkLinearAndNumeric(), ToleranceMode.PERCENT);
    }

    public Tolerance ulps() {
        return new Tolerance(checkLinearAndNumeric(), ToleranceMode.ULPS);
    }

    public Tolerance days() {
        return asDuration(86_400_000L);
    }

    public Tolerance hours() {
        return asDuration(3_600_000L);
    }

    public Tolerance minutes() {
        return asDuration(60_000L);
    }

    public Tolerance seconds() {
        return asDuration(1_000L);
    }

    public Tolerance millis() {
        return asDuration(1L);
    }

    /**
     * Derives the inclusive window around {@code expected}. Exact modes return the value itself as both bounds.
     *
     * @throws IllegalStateException when the mode cannot be applied to the value's type
     */
    public Range apply(Object expected) {
        checkNotNegative(amount);
        switch (mode) {
            case UNSET:
            case NONE:
            case ULPS:
                if (mode == ToleranceMode.ULPS && !Numerics.isFloatingPoint(expected)) {
                    throw new IllegalStateException("Ulps may only be specified for floating point arguments");
                }
                return new Range(expected, expected);
            case LINEAR:
                return linearRange(expected, (Number) amount);
            case PERCENT:
                return percentRange(expected);
            case DURATION:
                return durationRange(expected);
            default:
                throw new IllegalStateException("Unknown tolerance mode: " + mode);
        }
    }

    private Range linearRange(Object expected, Number delta) {
        if (!Numerics.isNumericType(expected)) {
            throw new IllegalStateException("Cannot apply a numeric tolerance to non-numeric type "
                + typeName(expected));
        }
        var value = (Number) expected;
        return new Range(Numerics.subtract(value, delta), Numerics.add(value, delta));
    }

    private Range percentRange(Object expected) {
        if (!Numerics.isNumericType(expected)) {
            throw new IllegalStateException("Cannot apply a percent tolerance to non-numeric type "
                + typeName(expected));
        }
        return linearRange(expected, Numerics.percentOf((Number) expected, (Number) amount));
    }

    private Range durationRange(Object expected) {
        var window = (Duration) amount;
        if (expected instanceof Duration duration) {
            return new Range(duration.minus(window), duration.plus(window));
        }
        if (expected instanceof Temporal temporal) {
            try {
                return new Range(temporal.minus(window), temporal.plus(window));
            } catch (DateTimeException ex) {
                throw new IllegalStateException("Cannot apply a time tolerance to " + typeName(expected), ex);
            }
        }
        throw new IllegalStateException("Cannot apply a time tolerance to type " + typeName(expected));
    }

    private Number checkLinearAndNumeric() {
        if (mode != ToleranceMode.LINEAR) {
            throw new IllegalStateException(mode == ToleranceMode.UNSET || mode == ToleranceMode.NONE
                ? "A tolerance amount must be specified before setting the mode"
                : "Tried to use multiple tolerance modes at the same time");
        }
        if (!(amount instanceof Number number)) {
            throw new IllegalStateException("A numeric tolerance is required");
        }
        return number;
    }

    private Tolerance asDuration(long millisPerUnit) {
        Number number = checkLinearAndNumeric();
        long millis = Math.round(number.doubleValue() * millisPerUnit);
        return new Tolerance(Duration.ofMillis(millis), ToleranceMode.DURATION);
    }

    private static void checkNotNegative(Object amount) {
        if (amount instanceof Number number && Numerics.isFloatingPoint(number)
            && (Double.isNaN(number.doubleValue()) || Double.isInfinite(number.doubleValue()))) {
            throw new IllegalStateException("Tolerance amount must be finite: " + number);
        }
        if (amount instanceof Number number && Numerics.compare(number, 0) < 0) {
            throw new IllegalStateException("Tolerance amount must not be negative: " + number);
        }
        if (amount instanceof Duration duration && duration.isNegative()) {
            throw new IllegalStateException("Tolerance amount must not be negative: " + duration);
        }
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getName();
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof Tolerance that) || mode != that.mode) {
            return false;
        }
        if (amount instanceof Number left && that.amount instanceof Number right) {
            return left.getClass() == right.getClass() && Numerics.compare(left, right) == 0;
        }
        return amount.equals(that.amount);
    }

    @Override
    public int hashCode() {
        Object key = amount instanceof Number number ? Numerics.toBigDecimal(number).stripTrailingZeros() : amount;
        return Objects.hash(mode, key);
    }

    @Override
    public String toString() {
        switch (mode) {
            case UNSET:
                return "default";
            case NONE:
                return "exact";
            case PERCENT:
                return amount + " Percent";
            case ULPS:
                return amount + " Ulps";
            default:
                return String.valueOf(amount);
        }
    }

    /**
     * Inclusive bounds derived from an expected value.
     */
    public record Range(Object lowerBound, Object upperBound) {}
}
