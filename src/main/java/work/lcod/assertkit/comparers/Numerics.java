package work.lcod.assertkit.comparers;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.math.MathContext;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Arithmetic and comparison helpers for mixed boxed numeric types.
 */
public final class Numerics {
    private static final BigDecimal HUNDRED = BigDecimal.valueOf(100);

    private Numerics() {}

    public static boolean isNumericType(Object value) {
        return isFloatingPoint(value) || isFixedPoint(value);
    }

    public static boolean isFloatingPoint(Object value) {
        return value instanceof Double || value instanceof Float;
    }

    public static boolean isFixedPoint(Object value) {
        return value instanceof Integer
            || value instanceof Long
            || value instanceof Short
            || value instanceof Byte
            || value instanceof BigInteger
            || value instanceof BigDecimal
            || value instanceof AtomicInteger
            || value instanceof AtomicLong;
    }

    /**
     * Tests {@code actual} against the window the tolerance derives from {@code expected}.
     */
    public static boolean areEqual(Number actual, Number expected, Tolerance tolerance) {
        if (isFloatingPoint(actual) || isFloatingPoint(expected)) {
            double a = actual.doubleValue();
            double e = expected.doubleValue();
            if (Double.isNaN(a) && Double.isNaN(e)) {
                return true;
            }
            if (Double.isNaN(a) || Double.isNaN(e) || Double.isInfinite(a) || Double.isInfinite(e)) {
                return a == e;
            }
            if (tolerance.mode() == ToleranceMode.ULPS) {
                long maxUlps = ((Number) tolerance.amount()).longValue();
                if (actual instanceof Float && expected instanceof Float) {
                    return areAlmostEqualUlps(actual.floatValue(), expected.floatValue(), maxUlps);
                }
                return areAlmostEqualUlps(a, e, maxUlps);
            }
        } else if (tolerance.mode() == ToleranceMode.ULPS) {
            throw new IllegalStateException("Ulps may only be specified for floating point arguments");
        }
        if (tolerance.mode() == ToleranceMode.DURATION) {
            throw new IllegalStateException("Cannot compare numbers using a time tolerance");
        }
        if (tolerance.isExact()) {
            return compare(actual, expected) == 0;
        }
        var range = tolerance.apply(expected);
        return compare(actual, (Number) range.lowerBound()) >= 0
            && compare(actual, (Number) range.upperBound()) <= 0;
    }

    public static int compare(Number left, Number right) {
        if (isFloatingPoint(left) || isFloatingPoint(right)) {
            double l = left.doubleValue();
            double r = right.doubleValue();
            if (Double.isNaN(l) || Double.isNaN(r) || Double.isInfinite(l) || Double.isInfinite(r)) {
                return Double.compare(l, r);
            }
        } else if (isSmallIntegral(left) && isSmallIntegral(right)) {
            return Long.compare(left.longValue(), right.longValue());
        }
        return toBigDecimal(left).compareTo(toBigDecimal(right));
    }

    public static Number add(Number left, Number right) {
        if (isFloatingPoint(left) || isFloatingPoint(right)) {
            return left.doubleValue() + right.doubleValue();
        }
        if (isSmallIntegral(left) && isSmallIntegral(right)) {
            try {
                return Math.addExact(left.longValue(), right.longValue());
            } catch (ArithmeticException overflow) {
                return toBigDecimal(left).add(toBigDecimal(right));
            }
        }
        return toBigDecimal(left).add(toBigDecimal(right));
    }

    public static Number subtract(Number left, Number right) {
        if (isFloatingPoint(left) || isFloatingPoint(right)) {
            return left.doubleValue() - right.doubleValue();
        }
        if (isSmallIntegral(left) && isSmallIntegral(right)) {
            try {
                return Math.subtractExact(left.longValue(), right.longValue());
            } catch (ArithmeticException overflow) {
                return toBigDecimal(left).subtract(toBigDecimal(right));
            }
        }
        return toBigDecimal(left).subtract(toBigDecimal(right));
    }

    /**
     * Returns {@code percent}% of the magnitude of {@code value}.
     */
    public static Number percentOf(Number value, Number percent) {
        if (isFloatingPoint(value) || isFloatingPoint(percent)) {
            return Math.abs(value.doubleValue()) * percent.doubleValue() / 100.0;
        }
        return toBigDecimal(value).abs()
            .multiply(toBigDecimal(percent))
            .divide(HUNDRED, MathContext.DECIMAL128);
    }

    public static BigDecimal toBigDecimal(Number value) {
        if (value instanceof BigDecimal decimal) {
            return decimal;
        }
        if (value instanceof BigInteger integer) {
            return new BigDecimal(integer);
        }
        if (isFloatingPoint(value)) {
            return new BigDecimal(value.doubleValue());
        }
        return BigDecimal.valueOf(value.longValue());
    }

    static boolean areAlmostEqualUlps(double left, double right, long maxUlps) {
        long l = Double.doubleToLongBits(left);
        long r = Double.doubleToLongBits(right);
        if (l < 0) {
            l = Long.MIN_VALUE - l;
        }
        if (r < 0) {
            r = Long.MIN_VALUE - r;
        }
        try {
            return Math.abs(Math.subtractExact(l, r)) <= maxUlps;
        } catch (ArithmeticException overflow) {
            return false;
        }
    }

    static boolean areAlmostEqualUlps(float left, float right, long maxUlps) {
        long l = Float.floatToIntBits(left);
        long r = Float.floatToIntBits(right);
        if (l < 0) {
            l = Integer.MIN_VALUE - l;
        }
        if (r < 0) {
            r = Integer.MIN_VALUE - r;
        }
        return Math.abs(l - r) <= maxUlps;
    }

    private static boolean isSmallIntegral(Number value) {
        return value instanceof Integer
            || value instanceof Long
            || value instanceof Short
            || value instanceof Byte
            || value instanceof AtomicInteger
            || value instanceof AtomicLong;
    }
}
