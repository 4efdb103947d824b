package work.lcod.assertkit.config;

import java.util.Objects;
import work.lcod.assertkit.comparers.Tolerance;

/**
 * Process-wide defaults seeded into every root execution context.
 *
 * @param floatingPointTolerance tolerance used for floating point equality when a constraint specifies none
 * @param maxStringLength longest rendering of a single value in a failure message, {@code 0} for unlimited
 * @param reflectionFallback whether unknown types are compared field by field instead of with {@code equals}
 */
public record AssertSettings(Tolerance floatingPointTolerance, int maxStringLength, boolean reflectionFallback) {
    public static final int DEFAULT_MAX_STRING_LENGTH = 200;

    public AssertSettings {
        Objects.requireNonNull(floatingPointTolerance, "floatingPointTolerance");
        if (maxStringLength < 0) {
            throw new IllegalArgumentException("maxStringLength must not be negative");
        }
    }

    public static AssertSettings defaults() {
        return new AssertSettings(Tolerance.DEFAULT, DEFAULT_MAX_STRING_LENGTH, true);
    }

    public AssertSettings withFloatingPointTolerance(Tolerance tolerance) {
        return new AssertSettings(tolerance, maxStringLength, reflectionFallback);
    }
}
