package work.lcod.assertkit.comparers;

import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.chrono.ChronoZonedDateTime;
import java.time.temporal.Temporal;

/**
 * Compares durations and same-typed temporal values, optionally within a time tolerance.
 * Zoned and offset values are compared as instants.
 */
final class TemporalsComparer implements ChainComparer {
    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (x instanceof Duration dx && y instanceof Duration dy) {
            if (tolerance.isExact()) {
                return ComparisonOutcome.of(dx.equals(dy));
            }
            var range = tolerance.apply(dy);
            return ComparisonOutcome.of(dx.compareTo((Duration) range.lowerBound()) >= 0
                && dx.compareTo((Duration) range.upperBound()) <= 0);
        }
        if (!(x instanceof Temporal tx) || !(y instanceof Temporal ty) || !(x instanceof Comparable<?>)) {
            return ComparisonOutcome.ABSTAIN;
        }
        if (!comparable(tx, ty)) {
            return ComparisonOutcome.ABSTAIN;
        }
        if (tolerance.isExact()) {
            return ComparisonOutcome.of(compare(tx, ty) == 0);
        }
        var range = tolerance.apply(ty);
        return ComparisonOutcome.of(compare(tx, (Temporal) range.lowerBound()) >= 0
            && compare(tx, (Temporal) range.upperBound()) <= 0);
    }

    private static boolean comparable(Temporal x, Temporal y) {
        return x.getClass() == y.getClass() || (toInstant(x) != null && toInstant(y) != null);
    }

    @SuppressWarnings({"unchecked", "rawtypes"})
    private static int compare(Temporal left, Temporal right) {
        var leftInstant = toInstant(left);
        var rightInstant = toInstant(right);
        if (leftInstant != null && rightInstant != null) {
            return leftInstant.compareTo(rightInstant);
        }
        return ((Comparable) left).compareTo(right);
    }

    private static Instant toInstant(Temporal value) {
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        if (value instanceof ChronoZonedDateTime<?> zoned) {
            return zoned.toInstant();
        }
        return null;
    }
}
