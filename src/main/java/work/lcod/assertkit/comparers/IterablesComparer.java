package work.lcod.assertkit.comparers;

import java.util.Collection;

/**
 * Compares iterables, or an iterable against an array, in enumeration order unless order is ignored.
 */
final class IterablesComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    IterablesComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!Sequences.isSequence(x) || !Sequences.isSequence(y)) {
            return ComparisonOutcome.ABSTAIN;
        }
        if (comparer.isIgnoreOrder()) {
            return ComparisonOutcome.of(Sequences.compareUnordered(comparer, x, y, tolerance, state));
        }
        if (x instanceof Collection<?> xs && y instanceof Collection<?> ys
            && xs.size() != ys.size() && !state.isTopLevel()) {
            return ComparisonOutcome.UNEQUAL;
        }
        return ComparisonOutcome.of(Sequences.compareOrdered(comparer, x, y, tolerance, state));
    }
}
