package work.lcod.assertkit.comparers;

import java.lang.reflect.Array;

/**
 * Compares two arrays element by element, primitive component types included.
 */
final class ArraysComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    ArraysComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!x.getClass().isArray() || !y.getClass().isArray()) {
            return ComparisonOutcome.ABSTAIN;
        }
        if (comparer.isIgnoreOrder()) {
            return ComparisonOutcome.of(Sequences.compareUnordered(comparer, x, y, tolerance, state));
        }
        if (Array.getLength(x) != Array.getLength(y) && !state.isTopLevel()) {
            return ComparisonOutcome.UNEQUAL;
        }
        return ComparisonOutcome.of(Sequences.compareOrdered(comparer, x, y, tolerance, state));
    }
}
