package work.lcod.assertkit.comparers;

import work.lcod.assertkit.shared.Tuple;

/**
 * Compares two {@link Tuple}s slot by slot after checking their arity.
 */
final class TupleComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    TupleComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!(x instanceof Tuple xt) || !(y instanceof Tuple yt)) {
            return ComparisonOutcome.ABSTAIN;
        }
        if (xt.size() != yt.size()) {
            return ComparisonOutcome.UNEQUAL;
        }
        var nested = state.push(x, y);
        for (int i = 0; i < xt.size(); i++) {
            if (!comparer.areEqual(xt.get(i), yt.get(i), tolerance, nested)) {
                return ComparisonOutcome.UNEQUAL;
            }
        }
        return ComparisonOutcome.EQUAL;
    }
}
