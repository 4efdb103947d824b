package work.lcod.assertkit.comparers;

import java.util.Map;

/**
 * Compares maps by size, key presence and recursively compared values.
 */
final class MapsComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    MapsComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!(x instanceof Map<?, ?> xMap) || !(y instanceof Map<?, ?> yMap)) {
            return ComparisonOutcome.ABSTAIN;
        }
        if (xMap.size() != yMap.size()) {
            return ComparisonOutcome.UNEQUAL;
        }
        var nested = state.push(x, y);
        for (Map.Entry<?, ?> entry : xMap.entrySet()) {
            if (!yMap.containsKey(entry.getKey())) {
                return ComparisonOutcome.UNEQUAL;
            }
            if (!comparer.areEqual(entry.getValue(), yMap.get(entry.getKey()), tolerance, nested)) {
                return ComparisonOutcome.UNEQUAL;
            }
        }
        return ComparisonOutcome.EQUAL;
    }
}
