package work.lcod.assertkit.comparers;

import java.util.Map;

final class MapEntriesComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    MapEntriesComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!(x instanceof Map.Entry<?, ?> xEntry) || !(y instanceof Map.Entry<?, ?> yEntry)) {
            return ComparisonOutcome.ABSTAIN;
        }
        var nested = state.push(x, y);
        // Keys compare exactly, the tolerance only applies to values.
        return ComparisonOutcome.of(
            comparer.areEqual(xEntry.getKey(), yEntry.getKey(), Tolerance.DEFAULT, nested)
                && comparer.areEqual(xEntry.getValue(), yEntry.getValue(), tolerance, nested));
    }
}
