package work.lcod.assertkit.comparers;

/**
 * Numeric equality, honoring the tolerance derived from the expected value.
 */
final class NumericsComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    NumericsComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!Numerics.isNumericType(x) || !Numerics.isNumericType(y)) {
            return ComparisonOutcome.ABSTAIN;
        }
        var effective = tolerance;
        if (effective.isUnsetOrDefault() && (Numerics.isFloatingPoint(x) || Numerics.isFloatingPoint(y))) {
            effective = comparer.defaultFloatingPointTolerance();
        }
        return ComparisonOutcome.of(Numerics.areEqual((Number) x, (Number) y, effective));
    }
}
