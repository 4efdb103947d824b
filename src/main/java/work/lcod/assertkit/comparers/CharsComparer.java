package work.lcod.assertkit.comparers;

final class CharsComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    CharsComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!(x instanceof Character xc) || !(y instanceof Character yc)) {
            return ComparisonOutcome.ABSTAIN;
        }
        if (!comparer.isIgnoreCase()) {
            return ComparisonOutcome.of(xc.charValue() == yc.charValue());
        }
        return ComparisonOutcome.of(Character.toLowerCase(xc) == Character.toLowerCase(yc)
            || Character.toUpperCase(xc) == Character.toUpperCase(yc));
    }
}
