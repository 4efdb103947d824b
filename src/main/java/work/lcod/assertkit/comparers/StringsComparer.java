package work.lcod.assertkit.comparers;

final class StringsComparer implements ChainComparer {
    private final DeepEqualityComparer comparer;

    StringsComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!(x instanceof CharSequence xs) || !(y instanceof CharSequence ys)) {
            return ComparisonOutcome.ABSTAIN;
        }
        var left = xs.toString();
        var right = ys.toString();
        return ComparisonOutcome.of(comparer.isIgnoreCase() ? left.equalsIgnoreCase(right) : left.equals(right));
    }
}
