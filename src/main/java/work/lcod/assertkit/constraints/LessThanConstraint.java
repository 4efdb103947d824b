package work.lcod.assertkit.constraints;

import work.lcod.assertkit.comparers.Tolerance;

/**
 * Succeeds when the actual value is below the upper bound of the tolerance window.
 */
public class LessThanConstraint extends ComparisonConstraint {
    public LessThanConstraint(Object expected) {
        super(expected, "less than");
    }

    @Override
    protected boolean matches(ComparisonAdapter adapter, Object actual, Tolerance.Range range) {
        return adapter.compare(actual, range.upperBound()) < 0;
    }
}
