package work.lcod.assertkit.constraints;

import work.lcod.assertkit.comparers.Tolerance;

/**
 * Succeeds when the actual value is above the lower bound of the tolerance window.
 */
public class GreaterThanConstraint extends ComparisonConstraint {
    public GreaterThanConstraint(Object expected) {
        super(expected, "greater than");
    }

    @Override
    protected boolean matches(ComparisonAdapter adapter, Object actual, Tolerance.Range range) {
        return adapter.compare(actual, range.lowerBound()) > 0;
    }
}
