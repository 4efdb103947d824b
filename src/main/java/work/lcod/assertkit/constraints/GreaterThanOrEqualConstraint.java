package work.lcod.assertkit.constraints;

import work.lcod.assertkit.comparers.Tolerance;

/**
 * Succeeds when the actual value is at or above the lower bound of the tolerance window.
 */
public class GreaterThanOrEqualConstraint extends ComparisonConstraint {
    public GreaterThanOrEqualConstraint(Object expected) {
        super(expected, "greater than or equal to");
    }

    @Override
    protected boolean matches(ComparisonAdapter adapter, Object actual, Tolerance.Range range) {
        return adapter.compare(actual, range.lowerBound()) >= 0;
    }
}
