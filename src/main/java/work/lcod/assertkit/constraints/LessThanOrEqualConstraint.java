package work.lcod.assertkit.constraints;

import work.lcod.assertkit.comparers.Tolerance;

/**
 * Succeeds when the actual value is at or below the upper bound of the tolerance window.
 */
public class LessThanOrEqualConstraint extends ComparisonConstraint {
    public LessThanOrEqualConstraint(Object expected) {
        super(expected, "less than or equal to");
    }

    @Override
    protected boolean matches(ComparisonAdapter adapter, Object actual, Tolerance.Range range) {
        return adapter.compare(actual, range.upperBound()) <= 0;
    }
}
