package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Reference identity with the expected object.
 */
public class SameAsConstraint extends AbstractConstraint {
    private final Object expected;

    public SameAsConstraint(Object expected) {
        super(expected);
        this.expected = expected;
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        return new ConstraintResult(this, actual, actual == expected);
    }

    @Override
    protected String describe() {
        return "same as " + format(expected);
    }
}
