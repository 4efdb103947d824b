package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

public class FalseConstraint extends AbstractConstraint {
    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        return new ConstraintResult(this, actual, Boolean.FALSE.equals(actual));
    }

    @Override
    protected String describe() {
        return "False";
    }
}
