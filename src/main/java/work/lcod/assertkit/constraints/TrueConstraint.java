package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

public class TrueConstraint extends AbstractConstraint {
    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        return new ConstraintResult(this, actual, Boolean.TRUE.equals(actual));
    }

    @Override
    protected String describe() {
        return "True";
    }
}
