package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

public class NullConstraint extends AbstractConstraint {
    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        return new ConstraintResult(this, actual, actual == null);
    }

    @Override
    protected String describe() {
        return "null";
    }
}
