package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

public class NotConstraint extends PrefixConstraint {
    public NotConstraint(ResolvableConstraint baseConstraint) {
        super(baseConstraint, "not");
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        var baseResult = baseConstraint.applyTo(actual, context);
        return new ConstraintResult(this, baseResult.actualValue(), !baseResult.isSuccess());
    }
}
