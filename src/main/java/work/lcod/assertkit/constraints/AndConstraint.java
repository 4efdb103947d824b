package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Succeeds when both operands succeed. The right operand is not evaluated once the left one failed.
 */
public class AndConstraint extends BinaryConstraint {
    public AndConstraint(ResolvableConstraint left, ResolvableConstraint right) {
        super(left, right);
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        var leftResult = left.applyTo(actual, context);
        if (!leftResult.isSuccess()) {
            return new BinaryConstraintResult(this, actual, false, leftResult, null, leftResult);
        }
        var rightResult = right.applyTo(actual, context);
        return new BinaryConstraintResult(this, actual, rightResult.isSuccess(), leftResult, rightResult,
            rightResult.isSuccess() ? null : rightResult);
    }

    @Override
    protected String describe() {
        return left.getDescription() + " and " + right.getDescription();
    }
}
