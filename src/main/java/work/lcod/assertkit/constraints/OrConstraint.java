package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Succeeds when either operand succeeds. The right operand is not evaluated once the left one succeeded.
 * On failure the left branch supplies the reported detail.
 */
public class OrConstraint extends BinaryConstraint {
    public OrConstraint(ResolvableConstraint left, ResolvableConstraint right) {
        super(left, right);
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        var leftResult = left.applyTo(actual, context);
        if (leftResult.isSuccess()) {
            return new BinaryConstraintResult(this, actual, true, leftResult, null, null);
        }
        var rightResult = right.applyTo(actual, context);
        return new BinaryConstraintResult(this, actual, rightResult.isSuccess(), leftResult, rightResult,
            rightResult.isSuccess() ? null : leftResult);
    }

    @Override
    protected String describe() {
        return left.getDescription() + " or " + right.getDescription();
    }
}
