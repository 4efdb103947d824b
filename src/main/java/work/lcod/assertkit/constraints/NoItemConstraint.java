package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

public class NoItemConstraint extends PrefixConstraint {
    public NoItemConstraint(ResolvableConstraint itemConstraint) {
        super(itemConstraint, "no item");
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        for (Object item : Items.of(actual)) {
            if (baseConstraint.applyTo(item, context).isSuccess()) {
                return new ConstraintResult(this, actual, false);
            }
        }
        return new ConstraintResult(this, actual, true);
    }
}
