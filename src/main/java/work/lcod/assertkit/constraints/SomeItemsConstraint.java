package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

public class SomeItemsConstraint extends PrefixConstraint {
    public SomeItemsConstraint(ResolvableConstraint itemConstraint) {
        super(itemConstraint, "some item");
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        for (Object item : Items.of(actual)) {
            if (baseConstraint.applyTo(item, context).isSuccess()) {
                return new ConstraintResult(this, actual, true);
            }
        }
        return new ConstraintResult(this, actual, false);
    }
}
