package work.lcod.assertkit.constraints;

import work.lcod.assertkit.runtime.TestExecutionContext;

public class AllItemsConstraint extends PrefixConstraint {
    public AllItemsConstraint(ResolvableConstraint itemConstraint) {
        super(itemConstraint, "all items");
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        for (Object item : Items.of(actual)) {
            if (!baseConstraint.applyTo(item, context).isSuccess()) {
                return new ConstraintResult(this, actual, false);
            }
        }
        return new ConstraintResult(this, actual, true);
    }
}
