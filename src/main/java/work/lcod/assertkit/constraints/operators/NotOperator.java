package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.Constraint;
import work.lcod.assertkit.constraints.NotConstraint;

public class NotOperator extends PrefixOperator {
    @Override
    protected Constraint applyPrefix(Constraint constraint) {
        return new NotConstraint(constraint);
    }
}
