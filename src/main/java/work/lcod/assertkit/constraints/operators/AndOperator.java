package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.AndConstraint;
import work.lcod.assertkit.constraints.Constraint;

public class AndOperator extends BinaryOperator {
    public AndOperator() {
        super(2);
    }

    @Override
    protected Constraint applyOperator(Constraint left, Constraint right) {
        return new AndConstraint(left, right);
    }
}
