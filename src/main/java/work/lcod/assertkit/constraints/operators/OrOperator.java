package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.Constraint;
import work.lcod.assertkit.constraints.OrConstraint;

public class OrOperator extends BinaryOperator {
    public OrOperator() {
        super(3);
    }

    @Override
    protected Constraint applyOperator(Constraint left, Constraint right) {
        return new OrConstraint(left, right);
    }
}
