package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.SomeItemsConstraint;
import work.lcod.assertkit.constraints.Constraint;

public class SomeOperator extends CollectionOperator {
    @Override
    protected Constraint applyPrefix(Constraint constraint) {
        return new SomeItemsConstraint(constraint);
    }
}
