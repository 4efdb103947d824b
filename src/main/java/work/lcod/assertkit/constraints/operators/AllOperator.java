package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.AllItemsConstraint;
import work.lcod.assertkit.constraints.Constraint;

public class AllOperator extends CollectionOperator {
    @Override
    protected Constraint applyPrefix(Constraint constraint) {
        return new AllItemsConstraint(constraint);
    }
}
