package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.NoItemConstraint;
import work.lcod.assertkit.constraints.Constraint;

public class NoneOperator extends CollectionOperator {
    @Override
    protected Constraint applyPrefix(Constraint constraint) {
        return new NoItemConstraint(constraint);
    }
}
