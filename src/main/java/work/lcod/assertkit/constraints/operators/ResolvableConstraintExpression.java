package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.Constraint;
import work.lcod.assertkit.constraints.ResolvableConstraint;

/**
 * An expression ending with a self-resolving operator: usable as a constraint, or continued.
 */
public class ResolvableConstraintExpression extends ConstraintExpression implements ResolvableConstraint {
    public ResolvableConstraintExpression(ConstraintBuilder builder) {
        super(builder);
    }

    public ConstraintExpression and() {
        return append(new AndOperator());
    }

    public ConstraintExpression or() {
        return append(new OrOperator());
    }

    @Override
    public Constraint resolve() {
        return builder.resolve();
    }
}
