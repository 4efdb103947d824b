package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.Constraint;

/**
 * Operator wrapping the single constraint that follows it.
 */
public abstract class PrefixOperator extends ConstraintOperator {
    protected PrefixOperator() {
        this(1, 1);
    }

    protected PrefixOperator(int leftPrecedence, int rightPrecedence) {
        super(leftPrecedence, rightPrecedence);
    }

    protected abstract Constraint applyPrefix(Constraint constraint);

    @Override
    public void reduce(ConstraintBuilder.ConstraintStack stack) {
        stack.push(applyPrefix(stack.pop()));
    }
}
