package work.lcod.assertkit.constraints.operators;

import work.lcod.assertkit.constraints.Constraint;

/**
 * Operator combining the constraints on either side of it. When a collection operator follows,
 * precedence is raised so the collection operator keeps its loose right binding.
 */
public abstract class BinaryOperator extends ConstraintOperator {
    private static final int COLLECTION_BIAS = 10;

    protected BinaryOperator(int precedence) {
        super(precedence, precedence);
    }

    @Override
    public int leftPrecedence() {
        return rightContext() instanceof CollectionOperator ? leftPrecedence + COLLECTION_BIAS : leftPrecedence;
    }

    @Override
    public int rightPrecedence() {
        return rightContext() instanceof CollectionOperator ? rightPrecedence + COLLECTION_BIAS : rightPrecedence;
    }

    protected abstract Constraint applyOperator(Constraint left, Constraint right);

    @Override
    public void reduce(ConstraintBuilder.ConstraintStack stack) {
        var right = stack.pop();
        var left = stack.pop();
        stack.push(applyOperator(left, right));
    }
}
