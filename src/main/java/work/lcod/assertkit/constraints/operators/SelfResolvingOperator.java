package work.lcod.assertkit.constraints.operators;

/**
 * Operator that forms a complete constraint on its own when nothing, or only a binary operator, follows it.
 */
public abstract class SelfResolvingOperator extends ConstraintOperator {
    protected SelfResolvingOperator() {
        super(1, 1);
    }

    /**
     * Whether no constraint operand follows this operator.
     */
    protected boolean standsAlone() {
        return rightContext() == null || rightContext() instanceof BinaryOperator;
    }
}
