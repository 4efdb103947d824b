package work.lcod.assertkit.constraints.operators;

/**
 * An operator in a fluent constraint expression. Operators are held on a stack by the
 * {@link ConstraintBuilder} and reduced against the constraint stack according to their precedence;
 * lower values bind tighter.
 */
public abstract class ConstraintOperator {
    protected int leftPrecedence;
    protected int rightPrecedence;
    private Object leftContext;
    private Object rightContext;

    protected ConstraintOperator(int leftPrecedence, int rightPrecedence) {
        this.leftPrecedence = leftPrecedence;
        this.rightPrecedence = rightPrecedence;
    }

    /**
     * Precedence used when this operator is about to be pushed.
     */
    public int leftPrecedence() {
        return leftPrecedence;
    }

    /**
     * Precedence used while this operator sits on the stack.
     */
    public int rightPrecedence() {
        return rightPrecedence;
    }

    /** The element appended just before this operator, or {@code null}. */
    public Object leftContext() {
        return leftContext;
    }

    void setLeftContext(Object leftContext) {
        this.leftContext = leftContext;
    }

    /** The element appended just after this operator, or {@code null} while none was. */
    public Object rightContext() {
        return rightContext;
    }

    void setRightContext(Object rightContext) {
        this.rightContext = rightContext;
    }

    /**
     * Pops the operands this operator needs and pushes the combined constraint.
     */
    public abstract void reduce(ConstraintBuilder.ConstraintStack stack);
}
