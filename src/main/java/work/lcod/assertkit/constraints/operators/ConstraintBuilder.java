package work.lcod.assertkit.constraints.operators;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.NoSuchElementException;
import java.util.Objects;
import work.lcod.assertkit.constraints.Constraint;
import work.lcod.assertkit.constraints.ResolvableConstraint;

/**
 * Collects the operators and constraints of a fluent expression in the order they are written and
 * reduces them by precedence into a single constraint tree.
 * <p>
 * Appending an operator first reduces every stacked operator whose right precedence is lower than
 * the new operator's left precedence. {@link #resolve()} reduces whatever is left; the result is
 * cached so repeated resolution returns the same tree.
 */
public final class ConstraintBuilder implements ResolvableConstraint {
    private final Deque<ConstraintOperator> operators = new ArrayDeque<>();
    private final ConstraintStack constraints = new ConstraintStack();
    private Object lastPushed;
    private Constraint resolved;
    private boolean resolving;

    public void append(ConstraintOperator operator) {
        Objects.requireNonNull(operator, "operator");
        checkOpen();
        operator.setLeftContext(lastPushed);
        if (lastPushed instanceof ConstraintOperator previous) {
            previous.setRightContext(operator);
        }
        reduceOperatorStack(operator.leftPrecedence());
        operators.push(operator);
        lastPushed = operator;
    }

    public void append(Constraint constraint) {
        Objects.requireNonNull(constraint, "constraint");
        checkOpen();
        if (lastPushed instanceof ConstraintOperator previous) {
            previous.setRightContext(constraint);
        }
        constraints.push(constraint);
        lastPushed = constraint;
        constraint.setBuilder(this);
    }

    /**
     * Whether the expression written so far forms a complete constraint.
     */
    public boolean isResolvable() {
        return resolved != null || lastPushed instanceof Constraint || lastPushed instanceof SelfResolvingOperator;
    }

    /**
     * Whether a reduction is in progress, during {@link #resolve()} or while appending an operator.
     * Constraints owned by this builder resolve to themselves meanwhile.
     */
    public boolean isResolving() {
        return resolving;
    }

    /**
     * @throws IllegalStateException when the expression ends with an operator that needs an operand
     */
    @Override
    public Constraint resolve() {
        if (resolved != null) {
            return resolved;
        }
        if (!isResolvable()) {
            throw new IllegalStateException("A partial expression may not be resolved");
        }
        resolving = true;
        try {
            while (!operators.isEmpty()) {
                operators.pop().reduce(constraints);
            }
            var result = constraints.pop();
            if (!constraints.isEmpty()) {
                throw new IllegalStateException("Constraint expression left unused operands");
            }
            resolved = result;
            return result;
        } finally {
            resolving = false;
        }
    }

    private void reduceOperatorStack(int targetPrecedence) {
        resolving = true;
        try {
            while (!operators.isEmpty() && operators.peek().rightPrecedence() < targetPrecedence) {
                operators.pop().reduce(constraints);
            }
        } finally {
            resolving = false;
        }
    }

    private void checkOpen() {
        if (resolved != null) {
            throw new IllegalStateException("Cannot extend an expression that was already resolved");
        }
    }

    /**
     * Operand stack handed to operators during reduction.
     */
    public static final class ConstraintStack {
        private final Deque<Constraint> items = new ArrayDeque<>();

        public void push(Constraint constraint) {
            items.push(constraint);
        }

        /**
         * @throws IllegalStateException when an operator is missing an operand
         */
        public Constraint pop() {
            try {
                return items.pop();
            } catch (NoSuchElementException ex) {
                throw new IllegalStateException("Constraint expression is missing an operand", ex);
            }
        }

        public boolean isEmpty() {
            return items.isEmpty();
        }
    }
}
