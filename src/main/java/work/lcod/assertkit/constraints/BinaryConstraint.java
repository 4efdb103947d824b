package work.lcod.assertkit.constraints;

import java.util.Objects;

/**
 * Combines two constraints. Both operands are resolved at construction.
 */
public abstract class BinaryConstraint extends AbstractConstraint {
    protected final Constraint left;
    protected final Constraint right;

    protected BinaryConstraint(ResolvableConstraint left, ResolvableConstraint right) {
        super(left, right);
        this.left = Objects.requireNonNull(left, "left").resolve();
        this.right = Objects.requireNonNull(right, "right").resolve();
    }

    public Constraint left() {
        return left;
    }

    public Constraint right() {
        return right;
    }
}
