package work.lcod.assertkit.constraints;

import java.util.Objects;

/**
 * A constraint that modifies how a single base constraint is applied.
 */
public abstract class PrefixConstraint extends AbstractConstraint {
    protected final Constraint baseConstraint;
    private final String descriptionPrefix;

    protected PrefixConstraint(ResolvableConstraint baseConstraint, String descriptionPrefix, Object... arguments) {
        super(arguments.length == 0 ? new Object[] {baseConstraint} : arguments);
        this.baseConstraint = Objects.requireNonNull(baseConstraint, "baseConstraint").resolve();
        this.descriptionPrefix = descriptionPrefix;
    }

    public Constraint baseConstraint() {
        return baseConstraint;
    }

    @Override
    protected String describe() {
        return descriptionPrefix + " " + baseConstraint.getDescription();
    }
}
