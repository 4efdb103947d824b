package work.lcod.assertkit.constraints;

/**
 * Anything that can be turned into a finished {@link Constraint}: a constraint or a fluent expression.
 */
@FunctionalInterface
public interface ResolvableConstraint {
    Constraint resolve();
}
