package work.lcod.assertkit.constraints;

import work.lcod.assertkit.constraints.operators.ConstraintBuilder;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * A composable predicate with a human readable description, evaluated against one actual value.
 */
public interface Constraint extends ResolvableConstraint {
    String getDisplayName();

    /**
     * Description of what this constraint tests, computed once and cached.
     */
    String getDescription();

    Object[] getArguments();

    ConstraintBuilder getBuilder();

    void setBuilder(ConstraintBuilder builder);

    /**
     * Evaluates against {@code actual} using the settings of {@code context}. Ordinary mismatches never throw.
     */
    ConstraintResult applyTo(Object actual, TestExecutionContext context);

    default ConstraintResult applyTo(Object actual) {
        return applyTo(actual, TestExecutionContext.current());
    }
}
