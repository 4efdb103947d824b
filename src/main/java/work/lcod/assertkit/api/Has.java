package work.lcod.assertkit.api;

import work.lcod.assertkit.constraints.CollectionContainsConstraint;
import work.lcod.assertkit.constraints.operators.ConstraintExpression;
import work.lcod.assertkit.constraints.operators.ResolvableConstraintExpression;

/**
 * Constraints on members of the actual value, e.g. {@code Has.property("name").equalTo("x")}.
 */
public final class Has {
    private Has() {}

    public static ResolvableConstraintExpression property(String name) {
        return new ConstraintExpression().property(name);
    }

    public static ResolvableConstraintExpression annotation(Class<?> annotationType) {
        return new ConstraintExpression().annotation(annotationType);
    }

    public static ConstraintExpression all() {
        return new ConstraintExpression().all();
    }

    public static ConstraintExpression some() {
        return new ConstraintExpression().some();
    }

    public static ConstraintExpression none() {
        return new ConstraintExpression().none();
    }

    public static CollectionContainsConstraint member(Object expected) {
        return new CollectionContainsConstraint(expected);
    }
}
