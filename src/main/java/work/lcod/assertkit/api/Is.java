package work.lcod.assertkit.api;

import work.lcod.assertkit.constraints.CollectionEquivalentConstraint;
import work.lcod.assertkit.constraints.ComparisonConstraint;
import work.lcod.assertkit.constraints.EmptyConstraint;
import work.lcod.assertkit.constraints.EqualConstraint;
import work.lcod.assertkit.constraints.FalseConstraint;
import work.lcod.assertkit.constraints.GreaterThanConstraint;
import work.lcod.assertkit.constraints.GreaterThanOrEqualConstraint;
import work.lcod.assertkit.constraints.InstanceOfConstraint;
import work.lcod.assertkit.constraints.LessThanConstraint;
import work.lcod.assertkit.constraints.LessThanOrEqualConstraint;
import work.lcod.assertkit.constraints.NullConstraint;
import work.lcod.assertkit.constraints.PathConstraint;
import work.lcod.assertkit.constraints.SameAsConstraint;
import work.lcod.assertkit.constraints.SamePathConstraint;
import work.lcod.assertkit.constraints.SubPathConstraint;
import work.lcod.assertkit.constraints.TrueConstraint;
import work.lcod.assertkit.constraints.operators.ConstraintExpression;

/**
 * Constraints on the actual value itself, e.g. {@code Is.equalTo(5).within(1)} or {@code Is.not().nullValue()}.
 */
public final class Is {
    private Is() {}

    public static ConstraintExpression not() {
        return new ConstraintExpression().not();
    }

    public static ConstraintExpression all() {
        return new ConstraintExpression().all();
    }

    public static EqualConstraint equalTo(Object expected) {
        return new EqualConstraint(expected);
    }

    public static SameAsConstraint sameAs(Object expected) {
        return new SameAsConstraint(expected);
    }

    public static ComparisonConstraint greaterThan(Object expected) {
        return new GreaterThanConstraint(expected);
    }

    public static ComparisonConstraint greaterThanOrEqualTo(Object expected) {
        return new GreaterThanOrEqualConstraint(expected);
    }

    public static ComparisonConstraint lessThan(Object expected) {
        return new LessThanConstraint(expected);
    }

    public static ComparisonConstraint lessThanOrEqualTo(Object expected) {
        return new LessThanOrEqualConstraint(expected);
    }

    public static NullConstraint nullValue() {
        return new NullConstraint();
    }

    public static TrueConstraint trueValue() {
        return new TrueConstraint();
    }

    public static FalseConstraint falseValue() {
        return new FalseConstraint();
    }

    public static EmptyConstraint empty() {
        return new EmptyConstraint();
    }

    public static InstanceOfConstraint instanceOf(Class<?> type) {
        return new InstanceOfConstraint(type);
    }

    public static CollectionEquivalentConstraint equivalentTo(Object expected) {
        return new CollectionEquivalentConstraint(expected);
    }

    public static PathConstraint samePath(Object expected) {
        return new SamePathConstraint(expected);
    }

    public static PathConstraint subPathOf(Object expected) {
        return new SubPathConstraint(expected);
    }
}
