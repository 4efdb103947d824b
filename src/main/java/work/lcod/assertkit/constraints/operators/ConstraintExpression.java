package work.lcod.assertkit.constraints.operators;

import java.util.Objects;
import work.lcod.assertkit.constraints.CollectionContainsConstraint;
import work.lcod.assertkit.constraints.CollectionEquivalentConstraint;
import work.lcod.assertkit.constraints.ComparisonConstraint;
import work.lcod.assertkit.constraints.Constraint;
import work.lcod.assertkit.constraints.EmptyConstraint;
import work.lcod.assertkit.constraints.EndsWithConstraint;
import work.lcod.assertkit.constraints.EqualConstraint;
import work.lcod.assertkit.constraints.FalseConstraint;
import work.lcod.assertkit.constraints.GreaterThanConstraint;
import work.lcod.assertkit.constraints.GreaterThanOrEqualConstraint;
import work.lcod.assertkit.constraints.InstanceOfConstraint;
import work.lcod.assertkit.constraints.LessThanConstraint;
import work.lcod.assertkit.constraints.LessThanOrEqualConstraint;
import work.lcod.assertkit.constraints.NullConstraint;
import work.lcod.assertkit.constraints.PathConstraint;
import work.lcod.assertkit.constraints.RegexConstraint;
import work.lcod.assertkit.constraints.SameAsConstraint;
import work.lcod.assertkit.constraints.SamePathConstraint;
import work.lcod.assertkit.constraints.StartsWithConstraint;
import work.lcod.assertkit.constraints.StringConstraint;
import work.lcod.assertkit.constraints.SubPathConstraint;
import work.lcod.assertkit.constraints.SubstringConstraint;
import work.lcod.assertkit.constraints.TrueConstraint;

/**
 * A fluent expression under construction. Operators return the expression for chaining; leaf
 * methods return the appended constraint so its modifiers stay reachable.
 */
public class ConstraintExpression {
    protected final ConstraintBuilder builder;

    public ConstraintExpression() {
        this(new ConstraintBuilder());
    }

    public ConstraintExpression(ConstraintBuilder builder) {
        this.builder = Objects.requireNonNull(builder, "builder");
    }

    public ConstraintBuilder builder() {
        return builder;
    }

    public ConstraintExpression append(ConstraintOperator operator) {
        builder.append(operator);
        return this;
    }

    public ResolvableConstraintExpression append(SelfResolvingOperator operator) {
        builder.append(operator);
        return new ResolvableConstraintExpression(builder);
    }

    public <C extends Constraint> C append(C constraint) {
        builder.append(constraint);
        return constraint;
    }

    public ConstraintExpression not() {
        return append(new NotOperator());
    }

    public ConstraintExpression all() {
        return append(new AllOperator());
    }

    public ConstraintExpression some() {
        return append(new SomeOperator());
    }

    public ConstraintExpression none() {
        return append(new NoneOperator());
    }

    public ResolvableConstraintExpression property(String name) {
        return append(new PropertyOperator(name));
    }

    public ResolvableConstraintExpression annotation(Class<?> annotationType) {
        return append(new AnnotationOperator(annotationType));
    }

    public EqualConstraint equalTo(Object expected) {
        return append(new EqualConstraint(expected));
    }

    public SameAsConstraint sameAs(Object expected) {
        return append(new SameAsConstraint(expected));
    }

    public ComparisonConstraint greaterThan(Object expected) {
        return append(new GreaterThanConstraint(expected));
    }

    public ComparisonConstraint greaterThanOrEqualTo(Object expected) {
        return append(new GreaterThanOrEqualConstraint(expected));
    }

    public ComparisonConstraint lessThan(Object expected) {
        return append(new LessThanConstraint(expected));
    }

    public ComparisonConstraint lessThanOrEqualTo(Object expected) {
        return append(new LessThanOrEqualConstraint(expected));
    }

    public NullConstraint nullValue() {
        return append(new NullConstraint());
    }

    public TrueConstraint trueValue() {
        return append(new TrueConstraint());
    }

    public FalseConstraint falseValue() {
        return append(new FalseConstraint());
    }

    public EmptyConstraint empty() {
        return append(new EmptyConstraint());
    }

    public InstanceOfConstraint instanceOf(Class<?> type) {
        return append(new InstanceOfConstraint(type));
    }

    public StringConstraint startsWith(String expected) {
        return append(new StartsWithConstraint(expected));
    }

    public StringConstraint endsWith(String expected) {
        return append(new EndsWithConstraint(expected));
    }

    public StringConstraint containsSubstring(String expected) {
        return append(new SubstringConstraint(expected));
    }

    public StringConstraint matches(String pattern) {
        return append(new RegexConstraint(pattern));
    }

    public PathConstraint samePath(Object expected) {
        return append(new SamePathConstraint(expected));
    }

    public PathConstraint subPathOf(Object expected) {
        return append(new SubPathConstraint(expected));
    }

    public CollectionEquivalentConstraint equivalentTo(Object expected) {
        return append(new CollectionEquivalentConstraint(expected));
    }

    public CollectionContainsConstraint member(Object expected) {
        return append(new CollectionContainsConstraint(expected));
    }
}
