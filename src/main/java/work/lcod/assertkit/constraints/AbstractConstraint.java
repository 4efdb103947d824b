package work.lcod.assertkit.constraints;

import java.util.Arrays;
import java.util.Objects;
import java.util.StringJoiner;
import work.lcod.assertkit.constraints.operators.AndOperator;
import work.lcod.assertkit.constraints.operators.BinaryOperator;
import work.lcod.assertkit.constraints.operators.ConstraintBuilder;
import work.lcod.assertkit.constraints.operators.ConstraintExpression;
import work.lcod.assertkit.constraints.operators.OrOperator;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Base class for constraints: arguments, lazily computed description, and fluent continuation.
 */
public abstract class AbstractConstraint implements Constraint {
    private final Object[] arguments;
    private volatile String description;
    private ConstraintBuilder builder;

    protected AbstractConstraint(Object... arguments) {
        this.arguments = arguments == null ? new Object[0] : arguments.clone();
    }

    /**
     * Computes the description. Called at most once per instance unless invalidated by a modifier.
     */
    protected abstract String describe();

    @Override
    public String getDescription() {
        var cached = description;
        if (cached == null) {
            cached = describe();
            description = cached;
        }
        return cached;
    }

    /**
     * Drops the cached description after a modifier changed what the constraint tests.
     */
    protected void invalidateDescription() {
        description = null;
    }

    @Override
    public String getDisplayName() {
        var name = getClass().getSimpleName();
        return name.endsWith("Constraint") && name.length() > "Constraint".length()
            ? name.substring(0, name.length() - "Constraint".length())
            : name;
    }

    @Override
    public Object[] getArguments() {
        return arguments.clone();
    }

    @Override
    public ConstraintBuilder getBuilder() {
        return builder;
    }

    @Override
    public void setBuilder(ConstraintBuilder builder) {
        this.builder = builder;
    }

    /**
     * A standalone constraint resolves to itself; one that ends a fluent expression resolves the whole
     * expression. While its builder is reducing, the constraint stands for itself.
     */
    @Override
    public Constraint resolve() {
        return builder == null || builder.isResolving() ? this : builder.resolve();
    }

    public ConstraintExpression and() {
        return continueWith(new AndOperator());
    }

    public ConstraintExpression or() {
        return continueWith(new OrOperator());
    }

    private ConstraintExpression continueWith(BinaryOperator operator) {
        var current = builder;
        if (current == null) {
            current = new ConstraintBuilder();
            current.append(this);
        }
        current.append(operator);
        return new ConstraintExpression(current);
    }

    /**
     * Formats {@code value} with the formatter of the current execution context.
     */
    protected static String format(Object value) {
        return TestExecutionContext.current().currentValueFormatter().format(value);
    }

    protected static <T> T requireType(Object actual, Class<T> type, String what) {
        if (!type.isInstance(actual)) {
            throw new IllegalArgumentException("The actual value must be " + what + " but was "
                + (actual == null ? "null" : actual.getClass().getName()));
        }
        return type.cast(actual);
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(" ", "<", ">");
        joiner.add(Character.toLowerCase(getDisplayName().charAt(0)) + getDisplayName().substring(1));
        Arrays.stream(arguments).map(AbstractConstraint::displayArgument).forEach(joiner::add);
        return joiner.toString();
    }

    private static String displayArgument(Object argument) {
        if (argument instanceof String text) {
            return "\"" + text + "\"";
        }
        return Objects.toString(argument);
    }
}
