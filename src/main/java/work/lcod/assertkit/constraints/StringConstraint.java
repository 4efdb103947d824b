package work.lcod.assertkit.constraints;

import java.util.Objects;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Base for constraints that test a string against an expected fragment or pattern.
 */
public abstract class StringConstraint extends AbstractConstraint {
    protected final String expected;
    private final String descriptionText;
    protected boolean caseInsensitive;

    protected StringConstraint(String expected, String descriptionText) {
        super(expected);
        this.expected = Objects.requireNonNull(expected, "expected");
        this.descriptionText = descriptionText;
    }

    public StringConstraint ignoreCase() {
        this.caseInsensitive = true;
        invalidateDescription();
        return this;
    }

    protected abstract boolean matches(String actual);

    /**
     * A {@code null} actual fails; any other non-string value is a usage error.
     */
    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        if (actual == null) {
            return new ConstraintResult(this, null, false);
        }
        var text = requireType(actual, CharSequence.class, "a string");
        return new ConstraintResult(this, actual, matches(text.toString()));
    }

    @Override
    protected String describe() {
        var text = descriptionText + " " + format(expected);
        return caseInsensitive ? text + ", ignoring case" : text;
    }
}
