package work.lcod.assertkit.constraints;

import java.util.Objects;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Applies the base constraint to a named property of the actual value.
 */
public class PropertyConstraint extends PrefixConstraint {
    private final String name;

    public PropertyConstraint(String name, ResolvableConstraint baseConstraint) {
        super(baseConstraint, "property " + Objects.requireNonNull(name, "name"), name, baseConstraint);
        this.name = name;
    }

    public String name() {
        return name;
    }

    /**
     * @throws IllegalArgumentException when the actual value is {@code null} or has no such property
     */
    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        if (actual == null) {
            throw new IllegalArgumentException("Cannot read property " + name + " of null");
        }
        var access = PropertyAccess.find(actual.getClass(), name)
            .orElseThrow(() -> new IllegalArgumentException("Property " + name + " was not found on "
                + actual.getClass().getName()));
        var value = access.read(actual);
        var baseResult = baseConstraint.applyTo(value, context);
        return new ConstraintResult(this, baseResult.actualValue(), baseResult.isSuccess());
    }
}
