package work.lcod.assertkit.constraints;

import java.util.Objects;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Succeeds when the actual object, or the class it names, exposes a readable property.
 */
public class PropertyExistsConstraint extends AbstractConstraint {
    private final String name;

    public PropertyExistsConstraint(String name) {
        super(name);
        this.name = Objects.requireNonNull(name, "name");
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        if (actual == null) {
            throw new IllegalArgumentException("Cannot look up property " + name + " on null");
        }
        var type = actual instanceof Class<?> c ? c : actual.getClass();
        return new ConstraintResult(this, type, PropertyAccess.find(type, name).isPresent());
    }

    @Override
    protected String describe() {
        return "property " + name;
    }
}
