package work.lcod.assertkit.constraints;

import java.util.Objects;
import work.lcod.assertkit.runtime.TestExecutionContext;

public class InstanceOfConstraint extends AbstractConstraint {
    private final Class<?> expectedType;

    public InstanceOfConstraint(Class<?> expectedType) {
        super(expectedType);
        this.expectedType = Objects.requireNonNull(expectedType, "expectedType");
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        return new ConstraintResult(this, actual, expectedType.isInstance(actual)) {
            @Override
            public void writeActualValueTo(TextMessageWriter writer) {
                writer.write(actual == null ? "null" : "<" + actual.getClass().getName() + ">");
            }
        };
    }

    @Override
    protected String describe() {
        return "instance of " + format(expectedType);
    }
}
