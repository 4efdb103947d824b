package work.lcod.assertkit.constraints;

import java.util.Objects;

/**
 * Outcome of applying a constraint to an actual value.
 */
public class ConstraintResult {
    private final Constraint constraint;
    private final Object actualValue;
    private final ConstraintStatus status;

    public ConstraintResult(Constraint constraint, Object actualValue, ConstraintStatus status) {
        this.constraint = Objects.requireNonNull(constraint, "constraint");
        this.actualValue = actualValue;
        this.status = Objects.requireNonNull(status, "status");
    }

    public ConstraintResult(Constraint constraint, Object actualValue, boolean isSuccess) {
        this(constraint, actualValue, isSuccess ? ConstraintStatus.SUCCESS : ConstraintStatus.FAILURE);
    }

    public boolean isSuccess() {
        return status == ConstraintStatus.SUCCESS;
    }

    public ConstraintStatus status() {
        return status;
    }

    public Object actualValue() {
        return actualValue;
    }

    public Constraint constraint() {
        return constraint;
    }

    public String getName() {
        return constraint.getDisplayName();
    }

    public String getDescription() {
        return constraint.getDescription();
    }

    /**
     * Writes the standard expected/actual block followed by any additional lines.
     */
    public void writeMessageTo(TextMessageWriter writer) {
        writer.displayDifferences(this);
    }

    public void writeActualValueTo(TextMessageWriter writer) {
        writer.writeActualValue(actualValue);
    }

    public void writeAdditionalLinesTo(TextMessageWriter writer) {
        // nothing beyond the expected/actual lines by default
    }
}
