package work.lcod.assertkit.constraints;

/**
 * Result of an and/or combination. The failure detail is the branch whose actual value and
 * additional lines end up in the message.
 */
public class BinaryConstraintResult extends ConstraintResult {
    private final ConstraintResult leftResult;
    private final ConstraintResult rightResult;
    private final ConstraintResult failureDetail;

    public BinaryConstraintResult(BinaryConstraint constraint, Object actual, boolean isSuccess,
                                  ConstraintResult leftResult, ConstraintResult rightResult,
                                  ConstraintResult failureDetail) {
        super(constraint, actual, isSuccess);
        this.leftResult = leftResult;
        this.rightResult = rightResult;
        this.failureDetail = failureDetail;
    }

    public ConstraintResult leftResult() {
        return leftResult;
    }

    /**
     * {@code null} when the left branch decided the outcome on its own.
     */
    public ConstraintResult rightResult() {
        return rightResult;
    }

    public ConstraintResult failureDetail() {
        return failureDetail;
    }

    @Override
    public void writeActualValueTo(TextMessageWriter writer) {
        if (failureDetail == null) {
            super.writeActualValueTo(writer);
        } else {
            failureDetail.writeActualValueTo(writer);
        }
    }

    @Override
    public void writeAdditionalLinesTo(TextMessageWriter writer) {
        if (failureDetail != null) {
            failureDetail.writeAdditionalLinesTo(writer);
        }
    }
}
