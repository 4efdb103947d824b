package work.lcod.assertkit.flow;

/**
 * Status of a single recorded assertion.
 */
public enum AssertionStatus {
    PASSED,
    WARNING,
    INCONCLUSIVE,
    IGNORED,
    FAILED,
    ERROR;

    public boolean isFailure() {
        return this == FAILED || this == ERROR;
    }

    public ResultState toResultState() {
        switch (this) {
            case PASSED:
                return ResultState.SUCCESS;
            case WARNING:
                return ResultState.WARNING;
            case INCONCLUSIVE:
                return ResultState.INCONCLUSIVE;
            case IGNORED:
                return ResultState.IGNORED;
            case FAILED:
                return ResultState.FAILURE;
            default:
                return ResultState.ERROR;
        }
    }
}
