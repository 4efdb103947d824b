package work.lcod.assertkit.flow;

/**
 * Ends a test early and marks it inconclusive.
 */
public class InconclusiveException extends ResultStateException {
    public InconclusiveException(String message) {
        super(message);
    }

    public InconclusiveException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ResultState resultState() {
        return ResultState.INCONCLUSIVE;
    }
}
