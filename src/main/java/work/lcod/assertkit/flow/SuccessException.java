package work.lcod.assertkit.flow;

/**
 * Ends a test early with a passing result.
 */
public class SuccessException extends ResultStateException {
    public SuccessException(String message) {
        super(message);
    }

    public SuccessException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ResultState resultState() {
        return ResultState.SUCCESS;
    }
}
