package work.lcod.assertkit.flow;

/**
 * Ends a test early and marks it ignored.
 */
public class IgnoreException extends ResultStateException {
    public IgnoreException(String message) {
        super(message);
    }

    public IgnoreException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ResultState resultState() {
        return ResultState.IGNORED;
    }
}
