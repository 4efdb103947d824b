package work.lcod.assertkit.flow;

/**
 * Thrown when an assertion fails.
 */
public class AssertionException extends ResultStateException {
    public AssertionException(String message) {
        super(message);
    }

    public AssertionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public ResultState resultState() {
        return ResultState.FAILURE;
    }
}
