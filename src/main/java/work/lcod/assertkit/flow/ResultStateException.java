package work.lcod.assertkit.flow;

/**
 * Unwinds the test body with a specific outcome kind. Used only outside multiple assertion blocks.
 */
public abstract class ResultStateException extends RuntimeException {
    protected ResultStateException(String message) {
        super(message);
    }

    protected ResultStateException(String message, Throwable cause) {
        super(message, cause);
    }

    public abstract ResultState resultState();
}
