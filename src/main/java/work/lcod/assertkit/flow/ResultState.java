package work.lcod.assertkit.flow;

/**
 * Terminal and non-terminal outcome kinds a test can end in.
 */
public enum ResultState {
    SUCCESS,
    WARNING,
    INCONCLUSIVE,
    IGNORED,
    FAILURE,
    ERROR;

    public boolean isFailure() {
        return this == FAILURE || this == ERROR;
    }
}
