package work.lcod.assertkit.runtime;

/**
 * Listener that takes no action.
 */
public final class NullListener implements TestListener {
    public static final NullListener INSTANCE = new NullListener();

    private NullListener() {}

    @Override
    public void testStarted(TestDescriptor test) {
        // no-op
    }

    @Override
    public void testFinished(TestResult result) {
        // no-op
    }
}
