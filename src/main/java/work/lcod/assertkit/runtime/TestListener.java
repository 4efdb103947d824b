package work.lcod.assertkit.runtime;

/**
 * Receives the start and completion of each tracked test.
 */
public interface TestListener {
    void testStarted(TestDescriptor test);

    void testFinished(TestResult result);
}
