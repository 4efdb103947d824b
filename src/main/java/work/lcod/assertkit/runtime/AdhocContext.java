package work.lcod.assertkit.runtime;

/**
 * Context created when assertions run outside any tracked test. Its result does not keep reported
 * assertions, since the context stays on its thread for good.
 */
public final class AdhocContext extends TestExecutionContext {
    static final TestDescriptor ADHOC_TEST = new TestDescriptor("adhoc", "AdhocTestMethod");

    public AdhocContext() {
        setCurrentResult(TestResult.untracked(ADHOC_TEST));
    }
}
