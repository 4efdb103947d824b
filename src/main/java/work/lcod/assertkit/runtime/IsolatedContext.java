package work.lcod.assertkit.runtime;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Installs a child of the current context and restores the prior one, by identity, on close.
 * <pre>{@code
 * try (var isolated = TestExecutionContext.isolated()) {
 *     isolated.context().setDefaultFloatingPointTolerance(Tolerance.of(0.01));
 *     ...
 * }
 * }</pre>
 */
public final class IsolatedContext implements ExecutionScope {
    private static final Logger log = LoggerFactory.getLogger(IsolatedContext.class);

    private final TestExecutionContext savedContext;
    private final TestExecutionContext context;
    private boolean closed;

    IsolatedContext() {
        this.savedContext = TestExecutionContext.current();
        this.context = new TestExecutionContext(savedContext);
        TestExecutionContext.setCurrent(context);
        log.trace("Entered isolated context");
    }

    public TestExecutionContext context() {
        return context;
    }

    public TestExecutionContext savedContext() {
        return savedContext;
    }

    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        TestExecutionContext.setCurrent(savedContext);
        log.trace("Restored prior execution context");
    }
}
