package work.lcod.assertkit.runtime;

import java.io.PrintWriter;
import java.util.Objects;
import java.util.concurrent.atomic.AtomicInteger;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.assertkit.comparers.Tolerance;
import work.lcod.assertkit.config.AssertSettings;
import work.lcod.assertkit.config.SettingsLoader;
import work.lcod.assertkit.flow.OutcomeAccumulator;
import work.lcod.assertkit.shared.MessageFormatting;
import work.lcod.assertkit.shared.ValueFormatter;
import work.lcod.assertkit.shared.ValueFormatterFactory;

/**
 * State shared by the assertions of one flow of control: assertion counter, multiple-assert nesting,
 * value formatter, default tolerance, current result and listener.
 * <p>
 * Each thread sees its own current context. Work handed to other threads keeps the context only when
 * wrapped through {@link ContextPropagation} or resumed with {@link #establishExecutionEnvironment()}.
 * The prior context link is used for restoration only; a child never owns its parent.
 */
public class TestExecutionContext {
    private static final Logger log = LoggerFactory.getLogger(TestExecutionContext.class);
    private static final ThreadLocal<TestExecutionContext> CURRENT = new ThreadLocal<>();

    private final TestExecutionContext priorContext;
    private final AtomicInteger multipleAssertLevel = new AtomicInteger();
    private volatile AtomicInteger assertCount;
    private volatile OutcomeAccumulator multipleAccumulator;
    private volatile ValueFormatter currentValueFormatter;
    private volatile Tolerance defaultFloatingPointTolerance;
    private volatile TestResult currentResult;
    private volatile TestListener listener;
    private final AssertSettings settings;

    /**
     * Creates a root context seeded from {@link SettingsLoader}.
     */
    public TestExecutionContext() {
        this(Holder.SETTINGS);
    }

    public TestExecutionContext(AssertSettings settings) {
        this.priorContext = null;
        this.settings = Objects.requireNonNull(settings, "settings");
        this.assertCount = new AtomicInteger();
        this.currentValueFormatter = clipping(MessageFormatting.defaultFormatter(), settings.maxStringLength());
        this.defaultFloatingPointTolerance = settings.floatingPointTolerance();
        this.listener = NullListener.INSTANCE;
    }

    /**
     * Creates a child holding a copy of {@code other}'s settings. The assertion counter is shared until the
     * child starts its own test; the multiple-assert level and its accumulator are copied by value.
     */
    public TestExecutionContext(TestExecutionContext other) {
        Objects.requireNonNull(other, "other");
        this.priorContext = other;
        this.settings = other.settings;
        this.assertCount = other.assertCount;
        this.multipleAssertLevel.set(other.multipleAssertLevel.get());
        this.multipleAccumulator = other.multipleAccumulator;
        this.currentValueFormatter = other.currentValueFormatter;
        this.defaultFloatingPointTolerance = other.defaultFloatingPointTolerance;
        this.currentResult = other.currentResult;
        this.listener = other.listener;
    }

    /**
     * The context of the calling flow, created on demand as an {@link AdhocContext}.
     */
    public static TestExecutionContext current() {
        var context = CURRENT.get();
        if (context == null) {
            context = new AdhocContext();
            CURRENT.set(context);
            log.debug("Created ad-hoc execution context on {}", Thread.currentThread().getName());
        }
        return context;
    }

    static TestExecutionContext peekCurrent() {
        return CURRENT.get();
    }

    static void setCurrent(TestExecutionContext context) {
        if (context == null) {
            CURRENT.remove();
        } else {
            CURRENT.set(context);
        }
    }

    /**
     * Installs a copy of the current context until the returned scope is closed.
     */
    public static IsolatedContext isolated() {
        return new IsolatedContext();
    }

    /**
     * Makes this context current on the calling worker. Closing the scope puts back whatever the worker
     * had before, which may differ from the thread this context was created on.
     */
    public ExecutionScope establishExecutionEnvironment() {
        var previous = CURRENT.get();
        CURRENT.set(this);
        return () -> setCurrent(previous);
    }

    public TestExecutionContext priorContext() {
        return priorContext;
    }

    public AssertSettings settings() {
        return settings;
    }

    public void incrementAssertCount() {
        assertCount.incrementAndGet();
    }

    public void incrementAssertCount(int count) {
        assertCount.addAndGet(count);
    }

    public int assertCount() {
        return assertCount.get();
    }

    public int multipleAssertLevel() {
        return multipleAssertLevel.get();
    }

    /**
     * Enters a multiple assertion block. The outermost block receives a fresh accumulator.
     */
    public OutcomeAccumulator enterMultipleAssert() {
        if (multipleAssertLevel.getAndIncrement() == 0) {
            multipleAccumulator = new OutcomeAccumulator();
        }
        return multipleAccumulator;
    }

    /**
     * Leaves a multiple assertion block.
     *
     * @return the accumulator to flush when the outermost block was left, otherwise {@code null}
     */
    public OutcomeAccumulator exitMultipleAssert() {
        int level = multipleAssertLevel.decrementAndGet();
        if (level < 0) {
            multipleAssertLevel.set(0);
            throw new IllegalStateException("Not inside a multiple assertion block");
        }
        if (level > 0) {
            return null;
        }
        var accumulator = multipleAccumulator;
        multipleAccumulator = null;
        return accumulator;
    }

    /**
     * Accumulator of the enclosing multiple assertion block, or {@code null} outside one.
     */
    public OutcomeAccumulator multipleAccumulator() {
        return multipleAssertLevel.get() > 0 ? multipleAccumulator : null;
    }

    public ValueFormatter currentValueFormatter() {
        return currentValueFormatter;
    }

    public void addFormatter(ValueFormatterFactory factory) {
        Objects.requireNonNull(factory, "factory");
        currentValueFormatter = factory.create(currentValueFormatter);
    }

    public Tolerance defaultFloatingPointTolerance() {
        return defaultFloatingPointTolerance;
    }

    public void setDefaultFloatingPointTolerance(Tolerance tolerance) {
        this.defaultFloatingPointTolerance = Objects.requireNonNull(tolerance, "tolerance");
    }

    public TestResult currentResult() {
        return currentResult;
    }

    public void setCurrentResult(TestResult result) {
        this.currentResult = result;
    }

    public PrintWriter outWriter() {
        var result = currentResult;
        if (result == null) {
            throw new IllegalStateException("No test is running in this context");
        }
        return result.outWriter();
    }

    public TestListener listener() {
        return listener;
    }

    public void setListener(TestListener listener) {
        this.listener = listener == null ? NullListener.INSTANCE : listener;
    }

    /**
     * Starts tracking a test: fresh result and assertion counter, then notifies the listener.
     */
    public TestResult testStarted(TestDescriptor test) {
        var result = new TestResult(test);
        this.currentResult = result;
        this.assertCount = new AtomicInteger();
        log.debug("Test {} started", test.name());
        listener.testStarted(test);
        return result;
    }

    /**
     * Seals the current result with the assertion count and notifies the listener.
     */
    public TestResult testFinished() {
        var result = currentResult;
        if (result == null) {
            throw new IllegalStateException("No test is running in this context");
        }
        result.finish(assertCount());
        log.debug("Test {} finished with {} after {} assertion(s)", result.test().name(), result.resultState(), result.assertCount());
        listener.testFinished(result);
        return result;
    }

    private static ValueFormatter clipping(ValueFormatter formatter, int maxLength) {
        if (maxLength <= 0) {
            return formatter;
        }
        return value -> MessageFormatting.clip(formatter.format(value), maxLength);
    }

    private static final class Holder {
        private static final AssertSettings SETTINGS = SettingsLoader.load();
    }
}
