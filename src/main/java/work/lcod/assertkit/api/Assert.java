package work.lcod.assertkit.api;

import java.util.Objects;
import java.util.concurrent.CompletionException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.assertkit.constraints.CollectionContainsConstraint;
import work.lcod.assertkit.constraints.EqualConstraint;
import work.lcod.assertkit.constraints.ResolvableConstraint;
import work.lcod.assertkit.constraints.TextMessageWriter;
import work.lcod.assertkit.constraints.TrueConstraint;
import work.lcod.assertkit.flow.AssertionException;
import work.lcod.assertkit.flow.AssertionResult;
import work.lcod.assertkit.flow.AssertionStatus;
import work.lcod.assertkit.flow.IgnoreException;
import work.lcod.assertkit.flow.InconclusiveException;
import work.lcod.assertkit.flow.OutcomeAccumulator;
import work.lcod.assertkit.flow.SuccessException;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Entry point for assertions.
 * <p>
 * Every outcome is recorded on the current test result. Outside a multiple assertion block a failure,
 * pass, ignore or inconclusive report unwinds the caller immediately; inside one it is deferred until the
 * outermost block ends. Warnings never unwind. Usage errors such as an incomplete constraint expression
 * or a tolerance that cannot apply are thrown as they happen, in or out of a block.
 */
public final class Assert {
    private static final Logger log = LoggerFactory.getLogger(Assert.class);

    private Assert() {}

    public static void that(Object actual, ResolvableConstraint expression) {
        that(TestExecutionContext.current(), actual, expression, null);
    }

    public static void that(Object actual, ResolvableConstraint expression, String message, Object... args) {
        that(TestExecutionContext.current(), actual, expression, message, args);
    }

    public static void that(TestExecutionContext context, Object actual, ResolvableConstraint expression) {
        that(context, actual, expression, null);
    }

    /**
     * Applies the constraint with the settings of {@code context} and reports a failure there when it is not met.
     */
    public static void that(TestExecutionContext context, Object actual, ResolvableConstraint expression,
                            String message, Object... args) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(expression, "expression");
        var constraint = expression.resolve();
        context.incrementAssertCount();
        var result = constraint.applyTo(actual, context);
        if (!result.isSuccess()) {
            var writer = new TextMessageWriter(context.currentValueFormatter(), message, args);
            result.writeMessageTo(writer);
            report(context, AssertionStatus.FAILED, writer.toString());
        }
    }

    public static void that(boolean condition) {
        that(TestExecutionContext.current(), condition, new TrueConstraint(), null);
    }

    public static void that(boolean condition, String message, Object... args) {
        that(TestExecutionContext.current(), condition, new TrueConstraint(), message, args);
    }

    public static void areEqual(Object expected, Object actual) {
        that(actual, new EqualConstraint(expected));
    }

    public static void areEqual(Object expected, Object actual, String message, Object... args) {
        that(actual, new EqualConstraint(expected), message, args);
    }

    public static void areEqual(double expected, double actual, double delta) {
        that(actual, new EqualConstraint(expected).within(delta));
    }

    public static void areEqual(double expected, double actual, double delta, String message, Object... args) {
        that(actual, new EqualConstraint(expected).within(delta), message, args);
    }

    /**
     * Asserts that the collection or array {@code actual} holds an element equal to {@code expected}.
     */
    public static void contains(Object expected, Object actual) {
        that(actual, new CollectionContainsConstraint(expected));
    }

    public static void contains(Object expected, Object actual, String message, Object... args) {
        that(actual, new CollectionContainsConstraint(expected), message, args);
    }

    public static void pass() {
        pass(null);
    }

    public static void pass(String message, Object... args) {
        report(TestExecutionContext.current(), AssertionStatus.PASSED, TextMessageWriter.formatUserMessage(message, args));
    }

    public static void fail() {
        fail(null);
    }

    public static void fail(String message, Object... args) {
        report(TestExecutionContext.current(), AssertionStatus.FAILED, TextMessageWriter.formatUserMessage(message, args));
    }

    public static void warn(String message, Object... args) {
        report(TestExecutionContext.current(), AssertionStatus.WARNING, TextMessageWriter.formatUserMessage(message, args));
    }

    public static void ignore() {
        ignore(null);
    }

    public static void ignore(String message, Object... args) {
        report(TestExecutionContext.current(), AssertionStatus.IGNORED, TextMessageWriter.formatUserMessage(message, args));
    }

    public static void inconclusive() {
        inconclusive(null);
    }

    public static void inconclusive(String message, Object... args) {
        report(TestExecutionContext.current(), AssertionStatus.INCONCLUSIVE, TextMessageWriter.formatUserMessage(message, args));
    }

    /**
     * Runs {@code block}, deferring every outcome it reports. Nested blocks join the outermost one,
     * which raises the combined outcome when it ends.
     */
    public static void multiple(AssertionBlock block) {
        multiple(TestExecutionContext.current(), block);
    }

    public static void multiple(TestExecutionContext context, AssertionBlock block) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(block, "block");
        context.enterMultipleAssert();
        OutcomeAccumulator toFlush;
        try {
            block.run();
        } finally {
            toFlush = context.exitMultipleAssert();
        }
        flush(toFlush);
    }

    /**
     * Like {@link #multiple(AssertionBlock)}, waiting for the stage returned by {@code block} before the
     * block ends. Continuations on other threads report into the same block when they run under the
     * context captured by {@link work.lcod.assertkit.runtime.ContextPropagation}.
     */
    public static void multipleAsync(AsyncAssertionBlock block) {
        multipleAsync(TestExecutionContext.current(), block);
    }

    public static void multipleAsync(TestExecutionContext context, AsyncAssertionBlock block) {
        Objects.requireNonNull(context, "context");
        Objects.requireNonNull(block, "block");
        context.enterMultipleAssert();
        OutcomeAccumulator toFlush;
        try {
            var stage = block.run();
            if (stage != null) {
                stage.toCompletableFuture().join();
            }
        } catch (CompletionException ex) {
            throw unwrap(ex);
        } finally {
            toFlush = context.exitMultipleAssert();
        }
        flush(toFlush);
    }

    private static void flush(OutcomeAccumulator accumulator) {
        if (accumulator != null) {
            log.debug("Multiple assertion block ended with {} deferred outcome(s)", accumulator.entries().size());
            accumulator.flush();
        }
    }

    private static RuntimeException unwrap(CompletionException ex) {
        var cause = ex.getCause();
        if (cause instanceof RuntimeException runtime) {
            return runtime;
        }
        if (cause instanceof Error error) {
            throw error;
        }
        return ex;
    }

    private static void report(TestExecutionContext context, AssertionStatus status, String message) {
        var result = AssertionResult.of(status, message);
        var testResult = context.currentResult();
        if (testResult != null) {
            testResult.recordAssertion(result);
        }
        var accumulator = context.multipleAccumulator();
        if (accumulator != null) {
            log.debug("Deferred {} inside multiple assertion block", status);
            accumulator.record(result);
            return;
        }
        switch (status) {
            case FAILED:
            case ERROR:
                throw new AssertionException(message);
            case IGNORED:
                throw new IgnoreException(message);
            case INCONCLUSIVE:
                throw new InconclusiveException(message);
            case PASSED:
                throw new SuccessException(message);
            default:
                log.debug("Warning recorded: {}", message);
        }
    }
}
