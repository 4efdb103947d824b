package work.lcod.assertkit.runtime;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import work.lcod.assertkit.flow.AssertionResult;
import work.lcod.assertkit.flow.AssertionStatus;
import work.lcod.assertkit.flow.ResultState;
import work.lcod.assertkit.flow.ResultStateException;

/**
 * Outcome of one tracked test: recorded assertions, captured output, and the final state.
 */
public final class TestResult {
    private static final Logger log = LoggerFactory.getLogger(TestResult.class);

    private final TestDescriptor test;
    private final boolean retainsAssertions;
    private final Instant startTime = Instant.now();
    private final List<AssertionResult> assertionResults = Collections.synchronizedList(new ArrayList<>());
    private final StringWriter output = new StringWriter();
    private final PrintWriter outWriter = new PrintWriter(output, true);

    private volatile ResultState resultState = ResultState.SUCCESS;
    private volatile String message = "";
    private volatile int assertCount;
    private volatile Instant endTime;

    public TestResult(TestDescriptor test) {
        this(test, true);
    }

    private TestResult(TestDescriptor test, boolean retainsAssertions) {
        this.test = Objects.requireNonNull(test, "test");
        this.retainsAssertions = retainsAssertions;
    }

    /**
     * Result for assertions made outside any tracked test. It lives as long as its thread, so reported
     * assertions are not kept.
     */
    public static TestResult untracked(TestDescriptor test) {
        return new TestResult(test, false);
    }

    public boolean retainsAssertions() {
        return retainsAssertions;
    }

    public TestDescriptor test() {
        return test;
    }

    public void recordAssertion(AssertionResult result) {
        Objects.requireNonNull(result, "result");
        if (!retainsAssertions) {
            log.trace("Not keeping {} assertion outside a tracked test", result.status());
            return;
        }
        assertionResults.add(result);
    }

    public void recordAssertion(AssertionStatus status, String message) {
        recordAssertion(AssertionResult.of(status, message));
    }

    /**
     * Records an exception that ended the test body.
     */
    public void recordException(Throwable error) {
        if (error instanceof ResultStateException signal) {
            setResult(signal.resultState(), signal.getMessage());
        } else {
            var text = error.getMessage() == null ? error.getClass().getName() : error.getClass().getName() + " : " + error.getMessage();
            recordAssertion(AssertionStatus.ERROR, text);
            setResult(ResultState.ERROR, text);
        }
    }

    public void setResult(ResultState state, String message) {
        this.resultState = Objects.requireNonNull(state, "state");
        this.message = message == null ? "" : message;
    }

    /**
     * Seals the result, promoting it to a failure or warning when recorded assertions demand it.
     */
    public void finish(int assertCount) {
        this.assertCount = assertCount;
        this.endTime = Instant.now();
        if (resultState == ResultState.SUCCESS) {
            var results = assertionResults();
            var failures = results.stream().filter(r -> r.status().isFailure()).collect(Collectors.toList());
            if (!failures.isEmpty()) {
                setResult(ResultState.FAILURE, failures.get(0).message());
            } else if (results.stream().anyMatch(r -> r.status() == AssertionStatus.WARNING)) {
                setResult(ResultState.WARNING, warnings().get(0).message());
            }
        }
    }

    public List<AssertionResult> assertionResults() {
        synchronized (assertionResults) {
            return List.copyOf(assertionResults);
        }
    }

    public List<AssertionResult> warnings() {
        return assertionResults().stream()
            .filter(r -> r.status() == AssertionStatus.WARNING)
            .collect(Collectors.toList());
    }

    public long pendingFailures() {
        return assertionResults().stream().filter(r -> r.status().isFailure()).count();
    }

    public ResultState resultState() {
        return resultState;
    }

    public String message() {
        return message;
    }

    public int assertCount() {
        return assertCount;
    }

    public Instant startTime() {
        return startTime;
    }

    public Duration duration() {
        var end = endTime == null ? Instant.now() : endTime;
        return Duration.between(startTime, end);
    }

    public PrintWriter outWriter() {
        return outWriter;
    }

    public String output() {
        outWriter.flush();
        return output.toString();
    }
}
