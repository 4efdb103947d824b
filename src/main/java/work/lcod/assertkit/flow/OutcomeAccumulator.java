package work.lcod.assertkit.flow;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the outcomes reported inside a multiple assertion block. Only the block that owns the
 * accumulator decides, on {@link #flush()}, whether a combined outcome is raised.
 * Safe for continuations reporting from other threads.
 */
public final class OutcomeAccumulator {
    private final List<AssertionResult> entries = Collections.synchronizedList(new ArrayList<>());

    public void record(AssertionResult result) {
        entries.add(result);
    }

    public List<AssertionResult> entries() {
        synchronized (entries) {
            return List.copyOf(entries);
        }
    }

    public boolean hasFailures() {
        return entries().stream().anyMatch(entry -> entry.status().isFailure());
    }

    /**
     * Raises the aggregate outcome of the block: one {@link MultipleAssertException} listing every
     * non-passing entry when anything failed, otherwise the first deferred ignore or inconclusive.
     * Passes and warnings complete silently.
     */
    public void flush() {
        var snapshot = entries();
        var reported = snapshot.stream()
            .filter(entry -> entry.status() != AssertionStatus.PASSED)
            .collect(Collectors.toList());
        if (reported.stream().anyMatch(entry -> entry.status().isFailure())) {
            throw new MultipleAssertException(reported);
        }
        for (AssertionResult entry : reported) {
            if (entry.status() == AssertionStatus.IGNORED) {
                throw new IgnoreException(entry.message());
            }
        }
        for (AssertionResult entry : reported) {
            if (entry.status() == AssertionStatus.INCONCLUSIVE) {
                throw new InconclusiveException(entry.message());
            }
        }
    }
}
