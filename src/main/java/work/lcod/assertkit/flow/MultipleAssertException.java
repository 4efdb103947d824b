package work.lcod.assertkit.flow;

import java.util.List;

/**
 * Aggregate failure raised when a multiple assertion block ends with deferred failures.
 */
public final class MultipleAssertException extends AssertionException {
    private final List<AssertionResult> results;

    public MultipleAssertException(List<AssertionResult> results) {
        super(buildMessage(results));
        this.results = List.copyOf(results);
    }

    /**
     * Every deferred entry, in the order it was reported.
     */
    public List<AssertionResult> results() {
        return results;
    }

    private static String buildMessage(List<AssertionResult> results) {
        var builder = new StringBuilder("Multiple failures or warnings in test:");
        int counter = 0;
        for (AssertionResult result : results) {
            builder.append(System.lineSeparator())
                .append("  ")
                .append(++counter)
                .append(") ")
                .append(result.message().replace(System.lineSeparator(), System.lineSeparator() + "  "));
        }
        return builder.toString();
    }
}
