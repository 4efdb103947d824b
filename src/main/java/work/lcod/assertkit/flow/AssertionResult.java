package work.lcod.assertkit.flow;

import java.util.Objects;

/**
 * One reported assertion outcome, kept in report order on the test result.
 */
public record AssertionResult(AssertionStatus status, String message, String stackTrace) {
    public AssertionResult {
        Objects.requireNonNull(status, "status");
        message = message == null ? "" : message;
    }

    public static AssertionResult of(AssertionStatus status, String message) {
        return new AssertionResult(status, message, StackFilter.currentStackTrace());
    }
}
