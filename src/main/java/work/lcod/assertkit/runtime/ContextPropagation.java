package work.lcod.assertkit.runtime;

import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.Executor;
import java.util.function.Supplier;

/**
 * Carries the submitting flow's execution context onto whichever worker runs the task.
 * The context is captured when the task is wrapped, not when it runs.
 */
public final class ContextPropagation {
    private ContextPropagation() {}

    public static Runnable wrap(Runnable task) {
        Objects.requireNonNull(task, "task");
        var captured = TestExecutionContext.current();
        return () -> {
            try (var scope = captured.establishExecutionEnvironment()) {
                task.run();
            }
        };
    }

    public static <T> Supplier<T> wrap(Supplier<T> task) {
        Objects.requireNonNull(task, "task");
        var captured = TestExecutionContext.current();
        return () -> {
            try (var scope = captured.establishExecutionEnvironment()) {
                return task.get();
            }
        };
    }

    public static <T> Callable<T> wrap(Callable<T> task) {
        Objects.requireNonNull(task, "task");
        var captured = TestExecutionContext.current();
        return () -> {
            try (var scope = captured.establishExecutionEnvironment()) {
                return task.call();
            }
        };
    }

    /**
     * Executor that wraps every submitted command with the context current at submission time.
     */
    public static Executor executor(Executor delegate) {
        Objects.requireNonNull(delegate, "delegate");
        return command -> delegate.execute(wrap(command));
    }
}
