package work.lcod.assertkit.runtime;

/**
 * A context switch undone on {@link #close()}. Meant for try-with-resources.
 */
@FunctionalInterface
public interface ExecutionScope extends AutoCloseable {
    @Override
    void close();
}
