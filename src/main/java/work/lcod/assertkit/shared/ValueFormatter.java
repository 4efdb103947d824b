package work.lcod.assertkit.shared;

/**
 * Renders a value for inclusion in a failure message.
 */
@FunctionalInterface
public interface ValueFormatter {
    String format(Object value);
}
