package work.lcod.assertkit.shared;

/**
 * Builds a formatter that handles some values itself and hands the rest to {@code next}.
 */
@FunctionalInterface
public interface ValueFormatterFactory {
    ValueFormatter create(ValueFormatter next);
}
