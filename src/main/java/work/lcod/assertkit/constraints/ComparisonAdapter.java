package work.lcod.assertkit.constraints;

import java.util.Comparator;
import java.util.Objects;
import work.lcod.assertkit.comparers.Numerics;

/**
 * Orders an actual value against a bound derived from the expected value.
 */
@FunctionalInterface
public interface ComparisonAdapter {
    /**
     * Negative, zero or positive as {@code actual} is below, at or above {@code bound}.
     *
     * @throws IllegalArgumentException when the values cannot be ordered
     */
    int compare(Object actual, Object bound);

    /**
     * Numbers of mixed types are compared by value; anything else must be mutually {@link Comparable}.
     */
    static ComparisonAdapter natural() {
        return NaturalOrder.INSTANCE;
    }

    static <T> ComparisonAdapter of(Class<T> type, Comparator<? super T> comparator) {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(comparator, "comparator");
        return (actual, bound) -> {
            if (!type.isInstance(actual) || !type.isInstance(bound)) {
                throw new IllegalArgumentException("Comparer for " + type.getName() + " cannot order "
                    + actual.getClass().getName() + " against " + bound.getClass().getName());
            }
            return comparator.compare(type.cast(actual), type.cast(bound));
        };
    }

    final class NaturalOrder implements ComparisonAdapter {
        private static final NaturalOrder INSTANCE = new NaturalOrder();

        private NaturalOrder() {}

        @Override
        @SuppressWarnings({"unchecked", "rawtypes"})
        public int compare(Object actual, Object bound) {
            if (Numerics.isNumericType(actual) && Numerics.isNumericType(bound)) {
                return Numerics.compare((Number) actual, (Number) bound);
            }
            if (actual instanceof Comparable comparable && bound != null
                && (bound.getClass().isInstance(actual) || actual.getClass().isInstance(bound))) {
                return comparable.compareTo(bound);
            }
            throw new IllegalArgumentException("Cannot compare " + typeName(actual) + " with " + typeName(bound));
        }

        private static String typeName(Object value) {
            return value == null ? "null" : value.getClass().getName();
        }
    }
}
