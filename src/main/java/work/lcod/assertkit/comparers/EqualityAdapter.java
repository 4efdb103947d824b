package work.lcod.assertkit.comparers;

import java.util.Comparator;
import java.util.Objects;
import java.util.function.BiPredicate;

/**
 * Wraps a caller supplied comparison so it can run ahead of the built-in chain.
 * The adapter only decides pairs whose both values are instances of its type.
 */
public final class EqualityAdapter<T> implements ChainComparer {
    private final Class<T> type;
    private final BiPredicate<? super T, ? super T> predicate;

    private EqualityAdapter(Class<T> type, BiPredicate<? super T, ? super T> predicate) {
        this.type = Objects.requireNonNull(type, "type");
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    public static <T> EqualityAdapter<T> of(Class<T> type, BiPredicate<? super T, ? super T> predicate) {
        return new EqualityAdapter<>(type, predicate);
    }

    public static <T> EqualityAdapter<T> of(Class<T> type, Comparator<? super T> comparator) {
        Objects.requireNonNull(comparator, "comparator");
        return new EqualityAdapter<>(type, (x, y) -> comparator.compare(x, y) == 0);
    }

    public Class<T> type() {
        return type;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!type.isInstance(x) || !type.isInstance(y)) {
            return ComparisonOutcome.ABSTAIN;
        }
        return ComparisonOutcome.of(predicate.test(type.cast(x), type.cast(y)));
    }
}
