package work.lcod.assertkit.constraints;

import java.util.Comparator;
import java.util.function.BiPredicate;
import work.lcod.assertkit.comparers.DeepEqualityComparer;
import work.lcod.assertkit.comparers.EqualityAdapter;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Succeeds when at least one element of the actual collection equals the expected item.
 */
public class CollectionContainsConstraint extends AbstractConstraint {
    private final Object expected;
    private final DeepEqualityComparer comparer = new DeepEqualityComparer();

    public CollectionContainsConstraint(Object expected) {
        super(expected);
        this.expected = expected;
    }

    public CollectionContainsConstraint ignoreCase() {
        comparer.ignoreCase(true);
        invalidateDescription();
        return this;
    }

    public <T> CollectionContainsConstraint using(Class<T> type, Comparator<? super T> comparator) {
        comparer.addExternalComparer(EqualityAdapter.of(type, comparator));
        return this;
    }

    public <T> CollectionContainsConstraint using(Class<T> type, BiPredicate<? super T, ? super T> predicate) {
        comparer.addExternalComparer(EqualityAdapter.of(type, predicate));
        return this;
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        var run = comparer.copy()
            .defaultFloatingPointTolerance(context::defaultFloatingPointTolerance)
            .reflectionFallback(context.settings().reflectionFallback());
        for (Object item : Items.of(actual)) {
            if (run.areEqual(item, expected)) {
                return new ConstraintResult(this, actual, true);
            }
        }
        return new ConstraintResult(this, actual, false);
    }

    @Override
    protected String describe() {
        var text = "some item equal to " + format(expected);
        return comparer.isIgnoreCase() ? text + ", ignoring case" : text;
    }
}
