package work.lcod.assertkit.constraints;

import work.lcod.assertkit.comparers.DeepEqualityComparer;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Same elements with the same multiplicities, in any order.
 */
public class CollectionEquivalentConstraint extends AbstractConstraint {
    private final Object expected;
    private final DeepEqualityComparer comparer = new DeepEqualityComparer()
        .compareAsCollection(true)
        .ignoreOrder(true);

    public CollectionEquivalentConstraint(Object expected) {
        super(expected);
        if (!Items.isSequence(expected)) {
            throw new IllegalArgumentException("Expected value must be a collection or array");
        }
        this.expected = expected;
    }

    public CollectionEquivalentConstraint ignoreCase() {
        comparer.ignoreCase(true);
        invalidateDescription();
        return this;
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        var items = Items.of(actual);
        var run = comparer.copy()
            .defaultFloatingPointTolerance(context::defaultFloatingPointTolerance)
            .reflectionFallback(context.settings().reflectionFallback());
        return new ConstraintResult(this, actual, run.areEqual(items, Items.of(expected)));
    }

    @Override
    protected String describe() {
        var text = "equivalent to " + format(expected);
        return comparer.isIgnoreCase() ? text + ", ignoring case" : text;
    }
}
