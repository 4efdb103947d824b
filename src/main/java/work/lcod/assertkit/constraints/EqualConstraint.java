package work.lcod.assertkit.constraints;

import java.time.Duration;
import java.util.Comparator;
import java.util.function.BiPredicate;
import work.lcod.assertkit.comparers.DeepEqualityComparer;
import work.lcod.assertkit.comparers.EqualityAdapter;
import work.lcod.assertkit.comparers.Numerics;
import work.lcod.assertkit.comparers.Tolerance;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Deep equality with the expected value, optionally within a tolerance.
 */
public class EqualConstraint extends AbstractConstraint {
    private final Object expected;
    private final DeepEqualityComparer comparer = new DeepEqualityComparer();
    private Tolerance tolerance = Tolerance.DEFAULT;

    public EqualConstraint(Object expected) {
        super(expected);
        this.expected = expected;
    }

    public Object expected() {
        return expected;
    }

    public Tolerance tolerance() {
        return tolerance;
    }

    public EqualConstraint within(Number amount) {
        return within(Tolerance.of(amount));
    }

    public EqualConstraint within(Duration amount) {
        return within(Tolerance.of(amount));
    }

    /**
     * @throws IllegalStateException when a tolerance was already given
     */
    public EqualConstraint within(Tolerance amount) {
        if (!tolerance.isUnsetOrDefault()) {
            throw new IllegalStateException("Within modifier may appear only once in a constraint expression");
        }
        return withTolerance(amount);
    }

    public EqualConstraint percent() {
        return withTolerance(tolerance.percent());
    }

    public EqualConstraint ulps() {
        return withTolerance(tolerance.ulps());
    }

    public EqualConstraint days() {
        return withTolerance(tolerance.days());
    }

    public EqualConstraint hours() {
        return withTolerance(tolerance.hours());
    }

    public EqualConstraint minutes() {
        return withTolerance(tolerance.minutes());
    }

    public EqualConstraint seconds() {
        return withTolerance(tolerance.seconds());
    }

    public EqualConstraint millis() {
        return withTolerance(tolerance.millis());
    }

    public EqualConstraint ignoreCase() {
        comparer.ignoreCase(true);
        invalidateDescription();
        return this;
    }

    public EqualConstraint asCollection() {
        comparer.compareAsCollection(true);
        invalidateDescription();
        return this;
    }

    public EqualConstraint ignoringOrder() {
        comparer.ignoreOrder(true);
        invalidateDescription();
        return this;
    }

    public EqualConstraint using(EqualityAdapter<?> adapter) {
        comparer.addExternalComparer(adapter);
        return this;
    }

    public <T> EqualConstraint using(Class<T> type, Comparator<? super T> comparator) {
        return using(EqualityAdapter.of(type, comparator));
    }

    public <T> EqualConstraint using(Class<T> type, BiPredicate<? super T, ? super T> predicate) {
        return using(EqualityAdapter.of(type, predicate));
    }

    private EqualConstraint withTolerance(Tolerance next) {
        this.tolerance = next;
        invalidateDescription();
        return this;
    }

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        if (!tolerance.isExact() && isScalar(expected)) {
            // rejects tolerances that make no sense for the expected type
            tolerance.apply(expected);
        }
        var run = comparer.copy()
            .defaultFloatingPointTolerance(context::defaultFloatingPointTolerance)
            .reflectionFallback(context.settings().reflectionFallback());
        boolean equal = run.areEqual(actual, expected, tolerance);
        return new EqualConstraintResult(this, actual, equal, run.failurePoints());
    }

    private static boolean isScalar(Object value) {
        return value instanceof CharSequence || value instanceof Boolean || value instanceof Character
            || value instanceof Enum<?> || Numerics.isNumericType(value);
    }

    @Override
    protected String describe() {
        var text = new StringBuilder(format(expected));
        if (!tolerance.isExact()) {
            text.append(" +/- ").append(tolerance);
        }
        if (comparer.isIgnoreCase()) {
            text.append(", ignoring case");
        }
        if (comparer.isCompareAsCollection()) {
            text.append(", as collection");
        }
        if (comparer.isIgnoreOrder()) {
            text.append(", ignoring order");
        }
        return text.toString();
    }
}
