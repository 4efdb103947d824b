package work.lcod.assertkit.constraints;

import java.time.Duration;
import java.util.Comparator;
import java.util.Objects;
import work.lcod.assertkit.comparers.Tolerance;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Ordering constraint against an expected bound widened by an optional tolerance.
 * A {@code null} actual value never satisfies it.
 */
public abstract class ComparisonConstraint extends AbstractConstraint {
    private final Object expected;
    private final String predicate;
    private Tolerance tolerance = Tolerance.DEFAULT;
    private ComparisonAdapter adapter = ComparisonAdapter.natural();

    protected ComparisonConstraint(Object expected, String predicate) {
        super(expected);
        if (expected == null) {
            throw new IllegalArgumentException("Expected value of a comparison must not be null");
        }
        this.expected = expected;
        this.predicate = Objects.requireNonNull(predicate, "predicate");
    }

    public Object expected() {
        return expected;
    }

    /**
     * Decides the outcome from the adapter and the window derived from the expected value.
     */
    protected abstract boolean matches(ComparisonAdapter adapter, Object actual, Tolerance.Range range);

    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        if (actual == null) {
            return new ConstraintResult(this, null, false);
        }
        var range = tolerance.apply(expected);
        return new ConstraintResult(this, actual, matches(adapter, actual, range));
    }

    public ComparisonConstraint within(Number amount) {
        return within(Tolerance.of(amount));
    }

    public ComparisonConstraint within(Duration amount) {
        return within(Tolerance.of(amount));
    }

    public ComparisonConstraint within(Tolerance amount) {
        if (!tolerance.isUnsetOrDefault()) {
            throw new IllegalStateException("Within modifier may appear only once in a constraint expression");
        }
        return withTolerance(Objects.requireNonNull(amount, "amount"));
    }

    public ComparisonConstraint percent() {
        return withTolerance(tolerance.percent());
    }

    public ComparisonConstraint ulps() {
        return withTolerance(tolerance.ulps());
    }

    public ComparisonConstraint days() {
        return withTolerance(tolerance.days());
    }

    public ComparisonConstraint hours() {
        return withTolerance(tolerance.hours());
    }

    public ComparisonConstraint minutes() {
        return withTolerance(tolerance.minutes());
    }

    public ComparisonConstraint seconds() {
        return withTolerance(tolerance.seconds());
    }

    public ComparisonConstraint millis() {
        return withTolerance(tolerance.millis());
    }

    public ComparisonConstraint using(ComparisonAdapter comparison) {
        this.adapter = Objects.requireNonNull(comparison, "comparison");
        return this;
    }

    public <T> ComparisonConstraint using(Class<T> type, Comparator<? super T> comparator) {
        return using(ComparisonAdapter.of(type, comparator));
    }

    private ComparisonConstraint withTolerance(Tolerance next) {
        this.tolerance = next;
        invalidateDescription();
        return this;
    }

    @Override
    protected String describe() {
        var text = predicate + " " + format(expected);
        return tolerance.isExact() ? text : text + " within " + tolerance;
    }
}
