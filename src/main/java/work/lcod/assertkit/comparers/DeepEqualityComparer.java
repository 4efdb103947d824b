package work.lcod.assertkit.comparers;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Supplier;

/**
 * Deep, cycle-safe equality over an ordered chain of type specific comparers.
 * <p>
 * Instances carry per-assertion options and the failure points of the last top-level comparison,
 * so an instance is confined to one comparison run at a time. Constraints keep one as an options
 * template and compare with a {@link #copy()}. The left operand is always the actual value and the
 * right operand the expected one; tolerance windows are derived from the expected side.
 */
public final class DeepEqualityComparer {
    private final List<ChainComparer> chain;
    private final PropertiesComparer fallback;
    private final List<ChainComparer> externalComparers = new ArrayList<>();
    private final List<FailurePoint> failurePoints = new ArrayList<>();

    private boolean ignoreCase;
    private boolean compareAsCollection;
    private boolean ignoreOrder;
    private boolean reflectionFallback = true;
    private Supplier<Tolerance> defaultFloatingPointTolerance = () -> Tolerance.DEFAULT;

    public DeepEqualityComparer() {
        // Types with their own notion of equality go ahead of the generic container entries.
        this.chain = List.of(
            new TupleComparer(this),
            new RecordComparer(this),
            new StructuralComparer(this),
            new ArraysComparer(this),
            new MapsComparer(this),
            new MapEntriesComparer(this),
            new StringsComparer(this),
            new CharsComparer(this),
            new PathsComparer(),
            new NumericsComparer(this),
            new TemporalsComparer(),
            new IterablesComparer(this),
            new EquatablesComparer()
        );
        this.fallback = new PropertiesComparer(this);
    }

    /**
     * A fresh comparer with the same options and external comparers but no failure points, for one
     * comparison run.
     */
    public DeepEqualityComparer copy() {
        var copy = new DeepEqualityComparer();
        copy.ignoreCase = ignoreCase;
        copy.compareAsCollection = compareAsCollection;
        copy.ignoreOrder = ignoreOrder;
        copy.reflectionFallback = reflectionFallback;
        copy.defaultFloatingPointTolerance = defaultFloatingPointTolerance;
        copy.externalComparers.addAll(externalComparers);
        return copy;
    }

    public boolean areEqual(Object actual, Object expected) {
        return areEqual(actual, expected, Tolerance.DEFAULT);
    }

    /**
     * Top-level comparison: resets the failure points before walking the chain.
     */
    public boolean areEqual(Object actual, Object expected, Tolerance tolerance) {
        failurePoints.clear();
        return areEqual(actual, expected, tolerance, ComparisonState.topLevel());
    }

    /**
     * Recursive entry point used by chain entries for nested values.
     */
    public boolean areEqual(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (x == null && y == null) {
            return true;
        }
        if (x == null || y == null) {
            return false;
        }
        if (x == y) {
            return true;
        }
        if (state.didCompare(x, y)) {
            // Revisiting a pair on the current path means both graphs loop back the same way.
            return true;
        }
        var effective = tolerance == null ? Tolerance.DEFAULT : tolerance;
        for (ChainComparer comparer : externalComparers) {
            var outcome = comparer.equal(x, y, effective, state);
            if (outcome.isDecided()) {
                return outcome.isEqual();
            }
        }
        for (ChainComparer comparer : chain) {
            var outcome = comparer.equal(x, y, effective, state);
            if (outcome.isDecided()) {
                return outcome.isEqual();
            }
        }
        return fallback.equal(x, y, effective, state).isEqual();
    }

    public boolean isIgnoreCase() {
        return ignoreCase;
    }

    public DeepEqualityComparer ignoreCase(boolean value) {
        this.ignoreCase = value;
        return this;
    }

    public boolean isCompareAsCollection() {
        return compareAsCollection;
    }

    public DeepEqualityComparer compareAsCollection(boolean value) {
        this.compareAsCollection = value;
        return this;
    }

    public boolean isIgnoreOrder() {
        return ignoreOrder;
    }

    public DeepEqualityComparer ignoreOrder(boolean value) {
        this.ignoreOrder = value;
        return this;
    }

    public boolean isReflectionFallback() {
        return reflectionFallback;
    }

    public DeepEqualityComparer reflectionFallback(boolean value) {
        this.reflectionFallback = value;
        return this;
    }

    public DeepEqualityComparer defaultFloatingPointTolerance(Supplier<Tolerance> supplier) {
        this.defaultFloatingPointTolerance = Objects.requireNonNull(supplier, "supplier");
        return this;
    }

    public Tolerance defaultFloatingPointTolerance() {
        var tolerance = defaultFloatingPointTolerance.get();
        return tolerance == null ? Tolerance.DEFAULT : tolerance;
    }

    public DeepEqualityComparer addExternalComparer(ChainComparer comparer) {
        externalComparers.add(Objects.requireNonNull(comparer, "comparer"));
        return this;
    }

    public List<ChainComparer> externalComparers() {
        return Collections.unmodifiableList(externalComparers);
    }

    /**
     * Positions recorded by the last top-level collection comparison, outermost first.
     */
    public List<FailurePoint> failurePoints() {
        return Collections.unmodifiableList(failurePoints);
    }

    void recordFailurePoint(FailurePoint point) {
        failurePoints.add(point);
    }
}
