package work.lcod.assertkit.comparers;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Compares two records of the same class component by component, like a positional tuple.
 */
final class RecordComparer implements ChainComparer {
    private static final Logger log = LoggerFactory.getLogger(RecordComparer.class);

    private final DeepEqualityComparer comparer;

    RecordComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!x.getClass().isRecord() || x.getClass() != y.getClass()) {
            return ComparisonOutcome.ABSTAIN;
        }
        RecordComponent[] components = x.getClass().getRecordComponents();
        var nested = state.push(x, y);
        try {
            for (RecordComponent component : components) {
                var accessor = component.getAccessor();
                accessor.setAccessible(true);
                if (!comparer.areEqual(accessor.invoke(x), accessor.invoke(y), tolerance, nested)) {
                    return ComparisonOutcome.UNEQUAL;
                }
            }
        } catch (IllegalAccessException | InvocationTargetException | RuntimeException ex) {
            log.debug("Record components of {} are not readable, deferring: {}", x.getClass().getName(), ex.toString());
            return ComparisonOutcome.ABSTAIN;
        }
        return ComparisonOutcome.EQUAL;
    }
}
