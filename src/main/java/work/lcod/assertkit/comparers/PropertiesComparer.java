package work.lcod.assertkit.comparers;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Last resort of the chain: field-by-field comparison of two instances of the same class.
 * Classes without instance fields, and fields the module system keeps closed, fall back to {@code equals}.
 */
final class PropertiesComparer implements ChainComparer {
    private static final Logger log = LoggerFactory.getLogger(PropertiesComparer.class);

    private static final ClassValue<List<Field>> FIELDS = new ClassValue<>() {
        @Override
        protected List<Field> computeValue(Class<?> type) {
            List<Field> fields = new ArrayList<>();
            for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
                for (Field field : current.getDeclaredFields()) {
                    if (!Modifier.isStatic(field.getModifiers()) && !field.isSynthetic()) {
                        fields.add(field);
                    }
                }
            }
            return List.copyOf(fields);
        }
    };

    private final DeepEqualityComparer comparer;

    PropertiesComparer(DeepEqualityComparer comparer) {
        this.comparer = comparer;
    }

    @Override
    public ComparisonOutcome equal(Object x, Object y, Tolerance tolerance, ComparisonState state) {
        if (!comparer.isReflectionFallback()) {
            return ComparisonOutcome.of(x.equals(y));
        }
        if (x.getClass() != y.getClass()) {
            return ComparisonOutcome.UNEQUAL;
        }
        var fields = FIELDS.get(x.getClass());
        if (fields.isEmpty()) {
            return ComparisonOutcome.of(x.equals(y));
        }
        var nested = state.push(x, y);
        try {
            for (Field field : fields) {
                field.setAccessible(true);
                if (!comparer.areEqual(field.get(x), field.get(y), tolerance, nested)) {
                    return ComparisonOutcome.UNEQUAL;
                }
            }
        } catch (IllegalAccessException | RuntimeException ex) {
            log.debug("Falling back to equals for {}: {}", x.getClass().getName(), ex.toString());
            return ComparisonOutcome.of(x.equals(y));
        }
        return ComparisonOutcome.EQUAL;
    }
}
