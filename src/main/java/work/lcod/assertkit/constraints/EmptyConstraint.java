package work.lcod.assertkit.constraints;

import java.lang.reflect.Array;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import work.lcod.assertkit.runtime.TestExecutionContext;

/**
 * Empty string, collection, map, array, iterable or {@link Optional}.
 */
public class EmptyConstraint extends AbstractConstraint {
    @Override
    public ConstraintResult applyTo(Object actual, TestExecutionContext context) {
        return new ConstraintResult(this, actual, isEmpty(actual));
    }

    private static boolean isEmpty(Object actual) {
        if (actual instanceof CharSequence text) {
            return text.length() == 0;
        }
        if (actual instanceof Collection<?> collection) {
            return collection.isEmpty();
        }
        if (actual instanceof Map<?, ?> map) {
            return map.isEmpty();
        }
        if (actual instanceof Iterable<?> iterable) {
            return !iterable.iterator().hasNext();
        }
        if (actual instanceof Optional<?> optional) {
            return optional.isEmpty();
        }
        if (actual != null && actual.getClass().isArray()) {
            return Array.getLength(actual) == 0;
        }
        throw new IllegalArgumentException("The actual value must be a string, collection, map, array or Optional but was "
            + (actual == null ? "null" : actual.getClass().getName()));
    }

    @Override
    protected String describe() {
        return "<empty>";
    }
}
