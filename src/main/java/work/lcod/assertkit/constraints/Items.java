package work.lcod.assertkit.constraints;

import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Reads the elements of an actual value that must be a collection or array.
 */
final class Items {
    private Items() {}

    static boolean isSequence(Object value) {
        return value != null
            && ((value instanceof Iterable<?> && !(value instanceof Map<?, ?>)) || value.getClass().isArray());
    }

    static List<Object> of(Object actual) {
        if (!isSequence(actual)) {
            throw new IllegalArgumentException("The actual value must be a collection or array but was "
                + (actual == null ? "null" : actual.getClass().getName()));
        }
        var items = new ArrayList<Object>();
        if (actual instanceof Iterable<?> iterable) {
            iterable.forEach(items::add);
        } else {
            int length = Array.getLength(actual);
            for (int i = 0; i < length; i++) {
                items.add(Array.get(actual, i));
            }
        }
        return items;
    }
}
