package work.lcod.assertkit.comparers;

import java.lang.reflect.Array;
import java.util.AbstractList;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.RandomAccess;

/**
 * Element-wise comparison of arrays and iterables, ordered or as a bag.
 */
final class Sequences {
    private Sequences() {}

    static boolean isSequence(Object value) {
        return (value instanceof Iterable<?> && !(value instanceof Map<?, ?>)) || value.getClass().isArray();
    }

    static Iterable<?> asIterable(Object value) {
        if (value instanceof Iterable<?> iterable) {
            return iterable;
        }
        return new ArrayView(value);
    }

    static boolean compareOrdered(DeepEqualityComparer comparer, Object x, Object y, Tolerance tolerance, ComparisonState state) {
        var nested = state.push(x, y);
        var xi = asIterable(x).iterator();
        var yi = asIterable(y).iterator();
        long index = 0;
        while (true) {
            boolean xHas = xi.hasNext();
            boolean yHas = yi.hasNext();
            if (!xHas && !yHas) {
                return true;
            }
            if (xHas != yHas) {
                if (state.isTopLevel()) {
                    Object xv = xHas ? xi.next() : null;
                    Object yv = yHas ? yi.next() : null;
                    comparer.recordFailurePoint(new FailurePoint(index, xv, yv, xHas, yHas));
                }
                return false;
            }
            Object xv = xi.next();
            Object yv = yi.next();
            if (!comparer.areEqual(xv, yv, tolerance, nested)) {
                if (state.isTopLevel()) {
                    comparer.recordFailurePoint(new FailurePoint(index, xv, yv, true, true));
                }
                return false;
            }
            index++;
        }
    }

    /**
     * Each actual element consumes the first unmatched expected element it equals.
     */
    static boolean compareUnordered(DeepEqualityComparer comparer, Object x, Object y, Tolerance tolerance, ComparisonState state) {
        var nested = state.push(x, y);
        var remaining = toList(asIterable(y));
        var actual = toList(asIterable(x));
        if (actual.size() != remaining.size()) {
            return false;
        }
        for (Object item : actual) {
            boolean matched = false;
            for (int i = 0; i < remaining.size(); i++) {
                if (comparer.areEqual(item, remaining.get(i), tolerance, nested)) {
                    remaining.remove(i);
                    matched = true;
                    break;
                }
            }
            if (!matched) {
                return false;
            }
        }
        return remaining.isEmpty();
    }

    static List<Object> toList(Iterable<?> items) {
        List<Object> list = items instanceof Collection<?> collection
            ? new ArrayList<>(collection.size())
            : new ArrayList<>();
        for (Object item : items) {
            list.add(item);
        }
        return list;
    }

    private static final class ArrayView extends AbstractList<Object> implements RandomAccess {
        private final Object array;

        private ArrayView(Object array) {
            this.array = array;
        }

        @Override
        public Object get(int index) {
            return Array.get(array, index);
        }

        @Override
        public int size() {
            return Array.getLength(array);
        }
    }
}
