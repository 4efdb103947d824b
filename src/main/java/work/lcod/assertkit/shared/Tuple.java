package work.lcod.assertkit.shared;

import java.util.Arrays;
import java.util.List;
import java.util.StringJoiner;

/**
 * Fixed-arity positional value, compared slot by slot by the equality chain.
 */
public final class Tuple {
    private final Object[] items;

    private Tuple(Object[] items) {
        this.items = items;
    }

    public static Tuple of(Object... items) {
        return new Tuple(items == null ? new Object[] {null} : items.clone());
    }

    public int size() {
        return items.length;
    }

    public Object get(int index) {
        return items[index];
    }

    public List<Object> toList() {
        return Arrays.asList(items.clone());
    }

    @Override
    public boolean equals(Object other) {
        return this == other || (other instanceof Tuple that && Arrays.deepEquals(items, that.items));
    }

    @Override
    public int hashCode() {
        return Arrays.deepHashCode(items);
    }

    @Override
    public String toString() {
        var joiner = new StringJoiner(", ", "(", ")");
        for (Object item : items) {
            joiner.add(String.valueOf(item));
        }
        return joiner.toString();
    }
}
