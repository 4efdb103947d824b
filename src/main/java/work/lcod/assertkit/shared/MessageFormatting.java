package work.lcod.assertkit.shared;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import java.lang.reflect.Array;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.Iterator;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Set;
import java.util.StringJoiner;

/**
 * Default value rendering for failure messages.
 */
public final class MessageFormatting {
    private static final ObjectMapper JSON = new ObjectMapper()
        .disable(SerializationFeature.FAIL_ON_EMPTY_BEANS);
    private static final int MAX_ITEMS = 10;
    private static final String ELLIPSIS = "...";

    private MessageFormatting() {}

    public static ValueFormatter defaultFormatter() {
        return value -> format(value, Collections.newSetFromMap(new IdentityHashMap<>()));
    }

    /**
     * Shortens {@code text} to at most {@code maxLength} characters, marking the cut with an ellipsis.
     */
    public static String clip(String text, int maxLength) {
        if (text == null || maxLength <= 0 || text.length() <= maxLength) {
            return text;
        }
        if (maxLength <= ELLIPSIS.length()) {
            return text.substring(0, maxLength);
        }
        return text.substring(0, maxLength - ELLIPSIS.length()) + ELLIPSIS;
    }

    public static String escapeControlChars(String text) {
        if (text == null) {
            return null;
        }
        var builder = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\n':
                    builder.append("\\n");
                    break;
                case '\r':
                    builder.append("\\r");
                    break;
                case '\t':
                    builder.append("\\t");
                    break;
                case '\0':
                    builder.append("\\0");
                    break;
                default:
                    builder.append(c);
            }
        }
        return builder.toString();
    }

    private static String format(Object value, Set<Object> visiting) {
        if (value == null) {
            return "null";
        }
        if (value instanceof CharSequence text) {
            return "\"" + escapeControlChars(text.toString()) + "\"";
        }
        if (value instanceof Character c) {
            return "'" + escapeControlChars(String.valueOf(c)) + "'";
        }
        if (value instanceof Double) {
            return value + "d";
        }
        if (value instanceof Float) {
            return value + "f";
        }
        if (value instanceof Long) {
            return value + "L";
        }
        if (value instanceof BigDecimal decimal) {
            return decimal.toPlainString() + "m";
        }
        if (value instanceof BigInteger) {
            return value + "n";
        }
        if (value instanceof Number || value instanceof Boolean || value instanceof Enum<?>) {
            return value.toString();
        }
        if (value instanceof Class<?> type) {
            return "<" + type.getName() + ">";
        }
        if (!visiting.add(value)) {
            return "<...>";
        }
        try {
            if (value instanceof Tuple tuple) {
                var joiner = new StringJoiner(", ", "(", ")");
                for (int i = 0; i < tuple.size(); i++) {
                    joiner.add(format(tuple.get(i), visiting));
                }
                return joiner.toString();
            }
            if (value instanceof Map<?, ?> map) {
                return formatMap(map, visiting);
            }
            if (value instanceof Iterable<?> iterable) {
                return formatItems(iterable, visiting);
            }
            if (value.getClass().isArray()) {
                return formatItems(new ArrayItems(value), visiting);
            }
            if (hasOwnToString(value.getClass())) {
                return "<" + value + ">";
            }
            return "<" + formatBean(value) + ">";
        } finally {
            visiting.remove(value);
        }
    }

    private static String formatItems(Iterable<?> items, Set<Object> visiting) {
        var joiner = new StringJoiner(", ", "< ", " >").setEmptyValue("<empty>");
        int count = 0;
        for (Object item : items) {
            if (count++ == MAX_ITEMS) {
                joiner.add(ELLIPSIS);
                break;
            }
            joiner.add(format(item, visiting));
        }
        return joiner.toString();
    }

    private static String formatMap(Map<?, ?> map, Set<Object> visiting) {
        var joiner = new StringJoiner(", ", "[ ", " ]").setEmptyValue("<empty>");
        int count = 0;
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            if (count++ == MAX_ITEMS) {
                joiner.add(ELLIPSIS);
                break;
            }
            joiner.add(format(entry.getKey(), visiting) + ": " + format(entry.getValue(), visiting));
        }
        return joiner.toString();
    }

    private static String formatBean(Object value) {
        try {
            return value.getClass().getSimpleName() + " " + JSON.writeValueAsString(value);
        } catch (JsonProcessingException | RuntimeException ex) {
            return value.getClass().getName() + "@" + Integer.toHexString(System.identityHashCode(value));
        }
    }

    private static boolean hasOwnToString(Class<?> type) {
        try {
            return type.getMethod("toString").getDeclaringClass() != Object.class;
        } catch (NoSuchMethodException ex) {
            return false;
        }
    }

    private static final class ArrayItems implements Iterable<Object> {
        private final Object array;

        private ArrayItems(Object array) {
            this.array = array;
        }

        @Override
        public Iterator<Object> iterator() {
            return new Iterator<>() {
                private int index;

                @Override
                public boolean hasNext() {
                    return index < Array.getLength(array);
                }

                @Override
                public Object next() {
                    if (!hasNext()) {
                        throw new NoSuchElementException();
                    }
                    return Array.get(array, index++);
                }
            };
        }
    }
}
