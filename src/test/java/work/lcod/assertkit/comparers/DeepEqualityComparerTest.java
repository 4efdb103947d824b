package work.lcod.assertkit.comparers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import com.fasterxml.jackson.databind.ObjectMapper;
import java.io.File;
import java.nio.file.Path;
import java.time.Duration;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import work.lcod.assertkit.shared.Tuple;
import work.lcod.assertkit.support.AssertTestSupport.Person;
import work.lcod.assertkit.support.AssertTestSupport.Point;

class DeepEqualityComparerTest {
    private final DeepEqualityComparer comparer = new DeepEqualityComparer();

    @Test
    void everyValueEqualsItself() {
        var list = new ArrayList<Object>(List.of(1, "a"));
        assertTrue(comparer.areEqual(list, list));
        assertTrue(comparer.areEqual(null, null));
        assertFalse(comparer.areEqual(null, 1));
        assertFalse(comparer.areEqual(1, null));
    }

    @Test
    void selfReferentialListsCompareWithoutRecursingForever() {
        var first = new ArrayList<Object>();
        first.add(first);
        var second = new ArrayList<Object>();
        second.add(second);

        assertTrue(comparer.areEqual(first, second));
    }

    @Test
    void orderMattersUnlessIgnored() {
        var actual = List.of(1, 2, 3);
        var expected = new int[] {3, 2, 1};

        assertFalse(comparer.areEqual(actual, expected));
        assertTrue(new DeepEqualityComparer().ignoreOrder(true).areEqual(actual, expected));
    }

    @Test
    void unorderedComparisonRespectsMultiplicity() {
        var unordered = new DeepEqualityComparer().ignoreOrder(true);
        assertFalse(unordered.areEqual(List.of(1, 1, 2), List.of(1, 2, 2)));
        assertTrue(unordered.areEqual(List.of("b", "a", "b"), List.of("b", "b", "a")));
    }

    @Test
    void recordsFirstDifferenceInTopLevelSequence() {
        assertFalse(comparer.areEqual(List.of(1, 2, 3), List.of(1, 5, 3)));
        assertEquals(List.of(new FailurePoint(1, 2, 5, true, true)), comparer.failurePoints());

        assertFalse(comparer.areEqual(List.of(1, 2), List.of(1, 2, 3)));
        var point = comparer.failurePoints().get(0);
        assertEquals(2, point.position());
        assertFalse(point.actualHasData());
        assertTrue(point.expectedHasData());
        assertEquals(3, point.expectedValue());
    }

    @Test
    void numbersOfDifferentTypesCompareByValue() {
        assertTrue(comparer.areEqual(5, 5L));
        assertTrue(comparer.areEqual(List.of(1, 2), new long[] {1L, 2L}));
        assertTrue(comparer.areEqual(List.of(1.0, 2.0), List.of(1.05, 1.95), Tolerance.of(0.1)));
    }

    @Test
    void defaultFloatingPointToleranceAppliesOnlyWhenUnset() {
        var lenient = new DeepEqualityComparer().defaultFloatingPointTolerance(() -> Tolerance.of(0.5));
        assertTrue(lenient.areEqual(1.2, 1.0));
        assertFalse(lenient.areEqual(1.2, 1.0, Tolerance.EXACT));
        assertFalse(lenient.areEqual(3, 2));
    }

    @Test
    void stringsHonorIgnoreCase() {
        assertFalse(comparer.areEqual("Hello", "hello"));
        assertTrue(new DeepEqualityComparer().ignoreCase(true).areEqual("Hello", "hello"));
        assertTrue(new DeepEqualityComparer().ignoreCase(true).areEqual('A', 'a'));
    }

    @Test
    void mapsCompareKeysAndValuesRegardlessOfInsertionOrder() {
        var left = new LinkedHashMap<String, Object>();
        left.put("a", 1);
        left.put("b", List.of(2.0));
        var right = new LinkedHashMap<String, Object>();
        right.put("b", List.of(2));
        right.put("a", 1L);

        assertTrue(comparer.areEqual(left, right));
        assertFalse(comparer.areEqual(left, Map.of("a", 1)));
    }

    @Test
    void tuplesCheckArityAndSlots() {
        assertTrue(comparer.areEqual(Tuple.of(1, "x"), Tuple.of(1L, "x")));
        assertFalse(comparer.areEqual(Tuple.of(1, "x"), Tuple.of(1, "x", null)));
        assertFalse(comparer.areEqual(Tuple.of(1, "x"), Tuple.of(1, "y")));
    }

    @Test
    void recordsCompareComponentsDeeply() {
        assertTrue(comparer.areEqual(new Person("Ada", 36), new Person("Ada", 36)));
        assertFalse(comparer.areEqual(new Person("Ada", 36), new Person("Ada", 37)));
    }

    @Test
    void classesWithoutEqualsFallBackToFieldsWhenEnabled() {
        assertTrue(comparer.areEqual(new Point(1, 2), new Point(1, 2)));
        assertFalse(comparer.areEqual(new Point(1, 2), new Point(2, 1)));
        assertFalse(new DeepEqualityComparer().reflectionFallback(false).areEqual(new Point(1, 2), new Point(1, 2)));
    }

    @Test
    void jsonTreesCompareLeavesThroughTheChain() throws Exception {
        var mapper = new ObjectMapper();
        var actual = mapper.readTree("{\"id\": 1, \"tags\": [\"a\", \"b\"]}");
        var expected = mapper.readTree("{\"tags\": [\"A\", \"B\"], \"id\": 1.0}");

        assertFalse(comparer.areEqual(actual, expected));
        assertTrue(new DeepEqualityComparer().ignoreCase(true).areEqual(actual, expected));
    }

    @Test
    void structuralEqualityIsTriedInBothDirections() {
        var strict = new Bag("strict", List.of(1, 2));
        var lenient = new Bag("lenient", List.of(2, 1));

        assertTrue(comparer.areEqual(strict, lenient));
        assertTrue(comparer.areEqual(lenient, strict));
        assertFalse(comparer.areEqual(strict, new Bag("strict", List.of(1, 3))));
    }

    @Test
    void structuralEqualityDecidesBeforeMapComparison() {
        var left = new KeySetMap();
        left.put("k", 1);
        var right = new KeySetMap();
        right.put("k", 2);

        assertTrue(comparer.areEqual(left, right));
        right.put("other", 3);
        assertFalse(comparer.areEqual(left, right));
    }

    @Test
    void externalComparersRunBeforeTheChain() {
        var byLength = new DeepEqualityComparer()
            .addExternalComparer(EqualityAdapter.of(String.class, (String a, String b) -> a.length() == b.length()));
        assertTrue(byLength.areEqual("abc", "xyz"));
        assertTrue(byLength.areEqual(List.of("ab"), List.of("cd")));
        assertFalse(byLength.areEqual("abc", "xy"));
    }

    @Test
    void temporalsAndPathsUseTheirNaturalIdentity() {
        var utc = OffsetDateTime.of(2024, 1, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        var paris = utc.withOffsetSameInstant(ZoneOffset.ofHours(1));
        assertTrue(comparer.areEqual(paris, utc));
        assertTrue(comparer.areEqual(utc.plusSeconds(3), utc, Tolerance.of(Duration.ofSeconds(5))));
        assertTrue(comparer.areEqual(Path.of("a/./b"), new File("a/b")));
    }

    /**
     * Map considered equal to any map with the same keys, whatever the values.
     */
    private static final class KeySetMap extends HashMap<String, Object> implements StructurallyEquatable {
        @Override
        public boolean structurallyEquals(Object other, ElementComparison comparison) {
            return other instanceof Map<?, ?> map && comparison.areEqual(keySet(), map.keySet());
        }
    }

    /**
     * Strict bags compare in order, lenient ones ignore order.
     */
    private static final class Bag implements StructurallyEquatable {
        private final String kind;
        private final List<Integer> items;

        private Bag(String kind, List<Integer> items) {
            this.kind = kind;
            this.items = items;
        }

        @Override
        public boolean structurallyEquals(Object other, ElementComparison comparison) {
            if (!(other instanceof Bag bag) || bag.items.size() != items.size()) {
                return false;
            }
            if ("strict".equals(kind)) {
                for (int i = 0; i < items.size(); i++) {
                    if (!comparison.areEqual(items.get(i), bag.items.get(i))) {
                        return false;
                    }
                }
                return true;
            }
            return items.stream().allMatch(item -> bag.items.stream().anyMatch(o -> comparison.areEqual(item, o)));
        }
    }
}
