package work.lcod.assertkit.comparers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.time.Duration;
import java.time.Instant;
import org.junit.jupiter.api.Test;

class ToleranceTest {
    @Test
    void linearToleranceWidensAroundExpected() {
        var range = Tolerance.of(2).apply(10);
        assertEquals(8L, range.lowerBound());
        assertEquals(12L, range.upperBound());
    }

    @Test
    void percentToleranceScalesWithExpectedMagnitude() {
        var range = Tolerance.of(10).percent().apply(-200.0);
        assertEquals(-220.0, (Double) range.lowerBound(), 1e-9);
        assertEquals(-180.0, (Double) range.upperBound(), 1e-9);
    }

    @Test
    void exactModesReturnExpectedAsBothBounds() {
        var range = Tolerance.EXACT.apply("text");
        assertEquals("text", range.lowerBound());
        assertEquals("text", range.upperBound());
        assertTrue(Tolerance.DEFAULT.isUnsetOrDefault());
        assertTrue(Tolerance.EXACT.isExact());
        assertFalse(Tolerance.EXACT.isUnsetOrDefault());
    }

    @Test
    void durationToleranceAppliesToTemporals() {
        var instant = Instant.parse("2024-01-01T00:00:00Z");
        var range = Tolerance.of(5).seconds().apply(instant);
        assertEquals(instant.minusSeconds(5), range.lowerBound());
        assertEquals(instant.plusSeconds(5), range.upperBound());
        assertEquals(Tolerance.of(Duration.ofMinutes(2)), Tolerance.of(2).minutes());
    }

    @Test
    void rejectsSecondModeAndModeWithoutAmount() {
        assertThrows(IllegalStateException.class, () -> Tolerance.of(1).percent().ulps());
        assertThrows(IllegalStateException.class, Tolerance.DEFAULT::percent);
        assertThrows(IllegalStateException.class, () -> Tolerance.of(Duration.ofSeconds(1)).seconds());
    }

    @Test
    void rejectsNegativeAndNonFiniteAmounts() {
        assertThrows(IllegalStateException.class, () -> Tolerance.of(-1));
        assertThrows(IllegalStateException.class, () -> Tolerance.of(Double.NaN));
        assertThrows(IllegalStateException.class, () -> Tolerance.of(Duration.ofSeconds(-1)));
    }

    @Test
    void numericToleranceOnTextIsAUsageError() {
        assertThrows(IllegalStateException.class, () -> Tolerance.of(1).apply("abc"));
        assertThrows(IllegalStateException.class, () -> Tolerance.of(1).ulps().apply(5));
        assertThrows(IllegalStateException.class, () -> Tolerance.of(1).seconds().apply(5));
    }

    @Test
    void equalTolerancesShareHashCode() {
        var left = Tolerance.of(new java.math.BigDecimal("1.0"));
        var right = Tolerance.of(new java.math.BigDecimal("1.00"));
        assertEquals(left, right);
        assertEquals(left.hashCode(), right.hashCode());
        assertEquals("5 Percent", Tolerance.of(5).percent().toString());
    }
}
