package work.lcod.assertkit.comparers;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.math.BigDecimal;
import java.math.BigInteger;
import org.junit.jupiter.api.Test;

class NumericsTest {
    @Test
    void comparesMixedNumericTypesByValue() {
        assertEquals(0, Numerics.compare(5, 5L));
        assertEquals(0, Numerics.compare(new BigDecimal("2.50"), 2.5));
        assertTrue(Numerics.compare(BigInteger.TEN.pow(30), Long.MAX_VALUE) > 0);
        assertTrue(Numerics.compare(-1, (short) 0) < 0);
    }

    @Test
    void exactComparisonDoesNotForgiveRounding() {
        assertFalse(Numerics.areEqual(0.1 + 0.2, 0.3, Tolerance.DEFAULT));
        assertTrue(Numerics.areEqual(0.1 + 0.2, 0.3, Tolerance.of(1e-9)));
        assertTrue(Numerics.areEqual(0.1 + 0.2, 0.3, Tolerance.of(1).ulps()));
    }

    @Test
    void nanEqualsNanAndInfinitiesCompareExactly() {
        assertTrue(Numerics.areEqual(Double.NaN, Double.NaN, Tolerance.DEFAULT));
        assertFalse(Numerics.areEqual(Double.NaN, 1.0, Tolerance.of(1000)));
        assertTrue(Numerics.areEqual(Double.POSITIVE_INFINITY, Double.POSITIVE_INFINITY, Tolerance.of(1)));
        assertFalse(Numerics.areEqual(Double.POSITIVE_INFINITY, Double.MAX_VALUE, Tolerance.of(1)));
    }

    @Test
    void linearToleranceIsInclusive() {
        assertTrue(Numerics.areEqual(12, 10, Tolerance.of(2)));
        assertFalse(Numerics.areEqual(13, 10, Tolerance.of(2)));
        assertTrue(Numerics.areEqual(95, 100, Tolerance.of(5).percent()));
    }

    @Test
    void integralArithmeticWidensOnOverflow() {
        assertEquals(new BigDecimal(Long.MAX_VALUE).add(BigDecimal.ONE), Numerics.add(Long.MAX_VALUE, 1));
        assertEquals(3L, Numerics.add(1, 2));
    }

    @Test
    void ulpsOnIntegersIsAUsageError() {
        assertThrows(IllegalStateException.class, () -> Numerics.areEqual(1, 1, Tolerance.of(2).ulps()));
    }
}
