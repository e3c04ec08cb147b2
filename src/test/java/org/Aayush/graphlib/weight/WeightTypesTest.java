package org.Aayush.graphlib.weight;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("WeightTypes Tests")
class WeightTypesTest {

    @Nested
    @DisplayName("Integer weights")
    class IntegerWeights {

        @Test
        @DisplayName("Identity, unit, addition and ordering")
        void testArithmetic() {
            WeightType<Integer> type = WeightTypes.INTEGER;
            assertEquals(0, type.zero());
            assertEquals(1, type.one());
            assertEquals(7, type.add(3, 4));
            assertTrue(type.compare(-5, 2) < 0);
            assertEquals(-5, type.min(2, -5));
            assertTrue(type.isNegative(-1));
            assertFalse(type.isNegative(0));
        }

        @Test
        @DisplayName("Overflow fails fast instead of wrapping")
        void testOverflow() {
            assertThrows(ArithmeticException.class, () -> WeightTypes.INTEGER.add(Integer.MAX_VALUE, 1));
        }

        @Test
        @DisplayName("improves treats null as unreachable")
        void testImproves() {
            assertTrue(WeightTypes.INTEGER.improves(100, null));
            assertTrue(WeightTypes.INTEGER.improves(3, 4));
            assertFalse(WeightTypes.INTEGER.improves(4, 4));
        }

        @Test
        @DisplayName("Null weights are rejected")
        void testNullRejected() {
            assertThrows(NullPointerException.class, () -> WeightTypes.INTEGER.requireValid(null));
        }
    }

    @Nested
    @DisplayName("Long weights")
    class LongWeights {

        @Test
        @DisplayName("Sums beyond int range are exact")
        void testWideSum() {
            assertEquals(4_000_000_000L, WeightTypes.LONG.add(2_000_000_000L, 2_000_000_000L));
        }

        @Test
        @DisplayName("Overflow fails fast")
        void testOverflow() {
            assertThrows(ArithmeticException.class, () -> WeightTypes.LONG.add(Long.MAX_VALUE, 1L));
        }
    }

    @Nested
    @DisplayName("Double weights")
    class DoubleWeights {

        @Test
        @DisplayName("Fractional addition and ordering")
        void testArithmetic() {
            assertEquals(0.75d, WeightTypes.DOUBLE.add(0.5d, 0.25d), 1e-12);
            assertTrue(WeightTypes.DOUBLE.compare(0.1d, 0.2d) < 0);
            assertEquals("double", WeightTypes.DOUBLE.name());
        }

        @Test
        @DisplayName("NaN is rejected at validation")
        void testNaNRejected() {
            assertThrows(IllegalArgumentException.class, () -> WeightTypes.DOUBLE.requireValid(Double.NaN));
            assertEquals(2.5d, WeightTypes.DOUBLE.requireValid(2.5d));
        }
    }
}
