package com.agrisense.fact;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class FactValuesTest {

    @Test
    void integralNumbers_becomeLong() {
        assertEquals(5L, FactValues.normalize("x", 5));
        assertEquals(5L, FactValues.normalize("x", 5.0));
        assertEquals(5.5, FactValues.normalize("x", 5.5));
    }

    @Test
    void equal_comparesNumbersByValue() {
        assertTrue(FactValues.equal(5L, 5.0));
        assertFalse(FactValues.equal(5L, "5"));
        assertTrue(FactValues.equal("tomato", "tomato"));
        assertFalse(FactValues.equal(null, null));
    }

    @Test
    void compareNumbers_mixesLongAndDouble() {
        assertTrue(FactValues.compareNumbers(5L, 5.5) < 0);
        assertTrue(FactValues.compareNumbers(6.0, 5L) > 0);
        assertEquals(0, FactValues.compareNumbers(7L, 7.0));
    }

    @Test
    void nonFiniteNumbers_areRejected() {
        assertThrows(IllegalArgumentException.class, () -> FactValues.normalize("ph", Double.NaN));
    }

    @Test
    void normalizeMap_keepsStringsAndBooleans() {
        Map<String, Object> normalized = FactValues.normalize(Map.of("crop", "rice", "irrigated", true));
        assertEquals("rice", normalized.get("crop"));
        assertEquals(true, normalized.get("irrigated"));
    }
}
