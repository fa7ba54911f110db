package com.spreadsheet.formula.services;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.Arrays;
import java.util.Collections;

import static org.junit.jupiter.api.Assertions.*;

class FormulaValuesTest {

    @Test
    void testTruthiness() {
        assertTrue(FormulaValues.isTruthy(true));
        assertTrue(FormulaValues.isTruthy(-1.0));
        assertTrue(FormulaValues.isTruthy("0"));
        assertTrue(FormulaValues.isTruthy(Collections.emptyList()));

        assertFalse(FormulaValues.isTruthy(false));
        assertFalse(FormulaValues.isTruthy(0.0));
        assertFalse(FormulaValues.isTruthy(0));
        assertFalse(FormulaValues.isTruthy(Double.NaN));
        assertFalse(FormulaValues.isTruthy(""));
        assertFalse(FormulaValues.isTruthy(null));
    }

    @Test
    void testFlattenIsOneLevel() {
        assertEquals(Arrays.asList(1.0, "a", true, 2.0),
                FormulaValues.flatten(Arrays.asList(1.0, Arrays.asList("a", true), 2.0)));
        assertEquals(Collections.emptyList(), FormulaValues.flatten(Collections.singletonList(Collections.emptyList())));
    }

    @Test
    void testNumbersFiltersAndWidens() {
        assertEquals(Arrays.asList(1.0, 2.0, 3.5),
                FormulaValues.numbers(Arrays.asList(1, "x", 2L, true, new BigDecimal("3.5"), null)));
    }

    @Test
    void testNormalize() {
        assertEquals(3.0, FormulaValues.normalize(3));
        assertEquals("s", FormulaValues.normalize("s"));
        assertNull(FormulaValues.normalize(null));
    }
}
