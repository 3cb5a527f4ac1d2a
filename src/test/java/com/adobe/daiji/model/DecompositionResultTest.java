package com.adobe.daiji.model;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("DecompositionResult Tests")
class DecompositionResultTest {

    @Test
    @DisplayName("of copies the decomposition and keeps the numeral as supplied")
    void shouldBuildFromDecomposition() {
        DecompositionResult result = DecompositionResult.of("-31.4E-1", new NumeralDecomposition(true, "3", "14"));

        assertEquals("-31.4E-1", result.input());
        assertTrue(result.negative());
        assertFalse(result.zero());
        assertEquals("3", result.integerDigits());
        assertEquals("14", result.fractionDigits());
        assertEquals("-3.14", result.plain());
    }

    @Test
    @DisplayName("of reports zero without a sign")
    void shouldBuildZero() {
        DecompositionResult result = DecompositionResult.of("-0.000", NumeralDecomposition.ZERO);

        assertFalse(result.negative());
        assertTrue(result.zero());
        assertEquals("0", result.plain());
    }
}
