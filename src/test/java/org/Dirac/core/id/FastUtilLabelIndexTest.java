package org.Dirac.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilLabelIndexTest {

    @Test
    @DisplayName("Baseline Correctness: labels map to their positions and back")
    void testSimpleMapping() {
        LabelIndex index = LabelIndex.of(List.of("A", "B", "C"));

        assertEquals(0, index.toIndex("A"));
        assertEquals(2, index.toIndex("C"));

        assertEquals("A", index.toLabel(0));
        assertEquals("B", index.toLabel(1));

        assertTrue(index.containsLabel("B"));
        assertFalse(index.containsLabel("Z"));
        assertEquals(3, index.size());
        assertEquals(List.of("A", "B", "C"), index.labels());
    }

    @Test
    @DisplayName("Order is positional, not alphabetical")
    void testPositionalOrder() {
        LabelIndex index = new FastUtilLabelIndex(List.of("Depot", "Bakery", "Airport"));

        assertEquals(0, index.toIndex("Depot"));
        assertEquals("Airport", index.toLabel(2));
    }

    @Test
    @DisplayName("Exception Path: unknown and null labels")
    void testUnknownLabel() {
        LabelIndex index = LabelIndex.of(List.of("A", "B"));

        assertThrows(LabelIndex.UnknownLabelException.class, () -> index.toIndex("Q"));
        assertThrows(LabelIndex.UnknownLabelException.class, () -> index.toIndex(null));
        assertFalse(index.containsLabel(null));
    }

    @Test
    @DisplayName("Exception Path: index out of bounds")
    void testInvalidIndex() {
        LabelIndex index = LabelIndex.of(List.of("A", "B"));

        assertThrows(IndexOutOfBoundsException.class, () -> index.toLabel(2));
        assertThrows(IndexOutOfBoundsException.class, () -> index.toLabel(-1));
    }

    @Test
    @DisplayName("Constructor Validation: duplicates, blanks and null input rejected")
    void testConstructorValidation() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilLabelIndex(null));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilLabelIndex(List.of("A", "A")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilLabelIndex(List.of("A", " ")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilLabelIndex(Arrays.asList("A", null)));
    }

    @Test
    @DisplayName("Labels view is immutable")
    void testLabelsImmutable() {
        LabelIndex index = LabelIndex.of(List.of("A", "B"));
        assertThrows(UnsupportedOperationException.class, () -> index.labels().add("C"));
    }

    @Test
    @DisplayName("Alphabet: first labels follow A, B, C order")
    void testAlphabet() {
        assertEquals(List.of("A", "B", "C", "D"), LabelAlphabet.firstLabels(4));
        assertEquals("Z", LabelAlphabet.firstLabels(26).get(25));
        assertTrue(LabelAlphabet.firstLabels(0).isEmpty());
        assertThrows(IllegalArgumentException.class, () -> LabelAlphabet.firstLabels(27));
        assertThrows(IllegalArgumentException.class, () -> LabelAlphabet.firstLabels(-1));
    }
}
