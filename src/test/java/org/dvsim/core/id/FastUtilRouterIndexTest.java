package org.dvsim.core.id;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class FastUtilRouterIndexTest {

    @Test
    @DisplayName("Indices follow lexicographic label order regardless of declaration order")
    void testSortedAssignment() {
        RouterIndex index = RouterIndex.of(List.of("Z", "A", "M"));

        assertEquals(0, index.toIndex("A"));
        assertEquals(1, index.toIndex("M"));
        assertEquals(2, index.toIndex("Z"));
        assertEquals("Z", index.toLabel(2));
        assertEquals(List.of("A", "M", "Z"), index.labels());
        assertEquals(3, index.size());
    }

    @Test
    @DisplayName("Lexicographic order is String order, not numeric order")
    void testLexicographicNotNumeric() {
        RouterIndex index = RouterIndex.of(List.of("R10", "R2", "R1"));

        assertEquals(List.of("R1", "R10", "R2"), index.labels());
    }

    @Test
    @DisplayName("Unknown labels and bad indices are rejected")
    void testLookupFailures() {
        RouterIndex index = new FastUtilRouterIndex(List.of("X", "Y"));

        assertThrows(RouterIndex.UnknownRouterException.class, () -> index.toIndex("Q"));
        assertThrows(IndexOutOfBoundsException.class, () -> index.toLabel(2));
        assertThrows(IndexOutOfBoundsException.class, () -> index.toLabel(-1));
        assertTrue(index.containsLabel("X"));
        assertFalse(index.containsLabel("Q"));
    }

    @Test
    @DisplayName("Construction rejects null, empty, blank and duplicate label sets")
    void testConstructionValidation() {
        assertThrows(IllegalArgumentException.class, () -> new FastUtilRouterIndex(null));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilRouterIndex(List.of()));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilRouterIndex(List.of("A", " ")));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilRouterIndex(Arrays.asList("A", null)));
        assertThrows(IllegalArgumentException.class, () -> new FastUtilRouterIndex(List.of("A", "B", "A")));
    }

    @Test
    @DisplayName("Labels view is immutable")
    void testLabelsImmutable() {
        RouterIndex index = RouterIndex.of(List.of("A", "B"));

        assertThrows(UnsupportedOperationException.class, () -> index.labels().add("C"));
    }
}
