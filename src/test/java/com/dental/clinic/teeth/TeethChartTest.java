package com.dental.clinic.teeth;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Set;
import java.util.SortedSet;

import static org.junit.jupiter.api.Assertions.*;

class TeethChartTest {

    @Test
    void serializeSortsLexicographically() {
        assertEquals("LL1, LR3, UL8", TeethChart.serialize(Set.of("LR3", "UL8", "LL1")));
    }

    @Test
    void parseTrimsAndDropsEmptyTokens() {
        SortedSet<String> teeth = TeethChart.parse(" UR2,, LL7 ,UR2, ");
        assertEquals(List.of("LL7", "UR2"), List.copyOf(teeth));
    }

    @Test
    void parseOfBlankIsEmpty() {
        assertTrue(TeethChart.parse(null).isEmpty());
        assertTrue(TeethChart.parse("   ").isEmpty());
        assertEquals("", TeethChart.serialize(TeethChart.parse("")));
    }

    @Test
    void parseKeepsMalformedTokens() {
        SortedSet<String> teeth = TeethChart.parse("UL9, XX, UR1");
        assertTrue(teeth.contains("UL9"));
        assertTrue(teeth.contains("XX"));
        assertEquals(List.of("UL9", "XX"), TeethChart.unrecognized(teeth));
    }

    @Test
    void toggleAddsThenRemoves() {
        SortedSet<String> start = TeethChart.parse("UL1");
        SortedSet<String> added = TeethChart.toggle(start, "LR5");
        assertEquals("LR5, UL1", TeethChart.serialize(added));
        assertEquals("UL1", TeethChart.serialize(TeethChart.toggle(added, "LR5")));
        // input untouched
        assertEquals(Set.of("UL1"), start);
    }

    @Test
    void doubleToggleIsNoOp() {
        List<String> selections = List.of("", "UL8", "LL1, LR3, UL8", "UR1, UR2, UR3");
        List<String> tokens = List.of("UL8", "LR1", "UR2");
        for (String s : selections) {
            for (String t : tokens) {
                String expected = TeethChart.serialize(TeethChart.parse(s));
                String actual = TeethChart.serialize(
                        TeethChart.toggle(TeethChart.toggle(TeethChart.parse(s), t), t));
                assertEquals(expected, actual, () -> "selection=" + s + " token=" + t);
            }
        }
    }

    @Test
    void recognizesToothIds() {
        assertTrue(TeethChart.isToothId("UL1"));
        assertTrue(TeethChart.isToothId("LR8"));
        assertFalse(TeethChart.isToothId("LR0"));
        assertFalse(TeethChart.isToothId("ul1"));
        assertFalse(TeethChart.isToothId("UX3"));
        assertFalse(TeethChart.isToothId(null));
    }
}
