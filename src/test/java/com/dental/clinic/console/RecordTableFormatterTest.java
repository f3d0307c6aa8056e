package com.dental.clinic.console;

import com.dental.clinic.dto.RecordRow;
import com.dental.clinic.teeth.TeethChart;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RecordTableFormatterTest {

    @Test
    void tableHasHeaderRuleAndOneLinePerRow() {
        List<String> lines = RecordTableFormatter.table(List.of(
                new RecordRow("Ann", "+10000000", "Cleaning", "LL1, UR2", "2026-10-19", "Filling", "Noha", "25.50", ""),
                new RecordRow("Bob", "+20000000", "", "", "", "", "", "", "")));

        assertEquals(4, lines.size());
        assertTrue(lines.get(0).startsWith("Patient | Phone"));
        assertTrue(lines.get(1).startsWith("-------"));
        assertTrue(lines.get(2).contains("LL1, UR2"));
        assertTrue(lines.get(3).startsWith("Bob"));
    }

    @Test
    void longCellsAreAbbreviated() {
        String notes = "a very long note that keeps going and going";
        List<String> lines = RecordTableFormatter.table(List.of(
                new RecordRow("Ann", "+10000000", "", "", "", "", "", "", notes)));

        assertFalse(lines.get(2).contains(notes));
        assertTrue(lines.get(2).endsWith("..."));
    }

    @Test
    void chartMarksSelectedTeethInDisplayOrder() {
        List<String> chart = RecordTableFormatter.chart(TeethChart.parse("UL8, LR1"));

        assertEquals(2, chart.size());
        assertTrue(chart.get(0).startsWith("UL: [8]  7 "));
        assertTrue(chart.get(0).contains("UR:  1 "));
        assertTrue(chart.get(1).contains("LR: [1]"));
    }
}
