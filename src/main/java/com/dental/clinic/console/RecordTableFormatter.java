package com.dental.clinic.console;

import com.dental.clinic.dto.RecordRow;
import com.dental.clinic.teeth.Quadrant;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Plain text rendering of the records table and the teeth chart.
 */
public final class RecordTableFormatter {

    private static final int MAX_CELL = 24;

    private RecordTableFormatter() {
    }

    public static List<String> table(List<RecordRow> rows) {
        int columns = RecordRow.HEADERS.size();
        int[] widths = new int[columns];
        for (int i = 0; i < columns; i++) {
            widths[i] = RecordRow.HEADERS.get(i).length();
        }
        for (RecordRow row : rows) {
            List<String> cells = row.cells();
            for (int i = 0; i < columns; i++) {
                widths[i] = Math.max(widths[i], Math.min(MAX_CELL, cells.get(i).length()));
            }
        }

        List<String> lines = new ArrayList<>();
        lines.add(line(RecordRow.HEADERS, widths));
        StringBuilder rule = new StringBuilder();
        for (int i = 0; i < columns; i++) {
            if (i > 0) rule.append("-+-");
            rule.append(StringUtils.repeat('-', widths[i]));
        }
        lines.add(rule.toString());
        for (RecordRow row : rows) {
            lines.add(line(row.cells(), widths));
        }
        return lines;
    }

    /**
     * Upper quadrants on the first line, lower on the second. Selected teeth are bracketed.
     */
    public static List<String> chart(Set<String> selected) {
        return List.of(
                quadrantPair(Quadrant.UPPER_LEFT, Quadrant.UPPER_RIGHT, selected),
                quadrantPair(Quadrant.LOWER_LEFT, Quadrant.LOWER_RIGHT, selected));
    }

    private static String quadrantPair(Quadrant left, Quadrant right, Set<String> selected) {
        return quadrant(left, selected) + " | " + quadrant(right, selected);
    }

    private static String quadrant(Quadrant quadrant, Set<String> selected) {
        StringBuilder sb = new StringBuilder(quadrant.getPrefix()).append(':');
        for (int position : quadrant.displayPositions()) {
            String id = quadrant.toothId(position);
            sb.append(' ').append(selected.contains(id) ? "[" + position + "]" : " " + position + " ");
        }
        return sb.toString();
    }

    private static String line(List<String> cells, int[] widths) {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) sb.append(" | ");
            sb.append(StringUtils.rightPad(StringUtils.abbreviate(cells.get(i), Math.max(4, widths[i])), widths[i]));
        }
        return StringUtils.stripEnd(sb.toString(), " ");
    }
}
