package com.dental.clinic.teeth;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Mouth quadrants as the clinic charts them. Left-side quadrants are drawn 8 to 1 so that the
 * front teeth meet in the middle of the chart.
 */
public enum Quadrant {

    UPPER_LEFT("UL", "Upper Left", true),
    UPPER_RIGHT("UR", "Upper Right", false),
    LOWER_LEFT("LL", "Lower Left", true),
    LOWER_RIGHT("LR", "Lower Right", false);

    public static final int TEETH_PER_QUADRANT = 8;

    private final String prefix;
    private final String label;
    private final boolean leftSide;

    Quadrant(String prefix, String label, boolean leftSide) {
        this.prefix = prefix;
        this.label = label;
        this.leftSide = leftSide;
    }

    public String getPrefix() {
        return prefix;
    }

    public String getLabel() {
        return label;
    }

    public boolean isLeftSide() {
        return leftSide;
    }

    public String toothId(int position) {
        if (position < 1 || position > TEETH_PER_QUADRANT) {
            throw new IllegalArgumentException("Tooth position out of range: " + position);
        }
        return prefix + position;
    }

    /** Positions in the order a chart shows them; does not affect serialized order. */
    public List<Integer> displayPositions() {
        List<Integer> positions = new ArrayList<>(TEETH_PER_QUADRANT);
        for (int i = 1; i <= TEETH_PER_QUADRANT; i++) {
            positions.add(i);
        }
        if (leftSide) {
            Collections.reverse(positions);
        }
        return positions;
    }
}
