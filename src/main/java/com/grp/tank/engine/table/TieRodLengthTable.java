package com.grp.tank.engine.table;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Standard tie-rod lengths in millimetres.
 */
public class TieRodLengthTable {

    /** Segment used for the repeated part of spans longer than the longest stock rod. */
    public static final int SEGMENT_LENGTH = 4000;

    private final int[] lengths;

    TieRodLengthTable(int[] lengths) {
        if (lengths.length == 0) {
            throw new IllegalArgumentException("Tie rod length table cannot be empty");
        }
        this.lengths = lengths.clone();
        Arrays.sort(this.lengths);
    }

    /** Closest stock length; ties go to the shorter rod. */
    public int nearest(int lengthMm) {
        int best = lengths[0];
        for (int candidate : lengths) {
            if (Math.abs(candidate - lengthMm) < Math.abs(best - lengthMm)) {
                best = candidate;
            }
        }
        return best;
    }

    /**
     * Stock rods making up a span. Spans above the longest stock length are cut into
     * 4000 mm segments plus one remainder, each matched independently.
     */
    public List<Integer> segmentsFor(int lengthMm) {
        List<Integer> segments = new ArrayList<>();
        int remaining = lengthMm;
        while (remaining > longest()) {
            segments.add(nearest(SEGMENT_LENGTH));
            remaining -= SEGMENT_LENGTH;
        }
        segments.add(nearest(remaining));
        return segments;
    }

    public int longest() {
        return lengths[lengths.length - 1];
    }

    public List<Integer> lengths() {
        return Arrays.stream(lengths).boxed().collect(Collectors.toList());
    }
}
