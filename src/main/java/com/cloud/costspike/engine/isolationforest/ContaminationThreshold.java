package com.cloud.costspike.engine.isolationforest;

import java.util.Arrays;
import java.util.Comparator;

/**
 * Turns raw anomaly scores into binary flags using the expected contamination fraction.
 */
public final class ContaminationThreshold {

    // Absorbs representation error, e.g. 0.05 * 100 landing a hair above 5
    private static final double EPSILON = 1e-9;

    private ContaminationThreshold() {}

    /**
     * How many of {@code n} rows get flagged: ceil(contamination * n), at least one.
     */
    public static int flagCount(int n, double contamination) {
        if (n == 0) return 0;
        int k = (int) Math.ceil(contamination * n - EPSILON);
        return Math.max(1, Math.min(n, k));
    }

    /**
     * Flags the {@link #flagCount} highest scores. Equal scores keep input order, so the
     * earlier row wins a tie at the cut-off.
     */
    public static boolean[] flagTop(double[] scores, double contamination) {
        if (contamination <= 0.0 || contamination > 0.5) {
            throw new IllegalArgumentException("contamination must be in (0, 0.5], got " + contamination);
        }

        Integer[] order = new Integer[scores.length];
        for (int i = 0; i < order.length; i++) order[i] = i;
        // Arrays.sort on objects is stable
        Arrays.sort(order, Comparator.comparingDouble((Integer i) -> scores[i]).reversed());

        boolean[] flags = new boolean[scores.length];
        int k = flagCount(scores.length, contamination);
        for (int r = 0; r < k; r++) {
            flags[order[r]] = true;
        }
        return flags;
    }
}
