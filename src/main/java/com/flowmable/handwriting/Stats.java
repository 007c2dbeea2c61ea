package com.flowmable.handwriting;

import java.util.Arrays;
import java.util.List;

/**
 * Central-tendency helpers shared by the estimators. Enhanced fidelity uses
 * medians, basic fidelity uses means.
 */
final class Stats {

    private Stats() {
    }

    /** Upper median: {@code sorted[n / 2]}. Caller guarantees a non-empty input. */
    static double median(double[] values) {
        double[] sorted = values.clone();
        Arrays.sort(sorted);
        return sorted[sorted.length / 2];
    }

    static double mean(double[] values) {
        double sum = 0;
        for (double v : values) sum += v;
        return sum / values.length;
    }

    static double center(double[] values, Fidelity fidelity) {
        return fidelity == Fidelity.ENHANCED ? median(values) : mean(values);
    }

    static double[] toArray(List<? extends Number> values) {
        double[] out = new double[values.size()];
        for (int i = 0; i < out.length; i++) {
            out[i] = values.get(i).doubleValue();
        }
        return out;
    }
}
