package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Finds text line positions from the horizontal ink projection.
 * <p>
 * The row profile is smoothed with a moving average, then each plateau of equal
 * smoothed values is a peak when every value within the peak radius on either
 * side is strictly lower and the value exceeds a fraction of the mask width.
 * A peak is reported at its plateau's centre row.
 */
public class LineSegmenter {

    private static final Logger logger = LogManager.getLogger(LineSegmenter.class);

    private static final int ENHANCED_SMOOTHING_RADIUS = 2;
    private static final int ENHANCED_PEAK_RADIUS = 2;
    private static final double ENHANCED_WIDTH_FRACTION = 0.01;

    private static final int BASIC_SMOOTHING_RADIUS = 0;
    private static final int BASIC_PEAK_RADIUS = 1;
    private static final double BASIC_WIDTH_FRACTION = 0.02;

    private final int smoothingRadius;
    private final int peakRadius;
    private final double widthFraction;

    public LineSegmenter(AnalysisSettings settings) {
        if (settings.fidelity() == Fidelity.ENHANCED) {
            smoothingRadius = ENHANCED_SMOOTHING_RADIUS;
            peakRadius = ENHANCED_PEAK_RADIUS;
            widthFraction = ENHANCED_WIDTH_FRACTION;
        } else {
            smoothingRadius = BASIC_SMOOTHING_RADIUS;
            peakRadius = BASIC_PEAK_RADIUS;
            widthFraction = BASIC_WIDTH_FRACTION;
        }
    }

    /** @return line rows in ascending order, possibly empty */
    public List<Integer> findLines(BinaryMask mask) {
        double[] profile = smooth(projection(mask), smoothingRadius);
        double threshold = mask.width() * widthFraction;

        List<Integer> lines = new ArrayList<>();
        int n = profile.length;
        int start = 0;
        while (start < n) {
            int end = start;
            while (end + 1 < n && profile[end + 1] == profile[start]) {
                end++;
            }
            double value = profile[start];
            if (value > threshold && isolatedPlateau(profile, start, end)) {
                lines.add((start + end) / 2);
            }
            start = end + 1;
        }

        if (lines.isEmpty()) {
            logger.debug("No text lines above {} ink pixels per row", threshold);
        }
        return lines;
    }

    static int[] projection(BinaryMask mask) {
        int[] rows = new int[mask.height()];
        for (int y = 0; y < rows.length; y++) {
            rows[y] = mask.rowInkCount(y);
        }
        return rows;
    }

    /** Moving average, window clamped at both ends. */
    static double[] smooth(int[] values, int radius) {
        double[] out = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            int lo = Math.max(0, i - radius);
            int hi = Math.min(values.length - 1, i + radius);
            long sum = 0;
            for (int j = lo; j <= hi; j++) {
                sum += values[j];
            }
            out[i] = (double) sum / (hi - lo + 1);
        }
        return out;
    }

    private boolean isolatedPlateau(double[] profile, int start, int end) {
        double value = profile[start];
        for (int i = Math.max(0, start - peakRadius); i < start; i++) {
            if (profile[i] >= value) return false;
        }
        for (int i = end + 1; i <= Math.min(profile.length - 1, end + peakRadius); i++) {
            if (profile[i] >= value) return false;
        }
        return true;
    }
}
