package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Estimates pen stroke width in pixels.
 * <p>
 * ENHANCED: two-pass chamfer distance transform (axis step 1, diagonal √2) over
 * ink pixels, then the mode of {@code round(2 × distance)}. Ties go to the wider
 * bucket. Pixels outside the image are not paper, unless the mask has no paper at
 * all, in which case the image border acts as paper.
 * <p>
 * BASIC: median ink run length along sampled rows and columns.
 */
public class StrokeWidthEstimator {

    private static final Logger logger = LogManager.getLogger(StrokeWidthEstimator.class);

    static final double FALLBACK = 2.0;
    private static final double SQRT2 = Math.sqrt(2.0);
    private static final int SCANLINE_STEP = 10;

    private final Fidelity fidelity;

    public StrokeWidthEstimator(AnalysisSettings settings) {
        this.fidelity = settings.fidelity();
    }

    public double estimate(BinaryMask mask) {
        int inkCount = mask.inkCount();
        if (inkCount == 0) {
            logger.debug("Mask has no ink; stroke width falls back to {}", FALLBACK);
            return FALLBACK;
        }
        return fidelity == Fidelity.ENHANCED ? distanceMode(mask, inkCount) : runLengthMedian(mask);
    }

    /**
     * Distance from each ink pixel to the nearest paper pixel; paper cells are 0.
     */
    static double[] distanceTransform(BinaryMask mask) {
        int w = mask.width();
        int h = mask.height();
        boolean borderIsPaper = mask.inkCount() == w * h;
        double outside = borderIsPaper ? 0.0 : Double.POSITIVE_INFINITY;
        double[] dist = new double[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                dist[y * w + x] = mask.isInk(x, y) ? Double.POSITIVE_INFINITY : 0.0;
            }
        }

        // Forward pass: W, NW, N, NE
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int idx = y * w + x;
                if (dist[idx] == 0.0) continue;
                double min = dist[idx];
                min = Math.min(min, at(dist, w, h, x - 1, y, outside) + 1.0);
                min = Math.min(min, at(dist, w, h, x - 1, y - 1, outside) + SQRT2);
                min = Math.min(min, at(dist, w, h, x, y - 1, outside) + 1.0);
                min = Math.min(min, at(dist, w, h, x + 1, y - 1, outside) + SQRT2);
                dist[idx] = min;
            }
        }

        // Backward pass: E, SE, S, SW
        for (int y = h - 1; y >= 0; y--) {
            for (int x = w - 1; x >= 0; x--) {
                int idx = y * w + x;
                if (dist[idx] == 0.0) continue;
                double min = dist[idx];
                min = Math.min(min, at(dist, w, h, x + 1, y, outside) + 1.0);
                min = Math.min(min, at(dist, w, h, x + 1, y + 1, outside) + SQRT2);
                min = Math.min(min, at(dist, w, h, x, y + 1, outside) + 1.0);
                min = Math.min(min, at(dist, w, h, x - 1, y + 1, outside) + SQRT2);
                dist[idx] = min;
            }
        }
        return dist;
    }

    private static double at(double[] dist, int w, int h, int x, int y, double outside) {
        if (x < 0 || y < 0 || x >= w || y >= h) return outside;
        return dist[y * w + x];
    }

    private double distanceMode(BinaryMask mask, int inkCount) {
        double[] dist = distanceTransform(mask);
        int maxBucket = 0;
        int[] buckets = new int[dist.length];
        for (int i = 0; i < dist.length; i++) {
            if (dist[i] > 0 && Double.isFinite(dist[i])) {
                buckets[i] = (int) Math.round(dist[i] * 2);
                maxBucket = Math.max(maxBucket, buckets[i]);
            }
        }
        int[] histogram = new int[maxBucket + 1];
        for (int i = 0; i < dist.length; i++) {
            if (dist[i] > 0 && Double.isFinite(dist[i])) {
                histogram[buckets[i]]++;
            }
        }

        int best = -1;
        for (int bucket = 0; bucket < histogram.length; bucket++) {
            if (histogram[bucket] > 0 && (best < 0 || histogram[bucket] >= histogram[best])) {
                best = bucket;
            }
        }
        if (best <= 0) {
            logger.debug("Distance transform gave no usable bucket for {} ink pixels; falling back to {}",
                    inkCount, FALLBACK);
            return FALLBACK;
        }
        return best;
    }

    private double runLengthMedian(BinaryMask mask) {
        int w = mask.width();
        int h = mask.height();
        List<Integer> runs = new ArrayList<>();
        for (int y = h / 4; y < Math.max(h / 4 + 1, 3 * h / 4); y += SCANLINE_STEP) {
            int run = 0;
            for (int x = 0; x < w; x++) {
                if (mask.isInk(x, y)) {
                    run++;
                } else if (run > 0) {
                    runs.add(run);
                    run = 0;
                }
            }
            if (run > 0) runs.add(run);
        }
        for (int x = w / 4; x < Math.max(w / 4 + 1, 3 * w / 4); x += SCANLINE_STEP) {
            int run = 0;
            for (int y = 0; y < h; y++) {
                if (mask.isInk(x, y)) {
                    run++;
                } else if (run > 0) {
                    runs.add(run);
                    run = 0;
                }
            }
            if (run > 0) runs.add(run);
        }
        if (runs.isEmpty()) {
            logger.debug("No ink on sampled scanlines; stroke width falls back to {}", FALLBACK);
            return FALLBACK;
        }
        Collections.sort(runs);
        return runs.get(runs.size() / 2);
    }
}
