package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Dominant stroke slant from an edge map via a (ρ, θ) Hough transform.
 * <p>
 * θ is the angle of a line's normal, sampled over [0°, 180°) and folded into
 * (−90°, 90°] so that vertical strokes sit at 0°. Positive slant leans right
 * (the stroke's top is further right than its bottom). Only angles within
 * {@code maxSlantDegrees} of vertical are candidates; a candidate is dominant
 * when some ρ bin holds more than {@code houghVoteThreshold} votes, and is weighted
 * by its best bin.
 */
public class SlantEstimator {

    private static final Logger logger = LogManager.getLogger(SlantEstimator.class);

    static final double FALLBACK = 0.0;

    private final AnalysisSettings settings;

    public SlantEstimator(AnalysisSettings settings) {
        this.settings = settings;
    }

    /** @return slant in radians */
    public double estimate(BinaryMask edges) {
        int w = edges.width();
        int h = edges.height();
        int diagonal = (int) Math.ceil(Math.sqrt((double) w * w + (double) h * h));
        int rhoBins = 2 * diagonal + 1;

        double step = settings.thetaStepDegrees();
        int thetaCount = (int) Math.ceil(180.0 / step);
        double[] cos = new double[thetaCount];
        double[] sin = new double[thetaCount];
        double[] folded = new double[thetaCount];
        boolean[] inWindow = new boolean[thetaCount];
        for (int t = 0; t < thetaCount; t++) {
            double degrees = t * step;
            double radians = Math.toRadians(degrees);
            cos[t] = Math.cos(radians);
            sin[t] = Math.sin(radians);
            folded[t] = degrees > 90.0 ? degrees - 180.0 : degrees;
            inWindow[t] = Math.abs(folded[t]) <= settings.maxSlantDegrees();
        }

        int[][] accumulator = new int[thetaCount][];
        for (int t = 0; t < thetaCount; t++) {
            if (inWindow[t]) accumulator[t] = new int[rhoBins];
        }

        long edgeCount = 0;
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                if (!edges.isInk(x, y)) continue;
                edgeCount++;
                for (int t = 0; t < thetaCount; t++) {
                    if (!inWindow[t]) continue;
                    int rho = (int) Math.round(x * cos[t] + y * sin[t]) + diagonal;
                    accumulator[t][rho]++;
                }
            }
        }

        double weightedSum = 0;
        double weightTotal = 0;
        int dominant = 0;
        for (int t = 0; t < thetaCount; t++) {
            if (!inWindow[t]) continue;
            int best = 0;
            for (int votes : accumulator[t]) {
                if (votes > best) best = votes;
            }
            if (best > settings.houghVoteThreshold()) {
                double weight = settings.fidelity() == Fidelity.ENHANCED ? best : 1.0;
                weightedSum += folded[t] * weight;
                weightTotal += weight;
                dominant++;
            }
        }

        if (dominant == 0) {
            logger.debug("No dominant angle among {} edge pixels; slant falls back to {}", edgeCount, FALLBACK);
            return FALLBACK;
        }
        double slant = Math.toRadians(weightedSum / weightTotal);
        logger.trace("Slant {} rad from {} dominant angles", slant, dominant);
        return slant;
    }
}
