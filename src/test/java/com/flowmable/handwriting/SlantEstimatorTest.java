package com.flowmable.handwriting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class SlantEstimatorTest {

    private final EdgeDetector edges = new EdgeDetector(AnalysisSettings.DEFAULT);

    private double slantOf(BinaryMask mask, AnalysisSettings settings) {
        return new SlantEstimator(settings).estimate(edges.detect(mask));
    }

    @Test
    void verticalStrokes_noSlant() {
        BinaryMask mask = SampleImages.slantedStrokes(200, 200, 40, 160, 30, 4, 0);
        assertEquals(0.0, slantOf(mask, AnalysisSettings.DEFAULT), 0.02);
    }

    @Test
    void rightLeaningStrokes_positiveSlant() {
        BinaryMask mask = SampleImages.slantedStrokes(240, 200, 40, 160, 30, 4, 12);
        double slant = slantOf(mask, AnalysisSettings.DEFAULT);
        assertEquals(Math.toRadians(12), slant, 0.05);
    }

    @Test
    void leftLeaningStrokes_negativeSlant() {
        boolean[] bits = new boolean[240 * 200];
        BinaryMask right = SampleImages.slantedStrokes(240, 200, 40, 160, 30, 4, 12);
        // Mirror horizontally
        for (int y = 0; y < 200; y++)
            for (int x = 0; x < 240; x++)
                bits[y * 240 + (239 - x)] = right.isInk(x, y);
        double slant = slantOf(new BinaryMask(240, 200, bits), AnalysisSettings.DEFAULT);
        assertEquals(-Math.toRadians(12), slant, 0.05);
    }

    @Test
    void horizontalLinesOnly_fallBackToZero() {
        boolean[] bits = new boolean[400 * 400];
        for (int y = 200; y < 210; y++)
            for (int x = 0; x < 400; x++)
                bits[y * 400 + x] = true;
        assertEquals(0.0, slantOf(new BinaryMask(400, 400, bits), AnalysisSettings.DEFAULT));
    }

    @Test
    void emptyEdgeMap_fallsBackToZero() {
        SlantEstimator estimator = new SlantEstimator(AnalysisSettings.DEFAULT);
        assertEquals(0.0, estimator.estimate(new BinaryMask(20, 20, new boolean[400])));
    }
}
