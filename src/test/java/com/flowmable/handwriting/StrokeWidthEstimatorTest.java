package com.flowmable.handwriting;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StrokeWidthEstimatorTest {

    private final StrokeWidthEstimator enhanced = new StrokeWidthEstimator(AnalysisSettings.DEFAULT);
    private final StrokeWidthEstimator basic =
            new StrokeWidthEstimator(AnalysisSettings.DEFAULT.withFidelity(Fidelity.BASIC));

    private static BinaryMask band(int w, int h, int top, int height) {
        boolean[] bits = new boolean[w * h];
        for (int y = top; y < top + height; y++)
            for (int x = 0; x < w; x++)
                bits[y * w + x] = true;
        return new BinaryMask(w, h, bits);
    }

    @Test
    void emptyMask_fallsBackToTwo() {
        BinaryMask empty = new BinaryMask(50, 50, new boolean[2500]);
        assertEquals(2.0, enhanced.estimate(empty));
        assertEquals(2.0, basic.estimate(empty));
    }

    @Test
    void singleInkPixel_isPositive() {
        BinaryMask dot = SampleImages.maskOf(10, 10, 55);
        assertTrue(enhanced.estimate(dot) > 0);
        assertTrue(basic.estimate(dot) > 0);
    }

    @Test
    void fullyInkedMask_isPositive() {
        boolean[] bits = new boolean[16 * 16];
        java.util.Arrays.fill(bits, true);
        assertTrue(enhanced.estimate(new BinaryMask(16, 16, bits)) > 0);
    }

    @Test
    void tenPixelBand_measuresTen() {
        BinaryMask mask = band(400, 400, 200, 10);
        assertEquals(10.0, enhanced.estimate(mask), 2.0);
        assertEquals(10.0, basic.estimate(mask), 2.0);
    }

    @Test
    void distanceTransform_countsStepsToPaper() {
        double[] dist = StrokeWidthEstimator.distanceTransform(band(20, 20, 5, 5));
        assertEquals(0.0, dist[4 * 20 + 10]);
        assertEquals(1.0, dist[5 * 20 + 10]);
        assertEquals(3.0, dist[7 * 20 + 10]);
        assertEquals(1.0, dist[9 * 20 + 10]);
    }

    @Test
    void distanceTransform_diagonalCostsRootTwo() {
        // Lone paper pixel in a corner of an ink block
        boolean[] bits = new boolean[9];
        java.util.Arrays.fill(bits, true);
        bits[0] = false;
        double[] dist = StrokeWidthEstimator.distanceTransform(new BinaryMask(3, 3, bits));
        assertEquals(Math.sqrt(2), dist[4], 1e-9);
        assertEquals(1.0, dist[1], 1e-9);
    }
}
