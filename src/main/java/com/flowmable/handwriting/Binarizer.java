package com.flowmable.handwriting;

/**
 * Classifies each pixel as ink or paper.
 * <p>
 * ENHANCED: adaptive local thresholding. A pixel is ink when its luma is below
 * the mean luma of the {@code blockSize × blockSize} window centred on it
 * (clamped at the image edges) minus {@code thresholdOffset}. Window sums come
 * from a summed-area table, so the result equals the direct window mean.
 * <p>
 * BASIC: a single global threshold on the unweighted channel mean.
 */
public class Binarizer {

    private final AnalysisSettings settings;

    public Binarizer(AnalysisSettings settings) {
        this.settings = settings;
    }

    public BinaryMask binarize(RasterImage image) {
        return settings.fidelity() == Fidelity.ENHANCED ? adaptive(image) : global(image);
    }

    private BinaryMask global(RasterImage image) {
        int w = image.width();
        int h = image.height();
        int threshold = settings.globalThreshold();
        boolean[] ink = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                int rgb = image.rgb(x, y);
                int gray = (((rgb >> 16) & 0xFF) + ((rgb >> 8) & 0xFF) + (rgb & 0xFF)) / 3;
                ink[y * w + x] = gray < threshold;
            }
        }
        return BinaryMask.wrap(w, h, ink);
    }

    private BinaryMask adaptive(RasterImage image) {
        int w = image.width();
        int h = image.height();
        int[] lum = new int[w * h];
        for (int y = 0; y < h; y++) {
            for (int x = 0; x < w; x++) {
                lum[y * w + x] = image.luminance(x, y);
            }
        }

        // integral[(y + 1) * (w + 1) + (x + 1)] = sum of lum over [0..x] × [0..y]
        long[] integral = new long[(w + 1) * (h + 1)];
        for (int y = 0; y < h; y++) {
            long rowSum = 0;
            for (int x = 0; x < w; x++) {
                rowSum += lum[y * w + x];
                integral[(y + 1) * (w + 1) + (x + 1)] = integral[y * (w + 1) + (x + 1)] + rowSum;
            }
        }

        int half = settings.blockSize() / 2;
        double c = settings.thresholdOffset();
        boolean[] ink = new boolean[w * h];
        for (int y = 0; y < h; y++) {
            int y0 = Math.max(0, y - half);
            int y1 = Math.min(h - 1, y + half);
            for (int x = 0; x < w; x++) {
                int x0 = Math.max(0, x - half);
                int x1 = Math.min(w - 1, x + half);
                long sum = integral[(y1 + 1) * (w + 1) + (x1 + 1)]
                        - integral[y0 * (w + 1) + (x1 + 1)]
                        - integral[(y1 + 1) * (w + 1) + x0]
                        + integral[y0 * (w + 1) + x0];
                int count = (x1 - x0 + 1) * (y1 - y0 + 1);
                double threshold = (double) sum / count - c;
                ink[y * w + x] = lum[y * w + x] < threshold;
            }
        }
        return BinaryMask.wrap(w, h, ink);
    }
}
