package com.flowmable.handwriting;

/**
 * Sobel edge detection over a binary mask read as {0, 1}.
 * <p>
 * The outermost ring of pixels is never an edge.
 */
public class EdgeDetector {

    private final double threshold;

    public EdgeDetector(AnalysisSettings settings) {
        this.threshold = settings.edgeThreshold();
    }

    public BinaryMask detect(BinaryMask mask) {
        int w = mask.width();
        int h = mask.height();
        boolean[] edges = new boolean[w * h];
        for (int y = 1; y < h - 1; y++) {
            for (int x = 1; x < w - 1; x++) {
                int tl = v(mask, x - 1, y - 1), t = v(mask, x, y - 1), tr = v(mask, x + 1, y - 1);
                int l = v(mask, x - 1, y), r = v(mask, x + 1, y);
                int bl = v(mask, x - 1, y + 1), b = v(mask, x, y + 1), br = v(mask, x + 1, y + 1);
                int gx = (tr + 2 * r + br) - (tl + 2 * l + bl);
                int gy = (bl + 2 * b + br) - (tl + 2 * t + tr);
                double magnitude = Math.sqrt(gx * gx + gy * gy);
                edges[y * w + x] = magnitude > threshold;
            }
        }
        return BinaryMask.wrap(w, h, edges);
    }

    private static int v(BinaryMask mask, int x, int y) {
        return mask.isInk(x, y) ? 1 : 0;
    }
}
