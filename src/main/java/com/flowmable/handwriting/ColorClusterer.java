package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Estimates the ink colour directly from the raster, independent of binarization.
 * <p>
 * Up to {@code colorSampleSize} pixels are sampled at a fixed stride; only pixels
 * whose three channels are all below {@code darkPixelThreshold} are candidates.
 * ENHANCED groups candidates into running-mean clusters; BASIC quantizes them
 * with median cut. Either way the most populated group's centroid wins.
 */
public class ColorClusterer {

    private static final Logger logger = LogManager.getLogger(ColorClusterer.class);

    static final InkColor FALLBACK = InkColor.BLACK;
    private static final int MEDIAN_CUT_BUCKETS = 8;

    private final AnalysisSettings settings;

    public ColorClusterer(AnalysisSettings settings) {
        this.settings = settings;
    }

    public InkColor estimateInkColor(RasterImage image) {
        List<ColorCluster> clusters = cluster(image);
        if (clusters.isEmpty()) {
            logger.debug("No dark pixels sampled; ink colour falls back to {}", FALLBACK.toHex());
            return FALLBACK;
        }
        ColorCluster best = clusters.get(0);
        for (ColorCluster c : clusters) {
            if (c.pixelCount() > best.pixelCount()) {
                best = c;
            }
        }
        return best.centroid();
    }

    /**
     * All clusters found among the sampled dark pixels, in creation order (ENHANCED)
     * or by descending size (BASIC).
     */
    public List<ColorCluster> cluster(RasterImage image) {
        List<int[]> candidates = sampleDarkPixels(image);
        if (candidates.isEmpty()) {
            return List.of();
        }
        return settings.fidelity() == Fidelity.ENHANCED
                ? runningMeanClusters(candidates)
                : MedianCut.quantize(candidates, MEDIAN_CUT_BUCKETS);
    }

    private List<int[]> sampleDarkPixels(RasterImage image) {
        int w = image.width();
        long total = (long) w * image.height();
        int sampleSize = (int) Math.min(settings.colorSampleSize(), total);
        double step = (double) total / sampleSize;
        int dark = settings.darkPixelThreshold();

        List<int[]> candidates = new ArrayList<>();
        for (int i = 0; i < sampleSize; i++) {
            long index = (long) (i * step);
            int x = (int) (index % w);
            int y = (int) (index / w);
            int rgb = image.rgb(x, y);
            int r = (rgb >> 16) & 0xFF;
            int g = (rgb >> 8) & 0xFF;
            int b = rgb & 0xFF;
            if (r < dark && g < dark && b < dark) {
                candidates.add(new int[]{r, g, b});
            }
        }
        return candidates;
    }

    private List<ColorCluster> runningMeanClusters(List<int[]> candidates) {
        List<RunningCluster> clusters = new ArrayList<>();
        double mergeDistance = settings.clusterMergeDistance();
        for (int[] px : candidates) {
            RunningCluster nearest = null;
            double minDistance = Double.POSITIVE_INFINITY;
            for (RunningCluster cluster : clusters) {
                double d = cluster.distanceTo(px);
                if (d < minDistance) {
                    minDistance = d;
                    nearest = cluster;
                }
            }
            if (nearest != null && minDistance < mergeDistance) {
                nearest.add(px);
            } else {
                clusters.add(new RunningCluster(px));
            }
        }

        List<ColorCluster> result = new ArrayList<>(clusters.size());
        for (RunningCluster c : clusters) {
            result.add(new ColorCluster(new InkColor(c.r, c.g, c.b), c.count));
        }
        return result;
    }

    /** Centroid is the truncated integer mean of its members. */
    private static final class RunningCluster {
        long rSum, gSum, bSum;
        int count;
        int r, g, b;

        RunningCluster(int[] px) {
            add(px);
        }

        void add(int[] px) {
            rSum += px[0];
            gSum += px[1];
            bSum += px[2];
            count++;
            r = (int) (rSum / count);
            g = (int) (gSum / count);
            b = (int) (bSum / count);
        }

        double distanceTo(int[] px) {
            int dr = px[0] - r;
            int dg = px[1] - g;
            int db = px[2] - b;
            return Math.sqrt(dr * dr + dg * dg + db * db);
        }
    }
}
