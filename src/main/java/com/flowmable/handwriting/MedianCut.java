package com.flowmable.handwriting;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

/**
 * Median-cut colour quantization.
 * <p>
 * Deterministic: identical input always produces identical output.
 * Tie-breaking uses left-child-before-right-child order in the cut tree.
 */
final class MedianCut {

    private MedianCut() {}

    /**
     * Quantize RGB pixels into at most k groups.
     *
     * @param pixels List of {r, g, b} arrays
     * @param k      Target number of buckets (a power of 2 splits evenly)
     * @return clusters sorted by pixel count descending
     */
    static List<ColorCluster> quantize(List<int[]> pixels, int k) {
        if (pixels.isEmpty()) {
            return List.of();
        }

        List<List<int[]>> buckets = new ArrayList<>();
        buckets.add(new ArrayList<>(pixels));

        while (buckets.size() < k) {
            List<List<int[]>> next = new ArrayList<>();
            for (int i = 0; i < buckets.size(); i++) {
                List<int[]> bucket = buckets.get(i);
                int remaining = buckets.size() - i;
                if (bucket.size() <= 1 || next.size() + remaining >= k) {
                    next.add(bucket);
                } else {
                    splitBucket(bucket, next);
                }
            }
            if (next.size() == buckets.size()) {
                break; // nothing left to split
            }
            buckets = next;
        }

        List<ColorCluster> result = new ArrayList<>();
        for (List<int[]> bucket : buckets) {
            if (bucket.isEmpty()) continue;
            long rSum = 0, gSum = 0, bSum = 0;
            for (int[] px : bucket) {
                rSum += px[0];
                gSum += px[1];
                bSum += px[2];
            }
            int n = bucket.size();
            result.add(new ColorCluster(new InkColor(
                    (int) Math.round((double) rSum / n),
                    (int) Math.round((double) gSum / n),
                    (int) Math.round((double) bSum / n)), n));
        }

        // Stable sort keeps cut-tree order among equal counts
        result.sort(Comparator.comparingInt(ColorCluster::pixelCount).reversed());
        return result;
    }

    private static void splitBucket(List<int[]> bucket, List<List<int[]>> output) {
        int minR = 255, maxR = 0, minG = 255, maxG = 0, minB = 255, maxB = 0;
        for (int[] px : bucket) {
            if (px[0] < minR) minR = px[0];
            if (px[0] > maxR) maxR = px[0];
            if (px[1] < minG) minG = px[1];
            if (px[1] > maxG) maxG = px[1];
            if (px[2] < minB) minB = px[2];
            if (px[2] > maxB) maxB = px[2];
        }

        int rangeR = maxR - minR;
        int rangeG = maxG - minG;
        int rangeB = maxB - minB;

        if (rangeR == 0 && rangeG == 0 && rangeB == 0) {
            output.add(bucket);
            return;
        }

        // Widest channel; tie-break R > G > B
        final int channel;
        if (rangeR >= rangeG && rangeR >= rangeB) {
            channel = 0;
        } else if (rangeG >= rangeB) {
            channel = 1;
        } else {
            channel = 2;
        }

        bucket.sort(Comparator.comparingInt(px -> px[channel]));

        int mid = bucket.size() / 2;
        output.add(new ArrayList<>(bucket.subList(0, mid)));
        output.add(new ArrayList<>(bucket.subList(mid, bucket.size())));
    }
}
