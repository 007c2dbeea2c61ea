package com.flowmable.handwriting;

import java.awt.image.BufferedImage;

/**
 * A decoded, read-only pixel buffer supplied by the caller.
 * <p>
 * Decoding compressed bytes is not part of this library; adapt whatever the
 * decoder produced through {@link #of(BufferedImage)} or {@link #ofPixels}.
 */
public interface RasterImage {

    int width();

    int height();

    /** Packed {@code 0xRRGGBB} at (x, y). */
    int rgb(int x, int y);

    /**
     * Luma in [0, 255], rounded: 0.299 R + 0.587 G + 0.114 B.
     */
    default int luminance(int x, int y) {
        int rgb = rgb(x, y);
        int r = (rgb >> 16) & 0xFF;
        int g = (rgb >> 8) & 0xFF;
        int b = rgb & 0xFF;
        return (299 * r + 587 * g + 114 * b + 500) / 1000;
    }

    /**
     * Snapshot a {@link BufferedImage}. Pixels with alpha below 128 are read as
     * white paper.
     */
    static RasterImage of(BufferedImage image) {
        return PixelRaster.fromImage(image);
    }

    /**
     * Wrap packed {@code 0xRRGGBB} pixels in row-major order. The array is copied.
     */
    static RasterImage ofPixels(int width, int height, int[] rgb) {
        return PixelRaster.fromPixels(width, height, rgb);
    }
}
