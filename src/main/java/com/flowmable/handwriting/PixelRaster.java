package com.flowmable.handwriting;

import java.awt.image.BufferedImage;

/**
 * Row-major {@code int[]} implementation of {@link RasterImage}.
 */
final class PixelRaster implements RasterImage {

    private static final int ALPHA_THRESHOLD = 128;
    private static final int PAPER = 0xFFFFFF;

    private final int width;
    private final int height;
    private final int[] pixels;

    private PixelRaster(int width, int height, int[] pixels) {
        this.width = width;
        this.height = height;
        this.pixels = pixels;
    }

    static PixelRaster fromImage(BufferedImage image) {
        int w = image.getWidth();
        int h = image.getHeight();
        int[] argb = image.getRGB(0, 0, w, h, null, 0, w);
        boolean hasAlpha = image.getColorModel().hasAlpha();
        int[] rgb = new int[w * h];
        for (int i = 0; i < argb.length; i++) {
            int a = (argb[i] >>> 24) & 0xFF;
            rgb[i] = hasAlpha && a < ALPHA_THRESHOLD ? PAPER : argb[i] & 0xFFFFFF;
        }
        return new PixelRaster(w, h, rgb);
    }

    static PixelRaster fromPixels(int width, int height, int[] rgb) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Raster must be non-empty, got " + width + "x" + height);
        }
        if (rgb.length != width * height) {
            throw new InvalidInputException("Expected " + (width * height) + " pixels, got " + rgb.length);
        }
        int[] copy = new int[rgb.length];
        for (int i = 0; i < rgb.length; i++) {
            copy[i] = rgb[i] & 0xFFFFFF;
        }
        return new PixelRaster(width, height, copy);
    }

    @Override
    public int width() {
        return width;
    }

    @Override
    public int height() {
        return height;
    }

    @Override
    public int rgb(int x, int y) {
        return pixels[y * width + x];
    }
}
