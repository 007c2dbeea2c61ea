package com.flowmable.handwriting;

import java.awt.image.BufferedImage;

/**
 * Synthetic handwriting-like fixtures.
 */
final class SampleImages {

    static final int WHITE = 0xFFFFFF;
    static final int BLACK = 0x000000;

    private SampleImages() {
    }

    static BufferedImage blank(int w, int h) {
        BufferedImage img = new BufferedImage(w, h, BufferedImage.TYPE_INT_RGB);
        fill(img, 0, 0, w, h, WHITE);
        return img;
    }

    static void fill(BufferedImage img, int x0, int y0, int w, int h, int rgb) {
        for (int y = y0; y < y0 + h; y++)
            for (int x = x0; x < x0 + w; x++)
                img.setRGB(x, y, rgb);
    }

    /** Full-width black bands of the given height starting at each top row. */
    static BufferedImage horizontalBands(int w, int h, int bandHeight, int... tops) {
        BufferedImage img = blank(w, h);
        for (int top : tops) {
            fill(img, 0, top, w, bandHeight, BLACK);
        }
        return img;
    }

    /**
     * One text line of {@code count} solid "glyphs", each {@code glyphW × glyphH},
     * separated by {@code gap} pixels, starting at (x0, y0).
     */
    static BufferedImage glyphRow(int w, int h, int x0, int y0, int count, int glyphW, int glyphH, int gap) {
        BufferedImage img = blank(w, h);
        for (int i = 0; i < count; i++) {
            fill(img, x0 + i * (glyphW + gap), y0, glyphW, glyphH, BLACK);
        }
        return img;
    }

    /**
     * Strokes {@code strokeW} wide from row {@code top} to row {@code bottom}
     * (exclusive), one every {@code pitch} pixels, shifted right by
     * {@code tan(degrees)} per row above the bottom so positive angles lean right.
     */
    static BinaryMask slantedStrokes(int w, int h, int top, int bottom, int pitch, int strokeW, double degrees) {
        boolean[] bits = new boolean[w * h];
        double shear = Math.tan(Math.toRadians(degrees));
        for (int x0 = 20; x0 + strokeW < w - 40; x0 += pitch) {
            for (int y = top; y < bottom; y++) {
                int start = x0 + (int) Math.round((bottom - y) * shear);
                for (int x = start; x < start + strokeW; x++) {
                    if (x >= 0 && x < w) bits[y * w + x] = true;
                }
            }
        }
        return new BinaryMask(w, h, bits);
    }

    static BinaryMask maskOf(int w, int h, int... inkIndices) {
        boolean[] bits = new boolean[w * h];
        for (int i : inkIndices) bits[i] = true;
        return new BinaryMask(w, h, bits);
    }
}
