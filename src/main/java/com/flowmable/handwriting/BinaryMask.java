package com.flowmable.handwriting;

import java.util.Arrays;

/**
 * Immutable width × height boolean grid; {@code true} marks ink.
 * Also used for edge maps, where {@code true} marks an edge pixel.
 */
public final class BinaryMask {

    private static final int INK_RGB = 0x000000;
    private static final int PAPER_RGB = 0xFFFFFF;

    private final int width;
    private final int height;
    private final boolean[] bits;

    /**
     * @param bits row-major cells, copied
     */
    public BinaryMask(int width, int height, boolean[] bits) {
        this(bits.clone(), width, height);
    }

    private BinaryMask(boolean[] bits, int width, int height) {
        if (width <= 0 || height <= 0) {
            throw new InvalidInputException("Mask must be non-empty, got " + width + "x" + height);
        }
        if (bits.length != width * height) {
            throw new InvalidInputException("Expected " + (width * height) + " cells, got " + bits.length);
        }
        this.width = width;
        this.height = height;
        this.bits = bits;
    }

    /** Takes ownership of {@code bits}; callers must not touch the array afterwards. */
    static BinaryMask wrap(int width, int height, boolean[] bits) {
        return new BinaryMask(bits, width, height);
    }

    public int width() {
        return width;
    }

    public int height() {
        return height;
    }

    public boolean isInk(int x, int y) {
        return bits[y * width + x];
    }

    /** Out-of-bounds coordinates read as background. */
    public boolean isInkOrFalse(int x, int y) {
        return x >= 0 && y >= 0 && x < width && y < height && bits[y * width + x];
    }

    public int inkCount() {
        int count = 0;
        for (boolean b : bits) {
            if (b) count++;
        }
        return count;
    }

    public int rowInkCount(int y) {
        int count = 0;
        int base = y * width;
        for (int x = 0; x < width; x++) {
            if (bits[base + x]) count++;
        }
        return count;
    }

    /**
     * Reinterpret as a two-level image: ink is black, background is white.
     */
    public RasterImage toRaster() {
        int[] rgb = new int[bits.length];
        for (int i = 0; i < bits.length; i++) {
            rgb[i] = bits[i] ? INK_RGB : PAPER_RGB;
        }
        return RasterImage.ofPixels(width, height, rgb);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof BinaryMask)) return false;
        BinaryMask other = (BinaryMask) o;
        return width == other.width && height == other.height && Arrays.equals(bits, other.bits);
    }

    @Override
    public int hashCode() {
        return 31 * (31 * width + height) + Arrays.hashCode(bits);
    }

    @Override
    public String toString() {
        return "BinaryMask[" + width + "x" + height + ", ink=" + inkCount() + "]";
    }
}
