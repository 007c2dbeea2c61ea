package com.flowmable.handwriting;

/**
 * An opaque sRGB ink colour.
 *
 * @param red   Red channel (0–255)
 * @param green Green channel (0–255)
 * @param blue  Blue channel (0–255)
 */
public record InkColor(int red, int green, int blue) {

    public static final InkColor BLACK = new InkColor(0, 0, 0);

    public InkColor {
        checkChannel("red", red);
        checkChannel("green", green);
        checkChannel("blue", blue);
    }

    /** Build from a packed {@code 0xRRGGBB} (alpha bits are ignored). */
    public static InkColor fromRgb(int rgb) {
        return new InkColor((rgb >> 16) & 0xFF, (rgb >> 8) & 0xFF, rgb & 0xFF);
    }

    /** Parse {@code #RRGGBB} or {@code RRGGBB}. */
    public static InkColor fromHex(String hex) {
        String digits = hex.startsWith("#") ? hex.substring(1) : hex;
        if (digits.length() != 6) {
            throw new InvalidInputException("Expected #RRGGBB, got: " + hex);
        }
        try {
            return fromRgb(Integer.parseInt(digits, 16));
        } catch (NumberFormatException e) {
            throw new InvalidInputException("Expected #RRGGBB, got: " + hex, e);
        }
    }

    public int toRgb() {
        return (red << 16) | (green << 8) | blue;
    }

    /** Packed ARGB with full opacity. */
    public int toArgb() {
        return 0xFF000000 | toRgb();
    }

    public String toHex() {
        return String.format("#%06X", toRgb());
    }

    /** Euclidean distance in RGB space. */
    public double distanceTo(InkColor other) {
        int dr = red - other.red;
        int dg = green - other.green;
        int db = blue - other.blue;
        return Math.sqrt(dr * dr + dg * dg + db * db);
    }

    private static void checkChannel(String name, int value) {
        if (value < 0 || value > 255) {
            throw new InvalidInputException(name + " channel out of range [0, 255]: " + value);
        }
    }
}
