package com.flowmable.handwriting;

/**
 * Coarse character categories. Each has a drawing box relative to the style's
 * character width and height.
 */
public enum GlyphClass {
    LOWERCASE(0.7, 0.5),
    UPPERCASE(1.0, 1.0),
    DIGIT(0.8, 1.0),
    PUNCTUATION(0.3, 1.0);

    private final double widthFactor;
    private final double heightFactor;

    GlyphClass(double widthFactor, double heightFactor) {
        this.widthFactor = widthFactor;
        this.heightFactor = heightFactor;
    }

    public double widthFactor() {
        return widthFactor;
    }

    public double heightFactor() {
        return heightFactor;
    }

    public static GlyphClass of(int codePoint) {
        if (Character.isLowerCase(codePoint)) return LOWERCASE;
        if (Character.isUpperCase(codePoint)) return UPPERCASE;
        if (Character.isDigit(codePoint)) return DIGIT;
        return PUNCTUATION;
    }
}
