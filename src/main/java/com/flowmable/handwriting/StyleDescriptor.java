package com.flowmable.handwriting;

/**
 * Numeric summary of a handwriting sample. Fully determines synthesis for a given
 * text and seed.
 *
 * @param inkColor          Estimated ink colour
 * @param strokeWidth       Pen width in pixels (&gt; 0)
 * @param slant             Stroke lean in radians, positive leans right
 * @param characterHeight   Typical glyph height in pixels (&gt; 0)
 * @param characterWidth    Typical glyph width in pixels (&gt; 0)
 * @param spaceWidth        Typical gap between glyphs of a line (&gt; 0)
 * @param lineSpacing       Typical distance between lines (&gt; 0)
 * @param baselineVariation Line spacing dispersion in pixels (≥ 0)
 * @param jitter            Positional noise std-dev in pixels (≥ 0)
 * @param pressure          Relative ink density [0, 1]
 * @param widthVariation    Relative glyph width spread [0, 0.3]
 */
public record StyleDescriptor(
        InkColor inkColor,
        double strokeWidth,
        double slant,
        double characterHeight,
        double characterWidth,
        double spaceWidth,
        double lineSpacing,
        double baselineVariation,
        double jitter,
        double pressure,
        double widthVariation
) {

    /** Used when no usable sample exists. */
    public static final StyleDescriptor DEFAULT = new StyleDescriptor(
            InkColor.BLACK,
            2.0,    // strokeWidth
            0.0,    // slant
            30.0,   // characterHeight
            20.0,   // characterWidth
            10.0,   // spaceWidth
            40.0,   // lineSpacing
            2.0,    // baselineVariation
            0.5,    // jitter
            0.8,    // pressure
            0.1     // widthVariation
    );

    public static final double MAX_WIDTH_VARIATION = 0.3;

    public StyleDescriptor {
        if (inkColor == null) {
            throw new InvalidInputException("inkColor is required");
        }
        requirePositive("strokeWidth", strokeWidth);
        if (!Double.isFinite(slant)) {
            throw new InvalidInputException("slant must be finite: " + slant);
        }
        requirePositive("characterHeight", characterHeight);
        requirePositive("characterWidth", characterWidth);
        requirePositive("spaceWidth", spaceWidth);
        requirePositive("lineSpacing", lineSpacing);
        requireRange("baselineVariation", baselineVariation, 0, Double.MAX_VALUE);
        requireRange("jitter", jitter, 0, Double.MAX_VALUE);
        requireRange("pressure", pressure, 0, 1);
        requireRange("widthVariation", widthVariation, 0, MAX_WIDTH_VARIATION);
    }

    public StyleDescriptor withInkColor(InkColor value) {
        return new StyleDescriptor(value, strokeWidth, slant, characterHeight, characterWidth, spaceWidth,
                lineSpacing, baselineVariation, jitter, pressure, widthVariation);
    }

    public StyleDescriptor withStrokeWidth(double value) {
        return new StyleDescriptor(inkColor, value, slant, characterHeight, characterWidth, spaceWidth,
                lineSpacing, baselineVariation, jitter, pressure, widthVariation);
    }

    public StyleDescriptor withSlant(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, value, characterHeight, characterWidth, spaceWidth,
                lineSpacing, baselineVariation, jitter, pressure, widthVariation);
    }

    public StyleDescriptor withCharacterHeight(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, slant, value, characterWidth, spaceWidth,
                lineSpacing, baselineVariation, jitter, pressure, widthVariation);
    }

    public StyleDescriptor withCharacterWidth(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, slant, characterHeight, value, spaceWidth,
                lineSpacing, baselineVariation, jitter, pressure, widthVariation);
    }

    public StyleDescriptor withSpaceWidth(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, slant, characterHeight, characterWidth, value,
                lineSpacing, baselineVariation, jitter, pressure, widthVariation);
    }

    public StyleDescriptor withLineSpacing(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, slant, characterHeight, characterWidth, spaceWidth,
                value, baselineVariation, jitter, pressure, widthVariation);
    }

    public StyleDescriptor withBaselineVariation(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, slant, characterHeight, characterWidth, spaceWidth,
                lineSpacing, value, jitter, pressure, widthVariation);
    }

    public StyleDescriptor withJitter(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, slant, characterHeight, characterWidth, spaceWidth,
                lineSpacing, baselineVariation, value, pressure, widthVariation);
    }

    public StyleDescriptor withPressure(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, slant, characterHeight, characterWidth, spaceWidth,
                lineSpacing, baselineVariation, jitter, value, widthVariation);
    }

    public StyleDescriptor withWidthVariation(double value) {
        return new StyleDescriptor(inkColor, strokeWidth, slant, characterHeight, characterWidth, spaceWidth,
                lineSpacing, baselineVariation, jitter, pressure, value);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new InvalidInputException(name + " must be positive and finite: " + value);
        }
    }

    private static void requireRange(String name, double value, double min, double max) {
        if (!(value >= min && value <= max)) {
            throw new InvalidInputException(name + " must be in [" + min + ", " + max + "]: " + value);
        }
    }
}
