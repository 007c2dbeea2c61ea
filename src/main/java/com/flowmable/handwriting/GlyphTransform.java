package com.flowmable.handwriting;

/**
 * Per-instance variation of one placed glyph.
 *
 * @param rotation    Radians about the glyph origin
 * @param scale       Uniform scale about the glyph origin
 * @param yOffset     Vertical displacement from the line, in pixels
 * @param strokeWidth Resolved pen width for this glyph
 */
public record GlyphTransform(double rotation, double scale, double yOffset, double strokeWidth) {
}
