package com.flowmable.handwriting;

import java.util.List;

/**
 * One character instance on the canvas.
 *
 * @param codePoint Character drawn
 * @param originX   Left edge of the glyph cell
 * @param originY   Top of the line the glyph sits on
 * @param transform Variation applied to this instance
 * @param color     Ink colour
 * @param strokes   Resolved geometry in canvas coordinates
 */
public record PlacedGlyph(
        int codePoint,
        double originX,
        double originY,
        GlyphTransform transform,
        InkColor color,
        List<List<PathSegment>> strokes
) {

    public PlacedGlyph {
        strokes = List.copyOf(strokes);
    }

    public String character() {
        return new String(Character.toChars(codePoint));
    }

    public double rotation() {
        return transform.rotation();
    }

    public double scale() {
        return transform.scale();
    }

    public double strokeWidth() {
        return transform.strokeWidth();
    }
}
