package com.flowmable.handwriting;

/**
 * A path primitive in canvas coordinates, tagged with the pen of its glyph.
 */
public record DrawCommand(PathSegment segment, InkColor color, double strokeWidth) {

    public PathSegment.Kind kind() {
        return segment.kind();
    }
}
