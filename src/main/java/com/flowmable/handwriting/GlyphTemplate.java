package com.flowmable.handwriting;

import java.util.ArrayList;
import java.util.List;

/**
 * Vector strokes of one character or character class in a unit box, v growing
 * downward. Coordinates may leave [0, 1] slightly for descenders and connectors.
 *
 * @param key     Character, class name, or {@code fallback}
 * @param strokes Ordered strokes, each starting with a move
 */
public record GlyphTemplate(String key, List<List<PathSegment>> strokes) {

    public GlyphTemplate {
        if (strokes == null || strokes.isEmpty()) {
            throw new InvalidInputException("Glyph template '" + key + "' has no strokes");
        }
        List<List<PathSegment>> copy = new ArrayList<>(strokes.size());
        for (List<PathSegment> stroke : strokes) {
            if (stroke.isEmpty() || stroke.get(0).kind() != PathSegment.Kind.MOVE) {
                throw new InvalidInputException("Glyph template '" + key + "' has a stroke without a leading move");
            }
            copy.add(List.copyOf(stroke));
        }
        strokes = List.copyOf(copy);
    }

    public static GlyphTemplate parse(String key, String pathData) {
        return new GlyphTemplate(key, PathParser.parse(pathData));
    }
}
