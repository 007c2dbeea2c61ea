package com.flowmable.handwriting;

import java.util.List;

/**
 * A horizontal guide line drawn under the text, as on ruled paper.
 *
 * @param x0 Left end
 * @param x1 Right end
 * @param y  Vertical position
 */
public record RuledLine(double x0, double x1, double y) {

    public List<PathSegment> segments() {
        return List.of(PathSegment.moveTo(x0, y), PathSegment.lineTo(x1, y));
    }
}
