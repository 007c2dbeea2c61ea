package com.flowmable.handwriting;

import java.awt.geom.AffineTransform;
import java.awt.geom.Point2D;

/**
 * One drawing primitive. For {@link Kind#QUAD} ({@code cx}, {@code cy}) is the
 * control point; otherwise both are zero.
 */
public record PathSegment(Kind kind, double cx, double cy, double x, double y) {

    public enum Kind {
        MOVE,
        LINE,
        QUAD
    }

    public static PathSegment moveTo(double x, double y) {
        return new PathSegment(Kind.MOVE, 0, 0, x, y);
    }

    public static PathSegment lineTo(double x, double y) {
        return new PathSegment(Kind.LINE, 0, 0, x, y);
    }

    public static PathSegment quadTo(double cx, double cy, double x, double y) {
        return new PathSegment(Kind.QUAD, cx, cy, x, y);
    }

    public PathSegment scaled(double sx, double sy) {
        return new PathSegment(kind, cx * sx, cy * sy, x * sx, y * sy);
    }

    public PathSegment transformed(AffineTransform transform) {
        Point2D end = transform.transform(new Point2D.Double(x, y), null);
        if (kind != Kind.QUAD) {
            return new PathSegment(kind, 0, 0, end.getX(), end.getY());
        }
        Point2D control = transform.transform(new Point2D.Double(cx, cy), null);
        return new PathSegment(kind, control.getX(), control.getY(), end.getX(), end.getY());
    }

    /** Replays this segment onto {@code sink}. */
    public void emit(StrokeSink sink) {
        switch (kind) {
            case MOVE:
                sink.moveTo(x, y);
                break;
            case LINE:
                sink.lineTo(x, y);
                break;
            case QUAD:
                sink.quadraticCurveTo(cx, cy, x, y);
                break;
        }
    }
}
