package com.flowmable.handwriting;

/**
 * Rendering backend for {@link RenderedDocument#replay}. Path primitives build the
 * current glyph's path; {@link #stroke} draws and clears it.
 */
public interface StrokeSink {

    void moveTo(double x, double y);

    void lineTo(double x, double y);

    void quadraticCurveTo(double cx, double cy, double x, double y);

    void stroke(InkColor color, double width);
}
