package com.flowmable.handwriting;

import java.awt.BasicStroke;
import java.awt.Color;
import java.awt.Graphics2D;
import java.awt.RenderingHints;
import java.awt.geom.Path2D;
import java.awt.image.BufferedImage;

/**
 * Draws a {@link RenderedDocument} through Java2D with round caps and joins.
 */
public class Graphics2DStrokeSink implements StrokeSink {

    private final Graphics2D graphics;
    private Path2D.Double path = new Path2D.Double();

    public Graphics2DStrokeSink(Graphics2D graphics) {
        this.graphics = graphics;
        graphics.setRenderingHint(RenderingHints.KEY_ANTIALIASING, RenderingHints.VALUE_ANTIALIAS_ON);
        graphics.setRenderingHint(RenderingHints.KEY_STROKE_CONTROL, RenderingHints.VALUE_STROKE_PURE);
    }

    /** Paper-white canvas with the document drawn on it. */
    public static BufferedImage rasterize(RenderedDocument document, int width, int height) {
        BufferedImage image = new BufferedImage(width, height, BufferedImage.TYPE_INT_RGB);
        Graphics2D g = image.createGraphics();
        try {
            g.setColor(Color.WHITE);
            g.fillRect(0, 0, width, height);
            document.replay(new Graphics2DStrokeSink(g));
        } finally {
            g.dispose();
        }
        return image;
    }

    @Override
    public void moveTo(double x, double y) {
        path.moveTo(x, y);
    }

    @Override
    public void lineTo(double x, double y) {
        path.lineTo(x, y);
    }

    @Override
    public void quadraticCurveTo(double cx, double cy, double x, double y) {
        path.quadTo(cx, cy, x, y);
    }

    @Override
    public void stroke(InkColor color, double width) {
        graphics.setColor(new Color(color.red(), color.green(), color.blue()));
        graphics.setStroke(new BasicStroke((float) width, BasicStroke.CAP_ROUND, BasicStroke.JOIN_ROUND));
        graphics.draw(path);
        path = new Path2D.Double();
    }
}
