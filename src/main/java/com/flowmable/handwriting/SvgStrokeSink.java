package com.flowmable.handwriting;

import java.util.Locale;

/**
 * Serializes a {@link RenderedDocument} as a standalone SVG document, one
 * {@code <path>} per glyph.
 */
public class SvgStrokeSink implements StrokeSink {

    private final StringBuilder body = new StringBuilder();
    private final StringBuilder path = new StringBuilder();
    private final double width;
    private final double height;

    public SvgStrokeSink(double width, double height) {
        this.width = width;
        this.height = height;
    }

    public static String toSvg(RenderedDocument document) {
        SvgStrokeSink sink = new SvgStrokeSink(document.canvasWidth(), document.canvasHeight());
        document.replay(sink);
        return sink.toSvg();
    }

    @Override
    public void moveTo(double x, double y) {
        append("M", x, y);
    }

    @Override
    public void lineTo(double x, double y) {
        append("L", x, y);
    }

    @Override
    public void quadraticCurveTo(double cx, double cy, double x, double y) {
        append("Q", cx, cy, x, y);
    }

    @Override
    public void stroke(InkColor color, double strokeWidth) {
        if (path.length() > 0) {
            body.append("  <path d=\"").append(path).append("\" stroke=\"").append(color.toHex())
                    .append("\" stroke-width=\"").append(PathParser.num(strokeWidth)).append("\"/>\n");
        }
        path.setLength(0);
    }

    public String toSvg() {
        return String.format(Locale.ROOT,
                "<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"%s\" height=\"%s\" viewBox=\"0 0 %s %s\">\n"
                        + "<g fill=\"none\" stroke-linecap=\"round\" stroke-linejoin=\"round\">\n"
                        + "%s"
                        + "</g>\n"
                        + "</svg>\n",
                PathParser.num(width), PathParser.num(height), PathParser.num(width), PathParser.num(height), body);
    }

    private void append(String command, double... coordinates) {
        if (path.length() > 0) path.append(' ');
        path.append(command);
        for (double c : coordinates) {
            path.append(' ').append(PathParser.num(c));
        }
    }
}
