package com.flowmable.handwriting;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class RenderedDocumentTest {

    private static final class RecordingSink implements StrokeSink {
        final List<String> calls = new ArrayList<>();

        @Override
        public void moveTo(double x, double y) {
            calls.add("M");
        }

        @Override
        public void lineTo(double x, double y) {
            calls.add("L");
        }

        @Override
        public void quadraticCurveTo(double cx, double cy, double x, double y) {
            calls.add("Q");
        }

        @Override
        public void stroke(InkColor color, double strokeWidth) {
            calls.add("S");
        }
    }

    private static RenderedDocument render(String text) {
        return new LayoutEngine(GlyphTemplateCatalog.defaultCatalog(), RenderSettings.DEFAULT)
                .layout(StyleDescriptor.DEFAULT.withJitter(0), text, 5);
    }

    @Test
    void replay_segmentsThenOneStrokePerGlyph() {
        RenderedDocument doc = render("hi there");
        RecordingSink sink = new RecordingSink();
        doc.replay(sink);

        long strokes = sink.calls.stream().filter("S"::equals).count();
        assertEquals(doc.placements().size(), strokes);
        assertEquals(doc.drawCommands().size() + strokes, sink.calls.size());
        assertEquals("M", sink.calls.get(0));
        assertEquals("S", sink.calls.get(sink.calls.size() - 1));
    }

    @Test
    void drawCommands_followGlyphOrder() {
        RenderedDocument doc = render("xy");
        List<DrawCommand> commands = doc.drawCommands();
        assertEquals(PathSegment.Kind.MOVE, commands.get(0).kind());
        int firstGlyphSegments = 0;
        for (List<PathSegment> stroke : doc.placements().get(0).strokes()) {
            firstGlyphSegments += stroke.size();
        }
        assertEquals(doc.placements().get(1).strokes().get(0).get(0), commands.get(firstGlyphSegments).segment());
    }

    @Test
    void skippedDocument_isEmpty() {
        RenderedDocument doc = RenderedDocument.skipped();
        RecordingSink sink = new RecordingSink();
        doc.replay(sink);
        assertTrue(doc.isSkipped());
        assertFalse(doc.truncated());
        assertTrue(doc.placements().isEmpty());
        assertTrue(sink.calls.isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> render("a").placements().clear());
    }

    @Test
    void svg_onePathPerGlyph() {
        InkColor ink = new InkColor(0x12, 0x34, 0x56);
        RenderedDocument doc = new LayoutEngine(GlyphTemplateCatalog.defaultCatalog(), RenderSettings.DEFAULT)
                .layout(StyleDescriptor.DEFAULT.withInkColor(ink), "Hello, world", 8);
        String svg = SvgStrokeSink.toSvg(doc);

        assertTrue(svg.startsWith("<svg xmlns=\"http://www.w3.org/2000/svg\" width=\"1200\" height=\"1600\""));
        assertEquals(doc.placements().size(), svg.split("<path ", -1).length - 1);
        assertTrue(svg.contains("stroke=\"#123456\""));
        assertTrue(svg.trim().endsWith("</svg>"));
    }

    @Test
    void ruledLines_replayBeforeGlyphs() {
        RenderedDocument doc = new LayoutEngine(GlyphTemplateCatalog.defaultCatalog(),
                RenderSettings.DEFAULT.withCanvas(400, 300).withRuledLines(true))
                .layout(StyleDescriptor.DEFAULT.withJitter(0), "lined", 5);
        int rules = doc.ruledLines().size();
        assertTrue(rules > 0);

        RecordingSink sink = new RecordingSink();
        doc.replay(sink);
        assertEquals(List.of("M", "L", "S"), sink.calls.subList(0, 3));
        assertEquals(rules + doc.placements().size(), sink.calls.stream().filter("S"::equals).count());

        String svg = SvgStrokeSink.toSvg(doc);
        assertEquals(rules + doc.placements().size(), svg.split("<path ", -1).length - 1);
        assertTrue(svg.contains("stroke=\"#E0E0E0\" stroke-width=\"0.5\""));
    }

    @Test
    void rasterizedDocument_hasInkOnPaper() {
        RenderedDocument doc = render("ink");
        java.awt.image.BufferedImage image = Graphics2DStrokeSink.rasterize(doc, 300, 200);
        assertEquals(0xFFFFFF, image.getRGB(299, 199) & 0xFFFFFF);
        boolean inked = false;
        for (int y = 0; y < 200 && !inked; y++) {
            for (int x = 0; x < 300 && !inked; x++) {
                inked = (image.getRGB(x, y) & 0xFFFFFF) != 0xFFFFFF;
            }
        }
        assertTrue(inked);
    }
}
