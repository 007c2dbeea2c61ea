package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.awt.geom.AffineTransform;
import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Flows text onto the canvas word by word and places one varied glyph per
 * character.
 * <p>
 * The cursor starts at the top-left margin corner. A word that would cross the
 * right margin moves to the next line unless it already starts a line. Only a
 * word wider than the whole printable width is broken between characters. Once
 * a new line would start below the bottom margin, layout stops and the document
 * is marked truncated.
 * <p>
 * With ruling enabled, guide lines are laid every {@code lineSpacing} from the
 * first baseline down to the bottom margin.
 */
public class LayoutEngine {

    private static final Logger logger = LogManager.getLogger(LayoutEngine.class);

    private static final double ENTRY_STROKE_CHANCE = 0.3;
    private static final double EXIT_STROKE_CHANCE = 0.4;
    private static final List<PathSegment> ENTRY_STROKE =
            List.of(PathSegment.moveTo(-0.1, 0.5), PathSegment.lineTo(0, 0.5));
    private static final List<PathSegment> EXIT_STROKE =
            List.of(PathSegment.moveTo(1.0, 0.5), PathSegment.lineTo(1.1, 0.5));

    private final GlyphTemplateCatalog catalog;
    private final RenderSettings settings;

    public LayoutEngine(GlyphTemplateCatalog catalog, RenderSettings settings) {
        this.catalog = catalog;
        this.settings = settings;
    }

    public RenderedDocument layout(StyleDescriptor style, String text, long seed) {
        if (style == null || text == null || text.isBlank()) {
            logger.debug("Nothing to lay out (style present: {}, text blank: {})",
                    style != null, text == null || text.isBlank());
            return RenderedDocument.skipped();
        }
        Random rng = new Random(seed);
        VariationModel model = new VariationModel(style, settings);
        Cursor cursor = new Cursor();
        List<PlacedGlyph> placements = new ArrayList<>();

        double printableWidth = settings.right() - settings.left();

        words:
        for (String word : text.trim().split("\\s+")) {
            int[] codePoints = word.codePoints().toArray();
            double naturalWidth = 0;
            for (int cp : codePoints) {
                naturalWidth += advance(cp, style);
            }
            double wordWidth = naturalWidth * settings.wordCompression();
            boolean breakable = naturalWidth > printableWidth;

            if (cursor.x + wordWidth > settings.right() && cursor.x > settings.left()) {
                if (!cursor.newLine(rng)) break;
            }

            for (int i = 0; i < codePoints.length; i++) {
                double baseAdvance = advance(codePoints[i], style);
                if (breakable && cursor.x + baseAdvance > settings.right() && cursor.x > settings.left()) {
                    if (!cursor.newLine(rng)) break words;
                }
                placements.add(place(codePoints[i], cursor.x, cursor.y, i == 0, i == codePoints.length - 1,
                        style, model, rng));
                double wv = style.widthVariation();
                cursor.x += baseAdvance * (1 + rng.nextDouble() * wv - wv / 2);
            }
            cursor.x += style.spaceWidth() * VariationModel.uniform(rng, settings.spaceMin(), settings.spaceMax());
        }

        if (cursor.truncated) {
            logger.info("Layout reached the bottom margin after {} glyph(s); remaining text dropped",
                    placements.size());
        }
        return RenderedDocument.rendered(ruledLines(style), placements, cursor.truncated,
                settings.canvasWidth(), settings.canvasHeight(), seed);
    }

    List<RuledLine> ruledLines(StyleDescriptor style) {
        List<RuledLine> rules = new ArrayList<>();
        if (!settings.ruledLines()) {
            return rules;
        }
        for (double y = settings.top() + style.characterHeight(); y <= settings.bottom(); y += style.lineSpacing()) {
            rules.add(new RuledLine(settings.left(), settings.right(), y));
        }
        return rules;
    }

    /** Horizontal advance before width variation. */
    static double advance(int codePoint, StyleDescriptor style) {
        return advanceFactor(codePoint) * style.characterWidth();
    }

    static double advanceFactor(int codePoint) {
        switch (codePoint) {
            case 'i':
            case 'l':
            case 't':
                return 0.3;
            case 'm':
            case 'w':
                return 1.4;
            case 'f':
            case 'j':
            case 'p':
            case 'q':
            case 'y':
                return 0.8;
            default:
                return 1.0;
        }
    }

    private PlacedGlyph place(int codePoint, double x, double y, boolean first, boolean last,
                              StyleDescriptor style, VariationModel model, Random rng) {
        GlyphClass glyphClass = GlyphClass.of(codePoint);
        double boxWidth = glyphClass.widthFactor() * style.characterWidth();
        double boxHeight = glyphClass.heightFactor() * style.characterHeight();

        GlyphTransform transform = model.nextTransform(rng);

        List<List<PathSegment>> unit = new ArrayList<>();
        boolean connectors = settings.connectorStrokes()
                && settings.fidelity() == Fidelity.ENHANCED
                && glyphClass == GlyphClass.LOWERCASE;
        if (connectors && first && rng.nextDouble() > ENTRY_STROKE_CHANCE) {
            unit.add(ENTRY_STROKE);
        }
        unit.addAll(catalog.lookup(codePoint).strokes());
        if (connectors && last && rng.nextDouble() > EXIT_STROKE_CHANCE) {
            unit.add(EXIT_STROKE);
        }

        List<List<PathSegment>> local = new ArrayList<>(unit.size());
        for (List<PathSegment> stroke : unit) {
            List<PathSegment> scaled = new ArrayList<>(stroke.size());
            for (PathSegment segment : stroke) {
                scaled.add(segment.scaled(boxWidth, boxHeight));
            }
            local.add(scaled);
        }
        local = model.jitter(local, rng);

        // Short glyph boxes sit on the bottom of the character cell
        AffineTransform toCanvas = new AffineTransform();
        toCanvas.translate(x, y + transform.yOffset() + (style.characterHeight() - boxHeight));
        toCanvas.rotate(transform.rotation());
        toCanvas.scale(transform.scale(), transform.scale());

        List<List<PathSegment>> resolved = new ArrayList<>(local.size());
        for (List<PathSegment> stroke : local) {
            List<PathSegment> placed = new ArrayList<>(stroke.size());
            for (PathSegment segment : stroke) {
                placed.add(segment.transformed(toCanvas));
            }
            resolved.add(placed);
        }
        return new PlacedGlyph(codePoint, x, y, transform, style.inkColor(), resolved);
    }

    private final class Cursor {
        double x = settings.left();
        double y = settings.top();
        boolean truncated;

        /** @return false once the new line would start below the bottom margin */
        boolean newLine(Random rng) {
            x = settings.left();
            y += settings.baseLineHeight() * (1 + rng.nextDouble() * settings.lineAdvanceSpread());
            if (y > settings.bottom()) {
                truncated = true;
                return false;
            }
            return true;
        }
    }
}
