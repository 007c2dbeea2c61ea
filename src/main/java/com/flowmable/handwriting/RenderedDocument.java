package com.flowmable.handwriting;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Output of one synthesis call: optional ruled guide lines, then placed glyphs
 * in emission order.
 */
public final class RenderedDocument {

    public enum Status {
        /** Layout ran; the document may still be empty or truncated. */
        RENDERED,
        /** Nothing to do: blank text or no style. */
        SKIPPED
    }

    public static final InkColor RULE_COLOR = new InkColor(0xE0, 0xE0, 0xE0);
    public static final double RULE_WIDTH = 0.5;

    private static final RenderedDocument SKIPPED_DOCUMENT = new RenderedDocument(
            Status.SKIPPED, Collections.emptyList(), Collections.emptyList(), false, 0, 0, 0L);

    private final Status status;
    private final List<RuledLine> ruledLines;
    private final List<PlacedGlyph> placements;
    private final boolean truncated;
    private final double canvasWidth;
    private final double canvasHeight;
    private final long seed;

    private RenderedDocument(Status status, List<RuledLine> ruledLines, List<PlacedGlyph> placements,
                             boolean truncated, double canvasWidth, double canvasHeight, long seed) {
        this.status = status;
        this.ruledLines = List.copyOf(ruledLines);
        this.placements = Collections.unmodifiableList(new ArrayList<>(placements));
        this.truncated = truncated;
        this.canvasWidth = canvasWidth;
        this.canvasHeight = canvasHeight;
        this.seed = seed;
    }

    public static RenderedDocument skipped() {
        return SKIPPED_DOCUMENT;
    }

    static RenderedDocument rendered(List<RuledLine> ruledLines, List<PlacedGlyph> placements, boolean truncated,
                                     double canvasWidth, double canvasHeight, long seed) {
        return new RenderedDocument(Status.RENDERED, ruledLines, placements, truncated,
                canvasWidth, canvasHeight, seed);
    }

    public Status status() {
        return status;
    }

    public boolean isSkipped() {
        return status == Status.SKIPPED;
    }

    /** True when layout stopped at the bottom margin before the text ran out. */
    public boolean truncated() {
        return truncated;
    }

    /** Guide lines, empty unless ruling was enabled. */
    public List<RuledLine> ruledLines() {
        return ruledLines;
    }

    public List<PlacedGlyph> placements() {
        return placements;
    }

    public double canvasWidth() {
        return canvasWidth;
    }

    public double canvasHeight() {
        return canvasHeight;
    }

    public long seed() {
        return seed;
    }

    public List<DrawCommand> drawCommands() {
        List<DrawCommand> commands = new ArrayList<>();
        for (RuledLine rule : ruledLines) {
            for (PathSegment segment : rule.segments()) {
                commands.add(new DrawCommand(segment, RULE_COLOR, RULE_WIDTH));
            }
        }
        for (PlacedGlyph glyph : placements) {
            for (List<PathSegment> stroke : glyph.strokes()) {
                for (PathSegment segment : stroke) {
                    commands.add(new DrawCommand(segment, glyph.color(), glyph.strokeWidth()));
                }
            }
        }
        return commands;
    }

    /**
     * Emits each ruled line, then each glyph's path, each followed by one
     * {@link StrokeSink#stroke} call.
     */
    public void replay(StrokeSink sink) {
        for (RuledLine rule : ruledLines) {
            for (PathSegment segment : rule.segments()) {
                segment.emit(sink);
            }
            sink.stroke(RULE_COLOR, RULE_WIDTH);
        }
        for (PlacedGlyph glyph : placements) {
            for (List<PathSegment> stroke : glyph.strokes()) {
                for (PathSegment segment : stroke) {
                    segment.emit(sink);
                }
            }
            sink.stroke(glyph.color(), glyph.strokeWidth());
        }
    }

    @Override
    public String toString() {
        return "RenderedDocument[" + status + ", glyphs=" + placements.size()
                + (truncated ? ", truncated" : "") + "]";
    }
}
