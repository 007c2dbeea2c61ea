package com.flowmable.handwriting;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits each text line band into glyph runs by column occupancy.
 * <p>
 * A line's band reaches halfway to its neighbouring lines; where there is no
 * neighbour it extends half of {@code lastLineBandHeight}. Runs whose width or
 * height lies outside [{@code minCharDimension}, {@code maxCharDimension}] are
 * noise and are dropped.
 */
public class CharacterSegmenter {

    private final int minDimension;
    private final int maxDimension;
    private final int openBandHalf;

    public CharacterSegmenter(AnalysisSettings settings) {
        this.minDimension = settings.minCharDimension();
        this.maxDimension = settings.maxCharDimension();
        this.openBandHalf = settings.lastLineBandHeight() / 2;
    }

    public List<CharacterBoundingBox> segment(BinaryMask mask, List<Integer> lines) {
        List<CharacterBoundingBox> all = new ArrayList<>();
        for (List<CharacterBoundingBox> line : segmentByLine(mask, lines)) {
            all.addAll(line);
        }
        return all;
    }

    /** One list per entry of {@code lines}, in the same order, boxes left to right. */
    public List<List<CharacterBoundingBox>> segmentByLine(BinaryMask mask, List<Integer> lines) {
        List<List<CharacterBoundingBox>> result = new ArrayList<>(lines.size());
        for (int i = 0; i < lines.size(); i++) {
            int line = lines.get(i);
            int top = i == 0 ? line - openBandHalf : (lines.get(i - 1) + line) / 2;
            int bottom = i == lines.size() - 1 ? line + openBandHalf + 1 : (line + lines.get(i + 1)) / 2;
            top = Math.max(0, top);
            bottom = Math.min(mask.height(), bottom);
            result.add(top < bottom ? scanBand(mask, top, bottom) : new ArrayList<>());
        }
        return result;
    }

    /** Rows [top, bottom). */
    private List<CharacterBoundingBox> scanBand(BinaryMask mask, int top, int bottom) {
        List<CharacterBoundingBox> boxes = new ArrayList<>();
        int width = mask.width();
        int runStart = -1;
        for (int x = 0; x <= width; x++) {
            boolean occupied = x < width && columnHasInk(mask, x, top, bottom);
            if (occupied && runStart < 0) {
                runStart = x;
            } else if (!occupied && runStart >= 0) {
                CharacterBoundingBox box = measure(mask, runStart, x, top, bottom);
                if (accepted(box)) {
                    boxes.add(box);
                }
                runStart = -1;
            }
        }
        return boxes;
    }

    private static boolean columnHasInk(BinaryMask mask, int x, int top, int bottom) {
        for (int y = top; y < bottom; y++) {
            if (mask.isInk(x, y)) return true;
        }
        return false;
    }

    private static CharacterBoundingBox measure(BinaryMask mask, int startX, int endX, int top, int bottom) {
        int minY = Integer.MAX_VALUE;
        int maxY = Integer.MIN_VALUE;
        for (int x = startX; x < endX; x++) {
            for (int y = top; y < bottom; y++) {
                if (mask.isInk(x, y)) {
                    minY = Math.min(minY, y);
                    maxY = Math.max(maxY, y);
                }
            }
        }
        return new CharacterBoundingBox(startX, minY, endX - startX, maxY - minY + 1);
    }

    private boolean accepted(CharacterBoundingBox box) {
        return box.width() >= minDimension && box.width() <= maxDimension
                && box.height() >= minDimension && box.height() <= maxDimension;
    }
}
