package com.flowmable.handwriting;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class CharacterSegmenterTest {

    private final Binarizer binarizer = new Binarizer(AnalysisSettings.DEFAULT);
    private final LineSegmenter lineSegmenter = new LineSegmenter(AnalysisSettings.DEFAULT);
    private final CharacterSegmenter segmenter = new CharacterSegmenter(AnalysisSettings.DEFAULT);

    @Test
    void glyphRun_becomesBoxes() {
        BufferedImage img = SampleImages.glyphRow(400, 300, 20, 100, 5, 12, 20, 8);
        BinaryMask mask = binarizer.binarize(RasterImage.of(img));
        List<Integer> lines = lineSegmenter.findLines(mask);
        assertEquals(1, lines.size());

        List<CharacterBoundingBox> boxes = segmenter.segment(mask, lines);
        assertEquals(5, boxes.size());
        for (int i = 0; i < 5; i++) {
            CharacterBoundingBox box = boxes.get(i);
            assertEquals(20 + i * 20, box.x());
            assertEquals(100, box.y());
            assertEquals(12, box.width());
            assertEquals(20, box.height());
        }
    }

    @Test
    void specksAndOversizedRuns_areDiscarded() {
        BufferedImage img = SampleImages.glyphRow(400, 300, 20, 100, 3, 12, 20, 8);
        SampleImages.fill(img, 300, 125, 2, 2, SampleImages.BLACK);      // speck
        SampleImages.fill(img, 150, 104, 120, 10, SampleImages.BLACK);   // underline-like run
        BinaryMask mask = binarizer.binarize(RasterImage.of(img));

        List<CharacterBoundingBox> boxes = segmenter.segment(mask, List.of(109));
        assertEquals(3, boxes.size());
        for (CharacterBoundingBox box : boxes) {
            assertTrue(box.width() >= 4 && box.width() <= 99);
            assertTrue(box.height() >= 4 && box.height() <= 99);
        }
    }

    @Test
    void lineBands_splitHalfwayBetweenLines() {
        BufferedImage img = SampleImages.blank(200, 200);
        SampleImages.fill(img, 10, 40, 10, 20, SampleImages.BLACK);
        SampleImages.fill(img, 10, 120, 10, 20, SampleImages.BLACK);
        BinaryMask mask = binarizer.binarize(RasterImage.of(img));

        List<List<CharacterBoundingBox>> byLine = segmenter.segmentByLine(mask, List.of(50, 130));
        assertEquals(2, byLine.size());
        assertEquals(List.of(new CharacterBoundingBox(10, 40, 10, 20)), byLine.get(0));
        assertEquals(List.of(new CharacterBoundingBox(10, 120, 10, 20)), byLine.get(1));
    }

    @Test
    void noLines_noCharacters() {
        BinaryMask mask = binarizer.binarize(RasterImage.of(SampleImages.glyphRow(100, 100, 10, 10, 2, 10, 10, 5)));
        assertTrue(segmenter.segment(mask, List.of()).isEmpty());
    }
}
