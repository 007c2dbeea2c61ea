package com.flowmable.handwriting;

import org.junit.jupiter.api.Test;

import java.awt.image.BufferedImage;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class StyleAnalyzerTest {

    private final StyleAnalyzer analyzer = new StyleAnalyzer();

    @Test
    void singleBand_endToEnd() {
        BufferedImage img = SampleImages.horizontalBands(400, 400, 10, 200);
        RasterImage raster = RasterImage.of(img);

        StyleDescriptor style = analyzer.analyze(raster);

        assertEquals(InkColor.BLACK, style.inkColor());
        assertEquals(10.0, style.strokeWidth(), 2.0);
        assertEquals(0.0, style.slant(), 0.02);

        BinaryMask mask = new Binarizer(AnalysisSettings.DEFAULT).binarize(raster);
        List<Integer> lines = new LineSegmenter(AnalysisSettings.DEFAULT).findLines(mask);
        assertEquals(1, lines.size());
        assertEquals(200, lines.get(0), 5);
    }

    @Test
    void blankPage_yieldsFallbacks() {
        StyleDescriptor style = analyzer.analyze(RasterImage.of(SampleImages.blank(100, 80)));
        StyleDescriptor d = StyleDescriptor.DEFAULT;
        assertEquals(d.inkColor(), style.inkColor());
        assertEquals(d.strokeWidth(), style.strokeWidth());
        assertEquals(0.0, style.slant());
        assertEquals(d.characterHeight(), style.characterHeight());
        assertEquals(d.characterWidth(), style.characterWidth());
        assertEquals(d.spaceWidth(), style.spaceWidth());
        assertEquals(d.lineSpacing(), style.lineSpacing());
        assertEquals(d.baselineVariation(), style.baselineVariation());
        assertEquals(d.jitter(), style.jitter());
        assertEquals(d.pressure(), style.pressure());
        assertEquals(d.widthVariation(), style.widthVariation());
    }

    @Test
    void glyphRow_metrics() {
        BufferedImage img = SampleImages.glyphRow(400, 300, 20, 100, 5, 12, 20, 8);
        StyleDescriptor style = analyzer.analyze(RasterImage.of(img));

        assertEquals(20.0, style.characterHeight());
        assertEquals(12.0, style.characterWidth());
        assertEquals(8.0, style.spaceWidth());
        assertEquals(0.0, style.widthVariation());
        assertEquals(40.0, style.lineSpacing());
    }

    @Test
    void recognizedText_blendsCharacterWidth() {
        BufferedImage img = SampleImages.glyphRow(400, 300, 20, 100, 5, 12, 20, 8);
        // ink spans x = 20..111, so 91 / 5 = 18.2 per character
        StyleDescriptor style = analyzer.analyze(RasterImage.of(img), "hello");
        assertEquals(0.5 * 12 + 0.5 * 18.2, style.characterWidth(), 1e-9);

        StyleDescriptor ignored = analyzer.analyze(RasterImage.of(img), "");
        assertEquals(12.0, ignored.characterWidth());
    }

    @Test
    void recognizedTextWithoutCharacters_keepsFallbackWidth() {
        // a full-width band is a line but too wide to be a character
        BufferedImage img = SampleImages.horizontalBands(400, 400, 10, 200);
        StyleDescriptor style = analyzer.analyze(RasterImage.of(img), "hello");
        assertEquals(StyleDescriptor.DEFAULT.characterWidth(), style.characterWidth());
    }

    @Test
    void twoLines_giveLineSpacing() {
        BufferedImage img = SampleImages.blank(300, 300);
        for (int i = 0; i < 4; i++) {
            SampleImages.fill(img, 20 + i * 20, 60, 12, 20, SampleImages.BLACK);
            SampleImages.fill(img, 20 + i * 20, 150, 12, 20, SampleImages.BLACK);
        }
        StyleDescriptor style = analyzer.analyze(RasterImage.of(img));
        assertEquals(90.0, style.lineSpacing(), 1.0);
        assertEquals(20.0, style.characterHeight());
    }

    @Test
    void basicFidelity_validDescriptor() {
        StyleAnalyzer basic = new StyleAnalyzer(AnalysisSettings.DEFAULT.withFidelity(Fidelity.BASIC));
        BufferedImage img = SampleImages.glyphRow(400, 300, 20, 100, 5, 12, 20, 8);
        StyleDescriptor style = basic.analyze(RasterImage.of(img));
        assertEquals(12.0, style.characterWidth(), 1e-9);
        assertEquals(20.0, style.characterHeight(), 1e-9);
        assertEquals(InkColor.BLACK, style.inkColor());
    }

    @Test
    void zeroSizedRaster_isRejected() {
        RasterImage empty = new RasterImage() {
            @Override
            public int width() {
                return 0;
            }

            @Override
            public int height() {
                return 10;
            }

            @Override
            public int rgb(int x, int y) {
                throw new IndexOutOfBoundsException();
            }
        };
        assertThrows(InvalidInputException.class, () -> analyzer.analyze(empty));
        assertThrows(InvalidInputException.class, () -> RasterImage.ofPixels(0, 0, new int[0]));
    }

    @Test
    void inkExtent_spansLeftmostToRightmostColumn() {
        BinaryMask mask = SampleImages.maskOf(20, 2, 3, 20 + 17);
        assertEquals(14, StyleAnalyzer.inkExtent(mask));
        assertEquals(0, StyleAnalyzer.inkExtent(new BinaryMask(4, 4, new boolean[16])));
    }
}
