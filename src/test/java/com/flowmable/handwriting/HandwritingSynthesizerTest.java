package com.flowmable.handwriting;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class HandwritingSynthesizerTest {

    private final HandwritingSynthesizer synthesizer = new HandwritingSynthesizer();

    @Test
    void blankText_isSkipped() {
        assertTrue(synthesizer.generate(synthesizer.defaultStyle(), " ").isSkipped());
        assertEquals(StyleDescriptor.DEFAULT, synthesizer.defaultStyle());
    }

    @Test
    void configuredSeed_generationIsRepeatable() {
        HandwritingSynthesizer seeded = new HandwritingSynthesizer(
                AnalysisSettings.DEFAULT, RenderSettings.DEFAULT.withSeed(99L));
        RenderedDocument a = seeded.generate(StyleDescriptor.DEFAULT, "same every time");
        RenderedDocument b = seeded.generate(StyleDescriptor.DEFAULT, "same every time");
        assertEquals(99L, a.seed());
        assertEquals(a.drawCommands(), b.drawCommands());
    }

    @Test
    void renderedStyle_survivesReanalysis() {
        InkColor ink = new InkColor(20, 30, 140);
        StyleDescriptor style = StyleDescriptor.DEFAULT.withInkColor(ink).withStrokeWidth(4).withJitter(0);
        RenderSettings settings = RenderSettings.DEFAULT.withCanvas(600, 300).withMargins(20, 20, 20, 20);
        HandwritingSynthesizer s = new HandwritingSynthesizer(AnalysisSettings.DEFAULT, settings);

        RenderedDocument doc = s.generate(style, "hello world from a pen", 17);
        BufferedImage image = Graphics2DStrokeSink.rasterize(doc, 600, 300);
        StyleDescriptor analyzed = s.analyze(RasterImage.of(image));

        assertTrue(analyzed.inkColor().distanceTo(ink) < 80, "ink " + analyzed.inkColor());
        assertTrue(analyzed.inkColor().blue() > analyzed.inkColor().red());
    }

    @Test
    void imageFile_analyzedLikeRaster(@TempDir Path dir) throws Exception {
        BufferedImage page = SampleImages.horizontalBands(400, 400, 10, 200);
        Path png = dir.resolve("sample.png");
        ImageIO.write(page, "png", png.toFile());

        StyleDescriptor fromFile = synthesizer.analyze(png);
        assertEquals(synthesizer.analyze(RasterImage.of(page)), fromFile);
    }

    @Test
    void nonImageFile_throwsIOException(@TempDir Path dir) throws Exception {
        Path text = dir.resolve("notes.png");
        Files.writeString(text, "not really a png");
        assertThrows(IOException.class, () -> synthesizer.analyze(text));
        assertThrows(IOException.class, () -> synthesizer.analyze(dir.resolve("missing.png")));
    }

    @Test
    void settings_areExposed() {
        HandwritingSynthesizer basic = new HandwritingSynthesizer(
                AnalysisSettings.DEFAULT.withFidelity(Fidelity.BASIC), RenderSettings.DEFAULT.forFidelity(Fidelity.BASIC));
        assertEquals(Fidelity.BASIC, basic.analysisSettings().fidelity());
        assertEquals(Fidelity.BASIC, basic.renderSettings().fidelity());
    }
}
