package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.IOException;
import java.nio.file.Path;

/**
 * Entry point: analyze a handwriting sample into a {@link StyleDescriptor}, then
 * render arbitrary text in that style.
 * <p>
 * Both operations are stateless; one instance may serve concurrent calls as long
 * as each call gets its own seed.
 */
public class HandwritingSynthesizer {

    private static final Logger logger = LogManager.getLogger(HandwritingSynthesizer.class);

    private final StyleAnalyzer analyzer;
    private final LayoutEngine layoutEngine;
    private final RenderSettings renderSettings;

    public HandwritingSynthesizer() {
        this(AnalysisSettings.DEFAULT, RenderSettings.DEFAULT, GlyphTemplateCatalog.defaultCatalog());
    }

    public HandwritingSynthesizer(AnalysisSettings analysisSettings, RenderSettings renderSettings) {
        this(analysisSettings, renderSettings, GlyphTemplateCatalog.defaultCatalog());
    }

    public HandwritingSynthesizer(AnalysisSettings analysisSettings, RenderSettings renderSettings,
                                  GlyphTemplateCatalog catalog) {
        this.analyzer = new StyleAnalyzer(analysisSettings);
        this.renderSettings = renderSettings;
        this.layoutEngine = new LayoutEngine(catalog, renderSettings);
    }

    public StyleDescriptor analyze(RasterImage image) {
        return analyzer.analyze(image);
    }

    /**
     * @param recognizedText Text an external recognizer read from the sample; may be
     *                       null or empty
     */
    public StyleDescriptor analyze(RasterImage image, String recognizedText) {
        return analyzer.analyze(image, recognizedText);
    }

    /**
     * Decode and analyze an image file.
     *
     * @throws IOException if the file cannot be read or is not a supported image
     */
    public StyleDescriptor analyze(Path imageFile) throws IOException {
        BufferedImage image = ImageIO.read(imageFile.toFile());
        if (image == null) {
            throw new IOException("Unsupported or corrupt image: " + imageFile);
        }
        logger.info("Analyzing {} ({}x{})", imageFile, image.getWidth(), image.getHeight());
        return analyze(RasterImage.of(image));
    }

    /** Style to use when no valid sample is available. */
    public StyleDescriptor defaultStyle() {
        return StyleDescriptor.DEFAULT;
    }

    public RenderedDocument generate(StyleDescriptor style, String text, long seed) {
        RenderedDocument document = layoutEngine.layout(style, text, seed);
        logger.debug("Generated {} with seed {}", document, seed);
        return document;
    }

    /** Uses the configured seed, or a time-derived one when none is configured. */
    public RenderedDocument generate(StyleDescriptor style, String text) {
        Long configured = renderSettings.seed();
        long seed = configured != null ? configured : System.nanoTime();
        return generate(style, text, seed);
    }

    public RenderSettings renderSettings() {
        return renderSettings;
    }

    public AnalysisSettings analysisSettings() {
        return analyzer.settings();
    }
}
