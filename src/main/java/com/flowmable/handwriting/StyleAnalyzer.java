package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Runs the full analysis pipeline on one sample image.
 * <p>
 * Every estimator has a fallback, so a descriptor is always produced for a
 * non-empty raster. Only a zero-sized raster is rejected.
 */
public class StyleAnalyzer {

    private static final Logger logger = LogManager.getLogger(StyleAnalyzer.class);

    private final AnalysisSettings settings;
    private final Binarizer binarizer;
    private final ColorClusterer colorClusterer;
    private final EdgeDetector edgeDetector;
    private final StrokeWidthEstimator strokeWidthEstimator;
    private final SlantEstimator slantEstimator;
    private final LineSegmenter lineSegmenter;
    private final CharacterSegmenter characterSegmenter;
    private final VariationAnalyzer variationAnalyzer;

    public StyleAnalyzer() {
        this(AnalysisSettings.DEFAULT);
    }

    public StyleAnalyzer(AnalysisSettings settings) {
        this.settings = settings;
        this.binarizer = new Binarizer(settings);
        this.colorClusterer = new ColorClusterer(settings);
        this.edgeDetector = new EdgeDetector(settings);
        this.strokeWidthEstimator = new StrokeWidthEstimator(settings);
        this.slantEstimator = new SlantEstimator(settings);
        this.lineSegmenter = new LineSegmenter(settings);
        this.characterSegmenter = new CharacterSegmenter(settings);
        this.variationAnalyzer = new VariationAnalyzer(settings);
    }

    public AnalysisSettings settings() {
        return settings;
    }

    public StyleDescriptor analyze(RasterImage image) {
        return analyze(image, null);
    }

    /**
     * @param recognizedText Text read from the sample by an external recognizer, or
     *                       null/empty when unavailable. Only refines character width.
     */
    public StyleDescriptor analyze(RasterImage image, String recognizedText) {
        if (image == null) {
            throw new InvalidInputException("image is required");
        }
        if (image.width() <= 0 || image.height() <= 0) {
            throw new InvalidInputException(
                    "Sample image must be non-empty, got " + image.width() + "x" + image.height());
        }
        long start = System.nanoTime();

        // 1. Ink colour straight from the pixels
        InkColor inkColor = colorClusterer.estimateInkColor(image);

        // 2. Binarize, edges
        BinaryMask mask = binarizer.binarize(image);
        BinaryMask edges = edgeDetector.detect(mask);

        // 3. Pen geometry
        double strokeWidth = strokeWidthEstimator.estimate(mask);
        double slant = slantEstimator.estimate(edges);

        // 4. Layout structure
        List<Integer> lines = lineSegmenter.findLines(mask);
        List<List<CharacterBoundingBox>> byLine = characterSegmenter.segmentByLine(mask, lines);
        List<CharacterBoundingBox> characters = new ArrayList<>();
        byLine.forEach(characters::addAll);

        // 5. Metrics
        CharacterMetrics metrics = measure(mask, lines, byLine, characters, recognizedText);

        // 6. Irregularity
        VariationStats variation = variationAnalyzer.analyze(mask, edges, characters, lines);

        StyleDescriptor descriptor = new StyleDescriptor(
                inkColor,
                strokeWidth,
                slant,
                metrics.height(),
                metrics.width(),
                metrics.spaceWidth(),
                metrics.lineSpacing(),
                variation.baselineVariation(),
                variation.jitter(),
                variation.pressure(),
                variation.widthVariation());

        logger.debug("Analyzed {}x{} sample ({}): {} line(s), {} character(s) in {} ms",
                image.width(), image.height(), settings.fidelity(), lines.size(), characters.size(),
                (System.nanoTime() - start) / 1_000_000);
        return descriptor;
    }

    record CharacterMetrics(double height, double width, double spaceWidth, double lineSpacing) {
    }

    CharacterMetrics measure(BinaryMask mask, List<Integer> lines, List<List<CharacterBoundingBox>> byLine,
                             List<CharacterBoundingBox> characters, String recognizedText) {
        Fidelity fidelity = settings.fidelity();
        StyleDescriptor fallback = StyleDescriptor.DEFAULT;

        double lineSpacing = fallback.lineSpacing();
        if (lines.size() > 1) {
            double[] spacings = new double[lines.size() - 1];
            for (int i = 1; i < lines.size(); i++) {
                spacings[i - 1] = lines.get(i) - lines.get(i - 1);
            }
            lineSpacing = Stats.center(spacings, fidelity);
        }

        double height = fallback.characterHeight();
        double width = fallback.characterWidth();
        if (!characters.isEmpty()) {
            double[] heights = new double[characters.size()];
            double[] widths = new double[characters.size()];
            for (int i = 0; i < characters.size(); i++) {
                heights[i] = characters.get(i).height();
                widths[i] = characters.get(i).width();
            }
            height = Stats.center(heights, fidelity);
            width = Stats.center(widths, fidelity);
        } else {
            logger.debug("No characters segmented; character metrics fall back to {}x{}", width, height);
        }

        if (!characters.isEmpty()) {
            width = blendRecognizedWidth(mask, width, recognizedText);
        }

        List<Double> gaps = new ArrayList<>();
        double maxGap = settings.maxCharDimension() / 2.0;
        for (List<CharacterBoundingBox> line : byLine) {
            for (int i = 1; i < line.size(); i++) {
                int gap = line.get(i).x() - line.get(i - 1).right();
                if (gap > 0 && gap < maxGap) gaps.add((double) gap);
            }
        }
        double spaceWidth;
        if (!gaps.isEmpty()) {
            spaceWidth = Stats.center(Stats.toArray(gaps), fidelity);
        } else if (!characters.isEmpty()) {
            spaceWidth = width * 0.5;
        } else {
            spaceWidth = fallback.spaceWidth();
        }

        return new CharacterMetrics(height, width, spaceWidth, lineSpacing);
    }

    private double blendRecognizedWidth(BinaryMask mask, double measured, String recognizedText) {
        if (recognizedText == null || recognizedText.isEmpty()) {
            return measured;
        }
        int inkWidth = inkExtent(mask);
        if (inkWidth <= 0) {
            return measured;
        }
        int length = recognizedText.codePointCount(0, recognizedText.length());
        double perCharacter = (double) inkWidth / length;
        double weight = settings.recognizedTextWeight();
        return (1 - weight) * measured + weight * perCharacter;
    }

    /** Horizontal distance between the leftmost and rightmost ink columns. */
    static int inkExtent(BinaryMask mask) {
        int minX = Integer.MAX_VALUE;
        int maxX = Integer.MIN_VALUE;
        for (int y = 0; y < mask.height(); y++) {
            for (int x = 0; x < mask.width(); x++) {
                if (mask.isInk(x, y)) {
                    minX = Math.min(minX, x);
                    maxX = Math.max(maxX, x);
                }
            }
        }
        return minX > maxX ? 0 : maxX - minX;
    }
}
