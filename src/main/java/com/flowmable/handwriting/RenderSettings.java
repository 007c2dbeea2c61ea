package com.flowmable.handwriting;

/**
 * Canvas geometry and variation ranges used by synthesis.
 *
 * @param canvasWidth       Canvas width in pixels
 * @param canvasHeight      Canvas height in pixels
 * @param marginLeft        Left margin; lines start here
 * @param marginTop         Top margin; the first line starts here
 * @param marginRight       Right margin; words wrap against {@code canvasWidth - marginRight}
 * @param marginBottom      Bottom margin; layout stops once a line would start below it
 * @param baseLineHeight    Line advance before the random spread
 * @param lineAdvanceSpread Line advance is {@code baseLineHeight × (1 + u × spread)}
 * @param wordCompression   Factor applied to the estimated word width when wrapping
 * @param scaleMin          Lower bound of the per-glyph scale
 * @param scaleMax          Upper bound of the per-glyph scale
 * @param pressureMin       Lower bound of the per-glyph stroke width multiplier
 * @param pressureMax       Upper bound of the per-glyph stroke width multiplier
 * @param spaceMin          Lower bound of the inter-word space multiplier
 * @param spaceMax          Upper bound of the inter-word space multiplier
 * @param rotationSpread    Rotation is uniform in ±{@code rotationSpread × slant}
 * @param baselineSpread    Vertical offset is uniform in ±{@code baselineSpread × baselineVariation / 2}
 * @param jitterStep        Arc-length step, in pixels, at which paths are resampled for jitter
 * @param connectorStrokes  Whether enhanced fidelity draws cursive entry and exit strokes
 * @param ruledLines        Whether to rule guide lines every {@code lineSpacing} of the style
 * @param fidelity          Synthesis variant
 * @param seed              Seed used when a caller does not pass one; null means time-derived
 */
public record RenderSettings(
        double canvasWidth,
        double canvasHeight,
        double marginLeft,
        double marginTop,
        double marginRight,
        double marginBottom,
        double baseLineHeight,
        double lineAdvanceSpread,
        double wordCompression,
        double scaleMin,
        double scaleMax,
        double pressureMin,
        double pressureMax,
        double spaceMin,
        double spaceMax,
        double rotationSpread,
        double baselineSpread,
        double jitterStep,
        boolean connectorStrokes,
        boolean ruledLines,
        Fidelity fidelity,
        Long seed
) {

    public static final double ENHANCED_ROTATION_SPREAD = 2.0;
    public static final double BASIC_ROTATION_SPREAD = 1.0;
    public static final double ENHANCED_JITTER_STEP = 1.5;
    public static final double BASIC_JITTER_STEP = 2.0;

    public static final RenderSettings DEFAULT = new RenderSettings(
            1200,  // canvasWidth
            1600,  // canvasHeight
            80,    // marginLeft
            80,    // marginTop
            80,    // marginRight
            80,    // marginBottom
            80,    // baseLineHeight
            0.15,  // lineAdvanceSpread
            0.9,   // wordCompression
            0.9,   // scaleMin
            1.1,   // scaleMax
            0.8,   // pressureMin
            1.2,   // pressureMax
            0.8,   // spaceMin
            1.2,   // spaceMax
            ENHANCED_ROTATION_SPREAD,
            1.5,   // baselineSpread
            ENHANCED_JITTER_STEP,
            true,  // connectorStrokes
            false, // ruledLines
            Fidelity.ENHANCED,
            null   // seed
    );

    public RenderSettings {
        requirePositive("canvasWidth", canvasWidth);
        requirePositive("canvasHeight", canvasHeight);
        requireNonNegative("marginLeft", marginLeft);
        requireNonNegative("marginTop", marginTop);
        requireNonNegative("marginRight", marginRight);
        requireNonNegative("marginBottom", marginBottom);
        if (marginLeft + marginRight >= canvasWidth) {
            throw new InvalidInputException("Horizontal margins leave no printable width");
        }
        if (marginTop + marginBottom >= canvasHeight) {
            throw new InvalidInputException("Vertical margins leave no printable height");
        }
        requirePositive("baseLineHeight", baseLineHeight);
        requireNonNegative("lineAdvanceSpread", lineAdvanceSpread);
        requirePositive("wordCompression", wordCompression);
        requireBand("scale", scaleMin, scaleMax);
        requireBand("pressure", pressureMin, pressureMax);
        requireBand("space", spaceMin, spaceMax);
        requireNonNegative("rotationSpread", rotationSpread);
        requireNonNegative("baselineSpread", baselineSpread);
        requirePositive("jitterStep", jitterStep);
        if (fidelity == null) {
            throw new InvalidInputException("fidelity is required");
        }
    }

    public double left() {
        return marginLeft;
    }

    public double right() {
        return canvasWidth - marginRight;
    }

    public double top() {
        return marginTop;
    }

    public double bottom() {
        return canvasHeight - marginBottom;
    }

    /**
     * Switch variant, resetting the fidelity-dependent rotation spread and jitter
     * step to that variant's defaults.
     */
    public RenderSettings forFidelity(Fidelity value) {
        boolean enhanced = value == Fidelity.ENHANCED;
        return new RenderSettings(canvasWidth, canvasHeight, marginLeft, marginTop, marginRight, marginBottom,
                baseLineHeight, lineAdvanceSpread, wordCompression, scaleMin, scaleMax, pressureMin, pressureMax,
                spaceMin, spaceMax,
                enhanced ? ENHANCED_ROTATION_SPREAD : BASIC_ROTATION_SPREAD,
                baselineSpread,
                enhanced ? ENHANCED_JITTER_STEP : BASIC_JITTER_STEP,
                connectorStrokes, ruledLines, value, seed);
    }

    public RenderSettings withCanvas(double width, double height) {
        return new RenderSettings(width, height, marginLeft, marginTop, marginRight, marginBottom,
                baseLineHeight, lineAdvanceSpread, wordCompression, scaleMin, scaleMax, pressureMin, pressureMax,
                spaceMin, spaceMax, rotationSpread, baselineSpread, jitterStep, connectorStrokes, ruledLines, fidelity, seed);
    }

    public RenderSettings withMargins(double left, double top, double right, double bottom) {
        return new RenderSettings(canvasWidth, canvasHeight, left, top, right, bottom,
                baseLineHeight, lineAdvanceSpread, wordCompression, scaleMin, scaleMax, pressureMin, pressureMax,
                spaceMin, spaceMax, rotationSpread, baselineSpread, jitterStep, connectorStrokes, ruledLines, fidelity, seed);
    }

    public RenderSettings withConnectorStrokes(boolean value) {
        return new RenderSettings(canvasWidth, canvasHeight, marginLeft, marginTop, marginRight, marginBottom,
                baseLineHeight, lineAdvanceSpread, wordCompression, scaleMin, scaleMax, pressureMin, pressureMax,
                spaceMin, spaceMax, rotationSpread, baselineSpread, jitterStep, value, ruledLines, fidelity, seed);
    }

    public RenderSettings withRuledLines(boolean value) {
        return new RenderSettings(canvasWidth, canvasHeight, marginLeft, marginTop, marginRight, marginBottom,
                baseLineHeight, lineAdvanceSpread, wordCompression, scaleMin, scaleMax, pressureMin, pressureMax,
                spaceMin, spaceMax, rotationSpread, baselineSpread, jitterStep, connectorStrokes, value, fidelity, seed);
    }

    public RenderSettings withSpaceBand(double min, double max) {
        return new RenderSettings(canvasWidth, canvasHeight, marginLeft, marginTop, marginRight, marginBottom,
                baseLineHeight, lineAdvanceSpread, wordCompression, scaleMin, scaleMax, pressureMin, pressureMax,
                min, max, rotationSpread, baselineSpread, jitterStep, connectorStrokes, ruledLines, fidelity, seed);
    }

    public RenderSettings withSeed(Long value) {
        return new RenderSettings(canvasWidth, canvasHeight, marginLeft, marginTop, marginRight, marginBottom,
                baseLineHeight, lineAdvanceSpread, wordCompression, scaleMin, scaleMax, pressureMin, pressureMax,
                spaceMin, spaceMax, rotationSpread, baselineSpread, jitterStep, connectorStrokes, ruledLines, fidelity, value);
    }

    private static void requirePositive(String name, double value) {
        if (!(value > 0) || !Double.isFinite(value)) {
            throw new InvalidInputException(name + " must be positive: " + value);
        }
    }

    private static void requireNonNegative(String name, double value) {
        if (!(value >= 0) || !Double.isFinite(value)) {
            throw new InvalidInputException(name + " must be non-negative: " + value);
        }
    }

    private static void requireBand(String name, double min, double max) {
        requirePositive(name + "Min", min);
        requirePositive(name + "Max", max);
        if (min > max) {
            throw new InvalidInputException(name + " band is inverted: [" + min + ", " + max + "]");
        }
    }
}
