package com.flowmable.handwriting;

/**
 * Irregularity measures of a handwriting sample.
 *
 * @param baselineVariation Dispersion of line spacing, in pixels
 * @param jitter            Edge roughness; 2 × fraction of isolated edge pixels
 * @param pressure          Typical over peak row ink density [0, 1]
 * @param widthVariation    Relative dispersion of glyph widths [0, 0.3]
 */
public record VariationStats(
        double baselineVariation,
        double jitter,
        double pressure,
        double widthVariation
) {
    public static final VariationStats FALLBACK = new VariationStats(2.0, 0.5, 0.8, 0.1);
}
