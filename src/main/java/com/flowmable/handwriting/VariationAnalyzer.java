package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Measures baseline wobble, edge jitter, pen pressure and glyph width spread.
 */
public class VariationAnalyzer {

    private static final Logger logger = LogManager.getLogger(VariationAnalyzer.class);

    static final double JITTER_SCALE = 2.0;
    static final int PRESSURE_SAMPLE_ROWS = 50;
    static final double MAX_WIDTH_VARIATION = 0.3;
    private static final int MIN_CHARACTERS_FOR_WIDTH = 3;

    private final Fidelity fidelity;

    public VariationAnalyzer(AnalysisSettings settings) {
        this.fidelity = settings.fidelity();
    }

    public VariationStats analyze(BinaryMask mask, BinaryMask edges,
                                  List<CharacterBoundingBox> characters, List<Integer> lines) {
        return new VariationStats(
                baselineVariation(lines),
                jitter(edges),
                pressure(mask),
                widthVariation(characters));
    }

    double baselineVariation(List<Integer> lines) {
        if (lines.size() < 2) {
            logger.debug("{} line(s) found; baseline variation falls back to {}",
                    lines.size(), VariationStats.FALLBACK.baselineVariation());
            return VariationStats.FALLBACK.baselineVariation();
        }
        double[] spacings = new double[lines.size() - 1];
        for (int i = 1; i < lines.size(); i++) {
            spacings[i - 1] = lines.get(i) - lines.get(i - 1);
        }
        return dispersion(spacings);
    }

    double jitter(BinaryMask edges) {
        int total = 0;
        int isolated = 0;
        for (int y = 0; y < edges.height(); y++) {
            for (int x = 0; x < edges.width(); x++) {
                if (!edges.isInk(x, y)) continue;
                total++;
                if (edgeNeighbours(edges, x, y) < 2) isolated++;
            }
        }
        if (total == 0) {
            logger.debug("Edge map is empty; jitter falls back to {}", VariationStats.FALLBACK.jitter());
            return VariationStats.FALLBACK.jitter();
        }
        return (double) isolated / total * JITTER_SCALE;
    }

    private static int edgeNeighbours(BinaryMask edges, int x, int y) {
        int count = 0;
        for (int dy = -1; dy <= 1; dy++) {
            for (int dx = -1; dx <= 1; dx++) {
                if ((dx != 0 || dy != 0) && edges.isInkOrFalse(x + dx, y + dy)) count++;
            }
        }
        return count;
    }

    double pressure(BinaryMask mask) {
        int step = Math.max(1, mask.height() / PRESSURE_SAMPLE_ROWS);
        List<Double> densities = new ArrayList<>();
        for (int i = 0; i < PRESSURE_SAMPLE_ROWS; i++) {
            int y = i * step;
            if (y >= mask.height()) break;
            double density = (double) mask.rowInkCount(y) / mask.width();
            if (density > 0) densities.add(density);
        }
        if (densities.isEmpty()) {
            logger.debug("No inked sample rows; pressure falls back to {}", VariationStats.FALLBACK.pressure());
            return VariationStats.FALLBACK.pressure();
        }
        double[] values = Stats.toArray(densities);
        double max = 0;
        for (double v : values) max = Math.max(max, v);
        return Math.min(1.0, Stats.median(values) / max);
    }

    double widthVariation(List<CharacterBoundingBox> characters) {
        if (characters.size() < MIN_CHARACTERS_FOR_WIDTH) {
            logger.debug("{} character(s) found; width variation falls back to {}",
                    characters.size(), VariationStats.FALLBACK.widthVariation());
            return VariationStats.FALLBACK.widthVariation();
        }
        double[] widths = new double[characters.size()];
        for (int i = 0; i < widths.length; i++) {
            widths[i] = characters.get(i).width();
        }
        double typical = Stats.center(widths, fidelity);
        double[] relative = new double[widths.length];
        for (int i = 0; i < widths.length; i++) {
            relative[i] = Math.abs(widths[i] - typical) / typical;
        }
        return Math.min(MAX_WIDTH_VARIATION, Stats.center(relative, fidelity));
    }

    /** Median absolute deviation from the median, or mean absolute deviation from the mean. */
    private double dispersion(double[] values) {
        double typical = Stats.center(values, fidelity);
        double[] deviations = new double[values.length];
        for (int i = 0; i < values.length; i++) {
            deviations[i] = Math.abs(values[i] - typical);
        }
        return Stats.center(deviations, fidelity);
    }
}
