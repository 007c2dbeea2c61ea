package com.flowmable.handwriting;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * Stochastic per-glyph variation driven by a caller-supplied {@link Random}.
 * <p>
 * Draw order per glyph is fixed (rotation, scale, vertical offset, stroke width,
 * then jitter noise) so that a seed reproduces a document exactly.
 */
public class VariationModel {

    private static final int QUAD_FLATTEN_STEPS = 16;

    private final StyleDescriptor style;
    private final RenderSettings settings;

    public VariationModel(StyleDescriptor style, RenderSettings settings) {
        this.style = style;
        this.settings = settings;
    }

    public GlyphTransform nextTransform(Random rng) {
        double rotationRange = settings.rotationSpread() * Math.abs(style.slant());
        double rotation = uniform(rng, -rotationRange, rotationRange);
        double scale = uniform(rng, settings.scaleMin(), settings.scaleMax());
        double offsetRange = settings.baselineSpread() * style.baselineVariation() / 2;
        double yOffset = uniform(rng, -offsetRange, offsetRange);
        double strokeWidth = style.strokeWidth() * uniform(rng, settings.pressureMin(), settings.pressureMax());
        return new GlyphTransform(rotation, scale, yOffset, strokeWidth);
    }

    /**
     * Resample each stroke at {@code jitterStep} and displace every sample by
     * independent Gaussian noise with std-dev {@code jitter}. Strokes come back as
     * polylines. With zero jitter the input is returned untouched and no random
     * numbers are drawn.
     */
    public List<List<PathSegment>> jitter(List<List<PathSegment>> strokes, Random rng) {
        double sigma = style.jitter();
        if (sigma == 0) {
            return strokes;
        }
        List<List<PathSegment>> out = new ArrayList<>(strokes.size());
        for (List<PathSegment> stroke : strokes) {
            List<double[]> samples = resample(flatten(stroke), settings.jitterStep());
            List<PathSegment> noisy = new ArrayList<>(samples.size());
            for (int i = 0; i < samples.size(); i++) {
                double x = samples.get(i)[0] + rng.nextGaussian() * sigma;
                double y = samples.get(i)[1] + rng.nextGaussian() * sigma;
                noisy.add(i == 0 ? PathSegment.moveTo(x, y) : PathSegment.lineTo(x, y));
            }
            out.add(noisy);
        }
        return out;
    }

    static double uniform(Random rng, double min, double max) {
        return min + (max - min) * rng.nextDouble();
    }

    /** Polyline approximation; quadratic curves are split into equal parameter steps. */
    static List<double[]> flatten(List<PathSegment> stroke) {
        List<double[]> points = new ArrayList<>();
        double px = 0;
        double py = 0;
        for (PathSegment s : stroke) {
            switch (s.kind()) {
                case MOVE:
                case LINE:
                    points.add(new double[]{s.x(), s.y()});
                    break;
                case QUAD:
                    for (int k = 1; k <= QUAD_FLATTEN_STEPS; k++) {
                        double t = (double) k / QUAD_FLATTEN_STEPS;
                        double mt = 1 - t;
                        double x = mt * mt * px + 2 * mt * t * s.cx() + t * t * s.x();
                        double y = mt * mt * py + 2 * mt * t * s.cy() + t * t * s.y();
                        points.add(new double[]{x, y});
                    }
                    break;
            }
            px = s.x();
            py = s.y();
        }
        return points;
    }

    /** Points every {@code step} along the polyline, always keeping both ends. */
    static List<double[]> resample(List<double[]> polyline, double step) {
        List<double[]> out = new ArrayList<>();
        if (polyline.isEmpty()) {
            return out;
        }
        double[] first = polyline.get(0);
        out.add(first);
        double carried = 0;
        for (int i = 1; i < polyline.size(); i++) {
            double[] a = polyline.get(i - 1);
            double[] b = polyline.get(i);
            double length = Math.hypot(b[0] - a[0], b[1] - a[1]);
            if (length == 0) continue;
            double along = step - carried;
            while (along <= length) {
                double t = along / length;
                out.add(new double[]{a[0] + (b[0] - a[0]) * t, a[1] + (b[1] - a[1]) * t});
                along += step;
            }
            carried = length - (along - step);
        }
        double[] last = polyline.get(polyline.size() - 1);
        double[] tail = out.get(out.size() - 1);
        if (out.size() == 1 || tail[0] != last[0] || tail[1] != last[1]) {
            out.add(last);
        }
        return out;
    }
}
