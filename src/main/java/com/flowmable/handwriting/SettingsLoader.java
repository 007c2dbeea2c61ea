package com.flowmable.handwriting;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.Locale;
import java.util.Properties;
import java.util.Set;

/**
 * Reads {@link AnalysisSettings} and {@link RenderSettings} overrides from a
 * properties file. Keys are the record component names prefixed with
 * {@code analysis.} or {@code render.}; absent keys keep their defaults.
 *
 * <pre>
 * analysis.fidelity=BASIC
 * analysis.blockSize=21
 * render.canvasWidth=800
 * render.seed=42
 * </pre>
 */
public final class SettingsLoader {

    private static final Logger logger = LogManager.getLogger(SettingsLoader.class);

    public static final String DEFAULT_RESOURCE = "handwriting.properties";

    public record Settings(AnalysisSettings analysis, RenderSettings render) {
        public static final Settings DEFAULT = new Settings(AnalysisSettings.DEFAULT, RenderSettings.DEFAULT);
    }

    private SettingsLoader() {
    }

    public static Settings load(Path file) throws IOException {
        Properties props = new Properties();
        try (Reader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8)) {
            props.load(reader);
        }
        logger.info("Loaded {} setting(s) from {}", props.size(), file);
        return fromProperties(props);
    }

    /** Defaults overridden by the classpath resource, when present. */
    public static Settings loadDefault() throws IOException {
        try (InputStream in = SettingsLoader.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (in == null) {
                return Settings.DEFAULT;
            }
            Properties props = new Properties();
            props.load(in);
            return fromProperties(props);
        }
    }

    public static Settings fromProperties(Properties props) {
        Lookup r = new Lookup(props);
        AnalysisSettings a = AnalysisSettings.DEFAULT;
        AnalysisSettings analysis = new AnalysisSettings(
                r.fidelity("analysis.fidelity", a.fidelity()),
                r.integer("analysis.globalThreshold", a.globalThreshold()),
                r.integer("analysis.blockSize", a.blockSize()),
                r.decimal("analysis.thresholdOffset", a.thresholdOffset()),
                r.integer("analysis.darkPixelThreshold", a.darkPixelThreshold()),
                r.decimal("analysis.clusterMergeDistance", a.clusterMergeDistance()),
                r.integer("analysis.colorSampleSize", a.colorSampleSize()),
                r.decimal("analysis.edgeThreshold", a.edgeThreshold()),
                r.integer("analysis.houghVoteThreshold", a.houghVoteThreshold()),
                r.decimal("analysis.thetaStepDegrees", a.thetaStepDegrees()),
                r.decimal("analysis.maxSlantDegrees", a.maxSlantDegrees()),
                r.integer("analysis.minCharDimension", a.minCharDimension()),
                r.integer("analysis.maxCharDimension", a.maxCharDimension()),
                r.integer("analysis.lastLineBandHeight", a.lastLineBandHeight()),
                r.decimal("analysis.recognizedTextWeight", a.recognizedTextWeight()));

        // Fidelity first, so the variant defaults apply before explicit overrides
        RenderSettings d = RenderSettings.DEFAULT.forFidelity(r.fidelity("render.fidelity", RenderSettings.DEFAULT.fidelity()));
        RenderSettings render = new RenderSettings(
                r.decimal("render.canvasWidth", d.canvasWidth()),
                r.decimal("render.canvasHeight", d.canvasHeight()),
                r.decimal("render.marginLeft", d.marginLeft()),
                r.decimal("render.marginTop", d.marginTop()),
                r.decimal("render.marginRight", d.marginRight()),
                r.decimal("render.marginBottom", d.marginBottom()),
                r.decimal("render.baseLineHeight", d.baseLineHeight()),
                r.decimal("render.lineAdvanceSpread", d.lineAdvanceSpread()),
                r.decimal("render.wordCompression", d.wordCompression()),
                r.decimal("render.scaleMin", d.scaleMin()),
                r.decimal("render.scaleMax", d.scaleMax()),
                r.decimal("render.pressureMin", d.pressureMin()),
                r.decimal("render.pressureMax", d.pressureMax()),
                r.decimal("render.spaceMin", d.spaceMin()),
                r.decimal("render.spaceMax", d.spaceMax()),
                r.decimal("render.rotationSpread", d.rotationSpread()),
                r.decimal("render.baselineSpread", d.baselineSpread()),
                r.decimal("render.jitterStep", d.jitterStep()),
                r.bool("render.connectorStrokes", d.connectorStrokes()),
                r.bool("render.ruledLines", d.ruledLines()),
                d.fidelity(),
                r.seed("render.seed", d.seed()));

        for (String key : props.stringPropertyNames()) {
            if (!r.consumed.contains(key)) {
                logger.warn("Ignoring unknown setting '{}'", key);
            }
        }
        return new Settings(analysis, render);
    }

    private static final class Lookup {
        private final Properties props;
        private final Set<String> consumed = new HashSet<>();

        Lookup(Properties props) {
            this.props = props;
        }

        private String raw(String key) {
            consumed.add(key);
            String value = props.getProperty(key);
            return value == null ? null : value.trim();
        }

        int integer(String key, int fallback) {
            String value = raw(key);
            if (value == null) return fallback;
            try {
                return Integer.parseInt(value);
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Setting " + key + " is not an integer: " + value, e);
            }
        }

        double decimal(String key, double fallback) {
            String value = raw(key);
            if (value == null) return fallback;
            try {
                return Double.parseDouble(value);
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Setting " + key + " is not a number: " + value, e);
            }
        }

        boolean bool(String key, boolean fallback) {
            String value = raw(key);
            if (value == null) return fallback;
            if (value.equalsIgnoreCase("true")) return true;
            if (value.equalsIgnoreCase("false")) return false;
            throw new InvalidInputException("Setting " + key + " is not true/false: " + value);
        }

        Fidelity fidelity(String key, Fidelity fallback) {
            String value = raw(key);
            if (value == null) return fallback;
            try {
                return Fidelity.valueOf(value.toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                throw new InvalidInputException("Setting " + key + " must be BASIC or ENHANCED: " + value, e);
            }
        }

        Long seed(String key, Long fallback) {
            String value = raw(key);
            if (value == null || value.isEmpty()) return fallback;
            try {
                return Long.parseLong(value);
            } catch (NumberFormatException e) {
                throw new InvalidInputException("Setting " + key + " is not a long: " + value, e);
            }
        }
    }
}
