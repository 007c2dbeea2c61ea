package com.flowmable.handwriting;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;

import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.function.Supplier;

/**
 * JSON form of a {@link StyleDescriptor}, for saving an analyzed style and reusing
 * it later.
 * <p>
 * {@code inkColor} is stored as a packed ARGB integer. Absent fields take the
 * value of {@link StyleDescriptor#DEFAULT}; out-of-range fields are rejected.
 *
 * <pre>{@code
 * {
 *   "strokeWidth": 2.0,
 *   "inkColor": -16777216,
 *   "slant": 0.0,
 *   ...
 * }
 * }</pre>
 */
public final class StyleDescriptorJson {

    private static final Gson GSON = new GsonBuilder()
            .setPrettyPrinting()
            .create();

    private StyleDescriptorJson() {
    }

    public static String toJson(StyleDescriptor descriptor) {
        return GSON.toJson(Fields.from(descriptor));
    }

    public static void toJson(StyleDescriptor descriptor, Writer writer) {
        GSON.toJson(Fields.from(descriptor), writer);
    }

    public static StyleDescriptor fromJson(String json) {
        return parse(() -> GSON.fromJson(json, Fields.class));
    }

    public static StyleDescriptor fromJson(Reader reader) {
        return parse(() -> GSON.fromJson(reader, Fields.class));
    }

    public static StyleDescriptor load(Path path) throws IOException {
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return fromJson(reader);
        }
    }

    public static void save(StyleDescriptor descriptor, Path path) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.UTF_8)) {
            toJson(descriptor, writer);
        }
    }

    private static StyleDescriptor parse(Supplier<Fields> source) {
        Fields fields;
        try {
            fields = source.get();
        } catch (JsonParseException e) {
            throw new InvalidInputException("Malformed style descriptor JSON: " + e.getMessage(), e);
        }
        if (fields == null) {
            throw new InvalidInputException("Style descriptor JSON is empty");
        }
        return fields.toDescriptor();
    }

    static final class Fields {
        @SerializedName("strokeWidth")
        Double strokeWidth;

        @SerializedName("inkColor")
        Integer inkColor;

        @SerializedName("slant")
        Double slant;

        @SerializedName("characterHeight")
        Double characterHeight;

        @SerializedName("characterWidth")
        Double characterWidth;

        @SerializedName("spaceWidth")
        Double spaceWidth;

        @SerializedName("lineSpacing")
        Double lineSpacing;

        @SerializedName("baselineVariation")
        Double baselineVariation;

        @SerializedName("jitter")
        Double jitter;

        @SerializedName("pressure")
        Double pressure;

        @SerializedName("widthVariation")
        Double widthVariation;

        static Fields from(StyleDescriptor d) {
            Fields f = new Fields();
            f.strokeWidth = d.strokeWidth();
            f.inkColor = d.inkColor().toArgb();
            f.slant = d.slant();
            f.characterHeight = d.characterHeight();
            f.characterWidth = d.characterWidth();
            f.spaceWidth = d.spaceWidth();
            f.lineSpacing = d.lineSpacing();
            f.baselineVariation = d.baselineVariation();
            f.jitter = d.jitter();
            f.pressure = d.pressure();
            f.widthVariation = d.widthVariation();
            return f;
        }

        StyleDescriptor toDescriptor() {
            StyleDescriptor d = StyleDescriptor.DEFAULT;
            return new StyleDescriptor(
                    inkColor != null ? InkColor.fromRgb(inkColor) : d.inkColor(),
                    or(strokeWidth, d.strokeWidth()),
                    or(slant, d.slant()),
                    or(characterHeight, d.characterHeight()),
                    or(characterWidth, d.characterWidth()),
                    or(spaceWidth, d.spaceWidth()),
                    or(lineSpacing, d.lineSpacing()),
                    or(baselineVariation, d.baselineVariation()),
                    or(jitter, d.jitter()),
                    or(pressure, d.pressure()),
                    or(widthVariation, d.widthVariation()));
        }

        private static double or(Double value, double fallback) {
            return value != null ? value : fallback;
        }
    }
}
