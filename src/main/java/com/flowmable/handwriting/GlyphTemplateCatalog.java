package com.flowmable.handwriting;

import com.google.gson.Gson;
import com.google.gson.JsonParseException;
import com.google.gson.annotations.SerializedName;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.Map;

/**
 * Read-only mapping from characters to glyph templates.
 * <p>
 * Lookup tries the exact character, then its {@link GlyphClass}, then the
 * fallback template, so it never fails. The JSON source has the shape:
 *
 * <pre>{@code
 * {
 *   "fallback": "M 0 0.5 Q 0.5 0 1 0.5",
 *   "classes": { "LOWERCASE": "...", "UPPERCASE": "...", "DIGIT": "...", "PUNCTUATION": "..." },
 *   "glyphs":  { "a": "...", "B": "...", "7": "..." }
 * }
 * }</pre>
 */
public final class GlyphTemplateCatalog {

    private static final Logger logger = LogManager.getLogger(GlyphTemplateCatalog.class);

    public static final String DEFAULT_RESOURCE = "glyph-templates.json";
    static final String FALLBACK_KEY = "fallback";

    private static final Gson GSON = new Gson();

    private final Map<Integer, GlyphTemplate> glyphs;
    private final Map<GlyphClass, GlyphTemplate> classes;
    private final GlyphTemplate fallback;

    private GlyphTemplateCatalog(Map<Integer, GlyphTemplate> glyphs,
                                 Map<GlyphClass, GlyphTemplate> classes,
                                 GlyphTemplate fallback) {
        this.glyphs = Collections.unmodifiableMap(glyphs);
        this.classes = Collections.unmodifiableMap(classes);
        this.fallback = fallback;
    }

    private static final class DefaultHolder {
        static final GlyphTemplateCatalog INSTANCE = fromResource(DEFAULT_RESOURCE);
    }

    /** The bundled catalog, loaded on first use. */
    public static GlyphTemplateCatalog defaultCatalog() {
        return DefaultHolder.INSTANCE;
    }

    public static GlyphTemplateCatalog fromResource(String resource) {
        InputStream in = GlyphTemplateCatalog.class.getClassLoader().getResourceAsStream(resource);
        if (in == null) {
            throw new InvalidInputException("Glyph template resource not found: " + resource);
        }
        try (Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
            GlyphTemplateCatalog catalog = load(reader);
            logger.debug("Loaded {} glyph templates from {}", catalog.size(), resource);
            return catalog;
        } catch (IOException e) {
            throw new UncheckedIOException("Failed to read glyph templates from " + resource, e);
        }
    }

    public static GlyphTemplateCatalog load(Reader reader) {
        Source source;
        try {
            source = GSON.fromJson(reader, Source.class);
        } catch (JsonParseException e) {
            throw new InvalidInputException("Malformed glyph template catalog: " + e.getMessage(), e);
        }
        if (source == null) {
            throw new InvalidInputException("Glyph template catalog is empty");
        }
        if (source.fallback == null || source.fallback.isBlank()) {
            throw new InvalidInputException("Glyph template catalog has no fallback entry");
        }
        GlyphTemplate fallback = GlyphTemplate.parse(FALLBACK_KEY, source.fallback);

        Map<GlyphClass, GlyphTemplate> classes = new EnumMap<>(GlyphClass.class);
        if (source.classes != null) {
            for (Map.Entry<String, String> e : source.classes.entrySet()) {
                GlyphClass glyphClass;
                try {
                    glyphClass = GlyphClass.valueOf(e.getKey());
                } catch (IllegalArgumentException ex) {
                    throw new InvalidInputException("Unknown glyph class: " + e.getKey(), ex);
                }
                classes.put(glyphClass, GlyphTemplate.parse(e.getKey(), e.getValue()));
            }
        }

        Map<Integer, GlyphTemplate> glyphs = new HashMap<>();
        if (source.glyphs != null) {
            for (Map.Entry<String, String> e : source.glyphs.entrySet()) {
                String key = e.getKey();
                if (key.codePointCount(0, key.length()) != 1) {
                    throw new InvalidInputException("Glyph key must be a single character: '" + key + "'");
                }
                glyphs.put(key.codePointAt(0), GlyphTemplate.parse(key, e.getValue()));
            }
        }
        return new GlyphTemplateCatalog(glyphs, classes, fallback);
    }

    public GlyphTemplate lookup(int codePoint) {
        GlyphTemplate exact = glyphs.get(codePoint);
        if (exact != null) {
            return exact;
        }
        GlyphTemplate byClass = classes.get(GlyphClass.of(codePoint));
        return byClass != null ? byClass : fallback;
    }

    public GlyphTemplate fallback() {
        return fallback;
    }

    public boolean hasExact(int codePoint) {
        return glyphs.containsKey(codePoint);
    }

    /** Number of templates, including class and fallback entries. */
    public int size() {
        return glyphs.size() + classes.size() + 1;
    }

    private static final class Source {
        @SerializedName("fallback")
        String fallback;

        @SerializedName("classes")
        Map<String, String> classes;

        @SerializedName("glyphs")
        Map<String, String> glyphs;
    }
}
