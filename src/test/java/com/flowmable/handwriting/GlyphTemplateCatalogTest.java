package com.flowmable.handwriting;

import org.junit.jupiter.api.Test;

import java.io.StringReader;

import static org.junit.jupiter.api.Assertions.*;

class GlyphTemplateCatalogTest {

    private static GlyphTemplateCatalog load(String json) {
        return GlyphTemplateCatalog.load(new StringReader(json));
    }

    @Test
    void bundledCatalog_coversBasicLatin() {
        GlyphTemplateCatalog catalog = GlyphTemplateCatalog.defaultCatalog();
        for (char c = 'a'; c <= 'z'; c++) {
            assertTrue(catalog.hasExact(c), "missing " + c);
        }
        for (char c = 'A'; c <= 'Z'; c++) {
            assertTrue(catalog.hasExact(c), "missing " + c);
        }
        for (char c = '0'; c <= '9'; c++) {
            assertTrue(catalog.hasExact(c), "missing " + c);
        }
        assertSame(catalog, GlyphTemplateCatalog.defaultCatalog());
    }

    @Test
    void lookup_exactThenClassThenFallback() {
        GlyphTemplateCatalog catalog = load("{"
                + "\"fallback\": \"M 0 0 L 1 1\","
                + "\"classes\": {\"LOWERCASE\": \"M 0 1 L 1 1\"},"
                + "\"glyphs\": {\"a\": \"M 0 0 L 0 1\"}}");

        assertEquals("a", catalog.lookup('a').key());
        assertEquals("LOWERCASE", catalog.lookup('b').key());
        assertEquals("LOWERCASE", catalog.lookup('é').key());
        assertSame(catalog.fallback(), catalog.lookup('Q'));
        assertEquals(GlyphTemplateCatalog.FALLBACK_KEY, catalog.fallback().key());
        assertEquals(GlyphTemplateCatalog.FALLBACK_KEY, catalog.lookup(0x1F600).key());
        assertEquals(3, catalog.size());
    }

    @Test
    void bundledCatalog_classifiesUnknownSymbols() {
        GlyphTemplateCatalog catalog = GlyphTemplateCatalog.defaultCatalog();
        assertFalse(catalog.hasExact('€'));
        assertEquals("PUNCTUATION", catalog.lookup('€').key());
        assertEquals("UPPERCASE", catalog.lookup('Ä').key());
    }

    @Test
    void invalidCatalog_isRejected() {
        assertThrows(InvalidInputException.class, () -> load("{}"));
        assertThrows(InvalidInputException.class, () -> load(""));
        assertThrows(InvalidInputException.class, () -> load("{\"fallback\": \"L 1 1\"}"));
        assertThrows(InvalidInputException.class,
                () -> load("{\"fallback\": \"M 0 0\", \"classes\": {\"SYMBOL\": \"M 0 0\"}}"));
        assertThrows(InvalidInputException.class,
                () -> load("{\"fallback\": \"M 0 0\", \"glyphs\": {\"ab\": \"M 0 0\"}}"));
        assertThrows(InvalidInputException.class, () -> load("{\"fallback\": [1, 2]}"));
        assertThrows(InvalidInputException.class, () -> GlyphTemplateCatalog.fromResource("no-such-catalog.json"));
    }

    @Test
    void glyphClass_boxFactors() {
        assertEquals(GlyphClass.LOWERCASE, GlyphClass.of('q'));
        assertEquals(GlyphClass.UPPERCASE, GlyphClass.of('Q'));
        assertEquals(GlyphClass.DIGIT, GlyphClass.of('4'));
        assertEquals(GlyphClass.PUNCTUATION, GlyphClass.of('?'));
        assertEquals(0.5, GlyphClass.LOWERCASE.heightFactor());
        assertEquals(0.3, GlyphClass.PUNCTUATION.widthFactor());
    }
}
