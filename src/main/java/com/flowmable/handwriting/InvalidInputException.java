package com.flowmable.handwriting;

/**
 * Structurally invalid input: an empty raster, an empty glyph catalog,
 * or settings and descriptor values outside their allowed range.
 * <p>
 * Soft degeneracies (no ink, no lines, no dominant angle) never raise this;
 * they fall back to documented constants instead.
 */
public class InvalidInputException extends IllegalArgumentException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
