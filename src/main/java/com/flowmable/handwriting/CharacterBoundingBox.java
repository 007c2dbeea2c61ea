package com.flowmable.handwriting;

/**
 * A glyph run's extent in mask coordinates.
 *
 * @param x      Left column (inclusive)
 * @param y      Top row (inclusive)
 * @param width  Column count
 * @param height Row count
 */
public record CharacterBoundingBox(int x, int y, int width, int height) {

    public int right() {
        return x + width;
    }
}
