package com.enterprise.sheetconvert.extraction.layout;

/**
 * A run of text with its position on the page, in points, origin top-left.
 * {@code y} is the baseline.
 */
public final class PositionedToken {

    private final float x;
    private final float endX;
    private final float y;
    private final float height;
    private final String text;

    public PositionedToken(float x, float endX, float y, float height, String text) {
        this.x = x;
        this.endX = Math.max(endX, x);
        this.y = y;
        this.height = height > 0f ? height : 1f;
        this.text = text == null ? "" : text;
    }

    public float x() {
        return x;
    }

    public float endX() {
        return endX;
    }

    public float y() {
        return y;
    }

    public float height() {
        return height;
    }

    public float top() {
        return y - height;
    }

    public float center() {
        return x + ((endX - x) / 2f);
    }

    public String text() {
        return text;
    }

    /**
     * Joins this token with one to its right.
     */
    PositionedToken merge(PositionedToken right) {
        return new PositionedToken(
                Math.min(x, right.x),
                Math.max(endX, right.endX),
                Math.max(y, right.y),
                Math.max(height, right.height),
                text + " " + right.text);
    }

    @Override
    public String toString() {
        return "'" + text + "'@(" + x + "," + y + ")";
    }
}
