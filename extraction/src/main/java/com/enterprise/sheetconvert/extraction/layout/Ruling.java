package com.enterprise.sheetconvert.extraction.layout;

/**
 * A straight horizontal or vertical line drawn on the page, in points, origin top-left.
 */
public final class Ruling {

    private static final float AXIS_TOLERANCE = 1f;

    private final float x1;
    private final float y1;
    private final float x2;
    private final float y2;

    public Ruling(float x1, float y1, float x2, float y2) {
        this.x1 = Math.min(x1, x2);
        this.x2 = Math.max(x1, x2);
        this.y1 = Math.min(y1, y2);
        this.y2 = Math.max(y1, y2);
    }

    public boolean isVertical() {
        return (x2 - x1) <= AXIS_TOLERANCE && (y2 - y1) > AXIS_TOLERANCE;
    }

    public boolean isHorizontal() {
        return (y2 - y1) <= AXIS_TOLERANCE && (x2 - x1) > AXIS_TOLERANCE;
    }

    public float x() {
        return x1 + ((x2 - x1) / 2f);
    }

    public float top() {
        return y1;
    }

    public float bottom() {
        return y2;
    }

    /**
     * Length of the vertical overlap between this ruling and the band {@code [top, bottom]}.
     */
    public float verticalOverlap(float top, float bottom) {
        return Math.max(0f, Math.min(y2, bottom) - Math.max(y1, top));
    }

    @Override
    public String toString() {
        return "Ruling[(" + x1 + "," + y1 + ")-(" + x2 + "," + y2 + ")]";
    }
}
