package com.nodeflow.model;

/**
 * Axis-aligned rectangle in canvas coordinates.
 *
 * Width and height are never negative when built through
 * {@link #fromEdges(double, double, double, double)}.
 */
public record Rect(double x, double y, double width, double height) {

    public static final Rect EMPTY = new Rect(0, 0, 0, 0);

    /** Builds a rectangle from its edges, clamping inverted extents to zero. */
    public static Rect fromEdges(double minX, double minY, double maxX, double maxY) {
        return new Rect(minX, minY, Math.max(0, maxX - minX), Math.max(0, maxY - minY));
    }

    public static Rect of(Point origin, Size size) {
        return new Rect(origin.x(), origin.y(), size.width(), size.height());
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    /** True if {@code inner} lies entirely inside this rectangle (edges inclusive). */
    public boolean contains(Rect inner) {
        return inner.x >= x && inner.y >= y
                && inner.right() <= right()
                && inner.bottom() <= bottom();
    }

    public boolean intersectsWith(Rect other) {
        return x < other.right() && right() > other.x
                && y < other.bottom() && bottom() > other.y;
    }

    /** Smallest rectangle containing both this one and {@code other}. */
    public Rect union(Rect other) {
        return fromEdges(
                Math.min(x, other.x), Math.min(y, other.y),
                Math.max(right(), other.right()), Math.max(bottom(), other.bottom()));
    }

    /** Grows the rectangle by {@code amount} on every side. */
    public Rect inflate(double amount) {
        return new Rect(x - amount, y - amount, width + 2 * amount, height + 2 * amount);
    }

    public Rect offset(double dx, double dy) {
        return new Rect(x + dx, y + dy, width, height);
    }

    public Point origin() {
        return new Point(x, y);
    }
}
