package com.nodeflow.model;

/** A point in canvas coordinates. */
public record Point(double x, double y) {

    public static final Point ORIGIN = new Point(0, 0);

    public Point offset(double dx, double dy) {
        return new Point(x + dx, y + dy);
    }
}
