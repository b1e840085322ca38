// file: core/src/main/java/io/annolite/core/Point.java
package io.annolite.core;

/**
 * One vertex of a stroke, in full-resolution image pixel coordinates.
 */
public record Point(double x, double y) {
    public Point {
        if (!Double.isFinite(x) || !Double.isFinite(y)) {
            throw new IllegalArgumentException("point coordinates must be finite: (" + x + ", " + y + ")");
        }
    }
}
