// file: core/src/main/java/io/annolite/core/Stroke.java
package io.annolite.core;

import java.util.List;
import java.util.Objects;

/**
 * A single free-hand mark drawn over the image.
 * <p>
 * Fields:
 *  - type:      geometry kind reported by the rendering surface (e.g. "polyline").
 *  - color:     CSS-style color string, compared verbatim.
 *  - thickness: stroke weight in screen pixels.
 *  - points:    ordered vertices; order is part of the stroke's identity.
 * <p>
 * The point list is copied on construction, so a Stroke never changes after
 * the core has seen it.
 */
public record Stroke(String type, String color, double thickness, List<Point> points) {

    public static final String POLYLINE = "polyline";

    public Stroke {
        Objects.requireNonNull(type, "type");
        Objects.requireNonNull(color, "color");
        if (!Double.isFinite(thickness) || thickness < 0) {
            throw new IllegalArgumentException("thickness must be a finite value >= 0, got: " + thickness);
        }
        points = List.copyOf(Objects.requireNonNull(points, "points"));
    }

    /** Convenience for the common case of a polyline. */
    public static Stroke polyline(String color, double thickness, List<Point> points) {
        return new Stroke(POLYLINE, color, thickness, points);
    }
}
