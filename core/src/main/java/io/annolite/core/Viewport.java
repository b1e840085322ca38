// file: core/src/main/java/io/annolite/core/Viewport.java
package io.annolite.core;

/**
 * Map view the rendering surface was showing when a state was observed.
 * Restored together with the strokes when a historical state is loaded.
 */
public record Viewport(double zoom, double centerX, double centerY) {
    public Viewport {
        if (!Double.isFinite(zoom) || !Double.isFinite(centerX) || !Double.isFinite(centerY)) {
            throw new IllegalArgumentException("viewport values must be finite");
        }
    }
}
