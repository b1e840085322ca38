// file: core/src/main/java/io/annolite/core/AnnotationState.java
package io.annolite.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Immutable value holding everything drawn over one image at one moment.
 * <p>
 * Design:
 *  - Value object: equals/hashCode cover every stroke, every point and the
 *    viewport. Stroke order and point order are significant.
 *  - The stroke list is copied on construction; instances can be shared
 *    freely between the session executor and the I/O pool.
 *  - viewport is optional because a surface may report only geometry.
 */
public record AnnotationState(List<Stroke> strokes, Viewport viewport) {

    private static final AnnotationState EMPTY = new AnnotationState(List.of(), null);

    public AnnotationState {
        strokes = List.copyOf(Objects.requireNonNull(strokes, "strokes"));
    }

    public AnnotationState(List<Stroke> strokes) {
        this(strokes, null);
    }

    /** A blank drawing with no recorded view. */
    public static AnnotationState empty() {
        return EMPTY;
    }

    public Optional<Viewport> viewportIfPresent() {
        return Optional.ofNullable(viewport);
    }

    public int strokeCount() {
        return strokes.size();
    }

    /** Return a new state with {@code stroke} appended after the existing strokes. */
    public AnnotationState withStroke(Stroke stroke) {
        Objects.requireNonNull(stroke, "stroke");
        var next = new ArrayList<Stroke>(strokes.size() + 1);
        next.addAll(strokes);
        next.add(stroke);
        return new AnnotationState(next, viewport);
    }

    public AnnotationState withViewport(Viewport newViewport) {
        return new AnnotationState(strokes, newViewport);
    }
}
