// file: server/src/test/java/io/annolite/server/session/Drawings.java
package io.annolite.server.session;

import io.annolite.core.AnnotationState;
import io.annolite.core.Point;
import io.annolite.core.Stroke;

import java.util.ArrayList;
import java.util.List;

/** Distinct, recognisable drawings for tests. */
final class Drawings {

    private Drawings() {
    }

    /** A drawing with one stroke whose first point is (n, n). */
    static AnnotationState numbered(long n) {
        return AnnotationState.empty().withStroke(
                Stroke.polyline("#ff0000", 3.0, List.of(new Point(n, n), new Point(n + 10, n + 5))));
    }

    static List<AnnotationState> numberedRange(long fromInclusive, long toInclusive) {
        List<AnnotationState> out = new ArrayList<>();
        for (long i = fromInclusive; i <= toInclusive; i++) {
            out.add(numbered(i));
        }
        return out;
    }

    static AnnotationState withExtraStroke(AnnotationState base) {
        return base.withStroke(
                Stroke.polyline("#00ff00", 2.0, List.of(new Point(500, 500), new Point(510, 520))));
    }
}
