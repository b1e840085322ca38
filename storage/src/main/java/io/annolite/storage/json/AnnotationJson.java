// file: storage/src/main/java/io/annolite/storage/json/AnnotationJson.java
package io.annolite.storage.json;

import io.annolite.core.AnnotationState;
import io.annolite.core.Point;
import io.annolite.core.Stroke;
import io.annolite.core.Viewport;

import java.util.ArrayList;
import java.util.List;

/**
 * Conversions between the immutable domain values and their JSON shapes.
 * <p>
 * fromJson validates as it goes; a structurally invalid document surfaces as
 * IllegalArgumentException (or NullPointerException for missing required
 * fields) for the caller to map to its own error type.
 */
public final class AnnotationJson {

    private AnnotationJson() {
        // utility
    }

    public static StateJson toJson(AnnotationState state) {
        StateJson out = new StateJson();
        out.strokes = new ArrayList<>(state.strokeCount());
        for (Stroke s : state.strokes()) {
            StrokeJson sj = new StrokeJson();
            sj.type = s.type();
            sj.color = s.color();
            sj.thickness = s.thickness();
            sj.points = new ArrayList<>(s.points().size());
            for (Point p : s.points()) {
                sj.points.add(new double[]{p.x(), p.y()});
            }
            out.strokes.add(sj);
        }
        if (state.viewport() != null) {
            ViewportJson vj = new ViewportJson();
            vj.zoom = state.viewport().zoom();
            vj.centerX = state.viewport().centerX();
            vj.centerY = state.viewport().centerY();
            out.viewport = vj;
        }
        return out;
    }

    public static AnnotationState fromJson(StateJson json) {
        if (json == null) {
            throw new IllegalArgumentException("state must not be null");
        }
        List<Stroke> strokes = new ArrayList<>();
        if (json.strokes != null) {
            for (StrokeJson sj : json.strokes) {
                if (sj == null) {
                    throw new IllegalArgumentException("stroke must not be null");
                }
                strokes.add(new Stroke(
                        sj.type == null ? Stroke.POLYLINE : sj.type,
                        sj.color,
                        sj.thickness,
                        points(sj.points)));
            }
        }
        Viewport viewport = null;
        if (json.viewport != null) {
            viewport = new Viewport(json.viewport.zoom, json.viewport.centerX, json.viewport.centerY);
        }
        return new AnnotationState(strokes, viewport);
    }

    private static List<Point> points(List<double[]> raw) {
        if (raw == null) {
            return List.of();
        }
        List<Point> out = new ArrayList<>(raw.size());
        for (double[] xy : raw) {
            if (xy == null || xy.length != 2) {
                throw new IllegalArgumentException("point must be a [x, y] pair");
            }
            out.add(new Point(xy[0], xy[1]));
        }
        return out;
    }
}
