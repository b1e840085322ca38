// file: storage/src/main/java/io/annolite/storage/json/StateJson.java
package io.annolite.storage.json;

import java.util.List;

/**
 * JSON shape of an annotation state.
 * Example:
 *   {
 *     "strokes": [
 *       { "type": "polyline", "color": "#ff0000", "thickness": 3.0,
 *         "points": [[120.5, 88.0], [121.0, 90.25]] }
 *     ],
 *     "viewport": { "zoom": 8.0, "centerX": 5120.0, "centerY": 3300.0 }
 *   }
 */
public class StateJson {
    public List<StrokeJson> strokes;
    public ViewportJson viewport; // optional
}
