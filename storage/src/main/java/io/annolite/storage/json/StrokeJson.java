// file: storage/src/main/java/io/annolite/storage/json/StrokeJson.java
package io.annolite.storage.json;

import java.util.List;

public class StrokeJson {
    public String type;
    public String color;
    public double thickness;
    public List<double[]> points; // each entry is [x, y]
}
