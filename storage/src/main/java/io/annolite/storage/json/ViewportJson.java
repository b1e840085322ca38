// file: storage/src/main/java/io/annolite/storage/json/ViewportJson.java
package io.annolite.storage.json;

public class ViewportJson {
    public double zoom;
    public double centerX;
    public double centerY;
}
