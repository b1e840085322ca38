// file: storage/src/main/java/io/annolite/storage/json/SnapshotJson.java
package io.annolite.storage.json;

/**
 * On-disk record for one snapshot file ({@code live/00047.json}).
 * <p>
 * The index is repeated inside the file so a renamed or misplaced file is
 * detected on read instead of silently loading the wrong history entry.
 */
public class SnapshotJson {
    public long index;
    public String createdAt; // ISO-8601 instant, UTC
    public StateJson state;
}
