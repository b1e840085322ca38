// file: server/src/main/java/io/annolite/server/dto/SnapshotResponse.java
package io.annolite.server.dto;

import io.annolite.storage.json.StateJson;

/**
 * JSON response for GET /sessions/{id}/snapshots/{index}.
 */
public class SnapshotResponse {
    public long index;
    public String createdAt;
    public boolean bookmarked;
    public StateJson state;
}
