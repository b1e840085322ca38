// file: server/src/main/java/io/annolite/server/dto/SurfaceCommandResponse.java
package io.annolite.server.dto;

import io.annolite.storage.json.StateJson;

/**
 * One queued command in GET /sessions/{id}/commands.
 * Load:
 *   { "type": "load", "target": 48, "state": { ... } }
 * State request:
 *   { "type": "request-state", "requestId": 17 }
 */
public class SurfaceCommandResponse {
    public String type;
    public Long target;     // load only
    public StateJson state; // load only
    public Long requestId;  // request-state only
}
