// file: server/src/main/java/io/annolite/server/dto/CurrentStateRequest.java
package io.annolite.server.dto;

import io.annolite.storage.json.StateJson;

/**
 * JSON body for POST /sessions/{id}/state.
 * Example:
 *   {
 *     "requestId": 17,
 *     "state": { "strokes": [ ... ], "viewport": { ... } }
 *   }
 */
public class CurrentStateRequest {
    public Long requestId;  // echoes the id of the request-state command
    public StateJson state;
}
