// file: server/src/main/java/io/annolite/server/dto/LoadConfirmedRequest.java
package io.annolite.server.dto;

/**
 * JSON body for POST /sessions/{id}/load-confirmed.
 * Example:
 *   { "target": 48 }
 */
public class LoadConfirmedRequest {
    public Long target;
}
