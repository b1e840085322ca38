// file: server/src/main/java/io/annolite/server/dto/NavigationResponse.java
package io.annolite.server.dto;

/**
 * JSON response for the navigation and bookmark endpoints.
 *   { "target": 48 }
 */
public class NavigationResponse {
    public long target;
}
