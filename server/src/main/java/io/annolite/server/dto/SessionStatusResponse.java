// file: server/src/main/java/io/annolite/server/dto/SessionStatusResponse.java
package io.annolite.server.dto;

import java.util.List;

/**
 * JSON response for GET /sessions/{id}.
 * Example:
 *   {
 *     "sessionId": "slide-017.tif",
 *     "cursor": 48,
 *     "latestIndex": 49,
 *     "snapshotCount": 5,
 *     "bookmarks": [45, 47],
 *     "state": "GRACE",
 *     "savePending": false,
 *     "canUndo": true, "canRedo": true,
 *     "canPrevBookmark": true, "canNextBookmark": false,
 *     "lastMessage": "showing snapshot 48",
 *     "review": { "done": true, "inkFound": true, "lastUpdated": "..." }
 *   }
 */
public class SessionStatusResponse {
    public String sessionId;
    public Long cursor;      // null when the session has no snapshot
    public Long latestIndex; // null when the session has no snapshot
    public int snapshotCount;
    public List<Long> bookmarks;
    public String state;
    public boolean savePending;
    public boolean canUndo;
    public boolean canRedo;
    public boolean canPrevBookmark;
    public boolean canNextBookmark;
    public String lastMessage;
    public ReviewStatusResponse review;
}
