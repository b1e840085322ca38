// file: server/src/main/java/io/annolite/server/session/SessionStatus.java
package io.annolite.server.session;

import io.annolite.core.ProtectionState;
import io.annolite.core.ReviewStatus;

import java.util.List;

/**
 * Point-in-time view of one session for status displays.
 * <p>
 * cursor and latestIndex are null while the session has no snapshot.
 * The can* flags tell a UI which navigation controls to disable.
 */
public record SessionStatus(
        String sessionId,
        Long cursor,
        Long latestIndex,
        int snapshotCount,
        List<Long> bookmarks,
        ProtectionState.Phase state,
        boolean savePending,
        boolean canUndo,
        boolean canRedo,
        boolean canPrevBookmark,
        boolean canNextBookmark,
        String lastMessage,
        ReviewStatus review
) {
    public SessionStatus {
        bookmarks = List.copyOf(bookmarks);
    }
}
