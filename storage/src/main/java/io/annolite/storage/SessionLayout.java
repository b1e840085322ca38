// file: storage/src/main/java/io/annolite/storage/SessionLayout.java
package io.annolite.storage;

import java.nio.file.Path;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Directory naming for everything persisted under one data root.
 * <p>
 * Layout:
 *   <dataDir>/sessions/<sessionId>/live/00000.json
 *   <dataDir>/sessions/<sessionId>/bookmarks.json
 *   <dataDir>/review-status.json
 * <p>
 * Each session owns a disjoint namespace. Session ids come from image names
 * supplied over HTTP, so they are validated before being used as a path
 * segment.
 */
public final class SessionLayout {

    private static final Pattern SESSION_ID = Pattern.compile("[A-Za-z0-9._-]{1,128}");

    private final Path dataDir;

    public SessionLayout(Path dataDir) {
        this.dataDir = Objects.requireNonNull(dataDir, "dataDir");
    }

    public Path dataDir() {
        return dataDir;
    }

    public Path sessionDir(String sessionId) {
        return dataDir.resolve("sessions").resolve(requireValidSessionId(sessionId));
    }

    public Path liveDir(String sessionId) {
        return sessionDir(sessionId).resolve("live");
    }

    public Path bookmarksFile(String sessionId) {
        return sessionDir(sessionId).resolve("bookmarks.json");
    }

    public Path reviewStatusFile() {
        return dataDir.resolve("review-status.json");
    }

    /**
     * @throws IllegalArgumentException if the id is not a safe single path segment
     */
    public static String requireValidSessionId(String sessionId) {
        if (sessionId == null
                || !SESSION_ID.matcher(sessionId).matches()
                || sessionId.equals(".")
                || sessionId.equals("..")) {
            throw new IllegalArgumentException("invalid session id: " + sessionId);
        }
        return sessionId;
    }

    /** Zero-padded record name for a snapshot index, e.g. 47 -> "00047.json". */
    public static String snapshotFileName(long index) {
        return String.format("%05d.json", index);
    }
}
