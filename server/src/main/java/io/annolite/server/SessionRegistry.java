// file: server/src/main/java/io/annolite/server/SessionRegistry.java
package io.annolite.server;

import io.annolite.core.ChangeDetector;
import io.annolite.core.Ticker;
import io.annolite.server.session.EditingSession;
import io.annolite.server.session.SessionSettings;
import io.annolite.server.surface.QueuedRenderingSurface;
import io.annolite.storage.FileBookmarkIndex;
import io.annolite.storage.FileSnapshotStore;
import io.annolite.storage.ReviewStatusStore;
import io.annolite.storage.SessionLayout;
import io.annolite.storage.SnapshotStore;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executor;
import java.util.logging.Logger;

/**
 * Open editing sessions of one data directory, keyed by image name.
 * <p>
 * Responsibilities:
 *  - Open a session on first use: file-backed store and bookmarks under the
 *    session's own directory, a polling surface, a running auto-save tick.
 *  - Hand out the same session (and surface) to later callers.
 *  - Close sessions; persisted data is left as is.
 */
public final class SessionRegistry implements AutoCloseable {
    private static final Logger log = Logger.getLogger(SessionRegistry.class.getName());

    /** A running session together with the surface its commands are queued on. */
    public record OpenSession(EditingSession session, QueuedRenderingSurface surface) {}

    private final SessionLayout layout;
    private final ReviewStatusStore review;
    private final ChangeDetector detector;
    private final Ticker ticker;
    private final Executor ioExecutor;
    private final SessionSettings settings;
    private final Clock clock;
    private final Map<String, OpenSession> sessions = new ConcurrentHashMap<>();

    public SessionRegistry(SessionLayout layout,
                           ReviewStatusStore review,
                           ChangeDetector detector,
                           Ticker ticker,
                           Executor ioExecutor,
                           SessionSettings settings,
                           Clock clock) {
        this.layout = Objects.requireNonNull(layout, "layout");
        this.review = Objects.requireNonNull(review, "review");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * @throws IllegalArgumentException if {@code sessionId} is not a valid image name
     */
    public OpenSession open(String sessionId) {
        SessionLayout.requireValidSessionId(sessionId);
        return sessions.computeIfAbsent(sessionId, this::create);
    }

    public Optional<OpenSession> get(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    /** @return true if a session was open and is now closed */
    public boolean close(String sessionId) {
        SessionLayout.requireValidSessionId(sessionId);
        OpenSession open = sessions.remove(sessionId);
        if (open == null) {
            return false;
        }
        open.session().close();
        log.info(String.format("[%s] session closed", sessionId));
        return true;
    }

    public void closeAll() {
        List<String> ids = new ArrayList<>(sessions.keySet());
        for (String id : ids) {
            close(id);
        }
    }

    public ReviewStatusStore review() {
        return review;
    }

    @Override
    public void close() {
        closeAll();
    }

    private OpenSession create(String sessionId) {
        SnapshotStore store = new FileSnapshotStore(layout.liveDir(sessionId), settings.firstIndex(), clock);
        var bookmarks = new FileBookmarkIndex(layout.bookmarksFile(sessionId), store);
        var surface = new QueuedRenderingSurface();
        var session = new EditingSession(
                sessionId, store, bookmarks, review, surface, detector, ticker, ioExecutor, settings);
        session.start();
        log.info(String.format("[%s] session opened (%d snapshots, %d bookmarks)",
                sessionId, store.listIndices().size(), bookmarks.list().size()));
        return new OpenSession(session, surface);
    }
}
