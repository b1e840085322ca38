// file: server/src/main/java/io/annolite/server/session/EditingSession.java
package io.annolite.server.session;

import io.annolite.core.AnnotationState;
import io.annolite.core.ChangeDetector;
import io.annolite.core.NavigationInProgressException;
import io.annolite.core.NoSuchTransitionException;
import io.annolite.core.ProtectionState;
import io.annolite.core.ReviewStatus;
import io.annolite.core.Snapshot;
import io.annolite.core.SnapshotReadException;
import io.annolite.core.Ticker;
import io.annolite.storage.BookmarkIndex;
import io.annolite.storage.ReviewStatusStore;
import io.annolite.storage.SnapshotStore;

import java.util.List;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.function.LongSupplier;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * One image being annotated: history, bookmarks, review flags and the
 * auto-save loop, all driven from a single session thread.
 * <p>
 * Threading:
 *  - Every read and write of navigation/auto-save state runs on this
 *    session's own single-threaded scheduler ("session-&lt;id&gt;").
 *  - Public methods may be called from any thread. Commands wait for the
 *    session thread ({@link #undo()} etc.); surface events are queued and
 *    return immediately.
 *  - Durable appends run on the shared I/O executor and report back here.
 * <p>
 * Errors from navigation propagate to the caller after the state machine
 * has been restored; background ticks log and keep running.
 */
public final class EditingSession implements AutoCloseable {
    private static final Logger log = Logger.getLogger(EditingSession.class.getName());
    private static final long CALL_TIMEOUT_SECONDS = 30;

    private final String sessionId;
    private final SnapshotStore store;
    private final BookmarkIndex bookmarks;
    private final ReviewStatusStore review;
    private final SessionSettings settings;
    private final ScheduledExecutorService exec;
    private final NavigationController navigation;
    private final AutoSaveScheduler autoSave;

    private volatile String lastMessage = "";
    private volatile boolean closed = false;
    private ScheduledFuture<?> tickTask;

    public EditingSession(String sessionId,
                          SnapshotStore store,
                          BookmarkIndex bookmarks,
                          ReviewStatusStore review,
                          RenderingSurface surface,
                          ChangeDetector detector,
                          Ticker ticker,
                          Executor ioExecutor,
                          SessionSettings settings) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.store = Objects.requireNonNull(store, "store");
        this.bookmarks = Objects.requireNonNull(bookmarks, "bookmarks");
        this.review = Objects.requireNonNull(review, "review");
        this.settings = Objects.requireNonNull(settings, "settings");
        this.exec = Executors.newSingleThreadScheduledExecutor(r -> {
            Thread t = new Thread(r, "session-" + sessionId);
            t.setDaemon(true);
            return t;
        });
        this.navigation = new NavigationController(
                sessionId, store, bookmarks, surface, ticker,
                settings.graceWindow(), settings.loadTimeout());
        this.autoSave = new AutoSaveScheduler(
                sessionId, navigation, store, detector, surface, exec, ioExecutor);
    }

    public String sessionId() {
        return sessionId;
    }

    /** Start the recurring auto-save tick. Idempotent. */
    public synchronized void start() {
        ensureOpen();
        if (tickTask != null) {
            return;
        }
        long period = settings.autosavePeriod().toMillis();
        tickTask = exec.scheduleAtFixedRate(this::tickSafe, period, period, TimeUnit.MILLISECONDS);
    }

    // ---------- navigation ----------

    public long undo() {
        return call(() -> navigate("undo", navigation::undo));
    }

    public long redo() {
        return call(() -> navigate("redo", navigation::redo));
    }

    public long jumpToPrevBookmark() {
        return call(() -> navigate("prev-bookmark", navigation::jumpToPrevBookmark));
    }

    public long jumpToNextBookmark() {
        return call(() -> navigate("next-bookmark", navigation::jumpToNextBookmark));
    }

    // ---------- bookmarking ----------

    /**
     * Bookmark whatever the surface shows now, saving it first if it changed.
     * <p>
     * Fails synchronously with {@link NavigationInProgressException} while a
     * load is unconfirmed. Otherwise returns a future completed on the
     * session thread with the bookmarked index.
     */
    public CompletableFuture<Long> bookmarkCurrent() {
        return call(this::beginBookmark);
    }

    // ---------- surface events ----------

    public void onCurrentState(long requestId, AnnotationState state) {
        Objects.requireNonNull(state, "state");
        submit(() -> autoSave.onCurrentState(requestId, state));
    }

    public void onLoadConfirmed(long target) {
        submit(() -> {
            if (navigation.onLoadConfirmed(target)) {
                lastMessage = "showing snapshot " + target;
            }
        });
    }

    // ---------- review status ----------

    public ReviewStatus toggleDone() {
        ensureOpen();
        return review.toggleDone(sessionId);
    }

    public ReviewStatus toggleInkFound() {
        ensureOpen();
        return review.toggleInkFound(sessionId);
    }

    // ---------- read-only history ----------

    public List<Long> snapshotIndices() {
        return store.listIndices();
    }

    public Snapshot readSnapshot(long index) {
        return store.read(index);
    }

    public boolean isBookmarked(long index) {
        return bookmarks.isMarked(index);
    }

    public SessionStatus status() {
        return call(() -> new SessionStatus(
                sessionId,
                navigation.cursor().isPresent() ? navigation.cursor().getAsLong() : null,
                store.latestIndex().isPresent() ? store.latestIndex().getAsLong() : null,
                store.listIndices().size(),
                bookmarks.list(),
                navigation.phase(),
                autoSave.savePending(),
                navigation.canUndo(),
                navigation.canRedo(),
                navigation.canJumpToPrevBookmark(),
                navigation.canJumpToNextBookmark(),
                lastMessage,
                review.get(sessionId)
        ));
    }

    /** Run one auto-save tick now and wait for it. */
    void tickNow() {
        call(() -> {
            autoSave.tick();
            return null;
        });
    }

    @Override
    public void close() {
        synchronized (this) {
            if (closed) {
                return;
            }
            closed = true;
            if (tickTask != null) {
                tickTask.cancel(false);
            }
        }
        exec.shutdown();
        try {
            if (!exec.awaitTermination(5, TimeUnit.SECONDS)) {
                log.warning(String.format("[%s] session thread did not stop in time", sessionId));
                exec.shutdownNow();
            }
        } catch (InterruptedException e) {
            exec.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    // ---------- internals (session thread) ----------

    private long navigate(String action, LongSupplier op) {
        try {
            long target = op.getAsLong();
            autoSave.abandonCaptures(target);
            lastMessage = action + ": loading snapshot " + target;
            return target;
        } catch (NoSuchTransitionException e) {
            log.fine(() -> String.format("[%s] %s", sessionId, e.getMessage()));
            lastMessage = e.getMessage();
            throw e;
        } catch (SnapshotReadException e) {
            lastMessage = action + " failed: snapshot " + e.index() + " unavailable";
            throw e;
        }
    }

    private CompletableFuture<Long> beginBookmark() {
        CompletableFuture<Long> result = new CompletableFuture<>();
        if (navigation.isProtected()) {
            var loading = (ProtectionState.Loading) navigation.protection();
            if (!loading.confirmed()) {
                lastMessage = "cannot bookmark while loading snapshot " + loading.target();
                throw new NavigationInProgressException(loading.target());
            }
            // Confirmed and settling: the surface shows exactly the cursor's snapshot.
            finishBookmark(loading.target(), result);
            return result;
        }
        autoSave.capture(new AutoSaveScheduler.CaptureListener() {
            @Override
            public void captured(long index) {
                finishBookmark(index, result);
            }

            @Override
            public void abandoned(RuntimeException cause) {
                lastMessage = "bookmark failed: " + cause.getMessage();
                result.completeExceptionally(cause);
            }
        });
        return result;
    }

    private void finishBookmark(long index, CompletableFuture<Long> result) {
        try {
            boolean added = bookmarks.mark(index);
            review.markSaved(sessionId);
            lastMessage = "bookmarked snapshot " + index;
            log.info(String.format("[%s] bookmark %d%s", sessionId, index, added ? "" : " (already marked)"));
            result.complete(index);
        } catch (RuntimeException e) {
            log.log(Level.WARNING, String.format("[%s] bookmark of %d failed", sessionId, index), e);
            lastMessage = "bookmark failed: " + e.getMessage();
            result.completeExceptionally(e);
        }
    }

    private void tickSafe() {
        try {
            autoSave.tick();
        } catch (Exception e) {
            log.log(Level.WARNING, String.format("[%s] error during auto-save tick", sessionId), e);
        }
    }

    // ---------- executor plumbing ----------

    private void submit(Runnable task) {
        ensureOpen();
        exec.execute(() -> {
            try {
                task.run();
            } catch (Exception e) {
                log.log(Level.WARNING, String.format("[%s] error handling surface event", sessionId), e);
            }
        });
    }

    private <T> T call(Callable<T> task) {
        ensureOpen();
        Future<T> f = exec.submit(task);
        try {
            return f.get(CALL_TIMEOUT_SECONDS, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException re) {
                throw re;
            }
            if (cause instanceof Error err) {
                throw err;
            }
            throw new IllegalStateException(cause);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("interrupted waiting for session " + sessionId, e);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new IllegalStateException("session " + sessionId + " did not respond", e);
        }
    }

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("session " + sessionId + " is closed");
        }
    }
}
