// file: server/src/main/java/io/annolite/server/session/AutoSaveScheduler.java
package io.annolite.server.session;

import io.annolite.core.AnnotationState;
import io.annolite.core.ChangeDetector;
import io.annolite.core.NavigationInProgressException;
import io.annolite.storage.SnapshotStore;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NavigableMap;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.TreeMap;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Periodic "has the drawing changed? then save it" loop of one session.
 * <p>
 * Each {@link #tick()}:
 *  - returns at once while the navigation controller is protected,
 *  - returns while an append is still in flight (one append per session at a time),
 *  - otherwise asks the surface for its current state under a fresh request id.
 * <p>
 * Answers arrive later through {@link #onCurrentState(long, AnnotationState)},
 * possibly after further ticks have issued newer requests. An answer is
 * accepted if its request is still outstanding, no navigation was issued
 * since that request, and the session is not protected now. Accepting an
 * answer retires its request and every older one, so answers are applied in
 * request order and each at most once. An accepted answer that differs from
 * the last saved state is appended on the I/O executor; completion is
 * marshalled back onto the session executor. Requests still outstanding when
 * an append starts are retired as well; the next tick asks again.
 * <p>
 * Not thread-safe: all methods except the I/O task run on the session executor.
 */
public final class AutoSaveScheduler {
    private static final Logger log = Logger.getLogger(AutoSaveScheduler.class.getName());

    // A surface that never answers must not grow the outstanding set forever.
    private static final int MAX_OUTSTANDING_REQUESTS = 32;

    /**
     * Callback for {@link #capture(CaptureListener)}. Invoked on the session
     * executor exactly once.
     */
    public interface CaptureListener {
        /** The surface's current state is stored at {@code index}. */
        void captured(long index);

        /** The capture could not complete; nothing was bookmarked. */
        void abandoned(RuntimeException cause);
    }

    /** A capture served by the first accepted answer to a request >= minRequestId. */
    private record PendingCapture(CaptureListener listener, long minRequestId) {}

    private static final long AFTER_APPEND = Long.MAX_VALUE;

    private final String sessionId;
    private final NavigationController navigation;
    private final SnapshotStore store;
    private final ChangeDetector detector;
    private final RenderingSurface surface;
    private final Executor sessionExecutor;
    private final Executor ioExecutor;

    private long lastRequestId;
    // request id -> navigation epoch at the time it was issued
    private final NavigableMap<Long, Long> outstanding = new TreeMap<>();
    private boolean appendInFlight;
    private boolean savePending;

    private final List<PendingCapture> waitingCaptures = new ArrayList<>();
    // Captures whose state is being written by the in-flight append.
    private final List<CaptureListener> appendCaptures = new ArrayList<>();

    public AutoSaveScheduler(String sessionId,
                             NavigationController navigation,
                             SnapshotStore store,
                             ChangeDetector detector,
                             RenderingSurface surface,
                             Executor sessionExecutor,
                             Executor ioExecutor) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.navigation = Objects.requireNonNull(navigation, "navigation");
        this.store = Objects.requireNonNull(store, "store");
        this.detector = Objects.requireNonNull(detector, "detector");
        this.surface = Objects.requireNonNull(surface, "surface");
        this.sessionExecutor = Objects.requireNonNull(sessionExecutor, "sessionExecutor");
        this.ioExecutor = Objects.requireNonNull(ioExecutor, "ioExecutor");
    }

    public void tick() {
        if (navigation.isProtected()) {
            log.fine(() -> String.format("[%s] tick skipped: %s", sessionId, navigation.protection()));
            return;
        }
        if (appendInFlight) {
            log.fine(() -> String.format("[%s] tick skipped: append in flight", sessionId));
            return;
        }
        requestState();
    }

    /**
     * Make sure whatever the surface shows right now is stored, then report
     * its index. Used by bookmarking. Callers must check protection first.
     * <p>
     * Only an answer to a request issued at or after this call counts.
     */
    public void capture(CaptureListener listener) {
        Objects.requireNonNull(listener, "listener");
        if (appendInFlight) {
            waitingCaptures.add(new PendingCapture(listener, AFTER_APPEND));
            return;
        }
        long requestId = requestState();
        waitingCaptures.add(new PendingCapture(listener, requestId));
    }

    /**
     * A navigation was issued; any capture in progress would observe the
     * wrong drawing.
     */
    public void abandonCaptures(long navigationTarget) {
        if (waitingCaptures.isEmpty() && appendCaptures.isEmpty()) {
            return;
        }
        var cause = new NavigationInProgressException(navigationTarget);
        notifyAbandoned(takeWaiting(AFTER_APPEND), cause);
        notifyAbandoned(appendCaptures, cause);
    }

    public void onCurrentState(long requestId, AnnotationState state) {
        Objects.requireNonNull(state, "state");
        Long requestEpoch = outstanding.get(requestId);
        if (requestEpoch == null) {
            log.fine(() -> String.format("[%s] discarding state for request %d: not outstanding",
                    sessionId, requestId));
            return;
        }
        outstanding.headMap(requestId, true).clear();
        List<CaptureListener> served = takeWaiting(requestId);

        if (requestEpoch != navigation.navigationEpoch() || navigation.isProtected()) {
            log.fine(() -> String.format("[%s] discarding state for request %d: navigated since request",
                    sessionId, requestId));
            notifyAbandoned(served, new IllegalStateException("navigated while capturing state"));
            return;
        }

        AnnotationState lastSaved = navigation.lastSavedState().orElse(null);
        if (!detector.shouldSave(state, lastSaved)) {
            OptionalLong cursor = navigation.cursor();
            if (cursor.isPresent()) {
                notifyCaptured(served, cursor.getAsLong());
            } else {
                notifyAbandoned(served, new IllegalStateException("session has no snapshots yet"));
            }
            return;
        }
        appendCaptures.addAll(served);
        startAppend(state);
    }

    public boolean savePending() {
        return savePending;
    }

    public boolean appendInFlight() {
        return appendInFlight;
    }

    // ---------- internals ----------

    private long requestState() {
        long requestId = ++lastRequestId;
        outstanding.put(requestId, navigation.navigationEpoch());
        while (outstanding.size() > MAX_OUTSTANDING_REQUESTS) {
            outstanding.pollFirstEntry();
        }
        surface.requestCurrentState(requestId);
        return requestId;
    }

    private void startAppend(AnnotationState state) {
        appendInFlight = true;
        outstanding.clear();
        try {
            ioExecutor.execute(() -> {
                try {
                    long index = store.append(state);
                    marshal(() -> onAppended(index, state));
                } catch (RuntimeException e) {
                    marshal(() -> onAppendFailed(e));
                }
            });
        } catch (RejectedExecutionException e) {
            onAppendFailed(e);
        }
    }

    private void onAppended(long index, AnnotationState state) {
        appendInFlight = false;
        savePending = false;
        boolean cursorMoved = navigation.recordAppend(index, state);
        log.info(String.format("[%s] saved snapshot %d (%d strokes)", sessionId, index, state.strokeCount()));
        if (cursorMoved) {
            notifyCaptured(appendCaptures, index);
        } else {
            notifyAbandoned(appendCaptures, new IllegalStateException("navigation pending while saving"));
        }
        resumeWaitingCaptures();
    }

    private void onAppendFailed(RuntimeException e) {
        appendInFlight = false;
        savePending = true;
        log.log(Level.WARNING, String.format("[%s] save failed; retrying on next tick", sessionId), e);
        notifyAbandoned(appendCaptures, e);
        resumeWaitingCaptures();
    }

    /** Requests were retired when the append started; waiting captures need a fresh one. */
    private void resumeWaitingCaptures() {
        if (waitingCaptures.isEmpty()) {
            return;
        }
        List<CaptureListener> waiting = takeWaiting(AFTER_APPEND);
        if (navigation.isProtected()) {
            notifyAbandoned(waiting, new IllegalStateException("navigation pending while saving"));
            return;
        }
        long requestId = requestState();
        for (CaptureListener l : waiting) {
            waitingCaptures.add(new PendingCapture(l, requestId));
        }
    }

    /** Remove and return the waiting captures an answer to {@code requestId} serves. */
    private List<CaptureListener> takeWaiting(long requestId) {
        List<CaptureListener> taken = new ArrayList<>();
        Iterator<PendingCapture> it = waitingCaptures.iterator();
        while (it.hasNext()) {
            PendingCapture c = it.next();
            if (c.minRequestId() <= requestId) {
                taken.add(c.listener());
                it.remove();
            }
        }
        return taken;
    }

    private void marshal(Runnable task) {
        try {
            sessionExecutor.execute(task);
        } catch (RejectedExecutionException e) {
            // Session closed while the write ran; the record itself is durable.
            log.fine(() -> String.format("[%s] append completed after session close", sessionId));
        }
    }

    private static void notifyCaptured(List<CaptureListener> listeners, long index) {
        List<CaptureListener> copy = List.copyOf(listeners);
        listeners.clear();
        for (CaptureListener l : copy) {
            l.captured(index);
        }
    }

    private static void notifyAbandoned(List<CaptureListener> listeners, RuntimeException cause) {
        List<CaptureListener> copy = List.copyOf(listeners);
        listeners.clear();
        for (CaptureListener l : copy) {
            l.abandoned(cause);
        }
    }
}
