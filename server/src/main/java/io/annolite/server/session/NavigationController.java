// file: server/src/main/java/io/annolite/server/session/NavigationController.java
package io.annolite.server.session;

import io.annolite.core.AnnotationState;
import io.annolite.core.NoSuchTransitionException;
import io.annolite.core.ProtectionState;
import io.annolite.core.ProtectionState.Loading;
import io.annolite.core.SnapshotCorruptedException;
import io.annolite.core.SnapshotNotFoundException;
import io.annolite.core.SnapshotReadException;
import io.annolite.core.Ticker;
import io.annolite.storage.BookmarkIndex;
import io.annolite.storage.SnapshotStore;

import java.time.Duration;
import java.util.Objects;
import java.util.Optional;
import java.util.OptionalLong;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Undo/redo/bookmark-jump state machine for one editing session.
 * <p>
 * Owns the three pieces of mutable session state:
 *  - cursor:          index of the snapshot the surface is (or will be) showing,
 *  - lastSavedState:  what auto-save compares new observations against,
 *  - protection:      Idle | Loading{target, issuedAt, confirmed}.
 * <p>
 * Navigation protocol:
 *  1) compute target from the live sequence or the bookmark index, relative
 *     to the still-unconfirmed pending target if there is one, else to the
 *     cursor; fail with NoSuchTransitionException and touch nothing if none,
 *  2) read the target snapshot,
 *  3) enter Loading (superseding any earlier pending target) and send the
 *     load command to the surface,
 *  4) on a matching confirmation, move cursor and lastSavedState and
 *     re-stamp the pending entry so the grace window starts now,
 *  5) on a read failure, drop back to Idle and rethrow.
 * <p>
 * Protection holds while the load is unconfirmed, and for the grace window
 * after confirmation. An unconfirmed load older than the load timeout is
 * abandoned with a warning so auto-save cannot stay paused forever.
 * <p>
 * Not thread-safe: every method must run on the owning session's executor.
 */
public final class NavigationController {
    private static final Logger log = Logger.getLogger(NavigationController.class.getName());

    private final String sessionId;
    private final SnapshotStore store;
    private final BookmarkIndex bookmarks;
    private final RenderingSurface surface;
    private final Ticker ticker;
    private final long graceNanos;
    private final long loadTimeoutNanos;

    private ProtectionState protection = ProtectionState.idle();
    private Long cursor;                   // null until the session has a snapshot
    private AnnotationState lastSavedState; // null until something was saved or loaded
    private long navigationEpoch;

    /**
     * Start Idle at the newest snapshot of {@code store}, if any.
     *
     * @param graceWindow how long auto-save stays quiet after a confirmed load
     * @param loadTimeout how long an unconfirmed load may keep auto-save paused
     */
    public NavigationController(String sessionId,
                                SnapshotStore store,
                                BookmarkIndex bookmarks,
                                RenderingSurface surface,
                                Ticker ticker,
                                Duration graceWindow,
                                Duration loadTimeout) {
        this.sessionId = Objects.requireNonNull(sessionId, "sessionId");
        this.store = Objects.requireNonNull(store, "store");
        this.bookmarks = Objects.requireNonNull(bookmarks, "bookmarks");
        this.surface = Objects.requireNonNull(surface, "surface");
        this.ticker = Objects.requireNonNull(ticker, "ticker");
        this.graceNanos = requirePositive(graceWindow, "graceWindow").toNanos();
        this.loadTimeoutNanos = requirePositive(loadTimeout, "loadTimeout").toNanos();
        resumeAtLatest();
    }

    // ---------- navigation ----------

    public long undo() {
        long from = requireOrigin("undo");
        OptionalLong target = store.previousIndex(from);
        if (target.isEmpty()) {
            throw new NoSuchTransitionException("undo", "already at oldest snapshot " + from);
        }
        return navigateTo("undo", target.getAsLong());
    }

    public long redo() {
        long from = requireOrigin("redo");
        OptionalLong target = store.nextIndex(from);
        if (target.isEmpty()) {
            throw new NoSuchTransitionException("redo", "already at newest snapshot " + from);
        }
        return navigateTo("redo", target.getAsLong());
    }

    public long jumpToPrevBookmark() {
        long from = requireOrigin("prev-bookmark");
        return navigateTo("prev-bookmark", bookmarks.predecessorOf(from));
    }

    public long jumpToNextBookmark() {
        long from = requireOrigin("next-bookmark");
        return navigateTo("next-bookmark", bookmarks.successorOf(from));
    }

    /**
     * Handle the surface's report that it finished loading {@code confirmedTarget}.
     *
     * @return true if the confirmation matched the pending request and was applied,
     *         false if it was stale and discarded
     */
    public boolean onLoadConfirmed(long confirmedTarget) {
        if (!(protection instanceof Loading loading)
                || loading.confirmed()
                || loading.target() != confirmedTarget) {
            log.fine(() -> String.format("[%s] discarding stale confirmation for %d (state=%s)",
                    sessionId, confirmedTarget, protection));
            return false;
        }
        lastSavedState = loading.state();
        cursor = confirmedTarget;
        protection = loading.confirmedAt(ticker.nanos());
        log.info(String.format("[%s] load of snapshot %d confirmed", sessionId, confirmedTarget));
        return true;
    }

    // ---------- protection ----------

    /**
     * Whether auto-save must skip this tick. Also performs the two
     * time-driven transitions back to Idle: grace window elapsed, and
     * unconfirmed load timed out.
     */
    public boolean isProtected() {
        if (!(protection instanceof Loading loading)) {
            return false;
        }
        long elapsed = loading.elapsedNanos(ticker.nanos());
        if (!loading.confirmed()) {
            if (elapsed < loadTimeoutNanos) {
                return true;
            }
            log.warning(String.format(
                    "[%s] load of snapshot %d not confirmed after %d ms; resuming auto-save",
                    sessionId, loading.target(), Duration.ofNanos(elapsed).toMillis()));
            protection = ProtectionState.idle();
            return false;
        }
        if (elapsed < graceNanos) {
            return true;
        }
        protection = ProtectionState.idle();
        return false;
    }

    public ProtectionState.Phase phase() {
        if (!isProtected()) {
            return ProtectionState.Phase.IDLE;
        }
        return ((Loading) protection).confirmed() ? ProtectionState.Phase.GRACE : ProtectionState.Phase.LOADING;
    }

    public ProtectionState protection() {
        return protection;
    }

    /**
     * Incremented on every navigation that reached the surface. Lets
     * auto-save recognise a state answer that was requested before the
     * user navigated.
     */
    public long navigationEpoch() {
        return navigationEpoch;
    }

    // ---------- auto-save hooks ----------

    /**
     * Record a successful append. Cursor and lastSavedState follow it unless
     * a navigation is pending, in which case the navigation decides them.
     *
     * @return true if cursor moved to {@code index}
     */
    public boolean recordAppend(long index, AnnotationState state) {
        Objects.requireNonNull(state, "state");
        if (protection instanceof Loading loading) {
            log.fine(() -> String.format("[%s] snapshot %d appended while navigating to %d; cursor unchanged",
                    sessionId, index, loading.target()));
            return false;
        }
        cursor = index;
        lastSavedState = state;
        return true;
    }

    // ---------- views ----------

    public OptionalLong cursor() {
        return cursor == null ? OptionalLong.empty() : OptionalLong.of(cursor);
    }

    public Optional<AnnotationState> lastSavedState() {
        return Optional.ofNullable(lastSavedState);
    }

    public boolean canUndo() {
        return cursor != null && store.previousIndex(cursor).isPresent();
    }

    public boolean canRedo() {
        return cursor != null && store.nextIndex(cursor).isPresent();
    }

    public boolean canJumpToPrevBookmark() {
        if (cursor == null) {
            return false;
        }
        return bookmarks.list().stream().anyMatch(b -> b < cursor);
    }

    public boolean canJumpToNextBookmark() {
        if (cursor == null) {
            return false;
        }
        return bookmarks.list().stream().anyMatch(b -> b > cursor);
    }

    // ---------- internals ----------

    private long navigateTo(String action, long target) {
        AnnotationState state;
        try {
            state = store.read(target).state();
        } catch (SnapshotNotFoundException e) {
            protection = ProtectionState.idle();
            log.warning(String.format("[%s] %s to %d failed: %s", sessionId, action, target, e.getMessage()));
            throw e;
        } catch (SnapshotCorruptedException e) {
            protection = ProtectionState.idle();
            log.log(Level.SEVERE, String.format("[%s] %s to %d hit a corrupted record", sessionId, action, target), e);
            throw e;
        } catch (RuntimeException e) {
            protection = ProtectionState.idle();
            throw e;
        }

        protection = ProtectionState.loading(target, state, ticker.nanos());
        navigationEpoch++;
        try {
            surface.loadState(target, state);
        } catch (RuntimeException e) {
            protection = ProtectionState.idle();
            throw e;
        }
        log.info(String.format("[%s] %s: %s -> %d (loading)", sessionId, action, cursor, target));
        return target;
    }

    /** Where a navigation starts from: the pending target if one is loading, else the cursor. */
    private long requireOrigin(String action) {
        if (isProtected() && protection instanceof Loading loading && !loading.confirmed()) {
            return loading.target();
        }
        if (cursor == null) {
            throw new NoSuchTransitionException(action, "session has no snapshots yet");
        }
        return cursor;
    }

    private void resumeAtLatest() {
        OptionalLong latest = store.latestIndex();
        if (latest.isEmpty()) {
            return;
        }
        cursor = latest.getAsLong();
        try {
            lastSavedState = store.read(cursor).state();
        } catch (SnapshotReadException e) {
            // Cursor still points at an existing index; the next observation is saved as new.
            log.log(Level.SEVERE, String.format("[%s] cannot read latest snapshot %d", sessionId, cursor), e);
        }
    }

    private static Duration requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + d);
        }
        return d;
    }
}
