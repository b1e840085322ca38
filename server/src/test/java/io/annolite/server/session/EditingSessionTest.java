// file: server/src/test/java/io/annolite/server/session/EditingSessionTest.java
package io.annolite.server.session;

import io.annolite.core.AnnotationState;
import io.annolite.core.NavigationInProgressException;
import io.annolite.core.NoSuchTransitionException;
import io.annolite.core.ProtectionState;
import io.annolite.core.StructuralChangeDetector;
import io.annolite.core.Ticker;
import io.annolite.storage.FileBookmarkIndex;
import io.annolite.storage.FileReviewStatusStore;
import io.annolite.storage.FileSnapshotStore;
import io.annolite.storage.SessionLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static io.annolite.server.session.Drawings.numbered;
import static io.annolite.server.session.Drawings.withExtraStroke;
import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for one session over real threads and real files.
 *
 * The surface fake answers state requests with whatever it currently
 * "shows" and, unless told otherwise, confirms every load right away.
 */
class EditingSessionTest {

    private static final String ID = "slide-007.svs";

    @TempDir Path dataDir;

    private SessionLayout layout;
    private FileSnapshotStore store;
    private FileBookmarkIndex bookmarks;
    private FileReviewStatusStore review;
    private EchoSurface surface;
    private ExecutorService io;
    private EditingSession session;

    @BeforeEach
    void setUp() {
        layout = new SessionLayout(dataDir);
        store = new FileSnapshotStore(layout.liveDir(ID), 0L, Clock.systemUTC());
        bookmarks = new FileBookmarkIndex(layout.bookmarksFile(ID), store);
        review = new FileReviewStatusStore(layout.reviewStatusFile(), Clock.systemUTC());
        surface = new EchoSurface();
        io = Executors.newSingleThreadExecutor();
    }

    @AfterEach
    void tearDown() throws InterruptedException {
        if (session != null) {
            session.close();
        }
        io.shutdown();
        assertTrue(io.awaitTermination(5, TimeUnit.SECONDS));
    }

    private EditingSession open(Duration autosave, Duration grace) {
        var settings = new SessionSettings(autosave, grace, Duration.ofSeconds(5), 0L);
        session = new EditingSession(ID, store, bookmarks, review, surface,
                new StructuralChangeDetector(), Ticker.system(), io, settings);
        surface.session = session;
        return session;
    }

    @Test
    void edits_are_saved_and_undo_loads_previous_drawing_without_duplicate() throws Exception {
        open(Duration.ofMillis(20), Duration.ofMillis(200)).start();

        surface.shown = numbered(1);
        awaitTrue(() -> cursorIs(0));
        surface.shown = withExtraStroke(numbered(1));
        awaitTrue(() -> cursorIs(1));

        assertEquals(0, session.undo());
        awaitTrue(() -> cursorIs(0));
        assertEquals(numbered(1), surface.shown);

        // well past the grace window, the loaded drawing is still not re-saved
        Thread.sleep(400);
        assertEquals(List.of(0L, 1L), store.listIndices());
        assertEquals(ProtectionState.Phase.IDLE, session.status().state());

        surface.shown = numbered(2);
        awaitTrue(() -> cursorIs(2));
        assertEquals(3, store.listIndices().size());
        assertTrue(session.status().canUndo());
        assertFalse(session.status().canRedo());
    }

    @Test
    void restart_resumes_at_latest_snapshot() {
        store.append(numbered(1));
        store.append(numbered(2));
        store.append(numbered(3));

        SessionStatus status = open(Duration.ofSeconds(1), Duration.ofSeconds(2)).status();

        assertEquals(2L, status.cursor());
        assertEquals(2L, status.latestIndex());
        assertEquals(3, status.snapshotCount());
        assertEquals(ProtectionState.Phase.IDLE, status.state());
        assertTrue(status.canUndo());
    }

    @Test
    void undo_at_oldest_snapshot_is_reported_not_thrown_away() {
        store.append(numbered(1));
        open(Duration.ofSeconds(1), Duration.ofSeconds(2));

        assertThrows(NoSuchTransitionException.class, session::undo);

        SessionStatus status = session.status();
        assertEquals(0L, status.cursor());
        assertFalse(status.canUndo());
        assertTrue(status.lastMessage().contains("undo"));
    }

    @Test
    void bookmark_current_saves_changed_drawing_then_marks_it() throws Exception {
        store.append(numbered(1));
        open(Duration.ofSeconds(60), Duration.ofSeconds(2)); // no tick during the test
        surface.shown = withExtraStroke(numbered(1));

        long marked = session.bookmarkCurrent().get(5, TimeUnit.SECONDS);

        assertEquals(1, marked);
        assertEquals(withExtraStroke(numbered(1)), store.read(1).state());
        assertEquals(List.of(1L), bookmarks.list());
        assertTrue(review.get(ID).done());
        assertTrue(review.get(ID).inkFound());
    }

    @Test
    void bookmark_current_of_unchanged_drawing_marks_cursor() throws Exception {
        store.append(numbered(1));
        store.append(numbered(2));
        open(Duration.ofSeconds(60), Duration.ofSeconds(2));
        surface.shown = numbered(2);

        assertEquals(1L, session.bookmarkCurrent().get(5, TimeUnit.SECONDS));
        assertEquals(2, store.listIndices().size());
    }

    @Test
    void bookmark_while_load_unconfirmed_is_rejected() {
        store.append(numbered(1));
        store.append(numbered(2));
        open(Duration.ofSeconds(60), Duration.ofSeconds(2));
        surface.autoConfirm = false;

        session.undo();

        assertThrows(NavigationInProgressException.class, session::bookmarkCurrent);
        assertTrue(bookmarks.list().isEmpty());
        assertEquals(ProtectionState.Phase.LOADING, session.status().state());
    }

    @Test
    void bookmark_inside_grace_window_marks_loaded_snapshot() throws Exception {
        store.append(numbered(1));
        store.append(numbered(2));
        open(Duration.ofSeconds(60), Duration.ofSeconds(30));

        session.undo();
        awaitTrue(() -> session.status().state() == ProtectionState.Phase.GRACE);

        assertEquals(0L, session.bookmarkCurrent().get(5, TimeUnit.SECONDS));
        assertEquals(List.of(0L), bookmarks.list());
    }

    @Test
    void bookmark_jumps_navigate_between_marks() throws Exception {
        for (int i = 0; i < 5; i++) {
            store.append(numbered(i));
        }
        bookmarks.mark(1);
        bookmarks.mark(3);
        open(Duration.ofSeconds(60), Duration.ofMillis(50));

        assertEquals(3, session.jumpToPrevBookmark());
        awaitTrue(() -> cursorIs(3));
        assertEquals(1, session.jumpToPrevBookmark());
        awaitTrue(() -> cursorIs(1));
        assertThrows(NoSuchTransitionException.class, session::jumpToPrevBookmark);
        assertEquals(3, session.jumpToNextBookmark());
    }

    @Test
    void review_toggles_are_per_image() {
        open(Duration.ofSeconds(60), Duration.ofSeconds(2));

        assertTrue(session.toggleDone().done());
        assertTrue(session.toggleInkFound().inkFound());
        assertTrue(session.status().review().done());
        assertFalse(review.get("other-image").done());
    }

    @Test
    void closed_session_rejects_commands() {
        open(Duration.ofSeconds(60), Duration.ofSeconds(2));
        session.close();

        assertThrows(IllegalStateException.class, session::undo);
        assertThrows(IllegalStateException.class, () -> session.onLoadConfirmed(1));
        session.close(); // idempotent
    }

    private boolean cursorIs(long index) {
        return Long.valueOf(index).equals(session.status().cursor());
    }

    private static void awaitTrue(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s");
            }
            Thread.sleep(10);
        }
    }

    /** Surface that shows whatever the test sets and answers immediately. */
    private static final class EchoSurface implements RenderingSurface {
        volatile EditingSession session;
        volatile AnnotationState shown = AnnotationState.empty();
        volatile boolean autoConfirm = true;

        @Override
        public void loadState(long target, AnnotationState state) {
            shown = state;
            if (autoConfirm) {
                session.onLoadConfirmed(target);
            }
        }

        @Override
        public void requestCurrentState(long requestId) {
            session.onCurrentState(requestId, shown);
        }
    }
}
