// file: server/src/test/java/io/annolite/server/surface/QueuedRenderingSurfaceTest.java
package io.annolite.server.surface;

import io.annolite.core.AnnotationState;
import io.annolite.core.Viewport;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class QueuedRenderingSurfaceTest {

    @Test
    void drain_returns_commands_in_issue_order_and_empties_queue() {
        var surface = new QueuedRenderingSurface();
        surface.requestCurrentState(1);
        surface.loadState(48, AnnotationState.empty());

        assertEquals(List.of(
                new SurfaceCommand.RequestState(1),
                new SurfaceCommand.Load(48, AnnotationState.empty())
        ), surface.drain());
        assertTrue(surface.drain().isEmpty());
    }

    @Test
    void newer_load_replaces_undrained_one() {
        var surface = new QueuedRenderingSurface();
        var later = AnnotationState.empty().withViewport(new Viewport(2, 10, 10));
        surface.loadState(48, AnnotationState.empty());
        surface.loadState(47, later);

        assertEquals(List.of(new SurfaceCommand.Load(47, later)), surface.drain());
    }

    @Test
    void only_latest_state_request_is_kept() {
        var surface = new QueuedRenderingSurface();
        surface.requestCurrentState(1);
        surface.requestCurrentState(2);
        surface.requestCurrentState(3);

        assertEquals(1, surface.size());
        assertEquals(List.of(new SurfaceCommand.RequestState(3)), surface.drain());
    }
}
