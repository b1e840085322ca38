// file: server/src/main/java/io/annolite/server/surface/QueuedRenderingSurface.java
package io.annolite.server.surface;

import io.annolite.core.AnnotationState;
import io.annolite.server.session.RenderingSurface;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * Rendering surface for a remote drawing client that polls for work.
 * <p>
 * The session pushes commands here; the client drains them over HTTP and
 * answers through the session's inbound events.
 * <p>
 * At most one command of each kind is kept: a newer load replaces an
 * undrained older load, and a newer state request replaces an older one.
 * The replaced commands would only produce stale answers.
 */
public final class QueuedRenderingSurface implements RenderingSurface {

    private final Deque<SurfaceCommand> pending = new ArrayDeque<>();

    @Override
    public synchronized void loadState(long target, AnnotationState state) {
        pending.removeIf(c -> c instanceof SurfaceCommand.Load);
        pending.addLast(new SurfaceCommand.Load(target, state));
    }

    @Override
    public synchronized void requestCurrentState(long requestId) {
        pending.removeIf(c -> c instanceof SurfaceCommand.RequestState);
        pending.addLast(new SurfaceCommand.RequestState(requestId));
    }

    /** Remove and return all queued commands, oldest first. */
    public synchronized List<SurfaceCommand> drain() {
        List<SurfaceCommand> out = List.copyOf(pending);
        pending.clear();
        return out;
    }

    public synchronized int size() {
        return pending.size();
    }
}
