// file: server/src/main/java/io/annolite/server/surface/SurfaceCommand.java
package io.annolite.server.surface;

import io.annolite.core.AnnotationState;

import java.util.Objects;

/**
 * Outbound instruction waiting for the rendering surface to pick it up.
 */
public sealed interface SurfaceCommand permits SurfaceCommand.Load, SurfaceCommand.RequestState {

    /** Show {@code state}, then confirm {@code target}. */
    record Load(long target, AnnotationState state) implements SurfaceCommand {
        public Load {
            Objects.requireNonNull(state, "state");
        }
    }

    /** Report the full current state, tagged with {@code requestId}. */
    record RequestState(long requestId) implements SurfaceCommand {
    }
}
