// file: server/src/main/java/io/annolite/server/session/RenderingSurface.java
package io.annolite.server.session;

import io.annolite.core.AnnotationState;

/**
 * Outbound half of the conversation with whatever draws the annotations.
 * <p>
 * Both calls are fire-and-forget: the surface answers later, through
 * {@link EditingSession#onCurrentState(long, AnnotationState)} and
 * {@link EditingSession#onLoadConfirmed(long)}. Implementations must not
 * block the caller, which is the session executor.
 */
public interface RenderingSurface {

    /**
     * Replace what the surface shows with {@code state}. The surface must
     * eventually confirm with the same {@code target}.
     */
    void loadState(long target, AnnotationState state);

    /**
     * Ask the surface for its full current state. The answer must carry
     * {@code requestId} so it can be matched to this request.
     */
    void requestCurrentState(long requestId);
}
