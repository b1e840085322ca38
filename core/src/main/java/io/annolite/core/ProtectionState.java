// file: core/src/main/java/io/annolite/core/ProtectionState.java
package io.annolite.core;

import java.util.Objects;

/**
 * Whether a historical state is currently being loaded into the rendering
 * surface, and therefore whether auto-save must stay quiet.
 * <p>
 * Two shapes only:
 *  - Idle:    nothing pending, auto-save runs normally.
 *  - Loading: a navigation to {@code target} was issued at
 *             {@code issuedAtNanos}. Once the surface confirms it,
 *             {@code confirmed} flips to true and {@code issuedAtNanos} is
 *             re-stamped to the confirmation time, which starts the grace
 *             window.
 * <p>
 * Timestamps come from a {@link Ticker} (monotonic), never from wall time.
 */
public sealed interface ProtectionState permits ProtectionState.Idle, ProtectionState.Loading {

    static ProtectionState idle() {
        return Idle.INSTANCE;
    }

    static Loading loading(long target, AnnotationState state, long issuedAtNanos) {
        return new Loading(target, state, issuedAtNanos, false);
    }

    /** Coarse phase used by status views and logs. */
    enum Phase { IDLE, LOADING, GRACE }

    final class Idle implements ProtectionState {
        private static final Idle INSTANCE = new Idle();

        private Idle() {
        }

        @Override
        public String toString() {
            return "Idle";
        }
    }

    /**
     * @param target        snapshot index the surface was asked to show
     * @param state         content of that snapshot, becomes lastSavedState on confirmation
     * @param issuedAtNanos request time, or confirmation time once confirmed
     * @param confirmed     whether the surface reported the load as applied
     */
    record Loading(long target, AnnotationState state, long issuedAtNanos, boolean confirmed)
            implements ProtectionState {

        public Loading {
            Objects.requireNonNull(state, "state");
        }

        /** The same pending target, confirmed and re-stamped at {@code nowNanos}. */
        public Loading confirmedAt(long nowNanos) {
            return new Loading(target, state, nowNanos, true);
        }

        public long elapsedNanos(long nowNanos) {
            return nowNanos - issuedAtNanos;
        }
    }
}
