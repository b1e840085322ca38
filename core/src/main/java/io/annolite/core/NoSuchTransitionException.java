// file: core/src/main/java/io/annolite/core/NoSuchTransitionException.java
package io.annolite.core;

/**
 * A navigation was requested from a position that has nowhere to go,
 * e.g. undo at the oldest snapshot. A normal boundary, not a failure.
 */
public final class NoSuchTransitionException extends RuntimeException {
    private final String action;

    public NoSuchTransitionException(String action, String detail) {
        super(action + ": " + detail);
        this.action = action;
    }

    public String action() {
        return action;
    }
}
