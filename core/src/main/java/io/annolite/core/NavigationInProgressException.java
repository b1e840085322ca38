// file: core/src/main/java/io/annolite/core/NavigationInProgressException.java
package io.annolite.core;

/**
 * An operation needs to know what the rendering surface shows, but a
 * historical load is still unconfirmed.
 */
public final class NavigationInProgressException extends RuntimeException {

    public NavigationInProgressException(long pendingTarget) {
        super("navigation to snapshot " + pendingTarget + " is still in progress");
    }
}
