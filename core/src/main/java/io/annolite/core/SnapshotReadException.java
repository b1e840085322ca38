// file: core/src/main/java/io/annolite/core/SnapshotReadException.java
package io.annolite.core;

/**
 * A snapshot could not be turned back into an annotation state.
 * Navigation treats every subtype the same way: the pending load is
 * abandoned and the cursor stays where it was.
 */
public abstract class SnapshotReadException extends RuntimeException {
    private final long index;

    protected SnapshotReadException(long index, String message, Throwable cause) {
        super(message, cause);
        this.index = index;
    }

    public long index() {
        return index;
    }
}
