// file: core/src/main/java/io/annolite/core/SnapshotWriteException.java
package io.annolite.core;

/**
 * A durable append did not complete. No index was consumed and no existing
 * record was touched; the same state can simply be appended again.
 */
public final class SnapshotWriteException extends RuntimeException {

    public SnapshotWriteException(String message, Throwable cause) {
        super(message, cause);
    }
}
