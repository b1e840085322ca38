// file: core/src/main/java/io/annolite/core/SnapshotCorruptedException.java
package io.annolite.core;

/**
 * A stored record exists but cannot be decoded, or does not describe the
 * index it is filed under. Indicates storage corruption.
 */
public final class SnapshotCorruptedException extends SnapshotReadException {

    public SnapshotCorruptedException(long index, String detail, Throwable cause) {
        super(index, "snapshot " + index + " is corrupted: " + detail, cause);
    }
}
