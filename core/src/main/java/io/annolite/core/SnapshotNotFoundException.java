// file: core/src/main/java/io/annolite/core/SnapshotNotFoundException.java
package io.annolite.core;

/** No record exists at the requested index. */
public final class SnapshotNotFoundException extends SnapshotReadException {

    public SnapshotNotFoundException(long index) {
        super(index, "no snapshot at index " + index, null);
    }

    public SnapshotNotFoundException(long index, Throwable cause) {
        super(index, "no snapshot at index " + index, cause);
    }
}
