// file: storage/src/main/java/io/annolite/storage/SnapshotStore.java
package io.annolite.storage;

import io.annolite.core.AnnotationState;
import io.annolite.core.Snapshot;

import java.util.List;
import java.util.OptionalLong;

/**
 * Append-only, per-session log of annotation states.
 * <p>
 * Contract:
 *  - append() assigns max(existing) + 1 (or the configured first index when
 *    empty), makes the record durable, and only then makes it visible.
 *  - A failed append consumes no index; the next success reuses it.
 *  - Records are never rewritten or removed by this interface.
 *  - At most one append runs at a time per store.
 */
public interface SnapshotStore {

    /**
     * @return the index assigned to {@code state}
     * @throws io.annolite.core.SnapshotWriteException if the durable write failed
     */
    long append(AnnotationState state);

    /**
     * @throws io.annolite.core.SnapshotNotFoundException  if nothing is stored at {@code index}
     * @throws io.annolite.core.SnapshotCorruptedException if the record cannot be decoded
     */
    Snapshot read(long index);

    /** Existing indices, ascending. */
    List<Long> listIndices();

    boolean contains(long index);

    OptionalLong latestIndex();

    /** Greatest existing index strictly below {@code index}. */
    OptionalLong previousIndex(long index);

    /** Smallest existing index strictly above {@code index}. */
    OptionalLong nextIndex(long index);
}
