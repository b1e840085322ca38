// file: storage/src/main/java/io/annolite/storage/BookmarkIndex.java
package io.annolite.storage;

import java.util.List;

/**
 * Sparse, ordered set of snapshot indices the user explicitly marked.
 * Always a subset of the session's live sequence.
 */
public interface BookmarkIndex {

    /**
     * Mark {@code index}. Marking an already-marked index is a no-op.
     *
     * @return true if the index was newly marked
     * @throws io.annolite.core.SnapshotNotFoundException if the index is not in the live sequence
     * @throws io.annolite.core.SnapshotWriteException    if the bookmark list could not be persisted
     */
    boolean mark(long index);

    /**
     * @throws io.annolite.core.NoSuchTransitionException if no bookmark lies strictly below {@code index}
     */
    long predecessorOf(long index);

    /**
     * @throws io.annolite.core.NoSuchTransitionException if no bookmark lies strictly above {@code index}
     */
    long successorOf(long index);

    boolean isMarked(long index);

    /** Bookmarked indices, ascending. */
    List<Long> list();
}
