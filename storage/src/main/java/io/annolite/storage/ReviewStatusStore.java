// file: storage/src/main/java/io/annolite/storage/ReviewStatusStore.java
package io.annolite.storage;

import io.annolite.core.ReviewStatus;

/**
 * Per-image review flags shared by all sessions of one data directory.
 * <p>
 * Transitions:
 *  - toggleDone:     done flips; inkFound is reset to false either way.
 *  - toggleInkFound: inkFound flips; done is untouched.
 *  - markSaved:      both become true (a bookmarked image counts as reviewed).
 */
public interface ReviewStatusStore {

    /** Stored status, or both flags false if the image was never touched. */
    ReviewStatus get(String sessionId);

    ReviewStatus toggleDone(String sessionId);

    ReviewStatus toggleInkFound(String sessionId);

    ReviewStatus markSaved(String sessionId);

    Counts counts();

    /** Totals across all images in the store. */
    record Counts(int done, int inkFound) {}
}
