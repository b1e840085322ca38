// file: core/src/main/java/io/annolite/core/ReviewStatus.java
package io.annolite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * Per-image review flags kept next to the annotation history.
 * <p>
 *  - done:     the reviewer finished this image.
 *  - inkFound: the reviewer marked ink on this image.
 */
public record ReviewStatus(boolean done, boolean inkFound, Instant lastUpdated) {
    public ReviewStatus {
        Objects.requireNonNull(lastUpdated, "lastUpdated");
    }

    public static ReviewStatus initial(Instant now) {
        return new ReviewStatus(false, false, now);
    }
}
