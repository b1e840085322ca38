// file: core/src/main/java/io/annolite/core/Snapshot.java
package io.annolite.core;

import java.time.Instant;
import java.util.Objects;

/**
 * A persisted annotation state, addressed by its position in the session's
 * live sequence.
 * <p>
 * createdAt is wall-clock metadata for humans and tooling. Ordering comes
 * from {@code index} only.
 */
public record Snapshot(long index, AnnotationState state, Instant createdAt) {
    public Snapshot {
        if (index < 0) {
            throw new IllegalArgumentException("index must be >= 0, got: " + index);
        }
        Objects.requireNonNull(state, "state");
        Objects.requireNonNull(createdAt, "createdAt");
    }
}
