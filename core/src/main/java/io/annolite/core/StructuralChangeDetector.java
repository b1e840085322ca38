// file: core/src/main/java/io/annolite/core/StructuralChangeDetector.java
package io.annolite.core;

import java.util.Objects;

/**
 * Order-sensitive structural comparison.
 * <p>
 * Two states are equal only if they hold the same strokes in the same order,
 * each stroke with the same points in the same order, and the same viewport.
 * A drawing whose strokes were merely reordered counts as a change.
 * Coordinates are compared exactly; there is no tolerance.
 * <p>
 * A missing last-saved state always counts as a change, so the first
 * observation of a fresh session is persisted even if it is blank.
 */
public final class StructuralChangeDetector implements ChangeDetector {

    @Override
    public boolean shouldSave(AnnotationState candidate, AnnotationState lastSaved) {
        Objects.requireNonNull(candidate, "candidate");
        if (lastSaved == null) {
            return true;
        }
        return !candidate.equals(lastSaved);
    }
}
