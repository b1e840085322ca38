// file: core/src/main/java/io/annolite/core/ChangeDetector.java
package io.annolite.core;

/**
 * Decides whether a freshly observed annotation state is worth persisting.
 * <p>
 * Implementations must be pure: no I/O, no mutation of either argument.
 */
public interface ChangeDetector {

    /**
     * @param candidate state just reported by the rendering surface
     * @param lastSaved state the session last persisted or loaded, or null if
     *                  the session has never saved anything
     * @return true if {@code candidate} should be appended as a new snapshot
     */
    boolean shouldSave(AnnotationState candidate, AnnotationState lastSaved);
}
