// file: core/src/main/java/io/annolite/core/Ticker.java
package io.annolite.core;

/**
 * Monotonic time source in nanoseconds.
 * <p>
 * Only differences between two readings are meaningful. Tests substitute a
 * manually advanced implementation.
 */
@FunctionalInterface
public interface Ticker {

    long nanos();

    static Ticker system() {
        return System::nanoTime;
    }
}
