// file: server/src/main/java/io/annolite/server/session/SessionSettings.java
package io.annolite.server.session;

import java.time.Duration;
import java.util.Objects;

/**
 * Timing and indexing knobs shared by every session of one server.
 *
 * @param autosavePeriod how often the auto-save tick runs
 * @param graceWindow    how long auto-save stays quiet after a confirmed load
 * @param loadTimeout    how long an unconfirmed load may keep auto-save paused
 * @param firstIndex     index given to the first snapshot of an empty session
 */
public record SessionSettings(
        Duration autosavePeriod,
        Duration graceWindow,
        Duration loadTimeout,
        long firstIndex
) {
    public SessionSettings {
        requirePositive(autosavePeriod, "autosavePeriod");
        requirePositive(graceWindow, "graceWindow");
        requirePositive(loadTimeout, "loadTimeout");
        if (firstIndex < 0) {
            throw new IllegalArgumentException("firstIndex must be >= 0, got: " + firstIndex);
        }
    }

    public static SessionSettings defaults() {
        return new SessionSettings(
                Duration.ofSeconds(1),
                Duration.ofSeconds(2),
                Duration.ofSeconds(10),
                0L
        );
    }

    private static void requirePositive(Duration d, String name) {
        Objects.requireNonNull(d, name);
        if (d.isNegative() || d.isZero()) {
            throw new IllegalArgumentException(name + " must be positive, got: " + d);
        }
    }
}
