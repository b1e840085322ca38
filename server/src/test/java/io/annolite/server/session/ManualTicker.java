// file: server/src/test/java/io/annolite/server/session/ManualTicker.java
package io.annolite.server.session;

import io.annolite.core.Ticker;

import java.time.Duration;

/** Ticker that only moves when a test says so. */
final class ManualTicker implements Ticker {
    private long now = 1_000_000_000L;

    @Override
    public long nanos() {
        return now;
    }

    void advance(Duration d) {
        now += d.toNanos();
    }

    void advanceMillis(long millis) {
        advance(Duration.ofMillis(millis));
    }
}
