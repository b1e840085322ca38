// file: storage/src/main/java/io/annolite/storage/FileReviewStatusStore.java
package io.annolite.storage;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.annolite.core.ReviewStatus;
import io.annolite.core.SnapshotWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.format.DateTimeParseException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Review flags for every image in one consolidated JSON file:
 * <pre>
 *   {
 *     "slide-001": { "done": true, "inkFound": false, "lastUpdated": "2026-10-17T09:30:12Z" },
 *     ...
 *   }
 * </pre>
 * Each update is a read-modify-write of the whole file under this
 * instance's monitor, written through {@link AtomicFiles}. One instance is
 * expected per data directory. A malformed file is logged and treated as
 * empty.
 */
public final class FileReviewStatusStore implements ReviewStatusStore {
    private static final Logger log = Logger.getLogger(FileReviewStatusStore.class.getName());
    private static final TypeReference<LinkedHashMap<String, Entry>> MAP_TYPE = new TypeReference<>() {};

    /** JSON shape of one entry. */
    public static class Entry {
        public boolean done;
        public boolean inkFound;
        public String lastUpdated;
    }

    private final Path file;
    private final Clock clock;
    private final ObjectMapper json = new ObjectMapper().enable(SerializationFeature.INDENT_OUTPUT);

    public FileReviewStatusStore(Path file, Clock clock) {
        this.file = Objects.requireNonNull(file, "file");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    @Override
    public synchronized ReviewStatus get(String sessionId) {
        Entry e = readAll().get(SessionLayout.requireValidSessionId(sessionId));
        return e == null ? ReviewStatus.initial(clock.instant()) : toStatus(e);
    }

    @Override
    public synchronized ReviewStatus toggleDone(String sessionId) {
        ReviewStatus current = get(sessionId);
        return put(sessionId, !current.done(), false);
    }

    @Override
    public synchronized ReviewStatus toggleInkFound(String sessionId) {
        ReviewStatus current = get(sessionId);
        return put(sessionId, current.done(), !current.inkFound());
    }

    @Override
    public synchronized ReviewStatus markSaved(String sessionId) {
        return put(sessionId, true, true);
    }

    @Override
    public synchronized Counts counts() {
        int done = 0;
        int ink = 0;
        for (Entry e : readAll().values()) {
            if (e == null) {
                continue;
            }
            if (e.done) done++;
            if (e.inkFound) ink++;
        }
        return new Counts(done, ink);
    }

    private ReviewStatus put(String sessionId, boolean done, boolean inkFound) {
        Map<String, Entry> all = readAll();
        Instant now = clock.instant();
        Entry entry = new Entry();
        entry.done = done;
        entry.inkFound = inkFound;
        entry.lastUpdated = now.toString();
        all.put(SessionLayout.requireValidSessionId(sessionId), entry);

        try {
            Files.createDirectories(file.getParent());
            AtomicFiles.write(file, json.writeValueAsBytes(all));
        } catch (IOException e) {
            throw new SnapshotWriteException("cannot write review status file " + file, e);
        }
        log.info(String.format("review status %s: done=%s inkFound=%s", sessionId, done, inkFound));
        return new ReviewStatus(done, inkFound, now);
    }

    private Map<String, Entry> readAll() {
        if (!Files.exists(file)) {
            return new LinkedHashMap<>();
        }
        try {
            LinkedHashMap<String, Entry> all = json.readValue(file.toFile(), MAP_TYPE);
            return all == null ? new LinkedHashMap<>() : all;
        } catch (IOException e) {
            log.log(Level.WARNING, "review status file " + file + " is unreadable; treating as empty", e);
            return new LinkedHashMap<>();
        }
    }

    private ReviewStatus toStatus(Entry e) {
        Instant updated;
        try {
            updated = e.lastUpdated == null ? clock.instant() : Instant.parse(e.lastUpdated);
        } catch (DateTimeParseException bad) {
            log.fine("unparseable lastUpdated '" + e.lastUpdated + "', using now");
            updated = clock.instant();
        }
        return new ReviewStatus(e.done, e.inkFound, updated);
    }
}
