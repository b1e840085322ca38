// file: storage/src/main/java/io/annolite/storage/FileBookmarkIndex.java
package io.annolite.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.annolite.core.NoSuchTransitionException;
import io.annolite.core.SnapshotNotFoundException;
import io.annolite.core.SnapshotWriteException;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Objects;
import java.util.TreeSet;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Bookmark set persisted as a compact JSON array of indices, e.g.
 * {@code [3, 17, 48]}, in the session directory next to {@code live/}.
 * <p>
 * Queries run against an in-memory TreeSet (O(log n) floor/ceiling).
 * Every successful mark() rewrites the whole file atomically; the list is
 * small compared to the snapshot history.
 * <p>
 * On load, entries that no longer exist in the live sequence are dropped
 * with a warning. An unreadable file is logged and treated as empty; it is
 * left on disk until the next mark() replaces it.
 */
public final class FileBookmarkIndex implements BookmarkIndex {
    private static final Logger log = Logger.getLogger(FileBookmarkIndex.class.getName());
    private static final TypeReference<List<Long>> LIST_OF_LONG = new TypeReference<>() {};

    private final Path file;
    private final SnapshotStore live;
    private final ObjectMapper json = new ObjectMapper();

    // guarded by this
    private final TreeSet<Long> marks = new TreeSet<>();

    public FileBookmarkIndex(Path file, SnapshotStore live) {
        this.file = Objects.requireNonNull(file, "file");
        this.live = Objects.requireNonNull(live, "live");
        load();
    }

    @Override
    public synchronized boolean mark(long index) {
        if (!live.contains(index)) {
            throw new SnapshotNotFoundException(index);
        }
        if (!marks.add(index)) {
            return false;
        }
        try {
            persist();
        } catch (IOException e) {
            marks.remove(index);
            throw new SnapshotWriteException("cannot persist bookmark " + index + " to " + file, e);
        }
        return true;
    }

    @Override
    public synchronized long predecessorOf(long index) {
        Long prev = marks.lower(index);
        if (prev == null) {
            throw new NoSuchTransitionException("prev-bookmark", "no bookmark before " + index);
        }
        return prev;
    }

    @Override
    public synchronized long successorOf(long index) {
        Long next = marks.higher(index);
        if (next == null) {
            throw new NoSuchTransitionException("next-bookmark", "no bookmark after " + index);
        }
        return next;
    }

    @Override
    public synchronized boolean isMarked(long index) {
        return marks.contains(index);
    }

    @Override
    public synchronized List<Long> list() {
        return List.copyOf(marks);
    }

    private void persist() throws IOException {
        Files.createDirectories(file.getParent());
        byte[] bytes;
        try {
            bytes = json.writeValueAsBytes(List.copyOf(marks));
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode bookmark list", e);
        }
        AtomicFiles.write(file, bytes);
    }

    private void load() {
        if (!Files.exists(file)) {
            return;
        }
        List<Long> stored;
        try {
            stored = json.readValue(file.toFile(), LIST_OF_LONG);
        } catch (IOException e) {
            log.log(Level.SEVERE, "bookmark file " + file + " is unreadable; starting with no bookmarks", e);
            return;
        }
        if (stored == null) {
            return;
        }
        for (Long index : stored) {
            if (index == null) {
                continue;
            }
            if (live.contains(index)) {
                marks.add(index);
            } else {
                log.warning("dropping bookmark " + index + ": not in live sequence of " + file.getParent());
            }
        }
    }
}
