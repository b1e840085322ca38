// file: storage/src/main/java/io/annolite/storage/FileSnapshotStore.java
package io.annolite.storage;

import io.annolite.core.AnnotationState;
import io.annolite.core.Snapshot;
import io.annolite.core.SnapshotNotFoundException;
import io.annolite.core.SnapshotWriteException;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.time.Clock;
import java.util.List;
import java.util.NavigableSet;
import java.util.Objects;
import java.util.OptionalLong;
import java.util.concurrent.ConcurrentSkipListSet;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.stream.Stream;

/**
 * Snapshot store backed by one JSON file per snapshot in a session's
 * {@code live/} directory.
 * <p>
 * Properties:
 *  - On construction it creates the directory if needed and scans it once.
 *    Only names of the form "<digits>.json" count; "*.tmp" leftovers from an
 *    interrupted write and foreign files are ignored.
 *  - append() writes through {@link AtomicFiles}, so a crash mid-write leaves
 *    at most a stray temp file and never a partial record.
 *  - The in-memory index set is updated only after the record was published;
 *    that is what keeps a failed append from consuming its index.
 *  - An existing record is never replaced. If another instance on the same
 *    directory already wrote the next index, append moves on to the one after.
 *  - Readers (listIndices/contains/read) may run on any thread. append() is
 *    serialized on this instance.
 */
public final class FileSnapshotStore implements SnapshotStore {
    private static final Logger log = Logger.getLogger(FileSnapshotStore.class.getName());
    private static final Pattern RECORD_NAME = Pattern.compile("(\\d{1,18})\\.json");

    private final Path dir;
    private final long firstIndex;
    private final Clock clock;
    private final SnapshotCodec codec = new SnapshotCodec();
    private final NavigableSet<Long> indices = new ConcurrentSkipListSet<>();

    public FileSnapshotStore(Path dir) {
        this(dir, 0L, Clock.systemUTC());
    }

    /**
     * @param dir        the session's live directory
     * @param firstIndex index assigned by the first append into an empty directory
     * @param clock      wall clock used only for the createdAt metadata
     */
    public FileSnapshotStore(Path dir, long firstIndex, Clock clock) {
        if (firstIndex < 0) {
            throw new IllegalArgumentException("firstIndex must be >= 0, got: " + firstIndex);
        }
        this.dir = Objects.requireNonNull(dir, "dir");
        this.firstIndex = firstIndex;
        this.clock = Objects.requireNonNull(clock, "clock");
        try {
            Files.createDirectories(dir);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot create snapshot directory " + dir, e);
        }
        scan();
    }

    @Override
    public synchronized long append(AnnotationState state) {
        Objects.requireNonNull(state, "state");
        long index = indices.isEmpty() ? firstIndex : indices.last() + 1;
        while (true) {
            var snapshot = new Snapshot(index, state, clock.instant());
            Path dst = dir.resolve(SessionLayout.snapshotFileName(index));
            try {
                AtomicFiles.writeNew(dst, codec.encode(snapshot));
            } catch (FileAlreadyExistsException e) {
                // Written by another store instance on the same directory since our scan.
                log.warning(String.format("snapshot %d already exists in %s; appending after it", index, dir));
                indices.add(index);
                index++;
                continue;
            } catch (IOException e) {
                throw new SnapshotWriteException("append of snapshot " + index + " to " + dir + " failed", e);
            }
            indices.add(index);
            log.log(Level.FINE, "wrote {0}", dst);
            return index;
        }
    }

    @Override
    public Snapshot read(long index) {
        if (!indices.contains(index)) {
            throw new SnapshotNotFoundException(index);
        }
        byte[] bytes;
        try {
            bytes = Files.readAllBytes(dir.resolve(SessionLayout.snapshotFileName(index)));
        } catch (NoSuchFileException e) {
            throw new SnapshotNotFoundException(index, e);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot read snapshot " + index + " in " + dir, e);
        }
        return codec.decode(index, bytes);
    }

    @Override
    public List<Long> listIndices() {
        return List.copyOf(indices);
    }

    @Override
    public boolean contains(long index) {
        return indices.contains(index);
    }

    @Override
    public OptionalLong latestIndex() {
        return indices.isEmpty() ? OptionalLong.empty() : OptionalLong.of(indices.last());
    }

    @Override
    public OptionalLong previousIndex(long index) {
        return toOptional(indices.lower(index));
    }

    @Override
    public OptionalLong nextIndex(long index) {
        return toOptional(indices.higher(index));
    }

    private void scan() {
        try (Stream<Path> files = Files.list(dir)) {
            files.map(p -> RECORD_NAME.matcher(p.getFileName().toString()))
                    .filter(Matcher::matches)
                    .map(m -> Long.parseLong(m.group(1)))
                    .forEach(indices::add);
        } catch (IOException e) {
            throw new UncheckedIOException("cannot list snapshot directory " + dir, e);
        }
    }

    private static OptionalLong toOptional(Long value) {
        return value == null ? OptionalLong.empty() : OptionalLong.of(value);
    }
}
