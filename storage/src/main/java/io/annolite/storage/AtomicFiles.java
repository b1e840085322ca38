// file: storage/src/main/java/io/annolite/storage/AtomicFiles.java
package io.annolite.storage;

import java.io.IOException;
import java.nio.ByteBuffer;
import java.nio.channels.FileChannel;
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;

import static java.nio.file.StandardCopyOption.ATOMIC_MOVE;
import static java.nio.file.StandardCopyOption.REPLACE_EXISTING;
import static java.nio.file.StandardOpenOption.*;

/**
 * Whole-file replace that readers never observe half-written.
 * <p>
 * Steps:
 *  1) write bytes to "<name>.tmp" next to the destination,
 *  2) force(true) so data and metadata are on disk,
 *  3) ATOMIC_MOVE over the destination.
 * <p>
 * If any step fails the temp file is removed (best effort) and the
 * destination is left exactly as it was.
 * <p>
 * {@link #writeNew} publishes with a hard link instead of the move, for
 * records that must never be overwritten.
 */
final class AtomicFiles {

    static final String TMP_SUFFIX = ".tmp";

    private AtomicFiles() {
        // utility
    }

    static void write(Path dst, byte[] bytes) throws IOException {
        Path tmp = writeTemp(dst, bytes);
        try {
            Files.move(tmp, dst, ATOMIC_MOVE, REPLACE_EXISTING);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw e;
        }
    }

    /**
     * Like {@link #write} but never replaces an existing file: the record is
     * published with a hard link, which fails if {@code dst} already exists.
     *
     * @throws FileAlreadyExistsException if {@code dst} exists; it is left untouched
     */
    static void writeNew(Path dst, byte[] bytes) throws IOException {
        Path tmp = writeTemp(dst, bytes);
        try {
            try {
                Files.createLink(dst, tmp);
            } catch (UnsupportedOperationException noLinks) {
                // No hard links on this file system; a plain move still refuses an existing target.
                Files.move(tmp, dst);
                return;
            }
            Files.delete(tmp);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw e;
        }
    }

    private static Path writeTemp(Path dst, byte[] bytes) throws IOException {
        Path tmp = dst.resolveSibling(dst.getFileName().toString() + TMP_SUFFIX);
        try (FileChannel ch = FileChannel.open(tmp, CREATE, WRITE, TRUNCATE_EXISTING)) {
            ByteBuffer buf = ByteBuffer.wrap(bytes);
            while (buf.hasRemaining()) {
                ch.write(buf);
            }
            ch.force(true);
        } catch (IOException e) {
            deleteQuietly(tmp, e);
            throw e;
        }
        return tmp;
    }

    private static void deleteQuietly(Path tmp, IOException primary) {
        try {
            Files.deleteIfExists(tmp);
        } catch (IOException cleanup) {
            primary.addSuppressed(cleanup);
        }
    }
}
