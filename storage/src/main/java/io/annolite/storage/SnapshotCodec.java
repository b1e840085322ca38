// file: storage/src/main/java/io/annolite/storage/SnapshotCodec.java
package io.annolite.storage;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import io.annolite.core.Snapshot;
import io.annolite.core.SnapshotCorruptedException;
import io.annolite.storage.json.AnnotationJson;
import io.annolite.storage.json.SnapshotJson;

import java.io.IOException;
import java.time.Instant;
import java.time.format.DateTimeParseException;

/**
 * JSON encoding of one snapshot record.
 * <p>
 * Layout (pretty-printed so history files stay readable by hand):
 *   {
 *     "index": 47,
 *     "createdAt": "2026-10-17T09:30:12.481Z",
 *     "state": { "strokes": [...], "viewport": {...} }
 *   }
 * <p>
 * decode() rejects anything that does not round-trip into a valid
 * {@link Snapshot} for the expected index.
 */
final class SnapshotCodec {

    private final ObjectMapper json = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    byte[] encode(Snapshot snapshot) {
        SnapshotJson out = new SnapshotJson();
        out.index = snapshot.index();
        out.createdAt = snapshot.createdAt().toString();
        out.state = AnnotationJson.toJson(snapshot.state());
        try {
            return json.writeValueAsBytes(out);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("cannot encode snapshot " + snapshot.index(), e);
        }
    }

    Snapshot decode(long expectedIndex, byte[] bytes) {
        SnapshotJson in;
        try {
            in = json.readValue(bytes, SnapshotJson.class);
        } catch (IOException e) {
            throw new SnapshotCorruptedException(expectedIndex, "malformed JSON", e);
        }
        if (in == null) {
            throw new SnapshotCorruptedException(expectedIndex, "empty record", null);
        }
        if (in.index != expectedIndex) {
            throw new SnapshotCorruptedException(expectedIndex,
                    "record claims index " + in.index, null);
        }
        if (in.state == null) {
            throw new SnapshotCorruptedException(expectedIndex, "missing state", null);
        }
        try {
            Instant createdAt = in.createdAt == null ? Instant.EPOCH : Instant.parse(in.createdAt);
            return new Snapshot(in.index, AnnotationJson.fromJson(in.state), createdAt);
        } catch (IllegalArgumentException | NullPointerException | DateTimeParseException e) {
            throw new SnapshotCorruptedException(expectedIndex, e.getMessage(), e);
        }
    }
}
