// file: server/src/test/java/io/annolite/server/WebServerTest.java
package io.annolite.server;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.annolite.core.AnnotationState;
import io.annolite.core.Point;
import io.annolite.core.Stroke;
import io.annolite.core.StructuralChangeDetector;
import io.annolite.core.Ticker;
import io.annolite.server.session.SessionSettings;
import io.annolite.storage.FileReviewStatusStore;
import io.annolite.storage.FileSnapshotStore;
import io.annolite.storage.SessionLayout;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * End-to-end specs for the HTTP adapter against a live Undertow server.
 *
 * Focus:
 *  - Routing and method checks.
 *  - Validation: bad session id, invalid JSON, oversized body -> 400/413.
 *  - Navigation outcomes -> 200/404/409/422.
 *  - The surface round trip: drain commands, answer, confirm.
 */
class WebServerTest {

    private static final int PORT = 18091; // test-only port
    private static final String IMAGE = "slide-42.svs";

    @TempDir Path dataDir;

    private final ObjectMapper json = new ObjectMapper();
    private SessionLayout layout;
    private ExecutorService io;
    private SessionRegistry registry;
    private WebServer server;
    private HttpClient client;

    @BeforeEach
    void startServer() {
        layout = new SessionLayout(dataDir);
        io = Executors.newSingleThreadExecutor();
        var settings = new SessionSettings(
                Duration.ofSeconds(60), // no background ticks during a test
                Duration.ofMillis(100),
                Duration.ofSeconds(10),
                0L);
        registry = new SessionRegistry(
                layout,
                new FileReviewStatusStore(layout.reviewStatusFile(), Clock.systemUTC()),
                new StructuralChangeDetector(),
                Ticker.system(),
                io,
                settings,
                Clock.systemUTC());
        server = new WebServer(PORT, registry);
        server.start();

        client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(2))
                .build();
    }

    @AfterEach
    void stopServer() throws InterruptedException {
        if (server != null) {
            server.stop();
        }
        registry.closeAll();
        io.shutdown();
        io.awaitTermination(5, TimeUnit.SECONDS);
    }

    // ---------- routing & validation ----------

    @Test
    void health_returns_ok() throws Exception {
        var resp = get("/admin/health");
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("ok"));
    }

    @Test
    void unknown_path_returns_404() throws Exception {
        assertEquals(404, get("/kv/anything").statusCode());
        assertEquals(404, post("/sessions/" + IMAGE + "/teleport", "").statusCode());
    }

    @Test
    void wrong_method_returns_405() throws Exception {
        assertEquals(405, get("/sessions/" + IMAGE + "/undo").statusCode());
        assertEquals(405, post("/sessions/" + IMAGE + "/commands", "").statusCode());
        assertEquals(405, post("/sessions/" + IMAGE + "/snapshots/0", "").statusCode());
        assertEquals(405, delete("/sessions/" + IMAGE + "/snapshots/0").statusCode());
    }

    @Test
    void invalid_session_id_returns_400() throws Exception {
        var resp = get("/sessions/bad$name");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid session id"));
        assertFalse(Files.exists(dataDir.resolve("sessions").resolve("bad$name")));
    }

    @Test
    void invalid_json_returns_400() throws Exception {
        var resp = post("/sessions/" + IMAGE + "/state", "{ invalid-json");
        assertEquals(400, resp.statusCode());
        assertTrue(resp.body().contains("invalid JSON"));

        var confirm = post("/sessions/" + IMAGE + "/load-confirmed", "{\"target\": ");
        assertEquals(400, confirm.statusCode());
        assertTrue(confirm.body().contains("invalid JSON"));
    }

    @Test
    void missing_fields_return_400() throws Exception {
        assertEquals(400, post("/sessions/" + IMAGE + "/state", "{\"requestId\": 1}").statusCode());
        assertEquals(400, post("/sessions/" + IMAGE + "/load-confirmed", "{}").statusCode());
    }

    @Test
    void too_large_body_returns_413() throws Exception {
        String big = "x".repeat(11 * 1024 * 1024);
        var resp = post("/sessions/" + IMAGE + "/state", big);
        assertEquals(413, resp.statusCode());
        assertTrue(resp.body().contains("request body too large"));
    }

    // ---------- sessions ----------

    @Test
    void new_session_status_has_no_cursor() throws Exception {
        var resp = get("/sessions/" + IMAGE);
        assertEquals(200, resp.statusCode());

        JsonNode body = json.readTree(resp.body());
        assertEquals(IMAGE, body.get("sessionId").asText());
        assertTrue(body.get("cursor").isNull());
        assertEquals(0, body.get("snapshotCount").asInt());
        assertEquals("IDLE", body.get("state").asText());
        assertFalse(body.get("canUndo").asBoolean());
    }

    @Test
    void undo_with_no_history_returns_409() throws Exception {
        var resp = post("/sessions/" + IMAGE + "/undo", "");
        assertEquals(409, resp.statusCode());
        assertTrue(resp.body().contains("no such transition"));
    }

    @Test
    void bookmark_round_trip_through_surface_commands() throws Exception {
        assertEquals(202, post("/sessions/" + IMAGE + "/bookmark", "").statusCode());

        JsonNode commands = json.readTree(get("/sessions/" + IMAGE + "/commands").body());
        assertEquals(1, commands.size());
        assertEquals("request-state", commands.get(0).get("type").asText());
        long requestId = commands.get(0).get("requestId").asLong();

        String state = """
                {
                  "requestId": %d,
                  "state": {
                    "strokes": [
                      { "type": "polyline", "color": "#ff0000", "thickness": 3.0,
                        "points": [[120.5, 88.0], [121.0, 90.25]] }
                    ],
                    "viewport": { "zoom": 8.0, "centerX": 5120.0, "centerY": 3300.0 }
                  }
                }
                """.formatted(requestId);
        assertEquals(200, post("/sessions/" + IMAGE + "/state", state).statusCode());

        awaitBody("/sessions/" + IMAGE, body -> body.get("bookmarks").size() == 1);
        JsonNode status = json.readTree(get("/sessions/" + IMAGE).body());
        assertEquals(0, status.get("cursor").asLong());
        assertTrue(status.get("review").get("done").asBoolean());
        assertTrue(status.get("review").get("inkFound").asBoolean());

        JsonNode snapshot = json.readTree(get("/sessions/" + IMAGE + "/snapshots/0").body());
        assertTrue(snapshot.get("bookmarked").asBoolean());
        assertEquals(120.5, snapshot.get("state").get("strokes").get(0).get("points").get(0).get(0).asDouble());

        JsonNode counts = json.readTree(get("/review/counts").body());
        assertEquals(1, counts.get("done").asInt());
        assertEquals(1, counts.get("inkFound").asInt());
    }

    @Test
    void navigation_round_trip_loads_and_confirms() throws Exception {
        seed(3);

        var resp = post("/sessions/" + IMAGE + "/undo", "");
        assertEquals(200, resp.statusCode());
        assertEquals(1, json.readTree(resp.body()).get("target").asLong());

        JsonNode commands = json.readTree(get("/sessions/" + IMAGE + "/commands").body());
        JsonNode load = commands.get(commands.size() - 1);
        assertEquals("load", load.get("type").asText());
        assertEquals(1, load.get("target").asLong());
        assertEquals(1.0, load.get("state").get("strokes").get(0).get("points").get(0).get(0).asDouble());

        assertEquals("LOADING", json.readTree(get("/sessions/" + IMAGE).body()).get("state").asText());
        assertEquals(409, post("/sessions/" + IMAGE + "/bookmark", "").statusCode());

        assertEquals(200, post("/sessions/" + IMAGE + "/load-confirmed", "{\"target\": 1}").statusCode());
        awaitBody("/sessions/" + IMAGE, body -> body.get("cursor").asLong() == 1);
        JsonNode status = json.readTree(get("/sessions/" + IMAGE).body());
        assertTrue(status.get("canUndo").asBoolean());
        assertTrue(status.get("canRedo").asBoolean());
    }

    @Test
    void corrupted_target_returns_422() throws Exception {
        seed(2);
        Files.writeString(layout.liveDir(IMAGE).resolve(SessionLayout.snapshotFileName(0)), "{ not json");

        var resp = post("/sessions/" + IMAGE + "/undo", "");
        assertEquals(422, resp.statusCode());
        assertEquals("IDLE", json.readTree(get("/sessions/" + IMAGE).body()).get("state").asText());
    }

    @Test
    void snapshot_lookup_validates_index() throws Exception {
        seed(2);

        assertEquals("[0,1]", get("/sessions/" + IMAGE + "/snapshots").body());
        assertEquals(404, get("/sessions/" + IMAGE + "/snapshots/7").statusCode());
        assertEquals(400, get("/sessions/" + IMAGE + "/snapshots/seven").statusCode());
    }

    @Test
    void review_toggles_update_counts() throws Exception {
        var done = json.readTree(post("/sessions/" + IMAGE + "/review/done", "").body());
        assertTrue(done.get("done").asBoolean());
        assertFalse(done.get("inkFound").asBoolean());

        var ink = json.readTree(post("/sessions/other.svs/review/ink-found", "").body());
        assertTrue(ink.get("inkFound").asBoolean());

        JsonNode counts = json.readTree(get("/review/counts").body());
        assertEquals(1, counts.get("done").asInt());
        assertEquals(1, counts.get("inkFound").asInt());
    }

    @Test
    void delete_closes_session() throws Exception {
        get("/sessions/" + IMAGE);

        var resp = delete("/sessions/" + IMAGE);
        assertEquals(200, resp.statusCode());
        assertTrue(resp.body().contains("true"));
        assertTrue(registry.get(IMAGE).isEmpty());

        assertTrue(delete("/sessions/" + IMAGE).body().contains("false"));
    }

    // ---------- helpers ----------

    /** Write {@code n} snapshots (0..n-1) before the session is opened. */
    private void seed(int n) {
        var store = new FileSnapshotStore(layout.liveDir(IMAGE));
        for (int i = 0; i < n; i++) {
            store.append(AnnotationState.empty().withStroke(
                    Stroke.polyline("#0000ff", 2.0, List.of(new Point(i, i), new Point(i + 1, i)))));
        }
    }

    private void awaitBody(String path, java.util.function.Predicate<JsonNode> condition) throws Exception {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (true) {
            JsonNode body = json.readTree(get(path).body());
            if (condition.test(body)) {
                return;
            }
            if (System.nanoTime() > deadline) {
                fail("condition not met within 5s, last body: " + body);
            }
            Thread.sleep(20);
        }
    }

    private String baseUrl() {
        return "http://localhost:" + PORT;
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .GET()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> delete(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .DELETE()
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    private HttpResponse<String> post(String path, String body) throws Exception {
        HttpRequest req = HttpRequest.newBuilder()
                .uri(URI.create(baseUrl() + path))
                .POST(HttpRequest.BodyPublishers.ofString(body, StandardCharsets.UTF_8))
                .header("Content-Type", "application/json")
                .build();
        return client.send(req, HttpResponse.BodyHandlers.ofString());
    }
}
