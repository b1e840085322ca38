// file: server/src/main/java/io/annolite/server/WebServer.java
package io.annolite.server;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.annolite.core.AnnotationState;
import io.annolite.core.NavigationInProgressException;
import io.annolite.core.NoSuchTransitionException;
import io.annolite.core.ReviewStatus;
import io.annolite.core.Snapshot;
import io.annolite.core.SnapshotCorruptedException;
import io.annolite.core.SnapshotNotFoundException;
import io.annolite.server.dto.CurrentStateRequest;
import io.annolite.server.dto.LoadConfirmedRequest;
import io.annolite.server.dto.NavigationResponse;
import io.annolite.server.dto.ReviewStatusResponse;
import io.annolite.server.dto.SessionStatusResponse;
import io.annolite.server.dto.SnapshotResponse;
import io.annolite.server.dto.SurfaceCommandResponse;
import io.annolite.server.session.EditingSession;
import io.annolite.server.session.SessionStatus;
import io.annolite.server.surface.SurfaceCommand;
import io.annolite.storage.ReviewStatusStore;
import io.annolite.storage.json.AnnotationJson;
import io.undertow.Undertow;
import io.undertow.server.HttpServerExchange;
import io.undertow.util.Headers;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Thin HTTP adapter over SessionRegistry.
 *
 * Responsibilities:
 *  - Parse HTTP method + path.
 *  - Decode JSON request bodies into DTOs.
 *  - Convert session results back into JSON.
 *  - Map Java exceptions to HTTP status codes.
 *  - Emit per-request logging.
 *
 * Path layout:
 *   - GET    /admin/health
 *   - GET    /review/counts
 *   - GET    /sessions/{id}                    open-or-get, session status
 *   - DELETE /sessions/{id}                    close session
 *   - POST   /sessions/{id}/undo | /redo | /prev-bookmark | /next-bookmark
 *   - POST   /sessions/{id}/bookmark           202, completes asynchronously
 *   - GET    /sessions/{id}/commands           drain queued surface commands
 *   - POST   /sessions/{id}/state              {requestId, state}
 *   - POST   /sessions/{id}/load-confirmed     {target}
 *   - GET    /sessions/{id}/snapshots
 *   - GET    /sessions/{id}/snapshots/{index}
 *   - POST   /sessions/{id}/review/done | /review/ink-found
 *
 * Session calls wait for the session thread, so requests are dispatched off
 * the Undertow I/O threads before any work is done.
 */
public final class WebServer {
    private static final int MAX_BODY_BYTES = 10 * 1024 * 1024; // 10 MiB
    private static final String SESSIONS = "/sessions/";

    private final Undertow server;
    private final ObjectMapper json = new ObjectMapper();
    private final SessionRegistry sessions;

    public WebServer(int port, SessionRegistry sessions) {
        this.sessions = sessions;
        this.server = Undertow.builder()
                .addHttpListener(port, "0.0.0.0")
                .setHandler(this::route)
                .build();
    }

    public void start() {
        server.start();
    }

    public void stop() {
        server.stop();
    }

    // ---------- routing ----------

    private void route(HttpServerExchange ex) {
        if (ex.isInIoThread()) {
            ex.dispatch(this::route);
            return;
        }
        long start = System.nanoTime();
        String path = ex.getRequestPath();
        String method = ex.getRequestMethod().toString();
        ex.getResponseHeaders().put(Headers.CONTENT_TYPE, "application/json");

        if ("/admin/health".equals(path)) {
            respond(ex, start, 200, () -> Map.of("status", "ok"));
        } else if ("/review/counts".equals(path) && "GET".equals(method)) {
            respond(ex, start, 200, () -> {
                ReviewStatusStore.Counts c = sessions.review().counts();
                return Map.of("done", c.done(), "inkFound", c.inkFound());
            });
        } else if (path.startsWith(SESSIONS)) {
            String rest = path.substring(SESSIONS.length());
            int slash = rest.indexOf('/');
            String sessionId = slash < 0 ? rest : rest.substring(0, slash);
            String action = slash < 0 ? "" : rest.substring(slash + 1);
            routeSession(ex, start, method, sessionId, action);
        } else {
            reject(ex, start, 404, "not found");
        }
    }

    private void routeSession(HttpServerExchange ex, long start, String method, String sessionId, String action) {
        if (action.isEmpty()) {
            switch (method) {
                case "GET" -> respond(ex, start, 200, () -> toDto(session(sessionId).status()));
                case "DELETE" -> respond(ex, start, 200, () -> Map.of("closed", sessions.close(sessionId)));
                default -> reject(ex, start, 405, "method not allowed");
            }
            return;
        }
        if (action.startsWith("snapshots/")) {
            if (!"GET".equals(method)) {
                reject(ex, start, 405, "method not allowed");
                return;
            }
            String indexStr = action.substring("snapshots/".length());
            respond(ex, start, 200, () -> handleSnapshot(sessionId, parseIndex(indexStr)));
            return;
        }
        switch (action) {
            case "undo" -> post(ex, start, method, () -> navigation(session(sessionId).undo()));
            case "redo" -> post(ex, start, method, () -> navigation(session(sessionId).redo()));
            case "prev-bookmark" -> post(ex, start, method, () -> navigation(session(sessionId).jumpToPrevBookmark()));
            case "next-bookmark" -> post(ex, start, method, () -> navigation(session(sessionId).jumpToNextBookmark()));
            case "bookmark" -> {
                if (!"POST".equals(method)) {
                    reject(ex, start, 405, "method not allowed");
                } else {
                    respond(ex, start, 202, () -> {
                        session(sessionId).bookmarkCurrent();
                        return Map.of("status", "accepted");
                    });
                }
            }
            case "review/done" -> post(ex, start, method, () -> toDto(session(sessionId).toggleDone()));
            case "review/ink-found" -> post(ex, start, method, () -> toDto(session(sessionId).toggleInkFound()));
            case "commands" -> {
                if (!"GET".equals(method)) {
                    reject(ex, start, 405, "method not allowed");
                } else {
                    respond(ex, start, 200, () -> handleCommands(sessionId));
                }
            }
            case "snapshots" -> {
                if (!"GET".equals(method)) {
                    reject(ex, start, 405, "method not allowed");
                } else {
                    respond(ex, start, 200, () -> session(sessionId).snapshotIndices());
                }
            }
            case "state" -> {
                if (!"POST".equals(method)) {
                    reject(ex, start, 405, "method not allowed");
                } else {
                    withBody(ex, start, data -> handleState(sessionId, data));
                }
            }
            case "load-confirmed" -> {
                if (!"POST".equals(method)) {
                    reject(ex, start, 405, "method not allowed");
                } else {
                    withBody(ex, start, data -> handleLoadConfirmed(sessionId, data));
                }
            }
            default -> reject(ex, start, 404, "not found");
        }
    }

    // ---------- handlers ----------

    /** GET /sessions/{id}/commands */
    private List<SurfaceCommandResponse> handleCommands(String sessionId) {
        List<SurfaceCommand> drained = sessions.open(sessionId).surface().drain();
        List<SurfaceCommandResponse> out = new ArrayList<>(drained.size());
        for (SurfaceCommand c : drained) {
            var dto = new SurfaceCommandResponse();
            if (c instanceof SurfaceCommand.Load load) {
                dto.type = "load";
                dto.target = load.target();
                dto.state = AnnotationJson.toJson(load.state());
            } else if (c instanceof SurfaceCommand.RequestState req) {
                dto.type = "request-state";
                dto.requestId = req.requestId();
            }
            out.add(dto);
        }
        return out;
    }

    /** POST /sessions/{id}/state */
    private Object handleState(String sessionId, byte[] data) throws IOException {
        var req = json.readValue(data, CurrentStateRequest.class);
        if (req.requestId == null || req.state == null) {
            throw new IllegalArgumentException("requestId and state are required");
        }
        AnnotationState state;
        try {
            state = AnnotationJson.fromJson(req.state);
        } catch (NullPointerException npe) {
            throw new IllegalArgumentException("invalid state: " + npe.getMessage(), npe);
        }
        session(sessionId).onCurrentState(req.requestId, state);
        return Map.of("accepted", true);
    }

    /** POST /sessions/{id}/load-confirmed */
    private Object handleLoadConfirmed(String sessionId, byte[] data) throws IOException {
        var req = json.readValue(data, LoadConfirmedRequest.class);
        if (req.target == null) {
            throw new IllegalArgumentException("target is required");
        }
        session(sessionId).onLoadConfirmed(req.target);
        return Map.of("accepted", true);
    }

    /** GET /sessions/{id}/snapshots/{index} */
    private SnapshotResponse handleSnapshot(String sessionId, long index) {
        EditingSession session = session(sessionId);
        Snapshot s = session.readSnapshot(index);
        var dto = new SnapshotResponse();
        dto.index = s.index();
        dto.createdAt = s.createdAt().toString();
        dto.bookmarked = session.isBookmarked(index);
        dto.state = AnnotationJson.toJson(s.state());
        return dto;
    }

    // ---------- request plumbing ----------

    @FunctionalInterface
    private interface Action {
        Object run() throws Exception;
    }

    @FunctionalInterface
    private interface BodyAction {
        Object run(byte[] body) throws Exception;
    }

    private void post(HttpServerExchange ex, long start, String method, Action action) {
        if (!"POST".equals(method)) {
            reject(ex, start, 405, "method not allowed");
            return;
        }
        respond(ex, start, 200, action);
    }

    private void withBody(HttpServerExchange ex, long start, BodyAction action) {
        ex.getRequestReceiver().receiveFullBytes(
                (exchange, data) -> {
                    if (data.length > MAX_BODY_BYTES) {
                        reject(exchange, start, 413, "request body too large");
                    } else {
                        respond(exchange, start, 200, () -> action.run(data));
                    }
                },
                (exchange, ioEx) -> {
                    send(exchange, 400, Map.of("error", "invalid request body"));
                    RequestLogger.logRequest(
                            exchange.getRequestMethod().toString(), exchange.getRequestPath(), 400, elapsedMs(start), ioEx);
                }
        );
    }

    /**
     * Run {@code action}, send its result with {@code okStatus}, or map the
     * failure to an HTTP status. Always logs the request.
     */
    private void respond(HttpServerExchange ex, long start, int okStatus, Action action) {
        int status = okStatus;
        Throwable error = null;
        try {
            Object body = action.run();
            send(ex, status, body);
        } catch (NoSuchTransitionException e) {
            status = 409;
            send(ex, status, Map.of("error", "no such transition", "message", e.getMessage()));
        } catch (NavigationInProgressException e) {
            status = 409;
            send(ex, status, Map.of("error", "navigation in progress", "message", e.getMessage()));
        } catch (SnapshotNotFoundException e) {
            status = 404;
            send(ex, status, Map.of("error", "snapshot not found", "index", e.index()));
        } catch (SnapshotCorruptedException e) {
            status = 422;
            error = e;
            send(ex, status, Map.of("error", "snapshot corrupted", "index", e.index()));
        } catch (JsonProcessingException e) {
            status = 400;
            error = e;
            send(ex, status, Map.of("error", "invalid JSON"));
        } catch (IllegalArgumentException e) {
            status = 400;
            error = e;
            send(ex, status, Map.of("error", String.valueOf(e.getMessage())));
        } catch (Exception e) {
            status = 500;
            error = e;
            send(ex, status, Map.of("error", e.getClass().getSimpleName(), "message", String.valueOf(e.getMessage())));
        } finally {
            RequestLogger.logRequest(
                    ex.getRequestMethod().toString(), ex.getRequestPath(), status, elapsedMs(start), error);
        }
    }

    private void reject(HttpServerExchange ex, long start, int status, String message) {
        send(ex, status, Map.of("error", message));
        RequestLogger.logRequest(
                ex.getRequestMethod().toString(), ex.getRequestPath(), status, elapsedMs(start), null);
    }

    // ---------- helpers ----------

    private EditingSession session(String sessionId) {
        return sessions.open(sessionId).session();
    }

    private static long parseIndex(String s) {
        try {
            long index = Long.parseLong(s);
            if (index < 0) {
                throw new IllegalArgumentException("snapshot index must be >= 0");
            }
            return index;
        } catch (NumberFormatException nfe) {
            throw new IllegalArgumentException("snapshot index must be a number", nfe);
        }
    }

    private static NavigationResponse navigation(long target) {
        var dto = new NavigationResponse();
        dto.target = target;
        return dto;
    }

    private static SessionStatusResponse toDto(SessionStatus s) {
        var dto = new SessionStatusResponse();
        dto.sessionId = s.sessionId();
        dto.cursor = s.cursor();
        dto.latestIndex = s.latestIndex();
        dto.snapshotCount = s.snapshotCount();
        dto.bookmarks = s.bookmarks();
        dto.state = s.state().name();
        dto.savePending = s.savePending();
        dto.canUndo = s.canUndo();
        dto.canRedo = s.canRedo();
        dto.canPrevBookmark = s.canPrevBookmark();
        dto.canNextBookmark = s.canNextBookmark();
        dto.lastMessage = s.lastMessage();
        dto.review = toDto(s.review());
        return dto;
    }

    private static ReviewStatusResponse toDto(ReviewStatus r) {
        var dto = new ReviewStatusResponse();
        dto.done = r.done();
        dto.inkFound = r.inkFound();
        dto.lastUpdated = r.lastUpdated().toString();
        return dto;
    }

    private static long elapsedMs(long startNanos) {
        return (System.nanoTime() - startNanos) / 1_000_000L;
    }

    /** Serialize 'body' as JSON and write it with the given HTTP status code. */
    private void send(HttpServerExchange ex, int code, Object body) {
        try {
            ex.setStatusCode(code);
            byte[] bytes = json.writeValueAsBytes(body);
            ex.getResponseSender().send(new String(bytes, StandardCharsets.UTF_8));
        } catch (Exception e) {
            ex.setStatusCode(500);
            ex.getResponseSender().send("{\"error\":\"serialization\"}");
        }
    }
}
