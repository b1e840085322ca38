// file: client/src/main/java/io/annolite/client/Cli.java
package io.annolite.client;

import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Map;

/**
 * Simple CLI for driving a running anno-lite server over HTTP.
 *
 * Usage:
 *   anno-cli [--base-url http://host:port] status    <image>
 *   anno-cli [--base-url http://host:port] undo      <image>
 *   anno-cli [--base-url http://host:port] redo      <image>
 *   anno-cli [--base-url http://host:port] prev      <image>
 *   anno-cli [--base-url http://host:port] next      <image>
 *   anno-cli [--base-url http://host:port] bookmark  <image>
 *   anno-cli [--base-url http://host:port] done      <image>
 *   anno-cli [--base-url http://host:port] ink       <image>
 *   anno-cli [--base-url http://host:port] snapshots <image> [index]
 *   anno-cli [--base-url http://host:port] close     <image>
 *   anno-cli [--base-url http://host:port] counts
 *
 * The server's JSON response is printed as-is.
 *
 * Exit codes:
 *   0  success
 *   1  usage error (usage text is printed)
 *   2  unexpected failure (connection refused, I/O)
 *   3  the server refused the request (e.g. 409 at the oldest snapshot)
 */
public final class Cli {

    private static final String DEFAULT_BASE_URL = "http://localhost:8080";

    private final HttpClient http;
    private final String baseUrl;

    Cli(String baseUrl) {
        this.http = HttpClient.newHttpClient();
        this.baseUrl = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
    }

    /** One resolved command: HTTP method plus path relative to the base URL. */
    record Call(String method, String path, int expectedStatus) {}

    public static void main(String[] args) {
        try {
            Map.Entry<String, String[]> parsed = parseBaseUrl(args);
            Cli cli = new Cli(parsed.getKey());
            Call call = toCall(parsed.getValue());
            System.out.println(cli.execute(call));
        } catch (CliException e) {
            System.err.println("error: " + e.getMessage());
            System.err.println(USAGE);
            System.exit(1);
        } catch (RequestFailedException e) {
            System.err.println("error: " + e.getMessage());
            System.exit(3);
        } catch (Exception e) {
            e.printStackTrace(System.err);
            System.exit(2);
        }
    }

    static Map.Entry<String, String[]> parseBaseUrl(String[] args) {
        if (args.length >= 1 && "--base-url".equals(args[0])) {
            if (args.length < 2) {
                throw new CliException("--base-url requires a value");
            }
            return Map.entry(args[1], Arrays.copyOfRange(args, 2, args.length));
        }
        return Map.entry(DEFAULT_BASE_URL, args);
    }

    /**
     * Map command-line words to a single HTTP call.
     *
     * @throws CliException on unknown commands or wrong arity
     */
    static Call toCall(String[] rest) {
        if (rest.length == 0) {
            throw new CliException("missing command");
        }
        String cmd = rest[0];
        if ("counts".equals(cmd)) {
            requireArgs(rest, 1, "counts takes no arguments");
            return new Call("GET", "/review/counts", 200);
        }
        if (rest.length < 2) {
            throw new CliException(cmd + " requires <image>");
        }
        String session = "/sessions/" + encode(rest[1]);
        return switch (cmd) {
            case "status" -> single(rest, "GET", session, 200);
            case "undo" -> single(rest, "POST", session + "/undo", 200);
            case "redo" -> single(rest, "POST", session + "/redo", 200);
            case "prev" -> single(rest, "POST", session + "/prev-bookmark", 200);
            case "next" -> single(rest, "POST", session + "/next-bookmark", 200);
            case "bookmark" -> single(rest, "POST", session + "/bookmark", 202);
            case "done" -> single(rest, "POST", session + "/review/done", 200);
            case "ink" -> single(rest, "POST", session + "/review/ink-found", 200);
            case "close" -> single(rest, "DELETE", session, 200);
            case "snapshots" -> {
                if (rest.length == 2) {
                    yield new Call("GET", session + "/snapshots", 200);
                }
                requireArgs(rest, 3, "snapshots takes <image> [index]");
                yield new Call("GET", session + "/snapshots/" + encode(rest[2]), 200);
            }
            default -> throw new CliException("unknown command: " + cmd);
        };
    }

    String execute(Call call) throws Exception {
        HttpRequest.Builder b = HttpRequest.newBuilder().uri(URI.create(baseUrl + call.path()));
        switch (call.method()) {
            case "GET" -> b.GET();
            case "DELETE" -> b.DELETE();
            default -> b.header("Content-Type", "application/json")
                    .POST(HttpRequest.BodyPublishers.noBody());
        }

        HttpResponse<String> resp = http.send(b.build(), HttpResponse.BodyHandlers.ofString(StandardCharsets.UTF_8));
        return checkResponse(call, resp.statusCode(), resp.body());
    }

    /**
     * @return the body if {@code status} is what {@code call} expects
     * @throws RequestFailedException otherwise
     */
    static String checkResponse(Call call, int status, String body) {
        if (status != call.expectedStatus()) {
            throw new RequestFailedException(call.method() + " " + call.path()
                    + " failed (" + status + "): " + body);
        }
        return body;
    }

    private static Call single(String[] rest, String method, String path, int expected) {
        requireArgs(rest, 2, rest[0] + " takes exactly <image>");
        return new Call(method, path, expected);
    }

    private static void requireArgs(String[] rest, int n, String msg) {
        if (rest.length != n) {
            throw new CliException(msg);
        }
    }

    private static String encode(String segment) {
        return URLEncoder.encode(segment, StandardCharsets.UTF_8).replace("+", "%20");
    }

    private static final String USAGE = """
            Usage:
              anno-cli [--base-url http://host:port] <command> <image>
            Commands:
              status | undo | redo | prev | next | bookmark | done | ink | close
              snapshots <image> [index]
              counts
            """;

    static final class CliException extends RuntimeException {
        CliException(String msg) {
            super(msg);
        }
    }

    /** The server answered, but not with the expected status. */
    static final class RequestFailedException extends RuntimeException {
        RequestFailedException(String msg) {
            super(msg);
        }
    }
}
