// file: server/src/main/java/io/annolite/server/RequestLogger.java
package io.annolite.server;

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Per-request access log for the HTTP adapter.
 *
 * One line per completed request: method, path, status and latency.
 * 5xx responses are logged at WARNING with the failure attached; client
 * errors and successes at INFO.
 */
public final class RequestLogger {
    private static final Logger log = Logger.getLogger(RequestLogger.class.getName());

    private RequestLogger() {
        // utility
    }

    /**
     * @param method      HTTP method (GET, POST, DELETE)
     * @param path        request path
     * @param status      HTTP status code sent
     * @param totalMillis latency from dispatch to response
     * @param error       failure behind a non-2xx status, or null
     */
    public static void logRequest(
            String method,
            String path,
            int status,
            long totalMillis,
            Throwable error
    ) {
        String msg = String.format("HTTP %s %s -> %d (%dms)", method, path, status, totalMillis);

        if (status >= 500) {
            log.log(Level.WARNING, msg, error);
        } else if (error != null) {
            log.log(Level.INFO, msg + ": " + error.getMessage());
        } else {
            log.log(Level.INFO, msg);
        }
    }
}
