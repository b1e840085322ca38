// file: server/src/main/java/io/annolite/server/Main.java
package io.annolite.server;

import io.annolite.core.StructuralChangeDetector;
import io.annolite.core.Ticker;
import io.annolite.storage.FileReviewStatusStore;
import io.annolite.storage.SessionLayout;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Path;
import java.time.Clock;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.LogManager;
import java.util.logging.Logger;

/**
 * Entry point for the annotation history server.
 *
 * Responsibilities:
 *  - Parse configuration from CLI.
 *  - Load logging configuration from the classpath.
 *  - Wire the shared pieces: data layout, review status file, snapshot write pool.
 *  - Create the SessionRegistry and the HTTP adapter over it.
 *  - Close every session on shutdown.
 */
public final class Main {
    private static final Logger log = Logger.getLogger(Main.class.getName());

    private Main() {
        // no-op
    }

    public static void main(String[] args) throws IOException {
        var cfg = ServerConfig.fromArgs(args);
        configureLogging();

        // ------ Storage layout -------
        var layout = new SessionLayout(Path.of(cfg.dataDir()));
        var review = new FileReviewStatusStore(layout.reviewStatusFile(), Clock.systemUTC());

        // ------ Shared snapshot write pool ------
        ExecutorService io = Executors.newFixedThreadPool(cfg.ioThreads(), namedDaemon("snapshot-io"));

        // ------ Sessions ------
        var registry = new SessionRegistry(
                layout,
                review,
                new StructuralChangeDetector(),
                Ticker.system(),
                io,
                cfg.sessionSettings(),
                Clock.systemUTC()
        );

        // ------ HTTP layer ------
        var web = new WebServer(cfg.httpPort(), registry);
        web.start();

        log.info(String.format("Annotation server listening on http://localhost:%d (data: %s)",
                cfg.httpPort(), layout.dataDir().toAbsolutePath()));

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            web.stop();
            registry.closeAll();
            io.shutdown();
            try {
                if (!io.awaitTermination(5, TimeUnit.SECONDS)) {
                    log.warning("snapshot writes still running at shutdown");
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }, "shutdown"));
    }

    private static void configureLogging() throws IOException {
        try (InputStream in = Main.class.getResourceAsStream("/logging.properties")) {
            if (in != null) {
                LogManager.getLogManager().readConfiguration(in);
            }
        }
    }

    private static ThreadFactory namedDaemon(String prefix) {
        AtomicInteger n = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, prefix + "-" + n.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }
}
