// file: server/src/main/java/io/annolite/server/ServerConfig.java
package io.annolite.server;

import io.annolite.server.session.SessionSettings;

import java.time.Duration;

/**
 * Server configuration parsed from CLI args.
 *
 * Supports:
 *  - httpPort:       HTTP API port
 *  - dataDir:        root of sessions/ and review-status.json
 *  - autosaveMillis: auto-save tick period
 *  - graceMillis:    quiet period after a confirmed historical load
 *  - loadTimeoutMillis: how long an unconfirmed load may pause auto-save
 *  - firstIndex:     index of the first snapshot in an empty session
 *  - ioThreads:      size of the shared pool that performs snapshot writes
 */
public record ServerConfig(
        int httpPort,
        String dataDir,
        long autosaveMillis,
        long graceMillis,
        long loadTimeoutMillis,
        long firstIndex,
        int ioThreads
) {

    public ServerConfig {
        if (httpPort <= 0 || httpPort > 65535) {
            throw new IllegalArgumentException("http-port must be in 1..65535, got: " + httpPort);
        }
        if (autosaveMillis <= 0 || graceMillis <= 0 || loadTimeoutMillis <= 0) {
            throw new IllegalArgumentException("durations must be > 0");
        }
        if (firstIndex < 0) {
            throw new IllegalArgumentException("first-index must be >= 0, got: " + firstIndex);
        }
        if (ioThreads <= 0) {
            throw new IllegalArgumentException("io-threads must be > 0, got: " + ioThreads);
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(8080, "./data", 1000, 2000, 10_000, 0, 2);
    }

    public SessionSettings sessionSettings() {
        return new SessionSettings(
                Duration.ofMillis(autosaveMillis),
                Duration.ofMillis(graceMillis),
                Duration.ofMillis(loadTimeoutMillis),
                firstIndex
        );
    }

    /**
     * Very small CLI parser.
     *
     * Supported flags:
     *   --http-port, -p   <port>
     *   --data-dir,  -d   <path>
     *   --autosave-ms     <millis>
     *   --grace-ms        <millis>
     *   --load-timeout-ms <millis>
     *   --first-index     <n>
     *   --io-threads      <n>
     *   --help,      -h
     *
     * All flags are optional; defaults are reasonable for local use.
     */
    public static ServerConfig fromArgs(String[] args) {
        ServerConfig d = defaults();
        int httpPort = d.httpPort();
        String dataDir = d.dataDir();
        long autosaveMillis = d.autosaveMillis();
        long graceMillis = d.graceMillis();
        long loadTimeoutMillis = d.loadTimeoutMillis();
        long firstIndex = d.firstIndex();
        int ioThreads = d.ioThreads();

        for (int i = 0; i < args.length; i++) {
            switch (args[i]) {
                case "--help", "-h" -> printHelpAndExit();

                case "--http-port", "-p" -> {
                    ensureValue(args, i);
                    httpPort = (int) parseNumber(args, ++i, "http-port");
                }

                case "--data-dir", "-d" -> {
                    ensureValue(args, i);
                    dataDir = args[++i];
                }

                case "--autosave-ms" -> {
                    ensureValue(args, i);
                    autosaveMillis = parseNumber(args, ++i, "autosave-ms");
                }

                case "--grace-ms" -> {
                    ensureValue(args, i);
                    graceMillis = parseNumber(args, ++i, "grace-ms");
                }

                case "--load-timeout-ms" -> {
                    ensureValue(args, i);
                    loadTimeoutMillis = parseNumber(args, ++i, "load-timeout-ms");
                }

                case "--first-index" -> {
                    ensureValue(args, i);
                    firstIndex = parseNumber(args, ++i, "first-index");
                }

                case "--io-threads" -> {
                    ensureValue(args, i);
                    ioThreads = (int) parseNumber(args, ++i, "io-threads");
                }

                default -> {
                    System.err.println("Unknown option: " + args[i]);
                    printHelpAndExit();
                }
            }
        }
        try {
            return new ServerConfig(
                    httpPort,
                    dataDir,
                    autosaveMillis,
                    graceMillis,
                    loadTimeoutMillis,
                    firstIndex,
                    ioThreads
            );
        } catch (IllegalArgumentException e) {
            System.err.println("Invalid configuration: " + e.getMessage());
            System.exit(1);
            return null; // unreachable
        }
    }

    private static long parseNumber(String[] args, int i, String name) {
        try {
            return Long.parseLong(args[i]);
        } catch (NumberFormatException e) {
            System.err.println("Invalid " + name + ": " + args[i]);
            System.exit(1);
            return -1; // unreachable
        }
    }

    private static void ensureValue(String[] args, int i) {
        if (i + 1 >= args.length) {
            System.err.println("Missing value for option: " + args[i]);
            System.exit(1);
        }
    }

    private static void printHelpAndExit() {
        System.out.println("""
            Usage: server [options]

            Options:
              --http-port,  -p   HTTP port (default: 8080)
              --data-dir,   -d   Data directory (default: ./data)
              --autosave-ms      Auto-save period in ms (default: 1000)
              --grace-ms         Quiet period after a confirmed load in ms (default: 2000)
              --load-timeout-ms  Give up waiting for a load confirmation after ms (default: 10000)
              --first-index      Index of the first snapshot of a new session (default: 0)
              --io-threads       Threads writing snapshots (default: 2)
              --help,       -h   Show this help message
            """);
        System.exit(0);
    }
}
