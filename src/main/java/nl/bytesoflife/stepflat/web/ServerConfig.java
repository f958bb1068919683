package nl.bytesoflife.stepflat.web;

import java.time.Duration;
import java.util.Map;

/**
 * Settings of the face export server.
 *
 * @param port           TCP port to listen on
 * @param sessionTtl     how long an uploaded file stays available
 * @param maxUploadBytes largest accepted upload
 * @param workerThreads  size of the request thread pool
 */
public record ServerConfig(int port, Duration sessionTtl, long maxUploadBytes, int workerThreads) {

    public static final int DEFAULT_PORT = 5000;
    public static final long DEFAULT_MAX_UPLOAD_BYTES = 16L * 1024 * 1024;
    public static final Duration DEFAULT_SESSION_TTL = Duration.ofMinutes(60);

    public ServerConfig {
        if (port < 0 || port > 65535) {
            throw new IllegalArgumentException("Invalid port: " + port);
        }
        if (maxUploadBytes <= 0 || workerThreads <= 0) {
            throw new IllegalArgumentException("Upload limit and worker threads must be positive");
        }
    }

    public static ServerConfig defaults() {
        return new ServerConfig(DEFAULT_PORT, DEFAULT_SESSION_TTL, DEFAULT_MAX_UPLOAD_BYTES, defaultWorkers());
    }

    /**
     * Port from the first argument, else {@code PORT}; session TTL from
     * {@code STEPFLAT_SESSION_TTL_MINUTES}.
     */
    public static ServerConfig from(String[] args, Map<String, String> env) {
        int port = DEFAULT_PORT;
        if (args.length > 0) {
            port = Integer.parseInt(args[0].trim());
        } else if (env.get("PORT") != null && !env.get("PORT").isBlank()) {
            port = Integer.parseInt(env.get("PORT").trim());
        }

        Duration ttl = DEFAULT_SESSION_TTL;
        String minutes = env.get("STEPFLAT_SESSION_TTL_MINUTES");
        if (minutes != null && !minutes.isBlank()) {
            ttl = Duration.ofMinutes(Long.parseLong(minutes.trim()));
        }
        return new ServerConfig(port, ttl, DEFAULT_MAX_UPLOAD_BYTES, defaultWorkers());
    }

    public ServerConfig withPort(int port) {
        return new ServerConfig(port, sessionTtl, maxUploadBytes, workerThreads);
    }

    public ServerConfig withMaxUploadBytes(long maxUploadBytes) {
        return new ServerConfig(port, sessionTtl, maxUploadBytes, workerThreads);
    }

    private static int defaultWorkers() {
        return Math.max(2, Runtime.getRuntime().availableProcessors());
    }
}
