package nl.bytesoflife.stepflat.web;

import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import nl.bytesoflife.stepflat.export.FaceExport;
import nl.bytesoflife.stepflat.export.FaceExporter;
import nl.bytesoflife.stepflat.export.FacePreview;
import nl.bytesoflife.stepflat.export.FacePreviewBuilder;
import nl.bytesoflife.stepflat.kernel.Face;
import nl.bytesoflife.stepflat.kernel.FaceSetReader;
import nl.bytesoflife.stepflat.kernel.memory.SimplifiedStepReader;
import nl.bytesoflife.stepflat.session.FaceSession;
import nl.bytesoflife.stepflat.session.InMemorySessionStore;
import nl.bytesoflife.stepflat.session.InvalidFaceIdException;
import nl.bytesoflife.stepflat.session.SessionNotFoundException;
import nl.bytesoflife.stepflat.session.SessionStore;
import nl.bytesoflife.stepflat.writer.ArtifactExporter;
import nl.bytesoflife.stepflat.writer.DrawingFormat;
import nl.bytesoflife.stepflat.writer.ExportArtifact;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * HTTP front end: upload a STEP file, inspect its faces and download a face as DXF or SVG.
 */
public class FaceExportServer {

    private static final Logger log = LoggerFactory.getLogger(FaceExportServer.class);

    private final ServerConfig config;
    private final SessionStore sessions;
    private final FaceSetReader reader;
    private HttpServer server;
    private ExecutorService executor;

    public FaceExportServer(ServerConfig config) {
        this(config, new InMemorySessionStore(config.sessionTtl()), new SimplifiedStepReader());
    }

    public FaceExportServer(ServerConfig config, SessionStore sessions, FaceSetReader reader) {
        this.config = config;
        this.sessions = sessions;
        this.reader = reader;
    }

    public void start() throws IOException {
        server = HttpServer.create(new InetSocketAddress(config.port()), 0);
        server.createContext("/", new StaticHandler());
        server.createContext("/api/health", new HealthHandler());
        server.createContext("/api/status", new StatusHandler(sessions));
        server.createContext("/api/upload", new UploadHandler(sessions, reader, config.maxUploadBytes()));
        server.createContext("/api/export-face/", new ExportHandler(sessions));
        server.createContext("/api/face-info/", new FaceInfoHandler(sessions));
        server.createContext("/api/preview-dxf/", new PreviewHandler(sessions));
        executor = Executors.newFixedThreadPool(config.workerThreads());
        server.setExecutor(executor);
        server.start();
        log.info("Face export server started at http://localhost:{}", getPort());
    }

    public void stop() {
        if (server != null) {
            server.stop(0);
        }
        if (executor != null) {
            executor.shutdownNow();
        }
    }

    /**
     * Bound port, useful when started on port 0.
     */
    public int getPort() {
        return server != null ? server.getAddress().getPort() : config.port();
    }

    /**
     * Serves the static HTML page.
     */
    static class StaticHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            String path = exchange.getRequestURI().getPath();
            if (path.equals("/") || path.equals("/index.html")) {
                sendResponse(exchange, 200, "text/html", getIndexHtml());
            } else {
                sendResponse(exchange, 404, "text/plain", "Not Found");
            }
        }
    }

    static class HealthHandler implements HttpHandler {
        @Override
        public void handle(HttpExchange exchange) throws IOException {
            sendResponse(exchange, 200, "application/json",
                    "{\"status\":\"ok\",\"kernel\":" + Json.escape("simplified")
                            + ",\"java_version\":" + Json.escape(System.getProperty("java.version")) + "}");
        }
    }

    static class StatusHandler implements HttpHandler {
        private final SessionStore sessions;

        StatusHandler(SessionStore sessions) {
            this.sessions = sessions;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            sendResponse(exchange, 200, "application/json",
                    "{\"kernel_available\":false,\"writers\":[\"dxf\",\"svg\"],\"active_sessions\":"
                            + sessions.size() + "}");
        }
    }

    /**
     * Accepts a STEP file as the raw request body, named by the {@code filename} query parameter.
     */
    static class UploadHandler implements HttpHandler {
        private static final Logger log = LoggerFactory.getLogger(UploadHandler.class);

        private final SessionStore sessions;
        private final FaceSetReader reader;
        private final long maxUploadBytes;

        UploadHandler(SessionStore sessions, FaceSetReader reader, long maxUploadBytes) {
            this.sessions = sessions;
            this.reader = reader;
            this.maxUploadBytes = maxUploadBytes;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"POST".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }

            String filename = sanitizeFilename(queryParams(exchange).get("filename"));
            if (filename.isEmpty()) {
                sendResponse(exchange, 400, "application/json", Json.error("No file provided"));
                return;
            }
            if (!isStepFile(filename)) {
                sendResponse(exchange, 400, "application/json",
                        Json.error("Only STEP files (.step, .stp) are allowed"));
                return;
            }

            Path temp = null;
            try {
                byte[] data = readLimited(exchange.getRequestBody(), maxUploadBytes);
                if (data == null) {
                    sendResponse(exchange, 413, "application/json",
                            Json.error("File exceeds " + maxUploadBytes + " bytes"));
                    return;
                }
                log.info("Received {}: {} bytes", filename, data.length);

                temp = Files.createTempFile("stepflat-upload-", ".step");
                Files.write(temp, data);
                FaceSetReader.FaceSet faceSet = reader.read(temp);

                FaceSession session = new FaceSession(UUID.randomUUID().toString(), filename,
                        faceSet.faces(), faceSet.note(), Instant.now());
                sessions.insert(session);

                StringBuilder json = new StringBuilder();
                json.append("{\"success\":true,\"session_id\":").append(Json.escape(session.id()));
                json.append(",\"face_count\":").append(session.faceCount());
                json.append(",\"faces\":[");
                for (int i = 0; i < session.faceCount(); i++) {
                    if (i > 0) json.append(',');
                    json.append(Json.faceInfo(i, session.face(i)));
                }
                json.append(']');
                if (session.note() != null) {
                    json.append(",\"note\":").append(Json.escape(session.note()));
                }
                json.append('}');

                log.info("Session {} created with {} faces", session.id(), session.faceCount());
                sendResponse(exchange, 200, "application/json", json.toString());
            } catch (Exception e) {
                log.error("Error processing upload", e);
                sendResponse(exchange, 500, "application/json", Json.error(e.getMessage()));
            } finally {
                if (temp != null) {
                    try {
                        Files.deleteIfExists(temp);
                    } catch (IOException e) {
                        log.warn("Could not delete upload {}: {}", temp, e.getMessage());
                    }
                }
            }
        }
    }

    /**
     * Base for the {@code /api/<action>/<session>/<face>} endpoints.
     */
    abstract static class FaceHandler implements HttpHandler {
        protected final Logger log = LoggerFactory.getLogger(getClass());
        protected final SessionStore sessions;

        FaceHandler(SessionStore sessions) {
            this.sessions = sessions;
        }

        @Override
        public void handle(HttpExchange exchange) throws IOException {
            if (!"GET".equals(exchange.getRequestMethod())) {
                sendResponse(exchange, 405, "text/plain", "Method Not Allowed");
                return;
            }
            String[] parts = exchange.getRequestURI().getPath().split("/");
            // "", "api", action, session, face
            if (parts.length != 5) {
                sendResponse(exchange, 404, "application/json", Json.error("Not Found"));
                return;
            }

            try {
                FaceSession session = sessions.require(parts[3]);
                int faceId = parseFaceId(parts[4], session.faceCount());
                handleFace(exchange, session, faceId, session.face(faceId));
            } catch (SessionNotFoundException e) {
                sendResponse(exchange, 404, "application/json", Json.error("Session not found"));
            } catch (InvalidFaceIdException e) {
                sendResponse(exchange, 400, "application/json", Json.error(e.getMessage()));
            } catch (Exception e) {
                log.error("Error handling {}", exchange.getRequestURI(), e);
                sendResponse(exchange, 500, "application/json", Json.error(e.getMessage()));
            }
        }

        protected abstract void handleFace(HttpExchange exchange, FaceSession session, int faceId, Face face)
                throws IOException;
    }

    static class ExportHandler extends FaceHandler {
        private final FaceExporter exporter = new FaceExporter();
        private final ArtifactExporter artifacts = new ArtifactExporter();

        ExportHandler(SessionStore sessions) {
            super(sessions);
        }

        @Override
        protected void handleFace(HttpExchange exchange, FaceSession session, int faceId, Face face)
                throws IOException {
            DrawingFormat format = DrawingFormat.fromQuery(queryParams(exchange).get("format"));
            FaceExport export = exporter.export(faceId, face);
            ExportArtifact artifact = artifacts.write(export, format.newWriter(), session.filename());
            try {
                byte[] bytes = Files.readAllBytes(artifact.path());
                exchange.getResponseHeaders().set("Content-Type", artifact.contentType());
                exchange.getResponseHeaders().set("Content-Disposition",
                        "attachment; filename=\"" + artifact.downloadName() + "\"");
                exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
                exchange.sendResponseHeaders(200, bytes.length);
                try (OutputStream os = exchange.getResponseBody()) {
                    os.write(bytes);
                }
                log.info("Sent {} ({} entities, {} stage)", artifact.downloadName(), artifact.entityCount(),
                        export.stage());
            } finally {
                ArtifactExporter.delete(artifact);
            }
        }
    }

    static class FaceInfoHandler extends FaceHandler {
        FaceInfoHandler(SessionStore sessions) {
            super(sessions);
        }

        @Override
        protected void handleFace(HttpExchange exchange, FaceSession session, int faceId, Face face)
                throws IOException {
            sendResponse(exchange, 200, "application/json", Json.faceInfo(faceId, face));
        }
    }

    static class PreviewHandler extends FaceHandler {
        private final FacePreviewBuilder previews = new FacePreviewBuilder();

        PreviewHandler(SessionStore sessions) {
            super(sessions);
        }

        @Override
        protected void handleFace(HttpExchange exchange, FaceSession session, int faceId, Face face)
                throws IOException {
            FacePreview preview = previews.build(faceId, face);
            log.debug("Preview of face {}: {} entities, {} holes", faceId, preview.entityCount(),
                    preview.holes().size());
            sendResponse(exchange, 200, "application/json",
                    "{\"success\":true,\"preview\":" + Json.preview(preview) + "}");
        }
    }

    static int parseFaceId(String value, int faceCount) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException e) {
            throw new InvalidFaceIdException(-1, faceCount);
        }
    }

    static boolean isStepFile(String filename) {
        String lower = filename.toLowerCase(Locale.ROOT);
        return lower.endsWith(".step") || lower.endsWith(".stp");
    }

    /**
     * Keeps only the last path segment and replaces characters that are unsafe in file names.
     */
    static String sanitizeFilename(String filename) {
        if (filename == null) return "";
        String name = filename.replace('\\', '/');
        name = name.substring(name.lastIndexOf('/') + 1);
        name = name.replaceAll("[^A-Za-z0-9._-]", "_");
        while (name.startsWith(".")) {
            name = name.substring(1);
        }
        return name;
    }

    static Map<String, String> queryParams(HttpExchange exchange) {
        String query = exchange.getRequestURI().getRawQuery();
        Map<String, String> params = new LinkedHashMap<>();
        if (query == null) return params;
        for (String param : query.split("&")) {
            String[] kv = param.split("=", 2);
            if (kv.length == 2) {
                params.put(URLDecoder.decode(kv[0], StandardCharsets.UTF_8),
                        URLDecoder.decode(kv[1], StandardCharsets.UTF_8));
            }
        }
        return params;
    }

    /**
     * Reads at most {@code limit} bytes; null when the stream holds more.
     */
    static byte[] readLimited(InputStream in, long limit) throws IOException {
        byte[] data = in.readNBytes((int) Math.min(limit + 1, Integer.MAX_VALUE - 8));
        return data.length > limit ? null : data;
    }

    private static void sendResponse(HttpExchange exchange, int status, String contentType, String body)
            throws IOException {
        byte[] bytes = body.getBytes(StandardCharsets.UTF_8);
        exchange.getResponseHeaders().set("Content-Type", contentType + "; charset=utf-8");
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin", "*");
        exchange.sendResponseHeaders(status, bytes.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(bytes);
        }
    }

    private static String getIndexHtml() throws IOException {
        try (InputStream in = FaceExportServer.class.getResourceAsStream("/web/index.html")) {
            if (in == null) {
                return "<!DOCTYPE html><html><body><h1>STEP face export</h1></body></html>";
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        }
    }

    public static void main(String[] args) throws IOException {
        Locale.setDefault(Locale.US);

        ServerConfig config = ServerConfig.from(args, System.getenv());
        FaceExportServer server = new FaceExportServer(config);
        server.start();

        Runtime.getRuntime().addShutdownHook(new Thread(server::stop));
    }
}
