package uitrace.server;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.sun.net.httpserver.HttpExchange;
import com.sun.net.httpserver.HttpHandler;
import com.sun.net.httpserver.HttpServer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.capture.CaptureOrchestrator;
import uitrace.capture.CaptureRequest;
import uitrace.capture.CycleResult;
import uitrace.model.CaptureRecord;
import uitrace.model.FailureKind;
import uitrace.model.ValidationException;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

/**
 * Embedded HTTP control plane: lets an inspector UI or script trigger
 * capture cycles on a control it has selected.
 *
 * <p>Uses JDK's built-in {@code com.sun.net.httpserver.HttpServer}. Every
 * response carries CORS headers so browser pages can call it. Cycles are
 * serialized by the {@link CaptureOrchestrator}, so concurrent requests queue
 * up rather than interleave.
 *
 * <pre>
 * GET  /                         endpoint listing
 * GET  /health                   {"ok":true}
 * POST /bridge/capture_tap       one capture cycle on a selected control
 * POST /bridge/final_screenshot  snapshot of the current screen, no action
 * </pre>
 */
@SuppressWarnings("restriction")
public class CaptureServer {

    private static final Logger log = LoggerFactory.getLogger(CaptureServer.class);

    private final CaptureOrchestrator orchestrator;
    private final RequestMapper requestMapper;
    private final String host;
    private final int port;
    private final ObjectMapper mapper = new ObjectMapper();

    private HttpServer httpServer;
    private ExecutorService executor;

    public CaptureServer(CaptureOrchestrator orchestrator, RequestMapper requestMapper, String host, int port) {
        this.orchestrator  = orchestrator;
        this.requestMapper = requestMapper;
        this.host          = host;
        this.port          = port;
    }

    // ── Lifecycle ─────────────────────────────────────────────────────────

    public void start() {
        try {
            httpServer = HttpServer.create(new InetSocketAddress(host, port), 0);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to start capture server on " + host + ":" + port, e);
        }
        executor = Executors.newFixedThreadPool(4);
        httpServer.setExecutor(executor);

        httpServer.createContext("/",                         guarded(this::handleIndex));
        httpServer.createContext("/health",                   guarded(this::handleHealth));
        httpServer.createContext("/bridge/capture_tap",       guarded(this::handleCaptureTap));
        httpServer.createContext("/bridge/final_screenshot",  guarded(this::handleFinalScreenshot));

        httpServer.start();
        log.info("Capture server listening on http://{}:{}", host, getPort());
    }

    public void stop() {
        if (httpServer != null) {
            httpServer.stop(1);
            httpServer = null;
        }
        if (executor != null) {
            executor.shutdownNow();
            executor = null;
        }
        log.info("Capture server stopped");
    }

    /** Bound port; differs from the configured one when that was 0. */
    public int getPort() {
        return httpServer == null ? port : httpServer.getAddress().getPort();
    }

    // ── Handlers ──────────────────────────────────────────────────────────

    /** GET / */
    private void handleIndex(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        if (!"/".equals(exchange.getRequestURI().getPath())) {
            sendError(exchange, 404, "Not found: " + exchange.getRequestURI().getPath());
            return;
        }
        if (!assertMethod(exchange, "GET")) return;

        ObjectNode body = mapper.createObjectNode();
        body.put("name", "UI Trace capture server");
        ArrayNode endpoints = body.putArray("endpoints");
        endpoints.add("GET /health");
        endpoints.add("POST /bridge/capture_tap  { bounds?, xpath?, action?: short-click|long-click|input|swipe|back|none,"
                + " tap?, durationMs?, text?, dx?, dy?, direction?, distance?, waitAfterMs?, midCapture?, midDelayMs? }");
        endpoints.add("POST /bridge/final_screenshot  {}  -> record of the current screen, no action");
        sendJson(exchange, 200, body);
    }

    /** GET /health */
    private void handleHealth(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        if (!assertMethod(exchange, "GET")) return;

        ObjectNode body = mapper.createObjectNode();
        body.put("ok", true);
        sendJson(exchange, 200, body);
    }

    /** POST /bridge/capture_tap */
    private void handleCaptureTap(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        if (!assertMethod(exchange, "POST")) return;

        Map<?, ?> body = readJsonBody(exchange);
        if (body == null) return;

        CaptureRequest request;
        try {
            request = requestMapper.map(body);
        } catch (ValidationException e) {
            sendFailure(exchange, FailureKind.VALIDATION, e.getMessage());
            return;
        }

        CycleResult result = orchestrator.capture(request);
        if (!result.isRecorded()) {
            sendFailure(exchange, result.getFailureKind(), result.getMessage());
            return;
        }
        sendJson(exchange, 200, successBody(result));
    }

    /** POST /bridge/final_screenshot */
    private void handleFinalScreenshot(HttpExchange exchange) throws IOException {
        if (handleCors(exchange)) return;
        if (!assertMethod(exchange, "POST")) return;

        // body is optional and ignored
        exchange.getRequestBody().readAllBytes();

        CycleResult result = orchestrator.captureFinal();
        if (!result.isRecorded()) {
            sendFailure(exchange, result.getFailureKind(), result.getMessage());
            return;
        }
        sendJson(exchange, 200, successBody(result));
    }

    private ObjectNode successBody(CycleResult result) {
        CaptureRecord record = result.getRecord();
        ObjectNode body = mapper.createObjectNode();
        body.put("ok", true);
        body.put("sequenceId", record.getSequenceId());
        body.put("elemId", record.getElemId());
        body.put("action", record.getAction().wireName());
        result.getCenter().ifPresent(c -> {
            ObjectNode center = body.putObject("center");
            center.put("x", c.x());
            center.put("y", c.y());
        });
        if (record.getSourceActivity() != null) {
            body.put("activity", record.getSourceActivity());
        }
        if (record.getDestActivity() != null) {
            body.put("destActivity", record.getDestActivity());
        }
        if (record.getCaptureTiming() != null) {
            body.put("captureTiming", record.getCaptureTiming());
        }
        ObjectNode files = body.putObject("files");
        result.getFiles().forEach(files::put);
        if (record.hasActionError()) {
            body.put("actionError", record.getActionError());
        }
        return body;
    }

    // ── Helpers ───────────────────────────────────────────────────────────

    static int statusFor(FailureKind kind) {
        if (kind == null) return 500;
        return switch (kind) {
            case VALIDATION -> 400;
            case RESOLUTION -> 404;
            case CONNECTION -> 503;
            case CAPTURE    -> 502;
            case LEDGER     -> 500;
        };
    }

    /**
     * Wraps a handler so an unexpected exception still produces a JSON 500
     * instead of a dropped connection.
     */
    private HttpHandler guarded(HttpHandler handler) {
        return exchange -> {
            try {
                handler.handle(exchange);
            } catch (RuntimeException e) {
                log.error("Unhandled error on {} {}", exchange.getRequestMethod(),
                        exchange.getRequestURI().getPath(), e);
                sendError(exchange, 500, "internal error: " + e.getMessage());
            } finally {
                exchange.close();
            }
        };
    }

    /**
     * Answers a CORS pre-flight OPTIONS request with 204.
     * Returns true if this was an OPTIONS request (caller should return immediately).
     */
    private boolean handleCors(HttpExchange exchange) throws IOException {
        setCorsHeaders(exchange);
        if ("OPTIONS".equalsIgnoreCase(exchange.getRequestMethod())) {
            exchange.sendResponseHeaders(204, -1);
            exchange.close();
            return true;
        }
        return false;
    }

    /** Adds CORS headers to every response. */
    private void setCorsHeaders(HttpExchange exchange) {
        exchange.getResponseHeaders().set("Access-Control-Allow-Origin",  "*");
        exchange.getResponseHeaders().set("Access-Control-Allow-Methods", "GET, POST, OPTIONS");
        exchange.getResponseHeaders().set("Access-Control-Allow-Headers", "*");
    }

    /**
     * Checks that the request uses the expected HTTP method.
     * Returns true if ok; sends 405 and returns false otherwise.
     */
    private boolean assertMethod(HttpExchange exchange, String expected) throws IOException {
        if (!expected.equalsIgnoreCase(exchange.getRequestMethod())) {
            sendError(exchange, 405, "Method not allowed, expected " + expected);
            return false;
        }
        return true;
    }

    /**
     * Reads and parses the request body as a JSON object. An empty body is
     * treated as an empty object. Returns null and sends 400 if the body is
     * not a JSON object.
     */
    private Map<?, ?> readJsonBody(HttpExchange exchange) throws IOException {
        byte[] raw = exchange.getRequestBody().readAllBytes();
        if (raw.length == 0) {
            return Map.of();
        }
        Map<?, ?> parsed;
        try {
            parsed = mapper.readValue(raw, Map.class);
        } catch (IOException e) {
            log.warn("Invalid JSON body: {}", e.getMessage());
            parsed = null;
        }
        if (parsed == null) {
            sendError(exchange, 400, "invalid JSON");
        }
        return parsed;
    }

    private void sendFailure(HttpExchange exchange, FailureKind kind, String message) throws IOException {
        sendError(exchange, statusFor(kind), message);
    }

    /**
     * Serializes {@code obj} with Jackson, sets Content-Type: application/json,
     * and writes the response.
     */
    private void sendJson(HttpExchange exchange, int status, Object obj) throws IOException {
        byte[] body = mapper.writeValueAsBytes(obj);
        exchange.getResponseHeaders().set("Content-Type", "application/json");
        setCorsHeaders(exchange);
        exchange.sendResponseHeaders(status, body.length);
        try (OutputStream os = exchange.getResponseBody()) {
            os.write(body);
        }
    }

    /** Sends {@code {"ok":false,"error":"<message>"}}. */
    private void sendError(HttpExchange exchange, int status, String message) throws IOException {
        ObjectNode err = mapper.createObjectNode();
        err.put("ok", false);
        err.put("error", message);
        sendJson(exchange, status, err);
    }
}
