package uitrace.device;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import okhttp3.HttpUrl;
import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.model.ActionOutcome;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.util.Base64;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link DeviceBridge} that talks JSON-RPC 2.0 to an on-device automation
 * agent (the uiautomator2 server) over HTTP.
 *
 * <p>Hierarchy, screenshot and gestures go through {@code POST {base}/jsonrpc/0};
 * the foreground activity and text input use the agent's {@code /shell}
 * endpoint. Reachability is checked with {@code GET {base}/ping}.
 */
public class NativeBackend implements DeviceBridge {

    private static final Logger log = LoggerFactory.getLogger(NativeBackend.class);
    private static final MediaType JSON = MediaType.get("application/json; charset=utf-8");
    private static final ObjectMapper MAPPER = new ObjectMapper();

    /** Milliseconds per swipe step; the agent moves one step every 5 ms. */
    static final int MS_PER_STEP = 5;

    private final String baseUrl;
    private final OkHttpClient httpClient;
    private final AtomicLong rpcId = new AtomicLong();

    public NativeBackend(String baseUrl, int timeoutSec) {
        this.baseUrl    = baseUrl.endsWith("/") ? baseUrl.substring(0, baseUrl.length() - 1) : baseUrl;
        this.httpClient = new OkHttpClient.Builder()
                .connectTimeout(10, TimeUnit.SECONDS)
                .readTimeout(timeoutSec, TimeUnit.SECONDS)
                .writeTimeout(10, TimeUnit.SECONDS)
                .build();
    }

    // ── Connection ────────────────────────────────────────────────────────

    @Override
    public void ensureConnected() {
        Request request = new Request.Builder().url(baseUrl + "/ping").get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new DeviceConnectionException(
                        "automation agent at " + baseUrl + " answered HTTP " + response.code());
            }
        } catch (IOException e) {
            throw new DeviceConnectionException(
                    "automation agent at " + baseUrl + " not reachable: " + e.getMessage(), e);
        }
    }

    // ── Capture ───────────────────────────────────────────────────────────

    @Override
    public String dumpHierarchy() throws IOException {
        JsonNode result = call("dumpWindowHierarchy", params(false));
        String xml = result.asText("");
        if (xml.isBlank()) {
            throw new IOException("dumpWindowHierarchy returned no hierarchy");
        }
        return xml;
    }

    /**
     * The agent returns a base64 JPEG; it is decoded and re-encoded as PNG so
     * every backend produces the same format.
     */
    @Override
    public byte[] screenshot() throws IOException {
        JsonNode result = call("takeScreenshot", params(1, 80));
        String b64 = result.asText("");
        if (b64.isBlank()) {
            throw new IOException("takeScreenshot returned no image");
        }
        byte[] encoded;
        try {
            encoded = Base64.getMimeDecoder().decode(b64);
        } catch (IllegalArgumentException e) {
            throw new IOException("takeScreenshot returned invalid base64: " + e.getMessage(), e);
        }
        BufferedImage image = ImageIO.read(new ByteArrayInputStream(encoded));
        if (image == null) {
            throw new IOException("takeScreenshot returned an unreadable image");
        }
        ByteArrayOutputStream png = new ByteArrayOutputStream();
        ImageIO.write(image, "png", png);
        return png.toByteArray();
    }

    @Override
    public String foregroundActivity() throws IOException {
        return ActivityParser.parse(shell("dumpsys activity"));
    }

    // ── Actions ───────────────────────────────────────────────────────────

    @Override
    public ActionOutcome tap(int x, int y) {
        return rpcAction("click", params(x, y));
    }

    /** A zero-length swipe held for the duration. */
    @Override
    public ActionOutcome longPress(int x, int y, int durationMs) {
        return rpcAction("swipe", params(x, y, x, y, steps(durationMs)));
    }

    @Override
    public ActionOutcome swipe(int x1, int y1, int x2, int y2, int durationMs) {
        return rpcAction("swipe", params(x1, y1, x2, y2, steps(durationMs)));
    }

    @Override
    public ActionOutcome inputText(String text) {
        try {
            shell("input text " + ShellBackend.escapeInputText(text));
            return ActionOutcome.success();
        } catch (IOException e) {
            log.warn("input text failed: {}", e.getMessage());
            return ActionOutcome.failure(e.getMessage());
        }
    }

    @Override
    public ActionOutcome back() {
        return rpcAction("pressKey", params("back"));
    }

    @Override
    public String name() { return "native"; }

    static int steps(int durationMs) {
        return Math.max(1, durationMs / MS_PER_STEP);
    }

    // ── JSON-RPC ──────────────────────────────────────────────────────────

    /**
     * Invokes one JSON-RPC method.
     *
     * @return the {@code result} member
     * @throws IOException on transport failure, a non-2xx status, or an
     *                     {@code error} member in the response
     */
    JsonNode call(String method, ArrayNode params) throws IOException {
        ObjectNode body = MAPPER.createObjectNode();
        body.put("jsonrpc", "2.0");
        body.put("id", rpcId.incrementAndGet());
        body.put("method", method);
        body.set("params", params);

        Request request = new Request.Builder()
                .url(baseUrl + "/jsonrpc/0")
                .post(RequestBody.create(MAPPER.writeValueAsString(body), JSON))
                .build();

        try (Response response = httpClient.newCall(request).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new IOException(method + " failed with HTTP " + response.code() + ": " + text);
            }
            JsonNode root = MAPPER.readTree(text);
            JsonNode error = root.path("error");
            if (!error.isMissingNode() && !error.isNull()) {
                throw new IOException(method + " failed: " + error.path("message").asText(error.toString()));
            }
            return root.path("result");
        }
    }

    private ActionOutcome rpcAction(String method, ArrayNode params) {
        try {
            JsonNode result = call(method, params);
            if (result.isBoolean() && !result.asBoolean()) {
                return ActionOutcome.failure(method + " returned false");
            }
            return ActionOutcome.success();
        } catch (IOException e) {
            log.warn("{} failed: {}", method, e.getMessage());
            return ActionOutcome.failure(e.getMessage());
        }
    }

    /** Runs a shell command through the agent and returns its output. */
    String shell(String command) throws IOException {
        HttpUrl url = HttpUrl.get(baseUrl + "/shell").newBuilder()
                .addQueryParameter("command", command)
                .build();
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            String text = response.body() != null ? response.body().string() : "";
            if (!response.isSuccessful()) {
                throw new IOException("shell '" + command + "' failed with HTTP " + response.code());
            }
            JsonNode root = MAPPER.readTree(text);
            if (root.path("exitCode").asInt(0) != 0) {
                throw new IOException("shell '" + command + "' exited with " + root.path("exitCode").asInt());
            }
            return root.path("output").asText("");
        }
    }

    private static ArrayNode params(Object... values) {
        ArrayNode arr = MAPPER.createArrayNode();
        for (Object v : values) {
            if (v instanceof Integer) arr.add((Integer) v);
            else if (v instanceof Boolean) arr.add((Boolean) v);
            else arr.add(String.valueOf(v));
        }
        return arr;
    }

    @Override
    public String toString() {
        return "NativeBackend{" + baseUrl + "}";
    }
}
