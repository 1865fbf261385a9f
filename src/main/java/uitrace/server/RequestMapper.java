package uitrace.server;

import uitrace.capture.CaptureRequest;
import uitrace.capture.CaptureTiming;
import uitrace.model.ActionKind;
import uitrace.model.ActionRequest;
import uitrace.model.BoundingRect;
import uitrace.model.NodeQuery;
import uitrace.model.SwipeDirection;
import uitrace.model.ValidationException;
import uitrace.resolve.NodeResolver;

import java.util.Map;

/**
 * Maps the JSON body of {@code POST /bridge/capture_tap} to a
 * {@link CaptureRequest}.
 *
 * <p>Recognised fields: {@code bounds} | {@code xpath}, {@code action},
 * {@code durationMs}, {@code text}, {@code dx}, {@code dy},
 * {@code direction}, {@code distance}, {@code waitAfterMs},
 * {@code midCapture}, {@code midDelayMs}, {@code tap}. Unknown fields are ignored.
 * A missing {@code action} means a short click, or no action at all when
 * {@code tap} is {@code false}; {@code tap} is ignored once {@code action}
 * is given.
 */
public class RequestMapper {

    public static final int DEFAULT_DURATION_MS = 800;

    private final long defaultWaitAfterMs;
    private final long defaultMidDelayMs;

    public RequestMapper(long defaultWaitAfterMs, long defaultMidDelayMs) {
        this.defaultWaitAfterMs = defaultWaitAfterMs;
        this.defaultMidDelayMs  = defaultMidDelayMs;
    }

    /**
     * @throws ValidationException if a field has the wrong type or value
     */
    public CaptureRequest map(Map<?, ?> body) {
        ActionKind kind = parseAction(body.get("action"), !body.containsKey("tap") || bool(body, "tap"));
        ActionRequest action = buildAction(kind, body);
        NodeQuery query = kind.requiresTarget() ? parseQuery(body) : null;

        CaptureTiming timing;
        if (bool(body, "midCapture")) {
            timing = new CaptureTiming(CaptureTiming.Mode.MID, defaultWaitAfterMs,
                    integer(body, "midDelayMs", defaultMidDelayMs));
        } else {
            timing = new CaptureTiming(CaptureTiming.Mode.POST,
                    integer(body, "waitAfterMs", defaultWaitAfterMs), defaultMidDelayMs);
        }
        return new CaptureRequest(query, action, timing);
    }

    // ── Fields ────────────────────────────────────────────────────────────

    static ActionKind parseAction(Object raw, boolean tap) {
        if (raw == null || raw.toString().isBlank()) return tap ? ActionKind.SHORT_CLICK : ActionKind.NONE;
        ActionKind kind = ActionKind.fromWire(raw.toString());
        if (kind == null || kind == ActionKind.FINAL) {
            throw new ValidationException("unsupported action: " + raw);
        }
        return kind;
    }

    private ActionRequest buildAction(ActionKind kind, Map<?, ?> body) {
        return switch (kind) {
            case SHORT_CLICK -> new ActionRequest.ShortClick();
            case LONG_CLICK  -> new ActionRequest.LongClick((int) integer(body, "durationMs", DEFAULT_DURATION_MS));
            case INPUT       -> new ActionRequest.InputText(text(body, "text"));
            case BACK        -> new ActionRequest.Back();
            case NONE        -> new ActionRequest.NoAction();
            case SWIPE       -> buildSwipe(body);
            case FINAL       -> throw new ValidationException("unsupported action: " + kind);
        };
    }

    private static ActionRequest buildSwipe(Map<?, ?> body) {
        String rawDirection = text(body, "direction");
        SwipeDirection direction = SwipeDirection.fromWire(rawDirection);
        if (direction == null) {
            throw new ValidationException("unknown swipe direction: " + rawDirection);
        }
        return new ActionRequest.Swipe(direction,
                optionalInt(body, "distance"),
                optionalInt(body, "dx"),
                optionalInt(body, "dy"),
                (int) integer(body, "durationMs", DEFAULT_DURATION_MS));
    }

    /** {@code bounds} wins over {@code xpath}; neither leaves the query empty. */
    private static NodeQuery parseQuery(Map<?, ?> body) {
        String bounds = text(body, "bounds");
        if (bounds != null && !bounds.isBlank()) {
            String normalized = NodeResolver.normalizeBounds(bounds);
            if (BoundingRect.parse(normalized).isEmpty()) {
                throw new ValidationException("invalid bounds format: " + bounds);
            }
            return new NodeQuery.BoundsQuery(normalized);
        }
        String xpath = text(body, "xpath");
        if (xpath != null && !xpath.isBlank()) {
            return new NodeQuery.PathQuery(xpath.trim());
        }
        return null;
    }

    // ── Coercion ──────────────────────────────────────────────────────────

    private static String text(Map<?, ?> body, String key) {
        Object v = body.get(key);
        return v == null ? null : v.toString();
    }

    private static Integer optionalInt(Map<?, ?> body, String key) {
        Object v = body.get(key);
        if (v == null) return null;
        if (v instanceof Number n) return n.intValue();
        String s = v.toString().trim();
        if (s.isEmpty()) return null;
        try {
            return (int) Double.parseDouble(s);
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be a number, got '" + s + "'", e);
        }
    }

    private static long integer(Map<?, ?> body, String key, long defaultValue) {
        Integer v = optionalInt(body, key);
        return v == null ? defaultValue : v;
    }

    private static boolean bool(Map<?, ?> body, String key) {
        Object v = body.get(key);
        if (v instanceof Boolean b) return b;
        return v != null && Boolean.parseBoolean(v.toString().trim());
    }
}
