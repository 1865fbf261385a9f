package uitrace.model;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * The single interaction performed during a capture cycle. Each variant
 * carries only the parameters its kind needs.
 *
 * <p>{@link #validate()} runs before any device I/O, so a malformed request
 * never leaves files behind.
 */
public interface ActionRequest {

    ActionKind kind();

    /**
     * Checks the parameters of this request.
     *
     * @throws ValidationException if a parameter is missing or out of range
     */
    default void validate() {}

    /** Parameters recorded under {@code actionParams}. */
    default Map<String, Object> recordParams() {
        return new LinkedHashMap<>();
    }

    // ── Variants ──────────────────────────────────────────────────────────

    record ShortClick() implements ActionRequest {
        @Override public ActionKind kind() { return ActionKind.SHORT_CLICK; }
    }

    record LongClick(int durationMs) implements ActionRequest {
        @Override public ActionKind kind() { return ActionKind.LONG_CLICK; }

        @Override
        public void validate() {
            if (durationMs <= 0) {
                throw new ValidationException("durationMs must be positive for long-click, got " + durationMs);
            }
        }

        @Override
        public Map<String, Object> recordParams() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("durationMs", durationMs);
            return params;
        }
    }

    /**
     * A swipe starting at the target's center. Either {@code direction} is one
     * of up/down/left/right together with {@code distance}, or the destination
     * is given as a relative displacement {@code (dx, dy)}.
     */
    record Swipe(SwipeDirection direction, Integer distance, Integer dx, Integer dy, int durationMs)
            implements ActionRequest {

        @Override public ActionKind kind() { return ActionKind.SWIPE; }

        public boolean isDirectional() {
            return direction != null && direction != SwipeDirection.CUSTOM && distance != null;
        }

        @Override
        public void validate() {
            if (durationMs <= 0) {
                throw new ValidationException("durationMs must be positive for swipe, got " + durationMs);
            }
            if (isDirectional()) {
                if (distance < 0) {
                    throw new ValidationException("distance must not be negative, got " + distance);
                }
                return;
            }
            if (dx == null && dy == null) {
                throw new ValidationException("swipe needs direction + distance or dx/dy");
            }
        }

        /**
         * Computes the end point of the swipe. Directional swipes are clamped
         * at zero on each axis; no upper clamp is applied.
         */
        public Point destination(Point start) {
            if (isDirectional()) {
                int d = distance;
                return switch (direction) {
                    case UP   -> new Point(start.x(), Math.max(0, start.y() - d));
                    case DOWN -> new Point(start.x(), start.y() + d);
                    case LEFT -> new Point(Math.max(0, start.x() - d), start.y());
                    default   -> new Point(start.x() + d, start.y());
                };
            }
            int ddx = dx == null ? 0 : dx;
            int ddy = dy == null ? 0 : dy;
            return new Point(start.x() + ddx, start.y() + ddy);
        }

        @Override
        public Map<String, Object> recordParams() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("durationMs", durationMs);
            if (isDirectional()) {
                params.put("swipeDirection", direction.wireName());
                params.put("swipeDistance", distance);
            } else {
                int ddx = dx == null ? 0 : dx;
                int ddy = dy == null ? 0 : dy;
                params.put("dx", ddx);
                params.put("dy", ddy);
                SwipeDirection inferred = SwipeDirection.dominant(ddx, ddy);
                if (inferred != null) params.put("swipeDirection", inferred.wireName());
                params.put("swipeDistance", (int) Math.hypot(ddx, ddy));
            }
            return params;
        }
    }

    record InputText(String text) implements ActionRequest {
        @Override public ActionKind kind() { return ActionKind.INPUT; }

        @Override
        public void validate() {
            if (text == null || text.isEmpty()) {
                throw new ValidationException("text required for input action");
            }
        }

        @Override
        public Map<String, Object> recordParams() {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("text", text);
            return params;
        }
    }

    record Back() implements ActionRequest {
        @Override public ActionKind kind() { return ActionKind.BACK; }
    }

    /** Capture around the target without touching the device. */
    record NoAction() implements ActionRequest {
        @Override public ActionKind kind() { return ActionKind.NONE; }
    }
}
