package uitrace.recorder;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.model.CompletedGesture;

import java.util.Optional;

/**
 * Turns a stream of touch event lines into completed taps.
 *
 * <p>Two states: idle and active. A finger going down (BTN_TOUCH /
 * BTN_TOOL_FINGER = 1, or a non-negative tracking id) makes the detector
 * active; lifting it (key value 0, or tracking id -1) emits a gesture at the
 * last known position and returns to idle. Positions are tracked in both
 * states and survive across gestures.
 *
 * <p>Not thread-safe; owned by the single consumer thread of a listener.
 */
public class ClickDetector {

    private static final Logger log = LoggerFactory.getLogger(ClickDetector.class);

    private boolean active;
    private Integer trackingId;
    private Integer lastX;
    private Integer lastY;

    /** Parses and feeds one raw line; malformed lines are ignored. */
    public Optional<CompletedGesture> onLine(String raw) {
        Optional<TouchEventLine> line = TouchEventLine.parse(raw);
        if (line.isEmpty()) {
            log.debug("ignored event line: {}", raw);
            return Optional.empty();
        }
        return onEvent(line.get());
    }

    public Optional<CompletedGesture> onEvent(TouchEventLine ev) {
        String code = ev.code();
        int value = ev.value();

        if (ev.isAbs()) {
            switch (code) {
                case TouchEventLine.ABS_MT_POSITION_X:
                case TouchEventLine.ABS_X:
                    lastX = value;
                    return Optional.empty();
                case TouchEventLine.ABS_MT_POSITION_Y:
                case TouchEventLine.ABS_Y:
                    lastY = value;
                    return Optional.empty();
                case TouchEventLine.ABS_MT_TRACKING_ID:
                    if (value >= 0) {
                        down(value);
                        return Optional.empty();
                    }
                    if (value == -1) return up();
                    return Optional.empty();
                default:
                    return Optional.empty();
            }
        }

        if (ev.isKey() && (TouchEventLine.BTN_TOUCH.equals(code) || TouchEventLine.BTN_TOOL_FINGER.equals(code))) {
            if (value == 1) {
                down(trackingId);
            } else if (value == 0) {
                return up();
            }
        }
        return Optional.empty();
    }

    private void down(Integer id) {
        active = true;
        trackingId = id;
    }

    private Optional<CompletedGesture> up() {
        Optional<CompletedGesture> gesture = Optional.empty();
        if (active && lastX != null && lastY != null) {
            gesture = Optional.of(new CompletedGesture(lastX, lastY));
            log.debug("tap completed at ({}, {})", lastX, lastY);
        }
        active = false;
        trackingId = null;
        return gesture;
    }

    // ── State inspection ──────────────────────────────────────────────────

    public boolean isActive()      { return active; }
    public Integer getTrackingId() { return trackingId; }
    public Integer getLastX()      { return lastX; }
    public Integer getLastY()      { return lastY; }
}
