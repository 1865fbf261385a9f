package uitrace.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.device.DeviceBridge;
import uitrace.model.ActionOutcome;
import uitrace.model.ActionRequest;
import uitrace.model.Point;

/**
 * Performs exactly one {@link ActionRequest} on the device.
 */
public class ActionDispatcher {

    private static final Logger log = LoggerFactory.getLogger(ActionDispatcher.class);

    private final DeviceBridge bridge;

    public ActionDispatcher(DeviceBridge bridge) {
        this.bridge = bridge;
    }

    /**
     * @param center resolved target center; may be null only for {@code back}
     */
    public ActionOutcome dispatch(ActionRequest action, Point center) {
        log.debug("dispatch {} at {}", action.kind(), center);
        if (action instanceof ActionRequest.ShortClick) {
            return bridge.tap(center.x(), center.y());
        }
        if (action instanceof ActionRequest.LongClick lc) {
            return bridge.longPress(center.x(), center.y(), lc.durationMs());
        }
        if (action instanceof ActionRequest.Swipe sw) {
            Point dest = sw.destination(center);
            return bridge.swipe(center.x(), center.y(), dest.x(), dest.y(), sw.durationMs());
        }
        if (action instanceof ActionRequest.InputText in) {
            return bridge.inputText(in.text());
        }
        if (action instanceof ActionRequest.Back) {
            return bridge.back();
        }
        if (action instanceof ActionRequest.NoAction) {
            return ActionOutcome.success();
        }
        return ActionOutcome.failure("unknown action: " + action.kind());
    }

    /**
     * How long a {@code mid} capture waits for the action after capturing:
     * duration + 1.5 s for long-click and swipe, 1 s otherwise.
     */
    public static long joinTimeoutMs(ActionRequest action) {
        if (action instanceof ActionRequest.LongClick lc) return lc.durationMs() + 1500L;
        if (action instanceof ActionRequest.Swipe sw)     return sw.durationMs() + 1500L;
        return 1000L;
    }
}
