package uitrace.capture;

import java.util.Locale;

/**
 * When the post-action snapshot is taken.
 *
 * @param mode        {@link Mode#POST}: after the action returns and a settle
 *                    delay; {@link Mode#MID}: while the action is running
 * @param waitAfterMs settle delay for {@code POST}
 * @param midDelayMs  delay between starting the action and capturing for {@code MID}
 */
public record CaptureTiming(Mode mode, long waitAfterMs, long midDelayMs) {

    public static final long DEFAULT_WAIT_AFTER_MS = 400;
    public static final long DEFAULT_MID_DELAY_MS  = 50;

    public enum Mode {
        POST, MID;

        public String wireName() { return name().toLowerCase(Locale.ROOT); }
    }

    public CaptureTiming {
        if (mode == null) mode = Mode.POST;
        waitAfterMs = Math.max(0, waitAfterMs);
        midDelayMs  = Math.max(0, midDelayMs);
    }

    public static CaptureTiming defaults() {
        return new CaptureTiming(Mode.POST, DEFAULT_WAIT_AFTER_MS, DEFAULT_MID_DELAY_MS);
    }

    public static CaptureTiming post(long waitAfterMs) {
        return new CaptureTiming(Mode.POST, waitAfterMs, DEFAULT_MID_DELAY_MS);
    }

    public static CaptureTiming mid(long midDelayMs) {
        return new CaptureTiming(Mode.MID, DEFAULT_WAIT_AFTER_MS, midDelayMs);
    }
}
