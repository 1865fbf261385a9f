package uitrace.device;

import uitrace.model.ActionOutcome;

import java.io.IOException;

/**
 * Everything a capture cycle needs from the device.
 *
 * <p>Capture methods throw {@link IOException} when the device answered but the
 * capture itself failed. Action primitives never throw: a failed action is an
 * {@link ActionOutcome#failure(String) outcome} so the cycle can still record
 * what happened.
 */
public interface DeviceBridge {

    /**
     * Verifies the device is reachable.
     *
     * @throws DeviceConnectionException if no usable device is attached
     */
    void ensureConnected();

    /** UI hierarchy XML of the current screen. */
    String dumpHierarchy() throws IOException;

    /** PNG-encoded screenshot of the current screen. */
    byte[] screenshot() throws IOException;

    /**
     * Fully-qualified name of the resumed activity, or {@code null} if the
     * device did not report one.
     */
    String foregroundActivity() throws IOException;

    ActionOutcome tap(int x, int y);

    ActionOutcome longPress(int x, int y, int durationMs);

    ActionOutcome swipe(int x1, int y1, int x2, int y2, int durationMs);

    ActionOutcome inputText(String text);

    ActionOutcome back();

    /** Short backend name for logs. */
    String name();
}
