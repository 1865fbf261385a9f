package uitrace.device;

import uitrace.model.FailureKind;
import uitrace.model.UiTraceException;

/** No usable device is attached, or the automation agent cannot be reached. */
public class DeviceConnectionException extends UiTraceException {

    public DeviceConnectionException(String message) {
        super(message);
    }

    public DeviceConnectionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() { return FailureKind.CONNECTION; }
}
