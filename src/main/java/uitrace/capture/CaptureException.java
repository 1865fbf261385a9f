package uitrace.capture;

import uitrace.model.FailureKind;
import uitrace.model.UiTraceException;

/** The pre-action snapshot could not be taken or persisted. */
public class CaptureException extends UiTraceException {

    public CaptureException(String message) {
        super(message);
    }

    public CaptureException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() { return FailureKind.CAPTURE; }
}
