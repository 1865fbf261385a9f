package uitrace.resolve;

import uitrace.model.FailureKind;
import uitrace.model.UiTraceException;

/** The target control could not be located in the hierarchy snapshot. */
public class ResolutionException extends UiTraceException {

    public ResolutionException(String message) {
        super(message);
    }

    public ResolutionException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() { return FailureKind.RESOLUTION; }
}
