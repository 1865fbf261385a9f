package uitrace.model;

/** A request parameter is missing or out of range. Raised before any device I/O. */
public class ValidationException extends UiTraceException {

    public ValidationException(String message) {
        super(message);
    }

    public ValidationException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() { return FailureKind.VALIDATION; }
}
