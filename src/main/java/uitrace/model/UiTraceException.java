package uitrace.model;

/**
 * Base unchecked exception for every fatal failure of a capture cycle.
 * Subclasses fix the {@link FailureKind} so callers can map the failure to a
 * response without inspecting messages.
 */
public abstract class UiTraceException extends RuntimeException {

    protected UiTraceException(String msg) {
        super(msg);
    }

    protected UiTraceException(String msg, Throwable cause) {
        super(msg, cause);
    }

    public abstract FailureKind getKind();
}
