package uitrace.model;

/**
 * Soft result of an action primitive. A failed outcome does not abort the
 * cycle; its message ends up in the record's {@code actionError}.
 */
public record ActionOutcome(boolean ok, String error) {

    private static final ActionOutcome SUCCESS = new ActionOutcome(true, null);

    public static ActionOutcome success() {
        return SUCCESS;
    }

    public static ActionOutcome failure(String error) {
        return new ActionOutcome(false, error == null || error.isBlank() ? "action failed" : error);
    }
}
