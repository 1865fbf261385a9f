package uitrace.ledger;

import uitrace.model.FailureKind;
import uitrace.model.UiTraceException;

/** The ledger file cannot be read, is invalid, or could not be rewritten. */
public class LedgerException extends UiTraceException {

    public LedgerException(String message) {
        super(message);
    }

    public LedgerException(String message, Throwable cause) {
        super(message, cause);
    }

    @Override
    public FailureKind getKind() { return FailureKind.LEDGER; }
}
