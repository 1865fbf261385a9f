package uitrace.model;

/**
 * Fatal failure categories of a capture cycle. Each one aborts the cycle (or,
 * for {@link #LEDGER}, fails it after the device work is done) and is reported
 * to the caller as a distinct outcome.
 *
 * <p>Soft action failures are not listed here; they travel with the record as
 * {@code actionError}.
 */
public enum FailureKind {
    /** Device bridge unreachable. */
    CONNECTION,
    /** Hierarchy dump or screenshot failed during pre-capture. */
    CAPTURE,
    /** No node matched the query. */
    RESOLUTION,
    /** Missing or contradictory action parameters. */
    VALIDATION,
    /** Ledger write or serialization failed. */
    LEDGER
}
