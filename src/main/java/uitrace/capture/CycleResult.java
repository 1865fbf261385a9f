package uitrace.capture;

import uitrace.model.ActionOutcome;
import uitrace.model.CaptureRecord;
import uitrace.model.FailureKind;
import uitrace.model.Point;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

/**
 * Outcome of one capture cycle: either a record was appended, or the cycle
 * aborted before appending anything.
 */
public final class CycleResult {

    public enum Status { RECORDED, ABORTED }

    private final Status status;
    private final CaptureRecord record;
    private final Point center;
    private final Map<String, String> files;
    private final CompletableFuture<ActionOutcome> action;
    private final FailureKind failureKind;
    private final String message;

    private CycleResult(Status status, CaptureRecord record, Point center, Map<String, String> files,
                        CompletableFuture<ActionOutcome> action, FailureKind failureKind, String message) {
        this.status      = status;
        this.record      = record;
        this.center      = center;
        this.files       = files;
        this.action      = action;
        this.failureKind = failureKind;
        this.message     = message;
    }

    public static CycleResult recorded(CaptureRecord record, Point center, Map<String, String> files,
                                       CompletableFuture<ActionOutcome> action) {
        return new CycleResult(Status.RECORDED, record.copy(), center,
                Collections.unmodifiableMap(new LinkedHashMap<>(files)), action, null, null);
    }

    public static CycleResult aborted(FailureKind kind, String message) {
        return new CycleResult(Status.ABORTED, null, null, Map.of(), null, kind, message);
    }

    public boolean isRecorded() { return status == Status.RECORDED; }

    public Status              getStatus()      { return status; }
    /** Copy of the appended record; null when aborted. */
    public CaptureRecord       getRecord()      { return record == null ? null : record.copy(); }
    /** Acted-upon point; absent for back and final. */
    public Optional<Point>     getCenter()      { return Optional.ofNullable(center); }
    /** raw, boxed, xml, json, dest, destXml → absolute paths (present ones only). */
    public Map<String, String> getFiles()       { return files; }
    public FailureKind         getFailureKind() { return failureKind; }
    public String              getMessage()     { return message; }

    /**
     * The action of the cycle. For {@code mid} timing it may still be running
     * on the device when the result is returned.
     */
    public Optional<CompletableFuture<ActionOutcome>> getAction() {
        return Optional.ofNullable(action);
    }

    @Override
    public String toString() {
        return isRecorded()
                ? "CycleResult{RECORDED " + record + "}"
                : "CycleResult{ABORTED " + failureKind + ": " + message + "}";
    }
}
