package uitrace.capture;

import uitrace.model.ActionRequest;
import uitrace.model.NodeQuery;
import uitrace.model.ValidationException;

/**
 * Input of one on-demand capture cycle.
 *
 * @param query  target control; ignored for {@code back}
 * @param action the single interaction to perform
 * @param timing post-capture timing
 */
public record CaptureRequest(NodeQuery query, ActionRequest action, CaptureTiming timing) {

    public CaptureRequest {
        if (timing == null) timing = CaptureTiming.defaults();
    }

    /**
     * @throws ValidationException if the action parameters are invalid or a
     *                             targeted action has no query
     */
    public void validate() {
        if (action == null) {
            throw new ValidationException("action is required");
        }
        action.validate();
        if (action.kind().requiresTarget() && query == null) {
            throw new ValidationException("no center; element required for " + action.kind());
        }
    }
}
