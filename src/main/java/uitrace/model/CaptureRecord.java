package uitrace.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One control → effect transition: the state before an interaction, what was
 * done, and (when it could be captured) the state after it.
 *
 * <p>Records are appended to the {@code Ledger} and never modified afterwards;
 * the setters exist for Jackson and for the orchestrator while it assembles a
 * record.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public class CaptureRecord {

    @JsonProperty("sequenceId")
    private int sequenceId;

    /** {@code elem_<sequenceId>}, the stem of every file of this record. */
    @JsonProperty("elemId")
    private String elemId;

    @JsonProperty("timestamp")
    private Instant timestamp;

    /** Absent for actions without a target (back, final). */
    @JsonProperty("clickPoint")
    private Point clickPoint;

    @JsonProperty("node")
    private Map<String, String> node = new LinkedHashMap<>();

    @JsonProperty("preImages")
    private ImageSet preImages;

    @JsonProperty("preXml")
    private String preXml;

    @JsonProperty("action")
    private ActionKind action;

    @JsonProperty("actionParams")
    private Map<String, Object> actionParams = new LinkedHashMap<>();

    @JsonProperty("postImages")
    private ImageSet postImages;

    @JsonProperty("postXml")
    private String postXml;

    @JsonProperty("sourceActivity")
    private String sourceActivity;

    @JsonProperty("destActivity")
    private String destActivity;

    @JsonProperty("activityChanged")
    private Boolean activityChanged;

    /** {@code post} or {@code mid}; absent when no post-capture was attempted. */
    @JsonProperty("captureTiming")
    private String captureTiming;

    /** Soft failure of the action primitive; the record is still valid. */
    @JsonProperty("actionError")
    private String actionError;

    public CaptureRecord() {}

    // ── Getters ──────────────────────────────────────────────────────────

    public int                 getSequenceId()      { return sequenceId; }
    public String              getElemId()          { return elemId; }
    public Instant             getTimestamp()       { return timestamp; }
    public Point               getClickPoint()      { return clickPoint; }
    public Map<String, String> getNode()            { return node; }
    public ImageSet            getPreImages()       { return preImages; }
    public String              getPreXml()          { return preXml; }
    public ActionKind          getAction()          { return action; }
    public Map<String, Object> getActionParams()    { return actionParams; }
    public ImageSet            getPostImages()      { return postImages; }
    public String              getPostXml()         { return postXml; }
    public String              getSourceActivity()  { return sourceActivity; }
    public String              getDestActivity()    { return destActivity; }
    public Boolean             getActivityChanged() { return activityChanged; }
    public String              getCaptureTiming()   { return captureTiming; }
    public String              getActionError()     { return actionError; }

    // ── Setters ──────────────────────────────────────────────────────────

    public void setSequenceId(int sequenceId)                  { this.sequenceId = sequenceId; }
    public void setElemId(String elemId)                       { this.elemId = elemId; }
    public void setTimestamp(Instant timestamp)                { this.timestamp = timestamp; }
    public void setClickPoint(Point clickPoint)                { this.clickPoint = clickPoint; }
    public void setNode(Map<String, String> node)              { this.node = node; }
    public void setPreImages(ImageSet preImages)               { this.preImages = preImages; }
    public void setPreXml(String preXml)                       { this.preXml = preXml; }
    public void setAction(ActionKind action)                   { this.action = action; }
    public void setActionParams(Map<String, Object> params)    { this.actionParams = params; }
    public void setPostImages(ImageSet postImages)             { this.postImages = postImages; }
    public void setPostXml(String postXml)                     { this.postXml = postXml; }
    public void setSourceActivity(String sourceActivity)       { this.sourceActivity = sourceActivity; }
    public void setDestActivity(String destActivity)           { this.destActivity = destActivity; }
    public void setActivityChanged(Boolean activityChanged)    { this.activityChanged = activityChanged; }
    public void setCaptureTiming(String captureTiming)         { this.captureTiming = captureTiming; }
    public void setActionError(String actionError)             { this.actionError = actionError; }

    // ── Convenience ──────────────────────────────────────────────────────

    @JsonIgnore public boolean hasClickPoint()  { return clickPoint != null; }
    @JsonIgnore public boolean hasPostCapture() { return postImages != null; }
    @JsonIgnore public boolean hasActionError() { return actionError != null && !actionError.isBlank(); }

    /**
     * Deep copy: the maps and image sets are duplicated, so changes to the
     * copy never reach this record.
     */
    public CaptureRecord copy() {
        CaptureRecord c = new CaptureRecord();
        c.sequenceId      = sequenceId;
        c.elemId          = elemId;
        c.timestamp       = timestamp;
        c.clickPoint      = clickPoint;
        c.node            = node == null ? null : new LinkedHashMap<>(node);
        c.preImages       = preImages == null ? null : preImages.copy();
        c.preXml          = preXml;
        c.action          = action;
        c.actionParams    = actionParams == null ? null : new LinkedHashMap<>(actionParams);
        c.postImages      = postImages == null ? null : postImages.copy();
        c.postXml         = postXml;
        c.sourceActivity  = sourceActivity;
        c.destActivity    = destActivity;
        c.activityChanged = activityChanged;
        c.captureTiming   = captureTiming;
        c.actionError     = actionError;
        return c;
    }

    @Override
    public String toString() {
        return String.format("CaptureRecord{id=%d, action=%s, click=%s, node=%s}",
                sequenceId, action, clickPoint, node == null ? null : node.get(ControlNode.ATTR_BOUNDS));
    }

    /**
     * Paths of the screenshots belonging to one side of the transition.
     * {@code boxed} is only present on the pre side.
     */
    @JsonInclude(JsonInclude.Include.NON_NULL)
    public static class ImageSet {

        @JsonProperty("raw")
        private String raw;

        @JsonProperty("boxed")
        private String boxed;

        public ImageSet() {}

        public ImageSet(String raw, String boxed) {
            this.raw = raw;
            this.boxed = boxed;
        }

        public String getRaw()   { return raw; }
        public String getBoxed() { return boxed; }

        public void setRaw(String raw)     { this.raw = raw; }
        public void setBoxed(String boxed) { this.boxed = boxed; }

        ImageSet copy() {
            return new ImageSet(raw, boxed);
        }
    }
}
