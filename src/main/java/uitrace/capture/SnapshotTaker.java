package uitrace.capture;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import uitrace.device.DeviceBridge;
import uitrace.model.UiSnapshot;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Takes hierarchy dump, screenshot and foreground activity from the device and
 * writes them into the {@link CaptureLayout}.
 *
 * <p>The pre-action snapshot is all-or-nothing: if the dump or the screenshot
 * fails the partial files are deleted and a {@link CaptureException} is
 * thrown. The post-action snapshot is best effort: each artifact failure is
 * logged and the artifact left out.
 */
public class SnapshotTaker {

    private static final Logger log = LoggerFactory.getLogger(SnapshotTaker.class);

    private final DeviceBridge bridge;
    private final CaptureLayout layout;

    public SnapshotTaker(DeviceBridge bridge, CaptureLayout layout) {
        this.bridge = bridge;
        this.layout = layout;
    }

    /**
     * @throws CaptureException if the dump or the screenshot cannot be taken
     */
    public UiSnapshot takePre(int sequenceId) {
        Path xml = layout.preXml(sequenceId);
        Path raw = layout.rawImage(sequenceId);
        try {
            layout.ensureDirectories();
            Files.writeString(xml, bridge.dumpHierarchy(), StandardCharsets.UTF_8);
            Files.write(raw, bridge.screenshot());
        } catch (IOException e) {
            discard(xml, raw);
            throw new CaptureException("Pre-capture failed for " + CaptureLayout.elemId(sequenceId)
                    + ": " + e.getMessage(), e);
        }
        String activity = activityOrNull();
        log.debug("Pre-capture {} done, activity={}", CaptureLayout.elemId(sequenceId), activity);
        return new UiSnapshot(xml, raw, activity, sequenceId);
    }

    /**
     * Screenshot first, then dump, then activity. Never throws; missing parts
     * come back as {@code null} paths.
     */
    public UiSnapshot takePost(int sequenceId) {
        Path png = layout.postImage(sequenceId);
        Path xml = layout.postXml(sequenceId);
        try {
            Files.write(png, bridge.screenshot());
        } catch (IOException e) {
            log.warn("Post screenshot failed for {}: {}", CaptureLayout.elemId(sequenceId), e.getMessage());
            png = null;
        }
        try {
            Files.writeString(xml, bridge.dumpHierarchy(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            log.warn("Post hierarchy dump failed for {}: {}", CaptureLayout.elemId(sequenceId), e.getMessage());
            xml = null;
        }
        return new UiSnapshot(xml, png, activityOrNull(), sequenceId);
    }

    /**
     * Writes a plain screenshot to {@code target}.
     *
     * @throws IOException if the screenshot cannot be taken or written
     */
    public void saveScreenshot(Path target) throws IOException {
        Files.createDirectories(target.getParent());
        Files.write(target, bridge.screenshot());
    }

    /** Deletes the files of an abandoned snapshot. */
    public void discard(Path... files) {
        for (Path f : files) {
            if (f == null) continue;
            try {
                Files.deleteIfExists(f);
            } catch (IOException e) {
                log.warn("Could not delete {}: {}", f, e.getMessage());
            }
        }
    }

    private String activityOrNull() {
        try {
            String activity = bridge.foregroundActivity();
            return activity == null || activity.isBlank() ? null : activity;
        } catch (IOException e) {
            log.warn("Foreground activity unavailable: {}", e.getMessage());
            return null;
        }
    }
}
