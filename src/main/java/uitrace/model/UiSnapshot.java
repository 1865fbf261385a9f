package uitrace.model;

import java.nio.file.Path;

/**
 * Hierarchy dump, screenshot and foreground activity taken at one instant and
 * tagged with the sequence id of the cycle that took it.
 *
 * <p>{@code hierarchyXmlPath} may be {@code null} for a post-action snapshot
 * whose dump failed; {@code activity} is {@code null} when it could not be read.
 */
public record UiSnapshot(Path hierarchyXmlPath, Path screenshotPath, String activity, int sequenceId) {

    public boolean hasHierarchy() {
        return hierarchyXmlPath != null;
    }

    public boolean hasActivity() {
        return activity != null && !activity.isBlank();
    }
}
