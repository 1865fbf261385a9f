package uitrace.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The kind of interaction a capture record describes. Serialized by its wire
 * name ({@code short-click}, {@code long-click}, ...).
 */
public enum ActionKind {
    SHORT_CLICK("short-click"),
    LONG_CLICK("long-click"),
    SWIPE("swipe"),
    INPUT("input"),
    BACK("back"),
    /** Target resolved and both snapshots taken, but nothing performed on the device. */
    NONE("none"),
    /** Snapshot of the current screen with no interaction. */
    FINAL("final");

    private final String wireName;

    ActionKind(String wireName) {
        this.wireName = wireName;
    }

    @JsonValue
    public String wireName() {
        return wireName;
    }

    /** Whether the action is aimed at a control resolved from the hierarchy. */
    public boolean requiresTarget() {
        return this != BACK && this != FINAL;
    }

    /**
     * Parses a wire name or one of its accepted aliases (case-insensitive,
     * underscores treated as dashes).
     *
     * @return the kind, or {@code null} when the text names no known action
     */
    @JsonCreator
    public static ActionKind fromWire(String raw) {
        if (raw == null) return null;
        String t = raw.trim().toLowerCase(Locale.ROOT).replace('_', '-');
        return switch (t) {
            case "tap", "click", "short", "short-click"              -> SHORT_CLICK;
            case "long-press", "longclick", "long-click", "press"    -> LONG_CLICK;
            case "input", "text", "type"                             -> INPUT;
            case "swipe"                                             -> SWIPE;
            case "back", "system-back", "navigate-back"              -> BACK;
            case "none", "no-tap"                                    -> NONE;
            case "final"                                             -> FINAL;
            default                                                  -> null;
        };
    }

    @Override
    public String toString() {
        return wireName;
    }
}
