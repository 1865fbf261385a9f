package uitrace.model;

import java.util.Locale;

/** Direction of a swipe; {@code CUSTOM} means the displacement is given as (dx, dy). */
public enum SwipeDirection {
    UP, DOWN, LEFT, RIGHT, CUSTOM;

    /** Lower-case name as written to capture records. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /**
     * @return the direction, {@code CUSTOM} when {@code raw} is null or blank,
     *         or {@code null} when it names no direction
     */
    public static SwipeDirection fromWire(String raw) {
        if (raw == null || raw.isBlank()) return CUSTOM;
        try {
            return valueOf(raw.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return null;
        }
    }

    /**
     * Infers the dominant direction of a displacement; the horizontal axis
     * wins ties. Returns {@code null} for a zero displacement.
     */
    public static SwipeDirection dominant(int dx, int dy) {
        if (Math.abs(dx) >= Math.abs(dy)) {
            if (dx > 0) return RIGHT;
            if (dx < 0) return LEFT;
            return null;
        }
        return dy > 0 ? DOWN : UP;
    }
}
