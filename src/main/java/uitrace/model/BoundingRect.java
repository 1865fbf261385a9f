package uitrace.model;

import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Axis-aligned rectangle in screen pixels, as written by the hierarchy dump in
 * the form {@code [x1,y1][x2,y2]}.
 */
public record BoundingRect(int x1, int y1, int x2, int y2) {

    private static final Pattern BOUNDS = Pattern.compile("\\[(\\d+),(\\d+)]\\[(\\d+),(\\d+)]");

    public BoundingRect {
        if (x2 < x1 || y2 < y1) {
            throw new IllegalArgumentException(String.format(
                    "Inverted rectangle [%d,%d][%d,%d]", x1, y1, x2, y2));
        }
    }

    /**
     * Parses a bounds string. Leading text is not allowed; anything after the
     * second bracket pair is ignored.
     *
     * @return the rectangle, or empty when the text is not a well-formed,
     *         non-inverted bounds string
     */
    public static Optional<BoundingRect> parse(String bounds) {
        if (bounds == null) return Optional.empty();
        Matcher m = BOUNDS.matcher(bounds);
        if (!m.lookingAt()) return Optional.empty();
        try {
            int x1 = Integer.parseInt(m.group(1));
            int y1 = Integer.parseInt(m.group(2));
            int x2 = Integer.parseInt(m.group(3));
            int y2 = Integer.parseInt(m.group(4));
            if (x2 < x1 || y2 < y1) return Optional.empty();
            return Optional.of(new BoundingRect(x1, y1, x2, y2));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }

    /** Inclusive on all four edges. */
    public boolean contains(int x, int y) {
        return x1 <= x && x <= x2 && y1 <= y && y <= y2;
    }

    public long area() {
        return (long) (x2 - x1) * (y2 - y1);
    }

    /** Floor of the arithmetic mean of each axis pair. */
    public Point center() {
        return new Point(Math.floorDiv(x1 + x2, 2), Math.floorDiv(y1 + y2, 2));
    }

    public String toBoundsString() {
        return "[" + x1 + "," + y1 + "][" + x2 + "," + y2 + "]";
    }

    @Override
    public String toString() {
        return toBoundsString();
    }
}
