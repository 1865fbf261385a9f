package uitrace.model;

/**
 * A finished down→up touch interaction, reported at the last position seen
 * before the finger was lifted.
 */
public record CompletedGesture(int x, int y) {

    public Point toPoint() {
        return new Point(x, y);
    }
}
