package uitrace.model;

/** How the target control of a cycle is located in the hierarchy. */
public interface NodeQuery {

    /** Smallest node whose bounds contain the point. */
    record PointQuery(int x, int y) implements NodeQuery {
        @Override
        public String toString() { return "point(" + x + "," + y + ")"; }
    }

    /** Node whose {@code bounds} attribute equals the string, whitespace ignored. */
    record BoundsQuery(String bounds) implements NodeQuery {
        @Override
        public String toString() { return "bounds(" + bounds + ")"; }
    }

    /** XPath-like expression resolved through the fallback strategies. */
    record PathQuery(String path) implements NodeQuery {
        @Override
        public String toString() { return "path(" + path + ")"; }
    }
}
