package uitrace.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import uitrace.model.BoundingRect;
import uitrace.model.ControlNode;
import uitrace.model.NodeQuery;

import java.util.List;
import java.util.Optional;

/**
 * Locates the target control of a cycle in a {@link HierarchySnapshot}.
 *
 * <ul>
 *   <li><b>point</b>: the smallest {@code node} whose bounds contain the
 *       point (edges inclusive); ties keep the first in document order.</li>
 *   <li><b>bounds</b>: the first {@code node} whose {@code bounds} attribute
 *       equals the query once all whitespace is removed.</li>
 *   <li><b>path</b>: the {@link PathStrategy} chain; the first strategy that
 *       finds an element wins.</li>
 * </ul>
 */
public class NodeResolver {

    private static final Logger log = LoggerFactory.getLogger(NodeResolver.class);

    private final List<PathStrategy> pathStrategies;

    public NodeResolver() {
        this(PathStrategy.defaults());
    }

    public NodeResolver(List<PathStrategy> pathStrategies) {
        this.pathStrategies = List.copyOf(pathStrategies);
    }

    /**
     * @throws ResolutionException if nothing matches the query
     */
    public ControlNode resolve(HierarchySnapshot snapshot, NodeQuery query) {
        if (query instanceof NodeQuery.PointQuery p) {
            return byPoint(snapshot, p.x(), p.y());
        }
        if (query instanceof NodeQuery.BoundsQuery b) {
            return byBounds(snapshot, b.bounds());
        }
        if (query instanceof NodeQuery.PathQuery p) {
            return byPath(snapshot, p.path());
        }
        throw new IllegalArgumentException("Unsupported query: " + query);
    }

    ControlNode byPoint(HierarchySnapshot snapshot, int x, int y) {
        Element best = null;
        long bestArea = Long.MAX_VALUE;
        for (Element node : snapshot.getNodes()) {
            Optional<BoundingRect> rect = BoundingRect.parse(node.getAttribute(ControlNode.ATTR_BOUNDS));
            if (rect.isEmpty() || !rect.get().contains(x, y)) continue;
            long area = rect.get().area();
            if (area < bestArea) {
                bestArea = area;
                best = node;
            }
        }
        if (best == null) {
            throw new ResolutionException("No node contains point (" + x + ", " + y + ")");
        }
        return snapshot.toControlNode(best);
    }

    ControlNode byBounds(HierarchySnapshot snapshot, String bounds) {
        String wanted = normalizeBounds(bounds);
        for (Element node : snapshot.getNodes()) {
            if (wanted.equals(node.getAttribute(ControlNode.ATTR_BOUNDS))) {
                return snapshot.toControlNode(node);
            }
        }
        throw new ResolutionException("No node with bounds " + wanted);
    }

    ControlNode byPath(HierarchySnapshot snapshot, String path) {
        if (path == null || path.isBlank()) {
            throw new ResolutionException("Empty path query");
        }
        for (PathStrategy strategy : pathStrategies) {
            Optional<Element> found = strategy.find(snapshot, path);
            if (found.isPresent()) {
                log.debug("path '{}' resolved by {}", path, strategy.name());
                return snapshot.toControlNode(found.get());
            }
            log.debug("path '{}' not matched by {}", path, strategy.name());
        }
        throw new ResolutionException("No node matches path " + path);
    }

    /** Removes all whitespace: {@code "[ 10,20 ][ 30, 40]"} → {@code "[10,20][30,40]"}. */
    public static String normalizeBounds(String bounds) {
        return bounds == null ? "" : bounds.replaceAll("\\s+", "");
    }
}
