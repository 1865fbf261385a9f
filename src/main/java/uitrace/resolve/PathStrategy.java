package uitrace.resolve;

import org.w3c.dom.Element;

import java.util.List;
import java.util.Optional;

/**
 * One way of turning an XPath-like expression into an element. Strategies are
 * pure: they only read the snapshot, and a syntax error counts as no match.
 */
public interface PathStrategy {

    /** Short name for logs. */
    String name();

    Optional<Element> find(HierarchySnapshot snapshot, String path);

    /** The strategies in the order they are tried. */
    static List<PathStrategy> defaults() {
        return List.of(
                new LiteralPathStrategy(),
                new ClassRewriteStrategy(),
                new GroupedPathStrategy(),
                new AttributeScanStrategy());
    }
}
