package uitrace.resolve;

import org.w3c.dom.Element;

import java.util.Optional;

/** Evaluates the path as written, anchored at the document root. */
public class LiteralPathStrategy implements PathStrategy {

    @Override
    public String name() { return "literal"; }

    @Override
    public Optional<Element> find(HierarchySnapshot snapshot, String path) {
        return XPathSupport.evaluateFirst(snapshot, XPathSupport.normalize(path));
    }
}
