package uitrace.resolve;

import org.w3c.dom.Element;

import java.util.Optional;

/**
 * Handles {@code ( inner )[n]}: the inner path is class-rewritten, then tried
 * as {@code (rewritten)[n]} (n-th match overall) and as {@code rewritten[n]}
 * (n-th among siblings).
 */
public class GroupedPathStrategy implements PathStrategy {

    @Override
    public String name() { return "grouped"; }

    @Override
    public Optional<Element> find(HierarchySnapshot snapshot, String path) {
        Optional<XPathSupport.Grouped> grouped = XPathSupport.unwrapGroup(path);
        if (grouped.isEmpty()) return Optional.empty();

        String inner = grouped.get().inner();
        int n = grouped.get().index();
        String rewritten = XPathSupport.classRewrite(inner).orElse(XPathSupport.normalize(inner));

        Optional<Element> found = XPathSupport.evaluateFirst(snapshot, "(" + rewritten + ")[" + n + "]");
        if (found.isPresent()) return found;
        return XPathSupport.evaluateFirst(snapshot, rewritten + "[" + n + "]");
    }
}
