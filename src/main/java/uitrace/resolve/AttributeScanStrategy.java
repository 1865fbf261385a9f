package uitrace.resolve;

import org.w3c.dom.Element;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Last resort without XPath: reads the tag, the {@code @attr='value'}
 * equalities and an optional 1-based index from the last step, then scans
 * every {@code node} element in document order.
 *
 * <p>Returns the index-th match, or the first match when no index is given or
 * it is out of range. Predicates other than equalities are ignored.
 */
public class AttributeScanStrategy implements PathStrategy {

    private static final Pattern EQUALITY = Pattern.compile("^@([A-Za-z0-9_\\-]+)\\s*=\\s*(['\"])(.*?)\\2$", Pattern.DOTALL);

    @Override
    public String name() { return "attribute-scan"; }

    @Override
    public Optional<Element> find(HierarchySnapshot snapshot, String path) {
        Integer index = null;
        String target = path;
        Optional<XPathSupport.Grouped> grouped = XPathSupport.unwrapGroup(path);
        if (grouped.isPresent()) {
            target = grouped.get().inner();
            index = grouped.get().index();
        }

        Optional<XPathSupport.Segment> parsed = XPathSupport.parseSegment(XPathSupport.lastStep(target));
        if (parsed.isEmpty()) return Optional.empty();
        XPathSupport.Segment seg = parsed.get();

        Map<String, String> conds = new LinkedHashMap<>();
        for (String pred : seg.predicates()) {
            if (XPathSupport.isIndex(pred)) {
                if (index == null) index = Integer.parseInt(pred.strip());
                continue;
            }
            Matcher m = EQUALITY.matcher(pred);
            if (m.matches()) conds.put(m.group(1), m.group(3));
        }
        String targetClass = XPathSupport.isStructuralTag(seg.tag()) ? null : seg.tag();

        Element first = null;
        int count = 0;
        for (Element node : snapshot.getNodes()) {
            if (targetClass != null && !targetClass.equals(node.getAttribute("class"))) continue;
            if (!matches(node, conds)) continue;
            count++;
            if (first == null) first = node;
            if (index != null && count == index) return Optional.of(node);
        }
        return Optional.ofNullable(first);
    }

    private static boolean matches(Element node, Map<String, String> conds) {
        for (Map.Entry<String, String> c : conds.entrySet()) {
            if (!node.hasAttribute(c.getKey()) || !c.getValue().equals(node.getAttribute(c.getKey()))) {
                return false;
            }
        }
        return true;
    }
}
