package uitrace.resolve;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

import javax.xml.xpath.XPath;
import javax.xml.xpath.XPathConstants;
import javax.xml.xpath.XPathExpressionException;
import javax.xml.xpath.XPathFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Path parsing and XPath evaluation shared by the {@link PathStrategy}
 * implementations.
 */
final class XPathSupport {

    private static final Logger log = LoggerFactory.getLogger(XPathSupport.class);

    /** {@code ( inner )[n]} */
    private static final Pattern GROUPED = Pattern.compile("^\\(\\s*(.+)\\s*\\)\\s*\\[\\s*(\\d+)\\s*]\\s*$", Pattern.DOTALL);

    /** {@code tag[pred][pred]...} */
    private static final Pattern SEGMENT = Pattern.compile("^([A-Za-z0-9_.$]+)((?:\\[.*])*)$", Pattern.DOTALL);

    private static final Pattern INDEX = Pattern.compile("^\\s*\\d+\\s*$");

    private XPathSupport() {}

    /** Expression wrapped in a group, with its 1-based index. */
    record Grouped(String inner, int index) {}

    /** Last path step split into its tag and predicate bodies (without brackets). */
    record Segment(String tag, List<String> predicates) {}

    // ── Parsing ───────────────────────────────────────────────────────────

    /** {@code //x} → {@code .//x}, {@code /x} → {@code ./x}, bare → {@code .//x}. */
    static String normalize(String path) {
        String p = path.strip();
        if (p.startsWith("(")) return p;
        if (p.startsWith("/")) return "." + p;
        if (p.startsWith(".")) return p;
        return ".//" + p;
    }

    static Optional<Grouped> unwrapGroup(String path) {
        Matcher m = GROUPED.matcher(path.strip());
        if (!m.matches()) return Optional.empty();
        return Optional.of(new Grouped(m.group(1).strip(), Integer.parseInt(m.group(2))));
    }

    /**
     * Last location step of a path. Slashes inside predicates and quotes do
     * not split.
     */
    static String lastStep(String path) {
        String p = path.strip();
        int depth = 0;
        char quote = 0;
        int lastSlash = -1;
        for (int i = 0; i < p.length(); i++) {
            char c = p.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            switch (c) {
                case '\'', '"' -> quote = c;
                case '[', '(' -> depth++;
                case ']', ')' -> depth--;
                case '/' -> { if (depth == 0) lastSlash = i; }
                default -> { }
            }
        }
        return p.substring(lastSlash + 1);
    }

    static Optional<Segment> parseSegment(String step) {
        Matcher m = SEGMENT.matcher(step.strip());
        if (!m.matches()) return Optional.empty();
        List<String> preds = splitPredicates(m.group(2));
        if (preds == null) return Optional.empty();
        return Optional.of(new Segment(m.group(1), preds));
    }

    /** Bodies of consecutive {@code [...]} groups, or null if unbalanced. */
    private static List<String> splitPredicates(String preds) {
        List<String> out = new ArrayList<>();
        int depth = 0;
        char quote = 0;
        int start = -1;
        for (int i = 0; i < preds.length(); i++) {
            char c = preds.charAt(i);
            if (quote != 0) {
                if (c == quote) quote = 0;
                continue;
            }
            if (c == '\'' || c == '"') {
                quote = c;
            } else if (c == '[') {
                if (depth == 0) start = i + 1;
                depth++;
            } else if (c == ']') {
                depth--;
                if (depth < 0) return null;
                if (depth == 0) out.add(preds.substring(start, i).strip());
            } else if (depth == 0 && !Character.isWhitespace(c)) {
                return null;
            }
        }
        return depth == 0 && quote == 0 ? out : null;
    }

    static boolean isIndex(String predicate) {
        return INDEX.matcher(predicate).matches();
    }

    /** Tags that are never taken as widget class names. */
    static boolean isStructuralTag(String tag) {
        return tag.equalsIgnoreCase(HierarchySnapshot.NODE_TAG) || tag.equalsIgnoreCase("hierarchy");
    }

    /**
     * Rewrites the last step {@code tag[p1][p2][n]} of a path to
     * {@code .//node[@class='tag' and p1 and p2][n]}.
     *
     * @return the rewritten expression, or empty if the step is not a
     *         class-named step
     */
    static Optional<String> classRewrite(String path) {
        Optional<Segment> parsed = parseSegment(lastStep(path));
        if (parsed.isEmpty()) return Optional.empty();
        Segment seg = parsed.get();
        if (isStructuralTag(seg.tag())) return Optional.empty();

        List<String> conds = new ArrayList<>();
        conds.add("@class=" + quote(seg.tag()));
        StringBuilder index = new StringBuilder();
        for (String pred : seg.predicates()) {
            if (isIndex(pred)) {
                index.append('[').append(pred.strip()).append(']');
            } else if (!pred.isEmpty()) {
                conds.add(pred);
            }
        }
        return Optional.of(".//node[" + String.join(" and ", conds) + "]" + index);
    }

    private static String quote(String literal) {
        return literal.indexOf('\'') < 0 ? "'" + literal + "'" : "\"" + literal + "\"";
    }

    // ── Evaluation ────────────────────────────────────────────────────────

    /**
     * Evaluates an XPath 1.0 expression against the document.
     *
     * @return the first element in the result, or empty on no match or a
     *         syntax error
     */
    static Optional<Element> evaluateFirst(HierarchySnapshot snapshot, String expression) {
        XPath xpath = XPathFactory.newInstance().newXPath();
        try {
            NodeList result = (NodeList) xpath.evaluate(expression, snapshot.getDocument(), XPathConstants.NODESET);
            for (int i = 0; i < result.getLength(); i++) {
                Node n = result.item(i);
                if (n instanceof Element e) return Optional.of(e);
            }
            return Optional.empty();
        } catch (XPathExpressionException e) {
            log.debug("XPath '{}' rejected: {}", expression, e.getMessage());
            return Optional.empty();
        }
    }
}
