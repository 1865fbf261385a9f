package uitrace.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * One element of a UI hierarchy snapshot, as an ordered attribute map
 * ({@code bounds}, {@code text}, {@code class}, {@code resource-id}, ...).
 */
public final class ControlNode {

    public static final String ATTR_BOUNDS = "bounds";
    public static final String ATTR_CLASS  = "class";

    private final Map<String, String> attributes;

    public ControlNode(Map<String, String> attributes) {
        this.attributes = Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
    }

    public static ControlNode empty() {
        return new ControlNode(Map.of());
    }

    public Map<String, String> getAttributes() { return attributes; }

    public String get(String name) { return attributes.get(name); }

    public String getBounds() { return attributes.get(ATTR_BOUNDS); }

    /** The parsed bounds rectangle, if the node has a well-formed one. */
    public Optional<BoundingRect> rect() {
        return BoundingRect.parse(getBounds());
    }

    @Override
    public String toString() {
        return String.format("ControlNode{class='%s', text='%s', bounds=%s}",
                attributes.get(ATTR_CLASS), attributes.get("text"), getBounds());
    }
}
