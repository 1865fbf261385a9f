package uitrace.resolve;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import uitrace.model.ControlNode;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import javax.xml.stream.XMLInputFactory;
import javax.xml.stream.XMLStreamConstants;
import javax.xml.stream.XMLStreamException;
import javax.xml.stream.XMLStreamReader;
import java.io.IOException;
import java.io.StringReader;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A parsed UI hierarchy dump. DTDs and external entities are refused.
 *
 * <p>The DOM does not keep attribute order, so the attributes of every
 * {@code node} element are also read with a streaming pass and kept in the
 * order the dump wrote them.
 */
public final class HierarchySnapshot {

    public static final String NODE_TAG = "node";

    private final Document document;
    private final List<Element> nodes;
    private final Map<Element, Map<String, String>> attributes = new IdentityHashMap<>();

    private HierarchySnapshot(Document document, List<Map<String, String>> orderedAttributes) {
        this.document = document;
        NodeList list = document.getElementsByTagName(NODE_TAG);
        List<Element> collected = new ArrayList<>(list.getLength());
        for (int i = 0; i < list.getLength(); i++) {
            collected.add((Element) list.item(i));
        }
        this.nodes = Collections.unmodifiableList(collected);
        if (orderedAttributes.size() == collected.size()) {
            for (int i = 0; i < collected.size(); i++) {
                attributes.put(collected.get(i), orderedAttributes.get(i));
            }
        }
    }

    /**
     * @throws ResolutionException if the text is not well-formed XML
     */
    public static HierarchySnapshot parse(String xml) {
        try {
            Document document = newBuilder().parse(new InputSource(new StringReader(xml)));
            return new HierarchySnapshot(document, readAttributes(xml));
        } catch (SAXException | IOException | XMLStreamException e) {
            throw new ResolutionException("Hierarchy XML is not parsable: " + e.getMessage(), e);
        }
    }

    public static HierarchySnapshot load(Path xmlFile) throws IOException {
        return parse(Files.readString(xmlFile));
    }

    /** Document node, the context for path queries. */
    public Document getDocument() { return document; }

    /** Every {@code node} element in document order. */
    public List<Element> getNodes() { return nodes; }

    /** All attributes of one of this snapshot's elements, in document order. */
    public ControlNode toControlNode(Element element) {
        Map<String, String> ordered = attributes.get(element);
        if (ordered != null) {
            return new ControlNode(ordered);
        }
        NamedNodeMap attrs = element.getAttributes();
        Map<String, String> map = new LinkedHashMap<>();
        for (int i = 0; i < attrs.getLength(); i++) {
            Node a = attrs.item(i);
            map.put(a.getNodeName(), a.getNodeValue());
        }
        return new ControlNode(map);
    }

    /** Attributes of each {@code node} start tag, in tag order. */
    private static List<Map<String, String>> readAttributes(String xml) throws XMLStreamException {
        XMLInputFactory factory = XMLInputFactory.newFactory();
        factory.setProperty(XMLInputFactory.SUPPORT_DTD, false);
        factory.setProperty(XMLInputFactory.IS_SUPPORTING_EXTERNAL_ENTITIES, false);
        List<Map<String, String>> result = new ArrayList<>();
        XMLStreamReader reader = factory.createXMLStreamReader(new StringReader(xml));
        try {
            while (reader.hasNext()) {
                if (reader.next() == XMLStreamConstants.START_ELEMENT && NODE_TAG.equals(reader.getLocalName())) {
                    Map<String, String> attrs = new LinkedHashMap<>();
                    for (int i = 0; i < reader.getAttributeCount(); i++) {
                        attrs.put(reader.getAttributeLocalName(i), reader.getAttributeValue(i));
                    }
                    result.add(attrs);
                }
            }
        } finally {
            reader.close();
        }
        return result;
    }

    private static DocumentBuilder newBuilder() {
        try {
            DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
            factory.setFeature("http://xml.org/sax/features/external-general-entities", false);
            factory.setFeature("http://xml.org/sax/features/external-parameter-entities", false);
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setXIncludeAware(false);
            factory.setExpandEntityReferences(false);
            return factory.newDocumentBuilder();
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }
}
