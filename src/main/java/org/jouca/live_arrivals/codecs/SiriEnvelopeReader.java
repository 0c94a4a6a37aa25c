package org.jouca.live_arrivals.codecs;

import java.io.IOException;
import java.io.StringReader;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;

import org.jouca.live_arrivals.exceptions.SchemaException;
import org.w3c.dom.Attr;
import org.w3c.dom.Element;
import org.w3c.dom.NamedNodeMap;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.JsonNodeFactory;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * Reads a stop-monitoring response into a Jackson tree.
 *
 * <p>JSON payloads are parsed as is. XML payloads are parsed without namespace processing and
 * converted so that both variants can be walked the same way:
 * <ul>
 *   <li>element names keep their prefix, e.g. {@code ns3:Status}</li>
 *   <li>attributes, namespace declarations included, become {@code @name} fields</li>
 *   <li>an element with only text becomes a string, an empty one becomes null</li>
 *   <li>text next to attributes or children is stored under {@code #text}</li>
 *   <li>repeated sibling elements become an array, a single one stays a scalar</li>
 * </ul>
 *
 * @author Jouca
 * @since 1.0
 */
public class SiriEnvelopeReader {

    private static final JsonNodeFactory NODES = JsonNodeFactory.instance;

    private final ObjectMapper objectMapper;
    private final DocumentBuilderFactory factory;

    public SiriEnvelopeReader(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
        this.factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(false);
        factory.setExpandEntityReferences(false);
        try {
            factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
            factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser does not support secure processing", e);
        }
    }

    /**
     * Parses a raw response body.
     *
     * @param payload the response body, XML or JSON
     * @return the document as a tree, the root element being the single field of the returned object
     * @throws SchemaException when the payload is neither well-formed XML nor JSON
     */
    public JsonNode read(String payload) {
        if (payload == null || payload.isBlank()) {
            throw new SchemaException("Empty stop-monitoring response");
        }
        String trimmed = payload.strip();
        if (trimmed.startsWith("{")) {
            try {
                return objectMapper.readTree(trimmed);
            } catch (JsonProcessingException e) {
                throw new SchemaException("Malformed JSON stop-monitoring response", e);
            }
        }
        try {
            DocumentBuilder builder = factory.newDocumentBuilder();
            Element root = builder.parse(new InputSource(new StringReader(trimmed))).getDocumentElement();
            ObjectNode document = NODES.objectNode();
            document.set(root.getNodeName(), convert(root));
            return document;
        } catch (ParserConfigurationException | SAXException | IOException e) {
            throw new SchemaException("Malformed XML stop-monitoring response", e);
        }
    }

    private static JsonNode convert(Element element) {
        ObjectNode node = NODES.objectNode();
        NamedNodeMap attributes = element.getAttributes();
        for (int i = 0; i < attributes.getLength(); i++) {
            Attr attr = (Attr) attributes.item(i);
            node.put("@" + attr.getName(), attr.getValue());
        }

        StringBuilder text = new StringBuilder();
        NodeList children = element.getChildNodes();
        for (int i = 0; i < children.getLength(); i++) {
            Node child = children.item(i);
            if (child.getNodeType() == Node.ELEMENT_NODE) {
                addChild(node, child.getNodeName(), convert((Element) child));
            } else if (child.getNodeType() == Node.TEXT_NODE || child.getNodeType() == Node.CDATA_SECTION_NODE) {
                text.append(child.getNodeValue());
            }
        }

        String value = text.toString().strip();
        if (node.isEmpty()) {
            return value.isEmpty() ? NODES.nullNode() : NODES.textNode(value);
        }
        if (!value.isEmpty()) {
            node.put("#text", value);
        }
        return node;
    }

    private static void addChild(ObjectNode parent, String name, JsonNode child) {
        JsonNode existing = parent.get(name);
        if (existing == null) {
            parent.set(name, child);
        } else if (existing.isArray()) {
            ((ArrayNode) existing).add(child);
        } else {
            ArrayNode array = NODES.arrayNode();
            array.add(existing);
            array.add(child);
            parent.set(name, array);
        }
    }
}
