package teranet.mapdev.layout.util;

import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;
import org.xml.sax.ErrorHandler;
import org.xml.sax.InputSource;
import org.xml.sax.SAXException;
import org.xml.sax.SAXParseException;

import javax.xml.XMLConstants;
import javax.xml.parsers.DocumentBuilder;
import javax.xml.parsers.DocumentBuilderFactory;
import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.List;

/**
 * DOM helpers shared by the layout loader and the TCL/XSL generators.
 *
 * Elements are looked up by local name so that documents with and without
 * namespace prefixes read the same.
 */
public class XmlDocumentUtil {

    public static final String XSI_NAMESPACE = "http://www.w3.org/2001/XMLSchema-instance";

    // Report problems through the thrown exception instead of the parser's stderr default
    private static final ErrorHandler RETHROWING_HANDLER = new ErrorHandler() {
        @Override
        public void warning(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void error(SAXParseException exception) throws SAXException {
            throw exception;
        }

        @Override
        public void fatalError(SAXParseException exception) throws SAXException {
            throw exception;
        }
    };

    private XmlDocumentUtil() {
    }

    /**
     * Parse XML text into a namespace-aware DOM with DTDs and external entities disabled.
     *
     * @throws SAXException if the content is not well-formed
     */
    public static Document parse(String xml) throws ParserConfigurationException, SAXException, IOException {
        DocumentBuilderFactory factory = DocumentBuilderFactory.newInstance();
        factory.setNamespaceAware(true);
        factory.setFeature(XMLConstants.FEATURE_SECURE_PROCESSING, true);
        factory.setFeature("http://apache.org/xml/features/disallow-doctype-decl", true);
        factory.setExpandEntityReferences(false);
        factory.setXIncludeAware(false);

        DocumentBuilder builder = factory.newDocumentBuilder();
        builder.setErrorHandler(RETHROWING_HANDLER);
        Document document = builder.parse(new InputSource(new StringReader(xml)));
        document.getDocumentElement().normalize();
        return document;
    }

    /**
     * Remove a byte order mark and anything before the first '<'.
     */
    public static String cleanXmlContent(String xmlContent) {
        if (xmlContent == null) {
            return "";
        }
        String cleaned = InputFileUtil.stripBom(xmlContent);
        int firstTag = cleaned.indexOf('<');
        if (firstTag > 0) {
            cleaned = cleaned.substring(firstTag);
        }
        return cleaned.trim();
    }

    /**
     * Element children of a node, in document order.
     */
    public static List<Element> childElements(Node parent) {
        List<Element> children = new ArrayList<>();
        NodeList nodes = parent.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            if (nodes.item(i).getNodeType() == Node.ELEMENT_NODE) {
                children.add((Element) nodes.item(i));
            }
        }
        return children;
    }

    /**
     * Element children with the given local name.
     */
    public static List<Element> childElements(Node parent, String localName) {
        List<Element> matching = new ArrayList<>();
        for (Element child : childElements(parent)) {
            if (localName.equals(localNameOf(child))) {
                matching.add(child);
            }
        }
        return matching;
    }

    /**
     * First element child with the given local name, or null.
     */
    public static Element firstChild(Node parent, String localName) {
        for (Element child : childElements(parent)) {
            if (localName.equals(localNameOf(child))) {
                return child;
            }
        }
        return null;
    }

    /**
     * All descendant elements in document order.
     */
    public static List<Element> descendants(Node root) {
        List<Element> all = new ArrayList<>();
        collectDescendants(root, all);
        return all;
    }

    /**
     * First descendant element with the given local name, or null.
     */
    public static Element firstDescendant(Node root, String localName) {
        for (Element child : childElements(root)) {
            if (localName.equals(localNameOf(child))) {
                return child;
            }
            Element nested = firstDescendant(child, localName);
            if (nested != null) {
                return nested;
            }
        }
        return null;
    }

    /**
     * Text of the first child element with the given local name, or "" when absent.
     */
    public static String childText(Node parent, String localName) {
        Element child = firstChild(parent, localName);
        return child != null ? child.getTextContent() : "";
    }

    /**
     * Integer value of a child element, or the default when absent or not numeric.
     */
    public static int childInt(Node parent, String localName, int defaultValue) {
        return parseInt(childText(parent, localName), defaultValue);
    }

    /**
     * Boolean value of a child element ("true"/"false", any case), or the default.
     */
    public static boolean childBoolean(Node parent, String localName, boolean defaultValue) {
        String text = childText(parent, localName).trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text)) {
            return false;
        }
        return defaultValue;
    }

    /**
     * Value of the xsi:type attribute, falling back to a plain "type" attribute; "" when absent.
     */
    public static String typeAttribute(Element element) {
        String value = element.getAttributeNS(XSI_NAMESPACE, "type");
        if (value == null || value.isEmpty()) {
            value = element.getAttribute("type");
        }
        if (value == null) {
            return "";
        }
        int colon = value.indexOf(':');
        return colon >= 0 ? value.substring(colon + 1) : value;
    }

    public static int parseInt(String text, int defaultValue) {
        if (text == null) {
            return defaultValue;
        }
        try {
            return Integer.parseInt(text.trim());
        } catch (NumberFormatException e) {
            return defaultValue;
        }
    }

    /**
     * Escape text for use inside an XML attribute or element.
     */
    public static String escape(String text) {
        if (text == null) {
            return "";
        }
        StringBuilder escaped = new StringBuilder(text.length());
        for (char c : text.toCharArray()) {
            switch (c) {
                case '&':
                    escaped.append("&amp;");
                    break;
                case '<':
                    escaped.append("&lt;");
                    break;
                case '>':
                    escaped.append("&gt;");
                    break;
                case '"':
                    escaped.append("&quot;");
                    break;
                case '\'':
                    escaped.append("&apos;");
                    break;
                default:
                    escaped.append(c);
            }
        }
        return escaped.toString();
    }

    private static String localNameOf(Node node) {
        return node.getLocalName() != null ? node.getLocalName() : node.getNodeName();
    }

    private static void collectDescendants(Node node, List<Element> out) {
        for (Element child : childElements(node)) {
            out.add(child);
            collectDescendants(child, out);
        }
    }
}
