package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;
import teranet.mapdev.layout.exception.LayoutCompilationException;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.AlignmentType;
import teranet.mapdev.layout.model.ElementKind;
import teranet.mapdev.layout.model.FieldElement;
import teranet.mapdev.layout.model.Layout;
import teranet.mapdev.layout.model.LayoutType;
import teranet.mapdev.layout.model.LineElement;
import teranet.mapdev.layout.util.XmlDocumentUtil;

import javax.xml.parsers.ParserConfigurationException;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

/**
 * Reads a layout definition (LayoutVO XML) into the {@link Layout} model.
 *
 * Top-level Elements/Element entries typed LineElementVO become the layout's lines. Nested
 * entries are serialized into JSON blobs carrying their type discriminator, recursively for
 * nested lines. Entries of any other type are logged and skipped.
 */
@Service
public class LayoutXmlLoader {

    private static final String ENDPOINT = "LayoutXmlLoader";

    private static final String ELEMENTS = "Elements";
    private static final String ELEMENT = "Element";

    private final ElementClassifier elementClassifier;
    private final TechLogger techLogger;

    public LayoutXmlLoader(ElementClassifier elementClassifier, TechLogger techLogger) {
        this.elementClassifier = elementClassifier;
        this.techLogger = techLogger;
    }

    /**
     * Load a layout from a UTF-8 stream.
     *
     * @throws LayoutCompilationException if the stream cannot be read or is not a layout
     */
    public Layout load(InputStream inputStream) {
        if (inputStream == null) {
            throw new IllegalArgumentException("Layout input stream is required");
        }
        try {
            return load(new String(inputStream.readAllBytes(), StandardCharsets.UTF_8));
        } catch (IOException e) {
            throw new LayoutCompilationException("Cannot read layout: " + e.getMessage(), e);
        }
    }

    /**
     * Load a layout from XML text.
     *
     * @param xml layout XML, optionally preceded by a BOM or stray characters
     * @return the layout with its lines in document order
     * @throws LayoutCompilationException if the XML is blank or malformed
     */
    public Layout load(String xml) {
        String cleaned = XmlDocumentUtil.cleanXmlContent(xml);
        if (cleaned.isEmpty()) {
            throw new LayoutCompilationException("Layout XML is empty");
        }

        Document document;
        try {
            document = XmlDocumentUtil.parse(cleaned);
        } catch (SAXException | IOException e) {
            throw new LayoutCompilationException("Invalid layout XML: " + e.getMessage(), e);
        } catch (ParserConfigurationException e) {
            throw new IllegalStateException("XML parser is not configurable", e);
        }

        Element root = document.getDocumentElement();
        Layout layout = new Layout(
                XmlDocumentUtil.childText(root, "LayoutGuid").trim(),
                XmlDocumentUtil.childText(root, "Name").trim(),
                LayoutType.fromValue(XmlDocumentUtil.childText(root, "LayoutType")));
        layout.setDescription(XmlDocumentUtil.childText(root, "Description").trim());
        layout.setLimitOfCharacters(XmlDocumentUtil.childInt(root, "LimitOfCaracters", 0));

        Element elements = XmlDocumentUtil.firstChild(root, ELEMENTS);
        if (elements != null) {
            for (Element lineNode : XmlDocumentUtil.childElements(elements, ELEMENT)) {
                String type = XmlDocumentUtil.typeAttribute(lineNode);
                if (ElementKind.fromDiscriminator(type) == ElementKind.LINE) {
                    layout.getElements().add(readLine(lineNode));
                } else {
                    techLogger.warn(ENDPOINT, "Skipping top-level element of type '" + type + "'");
                }
            }
        }

        techLogger.info(ENDPOINT, String.format("Loaded layout '%s' (%s) with %d top-level lines",
                layout.getName(), layout.getLayoutGuid(), layout.getElements().size()));
        return layout;
    }

    private LineElement readLine(Element node) {
        LineElement line = new LineElement(
                XmlDocumentUtil.childText(node, "Name").trim(),
                XmlDocumentUtil.childText(node, "InitialValue").trim(),
                XmlDocumentUtil.childInt(node, "Sequence", 0));
        line.setElementGuid(XmlDocumentUtil.childText(node, "ElementGuid").trim());
        line.setDescription(XmlDocumentUtil.childText(node, "Description").trim());
        line.setRequired(XmlDocumentUtil.childBoolean(node, "IsRequired", false));
        line.setMinimalOccurrence(XmlDocumentUtil.childInt(node, "MinimalOccurrence", 0));
        line.setMaximumOccurrence(XmlDocumentUtil.childInt(node, "MaximumOccurrence", 0));

        Element children = XmlDocumentUtil.firstChild(node, ELEMENTS);
        if (children == null) {
            return line;
        }

        for (Element child : XmlDocumentUtil.childElements(children, ELEMENT)) {
            String type = XmlDocumentUtil.typeAttribute(child);
            switch (ElementKind.fromDiscriminator(type)) {
                case FIELD:
                    FieldElement field = readField(child);
                    line.getElements().add(elementClassifier.toBlob(field));
                    techLogger.debug(ENDPOINT, String.format("Field %s.%s: length %d",
                            line.getName(), field.getName(), field.getLengthField()));
                    break;
                case LINE:
                    LineElement childLine = readLine(child);
                    line.getElements().add(elementClassifier.toBlob(childLine));
                    techLogger.debug(ENDPOINT, String.format("Nested line %s kept inside %s",
                            childLine.getName(), line.getName()));
                    break;
                default:
                    techLogger.warn(ENDPOINT, String.format("Unknown element type '%s' inside %s",
                            type, line.getName()));
            }
        }
        return line;
    }

    private FieldElement readField(Element node) {
        FieldElement field = new FieldElement(
                XmlDocumentUtil.childText(node, "Name").trim(),
                XmlDocumentUtil.childInt(node, "Sequence", 0),
                XmlDocumentUtil.childInt(node, "LengthField", 0));
        field.setElementGuid(XmlDocumentUtil.childText(node, "ElementGuid").trim());
        field.setDescription(XmlDocumentUtil.childText(node, "Description").trim());
        field.setRequired(XmlDocumentUtil.childBoolean(node, "IsRequired", false));
        field.setStartValue(XmlDocumentUtil.childInt(node, "StartValue", 0));
        field.setAlignmentType(AlignmentType.fromValue(XmlDocumentUtil.childText(node, "AlignmentType")));
        field.setStaticValue(XmlDocumentUtil.childBoolean(node, "IsStaticValue", false));
        field.setSequential(XmlDocumentUtil.childBoolean(node, "IsSequential", false));
        field.setDataTypeGuid(XmlDocumentUtil.childText(node, "DataTypeGuid").trim());
        return field;
    }
}
