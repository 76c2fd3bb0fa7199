package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import teranet.mapdev.layout.exception.LayoutCompilationException;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.ElementKind;
import teranet.mapdev.layout.util.XmlDocumentUtil;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Compiles a layout definition XML into a TCL mapping document.
 *
 * Output shape:
 * <pre>
 * &lt;MAP&gt;
 *     &lt;LINE identifier="A" name="LINHA000"&gt;
 *         &lt;FIELD name="codigoProduto" length="14"/&gt;
 *         &lt;CHILD&gt;LINHA001&lt;/CHILD&gt;
 *     &lt;/LINE&gt;
 * &lt;/MAP&gt;
 * </pre>
 * Every LineElementVO of the document becomes a LINE, nested ones included, ordered by their
 * Sequence. A LINE lists only its own fields, not those of lines nested inside it.
 */
@Service
public class TclGeneratorService {

    private static final String ENDPOINT = "TclGenerator";

    private final TclNamingService namingService;
    private final TechLogger techLogger;

    public TclGeneratorService(TclNamingService namingService, TechLogger techLogger) {
        this.namingService = namingService;
        this.techLogger = techLogger;
    }

    /**
     * Generate the TCL document for a layout.
     *
     * @param layoutXml layout definition XML
     * @return the TCL text
     * @throws LayoutCompilationException if the layout cannot be read
     */
    public String generateTcl(String layoutXml) {
        try {
            Document document = XmlDocumentUtil.parse(XmlDocumentUtil.cleanXmlContent(layoutXml));

            List<Element> lines = XmlDocumentUtil.descendants(document.getDocumentElement()).stream()
                    .filter(element -> ElementKind.fromDiscriminator(XmlDocumentUtil.typeAttribute(element))
                            == ElementKind.LINE)
                    .sorted(Comparator.comparingInt(TclGeneratorService::sequenceOf))
                    .collect(Collectors.toList());

            StringBuilder tcl = new StringBuilder();
            tcl.append("<MAP>\n");

            int lineCount = 0;
            for (Element line : lines) {
                String lineName = XmlDocumentUtil.childText(line, "Name").trim();
                if (lineName.isEmpty()) {
                    techLogger.debug(ENDPOINT, "Skipping line definition without a name");
                    continue;
                }
                appendLine(tcl, line, lineName, lines);
                lineCount++;
            }

            tcl.append("</MAP>\n");

            techLogger.info(ENDPOINT, String.format("Generated TCL with %d lines", lineCount));
            return tcl.toString();
        } catch (Exception e) {
            techLogger.error(ENDPOINT, "Error generating TCL: " + e.getMessage());
            throw new LayoutCompilationException("Error generating TCL: " + e.getMessage(), e);
        }
    }

    private void appendLine(StringBuilder tcl, Element line, String lineName, List<Element> allLines) {
        tcl.append("\t<LINE identifier=\"")
                .append(XmlDocumentUtil.escape(namingService.lineIdentifier(lineName)))
                .append("\" name=\"")
                .append(XmlDocumentUtil.escape(lineName))
                .append("\">\n");

        for (Element field : ownFields(line)) {
            String fieldName = XmlDocumentUtil.childText(field, "Name").trim();
            int length = XmlDocumentUtil.childInt(field, "LengthField", Integer.MIN_VALUE);
            if (fieldName.isEmpty() || length == Integer.MIN_VALUE) {
                techLogger.debug(ENDPOINT, String.format("Skipping field '%s' of %s without a numeric width",
                        fieldName, lineName));
                continue;
            }
            tcl.append("\t\t<FIELD name=\"")
                    .append(XmlDocumentUtil.escape(namingService.sanitizeFieldName(fieldName)))
                    .append("\" length=\"")
                    .append(namingService.lengthAttribute(fieldName, length))
                    .append("\"/>\n");
        }

        for (String child : childLineNames(line, lineName, allLines)) {
            tcl.append("\t\t<CHILD>").append(XmlDocumentUtil.escape(child)).append("</CHILD>\n");
        }

        tcl.append("\t</LINE>\n\n");
    }

    /**
     * Fields declared directly in the line's Elements block, ordered by Sequence.
     */
    private List<Element> ownFields(Element line) {
        List<Element> fields = new ArrayList<>();
        Element elements = XmlDocumentUtil.firstChild(line, "Elements");
        if (elements == null) {
            return fields;
        }
        for (Element child : XmlDocumentUtil.childElements(elements)) {
            if (ElementKind.fromDiscriminator(XmlDocumentUtil.typeAttribute(child)) == ElementKind.FIELD) {
                fields.add(child);
            }
        }
        fields.sort(Comparator.comparingInt(TclGeneratorService::sequenceOf));
        return fields;
    }

    /**
     * Names of the lines whose ParentElement refers to this line, without duplicates.
     */
    private Set<String> childLineNames(Element line, String lineName, List<Element> allLines) {
        Set<String> children = new LinkedHashSet<>();
        for (Element other : allLines) {
            if (other == line) {
                continue;
            }
            String parent = XmlDocumentUtil.childText(other, "ParentElement");
            String otherName = XmlDocumentUtil.childText(other, "Name").trim();
            if (parent.contains(lineName) && !otherName.isEmpty()) {
                children.add(otherName);
            }
        }
        return children;
    }

    private static int sequenceOf(Element element) {
        return XmlDocumentUtil.childInt(element, "Sequence", 0);
    }
}
