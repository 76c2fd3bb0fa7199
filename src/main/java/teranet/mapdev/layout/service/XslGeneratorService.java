package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import teranet.mapdev.layout.exception.LayoutCompilationException;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.MappingRule;
import teranet.mapdev.layout.util.XmlDocumentUtil;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Compiles a mapping document into an XSLT 1.0 stylesheet producing an NFe.
 *
 * Relations are grouped into the fixed NFe sections by the last segment of their target's
 * parent path; a relation to enviNFe/NFe/infNFe/emit/CNPJ lands in "emit". Each relation
 * becomes {@code <leaf><xsl:value-of select="ROOT/line/field"/></leaf>}. Relations outside
 * the known sections are left out.
 */
@Service
public class XslGeneratorService {

    private static final String ENDPOINT = "XslGenerator";

    public static final List<String> SECTIONS = Collections.unmodifiableList(
            Arrays.asList("ide", "emit", "dest", "det", "total", "transp", "cobr", "infAdic"));

    static final String NFE_NAMESPACE = "http://www.portalfiscal.inf.br/nfe";
    static final String EXTENSION_NAMESPACE = "com.neogrid.integrator.XSLFunctions";
    static final String NFE_VERSION = "4.00";

    private static final Pattern XML_NAME = Pattern.compile("[A-Za-z_][A-Za-z0-9_.\\-]*");

    private final MappingRuleExtractor ruleExtractor;
    private final TechLogger techLogger;

    public XslGeneratorService(MappingRuleExtractor ruleExtractor, TechLogger techLogger) {
        this.ruleExtractor = ruleExtractor;
        this.techLogger = techLogger;
    }

    /**
     * Generate the XSL for a mapping document.
     *
     * @param mapXml mapping XML holding Rule elements with Sequence and ContentValue
     * @return the stylesheet text
     * @throws LayoutCompilationException if the mapping cannot be read
     */
    public String generateXsl(String mapXml) {
        try {
            Document document = XmlDocumentUtil.parse(XmlDocumentUtil.cleanXmlContent(mapXml));
            List<MappingRule> rules = extractRules(document);
            Map<String, List<MappingRule>> sections = groupBySection(rules);

            StringBuilder xsl = new StringBuilder();
            appendHeader(xsl);
            for (Map.Entry<String, List<MappingRule>> section : sections.entrySet()) {
                if (!section.getValue().isEmpty()) {
                    appendSection(xsl, section.getKey(), section.getValue());
                }
            }
            appendFooter(xsl);

            techLogger.info(ENDPOINT, String.format("Generated XSL from %d relations in %d sections",
                    rules.size(), sections.values().stream().filter(list -> !list.isEmpty()).count()));
            return xsl.toString();
        } catch (Exception e) {
            techLogger.error(ENDPOINT, "Error generating XSL: " + e.getMessage());
            throw new LayoutCompilationException("Error generating XSL: " + e.getMessage(), e);
        }
    }

    /**
     * Relations of every Rule element, rules taken in Sequence order.
     */
    List<MappingRule> extractRules(Document document) {
        List<Element> ruleElements = XmlDocumentUtil.descendants(document.getDocumentElement()).stream()
                .filter(element -> "Rule".equals(element.getLocalName() != null
                        ? element.getLocalName() : element.getNodeName()))
                .sorted(Comparator.comparingInt(rule -> XmlDocumentUtil.childInt(rule, "Sequence", 0)))
                .collect(Collectors.toList());

        List<MappingRule> rules = new ArrayList<>();
        for (Element rule : ruleElements) {
            rules.addAll(ruleExtractor.extract(XmlDocumentUtil.childText(rule, "ContentValue")));
        }
        return rules;
    }

    /**
     * Relations per section, sections in their fixed order.
     */
    Map<String, List<MappingRule>> groupBySection(List<MappingRule> rules) {
        Map<String, List<MappingRule>> sections = new LinkedHashMap<>();
        for (String section : SECTIONS) {
            sections.put(section, new ArrayList<>());
        }

        for (MappingRule rule : rules) {
            List<MappingRule> target = sections.get(rule.getSection());
            if (target == null) {
                techLogger.debug(ENDPOINT, String.format("No section for %s (from %s), relation left out",
                        rule.getTargetPath(), rule.getSourceXPath()));
            } else if (!XML_NAME.matcher(rule.getTargetElement()).matches()) {
                techLogger.debug(ENDPOINT, "Target element is not a valid XML name: " + rule.getTargetPath());
            } else {
                target.add(rule);
            }
        }
        return sections;
    }

    private void appendHeader(StringBuilder xsl) {
        xsl.append("<?xml version=\"1.0\" encoding=\"UTF-8\"?>\n")
                .append("<xsl:stylesheet version=\"1.0\"\n")
                .append("\txmlns:xsl=\"http://www.w3.org/1999/XSL/Transform\"\n")
                .append("\txmlns:ng=\"").append(EXTENSION_NAMESPACE).append("\"\n")
                .append("\texclude-result-prefixes=\"ng\"\n")
                .append("\textension-element-prefixes=\"ng\">\n\n")
                .append("\t<xsl:output method=\"xml\" encoding=\"UTF-8\" indent=\"yes\"/>\n\n")
                .append("\t<xsl:template match=\"/\">\n")
                .append("\t\t<NFe xmlns=\"").append(NFE_NAMESPACE).append("\">\n")
                .append("\t\t\t<infNFe versao=\"").append(NFE_VERSION).append("\">\n")
                .append("\t\t\t\t<xsl:attribute name=\"Id\">\n")
                .append("\t\t\t\t\t<xsl:text>NFe</xsl:text>\n")
                .append("\t\t\t\t\t<xsl:value-of select=\"normalize-space(ROOT/chave/chNFe)\"/>\n")
                .append("\t\t\t\t</xsl:attribute>\n\n");
    }

    private void appendSection(StringBuilder xsl, String section, List<MappingRule> rules) {
        xsl.append("\t\t\t\t<").append(section).append(">\n");
        for (MappingRule rule : rules) {
            String leaf = rule.getTargetElement();
            xsl.append("\t\t\t\t\t<").append(leaf).append(">\n")
                    .append("\t\t\t\t\t\t<xsl:value-of select=\"")
                    .append(XmlDocumentUtil.escape(rule.getSourceXPath()))
                    .append("\"/>\n")
                    .append("\t\t\t\t\t</").append(leaf).append(">\n");
        }
        xsl.append("\t\t\t\t</").append(section).append(">\n");
    }

    private void appendFooter(StringBuilder xsl) {
        xsl.append("\t\t\t</infNFe>\n")
                .append("\t\t</NFe>\n")
                .append("\t</xsl:template>\n\n")
                .append("</xsl:stylesheet>\n");
    }
}
