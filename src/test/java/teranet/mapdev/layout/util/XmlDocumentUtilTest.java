package teranet.mapdev.layout.util;

import org.junit.jupiter.api.Test;
import org.w3c.dom.Document;
import org.w3c.dom.Element;
import org.xml.sax.SAXException;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for XmlDocumentUtil
 */
class XmlDocumentUtilTest {

    private static final String LAYOUT =
            "<LayoutVO xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\">"
                    + "<Name>Teste</Name>"
                    + "<Elements>"
                    + "<Element xsi:type=\"LineElementVO\"><Name>LINHA000</Name><Sequence> 3 </Sequence>"
                    + "<IsRequired>TRUE</IsRequired><Elements>"
                    + "<Element type=\"ng:FieldElementVO\"><Name>Campo</Name></Element>"
                    + "</Elements></Element>"
                    + "</Elements>"
                    + "</LayoutVO>";

    @Test
    void testParse_ReadsChildValues() throws Exception {
        // When
        Document document = XmlDocumentUtil.parse(LAYOUT);
        Element line = XmlDocumentUtil.firstDescendant(document.getDocumentElement(), "Element");

        // Then
        assertThat(XmlDocumentUtil.childText(document.getDocumentElement(), "Name")).isEqualTo("Teste");
        assertThat(XmlDocumentUtil.childInt(line, "Sequence", 0)).isEqualTo(3);
        assertThat(XmlDocumentUtil.childInt(line, "Missing", -1)).isEqualTo(-1);
        assertThat(XmlDocumentUtil.childBoolean(line, "IsRequired", false)).isTrue();
        assertThat(XmlDocumentUtil.childBoolean(line, "Missing", true)).isTrue();
        assertThat(XmlDocumentUtil.childText(line, "Missing")).isEmpty();
    }

    @Test
    void testTypeAttribute_XsiOrPlainWithoutPrefix() throws Exception {
        Document document = XmlDocumentUtil.parse(LAYOUT);
        Element line = XmlDocumentUtil.firstDescendant(document.getDocumentElement(), "Element");
        Element field = XmlDocumentUtil.firstDescendant(line, "Element");

        assertThat(XmlDocumentUtil.typeAttribute(line)).isEqualTo("LineElementVO");
        assertThat(XmlDocumentUtil.typeAttribute(field)).isEqualTo("FieldElementVO");
        assertThat(XmlDocumentUtil.typeAttribute(document.getDocumentElement())).isEmpty();
    }

    @Test
    void testDescendants_DocumentOrder() throws Exception {
        Document document = XmlDocumentUtil.parse("<a><b><c/></b><d/></a>");

        assertThat(XmlDocumentUtil.descendants(document.getDocumentElement()))
                .extracting(Element::getNodeName)
                .containsExactly("b", "c", "d");
        assertThat(XmlDocumentUtil.childElements(document.getDocumentElement()))
                .extracting(Element::getNodeName)
                .containsExactly("b", "d");
    }

    @Test
    void testParse_RejectsDoctype() {
        String xxe = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x SYSTEM \"file:///etc/passwd\">]><r>&x;</r>";

        assertThatThrownBy(() -> XmlDocumentUtil.parse(xxe)).isInstanceOf(SAXException.class);
    }

    @Test
    void testParse_MalformedXml_Throws() {
        assertThatThrownBy(() -> XmlDocumentUtil.parse("<LayoutVO>")).isInstanceOf(SAXException.class);
    }

    @Test
    void testCleanXmlContent_DropsBomAndLeadingNoise() {
        assertThat(XmlDocumentUtil.cleanXmlContent("\uFEFF  junk<root/>  ")).isEqualTo("<root/>");
        assertThat(XmlDocumentUtil.cleanXmlContent(null)).isEmpty();
    }

    @Test
    void testEscape() {
        assertThat(XmlDocumentUtil.escape("A&B <\"x\"> 'y'"))
                .isEqualTo("A&amp;B &lt;&quot;x&quot;&gt; &apos;y&apos;");
        assertThat(XmlDocumentUtil.escape(null)).isEmpty();
    }

    @Test
    void testParseInt() {
        assertThat(XmlDocumentUtil.parseInt(" 15 ", 0)).isEqualTo(15);
        assertThat(XmlDocumentUtil.parseInt("abc", 7)).isEqualTo(7);
        assertThat(XmlDocumentUtil.parseInt(null, 7)).isEqualTo(7);
    }
}
