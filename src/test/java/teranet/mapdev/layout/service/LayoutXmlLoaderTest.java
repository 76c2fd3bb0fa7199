package teranet.mapdev.layout.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.layout.exception.LayoutCompilationException;
import teranet.mapdev.layout.model.AlignmentType;
import teranet.mapdev.layout.model.FieldElement;
import teranet.mapdev.layout.model.Layout;
import teranet.mapdev.layout.model.LayoutType;
import teranet.mapdev.layout.model.LineElement;
import teranet.mapdev.layout.model.SeparatedElements;
import teranet.mapdev.layout.util.TestDataFactory;

import java.io.ByteArrayInputStream;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for LayoutXmlLoader
 * Tests reading a LayoutVO with nested lines into the layout model
 */
class LayoutXmlLoaderTest {

    private LayoutXmlLoader loader;

    @BeforeEach
    void setUp() {
        loader = new LayoutXmlLoader(TestDataFactory.classifier(), TestDataFactory.SILENT_LOGGER);
    }

    @Test
    void testLoad_ReadsLayoutAttributesAndTopLevelLines() {
        // When
        Layout layout = loader.load(TestDataFactory.readResource(TestDataFactory.LAYOUT_RESOURCE));

        // Then
        assertThat(layout.getLayoutGuid()).isEqualTo(TestDataFactory.LAYOUT_GUID);
        assertThat(layout.getName()).isEqualTo("NFe Saida 600");
        assertThat(layout.getLayoutType()).isEqualTo(LayoutType.TEXT_POSITIONAL);
        assertThat(layout.getLimitOfCharacters()).isEqualTo(600);
        assertThat(layout.getElements()).extracting(LineElement::getName)
                .containsExactly("HEADER", "LINHA000", "LINHA020", "LINHA040", "TRAILER");
    }

    @Test
    void testLoad_ReadsLineAttributes() {
        Layout layout = loader.load(TestDataFactory.readResource(TestDataFactory.LAYOUT_RESOURCE));

        LineElement header = layout.getElements().get(0);
        assertThat(header.getInitialValue()).isEqualTo("HEADER");
        assertThat(header.getSequence()).isEqualTo(1);
        assertThat(header.isRequired()).isTrue();
        assertThat(header.getMinimalOccurrence()).isEqualTo(1);
        assertThat(header.getMaximumOccurrence()).isEqualTo(1);
        assertThat(header.getElementGuid()).isEqualTo("LIN_HEADER");
    }

    @Test
    void testLoad_FieldsBecomeDiscriminatedBlobs() {
        Layout layout = loader.load(TestDataFactory.readResource(TestDataFactory.LAYOUT_RESOURCE));

        // When
        LineElement header = layout.getElements().get(0);
        SeparatedElements separated = TestDataFactory.classifier().separateElements(header);

        // Then
        assertThat(header.getElements()).allSatisfy(blob -> assertThat(blob).contains("\"type\":\"FieldElementVO\""));
        assertThat(separated.getFields()).extracting(FieldElement::getName)
                .containsExactly("Sequencia", "CNPJ Emitente", "Razao Social");
        FieldElement razaoSocial = separated.getFields().get(2);
        assertThat(razaoSocial.getLengthField()).isEqualTo(574);
        assertThat(razaoSocial.getAlignmentType()).isEqualTo(AlignmentType.LEFT);
        assertThat(separated.getFields().get(1).isRequired()).isTrue();
    }

    @Test
    void testLoad_NestedLinesKeepTheirOwnElements() {
        Layout layout = loader.load(TestDataFactory.readResource(TestDataFactory.LAYOUT_RESOURCE));

        // When
        SeparatedElements linha020 = TestDataFactory.classifier().separateElements(layout.getElements().get(2));

        // Then: one nested line with its three fields
        assertThat(linha020.getFields()).hasSize(3);
        assertThat(linha020.getChildLines()).extracting(LineElement::getName).containsExactly("LINHA021");
        LineElement linha021 = linha020.getChildLines().get(0);
        assertThat(linha021.getInitialValue()).isEqualTo("021");
        assertThat(linha021.getMaximumOccurrence()).isEqualTo(99);
        assertThat(TestDataFactory.classifier().separateElements(linha021).getFields())
                .extracting(FieldElement::getLengthField).containsExactly(6, 15, 576);
    }

    @Test
    void testLoad_FromStreamWithBomAndLeadingGarbage() {
        // Given: a BOM and stray text before the root element
        String xml = "\uFEFFjunk<LayoutVO><LayoutGuid>LAY_X</LayoutGuid><Name>n</Name>"
                + "<LayoutType>Xml</LayoutType></LayoutVO>";
        InputStream in = new ByteArrayInputStream(xml.getBytes(StandardCharsets.UTF_8));

        // When
        Layout layout = loader.load(in);

        // Then
        assertThat(layout.getLayoutGuid()).isEqualTo("LAY_X");
        assertThat(layout.getLayoutType()).isEqualTo(LayoutType.XML);
        assertThat(layout.getElements()).isEmpty();
    }

    @Test
    void testLoad_SkipsUnknownElementTypes() {
        String xml = "<LayoutVO xmlns:xsi=\"http://www.w3.org/2001/XMLSchema-instance\"><Elements>"
                + "<Element xsi:type=\"FieldElementVO\"><Name>Orphan</Name></Element>"
                + "<Element xsi:type=\"LineElementVO\"><Name>LINHA001</Name><Elements>"
                + "<Element xsi:type=\"MysteryVO\"><Name>M</Name></Element>"
                + "<Element type=\"FieldElementVO\"><Name>Plain</Name><LengthField>4</LengthField></Element>"
                + "</Elements></Element></Elements></LayoutVO>";

        Layout layout = loader.load(xml);

        assertThat(layout.getElements()).extracting(LineElement::getName).containsExactly("LINHA001");
        assertThat(layout.getElements().get(0).getElements()).hasSize(1);
    }

    @Test
    void testLoad_MalformedXml_Throws() {
        assertThatThrownBy(() -> loader.load("<LayoutVO><Name>x</LayoutVO>"))
                .isInstanceOf(LayoutCompilationException.class)
                .hasMessageStartingWith("Invalid layout XML");
    }

    @Test
    void testLoad_BlankXml_Throws() {
        assertThatThrownBy(() -> loader.load("  "))
                .isInstanceOf(LayoutCompilationException.class);
    }
}
