package teranet.mapdev.layout.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.layout.config.LineSizeConfig;
import teranet.mapdev.layout.dto.LayoutValidationReport;
import teranet.mapdev.layout.dto.LineValidationResult;
import teranet.mapdev.layout.dto.ParsingResult;
import teranet.mapdev.layout.exception.LayoutCompilationException;
import teranet.mapdev.layout.model.FormatType;
import teranet.mapdev.layout.model.Layout;
import teranet.mapdev.layout.model.LineElement;
import teranet.mapdev.layout.util.TestDataFactory;

import java.util.Collections;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Tests for LayoutProcessingService wired with the real engine services
 * Covers load, normalize, validate and parse on the bundled NFe layout
 */
class LayoutProcessingServiceTest {

    private LineSizeConfig lineSizeConfig;
    private LayoutProcessingService processingService;

    @BeforeEach
    void setUp() {
        lineSizeConfig = new LineSizeConfig();
        processingService = TestDataFactory.processingService(lineSizeConfig);
    }

    private static String layoutXml() {
        return TestDataFactory.readResource(TestDataFactory.LAYOUT_RESOURCE);
    }

    @Test
    void testLoadLayout_PromotesNestedLinesAndRenumbers() {
        // When
        Layout layout = processingService.loadLayout(layoutXml());

        // Then: LINHA021 leaves LINHA020, numbered lines first, HEADER and TRAILER last
        assertThat(layout.getLayoutGuid()).isEqualTo(TestDataFactory.LAYOUT_GUID);
        assertThat(layout.getElements())
                .extracting(LineElement::getName)
                .containsExactly("LINHA000", "LINHA020", "LINHA021", "LINHA040", "HEADER", "TRAILER");
        assertThat(layout.getElements())
                .extracting(LineElement::getSequence)
                .containsExactly(1, 2, 3, 4, 5, 6);
    }

    @Test
    void testValidateLayout_AllLinesFitLimitOfCharacters() {
        // When
        LayoutValidationReport report = processingService.validateLayout(layoutXml());

        // Then: LINHA041 stays nested under LINHA040
        assertThat(report.getExpectedLineLength()).isEqualTo(600);
        assertThat(report.isConfiguredWidth()).isFalse();
        assertThat(report.isAllValid()).isTrue();
        assertThat(report.getResults()).hasSize(7);
        assertThat(report.getContainerLineCount()).isEqualTo(1);
        assertThat(report.getVariableWidthLineCount()).isEqualTo(1);

        LineValidationResult linha041 = report.getResults().stream()
                .filter(r -> "LINHA041".equals(r.getLineName()))
                .findFirst()
                .orElseThrow();
        assertThat(linha041.getDepth()).isEqualTo(1);
    }

    @Test
    void testValidateLayout_ConfiguredWidthWins() {
        // Given: the layout listed among the 2500-character layouts, without its prefix
        lineSizeConfig.setLayouts2500(Collections.singletonList(TestDataFactory.LAYOUT_GUID.substring(4)));
        LayoutProcessingService wide = TestDataFactory.processingService(lineSizeConfig);

        // When
        LayoutValidationReport report = wide.validateLayout(layoutXml());

        // Then: only the container line still passes
        assertThat(report.getExpectedLineLength()).isEqualTo(2500);
        assertThat(report.isConfiguredWidth()).isTrue();
        assertThat(report.getInvalidLineCount()).isEqualTo(6);
        assertThat(report.isAllValid()).isFalse();
    }

    @Test
    void testParseDocument_EndToEnd() {
        // When
        ParsingResult result = processingService.parseDocument(TestDataFactory.sampleDocument(), layoutXml());

        // Then
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getFormat()).isEqualTo(FormatType.MQSERIES);
        assertThat(result.getLinesPresent())
                .containsExactlyInAnyOrder("HEADER", "LINHA000", "LINHA020", "LINHA021", "TRAILER");
        assertThat(result.getUnidentifiedLines()).isEmpty();
        assertThat(result.getSummary().getComplianceRate()).isEqualTo(100.0);
    }

    @Test
    void testParseDocument_InvalidLayoutStillParses() {
        // Given: LINHA000 four characters short
        String narrowed = layoutXml().replace("<LengthField>564</LengthField>", "<LengthField>560</LengthField>");

        // When
        ParsingResult result = processingService.parseDocument(TestDataFactory.sampleDocument(), narrowed);

        // Then
        assertThat(processingService.validateLayout(narrowed).getInvalidLineCount()).isEqualTo(1);
        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getLinesPresent()).contains("LINHA000");
    }

    @Test
    void testDetectFormat() {
        assertThat(processingService.detectFormat(TestDataFactory.sampleDocument())).isEqualTo(FormatType.MQSERIES);
        assertThat(processingService.detectFormat("")).isEqualTo(FormatType.UNKNOWN);
    }

    @Test
    void testGenerators() {
        assertThat(processingService.generateTcl(layoutXml())).startsWith("<MAP>");
        assertThat(processingService.generateXsl(TestDataFactory.readResource(TestDataFactory.MAP_RESOURCE)))
                .contains("<ide>");
    }

    @Test
    void testLoadLayout_MalformedXml_Throws() {
        assertThatThrownBy(() -> processingService.loadLayout("<LayoutVO><Elements>"))
                .isInstanceOf(LayoutCompilationException.class);
    }
}
