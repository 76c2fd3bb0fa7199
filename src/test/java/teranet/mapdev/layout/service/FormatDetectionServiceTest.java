package teranet.mapdev.layout.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.layout.model.FormatType;
import teranet.mapdev.layout.util.TestDataFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for FormatDetectionService
 * Tests xml, mqseries and idoc heuristics and their precedence
 */
class FormatDetectionServiceTest {

    private FormatDetectionService formatDetectionService;

    @BeforeEach
    void setUp() {
        formatDetectionService = new FormatDetectionService(TestDataFactory.defaultConfig(),
                TestDataFactory.SILENT_LOGGER);
    }

    @Test
    void testDetect_NullOrBlank_ReturnsUnknown() {
        assertThat(formatDetectionService.detect(null)).isEqualTo(FormatType.UNKNOWN);
        assertThat(formatDetectionService.detect("")).isEqualTo(FormatType.UNKNOWN);
        assertThat(formatDetectionService.detect("   \n  ")).isEqualTo(FormatType.UNKNOWN);
    }

    @Test
    void testDetect_WellFormedXml_ReturnsXml() {
        // Given: an XML document with declaration
        String content = "<?xml version=\"1.0\"?><NFe><infNFe/></NFe>";

        // When / Then
        assertThat(formatDetectionService.detect(content)).isEqualTo(FormatType.XML);
    }

    @Test
    void testDetect_XmlWithoutDeclaration_ReturnsXml() {
        assertThat(formatDetectionService.detect("  <root><a>1</a></root>")).isEqualTo(FormatType.XML);
    }

    @Test
    void testDetect_MalformedMarkup_IsNotXml() {
        // Given: content that looks like XML but does not parse
        String content = "<root><a>1</b></root>";

        // When / Then: falls through the other checks
        assertThat(formatDetectionService.detect(content)).isEqualTo(FormatType.UNKNOWN);
    }

    @Test
    void testDetect_DoctypeIsRejected() {
        // Given: XML with a DTD (disabled for safety)
        String content = "<?xml version=\"1.0\"?><!DOCTYPE r [<!ENTITY x \"y\">]><r>&x;</r>";

        // When / Then
        assertThat(formatDetectionService.detect(content)).isNotEqualTo(FormatType.XML);
    }

    @Test
    void testDetect_FixedWidthDocument_ReturnsMqSeries() {
        // Given: five 600-character records ending with a 999 terminal tag
        String content = TestDataFactory.sampleDocument();

        // When / Then
        assertThat(formatDetectionService.detect(content)).isEqualTo(FormatType.MQSERIES);
    }

    @Test
    void testDetect_FixedWidthDocumentWithLineBreaks_ReturnsMqSeries() {
        // Given: the same records separated by CRLF
        String content = TestDataFactory.sampleDocument().replaceAll("(.{600})", "$1\r\n");

        // When / Then: line terminators are ignored for the length check
        assertThat(formatDetectionService.detect(content)).isEqualTo(FormatType.MQSERIES);
    }

    @Test
    void testDetect_HeaderWithWrongLength_IsNotMqSeries() {
        // Given: a HEADER document that is not a multiple of 600
        String content = TestDataFactory.sampleDocument() + "X";

        // When / Then
        assertThat(formatDetectionService.looksLikeMqSeries(content)).isFalse();
    }

    @Test
    void testDetect_HeaderWithoutSequenceTags_IsNotMqSeries() {
        // Given: a 600-character HEADER record without digits
        String content = TestDataFactory.record(600, "HEADER", "NO SEQUENCE HERE");

        // When / Then
        assertThat(formatDetectionService.looksLikeMqSeries(content)).isFalse();
    }

    @Test
    void testDetect_TwoSequenceTagsWithoutTerminal_IsNotMqSeries() {
        // Given: exactly two 9-digit tags and no 999 terminal
        String content = TestDataFactory.record(600, "HEADER", "000001000", " ", "000002001");

        // When / Then: a third tag or the terminal is required
        assertThat(formatDetectionService.looksLikeMqSeries(content)).isFalse();
    }

    @Test
    void testDetect_ThreeSequenceTagsWithoutTerminal_IsMqSeries() {
        String content = TestDataFactory.record(600, "HEADER", "000001000", " ", "000002001", " ", "000003002");

        assertThat(formatDetectionService.looksLikeMqSeries(content)).isTrue();
    }

    @Test
    void testDetect_EdiPrefix_ReturnsIdoc() {
        assertThat(formatDetectionService.detect("EDI_DC40 800 0000000001234567")).isEqualTo(FormatType.IDOC);
    }

    @Test
    void testDetect_ZrsdmSegment_ReturnsIdoc() {
        assertThat(formatDetectionService.detect("control ZRSDM_NFE segment")).isEqualTo(FormatType.IDOC);
    }

    @Test
    void testDetect_LongTokenLine_ReturnsIdoc() {
        // Given: more than five tokens, one of them a 16+ character code
        String content = "A B C D E 0000123456789ABCDEF\nsecond line";

        // When / Then
        assertThat(formatDetectionService.detect(content)).isEqualTo(FormatType.IDOC);
    }

    @Test
    void testDetect_FiveTokensOnly_IsNotIdoc() {
        assertThat(formatDetectionService.looksLikeIdoc("A B C D 0000123456789ABCDEF")).isFalse();
    }

    @Test
    void testDetect_ShortTokens_IsNotIdoc() {
        assertThat(formatDetectionService.looksLikeIdoc("A B C D E F G H")).isFalse();
    }

    @Test
    void testDetect_FreeText_ReturnsUnknown() {
        assertThat(formatDetectionService.detect("just some plain text")).isEqualTo(FormatType.UNKNOWN);
    }

    @Test
    void testDetect_XmlWinsOverOtherHeuristics() {
        // Given: XML whose text also contains an idoc marker
        String content = "<?xml version=\"1.0\"?><r>EDI_DC40 ZRSDM_X</r>";

        // When / Then: xml is checked first
        assertThat(formatDetectionService.detect(content)).isEqualTo(FormatType.XML);
    }
}
