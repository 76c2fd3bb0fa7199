package teranet.mapdev.layout.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import teranet.mapdev.layout.model.Layout;
import teranet.mapdev.layout.model.LineElement;
import teranet.mapdev.layout.util.TestDataFactory;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Unit tests for LayoutNormalizerService
 * Tests the LINHA020 promotion and the sequence renumbering
 */
class LayoutNormalizerServiceTest {

    private LayoutNormalizerService normalizerService;

    @BeforeEach
    void setUp() {
        normalizerService = new LayoutNormalizerService(TestDataFactory.classifier(), TestDataFactory.SILENT_LOGGER);
    }

    @Test
    void testRestructure_PromotesNestedLinesOutOfLinha020() {
        // Given: LINHA020 holding a field, two LINHA lines and a non-LINHA line
        LineElement linha020 = TestDataFactory.line("LINHA020", "020", 3,
                TestDataFactory.fieldBlob("Codigo", 1, 14),
                TestDataFactory.lineBlob(TestDataFactory.line("LINHA021", "021", 4)),
                TestDataFactory.lineBlob(TestDataFactory.line("DETALHE", "D", 5)),
                TestDataFactory.lineBlob(TestDataFactory.line("LINHA022", "022", 6)));
        Layout layout = TestDataFactory.layout("LAY_1",
                TestDataFactory.line("LINHA000", "000", 1),
                linha020,
                TestDataFactory.line("LINHA030", "030", 7));

        // When
        Layout restructured = normalizerService.restructure(layout);

        // Then: promoted lines follow LINHA020 in encounter order
        assertThat(restructured.getElements()).extracting(LineElement::getName)
                .containsExactly("LINHA000", "LINHA020", "LINHA021", "LINHA022", "LINHA030");

        // And: LINHA020 keeps its field and the non-LINHA line
        LineElement cleaned = restructured.getElements().get(1);
        assertThat(cleaned.getElements()).hasSize(2);
        assertThat(TestDataFactory.classifier().separateElements(cleaned).getChildLines())
                .extracting(LineElement::getName).containsExactly("DETALHE");
    }

    @Test
    void testRestructure_DoesNotMutateInput() {
        // Given
        LineElement linha020 = TestDataFactory.line("LINHA020", "020", 3,
                TestDataFactory.lineBlob(TestDataFactory.line("LINHA021", "021", 4)));
        Layout layout = TestDataFactory.layout("LAY_1", linha020);

        // When
        normalizerService.restructure(layout);

        // Then
        assertThat(layout.getElements()).hasSize(1);
        assertThat(layout.getElements().get(0).getElements()).hasSize(1);
    }

    @Test
    void testRestructure_OtherLinesKeepTheirChildren() {
        // Given: nesting under a line other than LINHA020
        LineElement linha040 = TestDataFactory.line("LINHA040", "040", 1,
                TestDataFactory.lineBlob(TestDataFactory.line("LINHA041", "041", 2)));
        Layout layout = TestDataFactory.layout("LAY_1", linha040);

        // When
        Layout restructured = normalizerService.restructure(layout);

        // Then
        assertThat(restructured.getElements()).extracting(LineElement::getName).containsExactly("LINHA040");
        assertThat(restructured.getElements().get(0).getElements()).hasSize(1);
    }

    @Test
    void testRestructure_NestedLinha020IsNotPromoted() {
        // Given: LINHA020 nested inside LINHA020
        LineElement linha020 = TestDataFactory.line("LINHA020", "020", 1,
                TestDataFactory.lineBlob(TestDataFactory.line("LINHA020", "020", 2)));

        // When
        Layout restructured = normalizerService.restructure(TestDataFactory.layout("LAY_1", linha020));

        // Then
        assertThat(restructured.getElements()).hasSize(1);
        assertThat(restructured.getElements().get(0).getElements()).hasSize(1);
    }

    @Test
    void testRestructure_NullLayout_ReturnsNull() {
        assertThat(normalizerService.restructure(null)).isNull();
    }

    @Test
    void testReorderSequences_SortsByLineNumberAndRenumbers() {
        // Given: lines out of order, with unnumbered HEADER and TRAILER
        Layout layout = TestDataFactory.layout("LAY_1",
                TestDataFactory.line("HEADER", "HEADER", 1),
                TestDataFactory.line("LINHA010", "010", 2),
                TestDataFactory.line("TRAILER", "999", 3),
                TestDataFactory.line("LINHA002", "002", 4),
                TestDataFactory.line("LINHA100", "100", 5));

        // When
        Layout reordered = normalizerService.reorderSequences(layout);

        // Then: numbered lines ascending, unnumbered last in original order, sequences 1..n
        assertThat(reordered.getElements()).extracting(LineElement::getName)
                .containsExactly("LINHA002", "LINHA010", "LINHA100", "HEADER", "TRAILER");
        assertThat(reordered.getElements()).extracting(LineElement::getSequence)
                .containsExactly(1, 2, 3, 4, 5);
        assertThat(layout.getElements()).extracting(LineElement::getSequence).containsExactly(1, 2, 3, 4, 5);
        assertThat(layout.getElements().get(1).getName()).isEqualTo("LINHA010");
    }

    @Test
    void testReorderSequences_IsIdempotent() {
        Layout layout = TestDataFactory.layout("LAY_1",
                TestDataFactory.line("LINHA003", "003", 9),
                TestDataFactory.line("X", "", 3),
                TestDataFactory.line("LINHA001", "001", 1));

        Layout once = normalizerService.reorderSequences(layout);
        Layout twice = normalizerService.reorderSequences(once);

        assertThat(once.getElements()).extracting(LineElement::getName)
                .containsExactly("LINHA001", "LINHA003", "X");
        assertThat(twice.getElements()).extracting(LineElement::getName)
                .containsExactly("LINHA001", "LINHA003", "X");
        assertThat(twice.getElements()).extracting(LineElement::getSequence)
                .containsExactly(1, 2, 3);
    }

    @Test
    void testLineNumber() {
        assertThat(LayoutNormalizerService.lineNumber("LINHA007")).isEqualTo(7);
        assertThat(LayoutNormalizerService.lineNumber("LINHA")).isEqualTo(9999);
        assertThat(LayoutNormalizerService.lineNumber("LINHA01A")).isEqualTo(9999);
        assertThat(LayoutNormalizerService.lineNumber(null)).isEqualTo(9999);
    }
}
