package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.layout.config.LayoutEngineConfig;
import teranet.mapdev.layout.dto.LayoutValidationReport;
import teranet.mapdev.layout.dto.LineValidationResult;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.FieldElement;
import teranet.mapdev.layout.model.Layout;
import teranet.mapdev.layout.model.LineElement;
import teranet.mapdev.layout.model.SeparatedElements;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

/**
 * Checks that every line definition of a layout adds up to the record width.
 *
 * Per line:
 * - total = initial value length + field widths (Sequencia excluded) + 6 if Sequencia is present
 * - a leaf line must match the width exactly
 * - a line with nested lines is a container and only must not exceed it
 *
 * Results are reported depth-first, parent before children. An invalid line is data in the
 * report, never an exception.
 */
@Service
public class LayoutValidationService {

    private static final String ENDPOINT = "LayoutValidation";

    private final ElementClassifier elementClassifier;
    private final LineWidthResolver lineWidthResolver;
    private final LayoutEngineConfig config;
    private final TechLogger techLogger;

    public LayoutValidationService(
            ElementClassifier elementClassifier,
            LineWidthResolver lineWidthResolver,
            LayoutEngineConfig config,
            TechLogger techLogger) {
        this.elementClassifier = elementClassifier;
        this.lineWidthResolver = lineWidthResolver;
        this.config = config;
        this.techLogger = techLogger;
    }

    /**
     * Validate against the configured default width (600).
     */
    public List<LineValidationResult> validate(Layout layout) {
        return validate(layout, config.getDefaultLineLength());
    }

    /**
     * Validate every line of a layout against a fixed width.
     *
     * @param layout             the layout, may be null
     * @param expectedLineLength the record width lines must fill
     * @return results in pre-order; empty when the layout or its line list is null
     */
    public List<LineValidationResult> validate(Layout layout, int expectedLineLength) {
        if (layout == null || layout.getElements() == null) {
            techLogger.error(ENDPOINT, "Layout or its elements is null, nothing to validate");
            return Collections.emptyList();
        }

        List<LineValidationResult> results = new ArrayList<>();
        for (LineElement line : layout.getElements()) {
            validateLine(line, expectedLineLength, 0, results);
        }
        return results;
    }

    /**
     * Validate a layout against the width resolved for its guid.
     *
     * The width comes from the per-layout line size configuration, then from the layout's own
     * limit of characters, then from the configured default.
     *
     * @param layout the layout, may be null
     * @return the report with its summary logged
     */
    public LayoutValidationReport validateForLayout(Layout layout) {
        if (layout == null) {
            techLogger.error(ENDPOINT, "Layout is null, nothing to validate");
            return new LayoutValidationReport(null, null, config.getDefaultLineLength(), false,
                    Collections.emptyList());
        }

        Optional<Integer> configured = lineWidthResolver.resolve(layout.getLayoutGuid());
        int width = configured.orElseGet(() -> layout.getLimitOfCharacters() > 0
                ? layout.getLimitOfCharacters()
                : config.getDefaultLineLength());

        techLogger.info(ENDPOINT, String.format("Validating layout '%s' (%s) against %d characters per line%s",
                layout.getName(), layout.getLayoutGuid(), width,
                configured.isPresent() ? " (configured)" : ""));

        List<LineValidationResult> results = validate(layout, width);
        LayoutValidationReport report = new LayoutValidationReport(
                layout.getLayoutGuid(), layout.getName(), width, configured.isPresent(), results);
        logSummary(report);
        return report;
    }

    /**
     * Compute the width check of one line without descending into its children.
     */
    public LineValidationResult measureLine(LineElement line, int expectedLineLength, int depth) {
        SeparatedElements separated = elementClassifier.separateElements(line);
        return measure(line, separated, expectedLineLength, depth);
    }

    private void validateLine(LineElement line, int expectedLineLength, int depth,
            List<LineValidationResult> results) {
        if (line == null) {
            return;
        }
        if (depth > config.getMaxNestingDepth()) {
            techLogger.error(ENDPOINT, String.format(
                    "Line %s is nested deeper than %d levels, skipping this branch",
                    line.getName(), config.getMaxNestingDepth()));
            return;
        }

        SeparatedElements separated = elementClassifier.separateElements(line);
        LineValidationResult result = measure(line, separated, expectedLineLength, depth);
        results.add(result);

        techLogger.debug(ENDPOINT, String.format("%s: %d chars (expected %d, valid %s, children %d)",
                result.getLineName(), result.getTotalLength(), expectedLineLength,
                result.isValid(), result.getChildCount()));

        for (LineElement child : separated.getChildLines()) {
            validateLine(child, expectedLineLength, depth + 1, results);
        }
    }

    private LineValidationResult measure(LineElement line, SeparatedElements separated,
            int expectedLineLength, int depth) {
        List<FieldElement> fieldsToCalculate = separated.getFields().stream()
                .filter(field -> !field.isSequenceField())
                .sorted(Comparator.comparingInt(FieldElement::getSequence))
                .collect(Collectors.toList());

        int fieldsLength = fieldsToCalculate.stream().mapToInt(FieldElement::getLengthField).sum();
        boolean hasSequenceField = separated.getFields().stream().anyMatch(FieldElement::isSequenceField);
        int sequenceFieldLength = hasSequenceField ? FieldElement.SEQUENCE_FIELD_LENGTH : 0;

        int totalLength = line.getInitialValueLength() + fieldsLength + sequenceFieldLength;
        boolean hasChildren = separated.hasChildLines();
        boolean valid = hasChildren ? totalLength <= expectedLineLength : totalLength == expectedLineLength;

        return new LineValidationResult(
                line.getName(),
                line.getInitialValue(),
                totalLength,
                expectedLineLength,
                valid,
                hasChildren,
                fieldsToCalculate.size(),
                separated.getChildLines().size(),
                depth);
    }

    private void logSummary(LayoutValidationReport report) {
        int width = report.getExpectedLineLength();
        List<LineValidationResult> byName = report.getResults().stream()
                .sorted(Comparator.comparing(r -> String.valueOf(r.getLineName())))
                .collect(Collectors.toList());

        for (LineValidationResult line : byName) {
            if (!line.isValid()) {
                int difference = line.getDifference();
                techLogger.error(ENDPOINT, String.format("%s: %d chars (%s %d) - initial value '%s'",
                        line.getLineName(), line.getTotalLength(), difference > 0 ? "missing" : "exceeding",
                        Math.abs(difference), line.getInitialValue()));
            } else if (line.isHasChildren() && line.getTotalLength() != width) {
                techLogger.warn(ENDPOINT, String.format("%s: %d chars, variable width (children %d, own fields %d)",
                        line.getLineName(), line.getTotalLength(), line.getChildCount(), line.getFieldCount()));
            }
        }

        techLogger.info(ENDPOINT, String.format(
                "Validated %d lines of layout '%s': %d valid, %d invalid, %d with children",
                report.getResults().size(), report.getLayoutName(), report.getValidLineCount(),
                report.getInvalidLineCount(), report.getContainerLineCount()));
    }
}
