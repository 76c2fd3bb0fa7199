package teranet.mapdev.layout.service;

import org.springframework.stereotype.Service;
import teranet.mapdev.layout.config.LayoutEngineConfig;
import teranet.mapdev.layout.dto.DocumentSummary;
import teranet.mapdev.layout.dto.ParsingResult;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.FieldElement;
import teranet.mapdev.layout.model.FormatType;
import teranet.mapdev.layout.model.Layout;
import teranet.mapdev.layout.model.LayoutType;
import teranet.mapdev.layout.model.LineElement;
import teranet.mapdev.layout.model.ParsedField;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Decomposes an instance document into positional field values according to a layout.
 *
 * Each physical line is matched against the layout's line definitions, nested definitions
 * before their parent:
 * - initial value HEADER matches lines starting with HEADER
 * - any other initial value matches right after the 6-digit sequence prefix
 * - without initial value, a LINHA&lt;NNN&gt; definition matches a sequence prefix ending in NNN
 *
 * Fields are cut one after another from the line's data offset, ignoring their declared start
 * value. Bad content never throws: the result carries {@code success=false} instead.
 */
@Service
public class DocumentParserService {

    private static final String ENDPOINT = "DocumentParser";

    static final String HEADER = "HEADER";
    static final String LINE_NAME_PREFIX = "LINHA";
    private static final int PREVIEW_LENGTH = 20;
    private static final Pattern NUMERIC = Pattern.compile("\\d+");

    private final FormatDetectionService formatDetectionService;
    private final LineSplitterService lineSplitterService;
    private final ElementClassifier elementClassifier;
    private final LineWidthResolver lineWidthResolver;
    private final LayoutEngineConfig config;
    private final TechLogger techLogger;

    public DocumentParserService(
            FormatDetectionService formatDetectionService,
            LineSplitterService lineSplitterService,
            ElementClassifier elementClassifier,
            LineWidthResolver lineWidthResolver,
            LayoutEngineConfig config,
            TechLogger techLogger) {
        this.formatDetectionService = formatDetectionService;
        this.lineSplitterService = lineSplitterService;
        this.elementClassifier = elementClassifier;
        this.lineWidthResolver = lineWidthResolver;
        this.config = config;
        this.techLogger = techLogger;
    }

    /**
     * Parse document content against a layout.
     *
     * @param content raw document text
     * @param layout  the layout describing its lines
     * @return the parsed fields with a summary, or a failed result
     */
    public ParsingResult parse(String content, Layout layout) {
        if (layout == null || layout.getElements() == null) {
            techLogger.error(ENDPOINT, "Layout is required to parse a document");
            return ParsingResult.failed("Layout is required");
        }
        if (content == null || content.isBlank()) {
            techLogger.error(ENDPOINT, "Document content is empty");
            return ParsingResult.failed("Document content is empty");
        }

        try {
            return doParse(content, layout);
        } catch (RuntimeException e) {
            techLogger.error(ENDPOINT, "Parsing failed: " + e.getMessage());
            return ParsingResult.failed("Parsing error: " + e.getMessage());
        }
    }

    private ParsingResult doParse(String content, Layout layout) {
        FormatType detected = formatDetectionService.detect(content);
        int lineWidth = resolveLineWidth(layout);
        List<String> lines = splitLines(content, detected, layout, lineWidth);

        techLogger.info(ENDPOINT, String.format("Parsing %d %s lines with layout '%s' (%d characters per line)",
                lines.size(), detected.getCode(), layout.getName(), lineWidth));

        List<LineElement> definitions = flatten(layout.getElements(), 0);

        ParsingResult result = new ParsingResult();
        result.setFormat(detected);
        result.setLineCount(lines.size());

        Map<String, Integer> occurrences = new LinkedHashMap<>();

        for (int index = 0; index < lines.size(); index++) {
            String rawLine = lines.get(index);
            LineElement definition = findDefinition(rawLine, definitions);

            if (definition == null) {
                String preview = rawLine.substring(0, Math.min(PREVIEW_LENGTH, rawLine.length()));
                result.getUnidentifiedLines().add(String.format("Line %d: %s...", index + 1, preview));
                techLogger.warn(ENDPOINT, String.format("Line %d not identified: %s...", index + 1, preview));
                continue;
            }

            int seen = occurrences.getOrDefault(definition.getName(), 0);
            if (definition.getMaximumOccurrence() > 0 && seen >= definition.getMaximumOccurrence()) {
                techLogger.warn(ENDPOINT, String.format("Limit of %d occurrences reached for %s, line %d skipped",
                        definition.getMaximumOccurrence(), definition.getName(), index + 1));
                continue;
            }
            occurrences.put(definition.getName(), seen + 1);

            result.getParsedFields().addAll(parseLineFields(rawLine, definition, lineWidth, seen + 1));
        }

        result.getLinesPresent().addAll(occurrences.keySet());

        for (LineElement definition : definitions) {
            int present = occurrences.getOrDefault(definition.getName(), 0);
            if (present < definition.getMinimalOccurrence()) {
                result.getLinesBelowMinimum().add(definition.getName());
                techLogger.warn(ENDPOINT, String.format("%s occurs %d time(s), minimum is %d",
                        definition.getName(), present, definition.getMinimalOccurrence()));
            }
        }

        if (!result.getUnidentifiedLines().isEmpty()) {
            techLogger.warn(ENDPOINT, String.format("%d unidentified line(s): %s",
                    result.getUnidentifiedLines().size(), String.join("; ", result.getUnidentifiedLines())));
        }

        result.setSummary(summarize(result, definitions, occurrences, layout));
        result.setSuccess(true);

        techLogger.info(ENDPOINT, String.format("Parsed %d fields (%d errors) from %d lines, %d unidentified",
                result.getParsedFields().size(), result.getSummary().getErrorFields(), lines.size(),
                result.getUnidentifiedLines().size()));
        return result;
    }

    /**
     * Width of one record: configured per layout, then the layout's own limit, then the engine default.
     */
    int resolveLineWidth(Layout layout) {
        return lineWidthResolver.resolve(layout.getLayoutGuid())
                .orElseGet(() -> layout.getLimitOfCharacters() > 0
                        ? layout.getLimitOfCharacters()
                        : config.getRecordLength());
    }

    private List<String> splitLines(String content, FormatType detected, Layout layout, int lineWidth) {
        boolean hasLineBreaks = content.indexOf('\n') >= 0 || content.indexOf('\r') >= 0;
        boolean positional = layout.getLayoutType() == LayoutType.TEXT_POSITIONAL;

        if (detected == FormatType.MQSERIES || (detected == FormatType.UNKNOWN && positional && !hasLineBreaks)) {
            String stripped = content.replace("\r", "").replace("\n", "");
            return lineSplitterService.split(stripped, FormatType.MQSERIES, lineWidth);
        }
        return lineSplitterService.split(content, detected);
    }

    /**
     * Line definitions in matching order: nested definitions first, then their parent.
     */
    List<LineElement> flatten(List<LineElement> lines, int depth) {
        List<LineElement> flattened = new ArrayList<>();
        if (lines == null) {
            return flattened;
        }
        if (depth > config.getMaxNestingDepth()) {
            techLogger.error(ENDPOINT, "Line definitions nested deeper than "
                    + config.getMaxNestingDepth() + " levels are ignored");
            return flattened;
        }
        for (LineElement line : lines) {
            if (line == null) {
                continue;
            }
            flattened.addAll(flatten(elementClassifier.separateElements(line).getChildLines(), depth + 1));
            flattened.add(line);
        }
        return flattened;
    }

    private LineElement findDefinition(String line, List<LineElement> definitions) {
        for (LineElement definition : definitions) {
            if (matches(line, definition)) {
                return definition;
            }
        }
        return null;
    }

    /**
     * Whether a physical line is an instance of a line definition.
     */
    boolean matches(String line, LineElement definition) {
        String initialValue = definition.getInitialValue();
        int prefixLength = config.getSequencePrefixLength();

        if (initialValue != null && !initialValue.isEmpty()) {
            if (HEADER.equals(initialValue)) {
                return line.startsWith(HEADER);
            }
            return hasSequencePrefix(line)
                    && line.startsWith(initialValue, prefixLength);
        }

        String name = definition.getName();
        if (name == null || !name.startsWith(LINE_NAME_PREFIX) || !hasSequencePrefix(line)) {
            return false;
        }
        String suffix = name.substring(LINE_NAME_PREFIX.length());
        if (!NUMERIC.matcher(suffix).matches()) {
            return false;
        }
        String expectedTag = leftPadZeros(suffix, 3);
        return line.substring(prefixLength - 3, prefixLength).equals(expectedTag);
    }

    private List<ParsedField> parseLineFields(String rawLine, LineElement definition, int lineWidth, int occurrence) {
        String paddedLine = LineSplitterService.padRight(rawLine, lineWidth);
        String lineSequence = paddedLine.substring(0, Math.min(config.getSequencePrefixLength(), paddedLine.length()));

        List<FieldElement> fields = elementClassifier.separateElements(definition).getFields().stream()
                .filter(field -> !field.isSequenceField())
                .sorted(Comparator.comparingInt(FieldElement::getSequence))
                .collect(Collectors.toList());

        int position = dataOffset(rawLine, definition);
        techLogger.debug(ENDPOINT, String.format("%s (occurrence %d): %d fields from position %d",
                definition.getName(), occurrence, fields.size(), position + 1));

        List<ParsedField> parsed = new ArrayList<>();
        for (FieldElement field : fields) {
            int start = position;
            int end = start + field.getLengthField();

            ParsedField value = new ParsedField();
            value.setLineName(definition.getName());
            value.setFieldName(field.getName());
            value.setSequence(field.getSequence());
            value.setStart(start + 1);
            value.setLength(field.getLengthField());
            value.setRequired(field.isRequired());
            value.setOccurrence(occurrence);
            value.setLineSequence(lineSequence);

            if (field.getLengthField() < 0 || end > paddedLine.length()) {
                value.setValue("");
                value.setStatus(ParsedField.STATUS_ERROR);
                techLogger.warn(ENDPOINT, String.format("%s.%s: position %d-%d is outside the line",
                        definition.getName(), field.getName(), start + 1, end));
            } else {
                String text = field.getAlignmentType().strip(paddedLine.substring(start, end));
                value.setValue(text);
                if (field.isRequired() && text.isBlank()) {
                    value.setStatus(ParsedField.STATUS_ERROR);
                } else if (end > rawLine.length()) {
                    value.setStatus(ParsedField.STATUS_WARNING);
                } else {
                    value.setStatus(ParsedField.STATUS_OK);
                }
            }
            parsed.add(value);
            position = Math.max(end, position);
        }

        if (position != lineWidth) {
            techLogger.debug(ENDPOINT, String.format("%s ends at position %d, record width is %d",
                    definition.getName(), position, lineWidth));
        }
        return parsed;
    }

    /**
     * Position of the first data field: after HEADER, or after the sequence prefix and initial value.
     */
    int dataOffset(String line, LineElement definition) {
        String initialValue = definition.getInitialValue() != null ? definition.getInitialValue() : "";
        if (HEADER.equals(initialValue) || HEADER.equals(definition.getName())) {
            return HEADER.length();
        }
        if (hasSequencePrefix(line)) {
            return config.getSequencePrefixLength() + initialValue.length();
        }
        return initialValue.length();
    }

    private boolean hasSequencePrefix(String line) {
        int prefixLength = config.getSequencePrefixLength();
        if (line == null || line.length() < prefixLength) {
            return false;
        }
        for (int i = 0; i < prefixLength; i++) {
            char c = line.charAt(i);
            if (c < '0' || c > '9') {
                return false;
            }
        }
        return true;
    }

    private DocumentSummary summarize(ParsingResult result, List<LineElement> definitions,
            Map<String, Integer> occurrences, Layout layout) {
        DocumentSummary summary = new DocumentSummary();
        summary.setTotalLines(result.getLineCount());
        summary.setTotalFields(result.getParsedFields().size());
        summary.setValidFields(countByStatus(result.getParsedFields(), ParsedField.STATUS_OK));
        summary.setWarningFields(countByStatus(result.getParsedFields(), ParsedField.STATUS_WARNING));
        summary.setErrorFields(countByStatus(result.getParsedFields(), ParsedField.STATUS_ERROR));
        summary.setDocumentType(result.getFormat().getCode());
        summary.setLayoutName(layout.getName());
        summary.setProcessingDate(LocalDateTime.now());

        List<LineElement> expected = definitions.stream()
                .filter(line -> line.isRequired() || line.getMinimalOccurrence() > 0)
                .collect(Collectors.toList());
        int present = (int) expected.stream()
                .filter(line -> occurrences.containsKey(line.getName()))
                .count();
        summary.setExpectedLines(expected.size());
        summary.setPresentLines(present);
        summary.setMissingLines(expected.size() - present);
        return summary;
    }

    private static int countByStatus(List<ParsedField> fields, String status) {
        return (int) fields.stream().filter(field -> status.equals(field.getStatus())).count();
    }

    private static String leftPadZeros(String digits, int length) {
        StringBuilder padded = new StringBuilder();
        for (int i = digits.length(); i < length; i++) {
            padded.append('0');
        }
        return padded.append(digits).toString();
    }
}
