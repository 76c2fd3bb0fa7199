package teranet.mapdev.layout.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.json.JsonMapper;
import org.springframework.stereotype.Service;
import teranet.mapdev.layout.logging.TechLogger;
import teranet.mapdev.layout.model.ClassifiedElement;
import teranet.mapdev.layout.model.ElementKind;
import teranet.mapdev.layout.model.FieldElement;
import teranet.mapdev.layout.model.LineElement;
import teranet.mapdev.layout.model.SeparatedElements;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Tells apart the two kinds of serialized child blobs a line may hold.
 *
 * Classification rules, in order:
 * 1. A "type" discriminator of FieldElementVO or LineElementVO decides the kind.
 * 2. Without one, the blob is a field if it carries none of the line-only properties
 *    (elements, initialValue, minimalOccurrence, maximumOccurrence) and has a non-empty name.
 *    Other unknown properties, such as a data type, are ignored. Fields win when both shapes fit.
 * 3. Otherwise it is a line if it reads as a line with a non-empty name.
 * 4. Anything else is unrecognized and dropped by callers.
 *
 * Property names are matched case-insensitively, so legacy PascalCase blobs read the same way.
 *
 * This service is stateless and can be safely used concurrently.
 */
@Service
public class ElementClassifier {

    private static final String ENDPOINT = "ElementClassifier";
    private static final String TYPE_PROPERTY = "type";

    private static final Set<String> LINE_ONLY_PROPERTIES =
            Set.of("elements", "initialvalue", "minimaloccurrence", "maximumoccurrence");

    private static final ObjectMapper MAPPER = JsonMapper.builder()
            .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_PROPERTIES)
            .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
            .build();

    private final TechLogger techLogger;

    public ElementClassifier(TechLogger techLogger) {
        this.techLogger = techLogger;
    }

    /**
     * Classify one serialized child element.
     *
     * @param blob JSON text of a field or line
     * @return the classified element, never null
     */
    public ClassifiedElement classify(String blob) {
        if (blob == null || blob.isBlank()) {
            return ClassifiedElement.unrecognized();
        }

        JsonNode node;
        try {
            node = MAPPER.readTree(blob);
        } catch (JsonProcessingException e) {
            techLogger.debug(ENDPOINT, "Dropping element that is not valid JSON: " + e.getOriginalMessage());
            return ClassifiedElement.unrecognized();
        }
        if (node == null || !node.isObject()) {
            techLogger.debug(ENDPOINT, "Dropping element that is not a JSON object");
            return ClassifiedElement.unrecognized();
        }

        ElementKind declared = ElementKind.fromDiscriminator(discriminator(node));
        if (declared == ElementKind.FIELD) {
            return asField(node);
        }
        if (declared == ElementKind.LINE) {
            return asLine(node);
        }

        if (!hasLineOnlyProperty(node)) {
            ClassifiedElement field = asField(node);
            if (field.isField()) {
                return field;
            }
        }
        ClassifiedElement line = asLine(node);
        if (!line.isLine()) {
            techLogger.debug(ENDPOINT, "Dropping unrecognized element: " + abbreviate(blob));
        }
        return line;
    }

    /**
     * Partition a line's child blobs into own fields and nested lines, preserving order within each.
     *
     * @param line the line definition, may be null
     * @return the separated elements, empty when the line has none
     */
    public SeparatedElements separateElements(LineElement line) {
        if (line == null || line.getElements() == null) {
            return SeparatedElements.empty();
        }

        List<FieldElement> fields = new ArrayList<>();
        List<LineElement> childLines = new ArrayList<>();

        for (String blob : line.getElements()) {
            ClassifiedElement element = classify(blob);
            if (element.isField()) {
                fields.add(element.getField());
            } else if (element.isLine()) {
                childLines.add(element.getLine());
            }
        }

        return new SeparatedElements(fields, childLines);
    }

    /**
     * Serialize a field with its type discriminator.
     */
    public String toBlob(FieldElement field) {
        field.setType(ElementKind.FIELD.getDiscriminator());
        return write(field);
    }

    /**
     * Serialize a line (and its nested blobs) with its type discriminator.
     */
    public String toBlob(LineElement line) {
        line.setType(ElementKind.LINE.getDiscriminator());
        return write(line);
    }

    private static String discriminator(JsonNode node) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            String name = names.next();
            if (TYPE_PROPERTY.equalsIgnoreCase(name)) {
                return node.get(name).asText(null);
            }
        }
        return null;
    }

    private static boolean hasLineOnlyProperty(JsonNode node) {
        Iterator<String> names = node.fieldNames();
        while (names.hasNext()) {
            if (LINE_ONLY_PROPERTIES.contains(names.next().toLowerCase(Locale.ROOT))) {
                return true;
            }
        }
        return false;
    }

    private ClassifiedElement asField(JsonNode node) {
        try {
            FieldElement field = MAPPER.treeToValue(node, FieldElement.class);
            if (field != null && field.getName() != null && !field.getName().isEmpty()) {
                return ClassifiedElement.field(field);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            techLogger.debug(ENDPOINT, "Element does not read as a field: " + e.getMessage());
        }
        return ClassifiedElement.unrecognized();
    }

    private ClassifiedElement asLine(JsonNode node) {
        try {
            LineElement line = MAPPER.treeToValue(node, LineElement.class);
            if (line != null && line.getName() != null && !line.getName().isEmpty()) {
                return ClassifiedElement.line(line);
            }
        } catch (JsonProcessingException | IllegalArgumentException e) {
            techLogger.debug(ENDPOINT, "Element does not read as a line: " + e.getMessage());
        }
        return ClassifiedElement.unrecognized();
    }

    private String write(Object element) {
        try {
            return MAPPER.writeValueAsString(element);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Cannot serialize layout element", e);
        }
    }

    private static String abbreviate(String text) {
        return text.length() <= 80 ? text : text.substring(0, 80) + "...";
    }
}
