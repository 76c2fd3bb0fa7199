package teranet.mapdev.layout.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One record type of a layout.
 *
 * Child content is kept as serialized JSON blobs, each either a {@link FieldElement} or
 * another LineElement. Use the element classifier to tell them apart.
 */
@Data
@NoArgsConstructor
public class LineElement {

    @JsonProperty("type")
    private String type = ElementKind.LINE.getDiscriminator();

    @JsonProperty("elementGuid")
    private String elementGuid;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("sequence")
    private int sequence;

    @JsonProperty("isRequired")
    private boolean required;

    @JsonProperty("minimalOccurrence")
    private int minimalOccurrence;

    @JsonProperty("maximumOccurrence")
    private int maximumOccurrence;

    @JsonProperty("initialValue")
    private String initialValue;

    @JsonProperty("elements")
    private List<String> elements = new ArrayList<>();

    public LineElement(String name, String initialValue, int sequence) {
        this.name = name;
        this.initialValue = initialValue;
        this.sequence = sequence;
    }

    /**
     * Copy of this line with the same attributes and an independent element list.
     */
    public LineElement copy() {
        LineElement copy = copyWithoutElements();
        if (elements != null) {
            copy.setElements(new ArrayList<>(elements));
        }
        return copy;
    }

    /**
     * Copy of this line's attributes with an empty element list.
     */
    public LineElement copyWithoutElements() {
        LineElement copy = new LineElement();
        copy.setType(type);
        copy.setElementGuid(elementGuid);
        copy.setName(name);
        copy.setDescription(description);
        copy.setSequence(sequence);
        copy.setRequired(required);
        copy.setMinimalOccurrence(minimalOccurrence);
        copy.setMaximumOccurrence(maximumOccurrence);
        copy.setInitialValue(initialValue);
        return copy;
    }

    /**
     * @return length of the literal prefix identifying this line, 0 when absent
     */
    @JsonIgnore
    public int getInitialValueLength() {
        return initialValue != null ? initialValue.length() : 0;
    }
}
