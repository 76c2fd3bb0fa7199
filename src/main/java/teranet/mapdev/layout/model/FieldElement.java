package teranet.mapdev.layout.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * One fixed-width field within a line definition.
 *
 * A field named "Sequencia" (any case) holds the 6-digit running record counter and is
 * accounted separately from the other fields of its line.
 */
@Data
@NoArgsConstructor
public class FieldElement {

    public static final String SEQUENCE_FIELD_NAME = "Sequencia";
    public static final int SEQUENCE_FIELD_LENGTH = 6;

    @JsonProperty("type")
    private String type = ElementKind.FIELD.getDiscriminator();

    @JsonProperty("elementGuid")
    private String elementGuid;

    @JsonProperty("name")
    private String name;

    @JsonProperty("description")
    private String description;

    @JsonProperty("sequence")
    private int sequence;

    @JsonProperty("lengthField")
    private int lengthField;

    @JsonProperty("isRequired")
    private boolean required;

    @JsonProperty("startValue")
    private int startValue;

    @JsonProperty("alignmentType")
    private AlignmentType alignmentType = AlignmentType.NONE;

    @JsonProperty("isStaticValue")
    private boolean staticValue;

    @JsonProperty("isSequential")
    private boolean sequential;

    @JsonProperty("dataTypeGuid")
    private String dataTypeGuid;

    public FieldElement(String name, int sequence, int lengthField) {
        this.name = name;
        this.sequence = sequence;
        this.lengthField = lengthField;
    }

    /**
     * @return true if this is the record counter field
     */
    @JsonIgnore
    public boolean isSequenceField() {
        return name != null && SEQUENCE_FIELD_NAME.equalsIgnoreCase(name);
    }
}
