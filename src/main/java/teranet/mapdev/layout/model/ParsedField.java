package teranet.mapdev.layout.model;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Value of one field cut out of one physical line of an instance document.
 */
@Data
@NoArgsConstructor
public class ParsedField {

    public static final String STATUS_OK = "ok";
    public static final String STATUS_WARNING = "warning";
    public static final String STATUS_ERROR = "error";

    @JsonProperty("line_name")
    private String lineName;

    @JsonProperty("field_name")
    private String fieldName;

    @JsonProperty("sequence")
    private int sequence;

    /** 1-based start position within the line */
    @JsonProperty("start")
    private int start;

    @JsonProperty("length")
    private int length;

    @JsonProperty("value")
    private String value;

    @JsonProperty("status")
    private String status = STATUS_OK;

    @JsonProperty("is_required")
    private boolean required;

    @JsonProperty("occurrence")
    private int occurrence = 1;

    @JsonProperty("line_sequence")
    private String lineSequence;

    public String getFullPath() {
        return lineName + "." + fieldName;
    }
}
