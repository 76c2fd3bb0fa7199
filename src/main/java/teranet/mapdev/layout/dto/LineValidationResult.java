package teranet.mapdev.layout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Width check of one line definition, produced fresh by each validation pass.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class LineValidationResult {

    @JsonProperty("line_name")
    private String lineName;

    @JsonProperty("initial_value")
    private String initialValue;

    @JsonProperty("total_length")
    private int totalLength;

    @JsonProperty("expected_length")
    private int expectedLength;

    @JsonProperty("is_valid")
    private boolean valid;

    @JsonProperty("has_children")
    private boolean hasChildren;

    @JsonProperty("field_count")
    private int fieldCount;

    @JsonProperty("child_count")
    private int childCount;

    /** 0 for top-level lines */
    @JsonProperty("depth")
    private int depth;

    /**
     * @return expected minus actual width; negative when the line is too long
     */
    public int getDifference() {
        return expectedLength - totalLength;
    }
}
