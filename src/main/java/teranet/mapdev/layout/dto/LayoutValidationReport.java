package teranet.mapdev.layout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Flat, pre-ordered validation results of a layout with summary counts.
 */
@Data
@NoArgsConstructor
public class LayoutValidationReport {

    @JsonProperty("layout_guid")
    private String layoutGuid;

    @JsonProperty("layout_name")
    private String layoutName;

    @JsonProperty("expected_line_length")
    private int expectedLineLength;

    /** true when the width came from the per-layout line size configuration */
    @JsonProperty("configured_width")
    private boolean configuredWidth;

    @JsonProperty("results")
    private List<LineValidationResult> results = new ArrayList<>();

    public LayoutValidationReport(String layoutGuid, String layoutName, int expectedLineLength,
            boolean configuredWidth, List<LineValidationResult> results) {
        this.layoutGuid = layoutGuid;
        this.layoutName = layoutName;
        this.expectedLineLength = expectedLineLength;
        this.configuredWidth = configuredWidth;
        this.results = results != null ? results : new ArrayList<>();
    }

    @JsonProperty("valid_lines")
    public long getValidLineCount() {
        return results.stream().filter(r -> r.isValid() && !r.isHasChildren()).count();
    }

    @JsonProperty("invalid_lines")
    public long getInvalidLineCount() {
        return results.stream().filter(r -> !r.isValid()).count();
    }

    @JsonProperty("lines_with_children")
    public long getContainerLineCount() {
        return results.stream().filter(LineValidationResult::isHasChildren).count();
    }

    @JsonProperty("variable_width_lines")
    public long getVariableWidthLineCount() {
        return results.stream()
                .filter(r -> r.isValid() && r.isHasChildren() && r.getTotalLength() != expectedLineLength)
                .count();
    }

    @JsonProperty("all_valid")
    public boolean isAllValid() {
        return results.stream().allMatch(LineValidationResult::isValid);
    }
}
