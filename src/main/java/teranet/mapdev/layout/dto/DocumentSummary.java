package teranet.mapdev.layout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDateTime;

/**
 * Counts describing one parsed instance document.
 */
@Data
@NoArgsConstructor
public class DocumentSummary {

    @JsonProperty("total_lines")
    private int totalLines;

    @JsonProperty("total_fields")
    private int totalFields;

    @JsonProperty("valid_fields")
    private int validFields;

    @JsonProperty("warning_fields")
    private int warningFields;

    @JsonProperty("error_fields")
    private int errorFields;

    @JsonProperty("document_type")
    private String documentType;

    @JsonProperty("layout_name")
    private String layoutName;

    @JsonProperty("processing_date")
    private LocalDateTime processingDate;

    @JsonProperty("expected_lines")
    private int expectedLines;

    @JsonProperty("present_lines")
    private int presentLines;

    @JsonProperty("missing_lines")
    private int missingLines;

    @JsonProperty("compliance_rate")
    public double getComplianceRate() {
        return totalFields > 0 ? (double) validFields / totalFields * 100 : 0;
    }

    @JsonProperty("structure_rate")
    public double getStructureRate() {
        return expectedLines > 0 ? (double) presentLines / expectedLines * 100 : 0;
    }
}
