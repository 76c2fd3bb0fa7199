package teranet.mapdev.layout.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;
import teranet.mapdev.layout.model.FormatType;
import teranet.mapdev.layout.model.ParsedField;

import java.util.ArrayList;
import java.util.List;

/**
 * Outcome of decomposing one instance document against a layout.
 *
 * Parsing never throws for bad content: a failure is reported through
 * {@code success=false} and {@code errorMessage}.
 */
@Data
@NoArgsConstructor
public class ParsingResult {

    @JsonProperty("success")
    private boolean success;

    @JsonProperty("error_message")
    private String errorMessage;

    @JsonProperty("format")
    private FormatType format = FormatType.UNKNOWN;

    @JsonProperty("line_count")
    private int lineCount;

    @JsonProperty("parsed_fields")
    private List<ParsedField> parsedFields = new ArrayList<>();

    /** "Line n: preview..." for each physical line matching no definition */
    @JsonProperty("unidentified_lines")
    private List<String> unidentifiedLines = new ArrayList<>();

    /** Names of lines present fewer times than their minimal occurrence */
    @JsonProperty("lines_below_minimum")
    private List<String> linesBelowMinimum = new ArrayList<>();

    @JsonProperty("lines_present")
    private List<String> linesPresent = new ArrayList<>();

    @JsonProperty("summary")
    private DocumentSummary summary;

    public static ParsingResult failed(String errorMessage) {
        ParsingResult result = new ParsingResult();
        result.setSuccess(false);
        result.setErrorMessage(errorMessage);
        return result;
    }
}
