package teranet.mapdev.layout.logging;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;
import teranet.mapdev.layout.util.CorrelationIdUtil;

/**
 * Structured technical log entry handed to a {@link TechLogger}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
public class TechLogEntry {

    public enum Level {
        DEBUG, INFO, WARN, ERROR
    }

    private String requestId;
    private Level level;
    private String endpoint;
    private String message;

    /**
     * Entry tagged with the correlation ID of the current thread.
     */
    public static TechLogEntry of(Level level, String endpoint, String message) {
        return new TechLogEntry(CorrelationIdUtil.getCurrentCorrelationId(), level, endpoint, message);
    }
}
