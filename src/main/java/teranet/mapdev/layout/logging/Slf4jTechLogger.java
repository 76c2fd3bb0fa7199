package teranet.mapdev.layout.logging;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

/**
 * Forwards technical entries to SLF4J under the "teranet.mapdev.layout.tech" category.
 *
 * Format: [endpoint] message (request: requestId)
 */
@Component
public class Slf4jTechLogger implements TechLogger {

    private static final Logger logger = LoggerFactory.getLogger("teranet.mapdev.layout.tech");

    @Override
    public void logTechnical(TechLogEntry entry) {
        if (entry == null) {
            return;
        }

        TechLogEntry.Level level = entry.getLevel() != null ? entry.getLevel() : TechLogEntry.Level.INFO;
        String requestId = entry.getRequestId() != null ? entry.getRequestId() : "-";

        switch (level) {
            case DEBUG:
                logger.debug("[{}] {} (request: {})", entry.getEndpoint(), entry.getMessage(), requestId);
                break;
            case WARN:
                logger.warn("[{}] {} (request: {})", entry.getEndpoint(), entry.getMessage(), requestId);
                break;
            case ERROR:
                logger.error("[{}] {} (request: {})", entry.getEndpoint(), entry.getMessage(), requestId);
                break;
            default:
                logger.info("[{}] {} (request: {})", entry.getEndpoint(), entry.getMessage(), requestId);
        }
    }
}
