package teranet.mapdev.layout.util;

import org.slf4j.MDC;

import java.util.UUID;

/**
 * Manages the correlation ID that tags every log line of one engine request.
 * Uses SLF4J MDC (Mapped Diagnostic Context) for thread-local storage.
 *
 * Usage:
 * - Set by the command-line runner for each invocation
 * - Copied into every TechLogEntry as its request ID
 */
public class CorrelationIdUtil {

    private static final String CORRELATION_ID_KEY = "correlationId";
    private static final String NO_CORRELATION_ID = "NO-CORRELATION-ID";

    private CorrelationIdUtil() {
    }

    /**
     * Gets the current correlation ID from MDC
     * @return correlation ID or "NO-CORRELATION-ID" if not set
     */
    public static String getCurrentCorrelationId() {
        String correlationId = MDC.get(CORRELATION_ID_KEY);
        return correlationId != null ? correlationId : NO_CORRELATION_ID;
    }

    /**
     * Sets a correlation ID in MDC
     * @param correlationId correlation ID to set
     */
    public static void setCorrelationId(String correlationId) {
        MDC.put(CORRELATION_ID_KEY, correlationId);
    }

    /**
     * Generates a new random correlation ID and stores it in MDC
     * @return the generated ID
     */
    public static String startNewCorrelationId() {
        String correlationId = UUID.randomUUID().toString();
        setCorrelationId(correlationId);
        return correlationId;
    }

    /**
     * Removes correlation ID from MDC
     * IMPORTANT: Always call this in finally blocks to prevent leaking IDs across pooled threads
     */
    public static void clearCorrelationId() {
        MDC.remove(CORRELATION_ID_KEY);
    }

    /**
     * Checks if correlation ID is set
     * @return true if correlation ID exists in MDC
     */
    public static boolean hasCorrelationId() {
        return MDC.get(CORRELATION_ID_KEY) != null;
    }
}
