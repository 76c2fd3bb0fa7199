package teranet.mapdev.layout.logging;

/**
 * Sink for the technical log entries the layout engine emits at every significant step.
 *
 * Engine services receive an implementation by injection and never write output themselves.
 * The default implementation is {@link Slf4jTechLogger}; an audit or search-backed sink can
 * replace it by declaring another bean.
 */
public interface TechLogger {

    /**
     * Record one technical entry.
     *
     * @param entry the entry; implementations must tolerate a null level or request ID
     */
    void logTechnical(TechLogEntry entry);

    default void debug(String endpoint, String message) {
        logTechnical(TechLogEntry.of(TechLogEntry.Level.DEBUG, endpoint, message));
    }

    default void info(String endpoint, String message) {
        logTechnical(TechLogEntry.of(TechLogEntry.Level.INFO, endpoint, message));
    }

    default void warn(String endpoint, String message) {
        logTechnical(TechLogEntry.of(TechLogEntry.Level.WARN, endpoint, message));
    }

    default void error(String endpoint, String message) {
        logTechnical(TechLogEntry.of(TechLogEntry.Level.ERROR, endpoint, message));
    }
}
