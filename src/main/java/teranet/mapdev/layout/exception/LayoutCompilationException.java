package teranet.mapdev.layout.exception;

/**
 * Raised when a layout or mapping document cannot be parsed or traversed.
 * Fatal for the current call; the engine never retries.
 */
public class LayoutCompilationException extends RuntimeException {

    public LayoutCompilationException(String message) {
        super(message);
    }

    public LayoutCompilationException(String message, Throwable cause) {
        super(message, cause);
    }
}
