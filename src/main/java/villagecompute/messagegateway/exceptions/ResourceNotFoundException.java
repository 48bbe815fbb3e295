package villagecompute.messagegateway.exceptions;

/**
 * Exception thrown when a scheduled message or export job id is unknown.
 *
 * <p>
 * Extends RuntimeException per project standards.
 */
public class ResourceNotFoundException extends RuntimeException {

    public ResourceNotFoundException(String message) {
        super(message);
    }

    public ResourceNotFoundException(String message, Throwable cause) {
        super(message, cause);
    }
}
