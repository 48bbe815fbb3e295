package villagecompute.messagegateway.exceptions;

/**
 * Exception thrown when a gradual export is started while another export still occupies the engine (running or
 * paused). Callers should queue the target instead.
 */
public class AlreadyRunningException extends RuntimeException {

    public AlreadyRunningException(String message) {
        super(message);
    }

    public AlreadyRunningException(String message, Throwable cause) {
        super(message, cause);
    }
}
