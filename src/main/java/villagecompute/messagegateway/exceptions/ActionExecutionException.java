package villagecompute.messagegateway.exceptions;

/**
 * Exception thrown when a single host action (send, fetch, batch verb) fails.
 *
 * <p>
 * Treated as transient: batch runs record it per item, recurring schedules retry on their next interval.
 */
public class ActionExecutionException extends RuntimeException {

    public ActionExecutionException(String message) {
        super(message);
    }

    public ActionExecutionException(String message, Throwable cause) {
        super(message, cause);
    }
}
