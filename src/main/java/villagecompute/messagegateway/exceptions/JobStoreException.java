package villagecompute.messagegateway.exceptions;

/**
 * Exception thrown when the job store cannot persist or load a record.
 *
 * <p>
 * Mutating operations surface this to their caller; the in-memory job state is left untouched when it is thrown.
 */
public class JobStoreException extends RuntimeException {

    public JobStoreException(String message) {
        super(message);
    }

    public JobStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
