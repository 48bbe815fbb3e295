package villagecompute.messagegateway.exceptions;

/**
 * Exception thrown when the messaging host reports that the gateway is being rate limited (flood wait).
 *
 * <p>
 * This is not an error from the engine's point of view: the gradual export pauses (or waits out the signal) and
 * resumes automatically.
 *
 * <p>
 * All exceptions in this project extend RuntimeException per project standards.
 */
public class BackoffSignalException extends RuntimeException {

    private final long waitSeconds;

    public BackoffSignalException(long waitSeconds, String message) {
        super(message);
        this.waitSeconds = waitSeconds;
    }

    public BackoffSignalException(long waitSeconds, String message, Throwable cause) {
        super(message, cause);
        this.waitSeconds = waitSeconds;
    }

    /**
     * @return seconds the host asked us to wait, 0 when unknown
     */
    public long getWaitSeconds() {
        return waitSeconds;
    }
}
