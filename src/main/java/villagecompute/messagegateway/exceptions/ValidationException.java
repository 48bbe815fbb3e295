package villagecompute.messagegateway.exceptions;

/**
 * Exception thrown when a request is rejected before any state is touched (unparsable time, inverted configuration
 * range, illegal state transition).
 *
 * <p>
 * Extends RuntimeException per project standards. The {@link ErrorKind} narrows the reason so the tool surface can
 * report it without parsing the message.
 */
public class ValidationException extends RuntimeException {

    private final ErrorKind kind;

    public ValidationException(String message) {
        this(ErrorKind.INVALID_ARGUMENT, message);
    }

    public ValidationException(ErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public ValidationException(ErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public ErrorKind getKind() {
        return kind;
    }

    public static ValidationException invalidTime(String message, Throwable cause) {
        return new ValidationException(ErrorKind.INVALID_TIME, message, cause);
    }

    public static ValidationException invalidConfig(String message) {
        return new ValidationException(ErrorKind.INVALID_CONFIG, message);
    }

    public static ValidationException invalidState(String message) {
        return new ValidationException(ErrorKind.INVALID_STATE, message);
    }
}
