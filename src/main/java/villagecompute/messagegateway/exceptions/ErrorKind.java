package villagecompute.messagegateway.exceptions;

import java.util.Locale;

/**
 * Machine-readable failure categories returned to tool callers alongside a human-readable message.
 *
 * <p>
 * The wire value is the lower-case enum name (e.g. {@code invalid_time}).
 */
public enum ErrorKind {
    INVALID_TIME, INVALID_CONFIG, INVALID_ARGUMENT, INVALID_STATE, NOT_FOUND, ALREADY_RUNNING, PERSISTENCE, EXECUTION,
    BACKOFF, UNKNOWN_TOOL, INTERNAL;

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }
}
