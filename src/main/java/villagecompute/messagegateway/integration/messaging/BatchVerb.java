package villagecompute.messagegateway.integration.messaging;

import java.util.Locale;

/**
 * Host actions that can be fanned out over a list of items by the batch tools.
 */
public enum BatchVerb {
    SEND, DELETE, FORWARD, PIN, UNPIN, REACTION, MARK_READ;

    /** Path segment used by the host bridge, e.g. {@code mark_read}. */
    public String pathSegment() {
        return name().toLowerCase(Locale.ROOT);
    }
}
