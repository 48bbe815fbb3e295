package villagecompute.messagegateway.integration.messaging;

import java.time.Instant;

/**
 * One message of a target's history as returned by the host.
 *
 * @param id
 *            host message id
 * @param date
 *            message timestamp
 * @param author
 *            display name or id of the sender, may be null
 * @param text
 *            message text, empty for media-only messages
 */
public record HistoryRecord(long id, Instant date, String author, String text) {
}
