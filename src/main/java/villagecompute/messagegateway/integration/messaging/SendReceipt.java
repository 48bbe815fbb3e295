package villagecompute.messagegateway.integration.messaging;

import java.time.Instant;

/**
 * Host acknowledgement of a sent message.
 */
public record SendReceipt(String messageId, Instant sentAt) {
}
