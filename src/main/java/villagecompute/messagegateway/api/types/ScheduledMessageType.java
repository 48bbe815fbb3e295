package villagecompute.messagegateway.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.messagegateway.data.models.ScheduledMessage;

import java.time.Instant;
import java.util.Locale;

/**
 * API view of a scheduled message.
 */
public record ScheduledMessageType(long id, String target, String payload,
        @JsonProperty("schedule_kind") String scheduleKind, @JsonProperty("scheduled_time") Instant scheduledTime,
        @JsonProperty("delay_seconds") Long delaySeconds, @JsonProperty("recurrence_pattern") String recurrencePattern,
        @JsonProperty("recurrence_expression") String recurrenceExpression,
        @JsonProperty("start_time") Instant startTime, @JsonProperty("max_occurrences") int maxOccurrences,
        @JsonProperty("occurrences_sent") int occurrencesSent, @JsonProperty("last_sent") Instant lastSent,
        @JsonProperty("next_scheduled") Instant nextScheduled, String status,
        @JsonProperty("is_active") boolean active, @JsonProperty("last_error") String lastError,
        @JsonProperty("created_by") String createdBy, @JsonProperty("created_at") Instant createdAt) {

    public static ScheduledMessageType from(ScheduledMessage message) {
        return new ScheduledMessageType(message.id, message.target, message.payload,
                message.scheduleKind.name().toLowerCase(Locale.ROOT), message.scheduledTime,
                message.delaySeconds, message.recurrencePattern.name().toLowerCase(Locale.ROOT),
                message.recurrenceExpression, message.startTime, message.maxOccurrences, message.occurrencesSent,
                message.lastSent, message.nextScheduled, message.status.name().toLowerCase(Locale.ROOT),
                message.isActive(), message.lastError, message.createdBy, message.createdAt);
    }
}
