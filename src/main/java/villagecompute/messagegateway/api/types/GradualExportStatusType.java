package villagecompute.messagegateway.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Snapshot of the gradual export engine.
 *
 * @param state
 *            {@code idle} when no job occupies the engine, otherwise the current job's state
 * @param job
 *            current (or most recently finished) job, null when none ever ran
 * @param config
 *            effective configuration of the current job, or the engine defaults when idle
 * @param messagesThisHour
 *            records written in the rolling hour
 * @param messagesToday
 *            records written in the rolling day
 * @param queueSize
 *            jobs waiting behind the current one
 * @param currentDelayMs
 *            wait before the current job's next batch, 0 when none is scheduled
 */
public record GradualExportStatusType(String state, GradualExportJobType job, GradualExportConfigType config,
        @JsonProperty("messages_this_hour") int messagesThisHour, @JsonProperty("messages_today") int messagesToday,
        @JsonProperty("queue_size") int queueSize, @JsonProperty("current_delay_ms") long currentDelayMs) {
}
