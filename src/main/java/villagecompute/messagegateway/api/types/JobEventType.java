package villagecompute.messagegateway.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit record of a background outcome (scheduled send, export transition, batch run).
 *
 * @param timestamp
 *            when the event happened
 * @param source
 *            emitting component: {@code scheduler}, {@code export} or {@code batch}
 * @param jobId
 *            related job id, null for batch runs
 * @param type
 *            event name, e.g. {@code fired}, {@code send_failed}, {@code auto_paused}
 * @param error
 *            whether the event reports a failure
 * @param detail
 *            free-form description
 */
public record JobEventType(Instant timestamp, String source, @JsonProperty("job_id") Long jobId, String type,
        boolean error, String detail) {
}
