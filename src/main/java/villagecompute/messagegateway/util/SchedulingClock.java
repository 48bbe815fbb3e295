package villagecompute.messagegateway.util;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.concurrent.CompletionStage;

/**
 * Source of the current time plus a non-blocking timer primitive.
 *
 * <p>
 * Every wait in the scheduler, batch executor and export engine goes through {@link #delay(Duration)}, so a test can
 * replace the whole notion of time with a manually advanced implementation and nothing ever sleeps a thread.
 */
public interface SchedulingClock {

    Instant now();

    /**
     * Zone used for calendar arithmetic (recurrence, active hours, local-time parsing).
     */
    ZoneId zone();

    /**
     * Returns a stage that completes once {@code duration} has elapsed. Zero or negative durations complete
     * immediately.
     */
    CompletionStage<Void> delay(Duration duration);

    default ZonedDateTime nowInZone() {
        return now().atZone(zone());
    }
}
