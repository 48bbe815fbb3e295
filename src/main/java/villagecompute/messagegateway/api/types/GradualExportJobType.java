package villagecompute.messagegateway.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.messagegateway.data.models.GradualExportJob;

import java.time.Instant;
import java.util.Locale;

/**
 * API view of a gradual export job, used for status and queue listings.
 */
public record GradualExportJobType(long id, @JsonProperty("target_id") String targetId, String state,
        @JsonProperty("pause_reason") String pauseReason, int priority,
        @JsonProperty("messages_processed") long messagesProcessed,
        @JsonProperty("batches_completed") int batchesCompleted, @JsonProperty("bytes_written") long bytesWritten,
        @JsonProperty("failed_batches") int failedBatches, @JsonProperty("output_path") String outputPath,
        @JsonProperty("last_error") String lastError, @JsonProperty("enqueued_at") Instant enqueuedAt,
        @JsonProperty("started_at") Instant startedAt, @JsonProperty("finished_at") Instant finishedAt,
        @JsonProperty("next_action_at") Instant nextActionAt) {

    public static GradualExportJobType from(GradualExportJob job) {
        return new GradualExportJobType(job.id, job.targetId, job.state.name().toLowerCase(Locale.ROOT),
                job.pauseReason == null ? null : job.pauseReason.name().toLowerCase(Locale.ROOT), job.priority,
                job.messagesProcessed, job.batchesCompleted, job.bytesWritten, job.failedBatches, job.outputPath,
                job.lastError, job.enqueuedAt, job.startedAt, job.finishedAt, job.nextActionAt);
    }
}
