package villagecompute.messagegateway.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Immutable result of a {@code BatchExecutor} run.
 *
 * <p>
 * {@code successful + failed} equals the number of attempted items; {@code skipped} counts items never attempted
 * because the run stopped early.
 *
 * @param operationType
 *            caller-supplied label, e.g. {@code batch_delete}
 * @param total
 *            number of submitted items
 * @param successful
 *            items whose action succeeded
 * @param failed
 *            items whose action failed
 * @param skipped
 *            items not attempted after an early stop
 * @param results
 *            per-item outcomes in submission order
 * @param errors
 *            failure messages in submission order
 * @param status
 *            aggregate status
 * @param startedAt
 *            run start
 * @param completedAt
 *            run end
 * @param totalDurationMs
 *            elapsed wall time, including rate-limit pauses
 */
public record BatchResultType(@JsonProperty("operation_type") String operationType, int total, int successful,
        int failed, int skipped, List<OperationResultType> results, List<String> errors, BatchStatus status,
        @JsonProperty("started_at") Instant startedAt, @JsonProperty("completed_at") Instant completedAt,
        @JsonProperty("total_duration_ms") long totalDurationMs) {

    public BatchResultType {
        results = List.copyOf(results);
        errors = List.copyOf(errors);
    }
}
