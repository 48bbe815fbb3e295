package villagecompute.messagegateway.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Outcome of one item of a batch run.
 *
 * @param index
 *            position of the item in the submitted list
 * @param success
 *            whether the action completed normally
 * @param durationMs
 *            wall time spent on the item
 * @param error
 *            failure message, null on success
 * @param data
 *            action result data, empty on failure
 */
public record OperationResultType(int index, boolean success, @JsonProperty("duration_ms") long durationMs,
        String error, Map<String, Object> data) {

    public OperationResultType {
        data = data == null ? Map.of() : Map.copyOf(data);
    }

    public static OperationResultType succeeded(int index, long durationMs, Map<String, Object> data) {
        return new OperationResultType(index, true, durationMs, null, data);
    }

    public static OperationResultType failed(int index, long durationMs, String error) {
        return new OperationResultType(index, false, durationMs, error, Map.of());
    }
}
