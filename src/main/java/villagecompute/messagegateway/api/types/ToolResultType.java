package villagecompute.messagegateway.api.types;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.messagegateway.exceptions.ErrorKind;

/**
 * Envelope returned by every tool call.
 *
 * @param success
 *            whether the call was applied
 * @param errorKind
 *            machine-readable failure category, null on success
 * @param message
 *            human-readable summary or failure message
 * @param data
 *            tool-specific result
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record ToolResultType(boolean success, @JsonProperty("error_kind") String errorKind, String message,
        Object data) {

    public static ToolResultType ok(Object data) {
        return new ToolResultType(true, null, null, data);
    }

    public static ToolResultType ok(String message, Object data) {
        return new ToolResultType(true, null, message, data);
    }

    public static ToolResultType error(ErrorKind kind, String message) {
        return new ToolResultType(false, kind.wireName(), message, null);
    }
}
