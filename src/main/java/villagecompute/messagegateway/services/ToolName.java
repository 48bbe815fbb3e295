package villagecompute.messagegateway.services;

import villagecompute.messagegateway.integration.messaging.BatchVerb;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;

/**
 * Tools exposed by the gateway. The wire name is the lowercase constant name.
 */
public enum ToolName {

    SCHEDULE_MESSAGE("Schedule a message once, after a delay, or on a recurrence"),
    CANCEL_SCHEDULED("Cancel a scheduled message"),
    PAUSE_SCHEDULED("Pause a scheduled message"),
    RESUME_SCHEDULED("Resume a paused scheduled message"),
    LIST_SCHEDULED("List scheduled messages, optionally for one chat"),
    UPDATE_SCHEDULED("Replace the text of a scheduled message"),

    START_GRADUAL_EXPORT("Start a throttled export of a chat history"),
    PAUSE_GRADUAL_EXPORT("Pause the current gradual export"),
    RESUME_GRADUAL_EXPORT("Resume the paused gradual export"),
    CANCEL_GRADUAL_EXPORT("Cancel the current gradual export"),
    GET_GRADUAL_EXPORT_STATUS("Status and progress of the gradual export engine"),
    GET_GRADUAL_EXPORT_CONFIG("Current gradual export pacing defaults"),
    SET_GRADUAL_EXPORT_CONFIG("Change gradual export pacing"),
    QUEUE_GRADUAL_EXPORT("Queue a chat for gradual export"),
    GET_GRADUAL_EXPORT_QUEUE("List queued gradual exports"),
    CLEAR_GRADUAL_EXPORT_QUEUE("Remove all queued gradual exports"),

    GET_JOB_EVENTS("Recent scheduler, batch and export events"),

    BATCH_SEND("Send a message to several chats", BatchVerb.SEND),
    BATCH_DELETE("Delete several messages", BatchVerb.DELETE),
    BATCH_FORWARD("Forward several messages", BatchVerb.FORWARD),
    BATCH_PIN("Pin several messages", BatchVerb.PIN),
    BATCH_UNPIN("Unpin several messages", BatchVerb.UNPIN),
    BATCH_REACTION("React to several messages", BatchVerb.REACTION),
    BATCH_MARK_READ("Mark several messages as read", BatchVerb.MARK_READ);

    private final String description;
    private final BatchVerb batchVerb;

    ToolName(String description) {
        this(description, null);
    }

    ToolName(String description, BatchVerb batchVerb) {
        this.description = description;
        this.batchVerb = batchVerb;
    }

    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    public String getDescription() {
        return description;
    }

    /**
     * Host verb fanned out by this tool, empty for non-batch tools.
     */
    public Optional<BatchVerb> batchVerb() {
        return Optional.ofNullable(batchVerb);
    }

    public static Optional<ToolName> fromWire(String name) {
        if (name == null) {
            return Optional.empty();
        }
        String normalized = name.trim().toLowerCase(Locale.ROOT);
        return Arrays.stream(values()).filter(tool -> tool.wireName().equals(normalized)).findFirst();
    }
}
