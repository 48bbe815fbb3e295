package villagecompute.messagegateway.services;

import com.fasterxml.jackson.databind.JsonNode;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.api.types.GradualExportJobType;
import villagecompute.messagegateway.api.types.ScheduledMessageType;
import villagecompute.messagegateway.api.types.ToolResultType;
import villagecompute.messagegateway.data.models.ScheduledMessage;
import villagecompute.messagegateway.data.models.ScheduledMessage.RecurrencePattern;
import villagecompute.messagegateway.exceptions.ActionExecutionException;
import villagecompute.messagegateway.exceptions.AlreadyRunningException;
import villagecompute.messagegateway.exceptions.BackoffSignalException;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.JobStoreException;
import villagecompute.messagegateway.exceptions.ResourceNotFoundException;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.integration.messaging.ActionExecutor;
import villagecompute.messagegateway.integration.messaging.BatchVerb;
import villagecompute.messagegateway.observability.LoggingConfig;
import villagecompute.messagegateway.observability.ObservabilityMetrics;
import villagecompute.messagegateway.util.Futures;
import villagecompute.messagegateway.util.SchedulingClock;
import villagecompute.messagegateway.util.TimeParsing;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;

/**
 * Routes tool calls to the scheduler, the gradual export engine and the batch executor.
 *
 * <p>
 * Every call completes with a {@link ToolResultType}; exceptions are mapped to an {@link ErrorKind} and never escape.
 * Argument names follow the gateway's public tool schema ({@code chat_id}, {@code text}, {@code schedule_id}, ...).
 */
@ApplicationScoped
public class ToolDispatcher {

    private static final Logger LOG = Logger.getLogger(ToolDispatcher.class);

    private static final int DEFAULT_EVENT_LIMIT = 50;

    @Inject
    MessageSchedulerService scheduler;

    @Inject
    GradualExportService exports;

    @Inject
    BatchExecutor batchExecutor;

    @Inject
    ActionExecutor actionExecutor;

    @Inject
    JobAuditService audit;

    @Inject
    ObservabilityMetrics metrics;

    @Inject
    SchedulingClock clock;

    @ConfigProperty(
            name = "messagegateway.batch.default-concurrency-limit",
            defaultValue = "10")
    int defaultConcurrencyLimit = 10;

    @ConfigProperty(
            name = "messagegateway.batch.default-rate-limit-delay-ms",
            defaultValue = "1000")
    long defaultRateLimitDelayMs = 1000;

    /**
     * Runs the tool named {@code toolName}.
     *
     * @param arguments
     *            JSON object of tool arguments, may be null
     * @return stage that always completes normally
     */
    public CompletionStage<ToolResultType> dispatch(String toolName, JsonNode arguments) {
        ToolName tool = ToolName.fromWire(toolName).orElse(null);
        if (tool == null) {
            LOG.warnf("Unknown tool requested: %s", toolName);
            metrics.incrementToolCall("unknown", false);
            return CompletableFuture
                    .completedFuture(ToolResultType.error(ErrorKind.UNKNOWN_TOOL, "Unknown tool: " + toolName));
        }

        LoggingConfig.setToolName(tool.wireName());
        CompletionStage<ToolResultType> stage;
        try {
            LOG.debugf("Dispatching tool %s", tool.wireName());
            stage = execute(tool, ToolArguments.of(arguments));
        } catch (RuntimeException e) {
            stage = CompletableFuture.completedFuture(toError(tool, e));
        } finally {
            LoggingConfig.clearMDC();
        }
        return stage.exceptionally(failure -> toError(tool, Futures.unwrap(failure))).thenApply(result -> {
            metrics.incrementToolCall(tool.wireName(), result.success());
            return result;
        });
    }

    private CompletionStage<ToolResultType> execute(ToolName tool, ToolArguments args) {
        return switch (tool) {
            case SCHEDULE_MESSAGE -> done(scheduleMessage(args));
            case CANCEL_SCHEDULED -> done(
                    ToolResultType.ok("Scheduled message cancelled", scheduled(scheduler.cancel(scheduleId(args)))));
            case PAUSE_SCHEDULED -> done(
                    ToolResultType.ok("Scheduled message paused", scheduled(scheduler.pause(scheduleId(args)))));
            case RESUME_SCHEDULED -> done(
                    ToolResultType.ok("Scheduled message resumed", scheduled(scheduler.resume(scheduleId(args)))));
            case UPDATE_SCHEDULED -> done(ToolResultType.ok("Scheduled message updated",
                    scheduled(scheduler.update(scheduleId(args), args.requiredText("new_text")))));
            case LIST_SCHEDULED -> done(listScheduled(args));
            case START_GRADUAL_EXPORT -> done(startExport(args));
            case PAUSE_GRADUAL_EXPORT -> done(ToolResultType.ok(exports.pause()));
            case RESUME_GRADUAL_EXPORT -> done(ToolResultType.ok(exports.resume()));
            case CANCEL_GRADUAL_EXPORT -> done(ToolResultType.ok(exports.cancel()));
            case GET_GRADUAL_EXPORT_STATUS -> done(ToolResultType.ok(exports.status()));
            case GET_GRADUAL_EXPORT_CONFIG -> done(ToolResultType.ok(exports.getConfig()));
            case SET_GRADUAL_EXPORT_CONFIG -> done(
                    ToolResultType.ok("Configuration updated", exports.setConfig(args.remainingAsMap(Set.of()))));
            case QUEUE_GRADUAL_EXPORT -> done(queueExport(args));
            case GET_GRADUAL_EXPORT_QUEUE -> done(
                    ToolResultType.ok(exports.getQueue().stream().map(GradualExportJobType::from).toList()));
            case CLEAR_GRADUAL_EXPORT_QUEUE -> {
                int removed = exports.clearQueue();
                yield done(ToolResultType.ok("Removed " + removed + " queued exports", Map.of("removed", removed)));
            }
            case GET_JOB_EVENTS -> done(
                    ToolResultType.ok(audit.recent(args.optionalInt("limit").orElse(DEFAULT_EVENT_LIMIT))));
            case BATCH_SEND, BATCH_DELETE, BATCH_FORWARD, BATCH_PIN, BATCH_UNPIN, BATCH_REACTION, BATCH_MARK_READ ->
                runBatch(tool, args);
        };
    }

    // Scheduler tools

    private ToolResultType scheduleMessage(ToolArguments args) {
        String chatId = args.requiredText("chat_id");
        String text = args.requiredText("text");
        String scheduleType = args.requiredText("schedule_type").toLowerCase(Locale.ROOT);
        String createdBy = args.optionalText("created_by").orElse("tool");

        ScheduledMessage created = switch (scheduleType) {
            case "once" -> scheduler.scheduleOnce(chatId, text, args.requiredText("when"), createdBy);
            case "delayed" -> scheduler.scheduleDelayed(chatId, text, delaySeconds(args), createdBy);
            case "recurring" -> {
                Instant start = args.optionalText("when")
                        .map(when -> TimeParsing.parseInstant(when, clock.zone())).orElse(null);
                yield scheduler.scheduleRecurring(chatId, text, start, pattern(args),
                        args.optionalText("expression").orElse(null),
                        args.optionalInt("max_occurrences").orElse(-1), createdBy);
            }
            default -> throw new ValidationException(ErrorKind.INVALID_ARGUMENT,
                    "schedule_type must be once, delayed or recurring, got '" + scheduleType + "'");
        };
        return ToolResultType.ok("Scheduled message " + created.id, scheduled(created));
    }

    private static long delaySeconds(ToolArguments args) {
        return args.optionalLong("when").or(() -> args.optionalLong("delay_seconds"))
                .orElseThrow(() -> new ValidationException(ErrorKind.INVALID_ARGUMENT,
                        "when (delay in seconds) is required for delayed messages"));
    }

    private static RecurrencePattern pattern(ToolArguments args) {
        String value = args.optionalText("pattern").orElseThrow(
                () -> new ValidationException(ErrorKind.INVALID_ARGUMENT, "pattern is required for recurring messages"));
        try {
            RecurrencePattern pattern = RecurrencePattern.valueOf(value.trim().toUpperCase(Locale.ROOT));
            if (pattern == RecurrencePattern.NONE) {
                throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "pattern must not be none");
            }
            return pattern;
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT,
                    "pattern must be hourly, daily, weekly, monthly or custom", e);
        }
    }

    private ToolResultType listScheduled(ToolArguments args) {
        List<ScheduledMessageType> messages = scheduler
                .list(args.optionalText("chat_id").orElse(null), args.optionalBoolean("include_inactive").orElse(false))
                .stream().map(ScheduledMessageType::from).toList();
        return ToolResultType.ok(messages.size() + " scheduled messages", messages);
    }

    private static long scheduleId(ToolArguments args) {
        return args.requiredLong("schedule_id");
    }

    private static ScheduledMessageType scheduled(ScheduledMessage message) {
        return ScheduledMessageType.from(message);
    }

    // Export tools

    private ToolResultType startExport(ToolArguments args) {
        String chatId = args.requiredText("chat_id");
        GradualExportJobType job = GradualExportJobType
                .from(exports.start(chatId, args.remainingAsMap(Set.of("chat_id"))));
        return ToolResultType.ok("Gradual export of " + chatId + " started", job);
    }

    private ToolResultType queueExport(ToolArguments args) {
        String chatId = args.requiredText("chat_id");
        int priority = args.optionalInt("priority").orElse(0);
        GradualExportJobType job = GradualExportJobType
                .from(exports.queue(chatId, priority, args.remainingAsMap(Set.of("chat_id", "priority"))));
        return ToolResultType.ok("Export of " + chatId + " is " + job.state(), job);
    }

    // Batch tools

    private CompletionStage<ToolResultType> runBatch(ToolName tool, ToolArguments args) {
        BatchVerb verb = tool.batchVerb().orElseThrow();
        BatchExecutor.Options options = new BatchExecutor.Options(
                args.optionalInt("concurrency_limit").orElse(defaultConcurrencyLimit),
                Duration.ofMillis(args.optionalLong("rate_limit_delay_ms").orElse(defaultRateLimitDelayMs)),
                args.optionalBoolean("continue_on_error").orElse(true));

        Map<String, Object> params = new HashMap<>();
        List<String> items;
        String target;
        switch (verb) {
            case SEND -> {
                items = args.requiredIdList("chat_ids");
                target = null;
                params.put("text", args.optionalText("message").or(() -> args.optionalText("text"))
                        .orElseThrow(() -> new ValidationException(ErrorKind.INVALID_ARGUMENT, "message is required")));
            }
            case FORWARD -> {
                items = args.requiredIdList("message_ids");
                target = args.requiredText("from_chat_id");
                params.put("to_chat_id", args.requiredText("to_chat_id"));
            }
            case REACTION -> {
                items = args.requiredIdList("message_ids");
                target = args.requiredText("chat_id");
                params.put("emoji", args.requiredText("emoji"));
            }
            default -> {
                items = args.requiredIdList("message_ids");
                target = args.requiredText("chat_id");
            }
        }

        Map<String, Object> fixedParams = Map.copyOf(params);
        return batchExecutor.run(tool.wireName(), items,
                item -> actionExecutor.perform(verb, target != null ? target : item, item, fixedParams), options)
                .thenApply(result -> {
                    audit.info(JobAuditService.SOURCE_BATCH, null, tool.wireName(),
                            result.status() + ": " + result.successful() + "/" + result.total() + " succeeded");
                    return new ToolResultType(result.successful() > 0 || result.total() == 0, null,
                            lower(result.status().name()) + ": " + result.successful() + " of " + result.total()
                                    + " succeeded",
                            result);
                });
    }

    // Error mapping

    private ToolResultType toError(ToolName tool, Throwable failure) {
        ErrorKind kind = kindOf(failure);
        if (kind == ErrorKind.INTERNAL) {
            LOG.errorf(failure, "Tool %s failed unexpectedly", tool.wireName());
        } else {
            LOG.debugf("Tool %s rejected (%s): %s", tool.wireName(), kind.wireName(), failure.getMessage());
        }
        return ToolResultType.error(kind, Futures.describe(failure));
    }

    static ErrorKind kindOf(Throwable failure) {
        if (failure instanceof ValidationException validation) {
            return validation.getKind();
        }
        if (failure instanceof ResourceNotFoundException) {
            return ErrorKind.NOT_FOUND;
        }
        if (failure instanceof AlreadyRunningException) {
            return ErrorKind.ALREADY_RUNNING;
        }
        if (failure instanceof JobStoreException) {
            return ErrorKind.PERSISTENCE;
        }
        if (failure instanceof BackoffSignalException) {
            return ErrorKind.BACKOFF;
        }
        if (failure instanceof ActionExecutionException) {
            return ErrorKind.EXECUTION;
        }
        return ErrorKind.INTERNAL;
    }

    private static CompletionStage<ToolResultType> done(ToolResultType result) {
        return CompletableFuture.completedFuture(result);
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
