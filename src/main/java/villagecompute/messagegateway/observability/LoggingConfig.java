package villagecompute.messagegateway.observability;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.SpanContext;
import org.jboss.logging.MDC;

/**
 * Standard MDC field names and helpers for structured logging of background work.
 *
 * <p>
 * <b>Standard Log Fields:</b>
 * <ul>
 * <li>{@code trace_id} / {@code span_id} - OpenTelemetry identifiers of the current span</li>
 * <li>{@code job_id} - Scheduled message or export job id</li>
 * <li>{@code export_target} - Target whose history is being exported</li>
 * <li>{@code tool_name} - Tool being dispatched (request threads only)</li>
 * <li>{@code request_origin} - Ticker or REST path that started the work</li>
 * </ul>
 *
 * <p>
 * <b>Usage in tickers:</b>
 *
 * <pre>
 * LoggingConfig.enrichWithTraceContext();
 * LoggingConfig.setRequestOrigin("MessageSchedulerTicker");
 * try {
 *     ...
 * } finally {
 *     LoggingConfig.clearMDC();
 * }
 * </pre>
 *
 * <p>
 * <b>Thread Safety:</b> All methods operate on {@link MDC}, which is thread-local. Stages that resume on timer threads
 * must set their own context.
 */
public final class LoggingConfig {

    public static final String MDC_TRACE_ID = "trace_id";

    public static final String MDC_SPAN_ID = "span_id";

    /**
     * Scheduled message or export job id (Long as String).
     */
    public static final String MDC_JOB_ID = "job_id";

    public static final String MDC_EXPORT_TARGET = "export_target";

    public static final String MDC_TOOL_NAME = "tool_name";

    /**
     * Ticker class or REST path that initiated the work.
     */
    public static final String MDC_REQUEST_ORIGIN = "request_origin";

    private LoggingConfig() {
        // Utility class, no instantiation
    }

    /**
     * Copies trace_id and span_id of the current OpenTelemetry span into MDC. Empty strings are used when there is no
     * valid span so the log schema stays stable.
     */
    public static void enrichWithTraceContext() {
        SpanContext spanContext = Span.current().getSpanContext();

        if (spanContext.isValid()) {
            MDC.put(MDC_TRACE_ID, spanContext.getTraceId());
            MDC.put(MDC_SPAN_ID, spanContext.getSpanId());
        } else {
            MDC.put(MDC_TRACE_ID, "");
            MDC.put(MDC_SPAN_ID, "");
        }
    }

    public static void setJobId(Long jobId) {
        if (jobId != null) {
            MDC.put(MDC_JOB_ID, jobId.toString());
        }
    }

    public static void setExportTarget(String targetId) {
        if (targetId != null) {
            MDC.put(MDC_EXPORT_TARGET, targetId);
        }
    }

    public static void setToolName(String toolName) {
        if (toolName != null) {
            MDC.put(MDC_TOOL_NAME, toolName);
        }
    }

    public static void setRequestOrigin(String requestOrigin) {
        if (requestOrigin != null) {
            MDC.put(MDC_REQUEST_ORIGIN, requestOrigin);
        }
    }

    /**
     * Clears all fields set by this class. Call at the end of every tick or tool call to avoid leaking context into
     * the next task served by the same thread.
     */
    public static void clearMDC() {
        MDC.remove(MDC_TRACE_ID);
        MDC.remove(MDC_SPAN_ID);
        MDC.remove(MDC_JOB_ID);
        MDC.remove(MDC_EXPORT_TARGET);
        MDC.remove(MDC_TOOL_NAME);
        MDC.remove(MDC_REQUEST_ORIGIN);
    }
}
