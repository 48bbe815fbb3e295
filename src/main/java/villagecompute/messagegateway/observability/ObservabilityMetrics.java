package villagecompute.messagegateway.observability;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.context.Initialized;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.api.types.BatchStatus;
import villagecompute.messagegateway.services.GradualExportService;
import villagecompute.messagegateway.services.MessageSchedulerService;

import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Registers and manages custom metrics of the scheduling core.
 *
 * <p>
 * All metrics follow the naming convention {@code gateway_<category>_<metric>}.
 *
 * <p>
 * <b>Metrics Catalog:</b>
 * <ul>
 * <li><b>Gauges:</b> {@code gateway_scheduled_active} - Active scheduled messages</li>
 * <li><b>Gauges:</b> {@code gateway_export_queue_depth} - Gradual exports waiting behind the current one</li>
 * <li><b>Counters:</b> {@code gateway_schedule_fires_total{kind,result}} - Scheduled sends by outcome</li>
 * <li><b>Counters:</b> {@code gateway_batch_operations_total{operation,status}} - Batch runs by aggregate status</li>
 * <li><b>Counters:</b> {@code gateway_export_records_total} - History records written by gradual exports</li>
 * <li><b>Counters:</b> {@code gateway_export_state_changes_total{state}} - Export state transitions</li>
 * <li><b>Counters:</b> {@code gateway_tool_calls_total{tool,result}} - Tool calls by outcome</li>
 * </ul>
 *
 * <p>
 * Metrics are exported in Prometheus format at {@code /q/metrics}.
 *
 * @see LoggingConfig for structured logging field definitions
 */
@ApplicationScoped
public class ObservabilityMetrics {

    private static final Logger LOG = Logger.getLogger(ObservabilityMetrics.class);

    @Inject
    MeterRegistry registry;

    @Inject
    MessageSchedulerService schedulerService;

    @Inject
    GradualExportService exportService;

    /**
     * Counters indexed by metric name plus tag values.
     */
    private final Map<String, Counter> counters = new ConcurrentHashMap<>();

    /**
     * Registers gauges once the application scope is up.
     */
    public void registerMetrics(@Observes @Initialized(ApplicationScoped.class) Object init) {
        LOG.info("Registering gateway metrics");

        Gauge.builder("gateway_scheduled_active", schedulerService, MessageSchedulerService::activeCount)
                .description("Scheduled messages currently eligible to fire").register(registry);

        Gauge.builder("gateway_export_queue_depth", exportService, GradualExportService::queueSize)
                .description("Gradual exports queued behind the current one").register(registry);

        LOG.infof("Gateway metrics registration complete. Access metrics at /q/metrics");
    }

    public void incrementScheduleFire(String kind, boolean success) {
        counter("gateway_schedule_fires_total", "Scheduled message sends",
                List.of(Tag.of("kind", lower(kind)), Tag.of("result", success ? "success" : "failure"))).increment();
    }

    public void incrementBatchRun(String operationType, BatchStatus status) {
        counter("gateway_batch_operations_total", "Batch executor runs",
                List.of(Tag.of("operation", operationType), Tag.of("status", lower(status.name())))).increment();
    }

    public void recordExportRecords(long count) {
        if (count > 0) {
            counter("gateway_export_records_total", "History records written by gradual exports", List.of())
                    .increment(count);
        }
    }

    public void incrementExportStateChange(String state) {
        counter("gateway_export_state_changes_total", "Gradual export state transitions",
                List.of(Tag.of("state", lower(state)))).increment();
    }

    public void incrementToolCall(String tool, boolean success) {
        counter("gateway_tool_calls_total", "Tool calls",
                List.of(Tag.of("tool", tool), Tag.of("result", success ? "success" : "failure"))).increment();
    }

    private Counter counter(String name, String description, List<Tag> tags) {
        StringBuilder key = new StringBuilder(name);
        tags.forEach(tag -> key.append(':').append(tag.getValue()));
        return counters.computeIfAbsent(key.toString(),
                k -> Counter.builder(name).description(description).tags(tags).register(registry));
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
