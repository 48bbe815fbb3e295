package villagecompute.messagegateway.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.api.types.GradualExportConfigType;

/**
 * Deployment defaults for gradual exports, read from {@code messagegateway.export.*}.
 *
 * <p>
 * These seed the engine's configuration at startup; {@code set_gradual_export_config} changes the live defaults
 * afterwards without touching the properties.
 */
@ApplicationScoped
public class GradualExportDefaults {

    private static final Logger LOG = Logger.getLogger(GradualExportDefaults.class);

    @ConfigProperty(
            name = "messagegateway.export.min-delay-ms",
            defaultValue = "3000")
    long minDelayMs;

    @ConfigProperty(
            name = "messagegateway.export.max-delay-ms",
            defaultValue = "15000")
    long maxDelayMs;

    @ConfigProperty(
            name = "messagegateway.export.burst-pause-ms",
            defaultValue = "60000")
    long burstPauseMs;

    @ConfigProperty(
            name = "messagegateway.export.long-pause-ms",
            defaultValue = "300000")
    long longPauseMs;

    @ConfigProperty(
            name = "messagegateway.export.min-batch-size",
            defaultValue = "10")
    int minBatchSize;

    @ConfigProperty(
            name = "messagegateway.export.max-batch-size",
            defaultValue = "50")
    int maxBatchSize;

    @ConfigProperty(
            name = "messagegateway.export.batches-before-pause",
            defaultValue = "5")
    int batchesBeforePause;

    @ConfigProperty(
            name = "messagegateway.export.batches-before-long-pause",
            defaultValue = "20")
    int batchesBeforeLongPause;

    @ConfigProperty(
            name = "messagegateway.export.randomize-order",
            defaultValue = "true")
    boolean randomizeOrder;

    @ConfigProperty(
            name = "messagegateway.export.simulate-reading",
            defaultValue = "true")
    boolean simulateReading;

    @ConfigProperty(
            name = "messagegateway.export.respect-active-hours",
            defaultValue = "true")
    boolean respectActiveHours;

    @ConfigProperty(
            name = "messagegateway.export.active-hour-start",
            defaultValue = "8")
    int activeHourStart;

    @ConfigProperty(
            name = "messagegateway.export.active-hour-end",
            defaultValue = "23")
    int activeHourEnd;

    @ConfigProperty(
            name = "messagegateway.export.max-messages-per-day",
            defaultValue = "5000")
    int maxMessagesPerDay;

    @ConfigProperty(
            name = "messagegateway.export.max-messages-per-hour",
            defaultValue = "500")
    int maxMessagesPerHour;

    @ConfigProperty(
            name = "messagegateway.export.stop-on-flood-wait",
            defaultValue = "true")
    boolean stopOnFloodWait;

    @ConfigProperty(
            name = "messagegateway.export.max-retries",
            defaultValue = "3")
    int maxRetries;

    @ConfigProperty(
            name = "messagegateway.export.format",
            defaultValue = "html")
    String format;

    /**
     * Builds the configured defaults.
     *
     * @throws villagecompute.messagegateway.exceptions.ValidationException
     *             if the properties describe an invalid configuration (e.g. inverted delay range)
     */
    public GradualExportConfigType toConfig() {
        GradualExportConfigType config = new GradualExportConfigType(minDelayMs, maxDelayMs, burstPauseMs, longPauseMs,
                minBatchSize, maxBatchSize, batchesBeforePause, batchesBeforeLongPause, randomizeOrder,
                simulateReading, respectActiveHours, activeHourStart, activeHourEnd, maxMessagesPerDay,
                maxMessagesPerHour, stopOnFloodWait, maxRetries, format, null);
        LOG.debugf("Gradual export defaults: %s", config);
        return config;
    }
}
