package villagecompute.messagegateway.api.types;

import com.fasterxml.jackson.annotation.JsonProperty;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.integration.messaging.ExportFormat;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Pacing configuration of a gradual export.
 *
 * <p>
 * Instances are always valid: the canonical constructor rejects inverted ranges and out-of-range values with a
 * {@link ValidationException} of kind {@code INVALID_CONFIG}, so a rejected update never reaches a running export.
 * Partial updates arrive as maps keyed by the snake_case wire names and are merged with {@link #withOverrides(Map)}.
 *
 * @param minDelayMs
 *            lower bound of the inter-batch delay
 * @param maxDelayMs
 *            upper bound of the inter-batch delay
 * @param burstPauseMs
 *            extra pause after {@code batchesBeforePause} consecutive batches
 * @param longPauseMs
 *            extra pause every {@code batchesBeforeLongPause} batches
 * @param minBatchSize
 *            lower bound of records fetched per batch
 * @param maxBatchSize
 *            upper bound of records fetched per batch
 * @param batchesBeforePause
 *            consecutive batches before a burst pause
 * @param batchesBeforeLongPause
 *            batches between long pauses
 * @param randomizeOrder
 *            shuffle records inside each written batch
 * @param simulateReading
 *            add a reading delay proportional to the batch's text length
 * @param respectActiveHours
 *            only run between {@code activeHourStart} and {@code activeHourEnd} local time
 * @param activeHourStart
 *            first active hour (0-23)
 * @param activeHourEnd
 *            first inactive hour (0-24); a value below {@code activeHourStart} wraps past midnight
 * @param maxMessagesPerDay
 *            records per rolling day before an automatic pause
 * @param maxMessagesPerHour
 *            records per rolling hour before an automatic pause
 * @param stopOnFloodWait
 *            pause when the host signals flood wait instead of waiting it out in place
 * @param maxRetries
 *            consecutive failed fetches tolerated before the export errors
 * @param exportFormat
 *            html, markdown or json
 * @param exportPath
 *            optional destination file; defaults to the export directory
 */
public record GradualExportConfigType(@JsonProperty("min_delay_ms") long minDelayMs,
        @JsonProperty("max_delay_ms") long maxDelayMs, @JsonProperty("burst_pause_ms") long burstPauseMs,
        @JsonProperty("long_pause_ms") long longPauseMs, @JsonProperty("min_batch_size") int minBatchSize,
        @JsonProperty("max_batch_size") int maxBatchSize, @JsonProperty("batches_before_pause") int batchesBeforePause,
        @JsonProperty("batches_before_long_pause") int batchesBeforeLongPause,
        @JsonProperty("randomize_order") boolean randomizeOrder,
        @JsonProperty("simulate_reading") boolean simulateReading,
        @JsonProperty("respect_active_hours") boolean respectActiveHours,
        @JsonProperty("active_hour_start") int activeHourStart, @JsonProperty("active_hour_end") int activeHourEnd,
        @JsonProperty("max_messages_per_day") int maxMessagesPerDay,
        @JsonProperty("max_messages_per_hour") int maxMessagesPerHour,
        @JsonProperty("stop_on_flood_wait") boolean stopOnFloodWait, @JsonProperty("max_retries") int maxRetries,
        @JsonProperty("export_format") String exportFormat, @JsonProperty("export_path") String exportPath) {

    public GradualExportConfigType {
        requireNonNegative("min_delay_ms", minDelayMs);
        requireNonNegative("max_delay_ms", maxDelayMs);
        requireNonNegative("burst_pause_ms", burstPauseMs);
        requireNonNegative("long_pause_ms", longPauseMs);
        requireOrdered("min_delay_ms", minDelayMs, "max_delay_ms", maxDelayMs);
        requirePositive("min_batch_size", minBatchSize);
        requirePositive("max_batch_size", maxBatchSize);
        requireOrdered("min_batch_size", minBatchSize, "max_batch_size", maxBatchSize);
        requirePositive("batches_before_pause", batchesBeforePause);
        requirePositive("batches_before_long_pause", batchesBeforeLongPause);
        requirePositive("max_messages_per_day", maxMessagesPerDay);
        requirePositive("max_messages_per_hour", maxMessagesPerHour);
        requireNonNegative("max_retries", maxRetries);
        if (activeHourStart < 0 || activeHourStart > 23) {
            throw ValidationException.invalidConfig("active_hour_start must be between 0 and 23");
        }
        if (activeHourEnd < 0 || activeHourEnd > 24) {
            throw ValidationException.invalidConfig("active_hour_end must be between 0 and 24");
        }
        exportFormat = ExportFormat.fromWire(exportFormat).wireName();
        if (exportPath != null && exportPath.isBlank()) {
            exportPath = null;
        }
    }

    /**
     * Built-in defaults, conservative pacing well under typical host rate limits.
     */
    public static GradualExportConfigType defaults() {
        return new GradualExportConfigType(3000, 15000, 60000, 300000, 10, 50, 5, 20, true, true, true, 8, 23, 5000, 500,
                true, 3, "html", null);
    }

    /**
     * Rebuilds a configuration persisted with {@link #toMap()}, filling missing keys from {@code base}.
     */
    public static GradualExportConfigType fromMap(Map<String, Object> values, GradualExportConfigType base) {
        return values == null || values.isEmpty() ? base : base.withOverrides(values);
    }

    public ExportFormat format() {
        return ExportFormat.fromWire(exportFormat);
    }

    /**
     * Whether {@code hour} (0-23, local time) falls inside the active window. Equal start and end mean the whole day.
     */
    public boolean isActiveHour(int hour) {
        if (activeHourStart == activeHourEnd || (activeHourStart == 0 && activeHourEnd == 24)) {
            return true;
        }
        if (activeHourStart < activeHourEnd) {
            return hour >= activeHourStart && hour < activeHourEnd;
        }
        return hour >= activeHourStart || hour < activeHourEnd;
    }

    /**
     * Returns a copy with the given wire-named fields replaced. Unknown keys and ill-typed values are rejected.
     */
    public GradualExportConfigType withOverrides(Map<String, ?> overrides) {
        Map<String, Object> merged = toMap();
        for (Map.Entry<String, ?> entry : overrides.entrySet()) {
            if (!merged.containsKey(entry.getKey())) {
                throw ValidationException.invalidConfig("Unknown config key '" + entry.getKey() + "'");
            }
            merged.put(entry.getKey(), entry.getValue());
        }
        return new GradualExportConfigType(longValue(merged, "min_delay_ms"), longValue(merged, "max_delay_ms"),
                longValue(merged, "burst_pause_ms"), longValue(merged, "long_pause_ms"),
                intValue(merged, "min_batch_size"), intValue(merged, "max_batch_size"),
                intValue(merged, "batches_before_pause"), intValue(merged, "batches_before_long_pause"),
                boolValue(merged, "randomize_order"), boolValue(merged, "simulate_reading"),
                boolValue(merged, "respect_active_hours"), intValue(merged, "active_hour_start"),
                intValue(merged, "active_hour_end"), intValue(merged, "max_messages_per_day"),
                intValue(merged, "max_messages_per_hour"), boolValue(merged, "stop_on_flood_wait"),
                intValue(merged, "max_retries"), stringValue(merged, "export_format"),
                stringValue(merged, "export_path"));
    }

    /**
     * Wire-named view used for persistence and for merging overrides.
     */
    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("min_delay_ms", minDelayMs);
        map.put("max_delay_ms", maxDelayMs);
        map.put("burst_pause_ms", burstPauseMs);
        map.put("long_pause_ms", longPauseMs);
        map.put("min_batch_size", minBatchSize);
        map.put("max_batch_size", maxBatchSize);
        map.put("batches_before_pause", batchesBeforePause);
        map.put("batches_before_long_pause", batchesBeforeLongPause);
        map.put("randomize_order", randomizeOrder);
        map.put("simulate_reading", simulateReading);
        map.put("respect_active_hours", respectActiveHours);
        map.put("active_hour_start", activeHourStart);
        map.put("active_hour_end", activeHourEnd);
        map.put("max_messages_per_day", maxMessagesPerDay);
        map.put("max_messages_per_hour", maxMessagesPerHour);
        map.put("stop_on_flood_wait", stopOnFloodWait);
        map.put("max_retries", maxRetries);
        map.put("export_format", exportFormat);
        map.put("export_path", exportPath);
        return map;
    }

    private static void requireNonNegative(String name, long value) {
        if (value < 0) {
            throw ValidationException.invalidConfig(name + " must not be negative");
        }
    }

    private static void requirePositive(String name, long value) {
        if (value <= 0) {
            throw ValidationException.invalidConfig(name + " must be positive");
        }
    }

    private static void requireOrdered(String minName, long min, String maxName, long max) {
        if (min > max) {
            throw ValidationException.invalidConfig(minName + " (" + min + ") must not exceed " + maxName + " (" + max
                    + ")");
        }
    }

    private static long longValue(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (value instanceof Number number) {
            double asDouble = number.doubleValue();
            if (asDouble != Math.rint(asDouble)) {
                throw ValidationException.invalidConfig(key + " must be a whole number");
            }
            return number.longValue();
        }
        if (value instanceof String text) {
            try {
                return Long.parseLong(text.trim());
            } catch (NumberFormatException e) {
                throw new ValidationException(ErrorKind.INVALID_CONFIG,
                        key + " must be a number", e);
            }
        }
        throw ValidationException.invalidConfig(key + " must be a number");
    }

    private static int intValue(Map<String, Object> values, String key) {
        long value = longValue(values, key);
        if (value > Integer.MAX_VALUE || value < Integer.MIN_VALUE) {
            throw ValidationException.invalidConfig(key + " is out of range");
        }
        return (int) value;
    }

    private static boolean boolValue(Map<String, Object> values, String key) {
        Object value = values.get(key);
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof String text && ("true".equalsIgnoreCase(text) || "false".equalsIgnoreCase(text))) {
            return Boolean.parseBoolean(text);
        }
        throw ValidationException.invalidConfig(key + " must be true or false");
    }

    private static String stringValue(Map<String, Object> values, String key) {
        Object value = values.get(key);
        return value == null ? null : value.toString();
    }
}
