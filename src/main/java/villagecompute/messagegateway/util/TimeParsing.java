package villagecompute.messagegateway.util;

import villagecompute.messagegateway.exceptions.ValidationException;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.time.temporal.TemporalAccessor;

/**
 * Parses user-supplied ISO-8601 timestamps.
 *
 * <p>
 * Accepts zoned ({@code 2025-03-01T10:00:00+01:00[Europe/Paris]}), offset ({@code 2025-03-01T10:00:00Z}) and local
 * ({@code 2025-03-01T10:00:00}) date-times. Local values are interpreted in the supplied zone.
 */
public final class TimeParsing {

    private TimeParsing() {
        // Utility class, no instantiation
    }

    /**
     * @throws ValidationException
     *             with kind {@code INVALID_TIME} when the value is blank or not an ISO-8601 date-time
     */
    public static Instant parseInstant(String value, ZoneId zone) {
        if (value == null || value.isBlank()) {
            throw ValidationException.invalidTime("Time is required", null);
        }
        TemporalAccessor parsed;
        try {
            parsed = DateTimeFormatter.ISO_DATE_TIME.parseBest(value.trim(), ZonedDateTime::from, OffsetDateTime::from,
                    LocalDateTime::from);
        } catch (DateTimeParseException e) {
            throw ValidationException.invalidTime("Unparsable time '" + value + "', expected ISO-8601", e);
        }
        if (parsed instanceof ZonedDateTime zoned) {
            return zoned.toInstant();
        }
        if (parsed instanceof OffsetDateTime offset) {
            return offset.toInstant();
        }
        return ((LocalDateTime) parsed).atZone(zone).toInstant();
    }
}
