package villagecompute.messagegateway.services;

import com.cronutils.model.Cron;
import com.cronutils.model.CronType;
import com.cronutils.model.definition.CronDefinitionBuilder;
import com.cronutils.model.time.ExecutionTime;
import com.cronutils.parser.CronParser;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Locale;
import java.util.Optional;

/**
 * {@link CustomRecurrenceStrategy} for cron expressions and fixed ISO-8601 intervals.
 *
 * <p>
 * <b>Accepted expressions:</b>
 * <ul>
 * <li>ISO-8601 durations such as {@code PT90M} or {@code P2D}, added to the reference time</li>
 * <li>Five-field Unix cron, e.g. {@code 0 9 * * MON-FRI}</li>
 * <li>Six or seven field Quartz cron, e.g. {@code 0 0 9 ? * MON-FRI}</li>
 * </ul>
 * Cron expressions are evaluated in the zone of the reference time.
 */
public class CronRecurrenceStrategy implements CustomRecurrenceStrategy {

    private final CronParser unixParser = new CronParser(CronDefinitionBuilder.instanceDefinitionFor(CronType.UNIX));

    private final CronParser quartzParser = new CronParser(
            CronDefinitionBuilder.instanceDefinitionFor(CronType.QUARTZ));

    @Override
    public void validate(String expression) {
        if (isInterval(expression)) {
            parseInterval(expression);
        } else {
            parseCron(expression);
        }
    }

    @Override
    public Instant next(String expression, ZonedDateTime reference) {
        if (isInterval(expression)) {
            return reference.plus(parseInterval(expression)).toInstant();
        }
        Optional<ZonedDateTime> next = ExecutionTime.forCron(parseCron(expression)).nextExecution(reference);
        return next.map(ZonedDateTime::toInstant).orElseThrow(
                () -> new ValidationException(ErrorKind.INVALID_ARGUMENT,
                        "Recurrence '" + expression + "' has no occurrence after " + reference));
    }

    private static boolean isInterval(String expression) {
        return expression != null && expression.trim().toUpperCase(Locale.ROOT).startsWith("P");
    }

    private static Duration parseInterval(String expression) {
        Duration interval;
        try {
            interval = Duration.parse(expression.trim().toUpperCase(Locale.ROOT));
        } catch (DateTimeParseException e) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT,
                    "Invalid recurrence interval '" + expression + "'", e);
        }
        if (interval.isZero() || interval.isNegative()) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "Recurrence interval must be positive");
        }
        return interval;
    }

    private Cron parseCron(String expression) {
        if (expression == null || expression.isBlank()) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "Custom recurrence requires an expression");
        }
        String trimmed = expression.trim();
        CronParser parser = trimmed.split("\\s+").length == 5 ? unixParser : quartzParser;
        try {
            return parser.parse(trimmed).validate();
        } catch (IllegalArgumentException e) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT,
                    "Invalid cron expression '" + expression + "': " + e.getMessage(), e);
        }
    }
}
