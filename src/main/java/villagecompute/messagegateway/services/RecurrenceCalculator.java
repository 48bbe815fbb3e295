package villagecompute.messagegateway.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import villagecompute.messagegateway.data.models.ScheduledMessage.RecurrencePattern;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.util.SchedulingClock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Computes the next firing time of a recurring schedule.
 *
 * <p>
 * Fixed patterns add one calendar unit in the clock's zone: {@code HOURLY} adds 60 minutes of elapsed time,
 * {@code DAILY}/{@code WEEKLY} keep the local wall-clock time, {@code MONTHLY} clamps day-of-month overflow to the last
 * valid day (Jan 31 becomes Feb 28 or 29). {@code CUSTOM} delegates to the injected {@link CustomRecurrenceStrategy}.
 *
 * <p>
 * The result is always strictly after the reference time.
 */
@ApplicationScoped
public class RecurrenceCalculator {

    @Inject
    SchedulingClock clock;

    @Inject
    CustomRecurrenceStrategy customStrategy;

    /**
     * @param pattern
     *            recurrence pattern, never {@code NONE}
     * @param expression
     *            custom expression, only read for {@code CUSTOM}
     * @param reference
     *            time of the previous occurrence
     * @return next occurrence, strictly after {@code reference}
     * @throws ValidationException
     *             for {@code NONE}, an invalid custom expression, or a strategy result not after the reference
     */
    public Instant next(RecurrencePattern pattern, String expression, Instant reference) {
        ZonedDateTime local = reference.atZone(clock.zone());
        Instant next = switch (pattern) {
            case HOURLY -> reference.plus(Duration.ofHours(1));
            case DAILY -> local.plusDays(1).toInstant();
            case WEEKLY -> local.plusWeeks(1).toInstant();
            case MONTHLY -> local.plusMonths(1).toInstant();
            case CUSTOM -> customStrategy.next(expression, local);
            case NONE -> throw new ValidationException(ErrorKind.INVALID_ARGUMENT,
                    "Recurrence pattern NONE has no next occurrence");
        };
        if (!next.isAfter(reference)) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT,
                    "Recurrence " + pattern + " produced " + next + " which is not after " + reference);
        }
        return next;
    }

    /**
     * Rejects pattern/expression combinations that can never produce an occurrence.
     */
    public void validate(RecurrencePattern pattern, String expression) {
        if (pattern == null || pattern == RecurrencePattern.NONE) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "Recurring schedules need a recurrence pattern");
        }
        if (pattern == RecurrencePattern.CUSTOM) {
            customStrategy.validate(expression);
        }
    }

    /**
     * First occurrence strictly after {@code now}, stepping forward from {@code from}. Used when a recurring job missed
     * one or more slots.
     */
    public Instant nextAfter(RecurrencePattern pattern, String expression, Instant from, Instant now) {
        Instant next = next(pattern, expression, from);
        while (!next.isAfter(now)) {
            next = next(pattern, expression, next);
        }
        return next;
    }
}
