package villagecompute.messagegateway.services;

import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Resolves {@code CUSTOM} recurrence expressions.
 */
public interface CustomRecurrenceStrategy {

    /**
     * Rejects expressions this strategy cannot evaluate.
     *
     * @throws villagecompute.messagegateway.exceptions.ValidationException
     *             if {@code expression} is malformed
     */
    void validate(String expression);

    /**
     * @return first occurrence strictly after {@code reference}
     * @throws villagecompute.messagegateway.exceptions.ValidationException
     *             if the expression is malformed or has no further occurrence
     */
    Instant next(String expression, ZonedDateTime reference);
}
