package villagecompute.messagegateway.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.messagegateway.data.models.ScheduledMessage.RecurrencePattern;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.testing.ManualClock;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZonedDateTime;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link RecurrenceCalculator}.
 */
class RecurrenceCalculatorTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Mock
    CustomRecurrenceStrategy customStrategy;

    private RecurrenceCalculator calculator;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        calculator = new RecurrenceCalculator();
        calculator.clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"), NEW_YORK);
        calculator.customStrategy = customStrategy;
    }

    @Test
    void testNext_hourly_addsSixtyMinutes() {
        Instant reference = Instant.parse("2024-03-10T06:30:00Z");

        assertEquals(Instant.parse("2024-03-10T07:30:00Z"),
                calculator.next(RecurrencePattern.HOURLY, null, reference));
    }

    @Test
    void testNext_daily_keepsWallClockAcrossDstChange() {
        // 09:00 EST on the day before the spring-forward change
        Instant reference = ZonedDateTime.of(2024, 3, 9, 9, 0, 0, 0, NEW_YORK).toInstant();

        Instant next = calculator.next(RecurrencePattern.DAILY, null, reference);

        assertEquals(ZonedDateTime.of(2024, 3, 10, 9, 0, 0, 0, NEW_YORK).toInstant(), next);
        assertEquals(23, Duration.between(reference, next).toHours());
    }

    @Test
    void testNext_weekly_addsSevenDays() {
        Instant reference = Instant.parse("2024-01-01T09:00:00Z");

        assertEquals(Instant.parse("2024-01-08T09:00:00Z"),
                calculator.next(RecurrencePattern.WEEKLY, null, reference));
    }

    @Test
    void testNext_monthly_clampsToLastDayOfMonth() {
        Instant reference = ZonedDateTime.of(2024, 1, 31, 12, 0, 0, 0, NEW_YORK).toInstant();

        assertEquals(ZonedDateTime.of(2024, 2, 29, 12, 0, 0, 0, NEW_YORK).toInstant(),
                calculator.next(RecurrencePattern.MONTHLY, null, reference));
    }

    @Test
    void testNext_custom_delegatesToStrategy() {
        Instant reference = Instant.parse("2024-01-01T09:00:00Z");
        Instant expected = Instant.parse("2024-01-01T10:30:00Z");
        when(customStrategy.next(eq("PT90M"), any())).thenReturn(expected);

        assertEquals(expected, calculator.next(RecurrencePattern.CUSTOM, "PT90M", reference));
    }

    @Test
    void testNext_customResultNotAfterReference_throws() {
        Instant reference = Instant.parse("2024-01-01T09:00:00Z");
        when(customStrategy.next(eq("broken"), any())).thenReturn(reference);

        ValidationException e = assertThrows(ValidationException.class,
                () -> calculator.next(RecurrencePattern.CUSTOM, "broken", reference));
        assertEquals(ErrorKind.INVALID_ARGUMENT, e.getKind());
    }

    @Test
    void testNext_none_throws() {
        assertThrows(ValidationException.class,
                () -> calculator.next(RecurrencePattern.NONE, null, Instant.parse("2024-01-01T09:00:00Z")));
    }

    @Test
    void testValidate_noneOrNull_throws() {
        assertThrows(ValidationException.class, () -> calculator.validate(RecurrencePattern.NONE, null));
        assertThrows(ValidationException.class, () -> calculator.validate(null, null));
    }

    @Test
    void testNextAfter_skipsMissedSlots() {
        calculator.clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        Instant from = Instant.parse("2024-01-01T09:00:00Z");
        Instant now = Instant.parse("2024-01-03T10:00:00Z");

        assertEquals(Instant.parse("2024-01-04T09:00:00Z"),
                calculator.nextAfter(RecurrencePattern.DAILY, null, from, now));
    }

    @Test
    void testNextAfter_slotExactlyAtNow_movesPastIt() {
        calculator.clock = new ManualClock(Instant.parse("2024-01-01T00:00:00Z"));
        Instant from = Instant.parse("2024-01-01T09:00:00Z");

        assertEquals(Instant.parse("2024-01-01T11:00:00Z"), calculator.nextAfter(RecurrencePattern.HOURLY, null,
                from, Instant.parse("2024-01-01T10:00:00Z")));
    }
}
