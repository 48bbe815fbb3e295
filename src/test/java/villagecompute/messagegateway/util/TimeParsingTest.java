package villagecompute.messagegateway.util;

import org.junit.jupiter.api.Test;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;

import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class TimeParsingTest {

    private static final ZoneId NEW_YORK = ZoneId.of("America/New_York");

    @Test
    void testParseInstant_offsetAndUtc() {
        assertEquals(Instant.parse("2025-03-01T10:00:00Z"), TimeParsing.parseInstant("2025-03-01T10:00:00Z", NEW_YORK));
        assertEquals(Instant.parse("2025-03-01T09:00:00Z"),
                TimeParsing.parseInstant("2025-03-01T10:00:00+01:00", ZoneOffset.UTC));
    }

    @Test
    void testParseInstant_zoneIdWins() {
        assertEquals(Instant.parse("2025-07-01T08:00:00Z"),
                TimeParsing.parseInstant("2025-07-01T10:00:00+02:00[Europe/Paris]", NEW_YORK));
    }

    @Test
    void testParseInstant_localTimeUsesSuppliedZone() {
        assertEquals(Instant.parse("2025-01-15T14:30:00Z"), TimeParsing.parseInstant(" 2025-01-15T09:30:00 ", NEW_YORK));
    }

    @Test
    void testParseInstant_invalid_invalidTime() {
        for (String value : new String[] {"", "   ", "tomorrow", "2025-01-15", "2025-13-01T00:00:00"}) {
            ValidationException e = assertThrows(ValidationException.class,
                    () -> TimeParsing.parseInstant(value, NEW_YORK));
            assertEquals(ErrorKind.INVALID_TIME, e.getKind(), value);
        }
        assertThrows(ValidationException.class, () -> TimeParsing.parseInstant(null, NEW_YORK));
    }
}
