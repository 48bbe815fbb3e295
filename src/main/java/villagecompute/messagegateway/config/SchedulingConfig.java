package villagecompute.messagegateway.config;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.inject.Produces;
import jakarta.inject.Singleton;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.services.CronRecurrenceStrategy;
import villagecompute.messagegateway.services.CustomRecurrenceStrategy;
import villagecompute.messagegateway.util.SchedulingClock;
import villagecompute.messagegateway.util.SystemSchedulingClock;

import java.time.DateTimeException;
import java.time.ZoneId;

/**
 * Produces the time source and the custom recurrence strategy shared by the scheduler and the export engine.
 *
 * <p>
 * <b>Configuration:</b>
 * <ul>
 * <li>{@code messagegateway.clock.zone} - zone for recurrence arithmetic, active hours and local-time parsing
 * (default UTC)</li>
 * </ul>
 */
@ApplicationScoped
public class SchedulingConfig {

    private static final Logger LOG = Logger.getLogger(SchedulingConfig.class);

    @ConfigProperty(
            name = "messagegateway.clock.zone",
            defaultValue = "UTC")
    String zone;

    /**
     * @throws ValidationException
     *             if the configured zone id is unknown, failing startup
     */
    @Produces
    @Singleton
    public SchedulingClock schedulingClock() {
        ZoneId zoneId;
        try {
            zoneId = ZoneId.of(zone);
        } catch (DateTimeException e) {
            throw new ValidationException(ErrorKind.INVALID_CONFIG,
                    "messagegateway.clock.zone '" + zone + "' is not a valid zone id", e);
        }
        LOG.infof("Scheduling clock running in zone %s", zoneId);
        return SystemSchedulingClock.inZone(zoneId);
    }

    @Produces
    @Singleton
    public CustomRecurrenceStrategy customRecurrenceStrategy() {
        return new CronRecurrenceStrategy();
    }
}
