package villagecompute.messagegateway.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.services.MessageSchedulerService;

/**
 * Drives {@link MessageSchedulerService#tick()}.
 *
 * <p>
 * <b>Schedule:</b> every {@code messagegateway.scheduler.tick-interval} (default 1s)
 *
 * <p>
 * The tick is asynchronous and single-flight; a trigger that arrives while the previous tick is still sending is
 * skipped by the service, so slow sends never pile up ticks.
 */
@ApplicationScoped
public class MessageSchedulerTicker {

    private static final Logger LOG = Logger.getLogger(MessageSchedulerTicker.class);

    @Inject
    MessageSchedulerService schedulerService;

    @Scheduled(
            every = "${messagegateway.scheduler.tick-interval}",
            delayed = "${messagegateway.scheduler.tick-interval}")
    void tick() {
        schedulerService.tick().whenComplete((fired, failure) -> {
            if (failure != null) {
                LOG.errorf(failure, "Scheduler tick failed");
            } else if (fired > 0) {
                LOG.debugf("Scheduler tick handled %d due messages", fired);
            }
        });
    }
}
