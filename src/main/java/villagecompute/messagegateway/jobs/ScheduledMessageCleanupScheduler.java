package villagecompute.messagegateway.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.services.MessageSchedulerService;

/**
 * Daily purge of cancelled, completed and failed scheduled messages past the retention period.
 *
 * <p>
 * <b>Schedule:</b> Daily at 3:30 AM UTC (cron: 0 30 3 * * ?)
 *
 * <p>
 * <b>Retention:</b> {@code messagegateway.scheduler.archive-retention-days} (default 30)
 */
@ApplicationScoped
public class ScheduledMessageCleanupScheduler {

    private static final Logger LOG = Logger.getLogger(ScheduledMessageCleanupScheduler.class);

    @Inject
    MessageSchedulerService schedulerService;

    @Scheduled(
            cron = "0 30 3 * * ?",
            timeZone = "UTC")
    void purgeInactive() {
        int purged = schedulerService.purgeInactive();
        LOG.infof("Purged %d inactive scheduled messages", purged);
    }
}
