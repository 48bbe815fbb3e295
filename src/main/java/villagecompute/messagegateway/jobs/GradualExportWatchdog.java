package villagecompute.messagegateway.jobs;

import io.quarkus.scheduler.Scheduled;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.services.GradualExportService;

/**
 * Resumes gradual exports paused by a cap, the active-hours window or host backoff once the condition clears, and
 * retries starting a queued export that the store refused to record.
 *
 * <p>
 * <b>Schedule:</b> every {@code messagegateway.export.watchdog-interval} (default 30s)
 *
 * <p>
 * The engine also sets a timer at pause time; this job covers conditions that clear earlier than predicted and
 * timers lost to a restart.
 */
@ApplicationScoped
public class GradualExportWatchdog {

    private static final Logger LOG = Logger.getLogger(GradualExportWatchdog.class);

    @Inject
    GradualExportService exportService;

    @Scheduled(
            every = "${messagegateway.export.watchdog-interval}",
            concurrentExecution = Scheduled.ConcurrentExecution.SKIP)
    void checkExportEngine() {
        if (exportService.checkAutoResume()) {
            LOG.infof("Watchdog resumed the paused gradual export");
        }
        if (exportService.retryQueuedStart()) {
            LOG.infof("Watchdog started the queued gradual export held back by a store failure");
        }
    }
}
