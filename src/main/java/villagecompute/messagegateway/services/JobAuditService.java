package villagecompute.messagegateway.services;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.api.types.JobEventType;
import villagecompute.messagegateway.util.SchedulingClock;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;

/**
 * Event channel for outcomes of background work that has no synchronous caller: scheduled sends, export transitions
 * and batch runs.
 *
 * <p>
 * Every event is logged and kept in a bounded in-memory history ({@code messagegateway.audit.history-size}, oldest
 * dropped first) that the {@code get_job_events} tool exposes.
 */
@ApplicationScoped
public class JobAuditService {

    private static final Logger LOG = Logger.getLogger(JobAuditService.class);

    public static final String SOURCE_SCHEDULER = "scheduler";
    public static final String SOURCE_EXPORT = "export";
    public static final String SOURCE_BATCH = "batch";

    @Inject
    SchedulingClock clock;

    @ConfigProperty(
            name = "messagegateway.audit.history-size",
            defaultValue = "500")
    int historySize = 500;

    private final Deque<JobEventType> events = new ArrayDeque<>();

    public void info(String source, Long jobId, String type, String detail) {
        record(new JobEventType(clock.now(), source, jobId, type, false, detail));
        LOG.infof("[%s] job=%s %s: %s", source, jobId, type, detail);
    }

    public void error(String source, Long jobId, String type, String detail) {
        record(new JobEventType(clock.now(), source, jobId, type, true, detail));
        LOG.errorf("[%s] job=%s %s: %s", source, jobId, type, detail);
    }

    /**
     * Most recent events first.
     *
     * @param limit
     *            maximum number of events to return
     */
    public List<JobEventType> recent(int limit) {
        List<JobEventType> result = new ArrayList<>();
        synchronized (events) {
            Iterator<JobEventType> newestFirst = events.descendingIterator();
            while (newestFirst.hasNext() && result.size() < limit) {
                result.add(newestFirst.next());
            }
        }
        return result;
    }

    private void record(JobEventType event) {
        synchronized (events) {
            events.addLast(event);
            while (events.size() > Math.max(1, historySize)) {
                events.removeFirst();
            }
        }
    }
}
