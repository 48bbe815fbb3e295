package villagecompute.messagegateway.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.quarkus.runtime.StartupEvent;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.data.JobStore;
import villagecompute.messagegateway.data.models.ScheduledMessage;
import villagecompute.messagegateway.data.models.ScheduledMessage.RecurrencePattern;
import villagecompute.messagegateway.data.models.ScheduledMessage.ScheduleKind;
import villagecompute.messagegateway.data.models.ScheduledMessage.ScheduleStatus;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ResourceNotFoundException;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.integration.messaging.ActionExecutor;
import villagecompute.messagegateway.integration.messaging.SendReceipt;
import villagecompute.messagegateway.observability.LoggingConfig;
import villagecompute.messagegateway.observability.ObservabilityMetrics;
import villagecompute.messagegateway.util.Futures;
import villagecompute.messagegateway.util.SchedulingClock;
import villagecompute.messagegateway.util.TimeParsing;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Predicate;

/**
 * Owns scheduled messages and fires them when due.
 *
 * <p>
 * <b>State:</b> an in-memory map of detached {@link ScheduledMessage} snapshots backed by the {@link JobStore}. Every
 * change (management call or tick outcome) is one {@code computeIfPresent} on the job's id: the snapshot is copied,
 * changed, written to the store and only then published. A failed store write leaves memory untouched and surfaces as
 * {@link villagecompute.messagegateway.exceptions.JobStoreException}.
 *
 * <p>
 * <b>Tick:</b> {@link #tick()} is single-flight. It selects active jobs whose {@code nextScheduled} has passed, oldest
 * first, and sends them one by one through the {@link BatchExecutor}. Outcomes:
 * <ul>
 * <li>ONCE/DELAYED success: COMPLETED</li>
 * <li>ONCE/DELAYED failure: FAILED with {@code lastError}, never retried</li>
 * <li>RECURRING success: occurrence counted, next slot computed from the time it was sent; COMPLETED once
 * {@code maxOccurrences} is reached</li>
 * <li>RECURRING failure: occurrence not counted, the job moves on to its next regular slot</li>
 * </ul>
 * Failures are reported through {@link JobAuditService}; nothing is thrown to the ticker.
 */
@ApplicationScoped
public class MessageSchedulerService {

    private static final Logger LOG = Logger.getLogger(MessageSchedulerService.class);

    @Inject
    SchedulingClock clock;

    @Inject
    JobStore store;

    @Inject
    ActionExecutor actionExecutor;

    @Inject
    RecurrenceCalculator recurrence;

    @Inject
    BatchExecutor batchExecutor;

    @Inject
    JobAuditService audit;

    @Inject
    ObservabilityMetrics metrics;

    @Inject
    Tracer tracer;

    @ConfigProperty(
            name = "messagegateway.scheduler.send-timeout-seconds",
            defaultValue = "30")
    int sendTimeoutSeconds = 30;

    @ConfigProperty(
            name = "messagegateway.scheduler.tick-concurrency-limit",
            defaultValue = "20")
    int tickConcurrencyLimit = 20;

    @ConfigProperty(
            name = "messagegateway.scheduler.tick-rate-limit-delay-ms",
            defaultValue = "0")
    long tickRateLimitDelayMs;

    @ConfigProperty(
            name = "messagegateway.scheduler.archive-retention-days",
            defaultValue = "30")
    int archiveRetentionDays = 30;

    private final ConcurrentMap<Long, ScheduledMessage> jobs = new ConcurrentHashMap<>();

    private final AtomicLong nextId = new AtomicLong(1);

    private final AtomicBoolean tickInProgress = new AtomicBoolean(false);

    void onStart(@Observes StartupEvent event) {
        loadFromStore();
    }

    /**
     * Replaces the in-memory state with the store's contents and seeds the id sequence past the highest stored id.
     */
    public void loadFromStore() {
        List<ScheduledMessage> stored = store.loadScheduledMessages();
        jobs.clear();
        long maxId = 0;
        for (ScheduledMessage message : stored) {
            jobs.put(message.id, message);
            maxId = Math.max(maxId, message.id);
        }
        nextId.set(maxId + 1);
        LOG.infof("Loaded %d scheduled messages (%d active)", stored.size(), activeCount());
    }

    /**
     * Schedules a one-off send at an ISO-8601 time. Times in the past are accepted and fire on the next tick.
     *
     * @throws ValidationException
     *             with kind {@code INVALID_TIME} if {@code at} cannot be parsed
     */
    public ScheduledMessage scheduleOnce(String target, String payload, String at, String createdBy) {
        return scheduleOnce(target, payload, TimeParsing.parseInstant(at, clock.zone()), createdBy);
    }

    public ScheduledMessage scheduleOnce(String target, String payload, Instant at, String createdBy) {
        if (at == null) {
            throw ValidationException.invalidTime("Time is required", null);
        }
        ScheduledMessage message = newMessage(target, payload, ScheduleKind.ONCE, createdBy);
        message.scheduledTime = at;
        message.nextScheduled = at;
        if (at.isBefore(message.createdAt)) {
            LOG.debugf("Scheduled time %s is in the past, message will fire on the next tick", at);
        }
        return create(message);
    }

    /**
     * Schedules a one-off send {@code delaySeconds} from now.
     */
    public ScheduledMessage scheduleDelayed(String target, String payload, long delaySeconds, String createdBy) {
        if (delaySeconds < 0) {
            throw ValidationException.invalidTime("delay_seconds must not be negative", null);
        }
        ScheduledMessage message = newMessage(target, payload, ScheduleKind.DELAYED, createdBy);
        message.delaySeconds = delaySeconds;
        message.scheduledTime = message.createdAt.plusSeconds(delaySeconds);
        message.nextScheduled = message.scheduledTime;
        return create(message);
    }

    /**
     * Schedules a recurring send whose first occurrence is {@code startTime} (now when null).
     *
     * @param maxOccurrences
     *            positive bound, or -1 for unbounded
     */
    public ScheduledMessage scheduleRecurring(String target, String payload, Instant startTime,
            RecurrencePattern pattern, String expression, int maxOccurrences, String createdBy) {
        recurrence.validate(pattern, expression);
        if (maxOccurrences == 0 || maxOccurrences < -1) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT,
                    "max_occurrences must be positive or -1 for unbounded");
        }
        ScheduledMessage message = newMessage(target, payload, ScheduleKind.RECURRING, createdBy);
        message.recurrencePattern = pattern;
        message.recurrenceExpression = pattern == RecurrencePattern.CUSTOM ? expression : null;
        message.startTime = startTime != null ? startTime : message.createdAt;
        message.maxOccurrences = maxOccurrences;
        message.nextScheduled = message.startTime;
        return create(message);
    }

    /**
     * Cancels a job. Cancelling a cancelled or finished job changes nothing.
     *
     * @throws ResourceNotFoundException
     *             if the id is unknown
     */
    public ScheduledMessage cancel(long jobId) {
        ScheduledMessage result = mutate(jobId, job -> {
            if (job.status.isTerminal()) {
                return false;
            }
            job.status = ScheduleStatus.CANCELLED;
            job.nextScheduled = null;
            return true;
        });
        LOG.infof("Scheduled message %d is %s", jobId, result.status);
        return result;
    }

    /**
     * Holds an active job. Pausing a paused job changes nothing.
     *
     * @throws ValidationException
     *             with kind {@code INVALID_STATE} if the job already finished
     */
    public ScheduledMessage pause(long jobId) {
        return mutate(jobId, job -> {
            if (job.status == ScheduleStatus.PAUSED) {
                return false;
            }
            requireNotTerminal(job, "pause");
            job.status = ScheduleStatus.PAUSED;
            return true;
        });
    }

    /**
     * Reactivates a paused job. Recurring jobs skip slots missed while paused. Resuming an active job changes nothing.
     *
     * @throws ValidationException
     *             with kind {@code INVALID_STATE} if the job already finished
     */
    public ScheduledMessage resume(long jobId) {
        return mutate(jobId, job -> {
            if (job.status == ScheduleStatus.ACTIVE) {
                return false;
            }
            requireNotTerminal(job, "resume");
            Instant now = clock.now();
            if (job.isRecurring() && job.nextScheduled != null && !job.nextScheduled.isAfter(now)) {
                job.nextScheduled = recurrence.nextAfter(job.recurrencePattern, job.recurrenceExpression,
                        job.nextScheduled, now);
            }
            job.status = ScheduleStatus.ACTIVE;
            return true;
        });
    }

    /**
     * Replaces the payload of a pending job; scheduling parameters stay as they are.
     *
     * @throws ValidationException
     *             with kind {@code INVALID_STATE} if the job already finished
     */
    public ScheduledMessage update(long jobId, String newPayload) {
        if (newPayload == null) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "payload is required");
        }
        return mutate(jobId, job -> {
            requireNotTerminal(job, "update");
            if (newPayload.equals(job.payload)) {
                return false;
            }
            job.payload = newPayload;
            return true;
        });
    }

    public Optional<ScheduledMessage> get(long jobId) {
        return Optional.ofNullable(jobs.get(jobId)).map(ScheduledMessage::copy);
    }

    /**
     * Lists jobs ordered by next firing time (finished jobs last), optionally restricted to one target.
     *
     * @param target
     *            target filter, null for all targets
     * @param includeInactive
     *            also return paused and finished jobs
     */
    public List<ScheduledMessage> list(String target, boolean includeInactive) {
        return jobs.values().stream().filter(job -> target == null || target.equals(job.target))
                .filter(job -> includeInactive || job.isActive())
                .sorted(Comparator.comparing((ScheduledMessage job) -> job.nextScheduled,
                        Comparator.nullsLast(Comparator.naturalOrder())).thenComparing(job -> job.id))
                .map(ScheduledMessage::copy).toList();
    }

    public int activeCount() {
        return (int) jobs.values().stream().filter(ScheduledMessage::isActive).count();
    }

    /**
     * Fires every due job. Returns immediately with 0 if another tick is still running.
     *
     * @return stage completing with the number of jobs that were due
     */
    public CompletionStage<Integer> tick() {
        if (!tickInProgress.compareAndSet(false, true)) {
            LOG.debug("Scheduler tick already in progress, skipping");
            return CompletableFuture.completedFuture(0);
        }
        try {
            Instant now = clock.now();
            List<Long> due = jobs.values().stream().filter(job -> job.isDue(now))
                    .sorted(Comparator.comparing((ScheduledMessage job) -> job.nextScheduled)
                            .thenComparing(job -> job.id))
                    .map(job -> job.id).toList();
            if (due.isEmpty()) {
                tickInProgress.set(false);
                return CompletableFuture.completedFuture(0);
            }

            Span span = tracer.spanBuilder("scheduler.tick").setAttribute("scheduler.due", due.size()).startSpan();
            LOG.debugf("Scheduler tick: %d due messages", due.size());
            BatchExecutor.Options options = new BatchExecutor.Options(tickConcurrencyLimit,
                    Duration.ofMillis(tickRateLimitDelayMs), true);
            return batchExecutor.run("scheduled_send", due, this::fire, options).handle((result, failure) -> {
                tickInProgress.set(false);
                span.end();
                if (failure != null) {
                    LOG.errorf(failure, "Scheduler tick failed");
                    audit.error(JobAuditService.SOURCE_SCHEDULER, null, "tick_failed", Futures.describe(failure));
                }
                return due.size();
            });
        } catch (RuntimeException e) {
            tickInProgress.set(false);
            throw e;
        }
    }

    /**
     * Deletes finished jobs that have not changed for longer than the archive retention.
     *
     * @return number of purged jobs
     */
    public int purgeInactive() {
        Instant cutoff = clock.now().minus(Duration.ofDays(archiveRetentionDays));
        int purged = 0;
        for (Long id : List.copyOf(jobs.keySet())) {
            boolean[] removed = {false};
            jobs.computeIfPresent(id, (key, job) -> {
                if (!job.status.isTerminal() || job.updatedAt.isAfter(cutoff)) {
                    return job;
                }
                store.deleteScheduledMessage(key);
                removed[0] = true;
                return null;
            });
            if (removed[0]) {
                purged++;
            }
        }
        if (purged > 0) {
            LOG.infof("Purged %d finished scheduled messages older than %d days", purged, archiveRetentionDays);
        }
        return purged;
    }

    private CompletionStage<Map<String, Object>> fire(Long jobId) {
        ScheduledMessage job = jobs.get(jobId);
        if (job == null || !job.isDue(clock.now())) {
            // Paused, cancelled or updated since the tick selected it
            return CompletableFuture.completedFuture(Map.of("job_id", jobId, "skipped", true));
        }
        Instant slot = job.nextScheduled;
        return Futures.invoke(() -> actionExecutor.send(job.target, job.payload)).toCompletableFuture()
                .orTimeout(sendTimeoutSeconds, TimeUnit.SECONDS).handle((receipt, failure) -> {
                    LoggingConfig.setJobId(jobId);
                    try {
                        if (failure == null) {
                            return onSent(job, receipt);
                        }
                        onSendFailed(job, slot, Futures.unwrap(failure));
                        throw new CompletionException(Futures.unwrap(failure));
                    } finally {
                        LoggingConfig.clearMDC();
                    }
                });
    }

    private Map<String, Object> onSent(ScheduledMessage fired, SendReceipt receipt) {
        Instant now = clock.now();
        ScheduledMessage updated;
        try {
            updated = recordSent(fired.id, now);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Scheduled message %d was sent but its state could not be saved", fired.id);
            audit.error(JobAuditService.SOURCE_SCHEDULER, fired.id, "persist_failed", Futures.describe(e));
            throw e;
        }
        metrics.incrementScheduleFire(fired.scheduleKind.name(), true);
        audit.info(JobAuditService.SOURCE_SCHEDULER, fired.id, "fired",
                "Sent to " + fired.target + " (occurrence " + updated.occurrencesSent + ", status "
                        + updated.status + ")");
        return receipt == null ? Map.of("job_id", fired.id)
                : Map.of("job_id", fired.id, "message_id", String.valueOf(receipt.messageId()));
    }

    private ScheduledMessage recordSent(long jobId, Instant now) {
        return mutate(jobId, job -> {
            job.lastSent = now;
            job.occurrencesSent++;
            job.lastError = null;
            if (!job.isRecurring()) {
                job.nextScheduled = null;
                if (job.status != ScheduleStatus.CANCELLED) {
                    job.status = ScheduleStatus.COMPLETED;
                }
                return true;
            }
            if (job.maxOccurrences >= 0 && job.occurrencesSent >= job.maxOccurrences) {
                job.nextScheduled = null;
                if (!job.status.isTerminal()) {
                    job.status = ScheduleStatus.COMPLETED;
                }
                return true;
            }
            advance(job, now, now);
            return true;
        });
    }

    private void onSendFailed(ScheduledMessage fired, Instant slot, Throwable failure) {
        String error = Futures.describe(failure);
        metrics.incrementScheduleFire(fired.scheduleKind.name(), false);
        audit.error(JobAuditService.SOURCE_SCHEDULER, fired.id, "send_failed",
                "Send to " + fired.target + " failed: " + error);
        Instant now = clock.now();
        try {
            mutate(fired.id, job -> {
                job.lastError = error;
                if (job.isRecurring()) {
                    advance(job, slot, now);
                } else if (!job.status.isTerminal()) {
                    job.status = ScheduleStatus.FAILED;
                    job.nextScheduled = null;
                }
                return true;
            });
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to record send failure of scheduled message %d", fired.id);
            audit.error(JobAuditService.SOURCE_SCHEDULER, fired.id, "persist_failed", Futures.describe(e));
        }
    }

    /**
     * Moves a recurring job to its first slot after {@code now}, counted from {@code from}, finishing it if the
     * pattern has no further slot. A successful send counts from the time it went out; a failed one keeps the
     * original cadence.
     */
    private void advance(ScheduledMessage job, Instant from, Instant now) {
        try {
            job.nextScheduled = recurrence.nextAfter(job.recurrencePattern, job.recurrenceExpression, from, now);
        } catch (ValidationException e) {
            job.nextScheduled = null;
            job.lastError = e.getMessage();
            if (!job.status.isTerminal()) {
                job.status = ScheduleStatus.COMPLETED;
            }
        }
    }

    private ScheduledMessage newMessage(String target, String payload, ScheduleKind kind, String createdBy) {
        if (target == null || target.isBlank()) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "target is required");
        }
        if (payload == null) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "payload is required");
        }
        Instant now = clock.now();
        ScheduledMessage message = new ScheduledMessage();
        message.target = target;
        message.payload = payload;
        message.scheduleKind = kind;
        message.recurrencePattern = RecurrencePattern.NONE;
        message.maxOccurrences = 1;
        message.status = ScheduleStatus.ACTIVE;
        message.createdBy = createdBy;
        message.createdAt = now;
        message.updatedAt = now;
        return message;
    }

    private ScheduledMessage create(ScheduledMessage message) {
        message.id = nextId.getAndIncrement();
        store.upsert(message);
        jobs.put(message.id, message);
        LOG.infof("Scheduled %s message %d for %s at %s", message.scheduleKind, message.id, message.target,
                message.nextScheduled);
        return message.copy();
    }

    /**
     * Atomic read-modify-write of one job. {@code change} edits a copy and returns whether anything changed; unchanged
     * copies are neither written nor published.
     */
    private ScheduledMessage mutate(long jobId, Predicate<ScheduledMessage> change) {
        ScheduledMessage updated = jobs.computeIfPresent(jobId, (id, current) -> {
            ScheduledMessage copy = current.copy();
            if (!change.test(copy)) {
                return current;
            }
            copy.updatedAt = clock.now();
            store.upsert(copy);
            return copy;
        });
        if (updated == null) {
            throw new ResourceNotFoundException("Scheduled message " + jobId + " not found");
        }
        return updated.copy();
    }

    private static void requireNotTerminal(ScheduledMessage job, String operation) {
        if (job.status.isTerminal()) {
            throw ValidationException.invalidState(
                    "Cannot " + operation + " scheduled message " + job.id + " in state " + job.status);
        }
    }
}
