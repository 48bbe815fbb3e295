package villagecompute.messagegateway.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import io.quarkus.runtime.StartupEvent;
import jakarta.annotation.PostConstruct;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.enterprise.event.Observes;
import jakarta.inject.Inject;
import org.eclipse.microprofile.config.inject.ConfigProperty;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.api.types.GradualExportConfigType;
import villagecompute.messagegateway.api.types.GradualExportJobType;
import villagecompute.messagegateway.api.types.GradualExportStatusType;
import villagecompute.messagegateway.config.GradualExportDefaults;
import villagecompute.messagegateway.data.JobStore;
import villagecompute.messagegateway.data.models.GradualExportJob;
import villagecompute.messagegateway.data.models.GradualExportJob.ExportState;
import villagecompute.messagegateway.data.models.GradualExportJob.PauseReason;
import villagecompute.messagegateway.exceptions.AlreadyRunningException;
import villagecompute.messagegateway.exceptions.BackoffSignalException;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.integration.messaging.ActionExecutor;
import villagecompute.messagegateway.integration.messaging.ExportFormat;
import villagecompute.messagegateway.integration.messaging.ExportWriter;
import villagecompute.messagegateway.integration.messaging.HistoryPage;
import villagecompute.messagegateway.integration.messaging.HistoryRecord;
import villagecompute.messagegateway.observability.LoggingConfig;
import villagecompute.messagegateway.observability.ObservabilityMetrics;
import villagecompute.messagegateway.services.RateLimitService.RateLimitResult;
import villagecompute.messagegateway.services.RateLimitService.RateLimitRule;
import villagecompute.messagegateway.util.Futures;
import villagecompute.messagegateway.util.SchedulingClock;

import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Throttled export of message histories, one target at a time, with a priority queue behind it.
 *
 * <p>
 * <b>State machine:</b> idle, then {@code start} makes a job RUNNING. RUNNING and PAUSED switch on
 * {@code pause}/{@code resume}. Either becomes CANCELLED on {@code cancel}. An exhausted source makes it COMPLETED, and
 * failed fetches beyond {@code maxRetries} make it ERRORED. Only one job occupies the engine (RUNNING or PAUSED);
 * {@code start} on an occupied engine throws {@link AlreadyRunningException}. When the current job completes or errors,
 * the best queued job (lowest priority value, then oldest) starts automatically.
 *
 * <p>
 * <b>Batch loop:</b> each step runs on a timer from the {@link SchedulingClock} and re-checks, in order:
 * <ol>
 * <li>the active-hours window (auto-pause {@code ACTIVE_HOURS})</li>
 * <li>rolling daily and hourly volume caps (auto-pause {@code DAILY_CAP}/{@code HOURLY_CAP})</li>
 * <li>the host's flood-wait signal (auto-pause {@code BACKOFF}, or wait in place when {@code stopOnFloodWait} is
 * off)</li>
 * </ol>
 * It then fetches a batch of random size (clamped to the remaining capacity), writes it and waits a random delay, with
 * burst pauses, long pauses and simulated reading time added on top. Pause and cancel are observed between batches; a
 * batch already in flight is always written, and a cancelled job's output is closed after it. Automatic pauses resume
 * on their own once the condition clears, through a timer or the {@code GradualExportWatchdog}; manual pauses and
 * pauses restored after a restart wait for {@link #resume()}.
 *
 * <p>
 * <b>Thread Safety:</b> all state changes happen under one monitor. Host calls and file writes run outside it.
 */
@ApplicationScoped
public class GradualExportService {

    private static final Logger LOG = Logger.getLogger(GradualExportService.class);

    static final String HOURLY_KEY = "export:hourly";
    static final String DAILY_KEY = "export:daily";

    private static final Duration HOUR = Duration.ofHours(1);
    private static final Duration DAY = Duration.ofDays(1);
    private static final Duration FLOOD_WAIT_MARGIN = Duration.ofSeconds(5);

    private static final int READING_CHARS_PER_SECOND = 16;
    private static final long MIN_READING_MS = 100;
    private static final long MAX_READING_MS = 5000;

    private static final Comparator<GradualExportJob> QUEUE_ORDER = Comparator
            .comparingInt((GradualExportJob job) -> job.priority).thenComparing(job -> job.enqueuedAt)
            .thenComparingLong(job -> job.sequence);

    @Inject
    SchedulingClock clock;

    @Inject
    JobStore store;

    @Inject
    ActionExecutor actionExecutor;

    @Inject
    ExportWriter writer;

    @Inject
    RateLimitService rateLimitService;

    @Inject
    JobAuditService audit;

    @Inject
    ObservabilityMetrics metrics;

    @Inject
    Tracer tracer;

    @Inject
    GradualExportDefaults defaults;

    @ConfigProperty(
            name = "messagegateway.export.directory",
            defaultValue = "exports")
    String exportDirectory = "exports";

    @ConfigProperty(
            name = "messagegateway.export.fetch-timeout-seconds",
            defaultValue = "60")
    int fetchTimeoutSeconds = 60;

    Random random = new Random();

    private final Object lock = new Object();

    private final List<GradualExportJob> queue = new ArrayList<>();

    private final AtomicLong nextId = new AtomicLong(1);

    private final AtomicLong nextSequence = new AtomicLong(1);

    private GradualExportConfigType engineConfig = GradualExportConfigType.defaults();

    /** Job occupying the engine, or the last one that did. */
    private ActiveExport current;

    /** The best queued job could not be started and waits for {@link #retryQueuedStart()}. */
    private boolean startPending;

    /**
     * Live state of the job occupying the engine. Guarded by {@link #lock}.
     */
    private static final class ActiveExport {

        private GradualExportJob job;
        private GradualExportConfigType config;
        private int consecutiveBatches;
        private int retryCount;
        private long currentDelayMs;
        /** A step is scheduled or a batch is in flight. */
        private boolean chainActive;
        /** A fetched batch has not been written yet. */
        private boolean batchInFlight;
        private boolean outputClosed;

        ActiveExport(GradualExportJob job, GradualExportConfigType config) {
            this.job = job;
            this.config = config;
        }
    }

    private record FetchPlan(long jobId, String targetId, String cursor, int size, ExportFormat format,
            Path destination, boolean shuffle) {
    }

    private record BatchOutcome(HistoryPage page, long bytesWritten) {
    }

    private record Gate(PauseReason reason, Instant resumeAt) {
    }

    @PostConstruct
    void init() {
        engineConfig = defaults.toConfig();
    }

    void onStart(@Observes StartupEvent event) {
        loadFromStore();
    }

    /**
     * Starts exporting {@code targetId} right away.
     *
     * @param overrides
     *            wire-named config values applied on top of the engine defaults, may be null
     * @throws AlreadyRunningException
     *             if a job is running or paused
     * @throws ValidationException
     *             if the overrides are invalid
     */
    public GradualExportJob start(String targetId, Map<String, ?> overrides) {
        ActiveExport run;
        GradualExportJob snapshot;
        synchronized (lock) {
            requireTarget(targetId);
            if (isOccupied()) {
                throw new AlreadyRunningException("Export of " + current.job.targetId + " is "
                        + lower(current.job.state.name()) + "; queue " + targetId + " instead");
            }
            GradualExportConfigType config = resolveConfig(overrides);
            run = activate(newJob(targetId, config, 0), config);
            snapshot = run.job.copy();
        }
        kick(run, Duration.ZERO);
        return snapshot;
    }

    /**
     * Queues {@code targetId}. When nothing occupies the engine the best queued job starts immediately.
     *
     * @param priority
     *            lower values start sooner
     */
    public GradualExportJob queue(String targetId, int priority, Map<String, ?> overrides) {
        Runnable followUp = null;
        GradualExportJob snapshot;
        synchronized (lock) {
            requireTarget(targetId);
            GradualExportConfigType config = resolveConfig(overrides);
            GradualExportJob job = newJob(targetId, config, priority);
            store.upsert(job);
            queue.add(job);
            audit.info(JobAuditService.SOURCE_EXPORT, job.id, "queued",
                    "Queued export of " + targetId + " with priority " + priority);
            if (!isOccupied()) {
                followUp = startNextQueued();
            }
            snapshot = current != null && current.job.id.equals(job.id) ? current.job.copy() : job.copy();
        }
        if (followUp != null) {
            followUp.run();
        }
        return snapshot;
    }

    /**
     * Pauses the current job. Pausing a manually paused job, or an idle engine, changes nothing. An automatically
     * paused job becomes manually paused so it no longer resumes on its own.
     */
    public GradualExportStatusType pause() {
        synchronized (lock) {
            if (current != null && (current.job.state == ExportState.RUNNING
                    || current.job.state == ExportState.PAUSED && current.job.pauseReason != PauseReason.MANUAL)) {
                GradualExportJob job = current.job.copy();
                job.state = ExportState.PAUSED;
                job.pauseReason = PauseReason.MANUAL;
                job.nextActionAt = null;
                store.upsert(job);
                current.job = job;
                current.currentDelayMs = 0;
                stateChanged(job, "paused", "Paused by request");
            }
            return statusLocked();
        }
    }

    /**
     * Resumes a paused job, whatever paused it. On an idle engine with queued jobs, starts the best one. Otherwise
     * changes nothing.
     */
    public GradualExportStatusType resume() {
        Runnable followUp = null;
        GradualExportStatusType status;
        synchronized (lock) {
            if (current != null && current.job.state == ExportState.PAUSED) {
                followUp = resumeLocked(current, "Resumed by request");
            } else if (!isOccupied() && !queue.isEmpty()) {
                followUp = startNextQueued();
            }
            status = statusLocked();
        }
        if (followUp != null) {
            followUp.run();
        }
        return status;
    }

    /**
     * Cancels the current job. Queued jobs stay queued until the next {@code start}, {@code queue} or
     * {@code resume}. Cancelling with nothing running changes nothing.
     */
    public GradualExportStatusType cancel() {
        Runnable followUp = null;
        GradualExportStatusType status;
        synchronized (lock) {
            if (isOccupied()) {
                GradualExportJob job = current.job.copy();
                job.state = ExportState.CANCELLED;
                job.pauseReason = null;
                job.finishedAt = clock.now();
                job.nextActionAt = null;
                store.upsert(job);
                current.job = job;
                current.currentDelayMs = 0;
                stateChanged(job, "cancelled", "Cancelled after " + job.messagesProcessed + " records");
                // A batch still in flight closes the output once it is written
                followUp = closeOutput(current);
            }
            status = statusLocked();
        }
        if (followUp != null) {
            followUp.run();
        }
        return status;
    }

    public GradualExportStatusType status() {
        synchronized (lock) {
            return statusLocked();
        }
    }

    /**
     * Engine defaults applied to newly started or queued jobs.
     */
    public GradualExportConfigType getConfig() {
        synchronized (lock) {
            return engineConfig;
        }
    }

    /**
     * Merges {@code overrides} into the engine defaults and into the current job's configuration (effective from its
     * next batch). Nothing changes if any value is invalid.
     *
     * @throws ValidationException
     *             with kind {@code INVALID_CONFIG}
     */
    public GradualExportConfigType setConfig(Map<String, ?> overrides) {
        if (overrides == null || overrides.isEmpty()) {
            throw ValidationException.invalidConfig("No configuration values given");
        }
        synchronized (lock) {
            GradualExportConfigType updatedDefaults = engineConfig.withOverrides(overrides);
            if (isOccupied()) {
                GradualExportConfigType updatedRun = current.config.withOverrides(overrides);
                GradualExportJob job = current.job.copy();
                job.config = updatedRun.toMap();
                store.upsert(job);
                current.job = job;
                current.config = updatedRun;
            }
            engineConfig = updatedDefaults;
            LOG.infof("Gradual export configuration updated: %s", overrides.keySet());
            return engineConfig;
        }
    }

    /**
     * Queued jobs in start order.
     */
    public List<GradualExportJob> getQueue() {
        synchronized (lock) {
            return queue.stream().sorted(QUEUE_ORDER).map(GradualExportJob::copy).toList();
        }
    }

    /**
     * Removes every queued job from the queue and the store.
     *
     * @return number of removed jobs
     */
    public int clearQueue() {
        synchronized (lock) {
            int removed = 0;
            for (GradualExportJob job : List.copyOf(queue)) {
                store.deleteExportJob(job.id);
                queue.remove(job);
                removed++;
            }
            if (removed > 0) {
                audit.info(JobAuditService.SOURCE_EXPORT, null, "queue_cleared", "Removed " + removed + " queued jobs");
            }
            return removed;
        }
    }

    public int queueSize() {
        synchronized (lock) {
            return queue.size();
        }
    }

    /**
     * Resumes an automatically paused job whose condition has cleared. Called by timers set at pause time and by the
     * watchdog.
     *
     * @return true if the job was resumed
     */
    public boolean checkAutoResume() {
        Runnable followUp;
        synchronized (lock) {
            if (current == null || current.job.state != ExportState.PAUSED || current.job.pauseReason == null
                    || !current.job.pauseReason.autoResumable()) {
                return false;
            }
            Instant now = clock.now();
            if (current.job.pauseReason == PauseReason.BACKOFF && current.job.nextActionAt != null
                    && now.isBefore(current.job.nextActionAt)) {
                return false;
            }
            Gate gate = closedGate(current.config);
            if (gate != null) {
                LOG.debugf("Export %d still held: %s until %s", current.job.id, gate.reason(), gate.resumeAt());
                return false;
            }
            followUp = resumeLocked(current, "Resumed automatically after " + lower(current.job.pauseReason.name()));
        }
        followUp.run();
        return true;
    }

    /**
     * Starts the best queued job if an earlier attempt failed, typically because the store rejected the write. Called
     * by the watchdog.
     *
     * @return true if a queued job was started
     */
    public boolean retryQueuedStart() {
        Runnable followUp;
        synchronized (lock) {
            if (!startPending || isOccupied()) {
                return false;
            }
            followUp = startNextQueued();
        }
        if (followUp == null) {
            return false;
        }
        followUp.run();
        return true;
    }

    /**
     * Restores queue and current job from the store. A job that was running comes back paused (reason
     * {@code RESTORED}) and waits for {@link #resume()}.
     */
    public void loadFromStore() {
        synchronized (lock) {
            List<GradualExportJob> stored = new ArrayList<>(store.loadExportJobs());
            stored.sort(Comparator.comparing(job -> job.id));
            queue.clear();
            current = null;
            long maxId = 0;
            long maxSequence = 0;
            for (GradualExportJob job : stored) {
                maxId = Math.max(maxId, job.id);
                maxSequence = Math.max(maxSequence, job.sequence);
                if (job.state == ExportState.QUEUED) {
                    queue.add(job);
                } else if (job.state.occupiesEngine()) {
                    restore(job);
                }
            }
            nextId.set(maxId + 1);
            nextSequence.set(maxSequence + 1);
            LOG.infof("Loaded %d export jobs (%d queued, current: %s)", stored.size(), queue.size(),
                    current == null ? "none" : current.job.targetId);
        }
    }

    private void restore(GradualExportJob stored) {
        GradualExportJob job = stored.copy();
        if (current != null) {
            // Only one job may occupy the engine; later ones go back to the queue
            job.state = ExportState.QUEUED;
            job.pauseReason = null;
            persistQuietly(job);
            queue.add(job);
            return;
        }
        if (job.state == ExportState.RUNNING) {
            job.state = ExportState.PAUSED;
            job.pauseReason = PauseReason.RESTORED;
            job.nextActionAt = null;
            persistQuietly(job);
        }
        GradualExportConfigType config;
        try {
            config = GradualExportConfigType.fromMap(job.config, engineConfig);
        } catch (ValidationException e) {
            audit.error(JobAuditService.SOURCE_EXPORT, job.id, "config_invalid",
                    "Stored configuration rejected, using defaults: " + e.getMessage());
            config = engineConfig;
        }
        current = new ActiveExport(job, config);
    }

    // Batch loop

    private void kick(ActiveExport run, Duration delay) {
        clock.delay(delay).thenRun(() -> step(run));
    }

    private void step(ActiveExport run) {
        FetchPlan plan;
        Runnable followUp = null;
        try {
            synchronized (lock) {
                if (!continuing(run)) {
                    run.chainActive = false;
                    return;
                }
                Gate gate = closedGate(run.config);
                if (gate != null && gate.reason() == PauseReason.BACKOFF && !run.config.stopOnFloodWait()) {
                    LOG.debugf("Host signals backoff, export %d waits %ds", run.job.id.longValue(),
                            FLOOD_WAIT_MARGIN.toSeconds());
                    run.currentDelayMs = FLOOD_WAIT_MARGIN.toMillis();
                    followUp = () -> kick(run, FLOOD_WAIT_MARGIN);
                    plan = null;
                } else if (gate != null) {
                    followUp = autoPause(run, gate.reason(), gate.resumeAt());
                    plan = null;
                } else {
                    plan = planBatch(run);
                    run.batchInFlight = true;
                }
            }
        } catch (RuntimeException e) {
            failUnexpectedly(run, e);
            return;
        }
        if (plan == null) {
            if (followUp != null) {
                followUp.run();
            }
            return;
        }
        fetchAndWrite(run, plan);
    }

    private FetchPlan planBatch(ActiveExport run) {
        GradualExportConfigType config = run.config;
        RateLimitResult hourly = rateLimitService.checkVolume(HOURLY_KEY, hourlyRule(config));
        RateLimitResult daily = rateLimitService.checkVolume(DAILY_KEY, dailyRule(config));
        int size = (int) uniform(config.minBatchSize(), config.maxBatchSize());
        size = Math.max(1, Math.min(size, Math.min(hourly.remaining(), daily.remaining())));
        return new FetchPlan(run.job.id, run.job.targetId, run.job.cursor, size, config.format(),
                Path.of(run.job.outputPath), config.randomizeOrder());
    }

    private void fetchAndWrite(ActiveExport run, FetchPlan plan) {
        LoggingConfig.setJobId(plan.jobId());
        LoggingConfig.setExportTarget(plan.targetId());
        Span span = tracer.spanBuilder("export.batch").setAttribute("export.target", plan.targetId())
                .setAttribute("export.batch_size", plan.size()).startSpan();
        try {
            LOG.debugf("Fetching %d records of %s after cursor %s", plan.size(), plan.targetId(), plan.cursor());
            Futures.invoke(() -> actionExecutor.fetchBatch(plan.targetId(), plan.cursor(), plan.size()))
                    .toCompletableFuture().orTimeout(fetchTimeoutSeconds, TimeUnit.SECONDS)
                    .thenApply(page -> new BatchOutcome(page, write(plan, page)))
                    .handle((outcome, failure) -> {
                        if (failure != null) {
                            span.setStatus(StatusCode.ERROR, Futures.describe(failure));
                        } else {
                            span.setAttribute("export.records", outcome.page().records().size());
                        }
                        span.end();
                        afterBatch(run, plan, outcome, failure);
                        return null;
                    });
        } finally {
            LoggingConfig.clearMDC();
        }
    }

    private long write(FetchPlan plan, HistoryPage page) {
        if (page == null) {
            throw new IllegalStateException("Host returned no page");
        }
        if (page.records().isEmpty()) {
            return 0;
        }
        List<HistoryRecord> records = new ArrayList<>(page.records());
        if (plan.shuffle()) {
            Collections.shuffle(records, random);
        }
        return writer.write(records, plan.format(), plan.destination()).bytesWritten();
    }

    private void afterBatch(ActiveExport run, FetchPlan plan, BatchOutcome outcome, Throwable failure) {
        Runnable followUp;
        try {
            synchronized (lock) {
                run.batchInFlight = false;
                if (failure != null) {
                    Throwable cause = Futures.unwrap(failure);
                    followUp = cause instanceof BackoffSignalException backoff
                            ? onBackoff(run, backoff.getWaitSeconds())
                            : onBatchFailed(run, cause);
                } else {
                    followUp = onBatchWritten(run, outcome);
                }
                followUp = andThen(closeOutput(run), followUp);
            }
        } catch (RuntimeException e) {
            failUnexpectedly(run, e);
            return;
        }
        if (followUp != null) {
            followUp.run();
        }
    }

    private Runnable onBatchWritten(ActiveExport run, BatchOutcome outcome) {
        HistoryPage page = outcome.page();
        int count = page.records().size();
        GradualExportJob job = run.job.copy();
        job.messagesProcessed += count;
        job.batchesCompleted++;
        job.bytesWritten += outcome.bytesWritten();
        if (page.nextCursor() != null) {
            job.cursor = page.nextCursor();
        }
        job.lastError = null;
        run.retryCount = 0;
        run.consecutiveBatches++;
        rateLimitService.recordVolume(HOURLY_KEY, count);
        rateLimitService.recordVolume(DAILY_KEY, count);
        metrics.recordExportRecords(count);
        LOG.debugf("Export %d batch %d: %d records (%d total)", job.id, job.batchesCompleted, count,
                job.messagesProcessed);

        if (page.isLast()) {
            publishQuietly(run, job);
            return finish(run, ExportState.COMPLETED, null);
        }
        if (!continuing(run)) {
            publishQuietly(run, job);
            run.chainActive = false;
            return null;
        }
        Duration delay = nextDelay(run, job, page.records());
        run.currentDelayMs = delay.toMillis();
        job.nextActionAt = clock.now().plus(delay);
        publishQuietly(run, job);
        return () -> kick(run, delay);
    }

    private Runnable onBatchFailed(ActiveExport run, Throwable cause) {
        run.retryCount++;
        GradualExportJob job = run.job.copy();
        job.failedBatches++;
        job.lastError = Futures.describe(cause);
        audit.error(JobAuditService.SOURCE_EXPORT, job.id, "batch_failed",
                "Batch of " + job.targetId + " failed (attempt " + run.retryCount + "): " + job.lastError);
        if (run.retryCount >= run.config.maxRetries()) {
            publishQuietly(run, job);
            return finish(run, ExportState.ERRORED, job.lastError);
        }
        if (!continuing(run)) {
            publishQuietly(run, job);
            run.chainActive = false;
            return null;
        }
        Duration delay = Duration.ofMillis(run.config.maxDelayMs() * run.retryCount);
        run.currentDelayMs = delay.toMillis();
        job.nextActionAt = clock.now().plus(delay);
        publishQuietly(run, job);
        return () -> kick(run, delay);
    }

    private Runnable onBackoff(ActiveExport run, long waitSeconds) {
        Duration wait = Duration.ofSeconds(Math.max(0, waitSeconds)).plus(FLOOD_WAIT_MARGIN);
        Instant resumeAt = clock.now().plus(wait);
        audit.info(JobAuditService.SOURCE_EXPORT, run.job.id, "flood_wait",
                "Host asked to wait " + waitSeconds + "s during export of " + run.job.targetId);
        if (run.config.stopOnFloodWait()) {
            return autoPause(run, PauseReason.BACKOFF, resumeAt);
        }
        if (!continuing(run)) {
            run.chainActive = false;
            return null;
        }
        GradualExportJob job = run.job.copy();
        job.nextActionAt = resumeAt;
        run.currentDelayMs = wait.toMillis();
        publishQuietly(run, job);
        return () -> kick(run, wait);
    }

    private Runnable autoPause(ActiveExport run, PauseReason reason, Instant resumeAt) {
        run.chainActive = false;
        if (run.job.state != ExportState.RUNNING) {
            return null;
        }
        GradualExportJob job = run.job.copy();
        job.state = ExportState.PAUSED;
        job.pauseReason = reason;
        job.nextActionAt = resumeAt;
        run.currentDelayMs = 0;
        publishQuietly(run, job);
        stateChanged(job, "auto_paused", "Paused (" + lower(reason.name()) + ") until " + resumeAt);
        if (resumeAt == null) {
            return null;
        }
        return () -> clock.delay(nonNegative(Duration.between(clock.now(), resumeAt)))
                .thenRun(this::checkAutoResumeQuietly);
    }

    private Runnable resumeLocked(ActiveExport run, String detail) {
        GradualExportJob job = run.job.copy();
        job.state = ExportState.RUNNING;
        job.pauseReason = null;
        job.nextActionAt = clock.now();
        store.upsert(job);
        run.job = job;
        stateChanged(job, "resumed", detail);
        if (run.chainActive) {
            return null;
        }
        run.chainActive = true;
        return () -> kick(run, Duration.ZERO);
    }

    private Runnable finish(ActiveExport run, ExportState state, String error) {
        run.chainActive = false;
        if (run.job.state.isTerminal()) {
            // Already cancelled
            return closeOutput(run);
        }
        GradualExportJob job = run.job.copy();
        job.state = state;
        job.pauseReason = null;
        job.finishedAt = clock.now();
        job.nextActionAt = null;
        job.lastError = error;
        run.currentDelayMs = 0;
        publishQuietly(run, job);
        stateChanged(job, lower(state.name()),
                "Export of " + job.targetId + " " + lower(state.name()) + " after " + job.messagesProcessed
                        + " records in " + job.batchesCompleted + " batches");
        return andThen(closeOutput(run), run == current ? startNextQueued() : null);
    }

    /**
     * Starts the best queued job. It leaves the queue only once its RUNNING state is stored; otherwise it stays queued
     * and {@link #startPending} is set.
     */
    private Runnable startNextQueued() {
        if (queue.isEmpty()) {
            startPending = false;
            return null;
        }
        queue.sort(QUEUE_ORDER);
        GradualExportJob next = queue.get(0);
        GradualExportConfigType config;
        try {
            config = GradualExportConfigType.fromMap(next.config, engineConfig);
        } catch (ValidationException e) {
            audit.error(JobAuditService.SOURCE_EXPORT, next.id, "config_invalid",
                    "Stored configuration rejected, using defaults: " + e.getMessage());
            config = engineConfig;
        }
        ActiveExport run;
        try {
            run = activate(next, config);
        } catch (RuntimeException e) {
            startPending = true;
            LOG.errorf(e, "Failed to start queued export %d, it stays queued", next.id.longValue());
            audit.error(JobAuditService.SOURCE_EXPORT, next.id, "dequeue_failed", Futures.describe(e));
            return null;
        }
        queue.remove(next);
        startPending = false;
        return () -> kick(run, Duration.ZERO);
    }

    private ActiveExport activate(GradualExportJob queued, GradualExportConfigType config) {
        Instant now = clock.now();
        GradualExportJob job = queued.copy();
        job.state = ExportState.RUNNING;
        job.pauseReason = null;
        if (job.startedAt == null) {
            job.startedAt = now;
        }
        if (job.outputPath == null) {
            job.outputPath = destination(job, config).toString();
        }
        job.nextActionAt = now;
        store.upsert(job);
        ActiveExport run = new ActiveExport(job, config);
        run.chainActive = true;
        current = run;
        stateChanged(job, "started", "Exporting " + job.targetId + " to " + job.outputPath);
        return run;
    }

    private void failUnexpectedly(ActiveExport run, RuntimeException e) {
        LOG.errorf(e, "Gradual export step failed unexpectedly");
        Runnable followUp;
        synchronized (lock) {
            run.batchInFlight = false;
            followUp = finish(run, ExportState.ERRORED, Futures.describe(e));
        }
        if (followUp != null) {
            followUp.run();
        }
    }

    private void checkAutoResumeQuietly() {
        try {
            checkAutoResume();
        } catch (RuntimeException e) {
            LOG.errorf(e, "Automatic resume check failed");
            audit.error(JobAuditService.SOURCE_EXPORT, null, "auto_resume_failed", Futures.describe(e));
        }
    }

    // Pacing

    /**
     * First condition that currently forbids a batch, or null when a batch may run.
     */
    private Gate closedGate(GradualExportConfigType config) {
        ZonedDateTime local = clock.nowInZone();
        if (config.respectActiveHours() && !config.isActiveHour(local.getHour())) {
            return new Gate(PauseReason.ACTIVE_HOURS, nextActiveStart(config, local));
        }
        RateLimitResult daily = rateLimitService.checkVolume(DAILY_KEY, dailyRule(config));
        if (!daily.allowed()) {
            return new Gate(PauseReason.DAILY_CAP, daily.resetsAt());
        }
        RateLimitResult hourly = rateLimitService.checkVolume(HOURLY_KEY, hourlyRule(config));
        if (!hourly.allowed()) {
            return new Gate(PauseReason.HOURLY_CAP, hourly.resetsAt());
        }
        if (actionExecutor.signalsBackoff()) {
            return new Gate(PauseReason.BACKOFF, clock.now().plus(FLOOD_WAIT_MARGIN));
        }
        return null;
    }

    private static Instant nextActiveStart(GradualExportConfigType config, ZonedDateTime local) {
        ZonedDateTime start = local.truncatedTo(ChronoUnit.HOURS).withHour(config.activeHourStart());
        if (!start.isAfter(local)) {
            start = start.plusDays(1);
        }
        return start.toInstant();
    }

    private Duration nextDelay(ActiveExport run, GradualExportJob job, List<HistoryRecord> records) {
        GradualExportConfigType config = run.config;
        long delayMs = uniform(config.minDelayMs(), config.maxDelayMs());
        if (run.consecutiveBatches >= config.batchesBeforePause()) {
            delayMs += config.burstPauseMs() + jitter(config.burstPauseMs());
            run.consecutiveBatches = 0;
        }
        if (job.batchesCompleted % config.batchesBeforeLongPause() == 0) {
            delayMs += config.longPauseMs() + jitter(config.longPauseMs());
        }
        if (config.simulateReading() && !records.isEmpty()) {
            delayMs += readingTimeMs(records);
        }
        return Duration.ofMillis(delayMs);
    }

    /**
     * Time a person would need to read the batch, bounded to keep single batches from stalling the export.
     */
    static long readingTimeMs(List<HistoryRecord> records) {
        long chars = records.stream().mapToLong(record -> record.text() == null ? 0 : record.text().length()).sum();
        long millis = chars * 1000 / READING_CHARS_PER_SECOND;
        return Math.max(MIN_READING_MS, Math.min(MAX_READING_MS, millis));
    }

    private long uniform(long min, long max) {
        return max > min ? random.nextLong(min, max + 1) : min;
    }

    /** Up to a fifth of {@code pauseMs}. */
    private long jitter(long pauseMs) {
        return pauseMs >= 5 ? random.nextLong(0, pauseMs / 5 + 1) : 0;
    }

    private static RateLimitRule hourlyRule(GradualExportConfigType config) {
        return RateLimitRule.of("export_hourly", config.maxMessagesPerHour(), HOUR);
    }

    private static RateLimitRule dailyRule(GradualExportConfigType config) {
        return RateLimitRule.of("export_daily", config.maxMessagesPerDay(), DAY);
    }

    // Helpers

    private boolean isOccupied() {
        return current != null && current.job.state.occupiesEngine();
    }

    private boolean continuing(ActiveExport run) {
        return run == current && run.job.state == ExportState.RUNNING;
    }

    private GradualExportConfigType resolveConfig(Map<String, ?> overrides) {
        return overrides == null || overrides.isEmpty() ? engineConfig : engineConfig.withOverrides(overrides);
    }

    private GradualExportJob newJob(String targetId, GradualExportConfigType config, int priority) {
        GradualExportJob job = new GradualExportJob();
        job.id = nextId.getAndIncrement();
        job.sequence = nextSequence.getAndIncrement();
        job.targetId = targetId;
        job.config = config.toMap();
        job.state = ExportState.QUEUED;
        job.priority = priority;
        job.enqueuedAt = clock.now();
        return job;
    }

    private Path destination(GradualExportJob job, GradualExportConfigType config) {
        if (config.exportPath() != null) {
            return Path.of(config.exportPath());
        }
        String safeTarget = job.targetId.replaceAll("[^A-Za-z0-9._-]", "_");
        return Path.of(exportDirectory, safeTarget + "-" + job.id + "." + config.format().getExtension());
    }

    /**
     * Closes the output of a finished job once no batch is still being written to it. At most once per job.
     */
    private Runnable closeOutput(ActiveExport run) {
        if (run.outputClosed || run.batchInFlight || !run.job.state.isTerminal()) {
            return null;
        }
        run.outputClosed = true;
        GradualExportJob job = run.job;
        GradualExportConfigType config = run.config;
        return () -> finishOutput(job, config);
    }

    private static Runnable andThen(Runnable first, Runnable second) {
        if (first == null) {
            return second;
        }
        if (second == null) {
            return first;
        }
        return () -> {
            first.run();
            second.run();
        };
    }

    private void finishOutput(GradualExportJob job, GradualExportConfigType config) {
        if (job.outputPath == null) {
            return;
        }
        try {
            writer.finish(config.format(), Path.of(job.outputPath));
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to finalize export output %s", job.outputPath);
            audit.error(JobAuditService.SOURCE_EXPORT, job.id, "finalize_failed", Futures.describe(e));
        }
    }

    /**
     * Publishes progress made by the background loop. A store failure is reported, not thrown, because the work it
     * describes already happened.
     */
    private void publishQuietly(ActiveExport run, GradualExportJob job) {
        persistQuietly(job);
        run.job = job;
    }

    private void persistQuietly(GradualExportJob job) {
        try {
            store.upsert(job);
        } catch (RuntimeException e) {
            LOG.errorf(e, "Failed to persist export job %d", job.id);
            audit.error(JobAuditService.SOURCE_EXPORT, job.id, "persist_failed", Futures.describe(e));
        }
    }

    private void stateChanged(GradualExportJob job, String event, String detail) {
        metrics.incrementExportStateChange(job.state.name());
        audit.info(JobAuditService.SOURCE_EXPORT, job.id, event, detail);
    }

    private GradualExportStatusType statusLocked() {
        boolean occupied = isOccupied();
        return new GradualExportStatusType(occupied ? lower(current.job.state.name()) : "idle",
                current == null ? null : GradualExportJobType.from(current.job),
                occupied ? current.config : engineConfig, rateLimitService.usage(HOURLY_KEY, HOUR),
                rateLimitService.usage(DAILY_KEY, DAY), queue.size(), occupied ? current.currentDelayMs : 0);
    }

    private static void requireTarget(String targetId) {
        if (targetId == null || targetId.isBlank()) {
            throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "target_id is required");
        }
    }

    private static Duration nonNegative(Duration duration) {
        return duration.isNegative() ? Duration.ZERO : duration;
    }

    private static String lower(String value) {
        return value.toLowerCase(Locale.ROOT);
    }
}
