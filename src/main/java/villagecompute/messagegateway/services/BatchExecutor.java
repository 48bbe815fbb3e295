package villagecompute.messagegateway.services;

import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.StatusCode;
import io.opentelemetry.api.trace.Tracer;
import jakarta.enterprise.context.ApplicationScoped;
import jakarta.inject.Inject;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.api.types.BatchResultType;
import villagecompute.messagegateway.api.types.BatchStatus;
import villagecompute.messagegateway.api.types.OperationResultType;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.observability.ObservabilityMetrics;
import villagecompute.messagegateway.util.Futures;
import villagecompute.messagegateway.util.SchedulingClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Runs an ordered list of independent actions under a rate cap and aggregates the per-item outcomes.
 *
 * <p>
 * <b>Execution model:</b>
 * <ul>
 * <li>Items run strictly one after another; the next item starts when the previous action's stage completes.</li>
 * <li>After every {@code concurrencyLimit} completed items the run waits on {@link RateLimitService#awaitSpacing} so
 * that consecutive groups start at least {@code rateLimitDelay} apart. A run of {@code k} items therefore takes at
 * least {@code floor(k / concurrencyLimit) * rateLimitDelay}.</li>
 * <li>An action that throws, returns null, or completes exceptionally produces a failed {@link OperationResultType};
 * the run continues unless {@code continueOnError} is false, in which case it stops and reports
 * {@link BatchStatus#FAILED} with the remaining items counted as skipped.</li>
 * </ul>
 *
 * <p>
 * Waiting is a timer stage from the {@link SchedulingClock}; no thread is parked during rate-limit pauses.
 */
@ApplicationScoped
public class BatchExecutor {

    private static final Logger LOG = Logger.getLogger(BatchExecutor.class);

    @Inject
    SchedulingClock clock;

    @Inject
    RateLimitService rateLimitService;

    @Inject
    ObservabilityMetrics metrics;

    @Inject
    Tracer tracer;

    private final AtomicLong runSequence = new AtomicLong();

    /**
     * Per-item action. The returned map becomes {@link OperationResultType#data()}.
     */
    @FunctionalInterface
    public interface BatchAction<T> {
        CompletionStage<Map<String, Object>> apply(T item);
    }

    /**
     * @param concurrencyLimit
     *            items between rate-limit pauses, positive
     * @param rateLimitDelay
     *            minimum spacing between groups, zero disables pausing
     * @param continueOnError
     *            keep going after a failed item
     */
    public record Options(int concurrencyLimit, Duration rateLimitDelay, boolean continueOnError) {

        public Options {
            if (concurrencyLimit <= 0) {
                throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "concurrency_limit must be positive");
            }
            if (rateLimitDelay == null || rateLimitDelay.isNegative()) {
                throw new ValidationException(ErrorKind.INVALID_ARGUMENT, "rate_limit_delay must not be negative");
            }
        }
    }

    /**
     * Runs {@code action} over {@code items}.
     *
     * @param operationType
     *            label for logs, metrics and the result
     * @return stage completing with the aggregated result; it never completes exceptionally because of an item failure
     */
    public <T> CompletionStage<BatchResultType> run(String operationType, List<T> items, BatchAction<T> action,
            Options options) {
        List<T> snapshot = List.copyOf(items);
        String spacingKey = "batch:" + operationType + ":" + runSequence.incrementAndGet();
        RunState state = new RunState(clock.now());

        Span span = tracer.spanBuilder("batch." + operationType).setAttribute("batch.items", snapshot.size())
                .setAttribute("batch.concurrency_limit", options.concurrencyLimit())
                .setAttribute("batch.rate_limit_delay_ms", options.rateLimitDelay().toMillis()).startSpan();

        LOG.debugf("Starting batch %s: %d items, limit=%d, delay=%dms, continueOnError=%s", operationType,
                snapshot.size(), options.concurrencyLimit(), options.rateLimitDelay().toMillis(),
                options.continueOnError());
        rateLimitService.markSpacing(spacingKey);

        return runFrom(0, snapshot, action, options, state, spacingKey).thenApply(v -> {
            BatchResultType result = state.toResult(operationType, snapshot.size(), clock.now());
            span.setAttribute("batch.successful", result.successful());
            span.setAttribute("batch.failed", result.failed());
            if (result.status() != BatchStatus.COMPLETED) {
                span.setStatus(StatusCode.ERROR, result.status().name());
            }
            metrics.incrementBatchRun(operationType, result.status());
            LOG.infof("Batch %s finished: status=%s successful=%d failed=%d skipped=%d duration=%dms",
                    operationType, result.status(), result.successful(), result.failed(), result.skipped(),
                    result.totalDurationMs());
            return result;
        }).whenComplete((result, failure) -> {
            rateLimitService.release(spacingKey);
            span.end();
        });
    }

    /**
     * Processes items from {@code index} on. Items whose stage is already complete are handled in a loop rather than
     * by nested composition so long synchronous runs do not grow the stack.
     */
    private <T> CompletionStage<Void> runFrom(int index, List<T> items, BatchAction<T> action, Options options,
            RunState state, String spacingKey) {
        int i = index;
        while (i < items.size() && !state.aborted) {
            CompletableFuture<Void> step = runItem(i, items.get(i), action, options, state, spacingKey)
                    .toCompletableFuture();
            i++;
            if (!step.isDone()) {
                int next = i;
                return step.thenCompose(v -> runFrom(next, items, action, options, state, spacingKey));
            }
        }
        return CompletableFuture.completedFuture(null);
    }

    private <T> CompletionStage<Void> runItem(int index, T item, BatchAction<T> action, Options options,
            RunState state, String spacingKey) {
        Instant started = clock.now();
        return Futures.invoke(() -> action.apply(item)).handle((data, failure) -> {
            long durationMs = Duration.between(started, clock.now()).toMillis();
            if (failure == null) {
                state.succeeded(OperationResultType.succeeded(index, durationMs, data));
            } else {
                String error = Futures.describe(failure);
                LOG.debugf("Batch item %d failed: %s", index, error);
                state.failed(OperationResultType.failed(index, durationMs, error));
                if (!options.continueOnError()) {
                    state.aborted = true;
                }
            }
            return null;
        }).thenCompose(v -> {
            state.sinceLastPause++;
            if (state.aborted || state.sinceLastPause < options.concurrencyLimit()
                    || options.rateLimitDelay().isZero()) {
                return CompletableFuture.completedFuture(null);
            }
            state.sinceLastPause = 0;
            return rateLimitService.awaitSpacing(spacingKey, options.rateLimitDelay());
        });
    }

    /**
     * Mutable accumulator confined to one run; items never overlap, so no locking is needed.
     */
    private static final class RunState {

        private final Instant startedAt;
        private final List<OperationResultType> results = new ArrayList<>();
        private final List<String> errors = new ArrayList<>();
        private int successful;
        private int failed;
        private int sinceLastPause;
        private boolean aborted;

        RunState(Instant startedAt) {
            this.startedAt = startedAt;
        }

        void succeeded(OperationResultType result) {
            results.add(result);
            successful++;
        }

        void failed(OperationResultType result) {
            results.add(result);
            errors.add(result.error());
            failed++;
        }

        BatchResultType toResult(String operationType, int total, Instant completedAt) {
            BatchStatus status;
            if (aborted || successful == 0 && failed > 0) {
                status = BatchStatus.FAILED;
            } else if (failed == 0) {
                status = BatchStatus.COMPLETED;
            } else {
                status = BatchStatus.PARTIAL;
            }
            int skipped = total - successful - failed;
            return new BatchResultType(operationType, total, successful, failed, skipped, results, errors, status,
                    startedAt, completedAt, Duration.between(startedAt, completedAt).toMillis());
        }
    }
}
