package villagecompute.messagegateway.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.messagegateway.api.types.BatchResultType;
import villagecompute.messagegateway.api.types.BatchStatus;
import villagecompute.messagegateway.exceptions.ActionExecutionException;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.observability.ObservabilityMetrics;
import villagecompute.messagegateway.services.BatchExecutor.BatchAction;
import villagecompute.messagegateway.services.BatchExecutor.Options;
import villagecompute.messagegateway.testing.ManualClock;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.stream.IntStream;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.Mockito.verify;

/**
 * Unit tests for {@link BatchExecutor}.
 */
class BatchExecutorTest {

    @Mock
    ObservabilityMetrics metrics;

    private ManualClock clock;
    private BatchExecutor executor;

    private static final Options NO_DELAY = new Options(10, Duration.ZERO, true);

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new ManualClock(Instant.parse("2024-01-01T12:00:00Z"));
        executor = ServiceFixture.batchExecutor(clock, ServiceFixture.rateLimitService(clock), metrics);
    }

    private static BatchAction<String> echo() {
        return item -> CompletableFuture.completedFuture(Map.of("item", item));
    }

    private BatchResultType runNow(List<String> items, BatchAction<String> action, Options options) {
        CompletableFuture<BatchResultType> future = executor.run("test_op", items, action, options)
                .toCompletableFuture();
        assertTrue(future.isDone(), "run without delays should complete synchronously");
        return future.join();
    }

    @Test
    void testRun_allSucceed_completed() {
        BatchResultType result = runNow(List.of("a", "b", "c"), echo(), NO_DELAY);

        assertEquals(BatchStatus.COMPLETED, result.status());
        assertEquals(3, result.total());
        assertEquals(3, result.successful());
        assertEquals(0, result.failed());
        assertEquals(0, result.skipped());
        assertEquals(List.of(0, 1, 2), result.results().stream().map(r -> r.index()).toList());
        assertEquals("b", result.results().get(1).data().get("item"));
        verify(metrics).incrementBatchRun("test_op", BatchStatus.COMPLETED);
    }

    @Test
    void testRun_someFail_partialWithErrors() {
        BatchAction<String> action = item -> item.equals("bad")
                ? CompletableFuture.failedFuture(new ActionExecutionException("boom on " + item))
                : CompletableFuture.completedFuture(Map.of());

        BatchResultType result = runNow(List.of("a", "bad", "c"), action, NO_DELAY);

        assertEquals(BatchStatus.PARTIAL, result.status());
        assertEquals(2, result.successful());
        assertEquals(1, result.failed());
        assertEquals(List.of("boom on bad"), result.errors());
        assertFalse(result.results().get(1).success());
        assertEquals(result.total(), result.successful() + result.failed() + result.skipped());
    }

    @Test
    void testRun_allFail_failed() {
        BatchAction<String> action = item -> {
            throw new ActionExecutionException("sync failure");
        };

        BatchResultType result = runNow(List.of("a", "b"), action, NO_DELAY);

        assertEquals(BatchStatus.FAILED, result.status());
        assertEquals(2, result.failed());
        assertEquals(0, result.skipped());
    }

    @Test
    void testRun_nullStage_countsAsFailure() {
        BatchResultType result = runNow(List.of("a"), item -> null, NO_DELAY);

        assertEquals(BatchStatus.FAILED, result.status());
        assertEquals(1, result.failed());
    }

    @Test
    void testRun_emptyList_completedWithZeroTotals() {
        BatchResultType result = runNow(List.of(), echo(), NO_DELAY);

        assertEquals(BatchStatus.COMPLETED, result.status());
        assertEquals(0, result.total());
        assertTrue(result.results().isEmpty());
    }

    @Test
    void testRun_stopOnError_skipsRemainingItems() {
        List<String> attempted = new ArrayList<>();
        BatchAction<String> action = item -> {
            attempted.add(item);
            return item.equals("b")
                    ? CompletableFuture.failedFuture(new ActionExecutionException("stop here"))
                    : CompletableFuture.completedFuture(Map.of());
        };

        BatchResultType result = runNow(List.of("a", "b", "c", "d"), action, new Options(10, Duration.ZERO, false));

        assertEquals(List.of("a", "b"), attempted);
        assertEquals(BatchStatus.FAILED, result.status());
        assertEquals(1, result.successful());
        assertEquals(1, result.failed());
        assertEquals(2, result.skipped());
    }

    @Test
    void testRun_rateLimit_elapsedAtLeastGroupsTimesDelay() {
        List<String> items = IntStream.range(0, 5).mapToObj(Integer::toString).toList();

        CompletableFuture<BatchResultType> future = executor
                .run("paced", items, echo(), new Options(2, Duration.ofSeconds(10), true)).toCompletableFuture();

        // floor(5 / 2) * 10s = 20s
        clock.advance(Duration.ofSeconds(19));
        assertFalse(future.isDone());

        clock.advance(Duration.ofSeconds(1));
        assertTrue(future.isDone());
        BatchResultType result = future.join();
        assertEquals(BatchStatus.COMPLETED, result.status());
        assertTrue(result.totalDurationMs() >= 20_000);
    }

    @Test
    void testRun_rateLimit_pausesAfterFinalFullGroup() {
        List<String> items = List.of("a", "b", "c", "d");

        CompletableFuture<BatchResultType> future = executor
                .run("paced", items, echo(), new Options(2, Duration.ofSeconds(5), true)).toCompletableFuture();

        clock.advance(Duration.ofSeconds(9));
        assertFalse(future.isDone());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(10_000, future.join().totalDurationMs());
    }

    @Test
    void testRun_longSynchronousRun_doesNotOverflowStack() {
        List<Integer> items = IntStream.range(0, 20_000).boxed().toList();

        BatchResultType result = executor
                .run("long", items, item -> CompletableFuture.completedFuture(Map.of()), NO_DELAY)
                .toCompletableFuture().join();

        assertEquals(20_000, result.successful());
    }

    @Test
    void testOptions_rejectsInvalidValues() {
        assertThrows(ValidationException.class, () -> new Options(0, Duration.ZERO, true));
        assertThrows(ValidationException.class, () -> new Options(1, Duration.ofSeconds(-1), true));
        assertThrows(ValidationException.class, () -> new Options(1, null, true));
    }

    @Test
    void testRun_failedItemHasNoData() {
        BatchResultType result = runNow(List.of("x"),
                item -> CompletableFuture.failedFuture(new ActionExecutionException("nope")), NO_DELAY);

        assertNull(result.results().get(0).data().get("item"));
        assertEquals("nope", result.results().get(0).error());
    }
}
