package villagecompute.messagegateway.services;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.messagegateway.data.models.ScheduledMessage;
import villagecompute.messagegateway.data.models.ScheduledMessage.RecurrencePattern;
import villagecompute.messagegateway.data.models.ScheduledMessage.ScheduleStatus;
import villagecompute.messagegateway.exceptions.ActionExecutionException;
import villagecompute.messagegateway.exceptions.ErrorKind;
import villagecompute.messagegateway.exceptions.JobStoreException;
import villagecompute.messagegateway.exceptions.ResourceNotFoundException;
import villagecompute.messagegateway.exceptions.ValidationException;
import villagecompute.messagegateway.integration.messaging.ActionExecutor;
import villagecompute.messagegateway.integration.messaging.SendReceipt;
import villagecompute.messagegateway.observability.ObservabilityMetrics;
import villagecompute.messagegateway.testing.InMemoryJobStore;
import villagecompute.messagegateway.testing.ManualClock;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CompletableFuture;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for {@link MessageSchedulerService}.
 */
class MessageSchedulerServiceTest {

    private static final Instant START = Instant.parse("2024-01-01T08:00:00Z");
    private static final Instant NINE_AM = Instant.parse("2024-01-01T09:00:00Z");

    @Mock
    ActionExecutor actionExecutor;

    @Mock
    ObservabilityMetrics metrics;

    private ManualClock clock;
    private InMemoryJobStore store;
    private JobAuditService audit;
    private MessageSchedulerService scheduler;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        clock = new ManualClock(START);
        store = new InMemoryJobStore();
        audit = ServiceFixture.audit(clock);
        scheduler = ServiceFixture.scheduler(clock, store, actionExecutor, audit, metrics);
        when(actionExecutor.send(anyString(), anyString()))
                .thenReturn(CompletableFuture.completedFuture(new SendReceipt("m-1", START)));
    }

    private int tick() {
        return scheduler.tick().toCompletableFuture().join();
    }

    private ScheduledMessage job(long id) {
        return scheduler.get(id).orElseThrow();
    }

    @Test
    void testScheduleOnce_persistsActiveJob() {
        ScheduledMessage created = scheduler.scheduleOnce("chat-1", "hello", "2024-01-01T10:00:00Z", "test");

        assertEquals(ScheduleStatus.ACTIVE, created.status);
        assertEquals(Instant.parse("2024-01-01T10:00:00Z"), created.nextScheduled);
        assertEquals(created.payload, store.storedMessage(created.id).payload);
    }

    @Test
    void testScheduleOnce_unparseableTime_invalidTime() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> scheduler.scheduleOnce("chat-1", "hello", "tomorrow-ish", "test"));

        assertEquals(ErrorKind.INVALID_TIME, e.getKind());
        assertTrue(scheduler.list(null, true).isEmpty());
    }

    @Test
    void testTick_firesDueOnceJobExactlyOnce() {
        ScheduledMessage created = scheduler.scheduleOnce("chat-1", "hello", NINE_AM, "test");

        assertEquals(0, tick());
        verify(actionExecutor, never()).send(anyString(), anyString());

        clock.advance(Duration.ofHours(1));
        assertEquals(1, tick());
        assertEquals(0, tick());

        verify(actionExecutor, times(1)).send("chat-1", "hello");
        ScheduledMessage fired = job(created.id);
        assertEquals(ScheduleStatus.COMPLETED, fired.status);
        assertEquals(1, fired.occurrencesSent);
        assertNull(fired.nextScheduled);
        verify(metrics).incrementScheduleFire("ONCE", true);
    }

    @Test
    void testScheduleOnce_pastTime_firesOnNextTick() {
        ScheduledMessage created = scheduler.scheduleOnce("chat-1", "late", START.minusSeconds(60), "test");

        assertEquals(1, tick());
        assertEquals(ScheduleStatus.COMPLETED, job(created.id).status);
    }

    @Test
    void testScheduleDelayed_firesAfterDelay() {
        ScheduledMessage created = scheduler.scheduleDelayed("chat-1", "soon", 60, "test");
        assertEquals(START.plusSeconds(60), created.nextScheduled);

        clock.advance(Duration.ofSeconds(59));
        assertEquals(0, tick());
        clock.advance(Duration.ofSeconds(1));
        assertEquals(1, tick());
        assertEquals(ScheduleStatus.COMPLETED, job(created.id).status);
    }

    @Test
    void testScheduleDelayed_negativeDelay_rejected() {
        ValidationException e = assertThrows(ValidationException.class,
                () -> scheduler.scheduleDelayed("chat-1", "x", -1, "test"));
        assertEquals(ErrorKind.INVALID_TIME, e.getKind());
    }

    @Test
    void testRecurringDaily_threeOccurrences_thenCompleted() {
        ScheduledMessage created = scheduler.scheduleRecurring("chat-1", "daily", NINE_AM, RecurrencePattern.DAILY,
                null, 3, "test");

        clock.advance(Duration.ofHours(1));
        assertEquals(1, tick());
        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), job(created.id).nextScheduled);

        clock.advance(Duration.ofDays(1));
        assertEquals(1, tick());
        assertEquals(Instant.parse("2024-01-03T09:00:00Z"), job(created.id).nextScheduled);

        clock.advance(Duration.ofDays(1));
        assertEquals(1, tick());

        ScheduledMessage done = job(created.id);
        assertEquals(ScheduleStatus.COMPLETED, done.status);
        assertEquals(3, done.occurrencesSent);
        assertNull(done.nextScheduled);

        clock.advance(Duration.ofDays(1));
        assertEquals(0, tick());
        verify(actionExecutor, times(3)).send("chat-1", "daily");
    }

    @Test
    void testRecurringDaily_firesLate_nextRunCountedFromSendTime() {
        ScheduledMessage created = scheduler.scheduleRecurring("chat-1", "daily", NINE_AM, RecurrencePattern.DAILY,
                null, -1, "test");

        clock.set(Instant.parse("2024-01-01T09:30:00Z"));
        assertEquals(1, tick());

        ScheduledMessage after = job(created.id);
        assertEquals(Instant.parse("2024-01-01T09:30:00Z"), after.lastSent);
        assertEquals(Instant.parse("2024-01-02T09:30:00Z"), after.nextScheduled);
    }

    @Test
    void testRecurring_neverExceedsMaxOccurrences() {
        ScheduledMessage created = scheduler.scheduleRecurring("chat-1", "hourly", null, RecurrencePattern.HOURLY,
                null, 2, "test");

        for (int i = 0; i < 5; i++) {
            tick();
            clock.advance(Duration.ofHours(1));
        }

        assertEquals(2, job(created.id).occurrencesSent);
        verify(actionExecutor, times(2)).send("chat-1", "hourly");
    }

    @Test
    void testRecurring_invalidMaxOccurrences_rejected() {
        assertThrows(ValidationException.class, () -> scheduler.scheduleRecurring("chat-1", "x", null,
                RecurrencePattern.DAILY, null, 0, "test"));
        assertThrows(ValidationException.class, () -> scheduler.scheduleRecurring("chat-1", "x", null,
                RecurrencePattern.NONE, null, -1, "test"));
    }

    @Test
    void testRecurringCustom_usesCronExpression() {
        ScheduledMessage created = scheduler.scheduleRecurring("chat-1", "cron", NINE_AM, RecurrencePattern.CUSTOM,
                "0 9 * * MON-FRI", -1, "test");

        clock.advance(Duration.ofHours(1));
        tick();

        // 2024-01-01 is a Monday
        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), job(created.id).nextScheduled);
    }

    @Test
    void testTick_onceSendFails_jobFailedAndAudited() {
        when(actionExecutor.send("chat-1", "hello"))
                .thenReturn(CompletableFuture.failedFuture(new ActionExecutionException("host down")));
        ScheduledMessage created = scheduler.scheduleOnce("chat-1", "hello", START, "test");

        assertEquals(1, tick());

        ScheduledMessage failed = job(created.id);
        assertEquals(ScheduleStatus.FAILED, failed.status);
        assertEquals("host down", failed.lastError);
        assertTrue(audit.recent(10).stream().anyMatch(e -> e.type().equals("send_failed") && e.error()));
        assertEquals(0, tick());
        verify(metrics).incrementScheduleFire("ONCE", false);
    }

    @Test
    void testTick_recurringSendFails_staysActiveAndMovesToNextSlot() {
        when(actionExecutor.send("chat-1", "daily"))
                .thenReturn(CompletableFuture.failedFuture(new ActionExecutionException("flaky")));
        ScheduledMessage created = scheduler.scheduleRecurring("chat-1", "daily", NINE_AM, RecurrencePattern.DAILY,
                null, 3, "test");

        clock.advance(Duration.ofHours(1));
        tick();

        ScheduledMessage after = job(created.id);
        assertEquals(ScheduleStatus.ACTIVE, after.status);
        assertEquals(0, after.occurrencesSent);
        assertEquals("flaky", after.lastError);
        assertEquals(Instant.parse("2024-01-02T09:00:00Z"), after.nextScheduled);
    }

    @Test
    void testPause_isIdempotentAndStopsFiring() {
        ScheduledMessage created = scheduler.scheduleOnce("chat-1", "hello", NINE_AM, "test");

        assertEquals(ScheduleStatus.PAUSED, scheduler.pause(created.id).status);
        int writes = store.writes();
        assertEquals(ScheduleStatus.PAUSED, scheduler.pause(created.id).status);
        assertEquals(writes, store.writes());

        clock.advance(Duration.ofHours(2));
        assertEquals(0, tick());
        verify(actionExecutor, never()).send(anyString(), anyString());

        assertEquals(ScheduleStatus.ACTIVE, scheduler.resume(created.id).status);
        assertEquals(ScheduleStatus.ACTIVE, scheduler.resume(created.id).status);
        assertEquals(1, tick());
    }

    @Test
    void testResume_recurringSkipsMissedSlots() {
        ScheduledMessage created = scheduler.scheduleRecurring("chat-1", "hourly", NINE_AM, RecurrencePattern.HOURLY,
                null, -1, "test");
        scheduler.pause(created.id);

        clock.set(Instant.parse("2024-01-01T12:30:00Z"));
        ScheduledMessage resumed = scheduler.resume(created.id);

        assertEquals(Instant.parse("2024-01-01T13:00:00Z"), resumed.nextScheduled);
    }

    @Test
    void testCancel_isIdempotentAndTerminal() {
        ScheduledMessage created = scheduler.scheduleOnce("chat-1", "hello", NINE_AM, "test");

        assertEquals(ScheduleStatus.CANCELLED, scheduler.cancel(created.id).status);
        assertEquals(ScheduleStatus.CANCELLED, scheduler.cancel(created.id).status);

        ValidationException e = assertThrows(ValidationException.class, () -> scheduler.pause(created.id));
        assertEquals(ErrorKind.INVALID_STATE, e.getKind());
        assertThrows(ValidationException.class, () -> scheduler.resume(created.id));
        assertThrows(ValidationException.class, () -> scheduler.update(created.id, "changed"));
    }

    @Test
    void testOperations_unknownId_notFound() {
        assertThrows(ResourceNotFoundException.class, () -> scheduler.cancel(42));
        assertThrows(ResourceNotFoundException.class, () -> scheduler.pause(42));
        assertFalse(scheduler.get(42).isPresent());
    }

    @Test
    void testUpdate_replacesPayloadForNextSend() {
        ScheduledMessage created = scheduler.scheduleOnce("chat-1", "draft", NINE_AM, "test");

        assertEquals("final", scheduler.update(created.id, "final").payload);

        clock.advance(Duration.ofHours(1));
        tick();
        verify(actionExecutor).send("chat-1", "final");
    }

    @Test
    void testStoreFailure_leavesMemoryUnchanged() {
        ScheduledMessage created = scheduler.scheduleOnce("chat-1", "hello", NINE_AM, "test");
        store.failWrites(true);

        assertThrows(JobStoreException.class, () -> scheduler.pause(created.id));
        assertThrows(JobStoreException.class, () -> scheduler.scheduleOnce("chat-2", "x", NINE_AM, "test"));

        assertEquals(ScheduleStatus.ACTIVE, job(created.id).status);
        assertEquals(1, scheduler.list(null, true).size());
    }

    @Test
    void testList_filtersAndOrdersByNextScheduled() {
        ScheduledMessage later = scheduler.scheduleOnce("chat-1", "later", NINE_AM.plusSeconds(600), "test");
        ScheduledMessage sooner = scheduler.scheduleOnce("chat-1", "sooner", NINE_AM, "test");
        ScheduledMessage other = scheduler.scheduleOnce("chat-2", "other", NINE_AM, "test");
        scheduler.cancel(other.id);

        List<ScheduledMessage> chatOne = scheduler.list("chat-1", false);
        assertEquals(List.of(sooner.id, later.id), chatOne.stream().map(m -> m.id).toList());
        assertTrue(scheduler.list("chat-2", false).isEmpty());
        assertEquals(1, scheduler.list("chat-2", true).size());
        assertEquals(2, scheduler.activeCount());
    }

    @Test
    void testLoadFromStore_restoresJobsAndContinuesIds() {
        ScheduledMessage first = scheduler.scheduleOnce("chat-1", "a", NINE_AM, "test");
        scheduler.scheduleOnce("chat-1", "b", NINE_AM, "test");

        MessageSchedulerService restarted = ServiceFixture.scheduler(clock, store, actionExecutor, audit, metrics);
        restarted.loadFromStore();

        assertEquals("a", restarted.get(first.id).orElseThrow().payload);
        assertEquals(3L, restarted.scheduleOnce("chat-1", "c", NINE_AM, "test").id);
    }

    @Test
    void testPurgeInactive_removesOldFinishedJobs() {
        ScheduledMessage cancelled = scheduler.scheduleOnce("chat-1", "a", NINE_AM, "test");
        ScheduledMessage active = scheduler.scheduleOnce("chat-1", "b", NINE_AM.plus(Duration.ofDays(60)), "test");
        scheduler.cancel(cancelled.id);

        clock.advance(Duration.ofDays(31));
        assertEquals(1, scheduler.purgeInactive());

        assertFalse(scheduler.get(cancelled.id).isPresent());
        assertNull(store.storedMessage(cancelled.id));
        assertTrue(scheduler.get(active.id).isPresent());
    }

    @Test
    void testTick_isSingleFlight() {
        CompletableFuture<SendReceipt> pending = new CompletableFuture<>();
        when(actionExecutor.send("chat-1", "slow")).thenReturn(pending);
        scheduler.scheduleOnce("chat-1", "slow", START, "test");

        CompletableFuture<Integer> first = scheduler.tick().toCompletableFuture();
        assertFalse(first.isDone());
        assertEquals(0, tick());

        pending.complete(new SendReceipt("m-2", START));
        assertEquals(1, first.join());
    }
}
