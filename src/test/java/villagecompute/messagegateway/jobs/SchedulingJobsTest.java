package villagecompute.messagegateway.jobs;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.messagegateway.services.GradualExportService;
import villagecompute.messagegateway.services.MessageSchedulerService;

import java.util.concurrent.CompletableFuture;

import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

/**
 * Unit tests for the {@code @Scheduled} entry points; each must delegate to its service and tolerate failures.
 */
class SchedulingJobsTest {

    @Mock
    MessageSchedulerService schedulerService;

    @Mock
    GradualExportService exportService;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
    }

    @Test
    void testTicker_delegatesAndSurvivesFailedTick() {
        when(schedulerService.tick()).thenReturn(CompletableFuture.completedFuture(2),
                CompletableFuture.failedFuture(new IllegalStateException("store down")));
        MessageSchedulerTicker ticker = new MessageSchedulerTicker();
        ticker.schedulerService = schedulerService;

        ticker.tick();
        ticker.tick();

        verify(schedulerService, times(2)).tick();
    }

    @Test
    void testWatchdog_checksAutoResumeAndRetriesQueuedStart() {
        when(exportService.checkAutoResume()).thenReturn(true);
        when(exportService.retryQueuedStart()).thenReturn(false);
        GradualExportWatchdog watchdog = new GradualExportWatchdog();
        watchdog.exportService = exportService;

        watchdog.checkExportEngine();

        verify(exportService).checkAutoResume();
        verify(exportService).retryQueuedStart();
    }

    @Test
    void testCleanup_purgesInactive() {
        when(schedulerService.purgeInactive()).thenReturn(4);
        ScheduledMessageCleanupScheduler cleanup = new ScheduledMessageCleanupScheduler();
        cleanup.schedulerService = schedulerService;

        cleanup.purgeInactive();

        verify(schedulerService).purgeInactive();
    }
}
