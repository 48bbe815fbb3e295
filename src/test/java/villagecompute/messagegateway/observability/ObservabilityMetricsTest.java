package villagecompute.messagegateway.observability;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.Mock;
import org.mockito.MockitoAnnotations;
import villagecompute.messagegateway.api.types.BatchStatus;
import villagecompute.messagegateway.services.GradualExportService;
import villagecompute.messagegateway.services.MessageSchedulerService;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.mockito.Mockito.when;

class ObservabilityMetricsTest {

    @Mock
    MessageSchedulerService schedulerService;

    @Mock
    GradualExportService exportService;

    private SimpleMeterRegistry registry;
    private ObservabilityMetrics metrics;

    @BeforeEach
    void setUp() {
        MockitoAnnotations.openMocks(this);
        registry = new SimpleMeterRegistry();
        metrics = new ObservabilityMetrics();
        metrics.registry = registry;
        metrics.schedulerService = schedulerService;
        metrics.exportService = exportService;
    }

    @Test
    void testCounters_taggedByOutcome() {
        metrics.incrementScheduleFire("ONCE", true);
        metrics.incrementScheduleFire("ONCE", true);
        metrics.incrementScheduleFire("RECURRING", false);
        metrics.incrementBatchRun("batch_send", BatchStatus.PARTIAL);
        metrics.incrementToolCall("schedule_message", false);

        assertEquals(2.0, registry.get("gateway_schedule_fires_total").tags("kind", "once", "result", "success")
                .counter().count());
        assertEquals(1.0, registry.get("gateway_schedule_fires_total").tags("kind", "recurring", "result", "failure")
                .counter().count());
        assertEquals(1.0, registry.get("gateway_batch_operations_total").tags("operation", "batch_send", "status",
                "partial").counter().count());
        assertEquals(1.0,
                registry.get("gateway_tool_calls_total").tags("tool", "schedule_message", "result", "failure")
                        .counter().count());
    }

    @Test
    void testRecordExportRecords_ignoresZero() {
        metrics.recordExportRecords(0);
        assertNull(registry.find("gateway_export_records_total").counter());

        metrics.recordExportRecords(25);
        metrics.recordExportRecords(5);
        assertEquals(30.0, registry.get("gateway_export_records_total").counter().count());
    }

    @Test
    void testRegisterMetrics_gaugesReadServices() {
        when(schedulerService.activeCount()).thenReturn(3);
        when(exportService.queueSize()).thenReturn(2);

        metrics.registerMetrics(new Object());

        assertEquals(3.0, registry.get("gateway_scheduled_active").gauge().value());
        assertEquals(2.0, registry.get("gateway_export_queue_depth").gauge().value());
    }
}
