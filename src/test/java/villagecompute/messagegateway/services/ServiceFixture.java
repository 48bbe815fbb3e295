package villagecompute.messagegateway.services;

import io.opentelemetry.api.trace.TracerProvider;
import villagecompute.messagegateway.data.JobStore;
import villagecompute.messagegateway.integration.messaging.ActionExecutor;
import villagecompute.messagegateway.integration.messaging.ExportWriter;
import villagecompute.messagegateway.observability.ObservabilityMetrics;
import villagecompute.messagegateway.testing.ManualClock;

/**
 * Wires real services against a {@link ManualClock}, the way CDI would, for unit tests that need more than one
 * collaborator.
 */
final class ServiceFixture {

    private ServiceFixture() {
    }

    static RateLimitService rateLimitService(ManualClock clock) {
        RateLimitService service = new RateLimitService();
        service.clock = clock;
        return service;
    }

    static JobAuditService audit(ManualClock clock) {
        JobAuditService audit = new JobAuditService();
        audit.clock = clock;
        return audit;
    }

    static BatchExecutor batchExecutor(ManualClock clock, RateLimitService rateLimitService,
            ObservabilityMetrics metrics) {
        BatchExecutor executor = new BatchExecutor();
        executor.clock = clock;
        executor.rateLimitService = rateLimitService;
        executor.metrics = metrics;
        executor.tracer = TracerProvider.noop().get("test");
        return executor;
    }

    static RecurrenceCalculator recurrence(ManualClock clock) {
        RecurrenceCalculator calculator = new RecurrenceCalculator();
        calculator.clock = clock;
        calculator.customStrategy = new CronRecurrenceStrategy();
        return calculator;
    }

    static MessageSchedulerService scheduler(ManualClock clock, JobStore store, ActionExecutor actionExecutor,
            JobAuditService audit, ObservabilityMetrics metrics) {
        MessageSchedulerService scheduler = new MessageSchedulerService();
        scheduler.clock = clock;
        scheduler.store = store;
        scheduler.actionExecutor = actionExecutor;
        scheduler.recurrence = recurrence(clock);
        scheduler.batchExecutor = batchExecutor(clock, rateLimitService(clock), metrics);
        scheduler.audit = audit;
        scheduler.metrics = metrics;
        scheduler.tracer = TracerProvider.noop().get("test");
        return scheduler;
    }

    static GradualExportService exportService(ManualClock clock, JobStore store, ActionExecutor actionExecutor,
            ExportWriter writer, RateLimitService rateLimitService, JobAuditService audit,
            ObservabilityMetrics metrics) {
        GradualExportService service = new GradualExportService();
        service.clock = clock;
        service.store = store;
        service.actionExecutor = actionExecutor;
        service.writer = writer;
        service.rateLimitService = rateLimitService;
        service.audit = audit;
        service.metrics = metrics;
        service.tracer = TracerProvider.noop().get("test");
        service.exportDirectory = "target/test-exports";
        return service;
    }
}
