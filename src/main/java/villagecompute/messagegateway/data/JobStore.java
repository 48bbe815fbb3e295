package villagecompute.messagegateway.data;

import villagecompute.messagegateway.data.models.GradualExportJob;
import villagecompute.messagegateway.data.models.ScheduledMessage;

import java.util.List;

/**
 * Durable storage for scheduled messages and gradual export jobs.
 *
 * <p>
 * Implementations must treat each call as one atomic write and throw
 * {@link villagecompute.messagegateway.exceptions.JobStoreException} on failure. Callers only publish a change in
 * memory after the corresponding call returned normally.
 */
public interface JobStore {

    List<ScheduledMessage> loadScheduledMessages();

    void upsert(ScheduledMessage message);

    void deleteScheduledMessage(long id);

    List<GradualExportJob> loadExportJobs();

    void upsert(GradualExportJob job);

    void deleteExportJob(long id);
}
