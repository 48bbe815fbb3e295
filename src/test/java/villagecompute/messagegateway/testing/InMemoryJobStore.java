package villagecompute.messagegateway.testing;

import villagecompute.messagegateway.data.JobStore;
import villagecompute.messagegateway.data.models.GradualExportJob;
import villagecompute.messagegateway.data.models.ScheduledMessage;
import villagecompute.messagegateway.exceptions.JobStoreException;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * {@link JobStore} keeping detached copies in memory. Writes can be made to fail to exercise persistence errors.
 */
public class InMemoryJobStore implements JobStore {

    private final Map<Long, ScheduledMessage> messages = new TreeMap<>();
    private final Map<Long, GradualExportJob> exports = new TreeMap<>();
    private boolean failWrites;
    private int writes;

    public synchronized void failWrites(boolean fail) {
        this.failWrites = fail;
    }

    public synchronized int writes() {
        return writes;
    }

    public synchronized ScheduledMessage storedMessage(long id) {
        ScheduledMessage message = messages.get(id);
        return message == null ? null : message.copy();
    }

    public synchronized GradualExportJob storedExport(long id) {
        GradualExportJob job = exports.get(id);
        return job == null ? null : job.copy();
    }

    @Override
    public synchronized List<ScheduledMessage> loadScheduledMessages() {
        return messages.values().stream().map(ScheduledMessage::copy).toList();
    }

    @Override
    public synchronized void upsert(ScheduledMessage message) {
        checkWritable();
        messages.put(message.id, message.copy());
    }

    @Override
    public synchronized void deleteScheduledMessage(long id) {
        checkWritable();
        messages.remove(id);
    }

    @Override
    public synchronized List<GradualExportJob> loadExportJobs() {
        return exports.values().stream().map(GradualExportJob::copy).toList();
    }

    @Override
    public synchronized void upsert(GradualExportJob job) {
        checkWritable();
        exports.put(job.id, job.copy());
    }

    @Override
    public synchronized void deleteExportJob(long id) {
        checkWritable();
        exports.remove(id);
    }

    private void checkWritable() {
        if (failWrites) {
            throw new JobStoreException("Store unavailable");
        }
        writes++;
    }
}
