package villagecompute.messagegateway.data;

import jakarta.enterprise.context.ApplicationScoped;
import jakarta.transaction.Transactional;
import org.jboss.logging.Logger;
import villagecompute.messagegateway.data.models.GradualExportJob;
import villagecompute.messagegateway.data.models.ScheduledMessage;
import villagecompute.messagegateway.exceptions.JobStoreException;

import java.util.List;

/**
 * PostgreSQL-backed {@link JobStore} using Hibernate ORM with Panache.
 *
 * <p>
 * Callers hand over detached snapshots, so writes go through {@code merge} and never keep a managed instance around.
 * Every method runs in its own transaction; persistence failures are rethrown as {@link JobStoreException}.
 */
@ApplicationScoped
public class DatabaseJobStore implements JobStore {

    private static final Logger LOG = Logger.getLogger(DatabaseJobStore.class);

    @Override
    @Transactional
    public List<ScheduledMessage> loadScheduledMessages() {
        try {
            List<ScheduledMessage> messages = ScheduledMessage.findAllOrdered();
            messages.forEach(m -> ScheduledMessage.getEntityManager().detach(m));
            return messages;
        } catch (RuntimeException e) {
            throw new JobStoreException("Failed to load scheduled messages", e);
        }
    }

    @Override
    @Transactional
    public void upsert(ScheduledMessage message) {
        try {
            ScheduledMessage.getEntityManager().merge(message);
            ScheduledMessage.getEntityManager().flush();
            LOG.debugf("Persisted scheduled message %d (status: %s)", message.id, message.status);
        } catch (RuntimeException e) {
            throw new JobStoreException("Failed to persist scheduled message " + message.id, e);
        }
    }

    @Override
    @Transactional
    public void deleteScheduledMessage(long id) {
        try {
            ScheduledMessage.deleteById(id);
        } catch (RuntimeException e) {
            throw new JobStoreException("Failed to delete scheduled message " + id, e);
        }
    }

    @Override
    @Transactional
    public List<GradualExportJob> loadExportJobs() {
        try {
            List<GradualExportJob> jobs = GradualExportJob.findAllOrdered();
            jobs.forEach(j -> GradualExportJob.getEntityManager().detach(j));
            return jobs;
        } catch (RuntimeException e) {
            throw new JobStoreException("Failed to load gradual export jobs", e);
        }
    }

    @Override
    @Transactional
    public void upsert(GradualExportJob job) {
        try {
            GradualExportJob.getEntityManager().merge(job);
            GradualExportJob.getEntityManager().flush();
            LOG.debugf("Persisted export job %d for %s (state: %s)", job.id, job.targetId, job.state);
        } catch (RuntimeException e) {
            throw new JobStoreException("Failed to persist export job " + job.id, e);
        }
    }

    @Override
    @Transactional
    public void deleteExportJob(long id) {
        try {
            GradualExportJob.deleteById(id);
        } catch (RuntimeException e) {
            throw new JobStoreException("Failed to delete export job " + id, e);
        }
    }
}
