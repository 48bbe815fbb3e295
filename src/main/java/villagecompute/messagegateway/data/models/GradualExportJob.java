package villagecompute.messagegateway.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;
import org.hibernate.annotations.JdbcTypeCode;
import org.hibernate.type.SqlTypes;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Panache entity for a throttled export of one target's message history.
 *
 * <p>
 * The engine keeps at most one job in {@link ExportState#RUNNING}; a {@link ExportState#PAUSED} job also occupies the
 * engine. All other non-terminal jobs are {@link ExportState#QUEUED} and ordered by {@code priority} (lower first),
 * then {@code enqueued_at}, then {@code sequence}.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code config} (JSONB) - Effective {@code GradualExportConfigType} for this job</li>
 * <li>{@code cursor} (TEXT) - Opaque position returned by the last fetched page</li>
 * <li>{@code pause_reason} (TEXT) - Why a paused job is paused; null otherwise</li>
 * </ul>
 */
@Entity
@Table(
        name = "gradual_export_jobs")
public class GradualExportJob extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "target_id",
            nullable = false)
    public String targetId;

    @Column(
            name = "config",
            columnDefinition = "jsonb")
    @JdbcTypeCode(SqlTypes.JSON)
    public Map<String, Object> config;

    @Column(
            name = "state",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ExportState state;

    @Column(
            name = "pause_reason")
    @Enumerated(EnumType.STRING)
    public PauseReason pauseReason;

    @Column(
            name = "priority",
            nullable = false)
    public int priority;

    @Column(
            name = "sequence",
            nullable = false)
    public long sequence;

    @Column(
            name = "messages_processed",
            nullable = false)
    public long messagesProcessed;

    @Column(
            name = "batches_completed",
            nullable = false)
    public int batchesCompleted;

    @Column(
            name = "bytes_written",
            nullable = false)
    public long bytesWritten;

    @Column(
            name = "failed_batches",
            nullable = false)
    public int failedBatches;

    @Column(
            name = "cursor")
    public String cursor;

    @Column(
            name = "output_path")
    public String outputPath;

    @Column(
            name = "last_error",
            columnDefinition = "text")
    public String lastError;

    @Column(
            name = "enqueued_at",
            nullable = false)
    public Instant enqueuedAt;

    @Column(
            name = "started_at")
    public Instant startedAt;

    @Column(
            name = "finished_at")
    public Instant finishedAt;

    @Column(
            name = "next_action_at")
    public Instant nextActionAt;

    public enum ExportState {
        QUEUED, RUNNING, PAUSED, CANCELLED, COMPLETED, ERRORED;

        public boolean isTerminal() {
            return this == CANCELLED || this == COMPLETED || this == ERRORED;
        }

        /** Running or paused jobs hold the engine's single slot. */
        public boolean occupiesEngine() {
            return this == RUNNING || this == PAUSED;
        }
    }

    public enum PauseReason {
        /** Requested by a caller; only a caller resumes it. */
        MANUAL,

        HOURLY_CAP,

        DAILY_CAP,

        ACTIVE_HOURS,

        /** Host signalled flood wait. */
        BACKOFF,

        /** Was running when the process stopped. */
        RESTORED;

        public boolean autoResumable() {
            return this != MANUAL && this != RESTORED;
        }
    }

    public GradualExportJob copy() {
        GradualExportJob copy = new GradualExportJob();
        copy.id = id;
        copy.targetId = targetId;
        copy.config = config == null ? null : new LinkedHashMap<>(config);
        copy.state = state;
        copy.pauseReason = pauseReason;
        copy.priority = priority;
        copy.sequence = sequence;
        copy.messagesProcessed = messagesProcessed;
        copy.batchesCompleted = batchesCompleted;
        copy.bytesWritten = bytesWritten;
        copy.failedBatches = failedBatches;
        copy.cursor = cursor;
        copy.outputPath = outputPath;
        copy.lastError = lastError;
        copy.enqueuedAt = enqueuedAt;
        copy.startedAt = startedAt;
        copy.finishedAt = finishedAt;
        copy.nextActionAt = nextActionAt;
        return copy;
    }

    public static List<GradualExportJob> findAllOrdered() {
        return find("ORDER BY id ASC").list();
    }
}
