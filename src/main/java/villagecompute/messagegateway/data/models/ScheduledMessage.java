package villagecompute.messagegateway.data.models;

import io.quarkus.hibernate.orm.panache.PanacheEntityBase;
import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.Table;

import java.time.Instant;
import java.util.List;

/**
 * Panache entity for a message scheduled against a target (one-off, delayed or recurring).
 *
 * <p>
 * Instances held by {@link villagecompute.messagegateway.services.MessageSchedulerService} are detached snapshots: every
 * mutation works on a {@link #copy()} that is persisted before it replaces the previous snapshot, so the in-memory view
 * never runs ahead of the store.
 *
 * <p>
 * <b>Schema Mapping:</b>
 * <ul>
 * <li>{@code id} (BIGINT, PK) - Assigned by the scheduler at creation</li>
 * <li>{@code target} (TEXT) - Opaque destination identifier</li>
 * <li>{@code payload} (TEXT) - Opaque content handed to the action executor</li>
 * <li>{@code schedule_kind} (TEXT) - ONCE, DELAYED, RECURRING</li>
 * <li>{@code recurrence_pattern} (TEXT) - NONE, HOURLY, DAILY, WEEKLY, MONTHLY, CUSTOM</li>
 * <li>{@code recurrence_expression} (TEXT) - Cron or ISO-8601 duration for CUSTOM patterns</li>
 * <li>{@code next_scheduled} (TIMESTAMPTZ) - Next firing time</li>
 * <li>{@code status} (TEXT) - ACTIVE, PAUSED, CANCELLED, COMPLETED, FAILED</li>
 * </ul>
 */
@Entity
@Table(
        name = "scheduled_messages")
public class ScheduledMessage extends PanacheEntityBase {

    @Id
    @Column(
            nullable = false)
    public Long id;

    @Column(
            name = "target",
            nullable = false)
    public String target;

    @Column(
            name = "payload",
            nullable = false,
            columnDefinition = "text")
    public String payload;

    @Column(
            name = "schedule_kind",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ScheduleKind scheduleKind;

    @Column(
            name = "scheduled_time")
    public Instant scheduledTime;

    @Column(
            name = "delay_seconds")
    public Long delaySeconds;

    @Column(
            name = "recurrence_pattern",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public RecurrencePattern recurrencePattern;

    @Column(
            name = "recurrence_expression")
    public String recurrenceExpression;

    @Column(
            name = "start_time")
    public Instant startTime;

    @Column(
            name = "max_occurrences",
            nullable = false)
    public int maxOccurrences;

    @Column(
            name = "occurrences_sent",
            nullable = false)
    public int occurrencesSent;

    @Column(
            name = "last_sent")
    public Instant lastSent;

    @Column(
            name = "next_scheduled")
    public Instant nextScheduled;

    @Column(
            name = "status",
            nullable = false)
    @Enumerated(EnumType.STRING)
    public ScheduleStatus status;

    @Column(
            name = "last_error",
            columnDefinition = "text")
    public String lastError;

    @Column(
            name = "created_by")
    public String createdBy;

    @Column(
            name = "created_at",
            nullable = false)
    public Instant createdAt;

    @Column(
            name = "updated_at",
            nullable = false)
    public Instant updatedAt;

    public enum ScheduleKind {
        ONCE, DELAYED, RECURRING
    }

    public enum RecurrencePattern {
        NONE, HOURLY, DAILY, WEEKLY, MONTHLY, CUSTOM
    }

    public enum ScheduleStatus {
        /** Selected by scheduler ticks once due. */
        ACTIVE,

        /** Held by a management call, resumable. */
        PAUSED,

        CANCELLED,

        /** One-off fired, or recurring occurrences exhausted. */
        COMPLETED,

        /** One-off send failed; not retried. */
        FAILED;

        public boolean isTerminal() {
            return this == CANCELLED || this == COMPLETED || this == FAILED;
        }
    }

    public boolean isActive() {
        return status == ScheduleStatus.ACTIVE;
    }

    public boolean isRecurring() {
        return scheduleKind == ScheduleKind.RECURRING;
    }

    public boolean isDue(Instant now) {
        return isActive() && nextScheduled != null && !nextScheduled.isAfter(now);
    }

    /**
     * Detached field-by-field copy used for read-modify-write updates.
     */
    public ScheduledMessage copy() {
        ScheduledMessage copy = new ScheduledMessage();
        copy.id = id;
        copy.target = target;
        copy.payload = payload;
        copy.scheduleKind = scheduleKind;
        copy.scheduledTime = scheduledTime;
        copy.delaySeconds = delaySeconds;
        copy.recurrencePattern = recurrencePattern;
        copy.recurrenceExpression = recurrenceExpression;
        copy.startTime = startTime;
        copy.maxOccurrences = maxOccurrences;
        copy.occurrencesSent = occurrencesSent;
        copy.lastSent = lastSent;
        copy.nextScheduled = nextScheduled;
        copy.status = status;
        copy.lastError = lastError;
        copy.createdBy = createdBy;
        copy.createdAt = createdAt;
        copy.updatedAt = updatedAt;
        return copy;
    }

    public static List<ScheduledMessage> findAllOrdered() {
        return find("ORDER BY id ASC").list();
    }
}
