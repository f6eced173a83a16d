package com.example.eventscheduler.domain.entity;

import com.example.eventscheduler.domain.enums.MisfirePolicy;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.domain.enums.ScheduleState;
import jakarta.persistence.*;
import lombok.*;

import java.time.Instant;
import java.util.UUID;

/**
 * Durable record of a scheduled event.
 * <p>
 * Holds:
 * - The recurrence rule (one-shot, fixed interval or cron) and its timezone
 * - The target action to trigger
 * - The next intended fire time and lifecycle state
 * - Lease ownership (owner, leaseExpiry) used for cross-worker mutual exclusion
 * - The version used as fencing token for every conditional write
 */
@Entity
@Table(name = "schedules", indexes = {
        @Index(name = "idx_schedule_state_next_fire", columnList = "state, next_fire_at"),
        @Index(name = "idx_schedule_owner_lease", columnList = "owner, lease_expiry")
})
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
public class Schedule {

    @Id
    @GeneratedValue(strategy = GenerationType.UUID)
    @Column(name = "id", updatable = false, nullable = false)
    private UUID id;

    /**
     * Unique human-readable key
     */
    @Column(name = "name", nullable = false, unique = true, length = 200)
    private String name;

    @Column(name = "description", length = 500)
    private String description;

    // === Recurrence ===

    @Enumerated(EnumType.STRING)
    @Column(name = "recurrence_type", nullable = false, length = 20)
    private RecurrenceType recurrenceType;

    /**
     * Interval between occurrences, for INTERVAL schedules
     */
    @Column(name = "interval_ms")
    private Long intervalMs;

    /**
     * Spring cron expression (6 fields, seconds first), for CRON schedules
     */
    @Column(name = "cron_expression", length = 100)
    private String cronExpression;

    /**
     * Firings still to happen, including the one at nextFireAt. Null means unbounded.
     */
    @Column(name = "repeat_count_remaining")
    private Integer repeatCountRemaining;

    @Column(name = "timezone", nullable = false, length = 64)
    @Builder.Default
    private String timezone = "UTC";

    /**
     * Overrides the globally configured recovery policy when set
     */
    @Enumerated(EnumType.STRING)
    @Column(name = "misfire_policy", length = 30)
    private MisfirePolicy misfirePolicy;

    @Embedded
    private TargetAction targetAction;

    // === Firing State ===

    @Column(name = "next_fire_at")
    private Instant nextFireAt;

    @Enumerated(EnumType.STRING)
    @Column(name = "state", nullable = false, length = 20)
    private ScheduleState state;

    @Column(name = "last_fired_at")
    private Instant lastFiredAt;

    @Column(name = "fire_count", nullable = false)
    @Builder.Default
    private Long fireCount = 0L;

    @Column(name = "last_error", length = 2000)
    private String lastError;

    // === Lease ===

    /**
     * Worker currently holding the lease
     */
    @Column(name = "owner", length = 100)
    private String owner;

    @Column(name = "lease_expiry")
    private Instant leaseExpiry;

    /**
     * Fencing token; incremented by every persisted mutation
     */
    @Version
    @Column(name = "version", nullable = false)
    private Long version;

    // === Audit Fields ===

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    // === Helper Methods ===

    /**
     * Check if another worker holds a lease that has not yet expired
     */
    public boolean isLeasedAt(Instant now) {
        return owner != null && leaseExpiry != null && !leaseExpiry.isBefore(now);
    }

    /**
     * Check if the repeat budget allows no further occurrence after the current one
     */
    public boolean isLastRepetition() {
        return recurrenceType == RecurrenceType.ONCE
                || (repeatCountRemaining != null && repeatCountRemaining <= 1);
    }

    /**
     * Effective recovery policy (per-schedule override or global default)
     */
    public MisfirePolicy getEffectiveMisfirePolicy(MisfirePolicy defaultPolicy) {
        return misfirePolicy != null ? misfirePolicy : defaultPolicy;
    }

    public void clearLease() {
        this.owner = null;
        this.leaseExpiry = null;
    }
}
