package com.example.eventscheduler.service.lease;

import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.config.MetricsConfig;
import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.exception.LeaseLostException;
import com.example.eventscheduler.service.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.Optional;

/**
 * Grants, renews and releases time-bound ownership of schedules.
 * <p>
 * Every operation is a conditional write against the version the worker last observed,
 * so at most one worker can hold a given schedule at any time and a preempted worker
 * cannot commit anything afterwards.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LeaseManager {

    private final ScheduleStore scheduleStore;
    private final WorkerIdentity workerIdentity;
    private final EventSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final Clock clock;

    /**
     * Try to claim a schedule as seen by the last read.
     *
     * @return the lease, or empty if another worker won the race
     */
    public Optional<Lease> tryAcquire(Schedule schedule) {
        var now = clock.instant();
        var expiresAt = now.plusMillis(properties.getLeaseTtlMs());
        var owner = workerIdentity.getWorkerId();

        if (!scheduleStore.compareAndSwapLease(schedule.getId(), schedule.getVersion(), owner, expiresAt)) {
            log.debug("Lease conflict on schedule {} at version {}", schedule.getId(), schedule.getVersion());
            metricsConfig.recordLeaseConflict();
            return Optional.empty();
        }

        log.debug("Acquired lease on schedule {} until {}", schedule.getId(), expiresAt);
        return Optional.of(Lease.builder()
                .scheduleId(schedule.getId())
                .owner(owner)
                .version(schedule.getVersion() + 1)
                .grantedAt(now)
                .expiresAt(expiresAt)
                .build());
    }

    /**
     * Make sure the lease is still usable for a write, renewing it inside the renewal margin.
     *
     * @return the lease to use for the next conditional write (renewed or unchanged)
     * @throws LeaseLostException if the lease expired or the renewal lost the race
     */
    public Lease ensureValid(Lease lease) {
        var now = clock.instant();
        if (lease.isExpiredAt(now)) {
            throw new LeaseLostException(lease.getScheduleId(), lease.getOwner(), "expired at " + lease.getExpiresAt());
        }
        if (!lease.needsRenewalAt(now, properties.getLeaseRenewalMarginMs())) {
            return lease;
        }
        return renew(lease);
    }

    /**
     * Extend the lease by a full TTL from now.
     *
     * @throws LeaseLostException if the stored version moved on
     */
    public Lease renew(Lease lease) {
        var now = clock.instant();
        var expiresAt = now.plusMillis(properties.getLeaseTtlMs());
        if (!scheduleStore.compareAndSwapLease(lease.getScheduleId(), lease.getVersion(), lease.getOwner(), expiresAt)) {
            metricsConfig.recordLeaseConflict();
            throw new LeaseLostException(lease.getScheduleId(), lease.getOwner(), "renewal conflict at version " + lease.getVersion());
        }
        log.debug("Renewed lease on schedule {} until {}", lease.getScheduleId(), expiresAt);
        return lease.toBuilder()
                .version(lease.getVersion() + 1)
                .expiresAt(expiresAt)
                .build();
    }

    /**
     * Give up a lease that will not be used.
     *
     * @return false if the schedule changed in the meantime; the lease then simply expires
     */
    public boolean release(Lease lease) {
        var released = scheduleStore.releaseLease(lease.getScheduleId(), lease.getVersion());
        if (!released) {
            log.debug("Could not release lease on schedule {}, version moved past {}", lease.getScheduleId(), lease.getVersion());
        }
        return released;
    }
}
