package com.example.eventscheduler.service.store;

import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.domain.enums.MisfirePolicy;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.domain.enums.ScheduleState;
import com.example.eventscheduler.domain.repository.ScheduleRepository;
import com.example.eventscheduler.exception.DuplicateScheduleException;
import com.example.eventscheduler.exception.StoreUnavailableException;
import com.example.eventscheduler.exception.VersionConflictException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Pageable;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Durable keyed storage for schedules with conditional (expected-version) writes.
 * <p>
 * The conditional writes are the only concurrency control between workers:
 * a {@code false} result is a lost race, never an error. Infrastructure failures
 * are translated to {@link StoreUnavailableException} so callers can back off.
 * <p>
 * Each operation runs in its own short transaction.
 */
@Slf4j
@Service
public class ScheduleStore {

    private static final int MARK_FAILED_ATTEMPTS = 3;

    private final ScheduleRepository scheduleRepository;
    private final TransactionTemplate transactionTemplate;
    private final TransactionTemplate readOnlyTemplate;
    private final Clock clock;

    public ScheduleStore(ScheduleRepository scheduleRepository, PlatformTransactionManager transactionManager, Clock clock) {
        this.scheduleRepository = scheduleRepository;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate = new TransactionTemplate(transactionManager);
        this.readOnlyTemplate.setReadOnly(true);
        this.clock = clock;
    }

    // === Core Operations ===

    /**
     * Persist a new schedule.
     *
     * @return the generated identifier
     * @throws DuplicateScheduleException if the name is already taken
     */
    public UUID create(Schedule schedule) {
        var now = clock.instant();
        schedule.setCreatedAt(now);
        schedule.setUpdatedAt(now);
        if (schedule.getState() == null) {
            schedule.setState(ScheduleState.ACTIVE);
        }
        if (schedule.getFireCount() == null) {
            schedule.setFireCount(0L);
        }
        try {
            return write("create", () -> scheduleRepository.saveAndFlush(schedule).getId());
        } catch (DataIntegrityViolationException e) {
            throw new DuplicateScheduleException(schedule.getName());
        }
    }

    public Optional<Schedule> get(UUID id) {
        return read("get", () -> scheduleRepository.findById(id));
    }

    /**
     * Schedules that are ACTIVE, due at or before {@code before}, and not leased by a live worker,
     * ordered by next fire time then id.
     */
    public List<Schedule> listDue(Instant before, int limit) {
        var now = clock.instant();
        return read("listDue", () -> scheduleRepository.findDue(ScheduleState.ACTIVE, before, now, PageRequest.of(0, limit)));
    }

    /**
     * Grant, renew or clear a lease if the stored version still equals {@code expectedVersion}.
     * A null owner clears the lease.
     */
    public boolean compareAndSwapLease(UUID id, long expectedVersion, String newOwner, Instant newExpiry) {
        var now = clock.instant();
        return write("compareAndSwapLease",
                () -> scheduleRepository.compareAndSwapLease(id, expectedVersion, newOwner, newExpiry, now) == 1);
    }

    /**
     * Persist the outcome of a firing cycle and release the lease.
     */
    public boolean updateAfterFire(UUID id, long expectedVersion, FireOutcome outcome) {
        var now = clock.instant();
        return write("updateAfterFire", () -> scheduleRepository.updateAfterFire(
                id,
                expectedVersion,
                outcome.getNextFireAt(),
                outcome.getState(),
                outcome.getRepeatCountRemaining(),
                outcome.getLastFiredAt(),
                outcome.isFired() ? 1L : 0L,
                outcome.getLastError(),
                now) == 1);
    }

    public boolean delete(UUID id) {
        return write("delete", () -> {
            if (!scheduleRepository.existsById(id)) {
                return false;
            }
            scheduleRepository.deleteById(id);
            return true;
        });
    }

    // === Lease and Recovery Support ===

    public boolean releaseLease(UUID id, long expectedVersion) {
        return compareAndSwapLease(id, expectedVersion, null, null);
    }

    /**
     * Clear a stale lease and set the next fire time in one conditional write.
     */
    public boolean reclaim(UUID id, long expectedVersion, Instant nextFireAt) {
        var now = clock.instant();
        return write("reclaim", () -> scheduleRepository.reclaim(id, expectedVersion, nextFireAt, now) == 1);
    }

    /**
     * Active schedules recovery must rewrite: past due and held under an expired lease, or
     * unowned, due before {@code before} and skipping ahead under their misfire policy.
     *
     * @param defaultPolicy policy applied to schedules without their own
     */
    public List<Schedule> listOrphaned(Instant before, MisfirePolicy defaultPolicy, int limit) {
        var now = clock.instant();
        return read("listOrphaned", () -> scheduleRepository.findOrphaned(ScheduleState.ACTIVE, before, now,
                RecurrenceType.ONCE, MisfirePolicy.SKIP_TO_NEXT, defaultPolicy == MisfirePolicy.SKIP_TO_NEXT,
                PageRequest.of(0, limit)));
    }

    public Optional<Instant> earliestPendingFireAt() {
        var now = clock.instant();
        return read("earliestPendingFireAt", () -> Optional.ofNullable(scheduleRepository.findEarliestNextFireAt(ScheduleState.ACTIVE, now)));
    }

    /**
     * Move an ACTIVE or COMPLETED schedule to FAILED after its delivery was given up.
     * Re-reads and retries on conflict a bounded number of times.
     *
     * @return true if the schedule is FAILED afterwards because of this call
     */
    public boolean markFailed(UUID id, String error) {
        for (var attempt = 1; attempt <= MARK_FAILED_ATTEMPTS; attempt++) {
            var current = get(id).orElse(null);
            if (current == null) {
                log.debug("Schedule {} was deleted before it could be marked failed", id);
                return false;
            }
            if (current.getState() != ScheduleState.ACTIVE && current.getState() != ScheduleState.COMPLETED) {
                log.debug("Schedule {} is {}, not marking failed", id, current.getState());
                return false;
            }
            var now = clock.instant();
            var updated = write("markFailed", () -> scheduleRepository.updateState(
                    id, current.getVersion(), ScheduleState.FAILED, truncate(error), now) == 1);
            if (updated) {
                return true;
            }
            log.debug("Version conflict marking schedule {} failed (attempt {})", id, attempt);
        }
        log.warn("Gave up marking schedule {} failed after {} conflicting attempts", id, MARK_FAILED_ATTEMPTS);
        return false;
    }

    // === Management Support ===

    /**
     * Save a modified schedule; JPA's version check makes this a conditional write.
     *
     * @throws VersionConflictException if the schedule changed since it was read
     */
    public Schedule save(Schedule schedule) {
        schedule.setUpdatedAt(clock.instant());
        try {
            return write("save", () -> scheduleRepository.saveAndFlush(schedule));
        } catch (OptimisticLockingFailureException e) {
            throw new VersionConflictException(schedule.getId(), e);
        }
    }

    public Page<Schedule> list(ScheduleState state, Pageable pageable) {
        return read("list", () -> state != null
                ? scheduleRepository.findByState(state, pageable)
                : scheduleRepository.findAll(pageable));
    }

    public boolean existsByName(String name) {
        return read("existsByName", () -> scheduleRepository.existsByName(name));
    }

    // === Transaction and Error Translation ===

    private <T> T read(String operation, Supplier<T> action) {
        return execute(operation, readOnlyTemplate, action);
    }

    private <T> T write(String operation, Supplier<T> action) {
        return execute(operation, transactionTemplate, action);
    }

    private <T> T execute(String operation, TransactionTemplate template, Supplier<T> action) {
        try {
            return template.execute(status -> action.get());
        } catch (OptimisticLockingFailureException | DataIntegrityViolationException e) {
            throw e;
        } catch (TransientDataAccessException | RecoverableDataAccessException
                 | DataAccessResourceFailureException | TransactionException e) {
            log.warn("Store operation {} failed: {}", operation, e.getMessage());
            throw new StoreUnavailableException(operation, e);
        }
    }

    private static String truncate(String value) {
        if (value == null || value.length() <= 2000) {
            return value;
        }
        return value.substring(0, 1997) + "...";
    }
}
