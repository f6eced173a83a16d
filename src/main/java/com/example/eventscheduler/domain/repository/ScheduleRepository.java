package com.example.eventscheduler.domain.repository;

import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.domain.enums.MisfirePolicy;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.domain.enums.ScheduleState;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Repository for Schedule entity.
 * <p>
 * Every ownership or fire-state mutation is a conditional bulk update:
 * - WHERE version = :expectedVersion rejects writers holding a stale view
 * - SET version = version + 1 makes each successful write a new fencing token
 * <p>
 * An update count of 1 means the write won, 0 means a version conflict (or a deleted row).
 */
@Repository
public interface ScheduleRepository extends JpaRepository<Schedule, UUID> {

    /**
     * Find schedules whose next occurrence is due and that no live worker owns.
     * Ordered by next fire time then id so every worker sees the same sequence.
     */
    @Query("""
            SELECT s FROM Schedule s
            WHERE s.state = :state
              AND s.nextFireAt <= :before
              AND (s.owner IS NULL OR s.leaseExpiry < :now)
            ORDER BY s.nextFireAt ASC, s.id ASC
            """)
    List<Schedule> findDue(@Param("state") ScheduleState state,
                           @Param("before") Instant before,
                           @Param("now") Instant now,
                           Pageable pageable);

    /**
     * Earliest next fire time among claimable schedules, used to size the idle sleep.
     */
    @Query("""
            SELECT MIN(s.nextFireAt) FROM Schedule s
            WHERE s.state = :state
              AND (s.owner IS NULL OR s.leaseExpiry < :now)
            """)
    Instant findEarliestNextFireAt(@Param("state") ScheduleState state, @Param("now") Instant now);

    /**
     * Grant, renew or clear a lease.
     *
     * @return 1 if the expected version matched, 0 otherwise
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.owner = :owner,
                s.leaseExpiry = :leaseExpiry,
                s.version = s.version + 1,
                s.updatedAt = :now
            WHERE s.id = :id
              AND s.version = :expectedVersion
            """)
    int compareAndSwapLease(@Param("id") UUID id,
                            @Param("expectedVersion") Long expectedVersion,
                            @Param("owner") String owner,
                            @Param("leaseExpiry") Instant leaseExpiry,
                            @Param("now") Instant now);

    /**
     * Persist the outcome of a firing cycle and release the lease in the same write.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.nextFireAt = :nextFireAt,
                s.state = :state,
                s.repeatCountRemaining = :repeatCountRemaining,
                s.lastFiredAt = :lastFiredAt,
                s.fireCount = s.fireCount + :fireIncrement,
                s.lastError = :lastError,
                s.owner = NULL,
                s.leaseExpiry = NULL,
                s.version = s.version + 1,
                s.updatedAt = :now
            WHERE s.id = :id
              AND s.version = :expectedVersion
            """)
    int updateAfterFire(@Param("id") UUID id,
                        @Param("expectedVersion") Long expectedVersion,
                        @Param("nextFireAt") Instant nextFireAt,
                        @Param("state") ScheduleState state,
                        @Param("repeatCountRemaining") Integer repeatCountRemaining,
                        @Param("lastFiredAt") Instant lastFiredAt,
                        @Param("fireIncrement") long fireIncrement,
                        @Param("lastError") String lastError,
                        @Param("now") Instant now);

    /**
     * Re-admit an orphaned schedule into the due pool with the given next fire time.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.nextFireAt = :nextFireAt,
                s.owner = NULL,
                s.leaseExpiry = NULL,
                s.version = s.version + 1,
                s.updatedAt = :now
            WHERE s.id = :id
              AND s.version = :expectedVersion
            """)
    int reclaim(@Param("id") UUID id,
                @Param("expectedVersion") Long expectedVersion,
                @Param("nextFireAt") Instant nextFireAt,
                @Param("now") Instant now);

    /**
     * Move a schedule to FAILED and drop any lease.
     */
    @Modifying(clearAutomatically = true, flushAutomatically = true)
    @Query("""
            UPDATE Schedule s
            SET s.state = :state,
                s.lastError = :lastError,
                s.owner = NULL,
                s.leaseExpiry = NULL,
                s.version = s.version + 1,
                s.updatedAt = :now
            WHERE s.id = :id
              AND s.version = :expectedVersion
            """)
    int updateState(@Param("id") UUID id,
                    @Param("expectedVersion") Long expectedVersion,
                    @Param("state") ScheduleState state,
                    @Param("lastError") String lastError,
                    @Param("now") Instant now);

    /**
     * Find active schedules that recovery has to rewrite.
     * <p>
     * A past-due schedule still owned under an expired lease is a crash trace and qualifies
     * at once. An unowned schedule qualifies only once it is more than the misfire threshold
     * past due, and only when it will skip ahead: unowned fire-immediately schedules are
     * already claimable and one-shots never skip.
     */
    @Query("""
            SELECT s FROM Schedule s
            WHERE s.state = :state
              AND s.nextFireAt < :now
              AND ((s.owner IS NOT NULL AND s.leaseExpiry < :now)
                OR (s.owner IS NULL
                    AND s.nextFireAt < :before
                    AND s.recurrenceType <> :oneShot
                    AND (s.misfirePolicy = :skipPolicy
                      OR (s.misfirePolicy IS NULL AND :skipByDefault = TRUE))))
            ORDER BY s.nextFireAt ASC, s.id ASC
            """)
    List<Schedule> findOrphaned(@Param("state") ScheduleState state,
                                @Param("before") Instant before,
                                @Param("now") Instant now,
                                @Param("oneShot") RecurrenceType oneShot,
                                @Param("skipPolicy") MisfirePolicy skipPolicy,
                                @Param("skipByDefault") boolean skipByDefault,
                                Pageable pageable);

    boolean existsByName(String name);

    Page<Schedule> findByState(ScheduleState state, Pageable pageable);

    long countByState(ScheduleState state);

    /**
     * Count schedules currently leased by a live worker
     */
    @Query("""
            SELECT COUNT(s) FROM Schedule s
            WHERE s.owner IS NOT NULL
              AND s.leaseExpiry >= :now
            """)
    long countLeased(@Param("now") Instant now);
}
