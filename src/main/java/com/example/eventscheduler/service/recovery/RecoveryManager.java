package com.example.eventscheduler.service.recovery;

import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.config.MetricsConfig;
import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.domain.enums.MisfirePolicy;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.exception.RecurrenceComputationException;
import com.example.eventscheduler.exception.StoreUnavailableException;
import com.example.eventscheduler.service.alert.SlackAlertService;
import com.example.eventscheduler.service.scheduling.RecurrenceCalculator;
import com.example.eventscheduler.service.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import net.javacrumbs.shedlock.spring.annotation.SchedulerLock;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Re-admits schedules orphaned by crashed workers.
 * <p>
 * An orphan is an ACTIVE past-due schedule still held under an expired lease, or an
 * unowned one more than the misfire threshold past due. Depending on its misfire policy it
 * either re-enters the due pool unchanged (FIRE_IMMEDIATELY) or jumps to its first
 * occurrence after now (SKIP_TO_NEXT).
 * <p>
 * Recovery never delivers anything; it only rewrites schedules through conditional writes,
 * so concurrent sweeps or a worker finishing late can never double-apply a firing.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class RecoveryManager {

    private final ScheduleStore scheduleStore;
    private final RecurrenceCalculator recurrenceCalculator;
    private final EventSchedulerProperties properties;
    private final MetricsConfig metricsConfig;
    private final SlackAlertService slackAlertService;
    private final Clock clock;

    /**
     * Run once before this worker claims anything.
     * Drains every orphan, not just one batch, so none is claimed as an ordinary due schedule.
     *
     * @return number of recovered schedules
     */
    public int runStartupRecovery() {
        if (!properties.isStartupRecoveryEnabled()) {
            log.info("Startup recovery disabled");
            return 0;
        }
        log.info("Running startup recovery");
        return recoverAll();
    }

    /**
     * Periodic sweep for schedules orphaned while this worker was running.
     * <p>
     * ShedLock keeps sweeps from overlapping across instances.
     */
    @Scheduled(initialDelayString = "${event-scheduler.recovery-sweep-interval-ms:60000}",
            fixedDelayString = "${event-scheduler.recovery-sweep-interval-ms:60000}")
    @SchedulerLock(name = "scheduleRecoverySweep", lockAtLeastFor = "5s", lockAtMostFor = "5m")
    public void sweep() {
        try {
            recoverAll();
        } catch (StoreUnavailableException e) {
            log.warn("Recovery sweep skipped, store unavailable: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Error in recovery sweep: {}", e.getMessage(), e);
        }
    }

    /**
     * Reclassify orphans batch after batch until a batch is short or rewrites nothing.
     * Every rewritten schedule leaves the orphan set, so each full batch makes progress.
     *
     * @return number of schedules re-admitted to the due pool
     */
    public int recoverAll() {
        var batchSize = properties.getRecoveryBatchSize();
        var recovered = 0;
        while (true) {
            var orphans = findOrphans();
            var outcomes = recoverBatch(orphans);
            recovered += count(outcomes, Outcome.RECOVERED);

            var rewritten = outcomes.size() - count(outcomes, Outcome.UNCHANGED);
            if (orphans.size() < batchSize || rewritten == 0) {
                return recovered;
            }
            log.info("Orphan batch was full, continuing recovery");
        }
    }

    /**
     * Reclassify one batch of orphaned schedules.
     *
     * @return number of schedules re-admitted to the due pool
     */
    public int recover() {
        return count(recoverBatch(findOrphans()), Outcome.RECOVERED);
    }

    private List<Schedule> findOrphans() {
        var threshold = clock.instant().minusMillis(properties.getMisfireThresholdMs());
        return scheduleStore.listOrphaned(threshold, properties.getRecoveryPolicy(), properties.getRecoveryBatchSize());
    }

    private List<Outcome> recoverBatch(List<Schedule> orphans) {
        if (orphans.isEmpty()) {
            log.debug("No orphaned schedules found");
            return List.of();
        }

        log.warn("Found {} orphaned schedules", orphans.size());

        var now = clock.instant();
        var outcomes = new ArrayList<Outcome>(orphans.size());
        for (var schedule : orphans) {
            outcomes.add(recoverOne(schedule, now));
        }

        log.info("Recovered {} of {} orphaned schedules", count(outcomes, Outcome.RECOVERED), orphans.size());
        return outcomes;
    }

    private Outcome recoverOne(Schedule schedule, Instant now) {
        var policy = effectivePolicy(schedule);

        if (policy == MisfirePolicy.FIRE_IMMEDIATELY && schedule.getOwner() == null) {
            // already claimable as is
            log.debug("Schedule {} is overdue but unowned, leaving it in the due pool", schedule.getName());
            return Outcome.UNCHANGED;
        }

        Instant nextFireAt;
        if (policy == MisfirePolicy.SKIP_TO_NEXT) {
            try {
                nextFireAt = recurrenceCalculator.firstOccurrenceAfter(schedule, schedule.getNextFireAt(), now);
            } catch (RecurrenceComputationException e) {
                log.error("Cannot recover schedule {}: {}", schedule.getName(), e.getMessage());
                if (scheduleStore.markFailed(schedule.getId(), e.getMessage())) {
                    slackAlertService.sendScheduleFailedAlert(schedule.getId(), schedule.getName(), null, 0, e.getMessage());
                    return Outcome.FAILED;
                }
                return Outcome.UNCHANGED;
            }
        } else {
            nextFireAt = schedule.getNextFireAt();
        }

        if (!scheduleStore.reclaim(schedule.getId(), schedule.getVersion(), nextFireAt)) {
            log.debug("Schedule {} changed during recovery, leaving it to its new owner", schedule.getName());
            return Outcome.UNCHANGED;
        }

        log.info("Recovered schedule {} (previous owner {}) with policy {}, next fire at {}",
                schedule.getName(), schedule.getOwner(), policy, nextFireAt);
        metricsConfig.recordRecovered(policy.name());
        return Outcome.RECOVERED;
    }

    private static int count(List<Outcome> outcomes, Outcome wanted) {
        return (int) outcomes.stream().filter(outcome -> outcome == wanted).count();
    }

    /**
     * One-shot schedules have no later occurrence to skip to, so they always fire.
     */
    MisfirePolicy effectivePolicy(Schedule schedule) {
        if (schedule.getRecurrenceType() == RecurrenceType.ONCE) {
            return MisfirePolicy.FIRE_IMMEDIATELY;
        }
        return schedule.getEffectiveMisfirePolicy(properties.getRecoveryPolicy());
    }

    private enum Outcome {
        RECOVERED,
        FAILED,
        UNCHANGED
    }
}
