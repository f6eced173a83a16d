package com.example.eventscheduler.service.scheduling;

import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.config.MetricsConfig;
import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.exception.LeaseLostException;
import com.example.eventscheduler.exception.RecurrenceComputationException;
import com.example.eventscheduler.exception.StoreUnavailableException;
import com.example.eventscheduler.service.alert.SlackAlertService;
import com.example.eventscheduler.service.dispatch.EventDispatcher;
import com.example.eventscheduler.service.dispatch.TriggerEvent;
import com.example.eventscheduler.service.lease.Lease;
import com.example.eventscheduler.service.lease.LeaseManager;
import com.example.eventscheduler.service.recovery.RecoveryManager;
import com.example.eventscheduler.service.store.FireOutcome;
import com.example.eventscheduler.service.store.ScheduleStore;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.context.SmartLifecycle;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.util.HashMap;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Per-worker cycle that claims due schedules and fires them.
 * <p>
 * Flow of one cycle:
 * 1. Fetch due, unleased schedules, bounded by the batch size and the dispatcher's free slots
 * 2. Acquire a lease on each; a conflict means another worker won and the schedule is skipped
 * 3. Compute the next occurrence from the previous intended fire time
 * 4. Hand the trigger to the dispatcher without waiting for delivery
 * 5. Renew the lease if needed, then persist the post-fire state with the lease's version
 * <p>
 * Every worker runs this loop; mutual exclusion comes only from the conditional writes.
 * Store outages delay the next cycle but never stop the loop.
 */
@Slf4j
@Service
public class SchedulingLoop implements SmartLifecycle {

    private final ScheduleStore scheduleStore;
    private final LeaseManager leaseManager;
    private final RecurrenceCalculator recurrenceCalculator;
    private final EventDispatcher eventDispatcher;
    private final RecoveryManager recoveryManager;
    private final SlackAlertService slackAlertService;
    private final MetricsConfig metricsConfig;
    private final EventSchedulerProperties properties;
    private final Clock clock;
    private final TaskScheduler taskScheduler;

    private final AtomicBoolean running = new AtomicBoolean(false);
    private volatile boolean startupRecoveryDone;
    private volatile ScheduledFuture<?> nextTick;

    public SchedulingLoop(ScheduleStore scheduleStore,
                          LeaseManager leaseManager,
                          RecurrenceCalculator recurrenceCalculator,
                          EventDispatcher eventDispatcher,
                          RecoveryManager recoveryManager,
                          SlackAlertService slackAlertService,
                          MetricsConfig metricsConfig,
                          EventSchedulerProperties properties,
                          Clock clock,
                          @Qualifier("taskScheduler") TaskScheduler taskScheduler) {
        this.scheduleStore = scheduleStore;
        this.leaseManager = leaseManager;
        this.recurrenceCalculator = recurrenceCalculator;
        this.eventDispatcher = eventDispatcher;
        this.recoveryManager = recoveryManager;
        this.slackAlertService = slackAlertService;
        this.metricsConfig = metricsConfig;
        this.properties = properties;
        this.clock = clock;
        this.taskScheduler = taskScheduler;
    }

    // === Lifecycle ===

    @Override
    public void start() {
        if (!properties.isLoopEnabled()) {
            log.info("Scheduling loop disabled, this instance only serves the API");
            return;
        }
        if (running.compareAndSet(false, true)) {
            log.info("Starting scheduling loop (poll interval {}ms, batch size {})",
                    properties.getPollIntervalMs(), properties.getBatchSize());
            scheduleTick(Duration.ZERO);
        }
    }

    @Override
    public void stop() {
        if (running.compareAndSet(true, false)) {
            log.info("Stopping scheduling loop");
            var tick = nextTick;
            if (tick != null) {
                tick.cancel(false);
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running.get();
    }

    private void scheduleTick(Duration delay) {
        if (running.get()) {
            nextTick = taskScheduler.schedule(this::tick, taskScheduler.getClock().instant().plus(delay));
        }
    }

    void tick() {
        if (!running.get()) {
            return;
        }

        var delay = Duration.ofMillis(properties.getPollIntervalMs());
        try {
            if (!startupRecoveryDone) {
                recoveryManager.runStartupRecovery();
                startupRecoveryDone = true;
            }
            delay = nextDelay(runCycle());
        } catch (StoreUnavailableException e) {
            log.warn("Scheduling cycle aborted, store unavailable: {}", e.getMessage());
        } catch (Exception e) {
            log.error("Error in scheduling cycle: {}", e.getMessage(), e);
        } finally {
            scheduleTick(delay);
        }
    }

    // === Cycle ===

    /**
     * Run one cycle on the calling thread.
     */
    public CycleResult runCycle() {
        var freeSlots = eventDispatcher.availableSlots();
        if (freeSlots <= 0) {
            log.debug("Dispatcher saturated, not claiming this cycle");
            metricsConfig.recordDispatcherSaturated();
            return CycleResult.saturatedBeforeClaiming();
        }

        var now = clock.instant();
        var due = scheduleStore.listDue(now, Math.min(properties.getBatchSize(), freeSlots));
        if (due.isEmpty()) {
            log.debug("No schedules due");
            return CycleResult.builder().build();
        }

        log.debug("Found {} due schedules", due.size());

        var fired = 0;
        var conflicts = 0;
        var failed = 0;
        var saturated = false;

        for (var schedule : due) {
            var outcome = process(schedule);
            if (outcome == Outcome.FIRED) {
                fired++;
            } else if (outcome == Outcome.CONFLICT) {
                conflicts++;
            } else if (outcome == Outcome.FAILED) {
                failed++;
            } else if (outcome == Outcome.SATURATED) {
                saturated = true;
                break;
            }
        }

        if (fired > 0 || failed > 0) {
            log.info("Cycle fired {} schedules ({} conflicts, {} failed)", fired, conflicts, failed);
        }

        return CycleResult.builder()
                .due(due.size())
                .fired(fired)
                .conflicts(conflicts)
                .failed(failed)
                .saturated(saturated)
                .build();
    }

    /**
     * Delay before the next cycle: none after finding work, the poll interval when saturated,
     * otherwise until the earliest pending occurrence, capped at the poll interval.
     */
    Duration nextDelay(CycleResult result) {
        var pollInterval = Duration.ofMillis(properties.getPollIntervalMs());
        if (result.isSaturated()) {
            return pollInterval;
        }
        if (result.foundWork()) {
            return Duration.ZERO;
        }
        var now = clock.instant();
        return scheduleStore.earliestPendingFireAt()
                .map(earliest -> Duration.between(now, earliest))
                .map(untilDue -> untilDue.isNegative() ? Duration.ZERO : untilDue)
                .filter(untilDue -> untilDue.compareTo(pollInterval) < 0)
                .orElse(pollInterval);
    }

    private Outcome process(Schedule schedule) {
        var acquired = leaseManager.tryAcquire(schedule);
        if (acquired.isEmpty()) {
            return Outcome.CONFLICT;
        }
        var lease = acquired.get();
        var fireTime = schedule.getNextFireAt();

        FireOutcome fireOutcome;
        try {
            fireOutcome = recurrenceCalculator.nextAfter(schedule, fireTime)
                    .map(next -> FireOutcome.advanced(fireTime, next, recurrenceCalculator.remainingAfterFire(schedule)))
                    .orElseGet(() -> FireOutcome.completed(fireTime, recurrenceCalculator.remainingAfterFire(schedule)));
        } catch (RecurrenceComputationException e) {
            return failWithoutFiring(schedule, lease, e);
        }

        var trigger = TriggerEvent.builder()
                .scheduleId(schedule.getId())
                .scheduleName(schedule.getName())
                .fireTime(fireTime)
                .targetAction(schedule.getTargetAction().toBuilder()
                        .headers(schedule.getTargetAction().getHeaders() != null
                                ? new HashMap<>(schedule.getTargetAction().getHeaders())
                                : new HashMap<>())
                        .build())
                .build();

        if (!eventDispatcher.dispatch(trigger)) {
            log.debug("Dispatcher refused schedule {}, releasing its lease", schedule.getName());
            leaseManager.release(lease);
            return Outcome.SATURATED;
        }
        metricsConfig.recordTriggerFired();

        try {
            var current = leaseManager.ensureValid(lease);
            if (!scheduleStore.updateAfterFire(schedule.getId(), current.getVersion(), fireOutcome)) {
                log.debug("Post-fire write for schedule {} lost to a newer version, abandoning", schedule.getName());
                metricsConfig.recordCycleAbandoned("conflict");
                return Outcome.CONFLICT;
            }
        } catch (LeaseLostException e) {
            log.warn("Abandoning cycle of schedule {}: {}", schedule.getName(), e.getMessage());
            metricsConfig.recordCycleAbandoned("lease_lost");
            return Outcome.CONFLICT;
        }

        log.debug("Schedule {} fired for {}, now {} (next {})",
                schedule.getName(), fireTime, fireOutcome.getState(), fireOutcome.getNextFireAt());
        return Outcome.FIRED;
    }

    private Outcome failWithoutFiring(Schedule schedule, Lease lease, RecurrenceComputationException e) {
        log.error("Schedule {} cannot be evaluated, marking it failed: {}", schedule.getName(), e.getMessage());
        var outcome = FireOutcome.failed(schedule.getNextFireAt(), schedule.getRepeatCountRemaining(),
                schedule.getLastFiredAt(), e.getMessage());
        if (!scheduleStore.updateAfterFire(schedule.getId(), lease.getVersion(), outcome)) {
            metricsConfig.recordCycleAbandoned("conflict");
            return Outcome.CONFLICT;
        }
        slackAlertService.sendScheduleFailedAlert(schedule.getId(), schedule.getName(), null, 0, e.getMessage());
        return Outcome.FAILED;
    }

    private enum Outcome {
        FIRED, CONFLICT, FAILED, SATURATED
    }
}
