package com.example.eventscheduler.service.scheduling;

import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.exception.RecurrenceComputationException;
import org.springframework.scheduling.support.CronExpression;
import org.springframework.stereotype.Component;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.util.Optional;

/**
 * Evaluates recurrence rules.
 * <p>
 * Occurrences are always derived from the previous intended fire time, never from
 * the time a firing was actually processed, so repeated firings do not drift.
 * Cron rules are evaluated in the schedule's timezone; intervals are absolute durations.
 */
@Component
public class RecurrenceCalculator {

    /**
     * Reject rules that can never be evaluated.
     *
     * @throws RecurrenceComputationException if the rule is malformed
     */
    public void validate(Schedule schedule) {
        zoneOf(schedule);
        var type = schedule.getRecurrenceType();
        if (type == null) {
            throw new RecurrenceComputationException(schedule.getName(), "recurrence type is required");
        }
        switch (type) {
            case ONCE -> {
                // nothing beyond the fixed instant, checked at creation
            }
            case INTERVAL -> intervalOf(schedule);
            case CRON -> cronOf(schedule);
        }
        if (schedule.getRepeatCountRemaining() != null && schedule.getRepeatCountRemaining() < 1) {
            throw new RecurrenceComputationException(schedule.getName(), "repeat count must be at least 1");
        }
    }

    /**
     * First occurrence of a new schedule.
     *
     * @param startAt requested start (mandatory for ONCE, optional otherwise)
     * @param now     creation time
     */
    public Instant firstOccurrence(Schedule schedule, Instant startAt, Instant now) {
        validate(schedule);
        return switch (schedule.getRecurrenceType()) {
            case ONCE -> {
                if (startAt == null) {
                    throw new RecurrenceComputationException(schedule.getName(), "a one-shot schedule needs a fire time");
                }
                yield startAt;
            }
            case INTERVAL -> startAt != null ? startAt : now.plus(intervalOf(schedule));
            case CRON -> {
                var base = startAt != null && startAt.isAfter(now) ? startAt.minusNanos(1) : now;
                yield nextCron(schedule, base);
            }
        };
    }

    /**
     * Occurrence following {@code previousFireAt}, or empty when the schedule is exhausted.
     */
    public Optional<Instant> nextAfter(Schedule schedule, Instant previousFireAt) {
        if (schedule.isLastRepetition()) {
            return Optional.empty();
        }
        return switch (schedule.getRecurrenceType()) {
            case ONCE -> Optional.empty();
            case INTERVAL -> Optional.of(previousFireAt.plus(intervalOf(schedule)));
            case CRON -> Optional.of(nextCron(schedule, previousFireAt));
        };
    }

    /**
     * First occurrence strictly after {@code now}, stepping from {@code from} along the rule.
     * Skipped occurrences are discarded and do not consume the repeat count.
     */
    public Instant firstOccurrenceAfter(Schedule schedule, Instant from, Instant now) {
        return switch (schedule.getRecurrenceType()) {
            case ONCE -> throw new IllegalStateException("One-shot schedule " + schedule.getName() + " has no later occurrence");
            case INTERVAL -> {
                if (from.isAfter(now)) {
                    yield from;
                }
                var intervalMs = intervalOf(schedule).toMillis();
                var steps = Duration.between(from, now).toMillis() / intervalMs + 1;
                yield from.plusMillis(steps * intervalMs);
            }
            case CRON -> nextCron(schedule, from.isAfter(now) ? from.minusNanos(1) : now);
        };
    }

    /**
     * Decrement the remaining repeat budget after one firing; null stays unbounded.
     */
    public Integer remainingAfterFire(Schedule schedule) {
        var remaining = schedule.getRepeatCountRemaining();
        if (schedule.getRecurrenceType() == RecurrenceType.ONCE) {
            return 0;
        }
        return remaining == null ? null : Math.max(0, remaining - 1);
    }

    private Instant nextCron(Schedule schedule, Instant after) {
        var zone = zoneOf(schedule);
        var next = cronOf(schedule).next(after.atZone(zone));
        if (next == null) {
            throw new RecurrenceComputationException(schedule.getName(), "cron expression has no occurrence after " + after);
        }
        return next.toInstant();
    }

    private Duration intervalOf(Schedule schedule) {
        var intervalMs = schedule.getIntervalMs();
        if (intervalMs == null || intervalMs <= 0) {
            throw new RecurrenceComputationException(schedule.getName(), "interval must be a positive number of milliseconds");
        }
        return Duration.ofMillis(intervalMs);
    }

    private CronExpression cronOf(Schedule schedule) {
        var expression = schedule.getCronExpression();
        if (expression == null || expression.isBlank()) {
            throw new RecurrenceComputationException(schedule.getName(), "cron expression is required");
        }
        try {
            return CronExpression.parse(expression);
        } catch (IllegalArgumentException e) {
            throw new RecurrenceComputationException(schedule.getName(), "bad cron expression '" + expression + "'", e);
        }
    }

    private ZoneId zoneOf(Schedule schedule) {
        try {
            return ZoneId.of(schedule.getTimezone() != null ? schedule.getTimezone() : "UTC");
        } catch (DateTimeException e) {
            throw new RecurrenceComputationException(schedule.getName(), "unknown timezone '" + schedule.getTimezone() + "'", e);
        }
    }
}
