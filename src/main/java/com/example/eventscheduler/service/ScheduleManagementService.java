package com.example.eventscheduler.service;

import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.domain.entity.TargetAction;
import com.example.eventscheduler.domain.enums.ActionType;
import com.example.eventscheduler.domain.enums.MisfirePolicy;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.domain.enums.ScheduleState;
import com.example.eventscheduler.dto.CreateScheduleRequest;
import com.example.eventscheduler.dto.ScheduleResponse;
import com.example.eventscheduler.dto.TargetActionRequest;
import com.example.eventscheduler.dto.UpdateScheduleRequest;
import com.example.eventscheduler.exception.DuplicateScheduleException;
import com.example.eventscheduler.exception.InvalidScheduleStateException;
import com.example.eventscheduler.exception.ScheduleNotFoundException;
import com.example.eventscheduler.exception.VersionConflictException;
import com.example.eventscheduler.mapper.ScheduleMapper;
import com.example.eventscheduler.service.handler.TargetActionHandlerRegistry;
import com.example.eventscheduler.service.scheduling.RecurrenceCalculator;
import com.example.eventscheduler.service.store.ScheduleStore;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.PageRequest;
import org.springframework.data.domain.Sort;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.HashMap;
import java.util.UUID;

/**
 * Service for managing schedule lifecycle operations.
 * <p>
 * Provides:
 * - Registration with duplicate-name detection and rule validation
 * - Lookup and listing
 * - Update, pause, resume, disable, retry and delete
 * <p>
 * Every write goes through the store's version check, so an operator change that races
 * a worker either wins (and fences the worker out) or fails with a version conflict.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ScheduleManagementService {

    private final ScheduleStore scheduleStore;
    private final RecurrenceCalculator recurrenceCalculator;
    private final TargetActionHandlerRegistry handlerRegistry;
    private final ScheduleMapper scheduleMapper;
    private final EventSchedulerProperties properties;
    private final Clock clock;

    // === Registration ===

    /**
     * Register a new schedule and compute its first occurrence
     *
     * @throws DuplicateScheduleException if the name is taken
     */
    public ScheduleResponse createSchedule(CreateScheduleRequest request) {
        log.info("Creating {} schedule {}", request.getRecurrenceType(), request.getName());

        if (scheduleStore.existsByName(request.getName())) {
            log.warn("Schedule {} already exists", request.getName());
            throw new DuplicateScheduleException(request.getName());
        }

        var schedule = Schedule.builder()
                .name(request.getName())
                .description(request.getDescription())
                .recurrenceType(request.getRecurrenceType())
                .intervalMs(request.getIntervalMs())
                .cronExpression(request.getCronExpression())
                .repeatCountRemaining(repeatCountFor(request.getRecurrenceType(), request.getRepeatCount()))
                .timezone(request.getTimezone() != null ? request.getTimezone() : "UTC")
                .misfirePolicy(request.getMisfirePolicy())
                .targetAction(toValidatedAction(request.getTargetAction()))
                .state(ScheduleState.ACTIVE)
                .build();

        schedule.setNextFireAt(recurrenceCalculator.firstOccurrence(schedule, request.getStartAt(), clock.instant()));

        scheduleStore.create(schedule);
        log.info("Created schedule {} ({}), first fire at {}", schedule.getName(), schedule.getId(), schedule.getNextFireAt());

        return scheduleMapper.toResponse(schedule);
    }

    // === Retrieval ===

    public ScheduleResponse getSchedule(UUID id) {
        return scheduleMapper.toResponse(load(id));
    }

    /**
     * List schedules, optionally filtered by state, newest first
     */
    public Page<ScheduleResponse> listSchedules(ScheduleState state, int page, int size) {
        var pageable = PageRequest.of(page, size, Sort.by(Sort.Direction.DESC, "createdAt"));
        return scheduleStore.list(state, pageable).map(scheduleMapper::toResponse);
    }

    // === Modification ===

    /**
     * Apply a partial update. Any lease is cleared so a worker still holding one cannot commit.
     *
     * @throws VersionConflictException if expectedVersion is stale or the schedule changed concurrently
     */
    public ScheduleResponse updateSchedule(UUID id, UpdateScheduleRequest request) {
        var schedule = load(id);
        if (request.getExpectedVersion() != null && !request.getExpectedVersion().equals(schedule.getVersion())) {
            throw new VersionConflictException(id, request.getExpectedVersion());
        }

        log.info("Updating schedule {}", schedule.getName());

        if (request.getDescription() != null) {
            schedule.setDescription(request.getDescription());
        }
        if (request.getMisfirePolicy() != null) {
            schedule.setMisfirePolicy(request.getMisfirePolicy());
        }
        if (request.getTargetAction() != null) {
            schedule.setTargetAction(toValidatedAction(request.getTargetAction()));
        }
        if (request.changesRecurrence()) {
            if (request.getRecurrenceType() != null) {
                schedule.setRecurrenceType(request.getRecurrenceType());
            }
            if (request.getIntervalMs() != null) {
                schedule.setIntervalMs(request.getIntervalMs());
            }
            if (request.getCronExpression() != null) {
                schedule.setCronExpression(request.getCronExpression());
            }
            if (request.getTimezone() != null) {
                schedule.setTimezone(request.getTimezone());
            }
            if (request.getRepeatCount() != null || request.getRecurrenceType() != null) {
                schedule.setRepeatCountRemaining(repeatCountFor(schedule.getRecurrenceType(), request.getRepeatCount()));
            }
            schedule.setNextFireAt(recurrenceCalculator.firstOccurrence(schedule, request.getStartAt(), clock.instant()));
        }

        schedule.clearLease();
        return scheduleMapper.toResponse(scheduleStore.save(schedule));
    }

    public void deleteSchedule(UUID id) {
        if (!scheduleStore.delete(id)) {
            throw new ScheduleNotFoundException(id);
        }
        log.info("Deleted schedule {}", id);
    }

    // === State Management ===

    /**
     * Stop an ACTIVE schedule from firing, keeping its rule and next occurrence
     */
    public ScheduleResponse pauseSchedule(UUID id) {
        var schedule = load(id);
        if (schedule.getState() != ScheduleState.ACTIVE) {
            throw invalidTransition(schedule, ScheduleState.PAUSED);
        }
        return transition(schedule, ScheduleState.PAUSED);
    }

    /**
     * Re-activate a PAUSED or DISABLED schedule. Occurrences missed in the meantime follow
     * the schedule's misfire policy.
     */
    public ScheduleResponse resumeSchedule(UUID id) {
        var schedule = load(id);
        if (!schedule.getState().isResumable()) {
            throw invalidTransition(schedule, ScheduleState.ACTIVE);
        }

        var now = clock.instant();
        if (schedule.getNextFireAt() == null) {
            schedule.setNextFireAt(recurrenceCalculator.firstOccurrence(schedule, null, now));
        } else if (schedule.getNextFireAt().isBefore(now)
                && schedule.getRecurrenceType() != RecurrenceType.ONCE
                && schedule.getEffectiveMisfirePolicy(properties.getRecoveryPolicy()) == MisfirePolicy.SKIP_TO_NEXT) {
            schedule.setNextFireAt(recurrenceCalculator.firstOccurrenceAfter(schedule, schedule.getNextFireAt(), now));
        }
        return transition(schedule, ScheduleState.ACTIVE);
    }

    /**
     * Administratively disable a schedule; COMPLETED schedules stay completed
     */
    public ScheduleResponse disableSchedule(UUID id) {
        var schedule = load(id);
        if (schedule.getState() == ScheduleState.DISABLED || schedule.getState().isTerminal()) {
            throw invalidTransition(schedule, ScheduleState.DISABLED);
        }
        return transition(schedule, ScheduleState.DISABLED);
    }

    /**
     * Re-activate a FAILED schedule. Its next occurrence is kept, so an occurrence whose
     * delivery was given up is fired again when it is already past due.
     */
    public ScheduleResponse retrySchedule(UUID id) {
        var schedule = load(id);
        if (schedule.getState() != ScheduleState.FAILED) {
            throw invalidTransition(schedule, ScheduleState.ACTIVE);
        }
        if (schedule.getRepeatCountRemaining() != null && schedule.getRepeatCountRemaining() < 1) {
            schedule.setRepeatCountRemaining(1);
        }
        recurrenceCalculator.validate(schedule);
        schedule.setLastError(null);
        log.info("Retrying failed schedule {}", schedule.getName());
        return transition(schedule, ScheduleState.ACTIVE);
    }

    // === Helpers ===

    private Schedule load(UUID id) {
        return scheduleStore.get(id).orElseThrow(() -> new ScheduleNotFoundException(id));
    }

    private ScheduleResponse transition(Schedule schedule, ScheduleState target) {
        log.info("Schedule {} {} -> {}", schedule.getName(), schedule.getState(), target);
        schedule.setState(target);
        schedule.clearLease();
        return scheduleMapper.toResponse(scheduleStore.save(schedule));
    }

    private InvalidScheduleStateException invalidTransition(Schedule schedule, ScheduleState target) {
        return new InvalidScheduleStateException(schedule.getId().toString(), schedule.getState().name(), target.name());
    }

    private TargetAction toValidatedAction(TargetActionRequest request) {
        var action = scheduleMapper.toEntity(request);
        if (action.getActionType() == null) {
            action.setActionType(ActionType.HTTP_CALLBACK);
        }
        if (action.getMethod() == null) {
            action.setMethod("POST");
        } else {
            action.setMethod(action.getMethod().toUpperCase());
        }
        if (action.getHeaders() == null) {
            action.setHeaders(new HashMap<>());
        }
        handlerRegistry.getHandlerOrThrow(action.getActionType()).validate(action);
        return action;
    }

    /**
     * ONCE fires exactly once whatever the request says
     */
    private static Integer repeatCountFor(RecurrenceType type, Integer requested) {
        return type == RecurrenceType.ONCE ? 1 : requested;
    }
}
