package com.example.eventscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Lifecycle state of a schedule.
 * Only ACTIVE schedules are ever claimed by the scheduling loop.
 */
@Getter
@RequiredArgsConstructor
public enum ScheduleState {

    /**
     * Schedule has a defined next fire time and is eligible for claiming.
     */
    ACTIVE("active", "Active", true),

    /**
     * Schedule was paused by an operator and keeps its rule for a later resume.
     */
    PAUSED("paused", "Paused", false),

    /**
     * One-shot schedule fired, or a repeat count was exhausted.
     * Terminal state.
     */
    COMPLETED("completed", "Completed", false),

    /**
     * Delivery retries were exhausted or the recurrence rule could not be evaluated.
     * Requires external correction (update or retry).
     */
    FAILED("failed", "Failed", false),

    /**
     * Schedule was administratively disabled.
     */
    DISABLED("disabled", "Disabled", false);

    private final String code;
    private final String displayName;

    /**
     * Indicates if a schedule in this state may be leased by a worker
     */
    private final boolean claimable;

    /**
     * Find ScheduleState by its code value
     */
    public static ScheduleState fromCode(String code) {
        for (var state : values()) {
            if (state.getCode().equals(code)) {
                return state;
            }
        }
        throw new IllegalArgumentException("Unknown schedule state code: " + code);
    }

    /**
     * Check if this state represents a terminal state
     */
    public boolean isTerminal() {
        return this == COMPLETED;
    }

    /**
     * Check if this state can be resumed back to ACTIVE
     */
    public boolean isResumable() {
        return this == PAUSED || this == DISABLED;
    }
}
