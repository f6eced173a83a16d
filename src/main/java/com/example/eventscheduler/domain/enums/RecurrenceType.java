package com.example.eventscheduler.domain.enums;

/**
 * Kind of recurrence rule attached to a schedule.
 */
public enum RecurrenceType {

    /**
     * Fires exactly once at a fixed instant.
     */
    ONCE,

    /**
     * Fires every fixed interval, measured from the previous intended fire time.
     */
    INTERVAL,

    /**
     * Fires on a cron cadence evaluated in the schedule's timezone.
     */
    CRON;

    public boolean isRecurring() {
        return this != ONCE;
    }
}
