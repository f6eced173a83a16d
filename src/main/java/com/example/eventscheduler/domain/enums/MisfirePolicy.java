package com.example.eventscheduler.domain.enums;

/**
 * How the recovery manager treats an occurrence that was missed while no worker owned the schedule.
 */
public enum MisfirePolicy {

    /**
     * Put the missed occurrence back into the due pool unchanged.
     */
    FIRE_IMMEDIATELY,

    /**
     * Discard missed occurrences and advance to the first occurrence after now.
     */
    SKIP_TO_NEXT
}
