package com.example.eventscheduler.service.scheduling;

import lombok.Builder;
import lombok.Value;

/**
 * Counters of one scheduling cycle.
 */
@Value
@Builder
public class CycleResult {

    /**
     * Due schedules returned by the store
     */
    int due;

    int fired;

    /**
     * Candidates lost to another worker, at lease acquisition or at the post-fire write
     */
    int conflicts;

    int failed;

    /**
     * The dispatcher had no free slot, before or during the cycle
     */
    boolean saturated;

    public static CycleResult saturatedBeforeClaiming() {
        return CycleResult.builder().saturated(true).build();
    }

    public boolean foundWork() {
        return due > 0;
    }
}
