package com.example.eventscheduler.service.store;

import com.example.eventscheduler.domain.enums.ScheduleState;
import lombok.Builder;
import lombok.Value;

import java.time.Instant;

/**
 * Post-fire state written by the scheduling loop in one conditional update.
 */
@Value
@Builder
public class FireOutcome {

    Instant nextFireAt;
    ScheduleState state;
    Integer repeatCountRemaining;
    Instant lastFiredAt;
    boolean fired;
    String lastError;

    /**
     * The schedule fired and has a further occurrence
     */
    public static FireOutcome advanced(Instant firedAt, Instant nextFireAt, Integer repeatCountRemaining) {
        return FireOutcome.builder()
                .nextFireAt(nextFireAt)
                .state(ScheduleState.ACTIVE)
                .repeatCountRemaining(repeatCountRemaining)
                .lastFiredAt(firedAt)
                .fired(true)
                .build();
    }

    /**
     * The schedule fired for the last time; nextFireAt keeps the final occurrence
     */
    public static FireOutcome completed(Instant firedAt, Integer repeatCountRemaining) {
        return FireOutcome.builder()
                .nextFireAt(firedAt)
                .state(ScheduleState.COMPLETED)
                .repeatCountRemaining(repeatCountRemaining)
                .lastFiredAt(firedAt)
                .fired(true)
                .build();
    }

    /**
     * The schedule could not be evaluated and did not fire
     */
    public static FireOutcome failed(Instant nextFireAt, Integer repeatCountRemaining, Instant lastFiredAt, String error) {
        return FireOutcome.builder()
                .nextFireAt(nextFireAt)
                .state(ScheduleState.FAILED)
                .repeatCountRemaining(repeatCountRemaining)
                .lastFiredAt(lastFiredAt)
                .fired(false)
                .lastError(error)
                .build();
    }
}
