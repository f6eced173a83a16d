package com.example.eventscheduler.service.dispatch;

import com.example.eventscheduler.domain.entity.TargetAction;
import com.example.eventscheduler.domain.enums.DeliveryOutcome;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * One firing of a schedule on its way to the target action.
 * <p>
 * fireTime is the intended occurrence (the schedule's next fire time when it was claimed),
 * never the time the trigger was processed. It lives only in memory.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TriggerEvent {

    private UUID scheduleId;

    private String scheduleName;

    private Instant fireTime;

    /**
     * Snapshot of the action taken when the schedule was claimed
     */
    private TargetAction targetAction;

    /**
     * Number of delivery attempts started so far
     */
    @Builder.Default
    private int attempt = 0;

    @Builder.Default
    private DeliveryOutcome outcome = DeliveryOutcome.PENDING;

    /**
     * Stable key for receivers to drop duplicate deliveries of the same occurrence
     */
    public String getIdempotencyKey() {
        return scheduleId + ":" + fireTime;
    }

    public int nextAttempt() {
        return ++attempt;
    }
}
