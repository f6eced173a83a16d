package com.example.eventscheduler.dto;

import com.example.eventscheduler.domain.enums.MisfirePolicy;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Partial update of a schedule; null fields are left unchanged.
 * Changing any recurrence field (or startAt) recomputes the next fire time.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class UpdateScheduleRequest {

    @Size(max = 500)
    private String description;

    private RecurrenceType recurrenceType;

    @Min(value = 1, message = "Interval must be positive")
    private Long intervalMs;

    private String cronExpression;

    private Instant startAt;

    @Min(value = 1, message = "Repeat count must be at least 1")
    private Integer repeatCount;

    private String timezone;

    private MisfirePolicy misfirePolicy;

    @Valid
    private TargetActionRequest targetAction;

    /**
     * Version the caller last read; the update is rejected if the schedule changed since
     */
    private Long expectedVersion;

    public boolean changesRecurrence() {
        return recurrenceType != null || intervalMs != null || cronExpression != null
                || startAt != null || repeatCount != null || timezone != null;
    }
}
