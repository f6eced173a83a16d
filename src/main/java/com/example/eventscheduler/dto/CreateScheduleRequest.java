package com.example.eventscheduler.dto;

import com.example.eventscheduler.domain.enums.MisfirePolicy;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;

/**
 * Request DTO for registering a new schedule
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CreateScheduleRequest {

    @NotBlank(message = "Schedule name is required")
    @Size(max = 200)
    private String name;

    @Size(max = 500)
    private String description;

    @NotNull(message = "Recurrence type is required")
    private RecurrenceType recurrenceType;

    /**
     * Required for INTERVAL
     */
    @Min(value = 1, message = "Interval must be positive")
    private Long intervalMs;

    /**
     * Required for CRON; six fields, seconds first
     */
    private String cronExpression;

    /**
     * Fire time for ONCE; first occurrence for INTERVAL (default: now + interval);
     * lower bound for CRON (default: now)
     */
    private Instant startAt;

    /**
     * Number of firings for recurring schedules (default: unbounded)
     */
    @Min(value = 1, message = "Repeat count must be at least 1")
    private Integer repeatCount;

    /**
     * Zone for cron evaluation (default: UTC)
     */
    private String timezone;

    /**
     * Overrides the configured recovery policy
     */
    private MisfirePolicy misfirePolicy;

    @NotNull(message = "Target action is required")
    @Valid
    private TargetActionRequest targetAction;
}
