package com.example.eventscheduler.dto;

import com.example.eventscheduler.domain.enums.MisfirePolicy;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.domain.enums.ScheduleState;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * Response DTO for schedule data
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ScheduleResponse {

    private UUID id;
    private String name;
    private String description;
    private RecurrenceType recurrenceType;
    private Long intervalMs;
    private String cronExpression;
    private Integer repeatCountRemaining;
    private String timezone;
    private MisfirePolicy misfirePolicy;
    private TargetActionResponse targetAction;
    private Instant nextFireAt;
    private ScheduleState state;
    private Instant lastFiredAt;
    private Long fireCount;
    private String lastError;
    private String owner;
    private Instant leaseExpiry;
    private Long version;
    private Instant createdAt;
    private Instant updatedAt;
}
