package com.example.eventscheduler.controller;

import com.example.eventscheduler.domain.enums.ScheduleState;
import com.example.eventscheduler.dto.ApiResponse;
import com.example.eventscheduler.dto.CreateScheduleRequest;
import com.example.eventscheduler.dto.ScheduleResponse;
import com.example.eventscheduler.dto.UpdateScheduleRequest;
import com.example.eventscheduler.service.ScheduleManagementService;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.domain.Page;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * REST API controller for schedule management.
 * <p>
 * Provides endpoints for:
 * - Registering and unregistering schedules
 * - Retrieving and listing schedules
 * - Updating rules and target actions
 * - Managing state (pause, resume, disable, retry)
 */
@Slf4j
@Validated
@RestController
@RequiredArgsConstructor
@RequestMapping("/api/v1/schedules")
public class ScheduleController {

    private final ScheduleManagementService scheduleManagementService;

    // === Registration ===

    @PostMapping
    public ResponseEntity<ApiResponse<ScheduleResponse>> createSchedule(@Valid @RequestBody CreateScheduleRequest request) {
        log.info("API: Create schedule {} ({})", request.getName(), request.getRecurrenceType());

        var response = scheduleManagementService.createSchedule(request);
        return ResponseEntity.status(HttpStatus.CREATED).body(ApiResponse.success(response, "Schedule created successfully"));
    }

    @DeleteMapping("/{scheduleId}")
    public ResponseEntity<ApiResponse<Void>> deleteSchedule(@PathVariable UUID scheduleId) {
        log.info("API: Delete schedule {}", scheduleId);

        scheduleManagementService.deleteSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(null, "Schedule deleted successfully"));
    }

    // === Retrieval ===

    @GetMapping("/{scheduleId}")
    public ResponseEntity<ApiResponse<ScheduleResponse>> getSchedule(@PathVariable UUID scheduleId) {
        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.getSchedule(scheduleId)));
    }

    @GetMapping
    public ResponseEntity<ApiResponse<Page<ScheduleResponse>>> listSchedules(
            @RequestParam(required = false) ScheduleState state,
            @RequestParam(defaultValue = "0") @Min(0) int page,
            @RequestParam(defaultValue = "20") @Min(1) @Max(500) int size) {

        return ResponseEntity.ok(ApiResponse.success(scheduleManagementService.listSchedules(state, page, size)));
    }

    // === Modification ===

    @PutMapping("/{scheduleId}")
    public ResponseEntity<ApiResponse<ScheduleResponse>> updateSchedule(@PathVariable UUID scheduleId,
                                                                        @Valid @RequestBody UpdateScheduleRequest request) {
        log.info("API: Update schedule {}", scheduleId);

        var response = scheduleManagementService.updateSchedule(scheduleId, request);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule updated successfully"));
    }

    // === State Management ===

    @PostMapping("/{scheduleId}/pause")
    public ResponseEntity<ApiResponse<ScheduleResponse>> pauseSchedule(@PathVariable UUID scheduleId) {
        log.info("API: Pause schedule {}", scheduleId);

        var response = scheduleManagementService.pauseSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule paused successfully"));
    }

    @PostMapping("/{scheduleId}/resume")
    public ResponseEntity<ApiResponse<ScheduleResponse>> resumeSchedule(@PathVariable UUID scheduleId) {
        log.info("API: Resume schedule {}", scheduleId);

        var response = scheduleManagementService.resumeSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule resumed successfully"));
    }

    @PostMapping("/{scheduleId}/disable")
    public ResponseEntity<ApiResponse<ScheduleResponse>> disableSchedule(@PathVariable UUID scheduleId) {
        log.info("API: Disable schedule {}", scheduleId);

        var response = scheduleManagementService.disableSchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule disabled successfully"));
    }

    @PostMapping("/{scheduleId}/retry")
    public ResponseEntity<ApiResponse<ScheduleResponse>> retrySchedule(@PathVariable UUID scheduleId) {
        log.info("API: Retry schedule {}", scheduleId);

        var response = scheduleManagementService.retrySchedule(scheduleId);
        return ResponseEntity.ok(ApiResponse.success(response, "Schedule re-activated"));
    }
}
