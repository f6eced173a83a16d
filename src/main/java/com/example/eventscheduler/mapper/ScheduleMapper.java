package com.example.eventscheduler.mapper;

import com.example.eventscheduler.domain.entity.Schedule;
import com.example.eventscheduler.domain.entity.TargetAction;
import com.example.eventscheduler.dto.ScheduleResponse;
import com.example.eventscheduler.dto.TargetActionRequest;
import com.example.eventscheduler.dto.TargetActionResponse;
import org.mapstruct.Mapper;
import org.mapstruct.ReportingPolicy;

/**
 * MapStruct mapper for converting between entities and DTOs
 */
@Mapper(componentModel = "spring", unmappedTargetPolicy = ReportingPolicy.IGNORE)
public interface ScheduleMapper {

    ScheduleResponse toResponse(Schedule schedule);

    TargetActionResponse toResponse(TargetAction targetAction);

    /**
     * Convert an action request to the embedded entity; defaults are applied by the caller
     */
    TargetAction toEntity(TargetActionRequest request);
}
