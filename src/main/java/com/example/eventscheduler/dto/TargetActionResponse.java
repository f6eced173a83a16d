package com.example.eventscheduler.dto;

import com.example.eventscheduler.domain.enums.ActionType;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetActionResponse {

    private ActionType actionType;
    private String method;
    private String url;
    private Map<String, String> headers;
    private String payloadTemplate;
}
