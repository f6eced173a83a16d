package com.example.eventscheduler.dto;

import com.example.eventscheduler.domain.enums.ActionType;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;

/**
 * What a schedule triggers; validated further by the handler of its action type
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TargetActionRequest {

    /**
     * Defaults to HTTP_CALLBACK
     */
    private ActionType actionType;

    /**
     * HTTP method, defaults to POST
     */
    private String method;

    @NotBlank(message = "Target URL is required")
    @Size(max = 2000)
    private String url;

    private Map<String, String> headers;

    @Size(max = 4000)
    private String payloadTemplate;
}
