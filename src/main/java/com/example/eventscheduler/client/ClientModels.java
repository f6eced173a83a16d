package com.example.eventscheduler.client;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.HashMap;
import java.util.Map;

/**
 * Request/Response DTOs for outbound callbacks
 */
public class ClientModels {
    private ClientModels() {
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CallbackRequest {
        private String method;
        private String url;
        @Builder.Default
        private Map<String, String> headers = new HashMap<>();
        private String body;
    }

    @Data
    @Builder
    @NoArgsConstructor
    @AllArgsConstructor
    public static class CallbackResponse {
        private int statusCode;
        private String body;
        private long durationMs;
    }
}
