package com.example.eventscheduler.service.handler;

import com.example.eventscheduler.exception.DeliveryException;
import lombok.Builder;
import lombok.Data;

/**
 * Result of a single delivery attempt.
 */
@Data
@Builder
public class DeliveryResult {

    private boolean success;

    /**
     * HTTP status code if applicable
     */
    private Integer httpStatusCode;

    private String errorMessage;

    /**
     * Error classification for logs and metrics
     */
    private String errorType;

    private String responseBody;

    private long durationMs;

    /**
     * Whether another attempt may succeed
     */
    @Builder.Default
    private boolean retryable = true;

    public static DeliveryResult success(int httpStatusCode, String responseBody, long durationMs) {
        return DeliveryResult.builder()
                .success(true)
                .httpStatusCode(httpStatusCode)
                .responseBody(truncate(responseBody))
                .durationMs(durationMs)
                .build();
    }

    public static DeliveryResult failure(DeliveryException e) {
        return DeliveryResult.builder()
                .success(false)
                .httpStatusCode(e.getHttpStatusCode())
                .responseBody(truncate(e.getResponseBody()))
                .errorMessage(e.getMessage())
                .errorType(e.getHttpStatusCode() != null ? "HTTP_" + e.getHttpStatusCode() : errorTypeOf(e))
                .retryable(e.isRetryable())
                .build();
    }

    public static DeliveryResult failure(Exception e) {
        return DeliveryResult.builder()
                .success(false)
                .errorMessage(e.getMessage())
                .errorType(e.getClass().getSimpleName())
                .build();
    }

    /**
     * Create a non-retryable failure (permanent failure)
     */
    public static DeliveryResult permanentFailure(String errorMessage, String errorType) {
        return DeliveryResult.builder()
                .success(false)
                .errorMessage(errorMessage)
                .errorType(errorType)
                .retryable(false)
                .build();
    }

    private static String errorTypeOf(DeliveryException e) {
        return e.getCause() != null ? e.getCause().getClass().getSimpleName() : "DELIVERY_ERROR";
    }

    private static String truncate(String body) {
        if (body == null || body.length() <= 1000) {
            return body;
        }
        return body.substring(0, 1000) + "...";
    }
}
