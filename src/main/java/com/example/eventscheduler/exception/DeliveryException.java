package com.example.eventscheduler.exception;

import lombok.Getter;

/**
 * Failure to deliver a trigger to its target action.
 */
@Getter
public class DeliveryException extends RuntimeException {

    private final String target;
    private final Integer httpStatusCode;
    private final String responseBody;
    private final boolean retryable;

    public DeliveryException(String target, String message) {
        super(String.format("[%s] %s", target, message));
        this.target = target;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public DeliveryException(String target, Exception cause) {
        super(String.format("[%s] %s", target, cause.getMessage()), cause);
        this.target = target;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = true;
    }

    public DeliveryException(String target, int httpStatusCode, String responseBody) {
        super(String.format("[%s] HTTP %d: %s", target, httpStatusCode, responseBody));
        this.target = target;
        this.httpStatusCode = httpStatusCode;
        this.responseBody = responseBody;
        // any status outside the configured success range is retry-eligible
        this.retryable = true;
    }

    public DeliveryException(String target, String message, boolean retryable) {
        super(String.format("[%s] %s", target, message));
        this.target = target;
        this.httpStatusCode = null;
        this.responseBody = null;
        this.retryable = retryable;
    }
}
