package com.example.eventscheduler.exception;

import lombok.Getter;

/**
 * Transient failure of the schedule store (connection loss, timeout, pool exhaustion).
 * Callers back off and retry on their next cycle.
 */
@Getter
public class StoreUnavailableException extends RuntimeException {

    private final String operation;

    public StoreUnavailableException(String operation, Exception cause) {
        super(String.format("Schedule store unavailable during %s: %s", operation, cause.getMessage()), cause);
        this.operation = operation;
    }
}
