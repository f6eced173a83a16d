package com.example.eventscheduler.exception;

import lombok.Getter;

/**
 * The recurrence rule of a schedule cannot be evaluated (bad cron, bad timezone, missing interval).
 * The schedule moves to FAILED and is never retried automatically.
 */
@Getter
public class RecurrenceComputationException extends RuntimeException {

    private final String scheduleName;

    public RecurrenceComputationException(String scheduleName, String message) {
        super(String.format("Invalid recurrence for schedule %s: %s", scheduleName, message));
        this.scheduleName = scheduleName;
    }

    public RecurrenceComputationException(String scheduleName, String message, Exception cause) {
        super(String.format("Invalid recurrence for schedule %s: %s", scheduleName, message), cause);
        this.scheduleName = scheduleName;
    }
}
