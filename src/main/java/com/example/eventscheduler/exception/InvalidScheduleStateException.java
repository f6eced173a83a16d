package com.example.eventscheduler.exception;

import lombok.Getter;

/**
 * Exception for invalid schedule state transition
 */
@Getter
public class InvalidScheduleStateException extends RuntimeException {

    private final String scheduleId;
    private final String currentState;
    private final String requestedState;

    public InvalidScheduleStateException(String scheduleId, String currentState, String requestedState) {
        super(String.format("Cannot transition schedule %s from %s to %s", scheduleId, currentState, requestedState));
        this.scheduleId = scheduleId;
        this.currentState = currentState;
        this.requestedState = requestedState;
    }
}
