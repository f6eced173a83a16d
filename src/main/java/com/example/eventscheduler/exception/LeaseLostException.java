package com.example.eventscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * The worker can no longer prove ownership of a schedule; its cycle must be abandoned
 * without any further persisted side effect.
 */
@Getter
public class LeaseLostException extends RuntimeException {

    private final String scheduleId;
    private final String owner;

    public LeaseLostException(UUID scheduleId, String owner, String reason) {
        super(String.format("Lease on schedule %s held by %s lost: %s", scheduleId, owner, reason));
        this.scheduleId = scheduleId.toString();
        this.owner = owner;
    }
}
