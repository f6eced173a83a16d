package com.example.eventscheduler.exception;

import lombok.Getter;

import java.util.UUID;

/**
 * A conditional write carried a version that no longer matches the stored one.
 * This is an expected outcome of concurrent writers, not an error.
 */
@Getter
public class VersionConflictException extends RuntimeException {

    private final String scheduleId;
    private final Long expectedVersion;

    public VersionConflictException(UUID scheduleId, Long expectedVersion) {
        super(String.format("Schedule %s was modified concurrently (expected version %s)", scheduleId, expectedVersion));
        this.scheduleId = scheduleId.toString();
        this.expectedVersion = expectedVersion;
    }

    public VersionConflictException(UUID scheduleId, Exception cause) {
        super(String.format("Schedule %s was modified concurrently", scheduleId), cause);
        this.scheduleId = scheduleId.toString();
        this.expectedVersion = null;
    }
}
