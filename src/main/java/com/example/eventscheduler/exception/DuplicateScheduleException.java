package com.example.eventscheduler.exception;

import lombok.Getter;

/**
 * Exception for duplicate schedule name
 */
@Getter
public class DuplicateScheduleException extends RuntimeException {

    private final String name;

    public DuplicateScheduleException(String name) {
        super(String.format("Schedule with name %s already exists", name));
        this.name = name;
    }
}
