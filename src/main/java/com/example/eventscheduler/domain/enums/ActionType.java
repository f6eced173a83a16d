package com.example.eventscheduler.domain.enums;

import lombok.Getter;
import lombok.RequiredArgsConstructor;

/**
 * Closed set of target action kinds a schedule can trigger.
 * Each kind has exactly one handler registered in the handler registry.
 */
@Getter
@RequiredArgsConstructor
public enum ActionType {

    HTTP_CALLBACK("HTTP Callback");

    private final String displayName;
}
