package com.example.eventscheduler.domain.enums;

public enum DeliveryOutcome {
    PENDING,
    DELIVERED,
    FAILED
}
