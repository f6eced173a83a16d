package com.example.eventscheduler.service.dispatch;

import com.example.eventscheduler.service.handler.DeliveryResult;

/**
 * Sink for delivery attempts, e.g. an event history store.
 */
public interface DeliveryAttemptListener {

    /**
     * Called after every attempt, successful or not
     */
    void onAttempt(TriggerEvent trigger, DeliveryResult result);

    /**
     * Called once when a trigger reaches its final outcome
     */
    default void onCompleted(TriggerEvent trigger, DeliveryResult lastResult) {
    }
}
