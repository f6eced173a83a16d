package com.example.eventscheduler.service.handler;

import com.example.eventscheduler.domain.entity.TargetAction;
import com.example.eventscheduler.domain.enums.ActionType;
import com.example.eventscheduler.service.dispatch.TriggerEvent;

/**
 * Interface for target action handlers.
 * <p>
 * Each action type has exactly one handler that knows how to deliver a trigger to it.
 * <p>
 * Handlers should:
 * - Be stateless
 * - Make a single attempt per call (retries belong to the dispatcher)
 * - Translate their own errors into a {@link DeliveryResult}
 */
public interface TargetActionHandler {

    /**
     * Get the action type this handler supports
     */
    ActionType getActionType();

    /**
     * Deliver one attempt of a trigger
     *
     * @param trigger The trigger, with its attempt counter already incremented
     * @return Result of the attempt
     */
    DeliveryResult deliver(TriggerEvent trigger);

    default boolean supports(ActionType actionType) {
        return getActionType() == actionType;
    }

    /**
     * Validate an action when a schedule is created or updated
     *
     * @throws IllegalArgumentException if the action cannot be delivered by this handler
     */
    default void validate(TargetAction action) {
        if (action.getUrl() == null || action.getUrl().isBlank()) {
            throw new IllegalArgumentException("Target action URL is required");
        }
    }
}
