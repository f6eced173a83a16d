package com.example.eventscheduler.service.handler;

import com.example.eventscheduler.domain.enums.ActionType;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Registry for target action handlers.
 * <p>
 * Discovers all TargetActionHandler beans and provides lookup by action type.
 */
@Slf4j
@Component
public class TargetActionHandlerRegistry {

    private final Map<ActionType, TargetActionHandler> handlers = new EnumMap<>(ActionType.class);
    private final List<TargetActionHandler> handlerBeans;

    public TargetActionHandlerRegistry(List<TargetActionHandler> handlerBeans) {
        this.handlerBeans = handlerBeans;
    }

    @PostConstruct
    public void initialize() {
        for (var handler : handlerBeans) {
            var type = handler.getActionType();
            if (handlers.containsKey(type)) {
                log.warn("Duplicate handler for action type {}: {} will override {}",
                        type, handler.getClass().getSimpleName(),
                        handlers.get(type).getClass().getSimpleName());
            }
            handlers.put(type, handler);
            log.info("Registered handler for action type {}: {}", type, handler.getClass().getSimpleName());
        }

        for (var type : ActionType.values()) {
            if (!handlers.containsKey(type)) {
                log.warn("No handler registered for action type: {}", type);
            }
        }
    }

    public Optional<TargetActionHandler> getHandler(ActionType actionType) {
        return Optional.ofNullable(handlers.get(actionType));
    }

    /**
     * Get handler for an action type, throwing if not found
     *
     * @throws IllegalArgumentException if no handler is registered
     */
    public TargetActionHandler getHandlerOrThrow(ActionType actionType) {
        return getHandler(actionType).orElseThrow(() -> new IllegalArgumentException("No handler registered for action type: " + actionType));
    }

    public boolean hasHandler(ActionType actionType) {
        return handlers.containsKey(actionType);
    }

    public Set<ActionType> getRegisteredTypes() {
        return handlers.keySet();
    }
}
