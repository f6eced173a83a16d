package com.example.eventscheduler.service.handler;

import com.example.eventscheduler.client.CallbackClient;
import com.example.eventscheduler.client.ClientModels.CallbackRequest;
import com.example.eventscheduler.domain.entity.TargetAction;
import com.example.eventscheduler.domain.enums.ActionType;
import com.example.eventscheduler.exception.DeliveryException;
import com.example.eventscheduler.service.dispatch.TriggerEvent;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.springframework.util.PropertyPlaceholderHelper;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.HashMap;
import java.util.Map;
import java.util.Set;

/**
 * Handler for HTTP_CALLBACK actions.
 * <p>
 * Calls the action's URL with its method and headers. The body is rendered from the
 * payload template, where these placeholders are resolved:
 * - ${scheduleId}
 * - ${scheduleName}
 * - ${fireTime}
 * - ${attempt}
 * <p>
 * Every request carries Idempotency-Key, X-Schedule-Id and X-Schedule-Fire-Time so
 * receivers can drop duplicate deliveries of one occurrence.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class HttpCallbackHandler implements TargetActionHandler {

    static final String IDEMPOTENCY_KEY_HEADER = "Idempotency-Key";
    static final String SCHEDULE_ID_HEADER = "X-Schedule-Id";
    static final String FIRE_TIME_HEADER = "X-Schedule-Fire-Time";

    private static final Set<String> SUPPORTED_METHODS = Set.of("GET", "POST", "PUT", "PATCH", "DELETE");
    private static final PropertyPlaceholderHelper PLACEHOLDERS = new PropertyPlaceholderHelper("${", "}", null, true);

    private final CallbackClient callbackClient;

    @Override
    public ActionType getActionType() {
        return ActionType.HTTP_CALLBACK;
    }

    @Override
    public void validate(TargetAction action) {
        TargetActionHandler.super.validate(action);

        try {
            var uri = new URI(action.getUrl());
            if (!"http".equalsIgnoreCase(uri.getScheme()) && !"https".equalsIgnoreCase(uri.getScheme())) {
                throw new IllegalArgumentException("Callback URL must use http or https: " + action.getUrl());
            }
            if (uri.getHost() == null) {
                throw new IllegalArgumentException("Callback URL has no host: " + action.getUrl());
            }
        } catch (URISyntaxException e) {
            throw new IllegalArgumentException("Malformed callback URL: " + action.getUrl());
        }

        if (action.getMethod() != null && !SUPPORTED_METHODS.contains(action.getMethod().toUpperCase())) {
            throw new IllegalArgumentException("Unsupported HTTP method: " + action.getMethod());
        }
    }

    @Override
    public DeliveryResult deliver(TriggerEvent trigger) {
        var action = trigger.getTargetAction();
        log.debug("Delivering schedule {} occurrence {} (attempt {}) to {}",
                trigger.getScheduleName(), trigger.getFireTime(), trigger.getAttempt(), action.getUrl());

        try {
            var response = callbackClient.send(CallbackRequest.builder()
                    .method(action.getMethod())
                    .url(action.getUrl())
                    .headers(buildHeaders(trigger))
                    .body(renderPayload(trigger))
                    .build());

            return DeliveryResult.success(response.getStatusCode(), response.getBody(), response.getDurationMs());
        } catch (DeliveryException e) {
            log.debug("Callback for schedule {} failed: {}", trigger.getScheduleName(), e.getMessage());
            return DeliveryResult.failure(e);
        } catch (Exception e) {
            log.error("Unexpected error delivering schedule {}: {}", trigger.getScheduleName(), e.getMessage(), e);
            return DeliveryResult.failure(e);
        }
    }

    private Map<String, String> buildHeaders(TriggerEvent trigger) {
        var headers = new HashMap<String, String>();
        if (trigger.getTargetAction().getHeaders() != null) {
            headers.putAll(trigger.getTargetAction().getHeaders());
        }
        headers.put(IDEMPOTENCY_KEY_HEADER, trigger.getIdempotencyKey());
        headers.put(SCHEDULE_ID_HEADER, trigger.getScheduleId().toString());
        headers.put(FIRE_TIME_HEADER, trigger.getFireTime().toString());
        return headers;
    }

    String renderPayload(TriggerEvent trigger) {
        var template = trigger.getTargetAction().getPayloadTemplate();
        if (template == null) {
            return null;
        }
        var values = Map.of(
                "scheduleId", trigger.getScheduleId().toString(),
                "scheduleName", trigger.getScheduleName(),
                "fireTime", trigger.getFireTime().toString(),
                "attempt", String.valueOf(trigger.getAttempt()));
        return PLACEHOLDERS.replacePlaceholders(template, values::get);
    }
}
