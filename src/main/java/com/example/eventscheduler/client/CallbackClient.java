package com.example.eventscheduler.client;

import com.example.eventscheduler.client.ClientModels.CallbackRequest;
import com.example.eventscheduler.client.ClientModels.CallbackResponse;
import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.exception.DeliveryException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.stereotype.Component;
import org.springframework.web.reactive.function.client.WebClient;

import java.net.URI;
import java.time.Duration;

/**
 * Client for target action callbacks.
 * <p>
 * Performs exactly one HTTP call per invocation; retries are owned by the dispatcher.
 * Any status outside the configured success range is reported as a {@link DeliveryException}.
 */
@Slf4j
@Component
public class CallbackClient {

    private static final String TARGET = "Callback";

    private final WebClient webClient;
    private final EventSchedulerProperties properties;

    public CallbackClient(@Qualifier("callbackWebClient") WebClient webClient, EventSchedulerProperties properties) {
        this.webClient = webClient;
        this.properties = properties;
    }

    /**
     * Send a callback and wait for its response
     *
     * @param request The callback to send
     * @return The response when its status is in the success range
     * @throws DeliveryException for a non-success status, a timeout or a connection error
     */
    public CallbackResponse send(CallbackRequest request) {
        var method = HttpMethod.valueOf(request.getMethod() != null ? request.getMethod().toUpperCase() : "POST");
        log.debug("Calling {} {}", method, request.getUrl());
        var started = System.nanoTime();

        try {
            var spec = webClient.method(method)
                    .uri(URI.create(request.getUrl()))
                    .contentType(MediaType.APPLICATION_JSON)
                    .headers(h -> request.getHeaders().forEach(h::set));

            WebClient.RequestHeadersSpec<?> call = request.getBody() != null ? spec.bodyValue(request.getBody()) : spec;
            var entity = call
                    .exchangeToMono(response -> response.toEntity(String.class))
                    .timeout(Duration.ofSeconds(properties.getCallbackTimeoutSeconds()))
                    .block();

            if (entity == null) {
                throw new DeliveryException(TARGET, "No response from " + request.getUrl());
            }

            var status = entity.getStatusCode().value();
            if (!properties.isSuccessStatus(status)) {
                throw new DeliveryException(TARGET, status, entity.getBody());
            }

            return CallbackResponse.builder()
                    .statusCode(status)
                    .body(entity.getBody())
                    .durationMs(Duration.ofNanos(System.nanoTime() - started).toMillis())
                    .build();
        } catch (DeliveryException e) {
            throw e;
        } catch (IllegalArgumentException e) {
            throw new DeliveryException(TARGET, "Invalid callback URL " + request.getUrl() + ": " + e.getMessage(), false);
        } catch (Exception e) {
            log.debug("Callback to {} failed: {}", request.getUrl(), e.getMessage());
            throw new DeliveryException(TARGET, e);
        }
    }
}
