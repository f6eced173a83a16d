package com.example.eventscheduler.config;

import io.netty.channel.ChannelOption;
import io.netty.handler.timeout.ReadTimeoutHandler;
import io.netty.handler.timeout.WriteTimeoutHandler;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.http.client.reactive.ReactorClientHttpConnector;
import org.springframework.web.reactive.function.client.ExchangeFilterFunction;
import org.springframework.web.reactive.function.client.WebClient;
import reactor.core.publisher.Mono;
import reactor.netty.http.client.HttpClient;

import java.time.Duration;
import java.util.concurrent.TimeUnit;

/**
 * WebClient configuration for target action callbacks.
 * <p>
 * Callback URLs are absolute and differ per schedule, so a single client without base URL
 * is shared; timeouts come from the scheduler configuration.
 */
@Configuration
@Slf4j
public class WebClientConfig {

    @Bean(name = "callbackWebClient")
    public WebClient callbackWebClient(WebClient.Builder builder, EventSchedulerProperties properties) {
        var timeoutSeconds = properties.getCallbackTimeoutSeconds();
        var httpClient = HttpClient.create()
                .option(ChannelOption.CONNECT_TIMEOUT_MILLIS, timeoutSeconds * 1000)
                .responseTimeout(Duration.ofSeconds(timeoutSeconds))
                .doOnConnected(conn -> conn
                        .addHandlerLast(new ReadTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS))
                        .addHandlerLast(new WriteTimeoutHandler(timeoutSeconds, TimeUnit.SECONDS)));

        return builder.clone()
                .clientConnector(new ReactorClientHttpConnector(httpClient))
                .defaultHeader("X-Service-Name", "event-scheduler")
                .filter(logRequest())
                .filter(logResponse())
                .build();
    }

    /**
     * Log outgoing requests
     */
    private ExchangeFilterFunction logRequest() {
        return ExchangeFilterFunction.ofRequestProcessor(clientRequest -> {
            log.debug("[Callback] Request: {} {}", clientRequest.method(), clientRequest.url());
            return Mono.just(clientRequest);
        });
    }

    /**
     * Log incoming responses
     */
    private ExchangeFilterFunction logResponse() {
        return ExchangeFilterFunction.ofResponseProcessor(clientResponse -> {
            if (clientResponse.statusCode().isError()) {
                log.warn("[Callback] Error response: {}", clientResponse.statusCode());
            } else {
                log.debug("[Callback] Response status: {}", clientResponse.statusCode());
            }
            return Mono.just(clientResponse);
        });
    }
}
