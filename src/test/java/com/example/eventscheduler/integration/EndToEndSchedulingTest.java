package com.example.eventscheduler.integration;

import com.example.eventscheduler.client.CallbackClient;
import com.example.eventscheduler.client.ClientModels.CallbackRequest;
import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.domain.enums.RecurrenceType;
import com.example.eventscheduler.domain.enums.ScheduleState;
import com.example.eventscheduler.domain.repository.ScheduleRepository;
import com.example.eventscheduler.dto.CreateScheduleRequest;
import com.example.eventscheduler.dto.TargetActionRequest;
import com.example.eventscheduler.service.ScheduleManagementService;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.annotation.DirtiesContext;
import org.springframework.test.context.ActiveProfiles;

import java.io.IOException;
import java.time.Duration;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.UUID;
import java.util.concurrent.TimeUnit;
import java.util.function.BooleanSupplier;

import static org.assertj.core.api.Assertions.assertThat;

/**
 * Runs the whole worker (loop, dispatcher, callback client) against a local HTTP receiver.
 */
@SpringBootTest(
        webEnvironment = SpringBootTest.WebEnvironment.NONE,
        properties = "spring.datasource.url=jdbc:h2:mem:e2e;MODE=PostgreSQL;DB_CLOSE_DELAY=-1;DATABASE_TO_LOWER=TRUE;DEFAULT_NULL_ORDERING=HIGH"
)
@ActiveProfiles("test")
@DirtiesContext
@DisplayName("End-to-End Scheduling Tests")
class EndToEndSchedulingTest {

    @Autowired
    private ScheduleManagementService managementService;

    @Autowired
    private ScheduleRepository scheduleRepository;

    @Autowired
    private CallbackClient callbackClient;

    @Autowired
    private EventSchedulerProperties properties;

    private MockWebServer receiver;

    @BeforeEach
    void setUp() throws IOException {
        scheduleRepository.deleteAll();
        receiver = new MockWebServer();
        receiver.start();
    }

    @AfterEach
    void tearDown() throws IOException {
        receiver.shutdown();
    }

    private UUID registerOneShot(String name, Instant fireAt) {
        return managementService.createSchedule(CreateScheduleRequest.builder()
                .name(name)
                .recurrenceType(RecurrenceType.ONCE)
                .startAt(fireAt)
                .targetAction(TargetActionRequest.builder()
                        .url(receiver.url("/hooks/" + name).toString())
                        .payloadTemplate("{\"schedule\":\"${scheduleName}\",\"attempt\":${attempt}}")
                        .build())
                .build()).getId();
    }

    /**
     * The first WebClient exchange starts Reactor Netty; do it before timing a delivery.
     */
    private void warmUpCallbackClient() throws IOException {
        try (var warmUp = new MockWebServer()) {
            warmUp.start();
            warmUp.enqueue(new MockResponse().setResponseCode(200));
            callbackClient.send(CallbackRequest.builder().method("GET").url(warmUp.url("/ping").toString()).build());
        }
    }

    private ScheduleState stateOf(UUID id) {
        return scheduleRepository.findById(id).orElseThrow().getState();
    }

    private static void waitFor(BooleanSupplier condition, Duration timeout) throws InterruptedException {
        var deadline = System.nanoTime() + timeout.toNanos();
        while (!condition.getAsBoolean()) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Condition not met within " + timeout);
            }
            Thread.sleep(50);
        }
    }

    @Test
    @DisplayName("One-shot event should be delivered once, on time, and complete")
    void oneShotShouldBeDeliveredOnce() throws Exception {
        // Given
        warmUpCallbackClient();
        receiver.enqueue(new MockResponse().setResponseCode(200));
        var window = Duration.ofMillis(properties.getPollIntervalMs()).plusMillis(300);
        var fireAt = Instant.now().plusSeconds(2).truncatedTo(ChronoUnit.MILLIS);
        var id = registerOneShot("welcome-mail", fireAt);

        // When
        var request = receiver.takeRequest(6, TimeUnit.SECONDS);
        var receivedAt = Instant.now();

        // Then
        assertThat(request).isNotNull();
        assertThat(receivedAt).isAfterOrEqualTo(fireAt);
        assertThat(Duration.between(fireAt, receivedAt)).isLessThanOrEqualTo(window);
        assertThat(request.getHeader("Idempotency-Key")).isEqualTo(id + ":" + fireAt);
        assertThat(request.getBody().readUtf8()).isEqualTo("{\"schedule\":\"welcome-mail\",\"attempt\":1}");

        waitFor(() -> stateOf(id) == ScheduleState.COMPLETED, Duration.ofSeconds(5));
        assertThat(receiver.takeRequest(1500, TimeUnit.MILLISECONDS)).isNull();
        assertThat(scheduleRepository.findById(id).orElseThrow().getFireCount()).isEqualTo(1L);
    }

    @Test
    @DisplayName("Transient failures should be retried until the receiver accepts")
    void transientFailuresShouldBeRetried() throws Exception {
        // Given
        receiver.enqueue(new MockResponse().setResponseCode(503));
        receiver.enqueue(new MockResponse().setResponseCode(502));
        receiver.enqueue(new MockResponse().setResponseCode(200));
        var id = registerOneShot("flaky-receiver", Instant.now().plusMillis(500));

        // When
        var first = receiver.takeRequest(5, TimeUnit.SECONDS);
        var second = receiver.takeRequest(5, TimeUnit.SECONDS);
        var third = receiver.takeRequest(5, TimeUnit.SECONDS);

        // Then
        assertThat(first).isNotNull();
        assertThat(second).isNotNull();
        assertThat(third).isNotNull();
        assertThat(third.getHeader("Idempotency-Key")).isEqualTo(first.getHeader("Idempotency-Key"));
        waitFor(() -> stateOf(id) == ScheduleState.COMPLETED, Duration.ofSeconds(5));
        assertThat(receiver.takeRequest(1, TimeUnit.SECONDS)).isNull();
    }

    @Test
    @DisplayName("Exhausted retries should leave the schedule FAILED")
    void exhaustedRetriesShouldFailSchedule() throws Exception {
        // Given
        for (var i = 0; i < 3; i++) {
            receiver.enqueue(new MockResponse().setResponseCode(500).setBody("boom"));
        }
        var id = registerOneShot("broken-receiver", Instant.now().plusMillis(500));

        // When
        waitFor(() -> stateOf(id) == ScheduleState.FAILED, Duration.ofSeconds(10));

        // Then
        assertThat(receiver.getRequestCount()).isEqualTo(3);
        assertThat(scheduleRepository.findById(id).orElseThrow().getLastError()).contains("after 3 attempts");
    }
}
