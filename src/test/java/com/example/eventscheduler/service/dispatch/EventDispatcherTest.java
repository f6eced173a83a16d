package com.example.eventscheduler.service.dispatch;

import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.config.MetricsConfig;
import com.example.eventscheduler.domain.enums.ActionType;
import com.example.eventscheduler.domain.enums.DeliveryOutcome;
import com.example.eventscheduler.exception.DeliveryException;
import com.example.eventscheduler.service.alert.SlackAlertService;
import com.example.eventscheduler.service.handler.DeliveryResult;
import com.example.eventscheduler.service.handler.TargetActionHandler;
import com.example.eventscheduler.service.handler.TargetActionHandlerRegistry;
import com.example.eventscheduler.service.store.ScheduleStore;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;

import static com.example.eventscheduler.ScheduleFixtures.callback;
import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.contains;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@DisplayName("EventDispatcher Tests")
class EventDispatcherTest {

    private static final Instant FIRE_TIME = Instant.parse("2026-03-01T10:00:00Z");

    @Mock
    private TargetActionHandlerRegistry handlerRegistry;

    @Mock
    private TargetActionHandler handler;

    @Mock
    private ScheduleStore scheduleStore;

    @Mock
    private SlackAlertService slackAlertService;

    @Mock
    private MetricsConfig metricsConfig;

    private EventSchedulerProperties properties;
    private List<String> attempts;
    private DeliveryAttemptListener recordingListener;
    private UUID scheduleId;

    @BeforeEach
    void setUp() {
        properties = new EventSchedulerProperties();
        properties.setMaxDeliveryAttempts(3);
        properties.setRetryBackoffBaseMs(1);
        properties.setRetryBackoffMultiplier(1.5);
        properties.setDispatcherConcurrency(1);
        properties.setDispatcherQueueCapacity(0);
        attempts = new ArrayList<>();
        recordingListener = (trigger, result) -> attempts.add(trigger.getAttempt() + ":" + (result.isSuccess() ? "ok" : "failed"));
        scheduleId = UUID.randomUUID();
    }

    private EventDispatcher dispatcher(Executor executor) {
        return new EventDispatcher(handlerRegistry, scheduleStore, slackAlertService, List.of(recordingListener),
                metricsConfig, properties, executor);
    }

    private TriggerEvent trigger() {
        return TriggerEvent.builder()
                .scheduleId(scheduleId)
                .scheduleName("billing-sync")
                .fireTime(FIRE_TIME)
                .targetAction(callback("http://billing/hooks/sync"))
                .build();
    }

    private static DeliveryResult http503() {
        return DeliveryResult.failure(new DeliveryException("http://billing/hooks/sync", 503, "unavailable"));
    }

    @Nested
    @DisplayName("Delivery Tests")
    class DeliveryTests {

        @BeforeEach
        void registerHandler() {
            when(handlerRegistry.getHandler(ActionType.HTTP_CALLBACK)).thenReturn(Optional.of(handler));
        }

        @Test
        @DisplayName("Fail, fail, succeed should record every attempt and keep the schedule")
        void shouldRetryUntilSuccess() {
            // Given
            var trigger = trigger();
            when(handler.deliver(trigger))
                    .thenReturn(http503())
                    .thenReturn(http503())
                    .thenReturn(DeliveryResult.success(200, "ok", 12));

            // When
            var result = dispatcher(Runnable::run).deliver(trigger);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(trigger.getAttempt()).isEqualTo(3);
            assertThat(trigger.getOutcome()).isEqualTo(DeliveryOutcome.DELIVERED);
            assertThat(attempts).containsExactly("1:failed", "2:failed", "3:ok");
            verify(scheduleStore, never()).markFailed(any(), anyString());
            verify(slackAlertService, never()).sendScheduleFailedAlert(any(), any(), any(), anyInt(), any());
        }

        @Test
        @DisplayName("Success below the attempt cap should stop retrying")
        void shouldStopAtSuccessBelowCap() {
            // Given
            properties.setMaxDeliveryAttempts(5);
            var trigger = trigger();
            when(handler.deliver(trigger))
                    .thenReturn(http503())
                    .thenReturn(http503())
                    .thenReturn(DeliveryResult.success(200, "ok", 8));

            // When
            var result = dispatcher(Runnable::run).deliver(trigger);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(trigger.getAttempt()).isEqualTo(3);
            assertThat(trigger.getOutcome()).isEqualTo(DeliveryOutcome.DELIVERED);
            assertThat(attempts).containsExactly("1:failed", "2:failed", "3:ok");
            verify(handler, times(3)).deliver(trigger);
            verify(scheduleStore, never()).markFailed(any(), anyString());
        }

        @Test
        @DisplayName("Exhausted attempts should mark the schedule failed and alert")
        void shouldMarkFailedWhenExhausted() {
            // Given
            var trigger = trigger();
            when(handler.deliver(trigger)).thenReturn(http503());
            when(scheduleStore.markFailed(eq(scheduleId), contains("after 3 attempts"))).thenReturn(true);

            // When
            var result = dispatcher(Runnable::run).deliver(trigger);

            // Then
            assertThat(result.isSuccess()).isFalse();
            assertThat(result.getHttpStatusCode()).isEqualTo(503);
            assertThat(trigger.getOutcome()).isEqualTo(DeliveryOutcome.FAILED);
            assertThat(attempts).containsExactly("1:failed", "2:failed", "3:failed");
            verify(slackAlertService).sendScheduleFailedAlert(eq(scheduleId), eq("billing-sync"), eq(FIRE_TIME), eq(3), contains("HTTP 503"));
        }

        @Test
        @DisplayName("Non-retryable failure should not be retried")
        void shouldNotRetryPermanentFailure() {
            // Given
            var trigger = trigger();
            when(handler.deliver(trigger)).thenReturn(DeliveryResult.permanentFailure("Invalid URL", "INVALID_ACTION"));
            when(scheduleStore.markFailed(eq(scheduleId), anyString())).thenReturn(true);

            // When
            dispatcher(Runnable::run).deliver(trigger);

            // Then
            verify(handler, times(1)).deliver(trigger);
            assertThat(attempts).containsExactly("1:failed");
        }

        @Test
        @DisplayName("Handler exceptions should count as failed attempts")
        void shouldConvertHandlerExceptions() {
            // Given
            var trigger = trigger();
            when(handler.deliver(trigger))
                    .thenThrow(new IllegalStateException("connection reset"))
                    .thenReturn(DeliveryResult.success(204, null, 3));

            // When
            var result = dispatcher(Runnable::run).deliver(trigger);

            // Then
            assertThat(result.isSuccess()).isTrue();
            assertThat(attempts).containsExactly("1:failed", "2:ok");
        }

        @Test
        @DisplayName("No alert when the schedule was no longer eligible to fail")
        void shouldNotAlertWhenMarkFailedLoses() {
            // Given
            var trigger = trigger();
            when(handler.deliver(trigger)).thenReturn(http503());
            when(scheduleStore.markFailed(eq(scheduleId), anyString())).thenReturn(false);

            // When
            dispatcher(Runnable::run).deliver(trigger);

            // Then
            verify(slackAlertService, never()).sendScheduleFailedAlert(any(), any(), any(), anyInt(), any());
        }
    }

    @Test
    @DisplayName("Missing handler should fail the trigger without retries")
    void shouldFailWithoutHandler() {
        // Given
        var trigger = trigger();
        when(handlerRegistry.getHandler(ActionType.HTTP_CALLBACK)).thenReturn(Optional.empty());
        when(scheduleStore.markFailed(eq(scheduleId), contains("No handler"))).thenReturn(true);

        // When
        var result = dispatcher(Runnable::run).deliver(trigger);

        // Then
        assertThat(result.getErrorType()).isEqualTo("NO_HANDLER");
        assertThat(trigger.getOutcome()).isEqualTo(DeliveryOutcome.FAILED);
        assertThat(attempts).isEmpty();
    }

    @Nested
    @DisplayName("Capacity Tests")
    class CapacityTests {

        @Test
        @DisplayName("Should refuse triggers beyond capacity and free the slot after delivery")
        void shouldRefuseWhenSaturated() {
            // Given: an executor that holds tasks until the test runs them
            var held = new ArrayList<Runnable>();
            var dispatcher = dispatcher(held::add);
            when(handlerRegistry.getHandler(ActionType.HTTP_CALLBACK)).thenReturn(Optional.of(handler));
            when(handler.deliver(any())).thenReturn(DeliveryResult.success(200, "ok", 1));

            // When
            var first = dispatcher.dispatch(trigger());
            var second = dispatcher.dispatch(trigger());

            // Then
            assertThat(first).isTrue();
            assertThat(second).isFalse();
            assertThat(dispatcher.availableSlots()).isZero();
            verify(metricsConfig).recordDispatcherSaturated();

            held.get(0).run();

            assertThat(dispatcher.availableSlots()).isEqualTo(1);
        }

        @Test
        @DisplayName("Should give the slot back when the executor rejects the trigger")
        void shouldReleaseSlotOnRejection() {
            // Given
            Executor rejecting = task -> {
                throw new RejectedExecutionException("queue full");
            };
            var dispatcher = dispatcher(rejecting);

            // When
            var accepted = dispatcher.dispatch(trigger());

            // Then
            assertThat(accepted).isFalse();
            assertThat(dispatcher.availableSlots()).isEqualTo(1);
        }
    }
}
