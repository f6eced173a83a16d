package com.example.eventscheduler.service.dispatch;

import com.example.eventscheduler.config.EventSchedulerProperties;
import com.example.eventscheduler.config.MetricsConfig;
import com.example.eventscheduler.domain.enums.DeliveryOutcome;
import com.example.eventscheduler.service.alert.SlackAlertService;
import com.example.eventscheduler.service.handler.DeliveryResult;
import com.example.eventscheduler.service.handler.TargetActionHandler;
import com.example.eventscheduler.service.handler.TargetActionHandlerRegistry;
import com.example.eventscheduler.service.store.ScheduleStore;
import io.github.resilience4j.core.IntervalFunction;
import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryConfig;
import jakarta.annotation.PostConstruct;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.Semaphore;

/**
 * Delivers triggers to their target actions, off the scheduling loop's thread.
 * <p>
 * Capacity is bounded by the concurrency limit plus the queue capacity. When every slot is
 * taken, {@link #dispatch(TriggerEvent)} refuses the trigger and the loop stops claiming.
 * <p>
 * Each trigger is retried with exponential backoff up to the configured number of attempts.
 * When attempts are exhausted the schedule is marked FAILED and an alert is sent.
 * Delivery is at-least-once: receivers de-duplicate on the idempotency key.
 */
@Slf4j
@Service
public class EventDispatcher {

    private final TargetActionHandlerRegistry handlerRegistry;
    private final ScheduleStore scheduleStore;
    private final SlackAlertService slackAlertService;
    private final List<DeliveryAttemptListener> listeners;
    private final MetricsConfig metricsConfig;
    private final Executor dispatchExecutor;

    private final int capacity;
    private final Semaphore slots;
    private final Retry retry;

    public EventDispatcher(TargetActionHandlerRegistry handlerRegistry,
                           ScheduleStore scheduleStore,
                           SlackAlertService slackAlertService,
                           List<DeliveryAttemptListener> listeners,
                           MetricsConfig metricsConfig,
                           EventSchedulerProperties properties,
                           @Qualifier("dispatchExecutor") Executor dispatchExecutor) {
        this.handlerRegistry = handlerRegistry;
        this.scheduleStore = scheduleStore;
        this.slackAlertService = slackAlertService;
        this.listeners = listeners;
        this.metricsConfig = metricsConfig;
        this.dispatchExecutor = dispatchExecutor;
        this.capacity = properties.getDispatcherConcurrency() + properties.getDispatcherQueueCapacity();
        this.slots = new Semaphore(capacity);
        this.retry = Retry.of("delivery", RetryConfig.<DeliveryResult>custom()
                .maxAttempts(properties.getMaxDeliveryAttempts())
                .intervalFunction(IntervalFunction.ofExponentialBackoff(
                        properties.getRetryBackoffBaseMs(), properties.getRetryBackoffMultiplier()))
                .retryOnResult(result -> !result.isSuccess() && result.isRetryable())
                .build());
        this.retry.getEventPublisher().onRetry(event ->
                log.debug("Retrying delivery in {} (attempt {} done)", event.getWaitInterval(), event.getNumberOfRetryAttempts()));
    }

    @PostConstruct
    public void registerMetrics() {
        metricsConfig.registerGauge("dispatcher_slots_in_use", "Triggers running or queued for delivery",
                slots, s -> capacity - s.availablePermits());
    }

    /**
     * Hand a trigger over for asynchronous delivery without waiting for it.
     *
     * @return false if the dispatcher is saturated and the trigger was not accepted
     */
    public boolean dispatch(TriggerEvent trigger) {
        if (!slots.tryAcquire()) {
            log.debug("Dispatcher saturated, refusing schedule {}", trigger.getScheduleName());
            metricsConfig.recordDispatcherSaturated();
            return false;
        }

        try {
            dispatchExecutor.execute(() -> {
                try {
                    deliver(trigger);
                } finally {
                    slots.release();
                }
            });
            return true;
        } catch (RejectedExecutionException e) {
            slots.release();
            log.warn("Dispatch executor rejected schedule {}: {}", trigger.getScheduleName(), e.getMessage());
            metricsConfig.recordDispatcherSaturated();
            return false;
        }
    }

    /**
     * Number of triggers that can still be accepted right now
     */
    public int availableSlots() {
        return slots.availablePermits();
    }

    /**
     * Deliver a trigger on the calling thread, retrying per policy.
     *
     * @return the result of the last attempt
     */
    public DeliveryResult deliver(TriggerEvent trigger) {
        var handler = handlerRegistry.getHandler(trigger.getTargetAction().getActionType()).orElse(null);

        DeliveryResult last;
        if (handler == null) {
            last = DeliveryResult.permanentFailure(
                    "No handler registered for action type " + trigger.getTargetAction().getActionType(), "NO_HANDLER");
        } else {
            last = Retry.decorateSupplier(retry, () -> attempt(handler, trigger)).get();
        }

        if (last.isSuccess()) {
            trigger.setOutcome(DeliveryOutcome.DELIVERED);
        } else {
            trigger.setOutcome(DeliveryOutcome.FAILED);
            handleExhausted(trigger, last);
        }
        notifyCompleted(trigger, last);
        return last;
    }

    private DeliveryResult attempt(TargetActionHandler handler, TriggerEvent trigger) {
        trigger.nextAttempt();
        DeliveryResult result;
        try {
            result = handler.deliver(trigger);
        } catch (Exception e) {
            log.error("Handler {} threw for schedule {}: {}", handler.getClass().getSimpleName(), trigger.getScheduleName(), e.getMessage(), e);
            result = DeliveryResult.failure(e);
        }
        notifyAttempt(trigger, result);
        return result;
    }

    private void handleExhausted(TriggerEvent trigger, DeliveryResult last) {
        log.error("Giving up delivery of schedule {} occurrence {} after {} attempts: {}",
                trigger.getScheduleName(), trigger.getFireTime(), trigger.getAttempt(), last.getErrorMessage());

        var error = String.format("Delivery of occurrence %s failed after %d attempts: %s",
                trigger.getFireTime(), trigger.getAttempt(), last.getErrorMessage());
        try {
            if (scheduleStore.markFailed(trigger.getScheduleId(), error)) {
                slackAlertService.sendScheduleFailedAlert(trigger.getScheduleId(), trigger.getScheduleName(),
                        trigger.getFireTime(), trigger.getAttempt(), last.getErrorMessage());
            }
        } catch (RuntimeException e) {
            log.error("Could not mark schedule {} failed: {}", trigger.getScheduleName(), e.getMessage(), e);
        }
    }

    private void notifyAttempt(TriggerEvent trigger, DeliveryResult result) {
        for (var listener : listeners) {
            try {
                listener.onAttempt(trigger, result);
            } catch (Exception e) {
                log.warn("Delivery listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }

    private void notifyCompleted(TriggerEvent trigger, DeliveryResult result) {
        for (var listener : listeners) {
            try {
                listener.onCompleted(trigger, result);
            } catch (Exception e) {
                log.warn("Delivery listener {} failed: {}", listener.getClass().getSimpleName(), e.getMessage());
            }
        }
    }
}
