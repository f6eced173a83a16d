package com.example.eventscheduler.config;

import com.example.eventscheduler.domain.enums.ScheduleState;
import com.example.eventscheduler.domain.repository.ScheduleRepository;
import io.micrometer.core.instrument.Gauge;
import io.micrometer.core.instrument.MeterRegistry;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Configuration;
import org.springframework.scheduling.annotation.Scheduled;

import java.time.Clock;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.ToDoubleFunction;

/**
 * Metrics for monitoring scheduler health and throughput.
 * <p>
 * Exposes Prometheus metrics for:
 * - Schedule counts by state and live leases
 * - Fired triggers, lease conflicts and abandoned cycles
 * - Delivery attempts, retries and exhausted deliveries
 * - Recovered schedules and dispatcher saturation
 */
@Slf4j
@Configuration
@RequiredArgsConstructor
public class MetricsConfig {

    private final MeterRegistry meterRegistry;
    private final ScheduleRepository scheduleRepository;
    private final Clock clock;

    private final ConcurrentHashMap<String, AtomicLong> scheduleCounters = new ConcurrentHashMap<>();

    @PostConstruct
    public void initializeMetrics() {
        for (var state : ScheduleState.values()) {
            var key = "state_" + state.getCode();
            scheduleCounters.put(key, new AtomicLong(0));

            Gauge.builder("event_scheduler_schedules", scheduleCounters.get(key), AtomicLong::get)
                    .tag("state", state.getCode())
                    .description("Number of schedules by state")
                    .register(meterRegistry);
        }

        scheduleCounters.put("leased", new AtomicLong(0));
        Gauge.builder("event_scheduler_leased_schedules", scheduleCounters.get("leased"), AtomicLong::get)
                .description("Number of schedules currently leased by a live worker")
                .register(meterRegistry);
    }

    /**
     * Periodically update gauge metrics from the store
     */
    @Scheduled(fixedDelayString = "${event-scheduler.metrics-update-interval-ms:60000}")
    public void updateMetrics() {
        try {
            for (var state : ScheduleState.values()) {
                scheduleCounters.get("state_" + state.getCode()).set(scheduleRepository.countByState(state));
            }
            scheduleCounters.get("leased").set(scheduleRepository.countLeased(clock.instant()));
        } catch (Exception e) {
            log.warn("Could not refresh schedule gauges: {}", e.getMessage());
        }
    }

    /**
     * Register a gauge backed by a live value (e.g. dispatcher slots in use)
     */
    public <T> void registerGauge(String name, String description, T source, ToDoubleFunction<T> value) {
        Gauge.builder("event_scheduler_" + name, source, value)
                .description(description)
                .register(meterRegistry);
    }

    public void recordTriggerFired() {
        meterRegistry.counter("event_scheduler_triggers_fired").increment();
    }

    public void recordLeaseConflict() {
        meterRegistry.counter("event_scheduler_lease_conflicts").increment();
    }

    public void recordCycleAbandoned(String reason) {
        meterRegistry.counter("event_scheduler_cycles_abandoned", "reason", reason).increment();
    }

    public void recordDeliveryAttempt(boolean success) {
        meterRegistry.counter("event_scheduler_delivery_attempts", "success", String.valueOf(success)).increment();
    }

    public void recordDeliveryExhausted() {
        meterRegistry.counter("event_scheduler_deliveries_exhausted").increment();
    }

    public void recordRecovered(String policy) {
        meterRegistry.counter("event_scheduler_schedules_recovered", "policy", policy).increment();
    }

    public void recordDispatcherSaturated() {
        meterRegistry.counter("event_scheduler_dispatcher_saturated").increment();
    }
}
