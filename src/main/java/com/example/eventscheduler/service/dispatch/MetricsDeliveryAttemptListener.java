package com.example.eventscheduler.service.dispatch;

import com.example.eventscheduler.config.MetricsConfig;
import com.example.eventscheduler.domain.enums.DeliveryOutcome;
import com.example.eventscheduler.service.handler.DeliveryResult;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Default attempt sink: logs every attempt and records delivery metrics.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetricsDeliveryAttemptListener implements DeliveryAttemptListener {

    private final MetricsConfig metricsConfig;

    @Override
    public void onAttempt(TriggerEvent trigger, DeliveryResult result) {
        metricsConfig.recordDeliveryAttempt(result.isSuccess());
        if (result.isSuccess()) {
            log.info("Delivered schedule {} occurrence {} on attempt {} (HTTP {}, {}ms)",
                    trigger.getScheduleName(), trigger.getFireTime(), trigger.getAttempt(),
                    result.getHttpStatusCode(), result.getDurationMs());
        } else {
            log.warn("Delivery attempt {} for schedule {} occurrence {} failed: {}",
                    trigger.getAttempt(), trigger.getScheduleName(), trigger.getFireTime(), result.getErrorMessage());
        }
    }

    @Override
    public void onCompleted(TriggerEvent trigger, DeliveryResult lastResult) {
        if (trigger.getOutcome() == DeliveryOutcome.FAILED) {
            metricsConfig.recordDeliveryExhausted();
        }
    }
}
