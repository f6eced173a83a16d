package com.example.eventscheduler.config;

import com.example.eventscheduler.domain.enums.MisfirePolicy;
import jakarta.validation.constraints.AssertTrue;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotNull;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;
import org.springframework.validation.annotation.Validated;

/**
 * Configuration properties for the event scheduler.
 * Loaded from application.yml.
 */
@Data
@Validated
@Configuration
@ConfigurationProperties(prefix = "event-scheduler")
public class EventSchedulerProperties {

    /**
     * Upper bound of the idle sleep between two scheduling cycles
     */
    @Min(10)
    private long pollIntervalMs = 1000;

    /**
     * Time-to-live of a lease granted to a worker
     */
    @Min(100)
    private long leaseTtlMs = 30000;

    /**
     * Renew a lease when fewer than this many milliseconds remain before expiry
     */
    @Min(0)
    private long leaseRenewalMarginMs = 5000;

    /**
     * Maximum number of due schedules fetched per cycle
     */
    @Min(1)
    private int batchSize = 100;

    /**
     * Number of deliveries running concurrently
     */
    @Min(1)
    private int dispatcherConcurrency = 16;

    /**
     * Number of triggers that may wait for a free delivery thread
     */
    @Min(0)
    private int dispatcherQueueCapacity = 256;

    /**
     * Delivery attempts per trigger, including the first one
     */
    @Min(1)
    private int maxDeliveryAttempts = 5;

    /**
     * Wait before the first retry; later retries grow by the multiplier
     */
    @Min(1)
    private long retryBackoffBaseMs = 1000;

    @DecimalMin("1.0")
    private double retryBackoffMultiplier = 2.0;

    /**
     * Inclusive range of HTTP status codes treated as a successful delivery
     */
    @Min(100)
    @Max(599)
    private int successStatusMin = 200;

    @Min(100)
    @Max(599)
    private int successStatusMax = 299;

    @Min(1)
    private int callbackTimeoutSeconds = 10;

    /**
     * Default policy for occurrences missed while no worker owned the schedule
     */
    @NotNull
    private MisfirePolicy recoveryPolicy = MisfirePolicy.FIRE_IMMEDIATELY;

    @Min(1000)
    private long recoverySweepIntervalMs = 60000;

    /**
     * How far past due a schedule must be before recovery reclassifies it
     */
    @Min(0)
    private long misfireThresholdMs = 60000;

    @Min(1)
    private int recoveryBatchSize = 500;

    private boolean startupRecoveryEnabled = true;

    /**
     * Disable to run an API-only node that never claims schedules
     */
    private boolean loopEnabled = true;

    /**
     * Explicit worker identity; resolved from the environment when blank
     */
    private String workerId;

    @AssertTrue(message = "lease-ttl-ms must exceed poll-interval-ms plus lease-renewal-margin-ms")
    public boolean isLeaseTtlSafe() {
        return leaseTtlMs > pollIntervalMs + leaseRenewalMarginMs;
    }

    @AssertTrue(message = "success-status-min must not exceed success-status-max")
    public boolean isSuccessRangeValid() {
        return successStatusMin <= successStatusMax;
    }

    public boolean isSuccessStatus(int statusCode) {
        return statusCode >= successStatusMin && statusCode <= successStatusMax;
    }
}
