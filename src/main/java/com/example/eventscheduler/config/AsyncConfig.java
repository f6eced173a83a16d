package com.example.eventscheduler.config;

import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.task.TaskExecutor;
import org.springframework.scheduling.annotation.EnableAsync;
import org.springframework.scheduling.concurrent.ThreadPoolTaskExecutor;
import org.springframework.scheduling.concurrent.ThreadPoolTaskScheduler;

/**
 * Thread pools of a worker.
 * <p>
 * - taskScheduler: drives the scheduling loop ticks and the @Scheduled recovery sweep
 * - dispatchExecutor: bounded pool that delivers triggers, sized by the dispatcher concurrency limit
 * - taskExecutor: Spring's @Async executor, used for alerting
 */
@Slf4j
@EnableAsync
@Configuration
public class AsyncConfig {

    @Bean(name = "taskScheduler")
    public ThreadPoolTaskScheduler taskScheduler() {
        log.info("Creating task scheduler for the scheduling loop and recovery sweep");

        var scheduler = new ThreadPoolTaskScheduler();
        scheduler.setPoolSize(2);
        scheduler.setThreadNamePrefix("scheduler-");
        scheduler.setWaitForTasksToCompleteOnShutdown(true);
        scheduler.setAwaitTerminationSeconds(30);
        scheduler.setErrorHandler(t -> log.error("Unhandled error in scheduled tick: {}", t.getMessage(), t));
        scheduler.initialize();

        return scheduler;
    }

    /**
     * Delivery pool. The dispatcher tracks free slots itself, so the queue never overflows
     * in normal operation; a rejection is reported back to the loop as saturation.
     */
    @Bean(name = "dispatchExecutor")
    public ThreadPoolTaskExecutor dispatchExecutor(EventSchedulerProperties properties) {
        log.info("Creating dispatch executor with {} threads and queue capacity {}",
                properties.getDispatcherConcurrency(), properties.getDispatcherQueueCapacity());

        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(properties.getDispatcherConcurrency());
        executor.setMaxPoolSize(properties.getDispatcherConcurrency());
        executor.setQueueCapacity(properties.getDispatcherQueueCapacity());
        executor.setThreadNamePrefix("dispatch-");
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(60);
        executor.initialize();

        return executor;
    }

    /**
     * Task executor for Spring's @Async annotation.
     */
    @Bean(name = "taskExecutor")
    public TaskExecutor taskExecutor() {
        var executor = new ThreadPoolTaskExecutor();
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(4);
        executor.setQueueCapacity(100);
        executor.setThreadNamePrefix("async-");
        executor.setRejectedExecutionHandler((r, e) -> {
            log.warn("Task rejected from async executor, running in caller thread");
            if (!e.isShutdown()) {
                r.run();
            }
        });
        executor.setWaitForTasksToCompleteOnShutdown(true);
        executor.setAwaitTerminationSeconds(30);
        executor.initialize();

        return executor;
    }
}
