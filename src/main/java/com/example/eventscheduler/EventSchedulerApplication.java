package com.example.eventscheduler;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.scheduling.annotation.EnableScheduling;

/**
 * Distributed event scheduler.
 * <p>
 * Every instance is a worker: it polls the shared schedule store, leases due schedules,
 * fires them through the dispatcher and recovers schedules orphaned by crashed instances.
 * Instances coordinate only through conditional writes on the store.
 */
@EnableScheduling
@SpringBootApplication
public class EventSchedulerApplication {

    public static void main(String[] args) {
        SpringApplication.run(EventSchedulerApplication.class, args);
    }
}
