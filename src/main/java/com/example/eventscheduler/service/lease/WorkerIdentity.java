package com.example.eventscheduler.service.lease;

import com.example.eventscheduler.config.EventSchedulerProperties;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.net.InetAddress;
import java.util.UUID;

/**
 * Identity of this worker process, written as the lease owner.
 * <p>
 * Resolution order: configured worker id, POD_NAME, hostname-pid, HOSTNAME plus a random suffix.
 * It has no persisted record; liveness is only observed through lease expiry.
 */
@Slf4j
@Getter
@Component
public class WorkerIdentity {

    private final String workerId;

    public WorkerIdentity(EventSchedulerProperties properties,
                          @Value("${POD_NAME:}") String podName,
                          @Value("${HOSTNAME:unknown}") String hostname) {
        this.workerId = resolve(properties.getWorkerId(), podName, hostname);
        log.info("Worker identity resolved to {}", workerId);
    }

    private static String resolve(String configured, String podName, String hostname) {
        if (configured != null && !configured.isBlank()) {
            return configured;
        }
        if (podName != null && !podName.isBlank()) {
            return podName;
        }
        try {
            var host = InetAddress.getLocalHost().getHostName();
            return host + "-" + ProcessHandle.current().pid();
        } catch (Exception e) {
            return hostname + "-" + UUID.randomUUID().toString().substring(0, 8);
        }
    }
}
