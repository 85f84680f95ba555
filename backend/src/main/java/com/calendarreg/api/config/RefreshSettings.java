package com.calendarreg.api.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

@Component
public class RefreshSettings {
    private final int queueCapacity;
    private final int workers;
    private final Duration syncWait;
    private final Duration fetchTimeout;
    private final int failureWarnThreshold;
    private final ZoneId schedulerZone;

    public RefreshSettings(
            @Value("${calendarreg.refresh.queue-capacity:100}") int queueCapacity,
            @Value("${calendarreg.refresh.workers:5}") int workers,
            @Value("${calendarreg.refresh.sync-wait:3s}") Duration syncWait,
            @Value("${calendarreg.refresh.fetch-timeout:5m}") Duration fetchTimeout,
            @Value("${calendarreg.refresh.failure-warn-threshold:3}") int failureWarnThreshold,
            @Value("${calendarreg.scheduler.zone:}") String schedulerZone) {
        this.queueCapacity = queueCapacity;
        this.workers = workers;
        this.syncWait = syncWait;
        this.fetchTimeout = fetchTimeout;
        this.failureWarnThreshold = failureWarnThreshold;
        // blank means the JVM default zone
        this.schedulerZone = schedulerZone == null || schedulerZone.isBlank() ? ZoneId.systemDefault() : ZoneId.of(schedulerZone);
    }

    public static RefreshSettings defaults() {
        return new RefreshSettings(100, 5, Duration.ofSeconds(3), Duration.ofMinutes(5), 3, "");
    }

    public int getQueueCapacity() { return queueCapacity; }
    public int getWorkers() { return workers; }
    public Duration getSyncWait() { return syncWait; }
    public Duration getFetchTimeout() { return fetchTimeout; }
    public int getFailureWarnThreshold() { return failureWarnThreshold; }
    public ZoneId getSchedulerZone() { return schedulerZone; }
}
