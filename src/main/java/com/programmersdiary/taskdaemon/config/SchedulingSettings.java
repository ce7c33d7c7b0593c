package com.programmersdiary.taskdaemon.config;

import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

@Component
public class SchedulingSettings {

    private final ZoneId zoneId;
    private final Duration onceDelay;
    private final Duration fallbackDelay;
    private final int poolSize;
    private final int historySize;

    public SchedulingSettings(
            @Value("${taskdaemon.scheduling.time-zone:UTC}") String timeZone,
            @Value("${taskdaemon.scheduling.once-delay-seconds:60}") long onceDelaySeconds,
            @Value("${taskdaemon.scheduling.fallback-delay-seconds:60}") long fallbackDelaySeconds,
            @Value("${taskdaemon.scheduling.pool-size:4}") int poolSize,
            @Value("${taskdaemon.scheduling.history-size:200}") int historySize) {
        this.zoneId = ZoneId.of(timeZone == null || timeZone.isBlank() ? "UTC" : timeZone.trim());
        this.onceDelay = Duration.ofSeconds(Math.max(0, onceDelaySeconds));
        this.fallbackDelay = Duration.ofSeconds(Math.max(0, fallbackDelaySeconds));
        this.poolSize = Math.max(1, poolSize);
        this.historySize = Math.max(0, historySize);
    }

    public static SchedulingSettings defaults(String timeZone) {
        return new SchedulingSettings(timeZone, 60, 60, 4, 200);
    }

    public ZoneId zoneId() {
        return zoneId;
    }

    public Duration onceDelay() {
        return onceDelay;
    }

    public Duration fallbackDelay() {
        return fallbackDelay;
    }

    public int poolSize() {
        return poolSize;
    }

    public int historySize() {
        return historySize;
    }
}
