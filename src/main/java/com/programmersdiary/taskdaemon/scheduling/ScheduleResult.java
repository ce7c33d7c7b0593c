package com.programmersdiary.taskdaemon.scheduling;

import java.time.Instant;

public record ScheduleResult(
        String taskId,
        boolean scheduled,
        String schedule,
        Instant nextFireTime,
        String fallbackReason) {
}
