package com.programmersdiary.taskdaemon.scheduling;

import com.programmersdiary.taskdaemon.dispatch.ActionKind;

import java.time.Instant;

public record JobRun(
        String taskId,
        ActionKind kind,
        Instant scheduledFor,
        Instant startedAt,
        Instant endedAt,
        boolean ok,
        String error) {
}
