package com.programmersdiary.taskdaemon.scheduling;

import com.programmersdiary.taskdaemon.dispatch.ActionKind;

import java.time.Instant;

public record ActiveJob(String taskId, Instant nextFireTime, String schedule, ActionKind kind, String summary) {
}
