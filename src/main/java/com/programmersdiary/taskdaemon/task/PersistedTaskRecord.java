package com.programmersdiary.taskdaemon.task;

import com.programmersdiary.taskdaemon.dispatch.TaskAction;

import java.time.Instant;

public record PersistedTaskRecord(
        String taskId,
        TaskAction action,
        String recurrenceRule,
        boolean enabled,
        Instant createdAt,
        Instant updatedAt) {

    public PersistedTaskRecord withEnabled(boolean enabled, Instant updatedAt) {
        return new PersistedTaskRecord(taskId, action, recurrenceRule, enabled, createdAt, updatedAt);
    }
}
