package com.programmersdiary.taskdaemon.scheduling;

import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import com.programmersdiary.taskdaemon.recurrence.Trigger;

public record ScheduledJob(
        String taskId,
        Trigger trigger,
        TaskAction action,
        boolean enabled) {
}
