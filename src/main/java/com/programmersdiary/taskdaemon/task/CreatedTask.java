package com.programmersdiary.taskdaemon.task;

import com.programmersdiary.taskdaemon.scheduling.ScheduleResult;

public record CreatedTask(PersistedTaskRecord record, ScheduleResult schedule) {
}
