package com.programmersdiary.taskdaemon.task;

import com.programmersdiary.taskdaemon.dispatch.TaskAction;

public record TaskRequest(String taskId, String rule, TaskAction action) {
}
