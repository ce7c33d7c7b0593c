package com.programmersdiary.taskdaemon.scheduling;

import java.time.Instant;

public record JobCompletedEvent(String taskId, Instant firedAt, boolean ok) {
}
