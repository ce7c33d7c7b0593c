package com.programmersdiary.taskdaemon.scheduling;

import java.time.Instant;

public record RegistrationResult(String taskId, boolean registered, Instant nextFireTime, String reason) {

    public static RegistrationResult armed(String taskId, Instant nextFireTime) {
        return new RegistrationResult(taskId, true, nextFireTime, null);
    }

    public static RegistrationResult rejected(String taskId, String reason) {
        return new RegistrationResult(taskId, false, null, reason);
    }
}
