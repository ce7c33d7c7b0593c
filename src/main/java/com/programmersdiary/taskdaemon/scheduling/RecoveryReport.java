package com.programmersdiary.taskdaemon.scheduling;

import java.util.List;

public record RecoveryReport(int found, List<String> restored, List<SkippedRecord> skipped) {

    public record SkippedRecord(String taskId, String reason) {
    }
}
