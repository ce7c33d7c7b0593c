package com.programmersdiary.taskdaemon.scheduling;

import com.programmersdiary.taskdaemon.recurrence.RecurrenceParser;
import com.programmersdiary.taskdaemon.recurrence.TriggerResolver;
import com.programmersdiary.taskdaemon.task.PersistedTaskRecord;
import com.programmersdiary.taskdaemon.task.TaskRecordStore;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class JobRecoveryManager {

    private static final Logger log = LoggerFactory.getLogger(JobRecoveryManager.class);

    private final TaskRecordStore recordStore;
    private final RecurrenceParser parser;
    private final TriggerResolver triggerResolver;
    private final JobScheduler jobScheduler;
    private final boolean restoreOnStartup;

    public JobRecoveryManager(TaskRecordStore recordStore,
                              RecurrenceParser parser,
                              TriggerResolver triggerResolver,
                              JobScheduler jobScheduler,
                              @Value("${taskdaemon.recovery.enabled:true}") boolean restoreOnStartup) {
        this.recordStore = recordStore;
        this.parser = parser;
        this.triggerResolver = triggerResolver;
        this.jobScheduler = jobScheduler;
        this.restoreOnStartup = restoreOnStartup;
    }

    @PostConstruct
    void restoreJobs() {
        if (restoreOnStartup) {
            restoreAll();
        } else {
            log.info("Startup recovery disabled");
        }
    }

    public RecoveryReport restoreAll() {
        List<PersistedTaskRecord> records;
        try {
            records = recordStore.listEnabledTasks();
        } catch (RuntimeException e) {
            log.error("Could not read persisted tasks, nothing restored", e);
            return new RecoveryReport(0, List.of(),
                    List.of(new RecoveryReport.SkippedRecord(null, "Record store unavailable: " + e.getMessage())));
        }

        var restored = new ArrayList<String>();
        var skipped = new ArrayList<RecoveryReport.SkippedRecord>();
        for (var record : records) {
            var taskId = record != null ? record.taskId() : null;
            try {
                var problem = validate(record);
                if (problem != null) {
                    log.warn("Skipping task record '{}': {}", taskId, problem);
                    skipped.add(new RecoveryReport.SkippedRecord(taskId, problem));
                    continue;
                }
                var resolved = triggerResolver.resolve(parser.parse(record.recurrenceRule()));
                resolved.fallbackReason().ifPresent(reason ->
                        log.warn("Task '{}' restored with fallback schedule: {}", taskId, reason));
                var result = jobScheduler.register(taskId, resolved.trigger(), record.action());
                if (result.registered()) {
                    restored.add(taskId);
                } else {
                    log.warn("Skipping task record '{}': {}", taskId, result.reason());
                    skipped.add(new RecoveryReport.SkippedRecord(taskId, result.reason()));
                }
            } catch (RuntimeException e) {
                log.error("Failed to restore task '{}'", taskId, e);
                skipped.add(new RecoveryReport.SkippedRecord(taskId, e.getMessage()));
            }
        }
        log.info("Recovery restored {} of {} enabled task(s)", restored.size(), records.size());
        return new RecoveryReport(records.size(), List.copyOf(restored), List.copyOf(skipped));
    }

    private static String validate(PersistedTaskRecord record) {
        if (record == null) return "Empty record";
        if (record.taskId() == null || record.taskId().isBlank()) return "Missing task id";
        if (record.action() == null) return "Missing action";
        return null;
    }
}
