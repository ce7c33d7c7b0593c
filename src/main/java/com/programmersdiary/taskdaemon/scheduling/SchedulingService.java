package com.programmersdiary.taskdaemon.scheduling;

import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import com.programmersdiary.taskdaemon.recurrence.RecurrenceParser;
import com.programmersdiary.taskdaemon.recurrence.TriggerResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.List;

@Service
public class SchedulingService {

    private static final Logger log = LoggerFactory.getLogger(SchedulingService.class);

    private final RecurrenceParser parser;
    private final TriggerResolver triggerResolver;
    private final JobScheduler jobScheduler;
    private final JobRecoveryManager recoveryManager;

    public SchedulingService(RecurrenceParser parser,
                             TriggerResolver triggerResolver,
                             JobScheduler jobScheduler,
                             JobRecoveryManager recoveryManager) {
        this.parser = parser;
        this.triggerResolver = triggerResolver;
        this.jobScheduler = jobScheduler;
        this.recoveryManager = recoveryManager;
    }

    public ScheduleResult schedule(String taskId, String rule, TaskAction action) {
        var resolved = triggerResolver.resolve(parser.parse(rule));
        var fallbackReason = resolved.fallbackReason().orElse(null);
        if (fallbackReason != null) {
            log.warn("Rule '{}' for task '{}' not fully understood, using {}: {}",
                    rule, taskId, resolved.trigger().describe(), fallbackReason);
        }
        var result = jobScheduler.register(taskId, resolved.trigger(), action);
        if (!result.registered()) {
            return new ScheduleResult(taskId, false, null, null, result.reason());
        }
        return new ScheduleResult(taskId, true, resolved.trigger().describe(), result.nextFireTime(), fallbackReason);
    }

    public boolean unschedule(String taskId) {
        return jobScheduler.cancel(taskId);
    }

    public List<ActiveJob> listActive() {
        return jobScheduler.activeJobs();
    }

    public RecoveryReport restoreAll() {
        return recoveryManager.restoreAll();
    }

    public boolean isScheduled(String taskId) {
        return jobScheduler.isScheduled(taskId);
    }

    public boolean isRunning() {
        return jobScheduler.isRunning();
    }

    public int activeCount() {
        return jobScheduler.activeCount();
    }
}
