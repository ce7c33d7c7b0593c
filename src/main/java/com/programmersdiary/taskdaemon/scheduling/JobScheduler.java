package com.programmersdiary.taskdaemon.scheduling;

import com.programmersdiary.taskdaemon.dispatch.ActionDispatcher;
import com.programmersdiary.taskdaemon.dispatch.DispatchResult;
import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import com.programmersdiary.taskdaemon.recurrence.Trigger;
import com.programmersdiary.taskdaemon.recurrence.TriggerResolver;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.scheduling.TaskScheduler;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.Objects;

@Component
public class JobScheduler {

    private static final Logger log = LoggerFactory.getLogger(JobScheduler.class);

    private final TaskScheduler taskScheduler;
    private final JobTable jobTable;
    private final TriggerResolver triggerResolver;
    private final ActionDispatcher dispatcher;
    private final RunHistory runHistory;
    private final ApplicationEventPublisher eventPublisher;
    private final Clock clock;
    private volatile boolean running = true;

    public JobScheduler(TaskScheduler taskScheduler,
                        JobTable jobTable,
                        TriggerResolver triggerResolver,
                        ActionDispatcher dispatcher,
                        RunHistory runHistory,
                        ApplicationEventPublisher eventPublisher,
                        Clock clock) {
        this.taskScheduler = taskScheduler;
        this.jobTable = jobTable;
        this.triggerResolver = triggerResolver;
        this.dispatcher = dispatcher;
        this.runHistory = runHistory;
        this.eventPublisher = eventPublisher;
        this.clock = clock;
    }

    public RegistrationResult register(String taskId, Trigger trigger, TaskAction action) {
        if (taskId == null || taskId.isBlank()) {
            return RegistrationResult.rejected(taskId, "Task id is required");
        }
        if (trigger == null) {
            return RegistrationResult.rejected(taskId, "Trigger is required");
        }
        if (action == null) {
            return RegistrationResult.rejected(taskId, "Action is required");
        }
        if (!running) {
            return RegistrationResult.rejected(taskId, "Scheduler is shut down");
        }
        var handle = new JobHandle(new ScheduledJob(taskId, trigger, action, true));
        try {
            var firstFire = triggerResolver.firstFireTime(trigger, clock.instant());
            jobTable.put(taskId, handle);
            if (!arm(handle, firstFire)) {
                return RegistrationResult.rejected(taskId, "Replaced by a concurrent registration");
            }
            log.info("Scheduled task '{}' ({}), first run at {}", taskId, trigger.describe(), firstFire);
            return RegistrationResult.armed(taskId, firstFire);
        } catch (RuntimeException e) {
            log.error("Failed to schedule task '{}'", taskId, e);
            jobTable.remove(taskId, handle);
            return RegistrationResult.rejected(taskId, "Could not arm timer: " + e.getMessage());
        }
    }

    public boolean cancel(String taskId) {
        if (taskId == null) return false;
        var removed = jobTable.remove(taskId);
        if (removed) {
            log.info("Cancelled task '{}'", taskId);
        }
        return removed;
    }

    public boolean isRunning() {
        return running;
    }

    public boolean isScheduled(String taskId) {
        return taskId != null && jobTable.contains(taskId);
    }

    public int activeCount() {
        return jobTable.size();
    }

    public List<ActiveJob> activeJobs() {
        return jobTable.snapshot().stream()
                .filter(h -> !h.isCancelled())
                .map(h -> new ActiveJob(
                        h.taskId(),
                        h.nextFireTime(),
                        h.job().trigger().describe(),
                        h.job().action().kind(),
                        h.job().action().summary()))
                .sorted(Comparator.comparing(ActiveJob::nextFireTime,
                        Comparator.nullsLast(Comparator.naturalOrder())))
                .toList();
    }

    @PreDestroy
    public void shutdown() {
        running = false;
        var count = jobTable.size();
        jobTable.clear();
        log.info("Scheduler stopped, {} job(s) cancelled", count);
    }

    private boolean arm(JobHandle handle, Instant fireAt) {
        return handle.arm(fireAt, at -> taskScheduler.schedule(() -> fire(handle, at), at));
    }

    private void fire(JobHandle handle, Instant scheduledFor) {
        if (handle.isCancelled()) return;
        var job = handle.job();
        var oneShot = job.trigger() instanceof Trigger.Once;

        if (oneShot) {
            handle.markFired();
            jobTable.remove(job.taskId(), handle);
        } else {
            rearm(handle, scheduledFor);
        }

        var startedAt = clock.instant();
        var result = dispatch(job);
        var endedAt = clock.instant();
        runHistory.record(new JobRun(job.taskId(), job.action().kind(), scheduledFor,
                startedAt, endedAt, result.ok(), result.error()));

        if (result.ok()) {
            log.info("Task '{}' ran ({})", job.taskId(), job.action().kind());
        } else {
            log.warn("Task '{}' failed to dispatch {}: {}", job.taskId(), job.action().kind(), result.error());
        }
        if (oneShot) {
            publishCompleted(new JobCompletedEvent(job.taskId(), startedAt, result.ok()));
        }
    }

    private void rearm(JobHandle handle, Instant scheduledFor) {
        try {
            var next = triggerResolver.rearmTime(handle.job().trigger(), scheduledFor, clock.instant());
            if (arm(handle, next)) {
                log.debug("Task '{}' next run at {}", handle.taskId(), next);
            }
        } catch (RuntimeException e) {
            log.error("Could not re-arm task '{}'", handle.taskId(), e);
        }
    }

    private DispatchResult dispatch(ScheduledJob job) {
        try {
            return Objects.requireNonNullElseGet(dispatcher.dispatch(job.action()),
                    () -> DispatchResult.failed("Dispatcher returned no result"));
        } catch (RuntimeException e) {
            return DispatchResult.failed(e);
        }
    }

    private void publishCompleted(JobCompletedEvent event) {
        try {
            eventPublisher.publishEvent(event);
        } catch (RuntimeException e) {
            log.error("Completion listener failed for task '{}'", event.taskId(), e);
        }
    }
}
