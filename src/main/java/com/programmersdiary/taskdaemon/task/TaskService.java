package com.programmersdiary.taskdaemon.task;

import com.programmersdiary.taskdaemon.scheduling.JobCompletedEvent;
import com.programmersdiary.taskdaemon.scheduling.SchedulingService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.List;
import java.util.UUID;

@Service
public class TaskService {

    private static final Logger log = LoggerFactory.getLogger(TaskService.class);

    private final JsonTaskRecordRepository repository;
    private final SchedulingService schedulingService;
    private final Clock clock;

    public TaskService(JsonTaskRecordRepository repository, SchedulingService schedulingService, Clock clock) {
        this.repository = repository;
        this.schedulingService = schedulingService;
        this.clock = clock;
    }

    public CreatedTask create(TaskRequest request) {
        if (request == null || request.action() == null) {
            throw new IllegalArgumentException("Task action is required");
        }
        var taskId = request.taskId() == null || request.taskId().isBlank()
                ? UUID.randomUUID().toString()
                : request.taskId().trim();
        var now = clock.instant();
        var createdAt = repository.findById(taskId).map(PersistedTaskRecord::createdAt).orElse(now);
        var record = repository.save(new PersistedTaskRecord(
                taskId, request.action(), request.rule(), true, createdAt, now));
        var schedule = schedulingService.schedule(taskId, request.rule(), request.action());
        log.info("Task '{}' saved and scheduled: {}", taskId, schedule.schedule());
        return new CreatedTask(record, schedule);
    }

    public boolean disable(String taskId) {
        var disabled = repository.disable(taskId, clock.instant());
        var unscheduled = schedulingService.unschedule(taskId);
        return disabled || unscheduled;
    }

    public List<PersistedTaskRecord> list() {
        return repository.findAll();
    }

    public long enabledCount() {
        return repository.listEnabledTasks().size();
    }

    @EventListener
    public void onJobCompleted(JobCompletedEvent event) {
        // rescheduled under the same id while the one-shot was firing
        if (schedulingService.isScheduled(event.taskId())) return;
        if (repository.disableIfUnchangedSince(event.taskId(), event.firedAt(), clock.instant())) {
            log.info("One-shot task '{}' completed and was disabled", event.taskId());
        }
    }
}
