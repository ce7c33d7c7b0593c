package com.programmersdiary.taskdaemon.web;

import com.programmersdiary.taskdaemon.scheduling.ActiveJob;
import com.programmersdiary.taskdaemon.scheduling.JobRun;
import com.programmersdiary.taskdaemon.scheduling.RunHistory;
import com.programmersdiary.taskdaemon.scheduling.SchedulingService;
import com.programmersdiary.taskdaemon.task.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.time.Clock;
import java.time.ZonedDateTime;
import java.util.List;

@RestController
@RequestMapping("/api/jobs")
public class JobController {

    private final SchedulingService schedulingService;
    private final TaskService taskService;
    private final RunHistory runHistory;
    private final Clock clock;

    public JobController(SchedulingService schedulingService, TaskService taskService,
                         RunHistory runHistory, Clock clock) {
        this.schedulingService = schedulingService;
        this.taskService = taskService;
        this.runHistory = runHistory;
        this.clock = clock;
    }

    @GetMapping
    public List<ActiveJob> listJobs() {
        return schedulingService.listActive();
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void cancelJob(@PathVariable String id) {
        if (!schedulingService.unschedule(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND);
        }
    }

    @GetMapping("/results")
    public List<JobRun> getResults() {
        return runHistory.recent();
    }

    @GetMapping("/status")
    public SchedulerStatus status() {
        return new SchedulerStatus(
                schedulingService.isRunning(),
                schedulingService.activeCount(),
                taskService.enabledCount(),
                ZonedDateTime.now(clock));
    }

    public record SchedulerStatus(boolean running, int scheduledJobs, long enabledTasks, ZonedDateTime serverTime) {
    }
}
