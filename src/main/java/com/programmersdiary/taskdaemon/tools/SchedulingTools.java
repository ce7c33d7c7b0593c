package com.programmersdiary.taskdaemon.tools;

import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import com.programmersdiary.taskdaemon.scheduling.SchedulingService;
import com.programmersdiary.taskdaemon.task.TaskRequest;
import com.programmersdiary.taskdaemon.task.TaskService;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.ai.tool.annotation.ToolParam;
import org.springframework.stereotype.Component;

import java.util.stream.Collectors;

// exposed to a planner through ToolsConfig
@Component
public class SchedulingTools {

    private final TaskService taskService;
    private final SchedulingService schedulingService;

    public SchedulingTools(TaskService taskService, SchedulingService schedulingService) {
        this.taskService = taskService;
        this.schedulingService = schedulingService;
    }

    @Tool(description = "Schedule a reminder message. The reminder is sent to the chat each time the recurrence rule fires.")
    public String scheduleReminder(
            @ToolParam(description = "Chat id that receives the reminder") String chatId,
            @ToolParam(description = "iCalendar RRULE string. Examples: 'RRULE:FREQ=HOURLY;INTERVAL=2' for every 2 hours, "
                    + "'RRULE:FREQ=DAILY;BYHOUR=9;BYMINUTE=0' for daily at 9am, "
                    + "'RRULE:FREQ=WEEKLY;BYDAY=MO;BYHOUR=9;BYMINUTE=0' for Mondays at 9am, 'RRULE:FREQ=ONCE' for once") String rule,
            @ToolParam(description = "The reminder text to send") String text) {
        var created = taskService.create(new TaskRequest(null, rule, new TaskAction.SendMessage(chatId, text)));
        var schedule = created.schedule();
        if (!schedule.scheduled()) {
            return "Reminder could not be scheduled: " + schedule.fallbackReason();
        }
        var reply = "Reminder scheduled (id: " + schedule.taskId() + ", " + schedule.schedule()
                + ", next run: " + schedule.nextFireTime() + ")";
        if (schedule.fallbackReason() != null) {
            reply += ". Note: the timing was not fully understood (" + schedule.fallbackReason() + ")";
        }
        return reply;
    }

    @Tool(description = "Cancel a scheduled task by its ID.")
    public String cancelTask(
            @ToolParam(description = "The task ID to cancel") String taskId) {
        if (taskService.disable(taskId)) {
            return "Task cancelled: " + taskId;
        }
        return "Task not found: " + taskId;
    }

    @Tool(description = "List all currently scheduled tasks with their next run time.")
    public String listScheduledTasks() {
        var jobs = schedulingService.listActive();
        if (jobs.isEmpty()) {
            return "No scheduled tasks.";
        }
        return jobs.stream()
                .map(j -> "- " + j.summary() + " (id: " + j.taskId() + ", " + j.schedule()
                        + ", next run: " + j.nextFireTime() + ")")
                .collect(Collectors.joining("\n"));
    }
}
