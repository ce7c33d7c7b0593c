package com.programmersdiary.taskdaemon.tools;

import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import com.programmersdiary.taskdaemon.support.RecordingHandler;
import com.programmersdiary.taskdaemon.support.SchedulerFixture;
import com.programmersdiary.taskdaemon.task.JsonTaskRecordRepository;
import com.programmersdiary.taskdaemon.task.TaskService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SchedulingToolsTest {

    @TempDir
    Path dir;

    private final RecordingHandler<TaskAction.SendMessage> messages = RecordingHandler.messages();
    private final SchedulerFixture fx = new SchedulerFixture(List.of(messages));
    private TaskService taskService;
    private SchedulingTools tools;

    @BeforeEach
    void setUp() throws Exception {
        var repository = new JsonTaskRecordRepository(dir.toString());
        repository.load();
        var schedulingService = fx.schedulingService(repository);
        taskService = new TaskService(repository, schedulingService, fx.clock);
        tools = new SchedulingTools(taskService, schedulingService);
    }

    @Test
    void scheduleReminderReportsScheduleAndId() {
        var reply = tools.scheduleReminder("chat-1", "RRULE:FREQ=DAILY;BYHOUR=9;BYMINUTE=0", "Stand-up");

        assertTrue(reply.startsWith("Reminder scheduled"), reply);
        assertTrue(reply.contains("daily at 09:00"), reply);
        assertFalse(reply.contains("not fully understood"), reply);
        assertEquals(1, taskService.list().size());
    }

    @Test
    void scheduleReminderMentionsFallback() {
        var reply = tools.scheduleReminder("chat-1", "every now and then", "Stretch");

        assertTrue(reply.contains("not fully understood"), reply);
    }

    @Test
    void listAndCancel() {
        assertEquals("No scheduled tasks.", tools.listScheduledTasks());
        tools.scheduleReminder("chat-1", "RRULE:FREQ=HOURLY;INTERVAL=3", "Hydrate");
        var taskId = taskService.list().get(0).taskId();

        assertTrue(tools.listScheduledTasks().contains("Hydrate"));
        assertEquals("Task cancelled: " + taskId, tools.cancelTask(taskId));
        assertEquals("Task not found: " + taskId, tools.cancelTask(taskId));
        assertEquals("No scheduled tasks.", tools.listScheduledTasks());
    }
}
