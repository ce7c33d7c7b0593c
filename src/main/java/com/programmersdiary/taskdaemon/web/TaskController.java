package com.programmersdiary.taskdaemon.web;

import com.programmersdiary.taskdaemon.command.ScheduleCommandParser;
import com.programmersdiary.taskdaemon.dispatch.ActionDispatcher;
import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import com.programmersdiary.taskdaemon.task.CreatedTask;
import com.programmersdiary.taskdaemon.task.PersistedTaskRecord;
import com.programmersdiary.taskdaemon.task.TaskRequest;
import com.programmersdiary.taskdaemon.task.TaskService;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.*;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;

@RestController
@RequestMapping("/api/tasks")
public class TaskController {

    private final TaskService taskService;
    private final ScheduleCommandParser commandParser;
    private final ActionDispatcher dispatcher;

    public TaskController(TaskService taskService, ScheduleCommandParser commandParser, ActionDispatcher dispatcher) {
        this.taskService = taskService;
        this.commandParser = commandParser;
        this.dispatcher = dispatcher;
    }

    @GetMapping
    public List<PersistedTaskRecord> list() {
        return taskService.list();
    }

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedTask create(@RequestBody CreateTaskRequest request) {
        if (request.action() == null) {
            throw new ResponseStatusException(HttpStatus.BAD_REQUEST, "action is required");
        }
        return taskService.create(new TaskRequest(request.taskId(), request.rule(), request.action()));
    }

    @PostMapping("/commands")
    @ResponseStatus(HttpStatus.CREATED)
    public CreatedTask command(@RequestBody CommandRequest request) {
        var parsed = commandParser.parse(request.chatId(), request.text());
        if (parsed.isEmpty()) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "Could not understand the timing of: " + request.text());
        }
        var kind = parsed.get().action().kind();
        if (!dispatcher.supportedKinds().contains(kind)) {
            throw new ResponseStatusException(HttpStatus.UNPROCESSABLE_ENTITY,
                    "No handler is available for " + kind + " tasks; nothing was scheduled");
        }
        return taskService.create(parsed.get());
    }

    @DeleteMapping("/{id}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable String id) {
        if (!taskService.disable(id)) {
            throw new ResponseStatusException(HttpStatus.NOT_FOUND);
        }
    }

    public record CreateTaskRequest(String taskId, String rule, TaskAction action) {
    }

    public record CommandRequest(String chatId, String text) {
    }
}
