package com.programmersdiary.taskdaemon.scheduling;

import com.programmersdiary.taskdaemon.config.SchedulingSettings;
import org.springframework.stereotype.Component;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

@Component
public class RunHistory {

    private final int capacity;
    private final Deque<JobRun> runs = new ArrayDeque<>();

    public RunHistory(SchedulingSettings settings) {
        this.capacity = settings.historySize();
    }

    public synchronized void record(JobRun run) {
        if (capacity == 0) return;
        runs.addFirst(run);
        while (runs.size() > capacity) {
            runs.removeLast();
        }
    }

    public synchronized List<JobRun> recent() {
        return List.copyOf(runs);
    }

    public synchronized List<JobRun> forTask(String taskId) {
        var result = new ArrayList<JobRun>();
        for (var run : runs) {
            if (run.taskId().equals(taskId)) result.add(run);
        }
        return result;
    }
}
