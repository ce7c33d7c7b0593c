package com.programmersdiary.taskdaemon.scheduling;

import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

// one live handle per task id; mutations for the same id serialize through compute
@Component
public class JobTable {

    private final Map<String, JobHandle> handles = new ConcurrentHashMap<>();

    public void put(String taskId, JobHandle handle) {
        handles.compute(taskId, (id, previous) -> {
            if (previous != null && previous != handle) {
                previous.cancel();
            }
            return handle;
        });
    }

    public boolean contains(String taskId) {
        return handles.containsKey(taskId);
    }

    public boolean remove(String taskId) {
        var removed = handles.remove(taskId);
        if (removed == null) return false;
        removed.cancel();
        return true;
    }

    public boolean remove(String taskId, JobHandle expected) {
        if (!handles.remove(taskId, expected)) return false;
        expected.cancel();
        return true;
    }

    public List<JobHandle> snapshot() {
        return List.copyOf(handles.values());
    }

    public int size() {
        return handles.size();
    }

    public void clear() {
        handles.keySet().forEach(this::remove);
    }
}
