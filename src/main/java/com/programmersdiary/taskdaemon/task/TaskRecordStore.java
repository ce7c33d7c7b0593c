package com.programmersdiary.taskdaemon.task;

import java.util.List;
import java.util.Optional;

public interface TaskRecordStore {

    List<PersistedTaskRecord> listEnabledTasks();

    Optional<PersistedTaskRecord> getTask(String taskId);
}
