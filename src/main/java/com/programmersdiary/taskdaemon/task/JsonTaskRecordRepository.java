package com.programmersdiary.taskdaemon.task;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PostConstruct;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Repository;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;

@Repository
public class JsonTaskRecordRepository implements TaskRecordStore {

    private static final Logger log = LoggerFactory.getLogger(JsonTaskRecordRepository.class);

    private final ObjectMapper objectMapper = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .enable(SerializationFeature.INDENT_OUTPUT);
    private final Path tasksFile;
    private final List<PersistedTaskRecord> tasks = new CopyOnWriteArrayList<>();

    public JsonTaskRecordRepository(
            @Value("${taskdaemon.config-dir:${user.home}/.taskdaemon}") String configDir) {
        this.tasksFile = Path.of(configDir, "tasks.json");
    }

    @PostConstruct
    public void load() throws IOException {
        if (!Files.exists(tasksFile)) return;
        var root = objectMapper.readTree(tasksFile.toFile());
        if (root == null || !root.isArray()) {
            log.warn("Ignoring {}: expected a JSON array of tasks", tasksFile);
            return;
        }
        int index = 0;
        for (JsonNode node : root) {
            try {
                tasks.add(objectMapper.treeToValue(node, PersistedTaskRecord.class));
            } catch (IOException | IllegalArgumentException e) {
                log.warn("Skipping unreadable task record #{} in {}: {}", index, tasksFile, e.getMessage());
            }
            index++;
        }
        log.info("Loaded {} task record(s) from {}", tasks.size(), tasksFile);
    }

    @Override
    public List<PersistedTaskRecord> listEnabledTasks() {
        return tasks.stream().filter(PersistedTaskRecord::enabled).toList();
    }

    @Override
    public Optional<PersistedTaskRecord> getTask(String taskId) {
        return findById(taskId);
    }

    public List<PersistedTaskRecord> findAll() {
        return List.copyOf(tasks);
    }

    public Optional<PersistedTaskRecord> findById(String taskId) {
        return tasks.stream().filter(t -> t.taskId() != null && t.taskId().equals(taskId)).findFirst();
    }

    public synchronized PersistedTaskRecord save(PersistedTaskRecord task) {
        tasks.removeIf(t -> task.taskId().equals(t.taskId()));
        tasks.add(task);
        persist();
        return task;
    }

    public synchronized boolean disable(String taskId, Instant at) {
        return disableIf(taskId, at, Instant.MAX);
    }

    // leaves the task alone if it was saved at or after cutoff
    public synchronized boolean disableIfUnchangedSince(String taskId, Instant cutoff, Instant at) {
        return disableIf(taskId, at, cutoff);
    }

    private boolean disableIf(String taskId, Instant at, Instant cutoff) {
        var existing = findById(taskId);
        if (existing.isEmpty() || !existing.get().enabled()) {
            return false;
        }
        if (existing.get().updatedAt() != null && !existing.get().updatedAt().isBefore(cutoff)) {
            return false;
        }
        tasks.replaceAll(t -> t == existing.get() ? t.withEnabled(false, at) : t);
        persist();
        return true;
    }

    private void persist() {
        try {
            Files.createDirectories(tasksFile.getParent());
            objectMapper.writeValue(tasksFile.toFile(), new ArrayList<>(tasks));
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }
}
