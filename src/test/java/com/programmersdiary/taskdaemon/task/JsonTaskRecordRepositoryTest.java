package com.programmersdiary.taskdaemon.task;

import com.programmersdiary.taskdaemon.dispatch.TaskAction;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class JsonTaskRecordRepositoryTest {

    private static final Instant T0 = Instant.parse("2026-10-19T04:30:00Z");

    @TempDir
    Path dir;

    private JsonTaskRecordRepository open() throws Exception {
        var repo = new JsonTaskRecordRepository(dir.toString());
        repo.load();
        return repo;
    }

    @Test
    void missingFileMeansNoTasks() throws Exception {
        assertTrue(open().findAll().isEmpty());
    }

    @Test
    void savedTasksSurviveRestart() throws Exception {
        var repo = open();
        repo.save(new PersistedTaskRecord("order-1", new TaskAction.PlaceOrder("buyer", "store-3", "eggs"),
                "RRULE:FREQ=DAILY;INTERVAL=1", true, T0, T0));
        repo.save(new PersistedTaskRecord("digest", new TaskAction.EmailSummary("chat-9", 10),
                "RRULE:FREQ=WEEKLY;BYDAY=MO;BYHOUR=9;BYMINUTE=0", true, T0, T0));

        var reopened = open();

        assertEquals(2, reopened.findAll().size());
        var order = reopened.findById("order-1").orElseThrow();
        assertEquals(new TaskAction.PlaceOrder("buyer", "store-3", "eggs"), order.action());
        assertEquals(T0, order.createdAt());
        assertEquals(new TaskAction.EmailSummary("chat-9", 10), reopened.findById("digest").orElseThrow().action());
    }

    @Test
    void saveReplacesRecordWithSameId() throws Exception {
        var repo = open();
        repo.save(new PersistedTaskRecord("t1", new TaskAction.SendMessage("c", "old"), "RRULE:FREQ=HOURLY", true, T0, T0));
        repo.save(new PersistedTaskRecord("t1", new TaskAction.SendMessage("c", "new"), "RRULE:FREQ=HOURLY", true, T0, T0));

        assertEquals(1, repo.findAll().size());
        assertEquals(new TaskAction.SendMessage("c", "new"), repo.findById("t1").orElseThrow().action());
    }

    @Test
    void disableKeepsRecordButHidesItFromRecovery() throws Exception {
        var repo = open();
        repo.save(new PersistedTaskRecord("t1", new TaskAction.SendMessage("c", "x"), "RRULE:FREQ=HOURLY", true, T0, T0));

        assertTrue(repo.disable("t1", T0.plusSeconds(5)));
        assertFalse(repo.disable("t1", T0.plusSeconds(6)));
        assertFalse(repo.disable("unknown", T0));

        var reopened = open();
        assertTrue(reopened.listEnabledTasks().isEmpty());
        var record = reopened.getTask("t1").orElseThrow();
        assertFalse(record.enabled());
        assertEquals(T0.plusSeconds(5), record.updatedAt());
    }

    @Test
    void unreadableElementsAreSkipped() throws Exception {
        Files.writeString(dir.resolve("tasks.json"), """
                [
                  {"taskId": "good", "recurrenceRule": "RRULE:FREQ=HOURLY", "enabled": true,
                   "action": {"kind": "SEND_MESSAGE", "chatId": "c", "text": "hi"}},
                  {"taskId": "bad-kind", "recurrenceRule": "RRULE:FREQ=HOURLY", "enabled": true,
                   "action": {"kind": "LAUNCH_ROCKET"}},
                  {"taskId": "bad-date", "enabled": true, "createdAt": "yesterday",
                   "action": {"kind": "SEND_MESSAGE", "chatId": "c", "text": "hi"}}
                ]
                """);

        var repo = open();

        assertEquals(List.of("good"), repo.listEnabledTasks().stream().map(PersistedTaskRecord::taskId).toList());
    }

    @Test
    void nonArrayFileIsIgnored() throws Exception {
        Files.writeString(dir.resolve("tasks.json"), "{\"taskId\": \"lonely\"}");

        assertTrue(open().findAll().isEmpty());
    }
}
