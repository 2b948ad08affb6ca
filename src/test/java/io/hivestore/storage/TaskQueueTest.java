package io.hivestore.storage;

import io.hivestore.model.ActiveTask;
import io.hivestore.model.Task;
import io.hivestore.model.TaskPriority;
import io.hivestore.model.TaskStatus;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static io.hivestore.storage.AgentRegistryTest.agent;
import static io.hivestore.storage.DatabaseTest.deleteRecursively;
import static io.hivestore.storage.DatabaseTest.swarm;
import static io.hivestore.storage.SwarmRegistryTest.open;

final class TaskQueueTest {

    @Test
    void pendingTasksComeInPriorityThenArrivalOrder() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-task-pending-");
        try (Database db = open(root)) {
            new SwarmRegistry(db).create(swarm("swm_1"), 1_000L);
            TaskQueue tasks = new TaskQueue(db);
            tasks.create(task("tsk_low", TaskPriority.LOW), 1_000L);
            tasks.create(task("tsk_crit_late", TaskPriority.CRITICAL), 5_000L);
            tasks.create(task("tsk_med", TaskPriority.MEDIUM), 2_000L);
            tasks.create(task("tsk_high", TaskPriority.HIGH), 3_000L);
            tasks.create(task("tsk_crit_early", TaskPriority.CRITICAL), 4_000L);
            tasks.create(task("tsk_med_same_ms_1", TaskPriority.MEDIUM), 6_000L);
            tasks.create(task("tsk_med_same_ms_2", TaskPriority.MEDIUM), 6_000L);
            tasks.create(task("tsk_done", TaskPriority.CRITICAL), 500L);
            tasks.updateStatus("tsk_done", TaskStatus.COMPLETED, 7_000L);

            List<Task> pending = tasks.listPending("swm_1");
            Assertions.assertEquals(List.of(
                    "tsk_crit_early",
                    "tsk_crit_late",
                    "tsk_high",
                    "tsk_med",
                    "tsk_med_same_ms_1",
                    "tsk_med_same_ms_2",
                    "tsk_low"
            ), pending.stream().map(Task::id).toList());
            for (int i = 1; i < pending.size(); i++) {
                Task prev = pending.get(i - 1);
                Task cur = pending.get(i);
                Assertions.assertTrue(prev.priority().rank() <= cur.priority().rank());
                if (prev.priority() == cur.priority()) {
                    Assertions.assertTrue(prev.createdAtMs() <= cur.createdAtMs());
                }
            }
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void createdTaskReadsBackWithDefaults() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-task-create-");
        try (Database db = open(root)) {
            new SwarmRegistry(db).create(swarm("swm_1"), 1_000L);
            TaskQueue tasks = new TaskQueue(db);
            tasks.create(new TaskQueue.NewTask("tsk_1", "swm_1", null, "write docs", null, null, null,
                    List.of("tsk_0", "tsk_a"), "{\"lang\":\"en\"}", 60_000L, null), 2_000L);

            Task t = tasks.get("tsk_1").orElseThrow();
            Assertions.assertEquals("general", t.type());
            Assertions.assertEquals(TaskStatus.PENDING, t.status());
            Assertions.assertEquals(TaskPriority.MEDIUM, t.priority());
            Assertions.assertEquals(List.of("tsk_0", "tsk_a"), t.dependencies());
            Assertions.assertEquals("{\"lang\":\"en\"}", t.requirements());
            Assertions.assertEquals(60_000L, t.estimatedDurationMs());
            Assertions.assertNull(t.completedAtMs());
            Assertions.assertNull(t.startedAtMs());
            Assertions.assertTrue(tasks.get("tsk_missing").isEmpty());

            Assertions.assertThrows(IllegalArgumentException.class, () -> tasks.create(
                    new TaskQueue.NewTask("tsk_2", "swm_1", null, "x", TaskStatus.COMPLETED, null, null, null, null, null, null),
                    2_000L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void completedAtIsSetExactlyWhenStatusIsTerminal() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-task-status-");
        try (Database db = open(root)) {
            new SwarmRegistry(db).create(swarm("swm_1"), 1_000L);
            TaskQueue tasks = new TaskQueue(db);
            tasks.create(task("tsk_1", TaskPriority.HIGH), 1_000L);

            Assertions.assertTrue(tasks.updateStatus("tsk_1", TaskStatus.IN_PROGRESS, 2_000L));
            Task started = tasks.get("tsk_1").orElseThrow();
            Assertions.assertEquals(2_000L, started.startedAtMs());
            Assertions.assertNull(started.completedAtMs());

            // re-entering in-progress keeps the first start
            tasks.updateStatus("tsk_1", TaskStatus.IN_PROGRESS, 2_500L);
            Assertions.assertEquals(2_000L, tasks.get("tsk_1").orElseThrow().startedAtMs());

            Assertions.assertTrue(tasks.updateStatus("tsk_1", TaskStatus.FAILED, 3_000L));
            Task failed = tasks.get("tsk_1").orElseThrow();
            Assertions.assertEquals(TaskStatus.FAILED, failed.status());
            Assertions.assertEquals(3_000L, failed.completedAtMs());
            Assertions.assertEquals(1_000L, failed.actualDurationMs());

            tasks.updateStatus("tsk_1", TaskStatus.PENDING, 4_000L);
            Assertions.assertNull(tasks.get("tsk_1").orElseThrow().completedAtMs());
            Assertions.assertFalse(tasks.updateStatus("tsk_missing", TaskStatus.COMPLETED, 4_000L));
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void partialUpdateCannotTouchStatusOrCompletion() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-task-update-");
        try (Database db = open(root)) {
            new SwarmRegistry(db).create(swarm("swm_1"), 1_000L);
            TaskQueue tasks = new TaskQueue(db);
            tasks.create(task("tsk_1", TaskPriority.LOW), 1_000L);

            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> tasks.update("tsk_1", List.of(ColumnUpdate.set("status", "completed"))));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> tasks.update("tsk_1", List.of(ColumnUpdate.set("completed_at", 5L))));
            Assertions.assertThrows(IllegalArgumentException.class, () -> tasks.update("tsk_1", List.of()));
            Assertions.assertThrows(IllegalArgumentException.class,
                    () -> tasks.update("tsk_1", List.of(ColumnUpdate.increment("estimated_duration", 10L))));

            Assertions.assertTrue(tasks.update("tsk_1", List.of(
                    ColumnUpdate.set("priority", TaskPriority.CRITICAL),
                    ColumnUpdate.set("result", "{\"ok\":true}")
            )));
            Task t = tasks.get("tsk_1").orElseThrow();
            Assertions.assertEquals(TaskPriority.CRITICAL, t.priority());
            Assertions.assertEquals("{\"ok\":true}", t.result());
            Assertions.assertEquals(TaskStatus.PENDING, t.status());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void reassignMovesTaskToAssigned() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-task-reassign-");
        try (Database db = open(root)) {
            new SwarmRegistry(db).create(swarm("swm_1"), 1_000L);
            new AgentRegistry(db).create(agent("agt_1", "swm_1"), 1_000L);
            new AgentRegistry(db).create(agent("agt_2", "swm_1"), 1_000L);
            TaskQueue tasks = new TaskQueue(db);
            tasks.create(task("tsk_1", TaskPriority.HIGH), 1_000L);

            Assertions.assertTrue(tasks.reassign("tsk_1", "agt_1", 2_000L));
            Task assigned = tasks.get("tsk_1").orElseThrow();
            Assertions.assertEquals(TaskStatus.ASSIGNED, assigned.status());
            Assertions.assertEquals("agt_1", assigned.assignedAgentId());
            Assertions.assertEquals(2_000L, assigned.assignedAtMs());
            Assertions.assertTrue(tasks.listPending("swm_1").isEmpty());

            Assertions.assertTrue(tasks.reassign("tsk_1", "agt_2", 3_000L));
            Assertions.assertEquals("agt_2", tasks.get("tsk_1").orElseThrow().assignedAgentId());

            Assertions.assertFalse(tasks.reassign("tsk_missing", "agt_1", 3_000L));

            tasks.updateStatus("tsk_1", TaskStatus.CANCELLED, 4_000L);
            Assertions.assertThrows(IllegalStateException.class, () -> tasks.reassign("tsk_1", "agt_1", 5_000L));
            Assertions.assertEquals("agt_2", tasks.get("tsk_1").orElseThrow().assignedAgentId());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void activeTasksCarryTheAgentName() throws Exception {
        Path root = Files.createTempDirectory("hivestore-test-task-active-");
        try (Database db = open(root)) {
            new SwarmRegistry(db).create(swarm("swm_1"), 1_000L);
            new AgentRegistry(db).create(agent("agt_1", "swm_1"), 1_000L);
            TaskQueue tasks = new TaskQueue(db);
            tasks.create(task("tsk_a", TaskPriority.LOW), 1_000L);
            tasks.create(task("tsk_b", TaskPriority.LOW), 2_000L);
            tasks.create(task("tsk_c", TaskPriority.LOW), 3_000L);
            tasks.reassign("tsk_a", "agt_1", 4_000L);
            tasks.reassign("tsk_b", "agt_1", 4_000L);
            tasks.updateStatus("tsk_b", TaskStatus.IN_PROGRESS, 5_000L);

            List<ActiveTask> active = tasks.listActive("swm_1");
            Assertions.assertEquals(List.of("tsk_a", "tsk_b"), active.stream().map(a -> a.task().id()).toList());
            Assertions.assertEquals("agent agt_1", active.get(0).agentName());
            Assertions.assertEquals(3, tasks.listBySwarm("swm_1").size());
            Assertions.assertEquals("tsk_c", tasks.listBySwarm("swm_1").get(0).id());
        } finally {
            deleteRecursively(root);
        }
    }

    private static TaskQueue.NewTask task(String id, TaskPriority priority) {
        return new TaskQueue.NewTask(id, "swm_1", "general", "task " + id, null, priority, null, null, null, null, null);
    }
}
