package io.hivestore.storage;

import io.hivestore.model.ActiveTask;
import io.hivestore.model.Task;
import io.hivestore.model.TaskPriority;
import io.hivestore.model.TaskStatus;
import io.hivestore.util.Jsons;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class TaskQueue {
    // status and completed_at move together through updateStatus only
    static final Map<String, Boolean> UPDATABLE_COLUMNS = Map.ofEntries(
            Map.entry("type", false),
            Map.entry("description", false),
            Map.entry("priority", false),
            Map.entry("assigned_agent_id", false),
            Map.entry("dependencies", false),
            Map.entry("requirements", false),
            Map.entry("result", false),
            Map.entry("assigned_at", false),
            Map.entry("started_at", false),
            Map.entry("estimated_duration", false),
            Map.entry("actual_duration", false),
            Map.entry("metadata", false)
    );

    private final Database database;

    public TaskQueue(Database database) {
        this.database = database;
    }

    public Task create(NewTask t, long nowMs) {
        TaskStatus status = t.status() == null ? TaskStatus.PENDING : t.status();
        if (status.isTerminal()) {
            throw new IllegalArgumentException("A task cannot be created in terminal status " + status.wireValue());
        }
        TaskPriority priority = t.priority() == null ? TaskPriority.MEDIUM : t.priority();
        List<String> dependencies = t.dependencies() == null ? List.of() : List.copyOf(t.dependencies());
        String type = t.type() == null || t.type().isBlank() ? "general" : t.type();
        Long assignedAt = t.assignedAgentId() == null ? null : nowMs;
        database.update(StoreOperation.CREATE_TASK,
                t.id(),
                t.swarmId(),
                type,
                t.description(),
                status,
                priority,
                t.assignedAgentId(),
                Jsons.toStringListJson(dependencies),
                t.requirements(),
                null,
                nowMs,
                assignedAt,
                null,
                null,
                t.estimatedDurationMs(),
                null,
                t.metadata()
        );
        return new Task(t.id(), t.swarmId(), type, t.description(), status, priority, t.assignedAgentId(),
                dependencies, t.requirements(), null, nowMs, assignedAt, null, null,
                t.estimatedDurationMs(), null, t.metadata());
    }

    public Optional<Task> get(String id) {
        return database.queryOne(StoreOperation.GET_TASK, TaskQueue::mapTask, id);
    }

    public List<Task> listBySwarm(String swarmId) {
        return database.query(StoreOperation.LIST_TASKS, TaskQueue::mapTask, swarmId);
    }

    /**
     * @throws IllegalArgumentException when {@code updates} is empty or touches status, completed_at or an unknown column
     */
    public boolean update(String id, Collection<ColumnUpdate> updates) {
        ColumnUpdate.Rendered r = ColumnUpdate.render("tasks", updates, UPDATABLE_COLUMNS, id);
        return database.update(r.opKey(), r.sql(), r.params()) == 1;
    }

    /**
     * Moves a task to {@code status}. completed_at is stamped on terminal statuses and cleared otherwise;
     * started_at is stamped the first time the task enters in-progress.
     */
    public boolean updateStatus(String id, TaskStatus status, long nowMs) {
        Long completedAt = status.isTerminal() ? nowMs : null;
        Long startedCandidate = status == TaskStatus.IN_PROGRESS ? nowMs : null;
        return database.update(StoreOperation.UPDATE_TASK_STATUS,
                status, completedAt, startedCandidate, completedAt, completedAt, id) == 1;
    }

    public List<Task> listPending(String swarmId) {
        return database.query(StoreOperation.LIST_PENDING_TASKS, TaskQueue::mapTask, swarmId);
    }

    public List<ActiveTask> listActive(String swarmId) {
        return database.query(StoreOperation.LIST_ACTIVE_TASKS,
                rs -> new ActiveTask(mapTask(rs), rs.getString("agent_name")), swarmId);
    }

    /**
     * @return false if the task does not exist
     * @throws IllegalStateException if the task already reached a terminal status
     */
    public boolean reassign(String id, String agentId, long nowMs) {
        return database.inTransaction("reassignTask", () -> {
            if (database.update(StoreOperation.REASSIGN_TASK, agentId, nowMs, id) == 1) {
                return true;
            }
            Optional<Task> existing = get(id);
            if (existing.isEmpty()) {
                return false;
            }
            throw new IllegalStateException(
                    "Task " + id + " is " + existing.get().status().wireValue() + " and cannot be reassigned");
        });
    }

    static Task mapTask(ResultSet rs) throws SQLException {
        return new Task(
                rs.getString("id"),
                rs.getString("swarm_id"),
                rs.getString("type"),
                rs.getString("description"),
                TaskStatus.fromWire(rs.getString("status")),
                TaskPriority.fromString(rs.getString("priority")),
                rs.getString("assigned_agent_id"),
                Jsons.fromStringListJson(rs.getString("dependencies")),
                rs.getString("requirements"),
                rs.getString("result"),
                rs.getLong("created_at"),
                Rows.nullableLong(rs, "assigned_at"),
                Rows.nullableLong(rs, "started_at"),
                Rows.nullableLong(rs, "completed_at"),
                Rows.nullableLong(rs, "estimated_duration"),
                Rows.nullableLong(rs, "actual_duration"),
                rs.getString("metadata")
        );
    }

    public record NewTask(
            String id,
            String swarmId,
            String type,
            String description,
            TaskStatus status,
            TaskPriority priority,
            String assignedAgentId,
            List<String> dependencies,
            String requirements,
            Long estimatedDurationMs,
            String metadata
    ) {
    }
}
