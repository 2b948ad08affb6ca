package io.hivestore.storage;

import io.hivestore.model.Agent;
import io.hivestore.model.AgentPerformance;
import io.hivestore.model.AgentStatus;
import io.hivestore.model.AgentType;
import io.hivestore.util.Jsons;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;

public final class AgentRegistry {
    /**
     * Columns a partial update may touch. Counters map to true: they only accept positive increments.
     */
    static final Map<String, Boolean> UPDATABLE_COLUMNS = Map.of(
            "name", false,
            "type", false,
            "status", false,
            "capabilities", false,
            "current_task_id", false,
            "last_active_at", false,
            "metadata", false,
            "message_count", true,
            "success_count", true,
            "error_count", true
    );

    private final Database database;

    public AgentRegistry(Database database) {
        this.database = database;
    }

    public Agent create(NewAgent a, long nowMs) {
        List<String> capabilities = a.capabilities() == null ? List.of() : List.copyOf(a.capabilities());
        AgentStatus status = a.status() == null ? AgentStatus.IDLE : a.status();
        database.update(StoreOperation.CREATE_AGENT,
                a.id(),
                a.swarmId(),
                a.name(),
                a.type(),
                status,
                Jsons.toStringListJson(capabilities),
                null,
                0L,
                0L,
                0L,
                nowMs,
                nowMs,
                a.metadata()
        );
        return new Agent(a.id(), a.swarmId(), a.name(), a.type(), status, capabilities, null,
                0L, 0L, 0L, nowMs, nowMs, a.metadata());
    }

    public Optional<Agent> get(String id) {
        return database.queryOne(StoreOperation.GET_AGENT, AgentRegistry::mapAgent, id);
    }

    public List<Agent> listBySwarm(String swarmId) {
        return database.query(StoreOperation.LIST_AGENTS, AgentRegistry::mapAgent, swarmId);
    }

    public long countBySwarm(String swarmId) {
        return database.count(StoreOperation.COUNT_SWARM_AGENTS, swarmId);
    }

    /**
     * @throws IllegalArgumentException when {@code updates} is empty or names a column that is not updatable
     */
    public boolean update(String id, Collection<ColumnUpdate> updates) {
        ColumnUpdate.Rendered r = ColumnUpdate.render("agents", updates, UPDATABLE_COLUMNS, id);
        return database.update(r.opKey(), r.sql(), r.params()) == 1;
    }

    public boolean updateStatus(String id, AgentStatus status, long nowMs) {
        return database.update(StoreOperation.UPDATE_AGENT_STATUS, status, nowMs, id) == 1;
    }

    /**
     * Execution report from the agent itself: bumps exactly one of its outcome counters.
     */
    public boolean recordOutcome(String id, boolean success, long nowMs) {
        StoreOperation op = success ? StoreOperation.RECORD_AGENT_SUCCESS : StoreOperation.RECORD_AGENT_ERROR;
        return database.update(op, nowMs, id) == 1;
    }

    public boolean recordMessageSent(String id, long nowMs) {
        return database.update(StoreOperation.INCREMENT_AGENT_MESSAGES, nowMs, id) == 1;
    }

    public Optional<AgentPerformance> performance(String id) {
        return database.queryOne(StoreOperation.GET_AGENT_PERFORMANCE, rs -> new AgentPerformance(
                id,
                rs.getLong("success_count"),
                rs.getLong("error_count"),
                rs.getLong("completed_tasks"),
                rs.getLong("failed_tasks"),
                Rows.nullableDouble(rs, "avg_completion_time")
        ), id);
    }

    static Agent mapAgent(ResultSet rs) throws SQLException {
        return new Agent(
                rs.getString("id"),
                rs.getString("swarm_id"),
                rs.getString("name"),
                AgentType.fromWire(rs.getString("type")),
                AgentStatus.fromWire(rs.getString("status")),
                Jsons.fromStringListJson(rs.getString("capabilities")),
                rs.getString("current_task_id"),
                rs.getLong("message_count"),
                rs.getLong("error_count"),
                rs.getLong("success_count"),
                rs.getLong("created_at"),
                Rows.nullableLong(rs, "last_active_at"),
                rs.getString("metadata")
        );
    }

    public record NewAgent(
            String id,
            String swarmId,
            String name,
            AgentType type,
            AgentStatus status,
            List<String> capabilities,
            String metadata
    ) {
    }
}
