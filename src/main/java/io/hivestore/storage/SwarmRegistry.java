package io.hivestore.storage;

import io.hivestore.model.QueenMode;
import io.hivestore.model.Swarm;
import io.hivestore.model.SwarmStats;
import io.hivestore.model.SwarmStatus;
import io.hivestore.model.SwarmSummary;
import io.hivestore.model.Topology;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

public final class SwarmRegistry {
    private final Database database;

    public SwarmRegistry(Database database) {
        this.database = database;
    }

    public Swarm create(NewSwarm s, long nowMs) {
        if (s.consensusThreshold() < 0.0d || s.consensusThreshold() > 1.0d) {
            throw new IllegalArgumentException("consensus threshold must be within [0,1]: " + s.consensusThreshold());
        }
        if (s.maxAgents() < 1) {
            throw new IllegalArgumentException("max agents must be positive: " + s.maxAgents());
        }
        database.update(StoreOperation.CREATE_SWARM,
                s.id(),
                s.name(),
                s.topology(),
                s.queenMode(),
                s.maxAgents(),
                s.consensusThreshold(),
                s.memoryTtlSeconds(),
                s.config(),
                nowMs,
                nowMs,
                false,
                SwarmStatus.ACTIVE
        );
        return new Swarm(s.id(), s.name(), s.topology(), s.queenMode(), s.maxAgents(), s.consensusThreshold(),
                s.memoryTtlSeconds(), s.config(), nowMs, nowMs, false, SwarmStatus.ACTIVE);
    }

    public Optional<Swarm> get(String id) {
        return database.queryOne(StoreOperation.GET_SWARM, SwarmRegistry::mapSwarm, id);
    }

    public Optional<String> activeSwarmId() {
        return database.queryOne(StoreOperation.GET_ACTIVE_SWARM_ID, rs -> rs.getString("id"));
    }

    /**
     * Makes {@code id} the only active swarm. Clearing and setting the flag commit together;
     * an unknown id rolls back and leaves the previous active swarm untouched.
     *
     * @return false if no swarm has that id
     */
    public boolean setActive(String id, long nowMs) {
        try {
            return database.inTransaction("setActiveSwarm", () -> {
                database.update(StoreOperation.CLEAR_ACTIVE_SWARMS, nowMs);
                int activated = database.update(StoreOperation.ACTIVATE_SWARM, nowMs, id);
                if (activated != 1) {
                    throw new UnknownSwarmException(id);
                }
                return true;
            });
        } catch (UnknownSwarmException e) {
            // rolled back; the previous active swarm keeps its flag
            return false;
        }
    }

    public List<SwarmSummary> listWithAgentCount() {
        return database.query(StoreOperation.LIST_SWARMS,
                rs -> new SwarmSummary(mapSwarm(rs), rs.getInt("agent_count")));
    }

    public boolean updateStatus(String id, SwarmStatus status, long nowMs) {
        return database.update(StoreOperation.UPDATE_SWARM_STATUS, status, nowMs, id) == 1;
    }

    public SwarmStats stats(String swarmId) {
        return database.queryOne(StoreOperation.GET_SWARM_STATS, rs -> {
            int agents = rs.getInt("agent_count");
            int busy = rs.getInt("busy_agents");
            return new SwarmStats(swarmId, agents, busy, rs.getInt("task_backlog"),
                    agents > 0 ? (double) busy / agents : 0.0d);
        }, swarmId, swarmId, swarmId).orElse(new SwarmStats(swarmId, 0, 0, 0, 0.0d));
    }

    static Swarm mapSwarm(ResultSet rs) throws SQLException {
        return new Swarm(
                rs.getString("id"),
                rs.getString("name"),
                Topology.fromWire(rs.getString("topology")),
                QueenMode.fromWire(rs.getString("queen_mode")),
                rs.getInt("max_agents"),
                rs.getDouble("consensus_threshold"),
                rs.getLong("memory_ttl"),
                rs.getString("config"),
                rs.getLong("created_at"),
                rs.getLong("updated_at"),
                Rows.flag(rs, "is_active"),
                SwarmStatus.fromWire(rs.getString("status"))
        );
    }

    public record NewSwarm(
            String id,
            String name,
            Topology topology,
            QueenMode queenMode,
            int maxAgents,
            double consensusThreshold,
            long memoryTtlSeconds,
            String config
    ) {
    }

    static final class UnknownSwarmException extends RuntimeException {
        UnknownSwarmException(String id) {
            super("Unknown swarm: " + id);
        }
    }
}
