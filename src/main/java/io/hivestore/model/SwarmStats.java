package io.hivestore.model;

public record SwarmStats(
        String swarmId,
        int agentCount,
        int busyAgents,
        int taskBacklog,
        double agentUtilization
) {
}
