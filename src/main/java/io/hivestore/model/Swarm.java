package io.hivestore.model;

public record Swarm(
        String id,
        String name,
        Topology topology,
        QueenMode queenMode,
        int maxAgents,
        double consensusThreshold,
        long memoryTtlSeconds,
        String config,
        long createdAtMs,
        long updatedAtMs,
        boolean active,
        SwarmStatus status
) {
}
