package io.hivestore.model;

import java.util.List;

public record Agent(
        String id,
        String swarmId,
        String name,
        AgentType type,
        AgentStatus status,
        List<String> capabilities,
        String currentTaskId,
        long messageCount,
        long errorCount,
        long successCount,
        long createdAtMs,
        Long lastActiveAtMs,
        String metadata
) {
}
