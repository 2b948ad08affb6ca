package io.hivestore.model;

import java.util.List;

public record Task(
        String id,
        String swarmId,
        String type,
        String description,
        TaskStatus status,
        TaskPriority priority,
        String assignedAgentId,
        List<String> dependencies,
        String requirements,
        String result,
        long createdAtMs,
        Long assignedAtMs,
        Long startedAtMs,
        Long completedAtMs,
        Long estimatedDurationMs,
        Long actualDurationMs,
        String metadata
) {
}
