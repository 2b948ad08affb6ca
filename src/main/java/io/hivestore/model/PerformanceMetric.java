package io.hivestore.model;

public record PerformanceMetric(
        String id,
        String swarmId,
        String agentId,
        String taskId,
        String metricType,
        double metricValue,
        String metadata,
        long createdAtMs
) {
}
