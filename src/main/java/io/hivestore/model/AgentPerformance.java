package io.hivestore.model;

/**
 * Execution counters of one agent next to the outcome of the tasks assigned to it.
 * {@code avgCompletionTimeMs} is null until a task with a recorded duration exists.
 */
public record AgentPerformance(
        String agentId,
        long successCount,
        long errorCount,
        long completedTasks,
        long failedTasks,
        Double avgCompletionTimeMs
) {
}
