package io.hivestore.storage;

import io.hivestore.model.PerformanceMetric;

/**
 * Append-only sink for ad hoc performance counters. Nothing in this layer reads them back.
 */
public final class MetricsLog {
    private final Database database;

    public MetricsLog(Database database) {
        this.database = database;
    }

    public void append(PerformanceMetric m) {
        if (m.metricType() == null || m.metricType().isBlank()) {
            throw new IllegalArgumentException("Metric type must not be blank");
        }
        if (Double.isNaN(m.metricValue()) || Double.isInfinite(m.metricValue())) {
            throw new IllegalArgumentException("Metric value must be finite: " + m.metricValue());
        }
        database.update(StoreOperation.STORE_PERFORMANCE_METRIC,
                m.id(),
                m.swarmId(),
                m.agentId(),
                m.taskId(),
                m.metricType(),
                m.metricValue(),
                m.metadata(),
                m.createdAtMs()
        );
    }
}
