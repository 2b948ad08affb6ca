package io.hivestore.model;

import java.util.Map;

public record HealthReport(
        boolean healthy,
        Map<String, Long> tableCounts,
        String message,
        String checkedAt
) {
}
