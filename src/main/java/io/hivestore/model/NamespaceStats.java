package io.hivestore.model;

public record NamespaceStats(
        String namespace,
        long entryCount,
        long totalSizeBytes,
        Double avgTtlSeconds,
        double avgAccessCount,
        Long lastAccessedAtMs
) {
}
