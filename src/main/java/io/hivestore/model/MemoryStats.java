package io.hivestore.model;

public record MemoryStats(long totalEntries, long totalSizeBytes, long namespaceCount) {
}
