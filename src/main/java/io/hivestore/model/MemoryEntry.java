package io.hivestore.model;

public record MemoryEntry(
        String key,
        String namespace,
        String value,
        long accessCount,
        Long lastAccessedAtMs,
        long createdAtMs,
        long updatedAtMs,
        String metadata,
        Long ttlSeconds
) {
}
