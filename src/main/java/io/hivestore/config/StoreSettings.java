package io.hivestore.config;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import io.hivestore.util.Jsons;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Tunables read from {@code hivestore-settings.json} under the data root.
 * Missing fields fall back to the defaults; out-of-range values are clamped.
 */
public record StoreSettings(
        long busyTimeoutMs,
        int cacheSizeKb,
        long sweepIntervalMs,
        int defaultNamespaceCapacity,
        Map<String, Integer> namespaceCapacities
) {
    public StoreSettings {
        namespaceCapacities = namespaceCapacities == null ? Map.of() : Map.copyOf(namespaceCapacities);
    }

    public static StoreSettings defaults() {
        return new StoreSettings(
                HiveStoreConfig.DEFAULT_BUSY_TIMEOUT_MS,
                HiveStoreConfig.DEFAULT_CACHE_SIZE_KB,
                HiveStoreConfig.DEFAULT_SWEEP_INTERVAL_MS,
                HiveStoreConfig.DEFAULT_NAMESPACE_CAPACITY,
                Map.of()
        );
    }

    public static StoreSettings load(Path file) {
        StoreSettings defaults = defaults();
        if (file == null || !Files.isRegularFile(file)) {
            return defaults;
        }
        try {
            SettingsFile raw = Jsons.mapper().readValue(file.toFile(), SettingsFile.class);
            return fromFile(raw, defaults);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read settings file: " + file, e);
        }
    }

    /**
     * Capacity for a namespace; 0 means unbounded.
     */
    public int capacityFor(String namespace) {
        Integer configured = namespaceCapacities.get(namespace);
        return configured == null ? defaultNamespaceCapacity : configured;
    }

    static StoreSettings fromFile(SettingsFile file, StoreSettings defaults) {
        if (file == null) {
            return defaults;
        }
        Map<String, Integer> capacities = new LinkedHashMap<>();
        if (file.namespaceCapacities() != null) {
            for (Map.Entry<String, Integer> e : file.namespaceCapacities().entrySet()) {
                if (e.getKey() == null || e.getKey().isBlank() || e.getValue() == null) {
                    continue;
                }
                capacities.put(e.getKey().trim(), Math.max(0, e.getValue()));
            }
        }
        return new StoreSettings(
                sanitizeLong(file.busyTimeoutMs(), defaults.busyTimeoutMs(), 0L),
                sanitizeInt(file.cacheSizeKb(), defaults.cacheSizeKb(), 64),
                sanitizeLong(file.sweepIntervalMs(), defaults.sweepIntervalMs(), 0L),
                sanitizeInt(file.defaultNamespaceCapacity(), defaults.defaultNamespaceCapacity(), 0),
                capacities
        );
    }

    private static long sanitizeLong(Long raw, long fallback, long min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    private static int sanitizeInt(Integer raw, int fallback, int min) {
        if (raw == null) {
            return fallback;
        }
        return Math.max(min, raw);
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SettingsFile(
            Long busyTimeoutMs,
            Integer cacheSizeKb,
            Long sweepIntervalMs,
            Integer defaultNamespaceCapacity,
            Map<String, Integer> namespaceCapacities
    ) {
    }
}
