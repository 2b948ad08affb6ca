package io.hivestore.config;

import java.nio.file.Path;
import java.nio.file.Paths;

public final class HiveStoreConfig {
    public static final String DEFAULT_ROOT = "data";
    public static final String DB_FILE_NAME = "hive-mind.db";
    public static final String SETTINGS_FILE_NAME = "hivestore-settings.json";
    public static final String SCHEMA_RESOURCE = "/db/hive-mind-schema.sql";
    public static final long DEFAULT_BUSY_TIMEOUT_MS = 5_000L;
    public static final int DEFAULT_CACHE_SIZE_KB = 16_384;
    public static final long DEFAULT_SWEEP_INTERVAL_MS = 0L;
    public static final int DEFAULT_NAMESPACE_CAPACITY = 0;

    private final Path rootDir;
    private final String schemaResource;

    public HiveStoreConfig(Path rootDir, String schemaResource) {
        this.rootDir = rootDir;
        this.schemaResource = schemaResource;
    }

    public static HiveStoreConfig fromRoot(String root) {
        Path resolved = root == null || root.isBlank()
                ? Paths.get(DEFAULT_ROOT)
                : Paths.get(root);
        return new HiveStoreConfig(resolved.toAbsolutePath().normalize(), SCHEMA_RESOURCE);
    }

    public Path rootDir() {
        return rootDir;
    }

    public String schemaResource() {
        return schemaResource;
    }

    public HiveStoreConfig withSchemaResource(String resource) {
        return new HiveStoreConfig(rootDir, resource);
    }

    public Path dbFile() {
        return rootDir.resolve(DB_FILE_NAME);
    }

    public Path settingsFile() {
        return rootDir.resolve(SETTINGS_FILE_NAME);
    }

    public Path auditRoot() {
        return rootDir.resolve("audit");
    }

    public Path auditFile() {
        return auditRoot().resolve("audit.log");
    }
}
