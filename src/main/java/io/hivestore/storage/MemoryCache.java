package io.hivestore.storage;

import io.hivestore.model.MemoryEntry;
import io.hivestore.model.MemoryStats;
import io.hivestore.model.NamespaceStats;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.util.List;
import java.util.Optional;

/**
 * Namespaced key/value entries with access accounting.
 *
 * <p>Entries are ranked by access count, then by most recent access, then by most recent
 * insertion. Search, listing and capacity trimming all use that ranking.
 */
public final class MemoryCache {
    public static final int DEFAULT_LIMIT = 10;
    public static final String DECISIONS_NAMESPACE = "queen-decisions";
    public static final String DECISION_KEY_PREFIX = "decision/";
    public static final int DECISIONS_LIMIT = 100;

    private final Database database;

    public MemoryCache(Database database) {
        this.database = database;
    }

    /**
     * Inserts or replaces the value under (key, namespace). An existing entry keeps its
     * created_at and access count.
     */
    public void store(String key, String namespace, String value, String metadata, Long ttlSeconds, long nowMs) {
        requireKey(key, namespace);
        if (value == null) {
            throw new IllegalArgumentException("Memory value must not be null for key " + key);
        }
        if (ttlSeconds != null && ttlSeconds < 0L) {
            throw new IllegalArgumentException("TTL must not be negative: " + ttlSeconds);
        }
        database.update(StoreOperation.STORE_MEMORY, key, namespace, value, nowMs, nowMs, nowMs, metadata, ttlSeconds);
    }

    /**
     * Reads an entry and counts the read as an access; the returned entry already reflects it.
     */
    public Optional<MemoryEntry> get(String key, String namespace, long nowMs) {
        return database.inTransaction("getMemory", () -> {
            if (database.update(StoreOperation.TOUCH_MEMORY, nowMs, key, namespace) == 0) {
                return Optional.empty();
            }
            return database.queryOne(StoreOperation.GET_MEMORY, MemoryCache::mapEntry, key, namespace);
        });
    }

    /**
     * Reads an entry without touching its access statistics.
     */
    public Optional<MemoryEntry> peek(String key, String namespace) {
        return database.queryOne(StoreOperation.GET_MEMORY, MemoryCache::mapEntry, key, namespace);
    }

    public boolean touch(String key, String namespace, long nowMs) {
        return database.update(StoreOperation.TOUCH_MEMORY, nowMs, key, namespace) == 1;
    }

    /**
     * Substring match on key or value. {@code %}, {@code _} and {@code \} in the pattern match literally.
     */
    public List<MemoryEntry> search(String namespace, String pattern, int limit) {
        String like = "%" + escapeLike(pattern == null ? "" : pattern) + "%";
        return database.query(StoreOperation.SEARCH_MEMORY, MemoryCache::mapEntry,
                namespace, like, like, positiveLimit(limit));
    }

    public boolean delete(String key, String namespace) {
        return database.update(StoreOperation.DELETE_MEMORY, key, namespace) == 1;
    }

    public List<MemoryEntry> list(String namespace, int limit) {
        return database.query(StoreOperation.LIST_MEMORY, MemoryCache::mapEntry, namespace, positiveLimit(limit));
    }

    public List<String> namespaces() {
        return database.query(StoreOperation.LIST_MEMORY_NAMESPACES, rs -> rs.getString("namespace"));
    }

    public List<MemoryEntry> recent(int limit) {
        return database.query(StoreOperation.RECENT_MEMORY, MemoryCache::mapEntry, positiveLimit(limit));
    }

    public MemoryStats stats() {
        return database.queryOne(StoreOperation.GET_MEMORY_STATS, rs -> new MemoryStats(
                rs.getLong("total_entries"),
                rs.getLong("total_size"),
                rs.getLong("namespace_count")
        )).orElse(new MemoryStats(0L, 0L, 0L));
    }

    public NamespaceStats namespaceStats(String namespace) {
        return database.queryOne(StoreOperation.GET_NAMESPACE_STATS, rs -> new NamespaceStats(
                namespace,
                rs.getLong("entry_count"),
                rs.getLong("total_size"),
                Rows.nullableDouble(rs, "avg_ttl"),
                rs.getDouble("avg_access_count"),
                Rows.nullableLong(rs, "last_accessed")
        ), namespace).orElse(new NamespaceStats(namespace, 0L, 0L, null, 0.0d, null));
    }

    /**
     * Deletes entries of {@code namespace} created more than {@code maxAgeSeconds} ago. Rewriting
     * an entry does not make it younger.
     *
     * @return number of deleted entries
     */
    public int deleteOlderThan(String namespace, long maxAgeSeconds, long nowMs) {
        if (maxAgeSeconds < 0L) {
            throw new IllegalArgumentException("Age must not be negative: " + maxAgeSeconds);
        }
        return database.update(StoreOperation.DELETE_MEMORY_OLDER_THAN, namespace, nowMs - maxAgeSeconds * 1000L);
    }

    /**
     * Deletes entries whose own TTL has elapsed since their last write. Entries without a TTL never expire.
     */
    public int deleteExpired(String namespace, long nowMs) {
        return database.update(StoreOperation.DELETE_EXPIRED_MEMORY, namespace, nowMs);
    }

    /**
     * Keeps the {@code keep} best-ranked entries of {@code namespace} and deletes the rest.
     *
     * @return number of deleted entries
     */
    public int trim(String namespace, int keep) {
        // a negative LIMIT means "no limit" to SQLite and would keep everything
        if (keep < 0) {
            throw new IllegalArgumentException("Capacity must not be negative: " + keep);
        }
        return database.update(StoreOperation.TRIM_NAMESPACE, namespace, namespace, keep);
    }

    public int clearNamespace(String namespace) {
        return database.update(StoreOperation.CLEAR_NAMESPACE, namespace);
    }

    /**
     * Every entry of every namespace, ordered by namespace then key.
     */
    public List<MemoryEntry> listAll() {
        return database.query(StoreOperation.LIST_ALL_MEMORY, MemoryCache::mapEntry);
    }

    /**
     * Entries of any namespace created more than {@code daysOld} days before {@code nowMs}, oldest first.
     */
    public List<MemoryEntry> listCreatedBefore(int daysOld, long nowMs) {
        if (daysOld < 0) {
            throw new IllegalArgumentException("Age in days must not be negative: " + daysOld);
        }
        return database.query(StoreOperation.LIST_MEMORY_CREATED_BEFORE, MemoryCache::mapEntry,
                nowMs - daysOld * 86_400_000L);
    }

    /**
     * Overwrites value and access statistics of an existing entry. Metadata, TTL and created_at
     * are left alone.
     *
     * @return false when no entry exists under (key, namespace)
     */
    public boolean updateEntry(String key, String namespace, String value, long accessCount,
                               Long lastAccessedAtMs, long nowMs) {
        requireKey(key, namespace);
        if (value == null) {
            throw new IllegalArgumentException("Memory value must not be null for key " + key);
        }
        if (accessCount < 0L) {
            throw new IllegalArgumentException("Access count must not be negative: " + accessCount);
        }
        return database.update(StoreOperation.UPDATE_MEMORY_ENTRY,
                value, accessCount, lastAccessedAtMs, nowMs, key, namespace) == 1;
    }

    /**
     * Deletes entries, in any namespace, whose JSON metadata carries {@code "swarmId": swarmId}.
     * Entries without metadata or with metadata that is not JSON are kept.
     */
    public int clearForSwarm(String swarmId) {
        requireSwarmId(swarmId);
        return database.update(StoreOperation.CLEAR_SWARM_MEMORY, swarmId);
    }

    /**
     * Decision records of a swarm: entries of {@link #DECISIONS_NAMESPACE} keyed under
     * {@link #DECISION_KEY_PREFIX} whose metadata names the swarm, newest first.
     */
    public List<MemoryEntry> successfulDecisions(String swarmId) {
        requireSwarmId(swarmId);
        return database.query(StoreOperation.LIST_SWARM_DECISIONS, MemoryCache::mapEntry,
                DECISIONS_NAMESPACE, escapeLike(DECISION_KEY_PREFIX) + "%", swarmId, DECISIONS_LIMIT);
    }

    static String escapeLike(String raw) {
        StringBuilder sb = new StringBuilder(raw.length());
        for (char ch : raw.toCharArray()) {
            if (ch == '%' || ch == '_' || ch == '\\') {
                sb.append('\\');
            }
            sb.append(ch);
        }
        return sb.toString();
    }

    private static int positiveLimit(int limit) {
        return limit <= 0 ? DEFAULT_LIMIT : limit;
    }

    private static void requireKey(String key, String namespace) {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Memory key must not be blank");
        }
        if (namespace == null || namespace.isBlank()) {
            throw new IllegalArgumentException("Memory namespace must not be blank");
        }
    }

    private static void requireSwarmId(String swarmId) {
        if (swarmId == null || swarmId.isBlank()) {
            throw new IllegalArgumentException("Swarm id must not be blank");
        }
    }

    static MemoryEntry mapEntry(ResultSet rs) throws SQLException {
        return new MemoryEntry(
                rs.getString("key"),
                rs.getString("namespace"),
                rs.getString("value"),
                rs.getLong("access_count"),
                Rows.nullableLong(rs, "last_accessed_at"),
                rs.getLong("created_at"),
                rs.getLong("updated_at"),
                rs.getString("metadata"),
                Rows.nullableLong(rs, "ttl")
        );
    }
}
