package io.hivestore.storage;

import io.hivestore.config.HiveStoreConfig;
import io.hivestore.config.StoreSettings;
import io.hivestore.model.WireValue;
import io.hivestore.util.Hashing;
import io.hivestore.util.Jsons;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.sql.Types;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns the single SQLite connection shared by every entity store.
 *
 * <p>Statements are compiled once per operation key and reused. All executions are
 * serialized on one lock, so a unit of work run through {@link #inTransaction} is never
 * interleaved with statements issued by other threads.
 */
public final class Database implements AutoCloseable {
    public static final String SCHEMA_VERSION = "hive-mind-schema.v1";

    private final HiveStoreConfig config;
    private final StoreSettings settings;
    private final String jdbcUrl;
    private final Object lock = new Object();
    private final Map<String, PreparedStatement> statements = new HashMap<>();
    private Connection connection;
    private int transactionDepth;

    public Database(HiveStoreConfig config, StoreSettings settings) {
        this.config = config;
        this.settings = settings == null ? StoreSettings.defaults() : settings;
        this.jdbcUrl = "jdbc:sqlite:" + config.dbFile().toString();
    }

    public void init() {
        synchronized (lock) {
            if (connection != null) {
                return;
            }
            try {
                Files.createDirectories(config.rootDir());
            } catch (IOException e) {
                throw new StoreException("init", "Failed to create data directory: " + config.rootDir(), e);
            }
            try {
                connection = DriverManager.getConnection(jdbcUrl);
            } catch (SQLException e) {
                throw new StoreException("init", "Failed to open SQLite database: " + config.dbFile(), e);
            }
            try {
                applyAndValidatePragmas();
                initSchema();
            } catch (RuntimeException e) {
                closeQuietly();
                throw e;
            }
        }
    }

    public boolean isOpen() {
        synchronized (lock) {
            return connection != null;
        }
    }

    public <T> List<T> query(StoreOperation op, RowMapper<T> mapper, Object... params) {
        return query(op.key(), op.sql(), mapper, params);
    }

    public <T> List<T> query(String opKey, String sql, RowMapper<T> mapper, Object... params) {
        synchronized (lock) {
            try {
                PreparedStatement ps = prepared(opKey, sql);
                bind(ps, params);
                List<T> out = new ArrayList<>();
                try (ResultSet rs = ps.executeQuery()) {
                    while (rs.next()) {
                        out.add(mapper.map(rs));
                    }
                }
                return out;
            } catch (SQLException e) {
                throw failure(opKey, e);
            }
        }
    }

    public <T> Optional<T> queryOne(StoreOperation op, RowMapper<T> mapper, Object... params) {
        return queryOne(op.key(), op.sql(), mapper, params);
    }

    public <T> Optional<T> queryOne(String opKey, String sql, RowMapper<T> mapper, Object... params) {
        synchronized (lock) {
            try {
                PreparedStatement ps = prepared(opKey, sql);
                bind(ps, params);
                try (ResultSet rs = ps.executeQuery()) {
                    if (!rs.next()) {
                        return Optional.empty();
                    }
                    return Optional.ofNullable(mapper.map(rs));
                }
            } catch (SQLException e) {
                throw failure(opKey, e);
            }
        }
    }

    public long count(StoreOperation op, Object... params) {
        return queryOne(op, rs -> rs.getLong(1), params).orElse(0L);
    }

    public int update(StoreOperation op, Object... params) {
        return update(op.key(), op.sql(), params);
    }

    public int update(String opKey, String sql, Object... params) {
        synchronized (lock) {
            try {
                PreparedStatement ps = prepared(opKey, sql);
                bind(ps, params);
                return ps.executeUpdate();
            } catch (SQLException e) {
                throw failure(opKey, e);
            }
        }
    }

    /**
     * Runs {@code work} as one atomic unit. Any exception rolls the unit back and is rethrown;
     * runtime exceptions pass through unchanged. Nested calls join the outer transaction.
     */
    public <T> T inTransaction(String opKey, TransactionWork<T> work) {
        synchronized (lock) {
            Connection c = requireConnection(opKey);
            if (transactionDepth > 0) {
                transactionDepth++;
                try {
                    return work.run();
                } catch (RuntimeException e) {
                    throw e;
                } catch (Exception e) {
                    throw new StoreException(opKey, "Transaction " + opKey + " failed", e);
                } finally {
                    transactionDepth--;
                }
            }
            try {
                c.setAutoCommit(false);
            } catch (SQLException e) {
                throw failure(opKey, e);
            }
            transactionDepth = 1;
            try {
                T result = work.run();
                c.commit();
                return result;
            } catch (Exception e) {
                rollback(c, opKey, e);
                if (e instanceof RuntimeException) {
                    throw (RuntimeException) e;
                }
                if (e instanceof SQLException) {
                    throw failure(opKey, (SQLException) e);
                }
                throw new StoreException(opKey, "Transaction " + opKey + " failed", e);
            } finally {
                transactionDepth = 0;
                try {
                    c.setAutoCommit(true);
                } catch (SQLException e) {
                    throw failure(opKey, e);
                }
            }
        }
    }

    public int cachedStatementCount() {
        synchronized (lock) {
            return statements.size();
        }
    }

    public List<SchemaMigrationRow> listSchemaMigrations(int limit) {
        String sql = """
                SELECT version,description,checksum,applied_at_ms,success
                FROM schema_migrations
                ORDER BY applied_at_ms DESC, version DESC
                LIMIT ?
                """;
        return query("listSchemaMigrations", sql, rs -> new SchemaMigrationRow(
                rs.getString("version"),
                rs.getString("description"),
                rs.getString("checksum"),
                rs.getLong("applied_at_ms"),
                rs.getInt("success") == 1
        ), Math.max(1, limit));
    }

    @Override
    public void close() {
        synchronized (lock) {
            if (connection == null) {
                return;
            }
            SQLException first = null;
            for (PreparedStatement ps : statements.values()) {
                try {
                    ps.close();
                } catch (SQLException e) {
                    if (first == null) {
                        first = e;
                    }
                }
            }
            statements.clear();
            try {
                connection.close();
            } catch (SQLException e) {
                if (first == null) {
                    first = e;
                }
            } finally {
                connection = null;
            }
            if (first != null) {
                throw new StoreException("close", "Failed to close SQLite database", first);
            }
        }
    }

    private PreparedStatement prepared(String opKey, String sql) throws SQLException {
        Connection c = requireConnection(opKey);
        PreparedStatement ps = statements.get(opKey);
        if (ps == null) {
            ps = c.prepareStatement(sql);
            statements.put(opKey, ps);
        }
        return ps;
    }

    private Connection requireConnection(String opKey) {
        if (connection == null) {
            throw new StoreException(opKey, "Database is not initialized; call init() first");
        }
        return connection;
    }

    private static void bind(PreparedStatement ps, Object[] params) throws SQLException {
        ps.clearParameters();
        if (params == null) {
            return;
        }
        for (int i = 0; i < params.length; i++) {
            Object value = params[i];
            int index = i + 1;
            if (value == null) {
                ps.setNull(index, Types.NULL);
            } else if (value instanceof WireValue) {
                ps.setString(index, ((WireValue) value).wireValue());
            } else if (value instanceof Boolean) {
                ps.setInt(index, ((Boolean) value) ? 1 : 0);
            } else if (value instanceof List) {
                ps.setString(index, Jsons.toCompactJson(value));
            } else {
                ps.setObject(index, value);
            }
        }
    }

    private StoreException failure(String opKey, SQLException e) {
        return new StoreException(opKey, "Operation " + opKey + " failed: " + e.getMessage(), e);
    }

    private void rollback(Connection c, String opKey, Exception cause) {
        try {
            c.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(new StoreException(opKey, "Rollback of " + opKey + " failed", e));
        }
    }

    private void initSchema() {
        String script = readSchemaScript();
        List<String> ddl = splitStatements(script);
        inTransaction("applySchema", () -> {
            try (Statement st = connection.createStatement()) {
                for (String sql : ddl) {
                    st.execute(sql);
                }
            }
            recordSchemaVersion(Hashing.sha256Hex(script));
            return null;
        });
    }

    private String readSchemaScript() {
        String resource = config.schemaResource();
        try (InputStream in = Database.class.getResourceAsStream(resource)) {
            if (in == null) {
                throw new StoreException("applySchema", "Schema resource not found: " + resource);
            }
            return new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("applySchema", "Failed to read schema resource: " + resource, e);
        }
    }

    static List<String> splitStatements(String script) {
        StringBuilder withoutComments = new StringBuilder();
        for (String line : script.split("\\R")) {
            if (line.trim().startsWith("--")) {
                continue;
            }
            withoutComments.append(line).append('\n');
        }
        List<String> out = new ArrayList<>();
        for (String part : withoutComments.toString().split(";")) {
            String sql = part.trim();
            if (!sql.isEmpty()) {
                out.add(sql);
            }
        }
        return out;
    }

    private void recordSchemaVersion(String checksum) throws SQLException {
        try (PreparedStatement check = connection.prepareStatement(
                "SELECT checksum FROM schema_migrations WHERE version=? AND success=1")) {
            check.setString(1, SCHEMA_VERSION);
            try (ResultSet rs = check.executeQuery()) {
                if (rs.next() && checksum.equals(rs.getString(1))) {
                    return;
                }
            }
        }
        try (PreparedStatement ps = connection.prepareStatement(
                "INSERT OR REPLACE INTO schema_migrations(version,description,checksum,applied_at_ms,success) VALUES(?,?,?,?,1)")) {
            ps.setString(1, SCHEMA_VERSION);
            ps.setString(2, "Apply " + config.schemaResource());
            ps.setString(3, checksum);
            ps.setLong(4, Instant.now().toEpochMilli());
            ps.executeUpdate();
        }
    }

    private void applyAndValidatePragmas() {
        try (Statement st = connection.createStatement()) {
            st.execute("PRAGMA journal_mode=WAL");
            st.execute("PRAGMA synchronous=NORMAL");
            st.execute("PRAGMA foreign_keys=ON");
            st.execute("PRAGMA busy_timeout=" + settings.busyTimeoutMs());
            st.execute("PRAGMA cache_size=-" + settings.cacheSizeKb());
            st.execute("PRAGMA temp_store=MEMORY");

            validatePragma(st, "journal_mode", "wal");
            validatePragma(st, "synchronous", "1");
            validatePragma(st, "foreign_keys", "1");
        } catch (SQLException e) {
            throw new StoreException("init", "Failed to apply SQLite pragmas", e);
        }
    }

    private void validatePragma(Statement st, String pragma, String expected) throws SQLException {
        try (ResultSet rs = st.executeQuery("PRAGMA " + pragma)) {
            if (!rs.next()) {
                throw new IllegalStateException("PRAGMA " + pragma + " did not return a value");
            }
            String actual = rs.getString(1);
            if (actual == null || !actual.equalsIgnoreCase(expected)) {
                throw new IllegalStateException(
                        "PRAGMA " + pragma + " mismatch, expected=" + expected + ", actual=" + actual
                );
            }
        }
    }

    private void closeQuietly() {
        try {
            close();
        } catch (StoreException e) {
            System.err.println("WARN failed to close database after init failure: " + e.getMessage());
        }
    }

    @FunctionalInterface
    public interface TransactionWork<T> {
        T run() throws Exception;
    }

    public record SchemaMigrationRow(
            String version,
            String description,
            String checksum,
            long appliedAtMs,
            boolean success
    ) {
    }
}
