package io.hivestore.storage;

import java.util.ArrayList;
import java.util.Collection;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * One assignment in a partial update: either a plain value or an increment of the
 * column's current value. Column names are checked against a per-table whitelist
 * before any SQL is built, so no caller text reaches the statement.
 */
public record ColumnUpdate(String column, Kind kind, Object value) {

    public enum Kind {
        VALUE,
        INCREMENT
    }

    public static ColumnUpdate set(String column, Object value) {
        return new ColumnUpdate(column, Kind.VALUE, value);
    }

    public static ColumnUpdate increment(String column, long delta) {
        return new ColumnUpdate(column, Kind.INCREMENT, delta);
    }

    String fragment() {
        return kind == Kind.INCREMENT
                ? column + "=" + column + "+?"
                : column + "=?";
    }

    /**
     * Builds {@code UPDATE <table> SET ... WHERE id=?}. The cache key is derived from the
     * assignment shape, so repeated updates of the same column set share a compiled statement.
     *
     * @param allowed updatable columns of the table, mapped to whether they accept only increments
     */
    static Rendered render(String table, Collection<ColumnUpdate> updates, Map<String, Boolean> allowed, String id) {
        if (updates == null || updates.isEmpty()) {
            throw new IllegalArgumentException("Partial update of " + table + " needs at least one column");
        }
        List<String> fragments = new ArrayList<>(updates.size());
        List<Object> params = new ArrayList<>(updates.size() + 1);
        Set<String> seen = new HashSet<>();
        for (ColumnUpdate u : updates) {
            if (u == null || u.column() == null || u.kind() == null) {
                throw new IllegalArgumentException("Malformed column update for " + table + ": " + u);
            }
            Boolean incrementOnly = allowed.get(u.column());
            if (incrementOnly == null) {
                throw new IllegalArgumentException("Column not updatable on " + table + ": " + u.column());
            }
            if (u.kind() == Kind.INCREMENT) {
                if (!incrementOnly) {
                    throw new IllegalArgumentException("Column " + u.column() + " on " + table + " is not a counter");
                }
                if (!(u.value() instanceof Number)) {
                    throw new IllegalArgumentException("Increment of " + u.column() + " needs a numeric delta");
                }
                if (((Number) u.value()).longValue() < 0L) {
                    throw new IllegalArgumentException("Counter " + u.column() + " can only grow");
                }
            } else if (incrementOnly) {
                throw new IllegalArgumentException("Counter " + u.column() + " can only be incremented");
            }
            if (!seen.add(u.column())) {
                throw new IllegalArgumentException("Column assigned twice on " + table + ": " + u.column());
            }
            fragments.add(u.fragment());
            params.add(u.value());
        }
        params.add(id);
        String setClause = String.join(",", fragments);
        return new Rendered(
                "update:" + table + ":" + setClause,
                "UPDATE " + table + " SET " + setClause + " WHERE id=?",
                params.toArray()
        );
    }

    record Rendered(String opKey, String sql, Object[] params) {
    }
}
