package com.geico.poc.ttlindex.policy;

import org.springframework.jdbc.core.JdbcOperations;

import java.util.List;
import java.util.Optional;
import java.util.Set;

/**
 * Looks up a column's declared type in information_schema.
 *
 * Store access failures propagate as {@link org.springframework.dao.DataAccessException}:
 * "could not check" is never reported as "not temporal".
 */
public class ColumnTypeValidator {

    static final Set<String> TEMPORAL_TYPES = Set.of(
        "timestamp without time zone",
        "timestamp with time zone",
        "date"
    );

    private final JdbcOperations jdbc;

    public ColumnTypeValidator(JdbcOperations jdbc) {
        this.jdbc = jdbc;
    }

    /**
     * Declared type of {@code table.column} in the current schema, empty if no such column.
     */
    public Optional<String> columnType(String tableName, String columnName) {
        List<String> types = jdbc.queryForList(
            "SELECT data_type FROM information_schema.columns " +
            "WHERE table_schema = current_schema() AND table_name = ? AND column_name = ?",
            String.class, tableName, columnName);
        return types.isEmpty() ? Optional.empty() : Optional.ofNullable(types.get(0));
    }

    public boolean isTemporal(String tableName, String columnName) {
        return columnType(tableName, columnName)
            .map(TEMPORAL_TYPES::contains)
            .orElse(false);
    }

    /**
     * @throws InvalidTtlIndexException if the column is missing or not date/timestamp
     */
    public void requireTemporal(String tableName, String columnName) {
        Optional<String> type = columnType(tableName, columnName);
        if (type.isEmpty()) {
            throw new InvalidTtlIndexException(
                "column " + tableName + "." + columnName + " does not exist");
        }
        if (!TEMPORAL_TYPES.contains(type.get())) {
            throw new InvalidTtlIndexException(
                "column " + tableName + "." + columnName + " must be date/timestamp, found " + type.get());
        }
    }
}
