package io.pgstats.client.jdbc;

import java.sql.SQLException;

/**
 * Builds one record from the current row of a result set.
 */
@FunctionalInterface
public interface RowMapper<T> {
    T map(RowReader row) throws SQLException;
}
