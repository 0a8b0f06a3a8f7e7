package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalDouble;
import java.util.OptionalLong;

/**
 * Call statistics of a tracked function. Times are in milliseconds; {@code totalTime} includes
 * functions called by this one, {@code selfTime} does not.
 */
public record FunctionsRow(
        long funcid,
        String schemaname,
        String funcname,
        OptionalLong calls,
        OptionalDouble totalTime,
        OptionalDouble selfTime
) {
    public static FunctionsRow from(RowReader row) throws SQLException {
        return new FunctionsRow(
                row.getLong("funcid"),
                row.getString("schemaname"),
                row.getString("funcname"),
                row.getOptionalLong("calls"),
                row.getOptionalDouble("total_time"),
                row.getOptionalDouble("self_time")
        );
    }
}
