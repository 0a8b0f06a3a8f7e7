package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.OptionalDouble;

/**
 * Execution statistics of one normalized statement from the {@code pg_stat_statements} extension.
 * Times are in milliseconds. The timing columns {@code totalTime} to {@code stddevTime} are empty
 * for servers up to 9.4.
 */
public record StatementsRow(
        long userid,
        long dbid,
        long queryid,
        String query,
        long calls,
        OptionalDouble totalTime,
        OptionalDouble minTime,
        OptionalDouble maxTime,
        OptionalDouble meanTime,
        OptionalDouble stddevTime,
        long rows,
        long sharedBlksHit,
        long sharedBlksRead,
        long sharedBlksDirtied,
        long sharedBlksWritten,
        long localBlksHit,
        long localBlksRead,
        long localBlksDirtied,
        long localBlksWritten,
        long tempBlksRead,
        long tempBlksWritten,
        double blkReadTime,
        double blkWriteTime
) {
    public static StatementsRow from(RowReader row) throws SQLException {
        return new StatementsRow(
                row.getLong("userid"),
                row.getLong("dbid"),
                row.getLong("queryid"),
                row.getString("query"),
                row.getLong("calls"),
                row.getOptionalDouble("total_time"),
                row.getOptionalDouble("min_time"),
                row.getOptionalDouble("max_time"),
                row.getOptionalDouble("mean_time"),
                row.getOptionalDouble("stddev_time"),
                row.getLong("rows"),
                row.getLong("shared_blks_hit"),
                row.getLong("shared_blks_read"),
                row.getLong("shared_blks_dirtied"),
                row.getLong("shared_blks_written"),
                row.getLong("local_blks_hit"),
                row.getLong("local_blks_read"),
                row.getLong("local_blks_dirtied"),
                row.getLong("local_blks_written"),
                row.getLong("temp_blks_read"),
                row.getLong("temp_blks_written"),
                row.getDouble("blk_read_time"),
                row.getDouble("blk_write_time")
        );
    }
}
