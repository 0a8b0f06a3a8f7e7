package io.pgstats.client.jdbc;

import org.postgresql.replication.LogSequenceNumber;

import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.Duration;
import java.time.Instant;
import java.util.HashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalLong;
import java.util.Set;

/**
 * Typed, by-name access to the current row of a statistics query.
 * <p>
 * Mandatory getters fail on SQL NULL. Optional getters return an empty value both for SQL NULL
 * and for a column the query variant did not select, so one mapper serves every variant of a view.
 */
public final class RowReader {

    private static final String ZERO_LSN = "0/0";

    private final ResultSet rs;
    private final Set<String> columns;

    public RowReader(ResultSet rs) throws SQLException {
        this.rs = rs;
        this.columns = new HashSet<>();
        ResultSetMetaData metaData = rs.getMetaData();
        for (int i = 1; i <= metaData.getColumnCount(); i++) {
            columns.add(metaData.getColumnLabel(i).toLowerCase(Locale.ROOT));
        }
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public long getLong(String column) throws SQLException {
        long value = rs.getLong(column);
        requireNonNull(column);
        return value;
    }

    public double getDouble(String column) throws SQLException {
        double value = rs.getDouble(column);
        requireNonNull(column);
        return value;
    }

    public boolean getBoolean(String column) throws SQLException {
        boolean value = rs.getBoolean(column);
        requireNonNull(column);
        return value;
    }

    public String getString(String column) throws SQLException {
        String value = rs.getString(column);
        if (value == null) {
            throw new SQLException("Column " + column + " is NULL but a value is required");
        }
        return value;
    }

    public OptionalLong getOptionalLong(String column) throws SQLException {
        if (!hasColumn(column)) {
            return OptionalLong.empty();
        }
        long value = rs.getLong(column);
        return rs.wasNull() ? OptionalLong.empty() : OptionalLong.of(value);
    }

    public OptionalDouble getOptionalDouble(String column) throws SQLException {
        if (!hasColumn(column)) {
            return OptionalDouble.empty();
        }
        double value = rs.getDouble(column);
        return rs.wasNull() ? OptionalDouble.empty() : OptionalDouble.of(value);
    }

    public Optional<Boolean> getOptionalBoolean(String column) throws SQLException {
        if (!hasColumn(column)) {
            return Optional.empty();
        }
        boolean value = rs.getBoolean(column);
        return rs.wasNull() ? Optional.empty() : Optional.of(value);
    }

    public Optional<String> getOptionalString(String column) throws SQLException {
        if (!hasColumn(column)) {
            return Optional.empty();
        }
        return Optional.ofNullable(rs.getString(column));
    }

    public Optional<Instant> getOptionalInstant(String column) throws SQLException {
        if (!hasColumn(column)) {
            return Optional.empty();
        }
        Timestamp value = rs.getTimestamp(column);
        return value == null ? Optional.empty() : Optional.of(value.toInstant());
    }

    /**
     * Reads a {@code pg_lsn} column such as {@code 16/B374D848} as its 64-bit position.
     * <p>
     * Positions are unsigned; values from {@code 80000000/0} upwards come back negative, so compare
     * them with {@link Long#compareUnsigned(long, long)}.
     */
    public OptionalLong getOptionalLsn(String column) throws SQLException {
        Optional<String> text = getOptionalString(column);
        if (text.isEmpty()) {
            return OptionalLong.empty();
        }
        String value = text.get().trim();
        LogSequenceNumber lsn;
        try {
            lsn = LogSequenceNumber.valueOf(value);
        } catch (NumberFormatException e) {
            throw new SQLException("Column " + column + " is not a WAL position: " + text.get(), e);
        }
        // text without a slash comes back as INVALID_LSN, which is also how 0/0 decodes
        if (LogSequenceNumber.INVALID_LSN.equals(lsn) && !ZERO_LSN.equals(value)) {
            throw new SQLException("Column " + column + " is not a WAL position: " + text.get());
        }
        return OptionalLong.of(lsn.asLong());
    }

    public Optional<Duration> getOptionalInterval(String column) throws SQLException {
        Optional<String> text = getOptionalString(column);
        if (text.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(Intervals.parse(text.get()));
        } catch (SQLException e) {
            throw new SQLException("Column " + column + " is not an interval: " + text.get(), e);
        }
    }

    private void requireNonNull(String column) throws SQLException {
        if (rs.wasNull()) {
            throw new SQLException("Column " + column + " is NULL but a value is required");
        }
    }
}
