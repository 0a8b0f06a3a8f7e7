package io.pgstats.client.model;

import io.pgstats.client.jdbc.RowReader;

import java.sql.SQLException;
import java.util.Optional;
import java.util.OptionalLong;

/**
 * SSL state of one backend or WAL sender connection. All but {@code pid} and {@code ssl} are
 * empty when the connection does not use SSL.
 */
public record SslRow(
        long pid,
        boolean ssl,
        Optional<String> version,
        Optional<String> cipher,
        OptionalLong bits,
        Optional<Boolean> compression,
        Optional<String> clientdn
) {
    public static SslRow from(RowReader row) throws SQLException {
        return new SslRow(
                row.getLong("pid"),
                row.getBoolean("ssl"),
                row.getOptionalString("version"),
                row.getOptionalString("cipher"),
                row.getOptionalLong("bits"),
                row.getOptionalBoolean("compression"),
                row.getOptionalString("clientdn")
        );
    }
}
