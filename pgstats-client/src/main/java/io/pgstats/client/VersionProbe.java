package io.pgstats.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the server version of a connection. Nothing is cached; every call is a round-trip.
 */
final class VersionProbe {

    private static final Logger log = LoggerFactory.getLogger(VersionProbe.class);

    static final String VIEW = "server_version";
    static final String QUERY = "SELECT setting FROM pg_settings WHERE name = 'server_version'";

    // old style "9.6.x" or new style "12.x", "14beta1"
    private static final Pattern VERSION_PATTERN = Pattern.compile("(^9\\.\\d)|(^\\d{2})");

    private VersionProbe() {}

    static ServerVersion probe(Connection connection) throws PgStatsException {
        String text;
        try (Statement stmt = connection.createStatement();
             ResultSet rs = stmt.executeQuery(QUERY)) {
            if (!rs.next()) {
                throw new QueryException(VIEW, "no server_version setting returned");
            }
            text = rs.getString(1);
        } catch (SQLException e) {
            throw new QueryException(VIEW, e);
        }
        ServerVersion version = parse(text);
        log.debug("Server reports version '{}', major version {}", text, version);
        return version;
    }

    static ServerVersion parse(String text) throws VersionParseException {
        if (text == null) {
            throw new VersionParseException(null);
        }
        Matcher matcher = VERSION_PATTERN.matcher(text);
        if (!matcher.find()) {
            throw new VersionParseException(text);
        }
        if (matcher.group(1) != null) {
            return new ServerVersion(9, Character.digit(text.charAt(2), 10));
        }
        return ServerVersion.of(Integer.parseInt(matcher.group(2)));
    }
}
