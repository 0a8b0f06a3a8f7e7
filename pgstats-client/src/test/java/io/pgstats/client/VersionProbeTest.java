package io.pgstats.client;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class VersionProbeTest {

    @ParameterizedTest
    @CsvSource({
            "9.4.26, 9, 4",
            "9.5.25, 9, 5",
            "9.6.1, 9, 6",
            "10.4, 10, 0",
            "12.3, 12, 0",
            "14beta1, 14, 0",
            "16.2 (Debian 16.2-1.pgdg120+2), 16, 0"
    })
    void testParse(String text, int major, int minor) throws Exception {
        assertEquals(new ServerVersion(major, minor), VersionProbe.parse(text));
    }

    @ParameterizedTest
    @ValueSource(strings = {"foo", "", "8.4.22", "v12", " 12.3", "1"})
    void testParseRejectsUnknownFormats(String text) {
        VersionParseException e = assertThrows(VersionParseException.class, () -> VersionProbe.parse(text));
        assertEquals(text, e.getVersionText());
    }

    @Test
    void testParseRejectsNull() {
        assertThrows(VersionParseException.class, () -> VersionProbe.parse(null));
    }

    @Test
    void testProbeReadsServerVersionSetting() throws Exception {
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(VersionProbe.QUERY)).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn("9.6.24");

        assertEquals(ServerVersion.V9_6, VersionProbe.probe(connection));
        verify(rs).close();
        verify(statement).close();
    }

    @Test
    void testProbeWithoutRowFails() throws Exception {
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenReturn(rs);
        when(rs.next()).thenReturn(false);

        QueryException e = assertThrows(QueryException.class, () -> VersionProbe.probe(connection));
        assertEquals(VersionProbe.VIEW, e.getView());
    }

    @Test
    void testProbeWrapsDriverError() throws Exception {
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        SQLException failure = new SQLException("permission denied for relation pg_settings");
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenThrow(failure);

        QueryException e = assertThrows(QueryException.class, () -> VersionProbe.probe(connection));
        assertSame(failure, e.getCause());
    }

    @Test
    void testProbeUnparsableVersion() throws Exception {
        Connection connection = mock(Connection.class);
        Statement statement = mock(Statement.class);
        ResultSet rs = mock(ResultSet.class);
        when(connection.createStatement()).thenReturn(statement);
        when(statement.executeQuery(anyString())).thenReturn(rs);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn("foo");

        VersionParseException e = assertThrows(VersionParseException.class, () -> VersionProbe.probe(connection));
        assertEquals("foo", e.getVersionText());
    }
}
