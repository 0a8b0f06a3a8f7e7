package io.pgstats.client;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.classic.spi.ThrowableProxy;
import ch.qos.logback.core.read.ListAppender;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pgstats.client.query.Queries;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.slf4j.LoggerFactory;

import java.sql.Connection;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Statement;
import java.time.Duration;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class StatsClientMockTest {

    private Connection connection;
    private Statement statement;

    @BeforeEach
    void setup() throws Exception {
        connection = mock(Connection.class);
        statement = mock(Statement.class);
        when(connection.isValid(anyInt())).thenReturn(true);
        when(connection.createStatement()).thenReturn(statement);
    }

    private void serverReportsVersion(String version) throws SQLException {
        ResultSet rs = mock(ResultSet.class);
        when(rs.next()).thenReturn(true);
        when(rs.getString(1)).thenReturn(version);
        when(statement.executeQuery(VersionProbe.QUERY)).thenReturn(rs);
    }

    @Test
    void testInvalidConnectionRejected() throws Exception {
        when(connection.isValid(anyInt())).thenReturn(false);

        assertThrows(ConnectionException.class, () -> new StatsClient(connection, new SimpleMeterRegistry()));
        verify(connection, never()).createStatement();
    }

    @Test
    void testLivenessCheckFailureWrapped() throws Exception {
        SQLException failure = new SQLException("connection reset");
        when(connection.isValid(anyInt())).thenThrow(failure);

        ConnectionException e = assertThrows(ConnectionException.class, () -> new StatsClient(connection));
        assertSame(failure, e.getCause());
    }

    @Test
    void testValidationTimeoutRoundedUpToSeconds() throws Exception {
        new StatsClient(connection, new SimpleMeterRegistry(), Duration.ofMillis(1500));

        ArgumentCaptor<Integer> timeout = ArgumentCaptor.forClass(Integer.class);
        verify(connection).isValid(timeout.capture());
        assertEquals(2, timeout.getValue());
    }

    @Test
    void testGatedViewIssuesOnlyVersionQuery() throws Exception {
        serverReportsVersion("9.4.26");
        StatsClient client = new StatsClient(connection, new SimpleMeterRegistry());

        assertThrows(UnsupportedVersionException.class, client::ssl);
        assertThrows(UnsupportedVersionException.class, client::progressVacuum);
        assertThrows(UnsupportedVersionException.class, client::subscription);
        assertThrows(UnsupportedVersionException.class, client::walReceiver);

        ArgumentCaptor<String> sql = ArgumentCaptor.forClass(String.class);
        verify(statement, times(4)).executeQuery(sql.capture());
        assertTrue(sql.getAllValues().stream().allMatch(VersionProbe.QUERY::equals));
    }

    @Test
    void testUnparsableVersionFailsAccessor() throws Exception {
        serverReportsVersion("foo");
        StatsClient client = new StatsClient(connection, new SimpleMeterRegistry());

        VersionParseException e = assertThrows(VersionParseException.class, client::activity);
        assertEquals("foo", e.getVersionText());
        verify(statement, times(1)).executeQuery(anyString());
    }

    @Test
    void testDriverErrorWrappedWithView() throws Exception {
        SQLException failure = new SQLException("relation \"pg_stat_bgwriter\" does not exist");
        when(statement.executeQuery(anyString())).thenThrow(failure);
        StatsClient client = new StatsClient(connection, new SimpleMeterRegistry());

        QueryException e = assertThrows(QueryException.class, client::bgWriter);
        assertEquals("pg_stat_bgwriter", e.getView());
        assertSame(failure, e.getCause());
        verify(statement).close();
    }

    @Test
    void testRowFailureDiscardsRowsAlreadyRead() throws Exception {
        ResultSetMetaData metaData = mock(ResultSetMetaData.class);
        when(metaData.getColumnCount()).thenReturn(3);
        when(metaData.getColumnLabel(1)).thenReturn("funcid");
        when(metaData.getColumnLabel(2)).thenReturn("schemaname");
        when(metaData.getColumnLabel(3)).thenReturn("funcname");
        ResultSet rs = mock(ResultSet.class);
        when(rs.getMetaData()).thenReturn(metaData);
        when(rs.next()).thenReturn(true, true, false);
        SQLException failure = new SQLException("invalid input syntax for type bigint");
        when(rs.getLong("funcid")).thenReturn(16410L).thenThrow(failure);
        when(rs.getString("schemaname")).thenReturn("public");
        when(rs.getString("funcname")).thenReturn("refresh_totals");
        when(statement.executeQuery(Queries.userFunctions())).thenReturn(rs);
        StatsClient client = new StatsClient(connection, new SimpleMeterRegistry());

        QueryException e = assertThrows(QueryException.class, client::userFunctions);
        assertEquals(Queries.USER_FUNCTIONS_VIEW, e.getView());
        assertSame(failure, e.getCause());
        verify(rs, times(2)).next();
        verify(rs).close();
        verify(statement).close();
    }

    @Test
    void testCloseIsIdempotent() throws Exception {
        StatsClient client = new StatsClient(connection, new SimpleMeterRegistry());

        client.close();
        client.close();

        verify(connection, times(1)).close();
    }

    @Test
    void testCallAfterCloseDoesNotTouchConnection() throws Exception {
        StatsClient client = new StatsClient(connection, new SimpleMeterRegistry());
        client.close();

        assertThrows(ClientClosedException.class, client::database);
        assertThrows(ClientClosedException.class, client::activity);
        verify(connection, never()).createStatement();
    }

    @Test
    void testCloseFailureSurfaced() throws Exception {
        doThrow(new SQLException("socket closed")).when(connection).close();
        StatsClient client = new StatsClient(connection, new SimpleMeterRegistry());

        assertThrows(ConnectionException.class, client::close);
        assertTrue(client.isClosed());
        assertThrows(ClientClosedException.class, client::allTables);
    }

    @Test
    void testCloseFailureLoggedAsWarning() throws Exception {
        SQLException failure = new SQLException("socket closed");
        doThrow(failure).when(connection).close();
        StatsClient client = new StatsClient(connection, new SimpleMeterRegistry());
        Logger logger = (Logger) LoggerFactory.getLogger(StatsClient.class);
        ListAppender<ILoggingEvent> appender = new ListAppender<>();
        appender.start();
        logger.addAppender(appender);
        try {
            assertThrows(ConnectionException.class, client::close);
        } finally {
            logger.detachAppender(appender);
        }

        ILoggingEvent warning = appender.list.stream()
                .filter(event -> event.getLevel() == Level.WARN)
                .findFirst()
                .orElseThrow();
        assertEquals("Failed to close connection", warning.getFormattedMessage());
        assertSame(failure, ((ThrowableProxy) warning.getThrowableProxy()).getThrowable());
    }
}
