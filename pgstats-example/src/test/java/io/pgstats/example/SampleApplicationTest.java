package io.pgstats.example;

import io.pgstats.client.ServerVersion;
import io.pgstats.client.StatsClient;
import io.pgstats.client.UnsupportedVersionException;
import io.pgstats.client.model.IndexesRow;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Optional;
import java.util.OptionalLong;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

class SampleApplicationTest {

    private StatsClient client;
    private ByteArrayOutputStream buffer;
    private PrintStream out;

    @BeforeEach
    void setup() {
        client = mock(StatsClient.class);
        buffer = new ByteArrayOutputStream();
        out = new PrintStream(buffer, true, StandardCharsets.UTF_8);
    }

    private String output() {
        return buffer.toString(StandardCharsets.UTF_8);
    }

    private static IndexesRow index(String name) {
        return new IndexesRow(16390, 16395, "public", "customers", name,
                OptionalLong.of(7), OptionalLong.of(7), OptionalLong.empty());
    }

    @Test
    void testPrintsIndexNamesByDefault() throws Exception {
        when(client.allIndexes()).thenReturn(List.of(index("customers_pkey"), index("orders_pkey")));

        assertEquals(SampleApplication.EXIT_OK, SampleApplication.run(client, null, out));

        assertEquals(String.format("index name: customers_pkey%nindex name: orders_pkey%n"), output());
    }

    @Test
    void testDumpsViewAsJson() throws Exception {
        when(client.userIndexes()).thenReturn(List.of(index("customers_pkey")));

        assertEquals(SampleApplication.EXIT_OK, SampleApplication.run(client, "user_indexes", out));

        assertTrue(output().contains("\"indexrelname\" : \"customers_pkey\""));
        assertTrue(output().contains("\"idx_tup_fetch\" : null"));
        verify(client).userIndexes();
        verify(client, never()).allIndexes();
    }

    @Test
    void testWalReceiverAbsentPrintsNull() throws Exception {
        when(client.walReceiver()).thenReturn(Optional.empty());

        assertEquals(SampleApplication.EXIT_OK, SampleApplication.run(client, "wal_receiver", out));

        assertEquals("null", output().trim());
    }

    @Test
    void testUnknownViewListsKnownViews() throws Exception {
        assertEquals(SampleApplication.EXIT_USAGE, SampleApplication.run(client, "pg_locks", out));

        assertTrue(output().contains("Unknown view 'pg_locks'"));
        assertTrue(output().contains("all_indexes"));
        verifyNoInteractions(client);
    }

    @Test
    void testClientErrorsPropagate() throws Exception {
        when(client.subscription()).thenThrow(
                new UnsupportedVersionException("pg_stat_subscription", ServerVersion.V9_6));

        assertThrows(UnsupportedVersionException.class,
                () -> SampleApplication.run(client, "subscription", out));
    }
}
