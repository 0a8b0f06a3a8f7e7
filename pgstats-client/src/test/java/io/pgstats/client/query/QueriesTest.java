package io.pgstats.client.query;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import static org.junit.jupiter.api.Assertions.*;

class QueriesTest {

    // every line between SELECT and FROM is one column, all but the last ending in a comma
    private static final Pattern COLUMN_LINE = Pattern.compile("    [a-z_]+( AS [a-z_]+)?,?");

    @Test
    void testScopedViewNames() {
        assertEquals("pg_stat_all_tables", Scope.ALL.view(Queries.TABLES_PATTERN));
        assertEquals("pg_stat_sys_indexes", Scope.SYSTEM.view(Queries.INDEXES_PATTERN));
        assertEquals("pg_statio_user_sequences", Scope.USER.view(Queries.IO_SEQUENCES_PATTERN));
        assertEquals("pg_stat_xact_user_tables", Scope.USER.view(Queries.XACT_TABLES_PATTERN));
    }

    @Test
    void testScopedQueriesSelectFromScopedView() {
        assertTrue(Queries.indexes(Scope.ALL).endsWith("FROM pg_stat_all_indexes"));
        assertTrue(Queries.ioTables(Scope.SYSTEM).endsWith("FROM pg_statio_sys_tables"));
        assertTrue(Queries.ioIndexes(Scope.USER).endsWith("FROM pg_statio_user_indexes"));
    }

    @Test
    void testEveryQueryIsWellFormed() {
        for (String sql : allQueries()) {
            String[] lines = sql.split("\n");
            assertEquals("SELECT", lines[0], sql);
            assertTrue(lines[lines.length - 1].startsWith("FROM pg_stat"), sql);
            for (int i = 1; i < lines.length - 1; i++) {
                assertTrue(COLUMN_LINE.matcher(lines[i]).matches(), "bad column line '" + lines[i] + "' in\n" + sql);
                boolean last = i == lines.length - 2;
                assertEquals(!last, lines[i].endsWith(","), "comma placement in\n" + sql);
            }
        }
    }

    @Test
    void testIndexQuerySeparatesEveryColumn() {
        assertTrue(Queries.indexes(Scope.ALL).contains("indexrelname,\n    idx_scan"));
    }

    private static List<String> allQueries() {
        List<String> queries = new ArrayList<>(List.of(
                Queries.ARCHIVER, Queries.BGWRITER, Queries.DATABASE, Queries.DATABASE_CONFLICTS,
                Queries.PROGRESS_VACUUM, Queries.SSL, Queries.SUBSCRIPTION,
                Queries.userFunctions(), Queries.xactUserFunctions()));
        for (Scope scope : Scope.values()) {
            queries.add(Queries.tables(scope));
            queries.add(Queries.xactTables(scope));
            queries.add(Queries.indexes(scope));
            queries.add(Queries.ioTables(scope));
            queries.add(Queries.ioIndexes(scope));
            queries.add(Queries.ioSequences(scope));
        }
        for (QueryVariant variant : ActivityQuery.values()) {
            queries.add(variant.sql());
        }
        for (QueryVariant variant : ReplicationQuery.values()) {
            queries.add(variant.sql());
        }
        for (QueryVariant variant : StatementsQuery.values()) {
            queries.add(variant.sql());
        }
        for (QueryVariant variant : WalReceiverQuery.values()) {
            queries.add(variant.sql());
        }
        return queries;
    }
}
