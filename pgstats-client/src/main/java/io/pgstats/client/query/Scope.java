package io.pgstats.client.query;

/**
 * Which relations a scoped statistics view covers: {@code pg_stat_all_tables},
 * {@code pg_stat_sys_tables} or {@code pg_stat_user_tables}, and likewise for the other families.
 */
public enum Scope {
    ALL("all"),
    SYSTEM("sys"),
    USER("user");

    private final String infix;

    Scope(String infix) {
        this.infix = infix;
    }

    /**
     * @param pattern a view name with a single {@code %s} where the scope goes, e.g. {@code pg_stat_%s_tables}
     */
    public String view(String pattern) {
        return pattern.formatted(infix);
    }
}
