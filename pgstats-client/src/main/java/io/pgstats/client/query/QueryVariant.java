package io.pgstats.client.query;

/**
 * A version-specific column set of one view family.
 */
public interface QueryVariant {

    String view();

    String sql();

    String name();
}
