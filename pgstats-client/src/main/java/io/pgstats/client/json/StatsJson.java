package io.pgstats.client.json;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jdk8.Jdk8Module;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * JSON rendering of the statistics records. Property names are the view's column names
 * ({@code idxScan} is written as {@code idx_scan}), empty optionals are written as {@code null}
 * and timestamps as ISO-8601 strings.
 */
public final class StatsJson {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new Jdk8Module())
            .registerModule(new JavaTimeModule())
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(SerializationFeature.WRITE_DURATIONS_AS_TIMESTAMPS);

    private StatsJson() {}

    /**
     * Shared, configured mapper. Do not reconfigure it; use {@link ObjectMapper#copy()} for variations.
     */
    public static ObjectMapper mapper() {
        return MAPPER;
    }
}
