package io.pgstats.example;

import com.fasterxml.jackson.core.JsonProcessingException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import io.pgstats.client.PgStatsException;
import io.pgstats.client.StatsClient;
import io.pgstats.client.config.StatsClientConfig;
import io.pgstats.client.config.StatsClientConfigFactory;
import io.pgstats.client.config.StatsClientFactory;
import io.pgstats.client.json.StatsJson;
import io.pgstats.client.model.IndexesRow;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.util.Optional;
import java.util.concurrent.TimeUnit;

/**
 * Connects with the {@code pgstats} block of application.conf and prints statistics.
 * <p>
 * Without arguments it prints the name of every index. With a view name
 * (e.g. {@code user_tables}, {@code activity}) it prints that view as JSON.
 * A different conf file can be passed with {@code --config <path>}.
 */
public class SampleApplication {

    private static final Logger log = LoggerFactory.getLogger(SampleApplication.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILURE = 1;
    static final int EXIT_USAGE = 2;

    public static void main(String[] args) {
        String configPath = null;
        String view = null;
        for (int i = 0; i < args.length; i++) {
            if ("--config".equals(args[i]) && i + 1 < args.length) {
                configPath = args[++i];
            } else {
                view = args[i];
            }
        }

        StatsClientConfig config = configPath == null
                ? StatsClientConfigFactory.createConfig()
                : StatsClientConfigFactory.createConfig(configPath);
        MeterRegistry registry = new SimpleMeterRegistry();
        int exitCode;
        try (StatsClient client = StatsClientFactory.create(config, registry)) {
            exitCode = run(client, view, System.out);
        } catch (PgStatsException e) {
            log.error("Failed to read statistics", e);
            exitCode = EXIT_FAILURE;
        } finally {
            logTimings(registry);
            registry.close();
        }
        System.exit(exitCode);
    }

    static int run(StatsClient client, String view, PrintStream out) throws PgStatsException {
        if (view == null) {
            for (IndexesRow index : client.allIndexes()) {
                out.printf("index name: %s%n", index.indexrelname());
            }
            return EXIT_OK;
        }

        Optional<ViewCatalog.ViewReader> reader = ViewCatalog.lookup(view);
        if (reader.isEmpty()) {
            out.printf("Unknown view '%s'. Known views: %s%n", view, String.join(", ", ViewCatalog.names()));
            return EXIT_USAGE;
        }
        Object result = reader.get().read(client);
        try {
            out.println(StatsJson.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(result));
        } catch (JsonProcessingException e) {
            log.error("Failed to render {} as JSON", view, e);
            return EXIT_FAILURE;
        }
        return EXIT_OK;
    }

    private static void logTimings(MeterRegistry registry) {
        for (Timer timer : registry.find(StatsClient.QUERY_TIMER).timers()) {
            log.info("{} {}: {} calls, {} ms total",
                    StatsClient.QUERY_TIMER,
                    timer.getId().getTag("view"),
                    timer.count(),
                    String.format("%.2f", timer.totalTime(TimeUnit.MILLISECONDS)));
        }
    }
}
