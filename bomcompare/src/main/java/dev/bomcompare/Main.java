/*
* Copyright 2025 the BoM Compare authors
* Main application entry point for BoM Compare, which records Bureau of Meteorology
* precis forecasts next to station observations so the two can be compared.
*
* Commands: "ingest" runs one fetch/parse/store/purge cycle, "compare" prints the
* forecast-vs-observation rows for a date range as JSON, and "serve" starts the read API.
* Each command loads configuration, opens the store and closes it again on the way out.
*/

package dev.bomcompare;

import dev.bomcompare.api.ApiServer;
import dev.bomcompare.api.ComparisonJson;
import dev.bomcompare.bom.BomClient;
import dev.bomcompare.config.AppConfig;
import dev.bomcompare.db.*;
import dev.bomcompare.ingest.CycleReport;
import dev.bomcompare.ingest.IngestionPipeline;
import dev.bomcompare.ingest.ProductOutcome;
import dev.bomcompare.ingest.RetentionManager;
import dev.bomcompare.model.DateRange;
import dev.bomcompare.parse.ObservationJsonParser;
import dev.bomcompare.parse.PrecisForecastParser;
import dev.bomcompare.query.ComparisonQuery;
import dev.bomcompare.query.ComparisonRow;
import dev.bomcompare.query.StationScope;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.PrintStream;
import java.time.Clock;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

public final class Main {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    static final int EXIT_OK = 0;
    static final int EXIT_FAILED = 1;
    static final int EXIT_USAGE = 2;

    private static final String USAGE = String.join(System.lineSeparator(),
            "usage: bomcompare <command> [options]",
            "  ingest                                     run one ingest cycle",
            "  compare --from YYYY-MM-DD --to YYYY-MM-DD [--station X]",
            "                                             print forecast vs observation rows as JSON",
            "  serve                                      start the read API");

    private Main() {
    }

    public static void main(String[] args) throws Exception {
        if (args.length > 0 && args[0].equals("serve")) {
            serve();
            return;
        }
        System.exit(run(args, System.out, System.err));
    }

    /**
     * Runs a one-shot command and returns its exit code.
     */
    static int run(String[] args, PrintStream out, PrintStream err) {
        if (args.length == 0) {
            err.println(USAGE);
            return EXIT_USAGE;
        }

        AppConfig cfg;
        try {
            cfg = AppConfig.load();
        } catch (RuntimeException e) {
            err.println("Configuration error: " + e.getMessage());
            return EXIT_USAGE;
        }

        switch (args[0]) {
            case "ingest":
                return ingest(cfg, out);
            case "compare":
                Map<String, String> opts;
                try {
                    opts = options(args, 1);
                } catch (IllegalArgumentException e) {
                    err.println(e.getMessage());
                    err.println(USAGE);
                    return EXIT_USAGE;
                }
                return compare(cfg, opts, out, err);
            default:
                err.println("Unknown command: " + args[0]);
                err.println(USAGE);
                return EXIT_USAGE;
        }
    }

    static int ingest(AppConfig cfg, PrintStream out) {
        log.info("Starting ingest");
        ObjectMapper om = new ObjectMapper();
        Clock clock = Clock.system(cfg.clockZoneId());

        try (HikariDataSource ds = Database.createDataSource(cfg)) {
            Database.initSchema(ds);
            RecordStore store = new RecordStore(ds, cfg.clockZoneId());

            try (IngestionPipeline pipeline = new IngestionPipeline(cfg,
                    new BomClient(cfg, clock),
                    new PrecisForecastParser(cfg.clockZoneId()),
                    new ObservationJsonParser(om, cfg.observationStationId()),
                    store,
                    new RetentionManager(store, cfg.retentionDays()),
                    new IngestLogRepo(ds),
                    clock)) {
                CycleReport report = pipeline.runCycle();
                for (ProductOutcome p : report.products()) {
                    out.println(p.summary());
                    p.skipped().forEach(s -> out.println("  skipped " + s));
                }
                out.println(report.purge() == null
                        ? "purge failed: " + report.purgeError()
                        : "purged forecasts=" + report.purge().forecastRemoved()
                                + " observations=" + report.purge().observationRemoved());
                return report.success() ? EXIT_OK : EXIT_FAILED;
            }
        } catch (StoreException e) {
            log.error("Store unavailable", e);
            return EXIT_FAILED;
        }
    }

    static int compare(AppConfig cfg, Map<String, String> opts, PrintStream out, PrintStream err) {
        DateRange range;
        try {
            LocalDate from = LocalDate.parse(required(opts, "from"));
            LocalDate to = LocalDate.parse(opts.getOrDefault("to", from.toString()));
            range = new DateRange(from, to);
        } catch (DateTimeParseException | IllegalArgumentException e) {
            err.println(e.getMessage());
            err.println(USAGE);
            return EXIT_USAGE;
        }
        String station = opts.get("station");

        ObjectMapper om = new ObjectMapper();
        try (HikariDataSource ds = Database.createDataSource(cfg)) {
            Database.initSchema(ds);
            RecordStore store = new RecordStore(ds, cfg.clockZoneId());
            ComparisonQuery query = new ComparisonQuery(store, scope(cfg));
            List<ComparisonRow> rows = query.compare(range, station);
            out.println(om.writerWithDefaultPrettyPrinter()
                    .writeValueAsString(ComparisonJson.toJson(om, range, station, rows)));
            return EXIT_OK;
        } catch (StoreException e) {
            log.error("Comparison query failed", e);
            return EXIT_FAILED;
        } catch (com.fasterxml.jackson.core.JsonProcessingException e) {
            log.error("Could not render comparison", e);
            return EXIT_FAILED;
        }
    }

    private static void serve() throws StoreException {
        log.info("Starting application");
        AppConfig cfg = AppConfig.load();

        ObjectMapper om = new ObjectMapper();
        HikariDataSource ds = Database.createDataSource(cfg);
        Database.initSchema(ds);

        RecordStore store = new RecordStore(ds, cfg.clockZoneId());
        ComparisonQuery query = new ComparisonQuery(store, scope(cfg));
        IngestLogRepo ingestLog = new IngestLogRepo(ds);

        ApiServer api = new ApiServer(cfg, om, ds, store, query, ingestLog);
        api.start();
        log.info("API server started on port {}", api.port());

        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            try {
                log.info("Shutting down...");
                api.stop();
                ds.close();
            } catch (Exception e) {
                log.error("Shutdown error", e);
            }
        }));
    }

    static StationScope scope(AppConfig cfg) {
        return new StationScope(cfg.scopeForecastArea(), cfg.scopeObservationStation());
    }

    /**
     * Parses {@code --name value} pairs starting at {@code start}.
     */
    static Map<String, String> options(String[] args, int start) {
        Map<String, String> out = new HashMap<>();
        for (int i = start; i < args.length; i++) {
            String a = args[i];
            if (!a.startsWith("--") || a.length() == 2)
                throw new IllegalArgumentException("Unexpected argument: " + a);
            String name = a.substring(2);
            String value;
            int eq = name.indexOf('=');
            if (eq >= 0) {
                value = name.substring(eq + 1);
                name = name.substring(0, eq);
            } else {
                if (i + 1 >= args.length)
                    throw new IllegalArgumentException("Missing value for --" + name);
                value = args[++i];
            }
            out.put(name, value);
        }
        return out;
    }

    private static String required(Map<String, String> opts, String name) {
        String v = opts.get(name);
        if (v == null || v.isBlank())
            throw new IllegalArgumentException("Missing required option --" + name);
        return v;
    }
}
