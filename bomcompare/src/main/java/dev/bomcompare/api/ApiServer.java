/*
* Copyright 2025 the BoM Compare authors
* API Server for BoM Compare, the forecast-vs-observation read surface.
* Utilizes Javalin for the HTTP server and Jackson for JSON; reads through the
* record store and comparison query rather than raw SQL.
*/

package dev.bomcompare.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import dev.bomcompare.config.AppConfig;
import dev.bomcompare.db.IngestLogRepo;
import dev.bomcompare.db.RecordStore;
import dev.bomcompare.query.ComparisonQuery;

public class ApiServer {
    private static final Logger log = LoggerFactory.getLogger(ApiServer.class);

    private final AppConfig cfg;
    private final ObjectMapper om;
    private final HikariDataSource ds;
    private final RecordStore store;
    private final ComparisonQuery comparison;
    private final IngestLogRepo ingestLog;
    private Javalin app;

    public ApiServer(AppConfig cfg, ObjectMapper om, HikariDataSource ds, RecordStore store,
            ComparisonQuery comparison, IngestLogRepo ingestLog) {
        this.cfg = cfg;
        this.om = om;
        this.ds = ds;
        this.store = store;
        this.comparison = comparison;
        this.ingestLog = ingestLog;
    }

    public void start() {
        start(cfg.apiPort());
    }

    /**
     * Starts on the given port; 0 picks a free one (see {@link #port()}).
     */
    public void start(int port) {
        log.info("Starting API server on port {}", port);
        app = Javalin.create(j -> {
            j.http.defaultContentType = "application/json";
            j.bundledPlugins.enableCors(cors -> cors.addRule(r -> r.anyHost()));
        });

        // Basic request logging + record start time for latency measurement
        app.before(ctx -> ctx.attribute("startTime", System.currentTimeMillis()));

        app.after(ctx -> {
            Long t0 = ctx.attribute("startTime");
            long ms = (t0 == null) ? -1 : (System.currentTimeMillis() - t0);
            log.info("Handled {} {} -> {} ({} ms)", ctx.method(), ctx.path(), ctx.status(), ms);
        });

        // JSON error instead of the default HTML error page
        app.exception(Exception.class, (e, ctx) -> {
            log.error("Unhandled error on {} {}", ctx.method(), ctx.path(), e);
            ctx.status(500).json(om.createObjectNode()
                    .put("error", "internal_error")
                    .put("message", e.getMessage() == null ? "Unknown error" : e.getMessage()));
        });

        ApiRoutesRoot.register(this);
        ApiRoutesComparison.register(this);
        ApiRoutesIngest.register(this);

        app.start(port);
    }

    public void stop() {
        if (app != null)
            app.stop();
        log.info("API server stopped");
    }

    /**
     * Port the server is bound to; only meaningful after start.
     */
    public int port() {
        return app == null ? -1 : app.port();
    }

    Javalin app() {
        return app;
    }

    ObjectMapper om() {
        return om;
    }

    HikariDataSource ds() {
        return ds;
    }

    RecordStore store() {
        return store;
    }

    ComparisonQuery comparison() {
        return comparison;
    }

    IngestLogRepo ingestLog() {
        return ingestLog;
    }

    // --------------------------------------------------------------------
    // Helpers
    // --------------------------------------------------------------------
    static void putNullable(ObjectNode obj, String key, Object value) {
        if (value == null)
            obj.putNull(key);
        else if (value instanceof Integer i)
            obj.put(key, i);
        else if (value instanceof Long l)
            obj.put(key, l);
        else if (value instanceof Number n)
            obj.put(key, n.doubleValue());
        else
            obj.put(key, value.toString());
    }

    static Integer parseInt(String s, Integer def, int min, int max) {
        if (s == null || s.isBlank())
            return def;
        try {
            int v = Integer.parseInt(s.trim());
            if (v < min)
                v = min;
            if (v > max)
                v = max;
            return v;
        } catch (NumberFormatException e) {
            return def;
        }
    }
}
