package dev.bomcompare.api;

import com.zaxxer.hikari.HikariDataSource;
import io.javalin.Javalin;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.time.OffsetDateTime;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Root and health endpoints for the API.
 */
final class ApiRoutesRoot {
    private ApiRoutesRoot() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        HikariDataSource ds = api.ds();

        app.get("/", ctx -> ctx.json(Map.of(
                "service", "bomcompare",
                "status", "ok",
                "endpoints", new String[] {
                        "GET /health",
                        "GET /api/comparison?from=2024-03-01&to=2024-03-07&station=Dunalley",
                        "GET /api/comparison?date=2024-03-01",
                        "GET /api/locations",
                        "GET /api/ingest/runs?limit=50",
                        "GET /api/metrics/external"
                })));

        app.get("/health", ctx -> {
            Map<String, Object> out = new LinkedHashMap<>();
            out.put("status", "ok");
            out.put("time", OffsetDateTime.now().toString());

            try (Connection c = ds.getConnection();
                    PreparedStatement ps = c.prepareStatement("SELECT 1");
                    ResultSet rs = ps.executeQuery()) {
                out.put("db", rs.next() ? "ok" : "unknown");
                Map<String, Long> rows = new LinkedHashMap<>();
                api.store().counts().forEach((type, n) -> rows.put(type.table(), n));
                out.put("rows", rows);
            } catch (Exception e) {
                out.put("db", "fail");
                out.put("db_error", e.getMessage());
                ctx.status(503);
            }

            ctx.json(out);
        });
    }
}
