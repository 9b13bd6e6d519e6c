package dev.bomcompare.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.javalin.Javalin;
import io.javalin.http.Context;

import dev.bomcompare.model.DateRange;
import dev.bomcompare.query.ComparisonRow;
import dev.bomcompare.query.StationScope;

import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.time.temporal.ChronoUnit;
import java.util.List;
import java.util.TreeSet;

/**
 * Forecast-vs-observation routes used by the comparison page.
 */
final class ApiRoutesComparison {
    /** Widest range one request may ask for. */
    static final int MAX_RANGE_DAYS = 62;

    private ApiRoutesComparison() {
    }

    static void register(ApiServer api) {
        Javalin app = api.app();
        ObjectMapper om = api.om();

        // GET /api/comparison?from=2024-03-01&to=2024-03-07&station=Dunalley
        // GET /api/comparison?date=2024-03-01
        app.get("/api/comparison", ctx -> {
            LocalDate today = LocalDate.now(api.store().zone());
            LocalDate from;
            LocalDate to;
            try {
                String date = ctx.queryParam("date");
                if (date != null && !date.isBlank()) {
                    from = LocalDate.parse(date.trim());
                    to = from;
                } else {
                    from = parseDate(ctx.queryParam("from"), today);
                    to = parseDate(ctx.queryParam("to"), from);
                }
            } catch (DateTimeParseException e) {
                badRequest(ctx, om, "dates must be YYYY-MM-DD: " + e.getParsedString());
                return;
            }
            if (to.isBefore(from)) {
                badRequest(ctx, om, "to (" + to + ") is before from (" + from + ")");
                return;
            }
            if (ChronoUnit.DAYS.between(from, to) >= MAX_RANGE_DAYS) {
                badRequest(ctx, om, "range is limited to " + MAX_RANGE_DAYS + " days");
                return;
            }

            String station = ctx.queryParam("station");
            if (station != null && station.isBlank())
                station = null;

            DateRange range = new DateRange(from, to);
            List<ComparisonRow> rows = api.comparison().compare(range, station);
            ctx.json(ComparisonJson.toJson(om, range, station, rows));
        });

        app.get("/api/locations", ctx -> {
            StationScope scope = api.comparison().scope();
            TreeSet<String> areas = new TreeSet<>(api.store().forecastAreas());
            // the compared area is always offered, even before the first ingest
            areas.add(scope.forecastArea());

            ObjectNode out = om.createObjectNode();
            out.put("default", scope.forecastArea());
            out.put("observation_station", scope.observationStation());
            ArrayNode arr = out.putArray("locations");
            areas.forEach(arr::add);
            ctx.json(out);
        });
    }

    private static LocalDate parseDate(String s, LocalDate def) {
        if (s == null || s.isBlank())
            return def;
        return LocalDate.parse(s.trim());
    }

    private static void badRequest(Context ctx, ObjectMapper om, String msg) {
        ctx.status(400).json(om.createObjectNode().put("error", msg));
    }
}
