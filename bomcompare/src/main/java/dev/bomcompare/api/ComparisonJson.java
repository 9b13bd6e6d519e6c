package dev.bomcompare.api;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import dev.bomcompare.model.DateRange;
import dev.bomcompare.model.ForecastRecord;
import dev.bomcompare.model.ObservationRecord;
import dev.bomcompare.query.ComparisonRow;

import java.util.List;

/**
 * JSON shape of a comparison result, shared by the HTTP API and the CLI.
 */
public final class ComparisonJson {
    private ComparisonJson() {
    }

    public static ObjectNode toJson(ObjectMapper om, DateRange range, String station, List<ComparisonRow> rows) {
        ObjectNode out = om.createObjectNode();
        out.put("from", range.from().toString());
        out.put("to", range.to().toString());
        ApiServer.putNullable(out, "station", station);
        out.put("count", rows.size());
        ArrayNode arr = out.putArray("rows");
        for (ComparisonRow row : rows)
            arr.add(row(om, row));
        return out;
    }

    static ObjectNode row(ObjectMapper om, ComparisonRow row) {
        ForecastRecord f = row.forecast();
        ObjectNode n = om.createObjectNode();
        n.put("station_id", f.stationId());
        n.put("valid_date", f.validDate().toString());
        n.put("period_index", f.periodIndex());

        ObjectNode fc = n.putObject("forecast");
        fc.put("issued_at", f.issuedAt().toString());
        ApiServer.putNullable(fc, "summary", f.summaryText());
        ApiServer.putNullable(fc, "min_temp", f.minTemp());
        ApiServer.putNullable(fc, "max_temp", f.maxTemp());
        ApiServer.putNullable(fc, "rain_probability", f.rainProbability());
        ApiServer.putNullable(fc, "rain_amount_range", f.rainAmountRange());
        fc.put("fetched_at", f.fetchedAt().toString());

        ApiServer.putNullable(n, "observed_max_temp", row.observedMaxTemp());
        ApiServer.putNullable(n, "observed_min_temp", row.observedMinTemp());

        ArrayNode obs = n.putArray("observations");
        for (ObservationRecord o : row.observations()) {
            ObjectNode on = om.createObjectNode();
            on.put("station_id", o.stationId());
            ApiServer.putNullable(on, "station_name", o.stationName());
            on.put("observed_at", o.observedAt().toString());
            ApiServer.putNullable(on, "temperature", o.temperature());
            ApiServer.putNullable(on, "humidity", o.humidity());
            ApiServer.putNullable(on, "wind_speed_kmh", o.windSpeed());
            ApiServer.putNullable(on, "wind_direction", o.windDirection());
            ApiServer.putNullable(on, "rain_since_9am", o.rainfallSinceNineAm());
            obs.add(on);
        }
        return n;
    }
}
