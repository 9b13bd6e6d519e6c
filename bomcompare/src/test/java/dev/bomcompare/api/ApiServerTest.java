package dev.bomcompare.api;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariDataSource;
import dev.bomcompare.config.AppConfig;
import dev.bomcompare.db.IngestLogRepo;
import dev.bomcompare.db.RecordStore;
import dev.bomcompare.metrics.ExternalApiMetrics;
import dev.bomcompare.model.ForecastRecord;
import dev.bomcompare.model.ObservationRecord;
import dev.bomcompare.query.ComparisonQuery;
import dev.bomcompare.query.StationScope;
import dev.bomcompare.support.TestConfigs;
import dev.bomcompare.support.TestStores;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.file.Path;
import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ApiServerTest {
    private static final Instant ISSUED = Instant.parse("2024-02-29T05:35:00Z");
    private static final Instant FETCHED = Instant.parse("2024-03-01T06:00:00Z");

    @TempDir
    Path tmp;

    private final ObjectMapper om = new ObjectMapper();
    private final HttpClient http = HttpClient.newBuilder().connectTimeout(Duration.ofSeconds(2)).build();

    private HikariDataSource ds;
    private ApiServer api;
    private IngestLogRepo ingestLog;

    @BeforeEach
    void setUp() throws Exception {
        ExternalApiMetrics.reset();
        ds = TestStores.open(tmp);
        RecordStore store = new RecordStore(ds, TestStores.HOBART);
        ingestLog = new IngestLogRepo(ds);
        AppConfig cfg = TestConfigs.config(tmp, "file:///unused.txt", "file:///unused.json");

        store.upsert(new ForecastRecord("Dunalley", ISSUED, LocalDate.of(2024, 3, 1), 1, "Mostly sunny.", 12, 22,
                20, "0 to 2 mm", FETCHED));
        store.upsert(new ForecastRecord("Dunalley", ISSUED, LocalDate.of(2024, 3, 2), 2, "Rain.", 11, 16, 90,
                null, FETCHED));
        store.upsert(new ForecastRecord("Hobart", ISSUED, LocalDate.of(2024, 3, 1), 1, "Sunny.", 13, 23, null,
                null, FETCHED));
        store.upsert(new ObservationRecord("94951", "Dunalley (Henry anson)",
                Instant.parse("2024-03-01T02:30:00Z"), 19.4, 62, 15.0, "NW", null, FETCHED));

        api = new ApiServer(cfg, om, ds, store,
                new ComparisonQuery(store, new StationScope("Dunalley", "94951")), ingestLog);
        api.start(0);
    }

    @AfterEach
    void tearDown() {
        api.stop();
        ds.close();
    }

    @Test
    void comparisonReturnsRowsWithMatchedObservations() throws Exception {
        HttpResponse<String> resp = get("/api/comparison?from=2024-03-01&to=2024-03-02&station=Dunalley");

        assertEquals(200, resp.statusCode());
        JsonNode body = om.readTree(resp.body());
        assertEquals("Dunalley", body.get("station").asText());
        assertEquals(2, body.get("count").asInt());

        JsonNode first = body.get("rows").get(0);
        assertEquals("2024-03-01", first.get("valid_date").asText());
        assertEquals(22, first.get("forecast").get("max_temp").asInt());
        assertEquals("0 to 2 mm", first.get("forecast").get("rain_amount_range").asText());
        assertEquals(1, first.get("observations").size());
        assertEquals(19.4, first.get("observations").get(0).get("temperature").asDouble());
        assertTrue(first.get("observations").get(0).get("rain_since_9am").isNull());

        JsonNode second = body.get("rows").get(1);
        assertEquals(0, second.get("observations").size());
        assertTrue(second.get("observed_max_temp").isNull());
    }

    @Test
    void singleDateWithoutStationCoversEveryArea() throws Exception {
        JsonNode body = om.readTree(get("/api/comparison?date=2024-03-01").body());

        assertEquals(2, body.get("count").asInt());
        assertTrue(body.get("station").isNull());
        assertEquals("Dunalley", body.get("rows").get(0).get("station_id").asText());
        assertEquals("Hobart", body.get("rows").get(1).get("station_id").asText());
    }

    @Test
    void badDatesAreRejectedWith400() throws Exception {
        HttpResponse<String> badFormat = get("/api/comparison?from=01-03-2024");
        HttpResponse<String> reversed = get("/api/comparison?from=2024-03-02&to=2024-03-01");
        HttpResponse<String> tooWide = get("/api/comparison?from=2024-01-01&to=2024-06-01");

        assertEquals(400, badFormat.statusCode());
        assertEquals(400, reversed.statusCode());
        assertEquals(400, tooWide.statusCode());
        assertTrue(om.readTree(reversed.body()).get("error").asText().contains("before"));
    }

    @Test
    void locationsListStoredAreasAndTheDefault() throws Exception {
        JsonNode body = om.readTree(get("/api/locations").body());

        assertEquals("Dunalley", body.get("default").asText());
        assertEquals("94951", body.get("observation_station").asText());
        assertEquals(2, body.get("locations").size());
        assertEquals("Dunalley", body.get("locations").get(0).asText());
        assertEquals("Hobart", body.get("locations").get(1).asText());
    }

    @Test
    void ingestRunsAreListedNewestFirst() throws Exception {
        UUID older = ingestLog.startRun("bom_ingest_cycle");
        ingestLog.finishRun(older, true, "forecast=OK");
        Thread.sleep(5);
        UUID newer = ingestLog.startRun("bom_ingest_cycle");

        JsonNode runs = om.readTree(get("/api/ingest/runs?limit=5").body());

        assertEquals(2, runs.size());
        assertEquals(newer.toString(), runs.get(0).get("run_id").asText());
        assertEquals("RUNNING", runs.get(0).get("status").asText());
        assertTrue(runs.get(0).get("finished_at").isNull());
        assertEquals("SUCCESS", runs.get(1).get("status").asText());
    }

    @Test
    void healthReportsRowCounts() throws Exception {
        HttpResponse<String> resp = get("/health");
        JsonNode body = om.readTree(resp.body());

        assertEquals(200, resp.statusCode());
        assertEquals("ok", body.get("db").asText());
        assertEquals(3, body.get("rows").get("forecast").asInt());
        assertEquals(1, body.get("rows").get("observation").asInt());
    }

    @Test
    void externalMetricsShowRecordedCalls() throws Exception {
        ExternalApiMetrics.record("BOM", true);
        ExternalApiMetrics.record("BOM", false);

        JsonNode body = om.readTree(get("/api/metrics/external").body());

        assertEquals(60, body.get("window_minutes").asInt());
        JsonNode bom = body.get("services").get(0);
        assertEquals("BOM", bom.get("service").asText());
        assertEquals(2, bom.get("calls").asInt());
        assertEquals("down", bom.get("status").asText());
    }

    private HttpResponse<String> get(String path) throws Exception {
        HttpRequest req = HttpRequest.newBuilder(URI.create("http://localhost:" + api.port() + path))
                .timeout(Duration.ofSeconds(5))
                .GET()
                .build();
        return http.send(req, HttpResponse.BodyHandlers.ofString());
    }
}
