package dev.bomcompare.parse;

import com.fasterxml.jackson.databind.ObjectMapper;
import dev.bomcompare.model.ObservationRecord;
import dev.bomcompare.support.FixtureUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ObservationJsonParserTest {
    private static final Instant FETCHED = Instant.parse("2024-03-01T03:05:00Z");

    private final ObservationJsonParser parser = new ObservationJsonParser(new ObjectMapper(), "94951");

    @Test
    void readsTheLatestReading() throws Exception {
        ParseResult<ObservationRecord> result = parser.parse(
                FixtureUtils.fixtureText("fixtures/IDT60801.94951.json"), FETCHED);

        assertEquals(1, result.records().size());
        assertTrue(result.skipped().isEmpty());
        ObservationRecord o = result.records().get(0);
        assertEquals("94951", o.stationId());
        assertEquals("Dunalley (Henry anson)", o.stationName());
        assertEquals(Instant.parse("2024-03-01T02:30:00Z"), o.observedAt());
        assertEquals(19.4, o.temperature());
        assertEquals(62, o.humidity());
        assertEquals(15.0, o.windSpeed());
        assertEquals("NW", o.windDirection());
        assertEquals(0.2, o.rainfallSinceNineAm());
        assertEquals(FETCHED, o.fetchedAt());
    }

    @Test
    void badReadingsAreSkippedAndTheRestKept() throws Exception {
        ParseResult<ObservationRecord> result = parser.parse(
                FixtureUtils.fixtureText("fixtures/IDT60801.94951-history.json"), FETCHED);

        List<ObservationRecord> records = result.records();
        assertEquals(3, records.size());
        assertEquals(3, result.skipped().size());

        // numeric values sent as strings, humidity rounded
        assertEquals(17.0, records.get(0).windSpeed());
        assertEquals(58, records.get(0).humidity());
        // "-" means no reading
        assertNull(records.get(1).rainfallSinceNineAm());
        // no wmo falls back to the configured station; null and blank are absent
        ObservationRecord last = records.get(2);
        assertEquals("94951", last.stationId());
        assertNull(last.temperature());
        assertNull(last.humidity());
        assertNull(last.windDirection());

        assertEquals("observations.data[2]", result.skipped().get(0).section());
        assertTrue(result.skipped().get(0).reason().contains("air_temp"));
        assertTrue(result.skipped().get(1).reason().contains("aifstime_utc"));
        assertTrue(result.skipped().get(2).reason().contains("duplicate"));
    }

    @Test
    void invalidJsonIsAPayloadError() {
        PayloadParseException e = assertThrows(PayloadParseException.class,
                () -> parser.parse("{\"observations\": [", FETCHED));
        assertEquals("payload", e.section());
    }

    @Test
    void missingDataArrayIsAPayloadError() {
        PayloadParseException e = assertThrows(PayloadParseException.class,
                () -> parser.parse("{\"observations\": {\"header\": []}}", FETCHED));
        assertEquals("observations.data", e.section());
    }

    @Test
    void emptyDataArrayYieldsNoRecords() throws Exception {
        ParseResult<ObservationRecord> result = parser.parse("{\"observations\": {\"data\": []}}", FETCHED);

        assertTrue(result.records().isEmpty());
        assertTrue(result.skipped().isEmpty());
    }
}
