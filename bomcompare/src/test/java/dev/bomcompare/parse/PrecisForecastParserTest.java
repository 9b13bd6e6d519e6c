package dev.bomcompare.parse;

import dev.bomcompare.model.ForecastRecord;
import dev.bomcompare.support.FixtureUtils;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class PrecisForecastParserTest {
    private static final ZoneId HOBART = ZoneId.of("Australia/Hobart");
    private static final Instant FETCHED = Instant.parse("2024-03-01T06:00:00Z");

    private final PrecisForecastParser parser = new PrecisForecastParser(HOBART);

    @Test
    void parsesSevenPeriodsAndSkipsTheMalformedEntry() throws Exception {
        ParseResult<ForecastRecord> result = parser.parse(FixtureUtils.fixtureText("fixtures/precis_IDT16710.txt"),
                FETCHED);

        assertEquals(7, result.records().size());
        assertEquals(1, result.skipped().size());
        ParseResult.Skip skip = result.skipped().get(0);
        assertEquals("period 1 Swansea", skip.section());
        assertTrue(skip.reason().contains("maximum"), skip.reason());

        for (int i = 0; i < 7; i++) {
            ForecastRecord f = result.records().get(i);
            assertEquals("Dunalley", f.stationId());
            assertEquals(i, f.periodIndex());
            assertEquals(LocalDate.of(2024, 3, 1).plusDays(i), f.validDate());
            assertEquals(Instant.parse("2024-03-01T05:35:00Z"), f.issuedAt());
            assertEquals(FETCHED, f.fetchedAt());
        }
    }

    @Test
    void readsEachAttributeAndLeavesAbsentOnesNull() throws Exception {
        List<ForecastRecord> records = parser.parse(FixtureUtils.fixtureText("fixtures/precis_IDT16710.txt"),
                FETCHED).records();

        ForecastRecord restOfToday = records.get(0);
        assertEquals("Mostly sunny.", restOfToday.summaryText());
        assertNull(restOfToday.minTemp());
        assertEquals(22, restOfToday.maxTemp());
        assertNull(restOfToday.rainProbability());
        assertNull(restOfToday.rainAmountRange());

        ForecastRecord sunday = records.get(2);
        assertEquals("Shower or two.", sunday.summaryText());
        assertEquals(13, sunday.minTemp());
        assertEquals(19, sunday.maxTemp());
        assertEquals(70, sunday.rainProbability());
        assertEquals("0 to 2 mm", sunday.rainAmountRange());
    }

    @Test
    void missingIssueLineRejectsThePayload() {
        String text = "Forecast for Saturday 2 March\nDunalley          Sunny.   Max 24\n";

        PayloadParseException e = assertThrows(PayloadParseException.class, () -> parser.parse(text, FETCHED));
        assertEquals("issued_at", e.section());
    }

    @Test
    void payloadWithoutSectionsIsRejected() {
        String text = "Issued at 4:35 pm EDT on Friday 1 March 2024\n\nNo forecasts today.\n";

        PayloadParseException e = assertThrows(PayloadParseException.class, () -> parser.parse(text, FETCHED));
        assertEquals("forecast sections", e.section());
    }

    @Test
    void acceptsSeptAbbreviationAndMorningIssue() throws Exception {
        String text = String.join("\n",
                "Issued at 4:30 am EST on Tuesday 3 Sept 2024",
                "",
                "Forecast for the rest of Tuesday",
                "Dunalley          Cloudy.   Max 14",
                "Forecast for Wednesday 4 September",
                "Dunalley          Rain.     Min 6   Max 12   Chance of any rain: 95%");

        List<ForecastRecord> records = parser.parse(text, FETCHED).records();

        assertEquals(2, records.size());
        assertEquals(LocalDate.of(2024, 9, 3), records.get(0).validDate());
        assertEquals(LocalDate.of(2024, 9, 4), records.get(1).validDate());
        // AEST, +10:00 in September
        assertEquals(Instant.parse("2024-09-02T18:30:00Z"), records.get(0).issuedAt());
    }

    @Test
    void skipsOutOfRangeChanceAndDuplicateArea() throws Exception {
        String text = String.join("\n",
                "Issued at 4:35 pm EDT on Friday 1 March 2024",
                "Forecast for Saturday 2 March",
                "Dunalley          Sunny.    Max 24   Chance of any rain: 120%",
                "Hobart            Sunny.    Max 23",
                "Hobart            Cloudy.   Max 20",
                "Orford            Min 11   Max 21");

        ParseResult<ForecastRecord> result = parser.parse(text, FETCHED);

        assertEquals(2, result.records().size());
        assertEquals("Hobart", result.records().get(0).stationId());
        assertEquals("Sunny.", result.records().get(0).summaryText());
        ForecastRecord orford = result.records().get(1);
        assertNull(orford.summaryText());
        assertEquals(11, orford.minTemp());
        assertEquals(0, orford.periodIndex());
        assertEquals(LocalDate.of(2024, 3, 2), orford.validDate());

        assertEquals(2, result.skipped().size());
        assertTrue(result.skipped().get(0).reason().contains("out of range"));
        assertTrue(result.skipped().get(1).reason().contains("duplicate"));
    }

    @Test
    void summaryWordsAreNotReadAsLabelledValues() throws Exception {
        String text = String.join("\n",
                "Issued at 4:35 pm EDT on Friday 1 March 2024",
                "Forecast for the rest of Friday",
                "Dunalley          Slight chance of rain.   Min 10   Max 18",
                "Orford            Max temperatures near average.   Min 9   Max 19",
                "Swansea           Chance of a shower.   Max 17   Chance of any rain: 30%");

        List<ForecastRecord> records = parser.parse(text, FETCHED).records();

        assertEquals(3, records.size());
        ForecastRecord dunalley = records.get(0);
        assertEquals("Slight chance of rain.", dunalley.summaryText());
        assertEquals(10, dunalley.minTemp());
        assertEquals(18, dunalley.maxTemp());
        assertNull(dunalley.rainProbability());

        ForecastRecord orford = records.get(1);
        assertEquals("Max temperatures near average.", orford.summaryText());
        assertEquals(19, orford.maxTemp());

        ForecastRecord swansea = records.get(2);
        assertEquals("Chance of a shower.", swansea.summaryText());
        assertEquals(17, swansea.maxTemp());
        assertEquals(30, swansea.rainProbability());
    }

    @Test
    void validDateComesFromTheSectionHeader() throws Exception {
        String text = String.join("\n",
                "Issued at 4:30 am EDT on Saturday 2 March 2024",
                "Forecast for Saturday 2 March",
                "Dunalley          Sunny.    Max 24",
                "Forecast for Monday 4 March",
                "Dunalley          Cloudy.   Max 19");

        List<ForecastRecord> records = parser.parse(text, FETCHED).records();

        assertEquals(2, records.size());
        assertEquals(0, records.get(0).periodIndex());
        assertEquals(LocalDate.of(2024, 3, 2), records.get(0).validDate());
        assertEquals(1, records.get(1).periodIndex());
        assertEquals(LocalDate.of(2024, 3, 4), records.get(1).validDate());
    }

    @Test
    void sectionDatesRollIntoTheNextYear() throws Exception {
        String text = String.join("\n",
                "Issued at 4:35 pm EDT on Tuesday 31 December 2024",
                "Forecast for the rest of Tuesday",
                "Dunalley          Sunny.    Max 25",
                "Forecast for Wednesday 1 January",
                "Dunalley          Cloudy.   Min 13   Max 21");

        List<ForecastRecord> records = parser.parse(text, FETCHED).records();

        assertEquals(LocalDate.of(2024, 12, 31), records.get(0).validDate());
        assertEquals(LocalDate.of(2025, 1, 1), records.get(1).validDate());
    }

    @Test
    void emptyPayloadIsRejected() {
        assertThrows(PayloadParseException.class, () -> parser.parse("  \n", FETCHED));
    }
}
