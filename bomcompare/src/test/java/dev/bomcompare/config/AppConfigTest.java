package dev.bomcompare.config;

import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.ZoneId;
import java.util.Map;
import java.util.Properties;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

class AppConfigTest {
    @Test
    void defaultsPointAtTheDunalleyProducts() {
        AppConfig cfg = AppConfig.fromSources(Map.of(), new Properties(), new Properties());

        assertEquals("jdbc:sqlite:weather_data.db", cfg.dbJdbcUrl());
        assertEquals("ftp://ftp.bom.gov.au/anon/gen/fwo/IDT16710.txt", cfg.forecastUrl());
        assertEquals("http://www.bom.gov.au/fwo/IDT60801/IDT60801.94951.json", cfg.observationUrl());
        assertEquals("94951", cfg.observationStationId());
        assertEquals("Dunalley", cfg.scopeForecastArea());
        assertEquals("94951", cfg.scopeObservationStation());
        assertEquals(14, cfg.retentionDays());
        assertEquals(2, cfg.fetchMaxAttempts());
        assertEquals(Duration.ofSeconds(20), cfg.fetchTimeout());
        assertEquals(ZoneId.of("Australia/Hobart"), cfg.clockZoneId());
    }

    @Test
    void envBeatsSystemPropertyBeatsFile() {
        Properties file = new Properties();
        file.setProperty("retention.days", "7");
        file.setProperty("api.port", "9000");
        file.setProperty("scope.forecastArea", "Hobart");
        Properties sys = new Properties();
        sys.setProperty("retention.days", "10");
        sys.setProperty("api.port", "9100");

        AppConfig cfg = AppConfig.fromSources(Map.of("RETENTION_DAYS", "21"), sys, file);

        assertEquals(21, cfg.retentionDays());
        assertEquals(9100, cfg.apiPort());
        assertEquals("Hobart", cfg.scopeForecastArea());
    }

    @Test
    void observationProductDrivesUrlAndStation() {
        AppConfig cfg = AppConfig.fromSources(Map.of("BOM_OBSERVATION_PRODUCT", "IDT60901.94970"),
                new Properties(), new Properties());

        assertEquals("http://www.bom.gov.au/fwo/IDT60901/IDT60901.94970.json", cfg.observationUrl());
        assertEquals("94970", cfg.observationStationId());
        assertEquals("94970", cfg.scopeObservationStation());
    }

    @Test
    void retentionBelowOneDayIsRejected() {
        assertThrows(IllegalStateException.class,
                () -> AppConfig.fromSources(Map.of("RETENTION_DAYS", "0"), new Properties(), new Properties()));
    }

    @Test
    void attemptsAreAtLeastOne() {
        AppConfig cfg = AppConfig.fromSources(Map.of("FETCH_MAX_ATTEMPTS", "0"), new Properties(), new Properties());

        assertEquals(1, cfg.fetchMaxAttempts());
    }

    @Test
    void blankForecastUrlIsAConfigError() {
        Properties file = new Properties();
        file.setProperty("bom.forecastUrl", " ");

        assertThrows(IllegalStateException.class,
                () -> AppConfig.fromSources(Map.of(), new Properties(), file));
    }
}
