package dev.bomcompare.config;

import java.io.InputStream;
import java.time.*;
import java.util.*;

/**
 * Application configuration loaded from environment variables or properties.
 *
 * <p>
 * This record groups the store, feed, retention and comparison settings. It is
 * read once at start-up and handed to every component that needs it.
 * </p>
 */
public record AppConfig(
        // API / DB
        int apiPort,
        String dbJdbcUrl,
        String dbUsername,
        String dbPassword,
        int dbPoolMax,

        // BoM feed
        String userAgent,
        String forecastProduct,
        String forecastUrl,
        String observationProduct,
        String observationUrl,
        String observationStationId,
        Duration fetchTimeout,
        int fetchMaxAttempts,
        Duration fetchRetryBaseDelay,

        // Retention
        int retentionDays,

        // Comparison scope: which precis area lines up with the observing station
        String scopeForecastArea,
        String scopeObservationStation,

        // Time
        ZoneId clockZoneId) {

    /**
     * Loads configuration using environment variables, system properties, and
     * application.properties (in that order).
     */
    public static AppConfig load() {
        Properties p = new Properties();
        try (InputStream in = AppConfig.class.getClassLoader().getResourceAsStream("application.properties")) {
            if (in != null)
                p.load(in);
        } catch (Exception e) {
            throw new IllegalStateException("Could not read application.properties", e);
        }
        return fromSources(System.getenv(), System.getProperties(), p);
    }

    /**
     * Builds a config from explicit sources. Env wins over system properties,
     * which win over the properties file.
     */
    public static AppConfig fromSources(Map<String, String> env, Properties sys, Properties p) {
        Sources s = new Sources(env, sys, p);

        String dbUrl = requireNonBlank("db.jdbcUrl", s.get("DB_JDBC_URL", "db.jdbcUrl", "jdbc:sqlite:weather_data.db"));
        String dbUser = s.get("DB_USERNAME", "db.username", "");
        String dbPass = s.get("DB_PASSWORD", "db.password", ""); // ok empty for sqlite / trust auth
        int dbPoolMax = Integer.parseInt(s.get("DB_POOL_MAX", "db.poolMax", "4"));

        int port = Integer.parseInt(s.get("API_PORT", "api.port", "8080"));

        String ua = requireNonBlank("bom.userAgent",
                s.get("BOM_USER_AGENT", "bom.userAgent", "bomcompare/1.0 (+https://github.com/bomcompare)"));
        String forecastProduct = s.get("BOM_FORECAST_PRODUCT", "bom.forecastProduct", "IDT16710");
        String forecastUrl = requireNonBlank("bom.forecastUrl", s.get("BOM_FORECAST_URL", "bom.forecastUrl",
                "ftp://ftp.bom.gov.au/anon/gen/fwo/" + forecastProduct + ".txt"));
        String observationProduct = s.get("BOM_OBSERVATION_PRODUCT", "bom.observationProduct", "IDT60801.94951");
        String observationUrl = requireNonBlank("bom.observationUrl", s.get("BOM_OBSERVATION_URL",
                "bom.observationUrl", defaultObservationUrl(observationProduct)));
        String observationStation = s.get("BOM_OBSERVATION_STATION", "bom.observationStation",
                stationFromProduct(observationProduct));

        Duration fetchTimeout = Duration.parse(s.get("FETCH_TIMEOUT", "fetch.timeout", "PT20S"));
        int fetchAttempts = Integer.parseInt(s.get("FETCH_MAX_ATTEMPTS", "fetch.maxAttempts", "2"));
        Duration retryDelay = Duration.parse(s.get("FETCH_RETRY_BASE_DELAY", "fetch.retryBaseDelay", "PT2S"));

        int retentionDays = Integer.parseInt(s.get("RETENTION_DAYS", "retention.days", "14"));
        if (retentionDays < 1) {
            throw new IllegalStateException("retention.days must be at least 1, got " + retentionDays);
        }

        String scopeArea = s.get("SCOPE_FORECAST_AREA", "scope.forecastArea", "Dunalley");
        String scopeStation = s.get("SCOPE_OBSERVATION_STATION", "scope.observationStation", observationStation);

        ZoneId zoneId = ZoneId.of(s.get("CLOCK_ZONE", "clock.zone", "Australia/Hobart"));

        // IMPORTANT: constructor args must match record field order exactly
        return new AppConfig(
                port,
                dbUrl,
                dbUser,
                dbPass,
                dbPoolMax,

                ua,
                forecastProduct,
                forecastUrl,
                observationProduct,
                observationUrl,
                observationStation,
                fetchTimeout,
                Math.max(1, fetchAttempts),
                retryDelay,

                retentionDays,

                scopeArea,
                scopeStation,

                zoneId);
    }

    // ----------------------------
    // helpers
    // ----------------------------
    /**
     * Lookup order for a single key: env var, JVM property, properties file.
     */
    private record Sources(Map<String, String> env, Properties sys, Properties file) {
        String get(String envKey, String propKey, String def) {
            String v = env.get(envKey);
            if (v != null && !v.isBlank())
                return v;
            String prop = sys.getProperty(propKey);
            if (prop != null && !prop.isBlank())
                return prop;
            return file.getProperty(propKey, def);
        }
    }

    /**
     * Ensures a required config value is present and not blank.
     */
    private static String requireNonBlank(String key, String v) {
        if (v == null || v.isBlank()) {
            throw new IllegalStateException(
                    "Missing required config value " + key + " (env var, -Dprop, or application.properties).");
        }
        return v;
    }

    /**
     * BoM observation products are named IDxxxxx.WMO and served as JSON under /fwo.
     */
    private static String defaultObservationUrl(String product) {
        int dot = product.indexOf('.');
        String family = dot < 0 ? product : product.substring(0, dot);
        return "http://www.bom.gov.au/fwo/" + family + "/" + product + ".json";
    }

    private static String stationFromProduct(String product) {
        int dot = product.indexOf('.');
        return dot < 0 ? product : product.substring(dot + 1);
    }
}
