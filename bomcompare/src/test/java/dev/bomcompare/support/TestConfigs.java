package dev.bomcompare.support;

import dev.bomcompare.config.AppConfig;

import java.nio.file.Path;
import java.util.Map;
import java.util.Properties;

/**
 * AppConfig built from explicit properties only, so the host environment cannot leak in.
 */
public final class TestConfigs {
    private TestConfigs() {
    }

    public static AppConfig config(Path dbDir, String forecastUrl, String observationUrl, String... extra) {
        Properties p = new Properties();
        p.setProperty("db.jdbcUrl", TestStores.jdbcUrl(dbDir));
        p.setProperty("bom.forecastUrl", forecastUrl);
        p.setProperty("bom.observationUrl", observationUrl);
        p.setProperty("fetch.timeout", "PT2S");
        p.setProperty("fetch.retryBaseDelay", "PT0.01S");
        for (int i = 0; i + 1 < extra.length; i += 2)
            p.setProperty(extra[i], extra[i + 1]);
        return AppConfig.fromSources(Map.of(), new Properties(), p);
    }
}
