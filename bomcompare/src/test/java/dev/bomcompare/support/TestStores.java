package dev.bomcompare.support;

import com.zaxxer.hikari.HikariDataSource;
import dev.bomcompare.db.Database;
import dev.bomcompare.db.StoreException;

import java.nio.file.Path;
import java.time.ZoneId;

/**
 * File-backed SQLite stores under a JUnit temp directory.
 */
public final class TestStores {
    public static final ZoneId HOBART = ZoneId.of("Australia/Hobart");

    private TestStores() {
    }

    public static String jdbcUrl(Path dir) {
        return "jdbc:sqlite:" + dir.resolve("weather_data.db");
    }

    public static HikariDataSource open(Path dir) throws StoreException {
        HikariDataSource ds = Database.createDataSource(jdbcUrl(dir), "", "", 2);
        Database.initSchema(ds);
        return ds;
    }
}
