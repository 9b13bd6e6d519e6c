package dev.bomcompare.db;

import dev.bomcompare.config.AppConfig;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;

/**
 * Creates the pooled store connection (HikariCP) and the store's tables.
 */
public final class Database {
    private static final Logger log = LoggerFactory.getLogger(Database.class);

    private Database() {
    }

    /**
     * Builds the connection pool for the configured JDBC URL.
     */
    public static HikariDataSource createDataSource(AppConfig cfg) {
        return createDataSource(cfg.dbJdbcUrl(), cfg.dbUsername(), cfg.dbPassword(), cfg.dbPoolMax());
    }

    public static HikariDataSource createDataSource(String jdbcUrl, String user, String password, int maxPool) {
        HikariConfig hc = new HikariConfig();
        hc.setJdbcUrl(jdbcUrl);
        if (user != null && !user.isBlank())
            hc.setUsername(user);
        if (password != null && !password.isBlank())
            hc.setPassword(password);
        hc.setPoolName("bomcompare-store");
        hc.setMaximumPoolSize(Math.max(2, maxPool));
        hc.setMinimumIdle(1);
        hc.setConnectionTimeout(10_000);
        if (jdbcUrl.startsWith("jdbc:sqlite:")) {
            // sqlite allows one writer; wait for the file lock instead of failing with SQLITE_BUSY
            hc.setConnectionInitSql("PRAGMA busy_timeout = 5000");
        }
        return new HikariDataSource(hc);
    }

    /**
     * Runs schema.sql from the classpath. Every statement is idempotent.
     */
    public static void initSchema(HikariDataSource ds) throws StoreException {
        String script;
        try (InputStream in = Database.class.getClassLoader().getResourceAsStream("schema.sql")) {
            if (in == null)
                throw new StoreException("schema.sql not found on classpath", null);
            script = new String(in.readAllBytes(), StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new StoreException("Could not read schema.sql", e);
        }

        StringBuilder sql = new StringBuilder();
        for (String line : script.split("\\R")) {
            if (!line.strip().startsWith("--"))
                sql.append(line).append('\n');
        }

        int n = 0;
        try (Connection c = ds.getConnection(); Statement st = c.createStatement()) {
            for (String stmt : sql.toString().split(";")) {
                if (stmt.isBlank())
                    continue;
                st.execute(stmt.strip());
                n++;
            }
        } catch (SQLException e) {
            throw new StoreException("Schema initialisation failed: " + e.getMessage(), e);
        }
        log.info("Store schema ready ({} statements)", n);
    }
}
