package dev.bomcompare.db;

import com.zaxxer.hikari.HikariDataSource;

import dev.bomcompare.model.DateRange;
import dev.bomcompare.model.ForecastRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.List;

/**
 * Database access for precis forecast rows.
 */
public class ForecastRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ForecastRepo.class);

    /**
     * Creates a repo backed by the provided datasource.
     */
    public ForecastRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    private static final String UPSERT_SQL = "INSERT INTO forecast (" +
            "station_id, valid_date, period_index, issued_at, summary_text, min_temp, max_temp, " +
            "rain_probability, rain_amount_range, fetched_at" +
            ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (station_id, valid_date, period_index) DO UPDATE SET " +
            "issued_at=excluded.issued_at, summary_text=excluded.summary_text, " +
            "min_temp=excluded.min_temp, max_temp=excluded.max_temp, " +
            "rain_probability=excluded.rain_probability, rain_amount_range=excluded.rain_amount_range, " +
            "fetched_at=excluded.fetched_at " +
            "WHERE excluded.fetched_at >= forecast.fetched_at";

    /**
     * Inserts or updates one forecast row on (station_id, valid_date, period_index).
     *
     * @return false when the stored row has a newer fetched_at and was left alone
     */
    public boolean upsert(ForecastRecord f) throws SQLException {
        int n;
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(UPSERT_SQL)) {
            bind(ps, f);
            n = ps.executeUpdate();
        }
        log.debug("upsert forecast: {} applied={}", f.naturalKey(), n > 0);
        return n > 0;
    }

    /**
     * Upserts a batch in one transaction; any failure rolls the whole batch back.
     *
     * @return rows actually written (stale rows are not counted)
     */
    public int upsertAll(List<ForecastRecord> batch) throws SQLException {
        if (batch.isEmpty())
            return 0;
        try (Connection c = ds.getConnection()) {
            boolean auto = c.getAutoCommit();
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(UPSERT_SQL)) {
                for (ForecastRecord f : batch) {
                    bind(ps, f);
                    ps.addBatch();
                }
                int applied = 0;
                for (int n : ps.executeBatch())
                    if (n > 0)
                        applied++;
                c.commit();
                log.debug("upsert forecast batch: size={} applied={}", batch.size(), applied);
                return applied;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(auto);
            }
        }
    }

    private void bind(PreparedStatement ps, ForecastRecord f) throws SQLException {
        ps.setString(1, f.stationId());
        ps.setString(2, f.validDate().toString());
        ps.setInt(3, f.periodIndex());
        ps.setLong(4, f.issuedAt().toEpochMilli());
        ps.setString(5, f.summaryText());
        setInt(ps, 6, f.minTemp());
        setInt(ps, 7, f.maxTemp());
        setInt(ps, 8, f.rainProbability());
        ps.setString(9, f.rainAmountRange());
        ps.setLong(10, f.fetchedAt().toEpochMilli());
    }

    /**
     * Deletes forecasts valid before the given day.
     */
    public int deleteValidBefore(LocalDate cutoff) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("DELETE FROM forecast WHERE valid_date < ?")) {
            ps.setString(1, cutoff.toString());
            return ps.executeUpdate();
        }
    }

    /**
     * Lists forecasts in a date range (inclusive), optionally for one area.
     */
    public List<ForecastRecord> find(DateRange range, String stationId) throws SQLException {
        StringBuilder sql = new StringBuilder(
                "SELECT station_id, valid_date, period_index, issued_at, summary_text, min_temp, max_temp, " +
                        "rain_probability, rain_amount_range, fetched_at FROM forecast WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (range != null) {
            sql.append(" AND valid_date >= ? AND valid_date <= ?");
            args.add(range.from().toString());
            args.add(range.to().toString());
        }
        if (stationId != null) {
            sql.append(" AND station_id = ?");
            args.add(stationId);
        }
        sql.append(" ORDER BY valid_date, period_index, station_id");

        List<ForecastRecord> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++)
                ps.setObject(i + 1, args.get(i));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    out.add(new ForecastRecord(
                            rs.getString("station_id"),
                            Instant.ofEpochMilli(rs.getLong("issued_at")),
                            LocalDate.parse(rs.getString("valid_date")),
                            rs.getInt("period_index"),
                            rs.getString("summary_text"),
                            getInt(rs, "min_temp"),
                            getInt(rs, "max_temp"),
                            getInt(rs, "rain_probability"),
                            rs.getString("rain_amount_range"),
                            Instant.ofEpochMilli(rs.getLong("fetched_at"))));
                }
            }
        }
        return out;
    }

    /**
     * Distinct forecast areas currently stored.
     */
    public List<String> listAreas() throws SQLException {
        List<String> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "SELECT DISTINCT station_id FROM forecast ORDER BY station_id");
                ResultSet rs = ps.executeQuery()) {
            while (rs.next())
                out.add(rs.getString(1));
        }
        return out;
    }

    public long count() throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM forecast");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * Writes a nullable integer to a prepared statement.
     */
    private void setInt(PreparedStatement ps, int idx, Integer v) throws SQLException {
        if (v == null)
            ps.setNull(idx, java.sql.Types.INTEGER);
        else
            ps.setInt(idx, v);
    }

    private static Integer getInt(ResultSet rs, String col) throws SQLException {
        int v = rs.getInt(col);
        return rs.wasNull() ? null : v;
    }
}
