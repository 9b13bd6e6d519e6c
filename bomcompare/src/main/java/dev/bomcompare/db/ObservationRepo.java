package dev.bomcompare.db;

import com.zaxxer.hikari.HikariDataSource;

import dev.bomcompare.model.ObservationRecord;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Database access for station observation rows.
 */
public class ObservationRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(ObservationRepo.class);

    public ObservationRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    private static final String UPSERT_SQL = "INSERT INTO observation (" +
            "station_id, observed_at, station_name, temperature, humidity, wind_speed, wind_direction, " +
            "rainfall_since_9am, fetched_at" +
            ") VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?) " +
            "ON CONFLICT (station_id, observed_at) DO UPDATE SET " +
            "station_name=excluded.station_name, temperature=excluded.temperature, humidity=excluded.humidity, " +
            "wind_speed=excluded.wind_speed, wind_direction=excluded.wind_direction, " +
            "rainfall_since_9am=excluded.rainfall_since_9am, fetched_at=excluded.fetched_at " +
            "WHERE excluded.fetched_at >= observation.fetched_at";

    /**
     * Inserts or updates one reading on (station_id, observed_at). BoM can correct a
     * reading after publishing it, so a collision overwrites.
     *
     * @return false when the stored row has a newer fetched_at and was left alone
     */
    public boolean upsert(ObservationRecord o) throws SQLException {
        int n;
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(UPSERT_SQL)) {
            bind(ps, o);
            n = ps.executeUpdate();
        }
        log.debug("upsert observation: {} applied={}", o.naturalKey(), n > 0);
        return n > 0;
    }

    /**
     * Upserts a batch in one transaction; any failure rolls the whole batch back.
     */
    public int upsertAll(List<ObservationRecord> batch) throws SQLException {
        if (batch.isEmpty())
            return 0;
        try (Connection c = ds.getConnection()) {
            boolean auto = c.getAutoCommit();
            c.setAutoCommit(false);
            try (PreparedStatement ps = c.prepareStatement(UPSERT_SQL)) {
                for (ObservationRecord o : batch) {
                    bind(ps, o);
                    ps.addBatch();
                }
                int applied = 0;
                for (int n : ps.executeBatch())
                    if (n > 0)
                        applied++;
                c.commit();
                log.debug("upsert observation batch: size={} applied={}", batch.size(), applied);
                return applied;
            } catch (SQLException e) {
                c.rollback();
                throw e;
            } finally {
                c.setAutoCommit(auto);
            }
        }
    }

    private void bind(PreparedStatement ps, ObservationRecord o) throws SQLException {
        ps.setString(1, o.stationId());
        ps.setLong(2, o.observedAt().toEpochMilli());
        ps.setString(3, o.stationName());
        setDouble(ps, 4, o.temperature());
        if (o.humidity() == null)
            ps.setNull(5, java.sql.Types.INTEGER);
        else
            ps.setInt(5, o.humidity());
        setDouble(ps, 6, o.windSpeed());
        ps.setString(7, o.windDirection());
        setDouble(ps, 8, o.rainfallSinceNineAm());
        ps.setLong(9, o.fetchedAt().toEpochMilli());
    }

    /**
     * Deletes readings observed strictly before the cutoff.
     */
    public int deleteObservedBefore(Instant cutoff) throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("DELETE FROM observation WHERE observed_at < ?")) {
            ps.setLong(1, cutoff.toEpochMilli());
            return ps.executeUpdate();
        }
    }

    /**
     * Lists readings with {@code from <= observed_at < toExclusive}; either bound may be null.
     */
    public List<ObservationRecord> find(Instant from, Instant toExclusive, String stationId) throws SQLException {
        StringBuilder sql = new StringBuilder(
                "SELECT station_id, observed_at, station_name, temperature, humidity, wind_speed, wind_direction, " +
                        "rainfall_since_9am, fetched_at FROM observation WHERE 1=1");
        List<Object> args = new ArrayList<>();
        if (from != null) {
            sql.append(" AND observed_at >= ?");
            args.add(from.toEpochMilli());
        }
        if (toExclusive != null) {
            sql.append(" AND observed_at < ?");
            args.add(toExclusive.toEpochMilli());
        }
        if (stationId != null) {
            sql.append(" AND station_id = ?");
            args.add(stationId);
        }
        sql.append(" ORDER BY observed_at, station_id");

        List<ObservationRecord> out = new ArrayList<>();
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(sql.toString())) {
            for (int i = 0; i < args.size(); i++)
                ps.setObject(i + 1, args.get(i));
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    int rh = rs.getInt("humidity");
                    Integer humidity = rs.wasNull() ? null : rh;
                    out.add(new ObservationRecord(
                            rs.getString("station_id"),
                            rs.getString("station_name"),
                            Instant.ofEpochMilli(rs.getLong("observed_at")),
                            getDouble(rs, "temperature"),
                            humidity,
                            getDouble(rs, "wind_speed"),
                            rs.getString("wind_direction"),
                            getDouble(rs, "rainfall_since_9am"),
                            Instant.ofEpochMilli(rs.getLong("fetched_at"))));
                }
            }
        }
        return out;
    }

    public long count() throws SQLException {
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement("SELECT COUNT(*) FROM observation");
                ResultSet rs = ps.executeQuery()) {
            return rs.next() ? rs.getLong(1) : 0L;
        }
    }

    /**
     * Writes a nullable double to a prepared statement.
     */
    private void setDouble(PreparedStatement ps, int idx, Double v) throws SQLException {
        if (v == null)
            ps.setNull(idx, java.sql.Types.DOUBLE);
        else
            ps.setDouble(idx, v);
    }

    private static Double getDouble(ResultSet rs, String col) throws SQLException {
        double v = rs.getDouble(col);
        return rs.wasNull() ? null : v;
    }
}
