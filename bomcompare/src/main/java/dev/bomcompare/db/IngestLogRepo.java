package dev.bomcompare.db;

import com.zaxxer.hikari.HikariDataSource;

import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

/**
 * Database access for the ingest run log (one row per ingest cycle).
 */
public class IngestLogRepo {
    private final HikariDataSource ds;
    private static final org.slf4j.Logger log = org.slf4j.LoggerFactory.getLogger(IngestLogRepo.class);

    public IngestLogRepo(HikariDataSource ds) {
        this.ds = ds;
    }

    /**
     * Starts a new ingest run and returns its unique ID.
     */
    public UUID startRun(String jobName) throws SQLException {
        UUID runId = UUID.randomUUID();
        if (ds.isClosed()) {
            log.warn("startRun skipped (datasource closed): {}", jobName);
            return runId;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "INSERT INTO ingest_run (run_id, job_name, started_at, status) VALUES (?, ?, ?, 'RUNNING')")) {
            ps.setString(1, runId.toString());
            ps.setString(2, jobName);
            ps.setLong(3, System.currentTimeMillis());
            ps.executeUpdate();
        }
        log.debug("startRun: {} -> {}", jobName, runId);
        return runId;
    }

    /**
     * Marks an ingest run as success or failure with notes.
     */
    public void finishRun(UUID runId, boolean success, String notes) throws SQLException {
        if (ds.isClosed()) {
            log.warn("finishRun skipped (datasource closed): {}", runId);
            return;
        }
        try (Connection c = ds.getConnection();
                PreparedStatement ps = c.prepareStatement(
                        "UPDATE ingest_run SET finished_at=?, status=?, notes=? WHERE run_id=?")) {
            ps.setLong(1, System.currentTimeMillis());
            ps.setString(2, success ? "SUCCESS" : "FAILED");
            ps.setString(3, notes);
            ps.setString(4, runId.toString());
            ps.executeUpdate();
        }
        log.debug("finishRun: {} success={} notes={}", runId, success, notes);
    }

    /**
     * Most recent runs first.
     */
    public List<IngestRun> recentRuns(int limit) throws SQLException {
        String sql = "SELECT run_id, job_name, started_at, finished_at, status, notes FROM ingest_run " +
                "ORDER BY started_at DESC LIMIT ?";
        List<IngestRun> out = new ArrayList<>();
        try (Connection c = ds.getConnection(); PreparedStatement ps = c.prepareStatement(sql)) {
            ps.setInt(1, limit);
            try (ResultSet rs = ps.executeQuery()) {
                while (rs.next()) {
                    long finished = rs.getLong("finished_at");
                    boolean open = rs.wasNull();
                    out.add(new IngestRun(
                            UUID.fromString(rs.getString("run_id")),
                            rs.getString("job_name"),
                            Instant.ofEpochMilli(rs.getLong("started_at")),
                            open ? null : Instant.ofEpochMilli(finished),
                            rs.getString("status"),
                            rs.getString("notes")));
                }
            }
        }
        return out;
    }

    /**
     * One logged ingest run; finishedAt is null while running.
     */
    public record IngestRun(UUID runId, String jobName, Instant startedAt, Instant finishedAt, String status,
            String notes) {
    }
}
