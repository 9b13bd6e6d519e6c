package dev.bomcompare.ingest;

import dev.bomcompare.db.RecordStore;
import dev.bomcompare.db.StoreException;
import dev.bomcompare.model.RecordType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;

/**
 * Drops forecasts and observations that have aged past the retention horizon.
 *
 * <p>
 * Only rows strictly older than {@code now - horizon} are removed, so a row an
 * ingest cycle is writing right now is never a candidate. Safe to run at any
 * frequency.
 * </p>
 */
public class RetentionManager {
    private static final Logger log = LoggerFactory.getLogger(RetentionManager.class);

    private final RecordStore store;
    private final Duration horizon;

    public RetentionManager(RecordStore store, int retentionDays) {
        if (retentionDays < 1)
            throw new IllegalArgumentException("retentionDays must be >= 1, got " + retentionDays);
        this.store = store;
        this.horizon = Duration.ofDays(retentionDays);
    }

    public PurgeResult runPurge(Instant now) throws StoreException {
        Instant cutoff = now.minus(horizon);
        int f = store.purgeOlderThan(cutoff, RecordType.FORECAST);
        int o = store.purgeOlderThan(cutoff, RecordType.OBSERVATION);
        log.info("Retention purge before {}: forecasts={} observations={}", cutoff, f, o);
        return new PurgeResult(cutoff, f, o);
    }
}
