package dev.bomcompare.db;

import com.zaxxer.hikari.HikariDataSource;

import dev.bomcompare.model.DateRange;
import dev.bomcompare.model.ForecastRecord;
import dev.bomcompare.model.ObservationRecord;
import dev.bomcompare.model.RecordType;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.SQLException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keyed store for forecasts and observations with upsert on the natural key.
 *
 * <p>
 * Each upsert is a single statement, so a row is either fully written or not at
 * all. Writers to the same natural key are serialized in-process on a striped
 * lock; the statement itself refuses to replace a row with a newer fetched_at.
 * Calendar dates are resolved in the configured clock zone.
 * </p>
 */
public class RecordStore {
    private static final Logger log = LoggerFactory.getLogger(RecordStore.class);
    private static final int LOCK_STRIPES = 32;

    private final ForecastRepo forecasts;
    private final ObservationRepo observations;
    private final ZoneId zone;
    private final ReentrantLock[] stripes = new ReentrantLock[LOCK_STRIPES];

    public RecordStore(HikariDataSource ds, ZoneId zone) {
        this(new ForecastRepo(ds), new ObservationRepo(ds), zone);
    }

    public RecordStore(ForecastRepo forecasts, ObservationRepo observations, ZoneId zone) {
        this.forecasts = forecasts;
        this.observations = observations;
        this.zone = zone;
        for (int i = 0; i < LOCK_STRIPES; i++)
            stripes[i] = new ReentrantLock();
    }

    public ZoneId zone() {
        return zone;
    }

    /**
     * Inserts the forecast or overwrites the row with the same natural key.
     */
    public boolean upsert(ForecastRecord f) throws StoreException {
        ReentrantLock lock = stripeFor(f.naturalKey());
        lock.lock();
        try {
            return forecasts.upsert(f);
        } catch (SQLException e) {
            throw new StoreException("Forecast upsert failed for " + f.naturalKey() + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Inserts the observation or overwrites the row with the same natural key.
     */
    public boolean upsert(ObservationRecord o) throws StoreException {
        ReentrantLock lock = stripeFor(o.naturalKey());
        lock.lock();
        try {
            return observations.upsert(o);
        } catch (SQLException e) {
            throw new StoreException("Observation upsert failed for " + o.naturalKey() + ": " + e.getMessage(), e);
        } finally {
            lock.unlock();
        }
    }

    /**
     * Upserts a whole forecast batch in one transaction.
     *
     * @return rows written; a stale row (older fetched_at) is left alone and not counted
     */
    public int upsertForecasts(List<ForecastRecord> batch) throws StoreException {
        List<ReentrantLock> held = lockAll(batch.stream().map(ForecastRecord::naturalKey).toList());
        try {
            return forecasts.upsertAll(batch);
        } catch (SQLException e) {
            throw new StoreException("Forecast batch of " + batch.size() + " rolled back: " + e.getMessage(), e);
        } finally {
            unlockAll(held);
        }
    }

    public int upsertObservations(List<ObservationRecord> batch) throws StoreException {
        List<ReentrantLock> held = lockAll(batch.stream().map(ObservationRecord::naturalKey).toList());
        try {
            return observations.upsertAll(batch);
        } catch (SQLException e) {
            throw new StoreException("Observation batch of " + batch.size() + " rolled back: " + e.getMessage(), e);
        } finally {
            unlockAll(held);
        }
    }

    /**
     * Removes rows whose retention timestamp is strictly before the cutoff.
     *
     * <p>
     * Forecasts are compared by valid date: the cutoff's calendar day is kept.
     * Observations are compared by observed instant.
     * </p>
     */
    public int purgeOlderThan(Instant cutoff, RecordType type) throws StoreException {
        try {
            int n = switch (type) {
                case FORECAST -> forecasts.deleteValidBefore(LocalDate.ofInstant(cutoff, zone));
                case OBSERVATION -> observations.deleteObservedBefore(cutoff);
            };
            log.debug("purge {} older than {} removed={}", type, cutoff, n);
            return n;
        } catch (SQLException e) {
            throw new StoreException("Purge of " + type.table() + " failed: " + e.getMessage(), e);
        }
    }

    /**
     * Forecasts matching the filter, ordered by valid date, period, area.
     */
    public List<ForecastRecord> queryForecasts(RecordFilter filter) throws StoreException {
        try {
            return forecasts.find(filter.range(), filter.stationId());
        } catch (SQLException e) {
            throw new StoreException("Forecast query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Observations whose local date falls in the filter's range, ordered by time.
     */
    public List<ObservationRecord> queryObservations(RecordFilter filter) throws StoreException {
        DateRange r = filter.range();
        Instant from = r == null ? null : r.from().atStartOfDay(zone).toInstant();
        Instant to = r == null ? null : r.to().plusDays(1).atStartOfDay(zone).toInstant();
        try {
            return observations.find(from, to, filter.stationId());
        } catch (SQLException e) {
            throw new StoreException("Observation query failed: " + e.getMessage(), e);
        }
    }

    /**
     * Forecast areas that have at least one stored row.
     */
    public List<String> forecastAreas() throws StoreException {
        try {
            return forecasts.listAreas();
        } catch (SQLException e) {
            throw new StoreException("Area listing failed: " + e.getMessage(), e);
        }
    }

    /**
     * Row count per record type.
     */
    public Map<RecordType, Long> counts() throws StoreException {
        Map<RecordType, Long> out = new EnumMap<>(RecordType.class);
        for (RecordType t : RecordType.values())
            out.put(t, count(t));
        return out;
    }

    public long count(RecordType type) throws StoreException {
        try {
            return type == RecordType.FORECAST ? forecasts.count() : observations.count();
        } catch (SQLException e) {
            throw new StoreException("Count of " + type.table() + " failed: " + e.getMessage(), e);
        }
    }

    private ReentrantLock stripeFor(String key) {
        return stripes[stripeIndex(key)];
    }

    private static int stripeIndex(String key) {
        return Math.floorMod(key.hashCode(), LOCK_STRIPES);
    }

    /**
     * Takes every stripe the keys hash to, in ascending stripe order.
     */
    private List<ReentrantLock> lockAll(List<String> keys) {
        TreeSet<Integer> idx = new TreeSet<>();
        for (String k : keys)
            idx.add(stripeIndex(k));
        List<ReentrantLock> held = new ArrayList<>(idx.size());
        for (int i : idx) {
            stripes[i].lock();
            held.add(stripes[i]);
        }
        return held;
    }

    private static void unlockAll(List<ReentrantLock> held) {
        for (int i = held.size() - 1; i >= 0; i--)
            held.get(i).unlock();
    }
}
