package dev.bomcompare.query;

import dev.bomcompare.db.RecordFilter;
import dev.bomcompare.db.RecordStore;
import dev.bomcompare.db.StoreException;
import dev.bomcompare.model.DateRange;
import dev.bomcompare.model.ForecastRecord;
import dev.bomcompare.model.ObservationRecord;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Read side: lines forecasts up with the observations they predicted.
 *
 * <p>
 * Left join: every forecast in range yields one row, with an empty observation
 * list when nothing has been observed for its day yet. Rows come ordered by valid
 * date, then period index; observations within a row by time. An observation
 * belongs to the forecast whose valid date equals its local calendar date in the
 * store's zone.
 * </p>
 */
public class ComparisonQuery {
    private static final Logger log = LoggerFactory.getLogger(ComparisonQuery.class);

    private final RecordStore store;
    private final StationScope scope;

    public ComparisonQuery(RecordStore store, StationScope scope) {
        this.store = store;
        this.scope = scope;
    }

    public StationScope scope() {
        return scope;
    }

    /**
     * @param stationFilter forecast area or observation station id; null for all areas
     */
    public List<ComparisonRow> compare(DateRange range, String stationFilter) throws StoreException {
        Objects.requireNonNull(range, "range");
        String area = scope.forecastAreaFor(stationFilter);
        List<ForecastRecord> forecasts = store.queryForecasts(new RecordFilter(range, area));

        Map<LocalDate, List<ObservationRecord>> byDay = new LinkedHashMap<>();
        if (forecasts.stream().anyMatch(f -> scope.covers(f.stationId()))) {
            for (ObservationRecord o : store.queryObservations(new RecordFilter(range, scope.observationStation()))) {
                LocalDate day = LocalDate.ofInstant(o.observedAt(), store.zone());
                byDay.computeIfAbsent(day, k -> new ArrayList<>()).add(o);
            }
        }

        List<ComparisonRow> rows = new ArrayList<>(forecasts.size());
        for (ForecastRecord f : forecasts) {
            List<ObservationRecord> matched = new ArrayList<>();
            for (ObservationRecord o : byDay.getOrDefault(f.validDate(), List.of())) {
                if (scope.matches(f.stationId(), o.stationId()))
                    matched.add(o);
            }
            rows.add(new ComparisonRow(f, matched));
        }
        log.debug("compare {}..{} filter={} -> {} rows", range.from(), range.to(), stationFilter, rows.size());
        return rows;
    }
}
