package dev.bomcompare.query;

import dev.bomcompare.model.ForecastRecord;
import dev.bomcompare.model.ObservationRecord;

import java.util.List;
import java.util.Objects;

/**
 * A forecast next to the observations taken on its valid date (possibly none yet).
 */
public record ComparisonRow(ForecastRecord forecast, List<ObservationRecord> observations) {

    public ComparisonRow {
        Objects.requireNonNull(forecast, "forecast");
        observations = List.copyOf(observations);
    }

    public boolean hasObservations() {
        return !observations.isEmpty();
    }

    /**
     * Highest observed temperature that day, or null with no readings.
     */
    public Double observedMaxTemp() {
        return observations.stream()
                .map(ObservationRecord::temperature)
                .filter(Objects::nonNull)
                .max(Double::compare)
                .orElse(null);
    }

    public Double observedMinTemp() {
        return observations.stream()
                .map(ObservationRecord::temperature)
                .filter(Objects::nonNull)
                .min(Double::compare)
                .orElse(null);
    }

    public ObservationRecord latestObservation() {
        return observations.isEmpty() ? null : observations.get(observations.size() - 1);
    }
}
