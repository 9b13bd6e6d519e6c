package dev.bomcompare.model;

import java.time.Instant;
import java.util.Objects;

/**
 * A single station reading. Natural key is (stationId, observedAt).
 */
public record ObservationRecord(
        String stationId,
        String stationName,
        Instant observedAt,
        Double temperature,
        Integer humidity,
        Double windSpeed,
        String windDirection,
        Double rainfallSinceNineAm,
        Instant fetchedAt) {

    public ObservationRecord {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(observedAt, "observedAt");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
    }

    public String naturalKey() {
        return stationId + "|" + observedAt.toEpochMilli();
    }

    public ObservationRecord withFetchedAt(Instant at) {
        return new ObservationRecord(stationId, stationName, observedAt, temperature, humidity, windSpeed,
                windDirection, rainfallSinceNineAm, at);
    }
}
