package dev.bomcompare.model;

import java.time.Instant;
import java.time.LocalDate;
import java.util.Objects;

/**
 * One day period of a precis forecast for a single forecast area.
 *
 * <p>
 * Natural key is (stationId, validDate, periodIndex). Payload fields are null
 * when the product omits them.
 * </p>
 */
public record ForecastRecord(
        String stationId,
        Instant issuedAt,
        LocalDate validDate,
        int periodIndex,
        String summaryText,
        Integer minTemp,
        Integer maxTemp,
        Integer rainProbability,
        String rainAmountRange,
        Instant fetchedAt) {

    public ForecastRecord {
        Objects.requireNonNull(stationId, "stationId");
        Objects.requireNonNull(issuedAt, "issuedAt");
        Objects.requireNonNull(validDate, "validDate");
        Objects.requireNonNull(fetchedAt, "fetchedAt");
        if (periodIndex < 0)
            throw new IllegalArgumentException("periodIndex must be >= 0, got " + periodIndex);
    }

    /**
     * Natural key used for upserts and per-key locking.
     */
    public String naturalKey() {
        return stationId + "|" + validDate + "|" + periodIndex;
    }

    /**
     * Same forecast, restamped with a new ingestion time.
     */
    public ForecastRecord withFetchedAt(Instant at) {
        return new ForecastRecord(stationId, issuedAt, validDate, periodIndex, summaryText, minTemp, maxTemp,
                rainProbability, rainAmountRange, at);
    }
}
