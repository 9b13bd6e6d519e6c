package dev.bomcompare.ingest;

import java.time.Instant;
import java.util.List;
import java.util.UUID;

/**
 * Outcome of one ingest cycle: each product's result and the retention pass.
 *
 * <p>
 * {@code purge} is null when the purge itself failed; {@code purgeError} says why.
 * </p>
 */
public record CycleReport(
        UUID runId,
        Instant startedAt,
        Instant finishedAt,
        ProductOutcome forecast,
        ProductOutcome observation,
        PurgeResult purge,
        String purgeError) {

    public List<ProductOutcome> products() {
        return List.of(forecast, observation);
    }

    /**
     * True when both products were ingested (or unchanged) and the purge ran.
     * Skipped records do not count against a cycle.
     */
    public boolean success() {
        return forecast.succeeded() && observation.succeeded() && purgeError == null;
    }

    public String summary() {
        StringBuilder sb = new StringBuilder();
        sb.append(forecast.summary()).append("; ").append(observation.summary()).append("; ");
        if (purge != null)
            sb.append("purged forecasts=").append(purge.forecastRemoved())
                    .append(" observations=").append(purge.observationRemoved());
        else
            sb.append("purge failed: ").append(purgeError);
        return sb.toString();
    }
}
