package dev.bomcompare.ingest;

import java.time.Instant;

/**
 * Rows removed by one retention pass, and the cutoff it used.
 */
public record PurgeResult(Instant cutoff, int forecastRemoved, int observationRemoved) {
}
