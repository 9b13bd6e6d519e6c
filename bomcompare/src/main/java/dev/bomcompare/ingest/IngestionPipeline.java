package dev.bomcompare.ingest;

import dev.bomcompare.bom.BomClient;
import dev.bomcompare.bom.FetchException;
import dev.bomcompare.bom.Product;
import dev.bomcompare.bom.RawPayload;
import dev.bomcompare.config.AppConfig;
import dev.bomcompare.db.IngestLogRepo;
import dev.bomcompare.db.RecordStore;
import dev.bomcompare.db.StoreException;
import dev.bomcompare.model.ForecastRecord;
import dev.bomcompare.model.ObservationRecord;
import dev.bomcompare.parse.ParseResult;
import dev.bomcompare.parse.PayloadParseException;
import dev.bomcompare.parse.ProductParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.MDC;

import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.UUID;
import java.util.concurrent.*;

/**
 * Runs one ingest cycle: fetch, parse, upsert for both products, then purge.
 *
 * <p>
 * The two products are fetched concurrently and then handled independently, so
 * a fetch or parse failure on one never stops the other. The retention purge
 * runs once at the end regardless of how the products fared.
 * </p>
 */
public class IngestionPipeline implements AutoCloseable {
    private static final Logger log = LoggerFactory.getLogger(IngestionPipeline.class);
    static final String JOB_NAME = "bom_ingest_cycle";

    private final AppConfig cfg;
    private final BomClient client;
    private final ProductParser<ForecastRecord> forecastParser;
    private final ProductParser<ObservationRecord> observationParser;
    private final RecordStore store;
    private final RetentionManager retention;
    private final IngestLogRepo logRepo;
    private final Clock clock;

    private final ExecutorService fetchExec = Executors.newFixedThreadPool(2, r -> {
        Thread t = new Thread(r, "ingest-fetch");
        t.setDaemon(true);
        return t;
    });

    /**
     * Builds the pipeline with required parsers, store and HTTP client.
     */
    public IngestionPipeline(AppConfig cfg,
            BomClient client,
            ProductParser<ForecastRecord> forecastParser,
            ProductParser<ObservationRecord> observationParser,
            RecordStore store,
            RetentionManager retention,
            IngestLogRepo logRepo,
            Clock clock) {
        this.cfg = cfg;
        this.client = client;
        this.forecastParser = forecastParser;
        this.observationParser = observationParser;
        this.store = store;
        this.retention = retention;
        this.logRepo = logRepo;
        this.clock = clock;
    }

    /**
     * Runs one full cycle and reports per-product counts and the purge result.
     */
    public CycleReport runCycle() {
        Instant started = clock.instant();
        UUID runId = startRun();
        MDC.put("job", "ingest");
        MDC.put("runId", runId.toString());
        log.info("Starting ingest cycle");

        try {
            // both fetches finish (or fail) before either product is written
            CompletableFuture<Fetched> forecastFetch = fetchAsync(Product.FORECAST);
            CompletableFuture<Fetched> observationFetch = fetchAsync(Product.OBSERVATION);
            Fetched forecastRaw = forecastFetch.join();
            Fetched observationRaw = observationFetch.join();

            ProductOutcome forecast = ingest(forecastRaw, forecastParser, store::upsertForecasts);
            ProductOutcome observation = ingest(observationRaw, observationParser, store::upsertObservations);

            PurgeResult purge = null;
            String purgeError = null;
            try {
                purge = retention.runPurge(clock.instant());
            } catch (StoreException e) {
                purgeError = e.getMessage();
                log.error("Retention purge failed", e);
            }

            CycleReport report = new CycleReport(runId, started, clock.instant(), forecast, observation, purge,
                    purgeError);
            finishRun(runId, report);
            if (report.success())
                log.info("Finished ingest cycle: {}", report.summary());
            else
                log.warn("Ingest cycle failed: {}", report.summary());
            return report;
        } finally {
            MDC.remove("runId");
            MDC.remove("job");
        }
    }

    /**
     * Parses and upserts one fetched product.
     */
    private <T> ProductOutcome ingest(Fetched fetched, ProductParser<T> parser, Upserter<T> upserter) {
        Product product = fetched.product();
        if (fetched.error() != null) {
            log.warn("{} fetch failed: {}", product, fetched.error().getMessage());
            return new ProductOutcome(product, ProductOutcome.Status.FETCH_FAILED, 0, List.of(),
                    fetched.error().getMessage());
        }

        RawPayload payload = fetched.payload();
        if (payload.notModified())
            return new ProductOutcome(product, ProductOutcome.Status.NOT_MODIFIED, 0, List.of(), null);

        ParseResult<T> parsed;
        try {
            parsed = parser.parse(payload.body(), payload.fetchedAt());
        } catch (PayloadParseException e) {
            log.warn("{} payload rejected: {}", product, e.getMessage());
            return new ProductOutcome(product, ProductOutcome.Status.PARSE_FAILED, 0, List.of(), e.getMessage());
        }

        if (parsed.records().isEmpty()) {
            log.warn("{} payload held no usable records", product);
            return new ProductOutcome(product, ProductOutcome.Status.EMPTY, 0, parsed.skipped(),
                    "no records in payload");
        }

        int written;
        try {
            written = upserter.upsertAll(parsed.records());
        } catch (StoreException e) {
            log.error("{} batch of {} records not stored", product, parsed.records().size(), e);
            return new ProductOutcome(product, ProductOutcome.Status.STORE_FAILED, 0, parsed.skipped(),
                    e.getMessage());
        }
        log.info("Ingested {} {} records (written={}, skipped={})", parsed.records().size(), product, written,
                parsed.skipped().size());
        return new ProductOutcome(product, ProductOutcome.Status.OK, written, parsed.skipped(), null);
    }

    private CompletableFuture<Fetched> fetchAsync(Product product) {
        return CompletableFuture.supplyAsync(() -> {
            try {
                return new Fetched(product, fetchWithRetry(product), null);
            } catch (FetchException e) {
                return new Fetched(product, null, e);
            } catch (RuntimeException e) {
                // e.g. a malformed product URL
                return new Fetched(product, null, new FetchException(product, String.valueOf(e.getMessage()), e));
            }
        }, fetchExec);
    }

    /**
     * Fetches with exponential backoff; client errors (4xx) are not retried.
     */
    RawPayload fetchWithRetry(Product product) throws FetchException {
        int attempts = cfg.fetchMaxAttempts();
        Duration base = cfg.fetchRetryBaseDelay();
        for (int attempt = 1;; attempt++) {
            try {
                return client.fetch(product);
            } catch (FetchException e) {
                if (attempt >= attempts || !retryable(e))
                    throw e;
                long delayMs = base.toMillis() << (attempt - 1);
                log.warn("{} fetch attempt {} failed ({}), retrying in {} ms", product, attempt, e.getMessage(),
                        delayMs);
                try {
                    Thread.sleep(delayMs);
                } catch (InterruptedException ie) {
                    Thread.currentThread().interrupt();
                    throw e;
                }
            }
        }
    }

    private static boolean retryable(FetchException e) {
        Integer status = e.httpStatus();
        return status == null || status == 429 || status >= 500;
    }

    private UUID startRun() {
        try {
            return logRepo.startRun(JOB_NAME);
        } catch (SQLException e) {
            log.warn("Could not record ingest run start: {}", e.getMessage());
            return UUID.randomUUID();
        }
    }

    private void finishRun(UUID runId, CycleReport report) {
        try {
            logRepo.finishRun(runId, report.success(), report.summary());
        } catch (SQLException e) {
            log.warn("Could not record ingest run finish for {}: {}", runId, e.getMessage());
        }
    }

    @Override
    public void close() {
        fetchExec.shutdownNow();
        try {
            if (!fetchExec.awaitTermination(3, TimeUnit.SECONDS))
                log.warn("fetch executor did not terminate cleanly");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
        }
    }

    /**
     * Result of fetching one product: exactly one of payload / error is set.
     */
    private record Fetched(Product product, RawPayload payload, FetchException error) {
    }

    @FunctionalInterface
    interface Upserter<T> {
        int upsertAll(List<T> batch) throws StoreException;
    }
}
