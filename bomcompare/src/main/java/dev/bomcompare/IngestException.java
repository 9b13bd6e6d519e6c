package dev.bomcompare;

/**
 * Base for the checked failures an ingest cycle can hit (fetch, parse, store).
 */
public class IngestException extends Exception {
    public IngestException(String message) {
        super(message);
    }

    public IngestException(String message, Throwable cause) {
        super(message, cause);
    }
}
