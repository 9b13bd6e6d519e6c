package dev.bomcompare.db;

import dev.bomcompare.IngestException;

/**
 * The record store could not complete a read or write.
 */
public class StoreException extends IngestException {
    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
