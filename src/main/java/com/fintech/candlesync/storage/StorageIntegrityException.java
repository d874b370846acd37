package com.fintech.candlesync.storage;

/**
 * An insert failed for a reason other than a duplicate key (schema mismatch, constraint, bad value).
 * The whole batch is rolled back and considered lost for the current cycle.
 */
public class StorageIntegrityException extends StoreException {

    public StorageIntegrityException(String message, Throwable cause) {
        super(message, cause);
    }
}
