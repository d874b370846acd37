package com.fintech.candlesync.storage;

/**
 * The store could not be reached or stopped answering.
 * Callers skip the current unit of work; the connection supervisor reconnects on the next one.
 */
public class StoreUnavailableException extends StoreException {

    public StoreUnavailableException(String message, Throwable cause) {
        super(message, cause);
    }
}
