package com.fintech.candlesync.storage;

/**
 * Base class for failures raised by a {@link CandleRepository}.
 */
public class StoreException extends RuntimeException {

    public StoreException(String message) {
        super(message);
    }

    public StoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
