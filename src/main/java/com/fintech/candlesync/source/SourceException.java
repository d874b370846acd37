package com.fintech.candlesync.source;

/**
 * Failure reported by the market data source.
 */
public class SourceException extends RuntimeException {

    private final SourceErrorKind kind;

    public SourceException(SourceErrorKind kind, String message) {
        super(message);
        this.kind = kind;
    }

    public SourceException(SourceErrorKind kind, String message, Throwable cause) {
        super(message, cause);
        this.kind = kind;
    }

    public SourceErrorKind kind() {
        return kind;
    }
}
