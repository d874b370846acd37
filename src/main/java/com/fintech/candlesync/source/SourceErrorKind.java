package com.fintech.candlesync.source;

/**
 * Classification of source failures, assigned where the provider's error is decoded.
 * Callers dispatch on the kind, never on message text.
 */
public enum SourceErrorKind {
    /** Provider unreachable or terminal not answering. Supervisor reconnects on the next operation. */
    CONNECTIVITY,
    /** Provider rejected the request size or shape. Drives adaptive chunk shrinking. */
    INVALID_RANGE,
    /** Symbol unknown to the provider. Permanent for the process lifetime. */
    NOT_FOUND,
    UNKNOWN
}
