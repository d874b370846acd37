package com.fintech.candlesync.domain;

/**
 * Severity of an operational event written to the collection log.
 */
public enum EventLevel {
    INFO,
    WARNING,
    ERROR
}
