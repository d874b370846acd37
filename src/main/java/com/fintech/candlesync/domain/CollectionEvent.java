package com.fintech.candlesync.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Append-only operational history entry.
 *
 * @param timestamp When the event was recorded (UTC)
 * @param level Severity
 * @param instrument Related instrument, or null for service-wide events
 * @param timeframe Related timeframe, or null
 * @param message Human-readable message
 * @param details Structured details as JSON text, or null
 */
public record CollectionEvent(
    Instant timestamp,
    EventLevel level,
    String instrument,
    Timeframe timeframe,
    String message,
    String details
) implements Serializable {

    public CollectionEvent {
        Objects.requireNonNull(timestamp, "Timestamp cannot be null");
        Objects.requireNonNull(level, "Level cannot be null");
        Objects.requireNonNull(message, "Message cannot be null");
    }
}
