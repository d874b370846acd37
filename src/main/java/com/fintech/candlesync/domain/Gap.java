package com.fintech.candlesync.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Missing range between two adjacent stored candles.
 * Derived on every detection pass, never persisted.
 *
 * @param start Time of the last stored candle before the hole
 * @param end Time of the first stored candle after the hole
 */
public record Gap(Instant start, Instant end) {

    public Gap {
        Objects.requireNonNull(start, "Gap start cannot be null");
        Objects.requireNonNull(end, "Gap end cannot be null");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Gap end " + end + " must be after start " + start);
        }
    }

    public Duration length() {
        return Duration.between(start, end);
    }
}
