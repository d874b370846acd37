package com.fintech.candlesync.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Objects;

/**
 * Half-open fetch window {@code [start, end)} sized to respect the source's per-request limit.
 */
public record Chunk(Instant start, Instant end) {

    public Chunk {
        Objects.requireNonNull(start, "Chunk start cannot be null");
        Objects.requireNonNull(end, "Chunk end cannot be null");
        if (!end.isAfter(start)) {
            throw new IllegalArgumentException("Chunk end " + end + " must be after start " + start);
        }
    }

    public Duration span() {
        return Duration.between(start, end);
    }

    /** Returns true if {@code instant} falls in {@code [start, end)}. */
    public boolean contains(Instant instant) {
        return !instant.isBefore(start) && instant.isBefore(end);
    }
}
