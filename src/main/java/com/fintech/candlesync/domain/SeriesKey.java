package com.fintech.candlesync.domain;

import java.util.Objects;

/**
 * Identity of one candle time series: an instrument at a timeframe.
 * Every sync operation is scoped to exactly one series.
 * Implements natural ordering by instrument, then timeframe.
 */
public record SeriesKey(
    String instrument,
    Timeframe timeframe
) implements Comparable<SeriesKey> {

    public SeriesKey {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(timeframe, "Timeframe cannot be null");
        if (instrument.isBlank()) {
            throw new IllegalArgumentException("Instrument cannot be blank");
        }
    }

    @Override
    public int compareTo(SeriesKey other) {
        int instrumentCompare = this.instrument.compareTo(other.instrument);
        if (instrumentCompare != 0) {
            return instrumentCompare;
        }
        return this.timeframe.compareTo(other.timeframe);
    }

    /**
     * Creates a string prefix suitable for key-value stores.
     * Format: "INSTRUMENT-TIMEFRAME-"
     */
    public String toKeyPrefix() {
        return instrument + "-" + timeframe.name() + "-";
    }

    @Override
    public String toString() {
        return instrument + " " + timeframe.name();
    }
}
