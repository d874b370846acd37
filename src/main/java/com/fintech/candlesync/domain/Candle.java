package com.fintech.candlesync.domain;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Immutable OHLCV bar for one instrument and timeframe.
 * Identity is {@code (instrument, timeframe, time)}; once stored a candle is never updated.
 * Serializable for off-heap Chronicle Map persistence.
 *
 * @param instrument User-facing instrument symbol (e.g. "US30"), never the provider's native name
 * @param timeframe Bar interval
 * @param time Bar open time in UTC
 * @param open First price in the bar
 * @param high Maximum price (must be >= open, close, low)
 * @param low Minimum price (must be <= open, close, high)
 * @param close Last price in the bar
 * @param volume Tick volume
 */
public record Candle(
    String instrument,
    Timeframe timeframe,
    Instant time,
    double open,
    double high,
    double low,
    double close,
    long volume
) implements Serializable {

    /**
     * Validates identity fields and OHLC invariants.
     */
    public Candle {
        Objects.requireNonNull(instrument, "Instrument cannot be null");
        Objects.requireNonNull(timeframe, "Timeframe cannot be null");
        Objects.requireNonNull(time, "Time cannot be null");

        if (high < low) {
            throw new IllegalArgumentException(
                "High price (" + high + ") cannot be less than low price (" + low + ")"
            );
        }
        if (high < open || high < close) {
            throw new IllegalArgumentException(
                "High price (" + high + ") must be >= open (" + open + ") and close (" + close + ")"
            );
        }
        if (low > open || low > close) {
            throw new IllegalArgumentException(
                "Low price (" + low + ") must be <= open (" + open + ") and close (" + close + ")"
            );
        }
        if (volume < 0) {
            throw new IllegalArgumentException("Volume cannot be negative: " + volume);
        }
    }

    /** Returns the series this candle belongs to. */
    public SeriesKey series() {
        return new SeriesKey(instrument, timeframe);
    }

    /** Returns the exclusive end of the bar: time + timeframe duration. */
    public Instant closeTime() {
        return time.plus(timeframe.duration());
    }
}
