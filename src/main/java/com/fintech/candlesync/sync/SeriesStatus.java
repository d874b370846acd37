package com.fintech.candlesync.sync;

import com.fintech.candlesync.domain.Timeframe;

import java.time.Instant;

/**
 * Stored state of one series.
 *
 * @param highWaterMark Latest stored candle time, null when the series is empty
 */
public record SeriesStatus(
    String instrument,
    Timeframe timeframe,
    long storedCandles,
    Instant highWaterMark
) {
}
