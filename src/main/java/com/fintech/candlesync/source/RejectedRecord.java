package com.fintech.candlesync.source;

import com.fintech.candlesync.domain.SeriesKey;

import java.time.Instant;

/**
 * A provider record that could not be turned into a candle.
 *
 * @param time UTC open time, null when the record carried none
 */
public record RejectedRecord(SeriesKey series, Instant time, String reason) {
}
