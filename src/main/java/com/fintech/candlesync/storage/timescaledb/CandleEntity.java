package com.fintech.candlesync.storage.timescaledb;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * JPA entity for TimescaleDB candle persistence.
 *
 * Rows are written only through {@link CandleJpaRepository#insertIgnore}, never merged,
 * so a stored candle is immutable.
 */
@Entity
@Table(
    name = "candles",
    indexes = {
        @Index(name = "idx_candles_instrument_timeframe_time", columnList = "instrument, timeframe, open_time"),
        @Index(name = "idx_candles_time", columnList = "open_time")
    },
    uniqueConstraints = {
        @UniqueConstraint(name = "uk_candle", columnNames = {"instrument", "timeframe", "open_time"})
    }
)
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class CandleEntity {

    /**
     * Composite primary key: instrument_timeframe_openTime
     * Example: "US30_H1_1703000000000"
     */
    @Id
    @Column(length = 100)
    private String id;

    @Column(nullable = false, length = 64)
    private String instrument;

    /**
     * Timeframe name (M1, M5, ..., D1)
     */
    @Column(nullable = false, length = 8)
    private String timeframe;

    /**
     * Bar open time (Unix epoch milliseconds, UTC)
     */
    @Column(name = "open_time", nullable = false)
    private Long openTime;

    @Column(nullable = false)
    private Double open;

    @Column(nullable = false)
    private Double high;

    @Column(nullable = false)
    private Double low;

    @Column(nullable = false)
    private Double close;

    /**
     * Tick volume
     */
    @Column(nullable = false)
    private Long volume;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Long createdAt;

    @Column(name = "updated_at", nullable = false)
    private Long updatedAt;

    /**
     * Generates composite ID from instrument, timeframe, and open time.
     */
    public static String generateId(String instrument, String timeframe, long openTime) {
        return String.format("%s_%s_%d", instrument, timeframe, openTime);
    }
}
