package com.fintech.candlesync;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Candle Sync Service
 *
 * Keeps a gap-free, duplicate-free store of OHLCV candles pulled from an MT5 terminal.
 *
 * Key Features:
 * - Resumable historical backfill with adaptive chunking
 * - Gap detection and repair over a rolling window
 * - Live collection on a fixed cadence
 * - Supervised reconnects for both source and store
 * - TimescaleDB or Chronicle Map storage
 * - TradingView-compatible history API, Prometheus metrics
 *
 * @since 1.0.0
 */
@SpringBootApplication
public class CandleSyncApplication {

    public static void main(String[] args) {
        SpringApplication.run(CandleSyncApplication.class, args);
    }
}
