package com.fintech.candlesync.storage.timescaledb;

import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

/**
 * Spring Data JPA repository for TimescaleDB candle operations.
 */
@Repository
public interface CandleJpaRepository extends JpaRepository<CandleEntity, String> {

    /**
     * Inserts a candle unless a row with the same key already exists.
     * Never updates: {@code ON CONFLICT DO NOTHING} covers both the id and the
     * (instrument, timeframe, open_time) unique constraint.
     *
     * @return 1 if inserted, 0 if the candle was already stored
     */
    @Modifying
    @Query(value = "INSERT INTO candles " +
                   "(id, instrument, timeframe, open_time, open, high, low, close, volume, created_at, updated_at) " +
                   "VALUES (:id, :instrument, :timeframe, :openTime, :open, :high, :low, :close, :volume, :now, :now) " +
                   "ON CONFLICT DO NOTHING",
           nativeQuery = true)
    int insertIgnore(
        @Param("id") String id,
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe,
        @Param("openTime") long openTime,
        @Param("open") double open,
        @Param("high") double high,
        @Param("low") double low,
        @Param("close") double close,
        @Param("volume") long volume,
        @Param("now") long now
    );

    /**
     * Find candles within [fromTime, toTime), ordered by open time ascending.
     */
    @Query("SELECT c FROM CandleEntity c " +
           "WHERE c.instrument = :instrument " +
           "AND c.timeframe = :timeframe " +
           "AND c.openTime >= :fromTime " +
           "AND c.openTime < :toTime " +
           "ORDER BY c.openTime ASC")
    List<CandleEntity> findByRange(
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe,
        @Param("fromTime") long fromTime,
        @Param("toTime") long toTime
    );

    /**
     * Open times only, for gap detection over large windows.
     */
    @Query("SELECT c.openTime FROM CandleEntity c " +
           "WHERE c.instrument = :instrument " +
           "AND c.timeframe = :timeframe " +
           "AND c.openTime >= :fromTime " +
           "AND c.openTime < :toTime " +
           "ORDER BY c.openTime ASC")
    List<Long> findOpenTimes(
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe,
        @Param("fromTime") long fromTime,
        @Param("toTime") long toTime
    );

    long countByInstrumentAndTimeframe(String instrument, String timeframe);

    /**
     * Latest open time for an instrument-timeframe, the resume point for backfill.
     */
    @Query("SELECT MAX(c.openTime) FROM CandleEntity c " +
           "WHERE c.instrument = :instrument AND c.timeframe = :timeframe")
    Optional<Long> findLatestOpenTime(
        @Param("instrument") String instrument,
        @Param("timeframe") String timeframe
    );
}
