package com.fintech.candlesync.storage;

import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.CollectionEvent;
import com.fintech.candlesync.domain.SeriesKey;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Repository interface for candle persistence operations.
 * Abstracts the underlying storage mechanism (TimescaleDB, Chronicle Map, ...) so the
 * sync engine never branches on which backend is active.
 *
 * <p>Connectivity failures surface as {@link StoreUnavailableException}; failed inserts that
 * are not duplicate keys surface as {@link StorageIntegrityException}.
 */
public interface CandleRepository {

    /**
     * Inserts candles with insert-or-ignore semantics on {@code (instrument, timeframe, time)}.
     * An existing candle is never overwritten.
     *
     * @param candles Candles to insert, in any order
     * @return Number of candles that were new
     */
    int insertIgnore(List<Candle> candles);

    /**
     * Returns the high-water mark of a series: the latest stored candle time.
     *
     * @param series The series
     * @return Latest stored time, empty if the series has no data
     */
    Optional<Instant> findLatestTime(SeriesKey series);

    /**
     * Retrieves candles of a series in {@code [from, to)}, ordered by time ascending.
     *
     * @param series The series
     * @param from Start of range (inclusive)
     * @param to End of range (exclusive)
     * @return Candles in the range, empty if none found
     */
    List<Candle> findByRange(SeriesKey series, Instant from, Instant to);

    /**
     * Retrieves only the stored times of a series in {@code [from, to)}, ascending.
     */
    List<Instant> findTimes(SeriesKey series, Instant from, Instant to);

    /**
     * Returns the number of candles stored for a series.
     */
    long count(SeriesKey series);

    /**
     * Appends an operational event to the collection log.
     */
    void logEvent(CollectionEvent event);

    /**
     * Actively probes the store with a trivial query.
     * Must not answer from a cached flag: a transport that reports itself open but no longer
     * answers queries is unhealthy.
     *
     * @return true if the store answered
     */
    boolean isHealthy();

    /**
     * Drops the current connections and establishes fresh ones.
     *
     * @throws StoreUnavailableException if the store cannot be reopened
     */
    void reconnect();

    /**
     * Releases connections. The repository may be reopened with {@link #reconnect()}.
     */
    void close();

    /**
     * Short name of the backend technology, for logs and the status API.
     */
    String backendName();
}
