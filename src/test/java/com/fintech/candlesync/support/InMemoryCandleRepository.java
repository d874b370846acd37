package com.fintech.candlesync.support;

import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.CollectionEvent;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.storage.CandleRepository;
import com.fintech.candlesync.storage.StorageIntegrityException;
import com.fintech.candlesync.storage.StoreUnavailableException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.NavigableMap;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

/**
 * Store double with insert-or-ignore semantics and switchable failures.
 */
public class InMemoryCandleRepository implements CandleRepository {

    private final Map<SeriesKey, NavigableMap<Instant, Candle>> series = new ConcurrentHashMap<>();
    private final List<CollectionEvent> events = new CopyOnWriteArrayList<>();

    private volatile boolean available = true;
    private volatile int failingInserts = 0;
    private volatile int reconnects = 0;

    @Override
    public int insertIgnore(List<Candle> candles) {
        requireAvailable();
        if (failingInserts > 0) {
            failingInserts--;
            throw new StorageIntegrityException("Insert rejected by schema", null);
        }
        int inserted = 0;
        for (Candle candle : candles) {
            NavigableMap<Instant, Candle> stored = series.computeIfAbsent(candle.series(), key -> new TreeMap<>());
            if (stored.putIfAbsent(candle.time(), candle) == null) {
                inserted++;
            }
        }
        return inserted;
    }

    @Override
    public Optional<Instant> findLatestTime(SeriesKey key) {
        requireAvailable();
        NavigableMap<Instant, Candle> stored = series.get(key);
        return stored == null || stored.isEmpty() ? Optional.empty() : Optional.of(stored.lastKey());
    }

    @Override
    public List<Candle> findByRange(SeriesKey key, Instant from, Instant to) {
        requireAvailable();
        NavigableMap<Instant, Candle> stored = series.get(key);
        if (stored == null) {
            return List.of();
        }
        return new ArrayList<>(stored.subMap(from, true, to, false).values());
    }

    @Override
    public List<Instant> findTimes(SeriesKey key, Instant from, Instant to) {
        return findByRange(key, from, to).stream().map(Candle::time).toList();
    }

    @Override
    public long count(SeriesKey key) {
        requireAvailable();
        NavigableMap<Instant, Candle> stored = series.get(key);
        return stored == null ? 0 : stored.size();
    }

    @Override
    public void logEvent(CollectionEvent event) {
        requireAvailable();
        events.add(event);
    }

    @Override
    public boolean isHealthy() {
        return available;
    }

    @Override
    public void reconnect() {
        reconnects++;
        requireAvailable();
    }

    @Override
    public void close() {
    }

    @Override
    public String backendName() {
        return "InMemory";
    }

    public void setAvailable(boolean available) {
        this.available = available;
    }

    public void failNextInserts(int count) {
        this.failingInserts = count;
    }

    public void delete(SeriesKey key, Instant from, Instant to) {
        NavigableMap<Instant, Candle> stored = series.get(key);
        if (stored != null) {
            stored.subMap(from, true, to, false).clear();
        }
    }

    public List<CollectionEvent> events() {
        return events;
    }

    public int reconnects() {
        return reconnects;
    }

    private void requireAvailable() {
        if (!available) {
            throw new StoreUnavailableException("In-memory store switched off", null);
        }
    }
}
