package com.fintech.candlesync.storage.chronicle;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.CollectionEvent;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.storage.CandleRepository;
import com.fintech.candlesync.storage.StorageIntegrityException;
import com.fintech.candlesync.storage.StoreException;
import com.fintech.candlesync.storage.StoreUnavailableException;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import net.openhft.chronicle.hash.ChronicleHashClosedException;
import net.openhft.chronicle.map.ChronicleMap;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Repository;

import java.io.File;
import java.io.IOException;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;

/**
 * Chronicle Map implementation of CandleRepository.
 *
 * Embedded, file-backed storage for single-node deployments without a database:
 * - {@code putIfAbsent} gives insert-or-ignore on the candle key
 * - a second map keyed by sequence number holds the newest collection events
 * - files are recovered on restart
 */
@Repository
@ConditionalOnProperty(name = "candle-sync.storage.type", havingValue = "chronicle")
public class ChronicleMapCandleRepository implements CandleRepository {

    private static final Logger log = LoggerFactory.getLogger(ChronicleMapCandleRepository.class);

    private static final String HEALTH_CHECK_KEY = "HEALTH-CHECK";
    private static final String SAMPLE_KEY = "USTECH-M15-1700000000000";

    private final SyncProperties.Storage.Chronicle settings;
    private volatile ChronicleMap<String, Candle> candleMap;
    private volatile ChronicleMap<Long, CollectionEvent> eventMap;
    private final AtomicLong eventSequence = new AtomicLong(0);
    private final AtomicLong writeCounter = new AtomicLong(0);
    private final AtomicLong readCounter = new AtomicLong(0);

    public ChronicleMapCandleRepository(SyncProperties properties) {
        this.settings = properties.getStorage().getChronicle();
    }

    @PostConstruct
    public void initialize() {
        try {
            open();
        } catch (IOException e) {
            log.error("Failed to initialize Chronicle Map", e);
            throw new StoreUnavailableException("Chronicle Map initialization failed", e);
        }
    }

    private synchronized void open() throws IOException {
        File dataFile = ensureParent(new File(settings.getPath()));
        File eventsFile = ensureParent(new File(settings.getEventsPath()));

        candleMap = ChronicleMap
            .of(String.class, Candle.class)
            .name("candle-storage")
            .entries(settings.getEntries())
            .averageKey(SAMPLE_KEY)
            .averageValueSize(400)
            .createOrRecoverPersistedTo(dataFile);

        eventMap = ChronicleMap
            .of(Long.class, CollectionEvent.class)
            .name("collection-events")
            .entries(settings.getEventEntries())
            .averageValueSize(512)
            .createOrRecoverPersistedTo(eventsFile);

        long lastSequence = eventMap.keySet().stream().mapToLong(Long::longValue).max().orElse(0L);
        eventSequence.set(lastSequence);

        log.info("Chronicle Map initialized: path={}, existing_entries={}, events={}",
                dataFile.getAbsolutePath(), candleMap.size(), eventMap.size());
    }

    private File ensureParent(File file) {
        File parentDir = file.getParentFile();
        if (parentDir != null && !parentDir.exists()) {
            boolean created = parentDir.mkdirs();
            if (created) {
                log.info("Created Chronicle Map data directory: {}", parentDir.getAbsolutePath());
            }
        }
        return file;
    }

    @Override
    public int insertIgnore(List<Candle> candles) {
        return guardedWrite("Insert of " + candles.size() + " candles", () -> {
            int inserted = 0;
            for (Candle candle : candles) {
                if (candleMap.putIfAbsent(createKey(candle), candle) == null) {
                    inserted++;
                }
            }
            writeCounter.addAndGet(inserted);

            if (log.isTraceEnabled()) {
                log.trace("Chronicle insert: batch={}, inserted={}", candles.size(), inserted);
            }
            return inserted;
        });
    }

    @Override
    public Optional<Instant> findLatestTime(SeriesKey series) {
        return guarded("Latest time lookup for " + series, () -> {
            readCounter.incrementAndGet();
            String prefix = series.toKeyPrefix();
            return candleMap.entrySet().stream()
                .filter(entry -> entry.getKey().startsWith(prefix))
                .map(entry -> entry.getValue().time())
                .max(Comparator.naturalOrder());
        });
    }

    @Override
    public List<Candle> findByRange(SeriesKey series, Instant from, Instant to) {
        return guarded("Range query for " + series, () -> {
            readCounter.incrementAndGet();

            // No native range queries, so scan with a prefix filter
            String prefix = series.toKeyPrefix();
            List<Candle> results = new ArrayList<>();
            for (var entry : candleMap.entrySet()) {
                if (entry.getKey().startsWith(prefix)) {
                    Candle candle = entry.getValue();
                    if (!candle.time().isBefore(from) && candle.time().isBefore(to)) {
                        results.add(candle);
                    }
                }
            }
            results.sort(Comparator.comparing(Candle::time));

            if (log.isDebugEnabled()) {
                log.debug("Range query: series={}, from={}, to={}, results={}", series, from, to, results.size());
            }
            return results;
        });
    }

    @Override
    public List<Instant> findTimes(SeriesKey series, Instant from, Instant to) {
        return findByRange(series, from, to).stream()
            .map(Candle::time)
            .toList();
    }

    @Override
    public long count(SeriesKey series) {
        return guarded("Count for " + series, () -> {
            String prefix = series.toKeyPrefix();
            return candleMap.keySet().stream()
                .filter(key -> key.startsWith(prefix))
                .count();
        });
    }

    /**
     * Appends to the collection log, keeping only the newest {@code eventEntries} events
     * so the fixed-capacity map never fills up.
     */
    @Override
    public void logEvent(CollectionEvent event) {
        guardedWrite("Event log write", () -> {
            long sequence = eventSequence.incrementAndGet();
            eventMap.put(sequence, event);
            long evicted = sequence - settings.getEventEntries();
            if (evicted > 0) {
                eventMap.remove(evicted);
            }
            return sequence;
        });
    }

    @Override
    public boolean isHealthy() {
        try {
            // A closed map throws on access, so this read doubles as the liveness probe
            candleMap.containsKey(HEALTH_CHECK_KEY);
            eventMap.size();
            return true;
        } catch (Exception e) {
            log.warn("Chronicle Map health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public synchronized void reconnect() {
        close();
        try {
            open();
        } catch (IOException e) {
            throw new StoreUnavailableException("Chronicle Map could not be reopened", e);
        }
    }

    @Override
    @PreDestroy
    public synchronized void close() {
        if (candleMap != null && candleMap.isOpen()) {
            log.info("Closing Chronicle Map: total_writes={}, total_reads={}",
                    writeCounter.get(), readCounter.get());
            candleMap.close();
        }
        if (eventMap != null && eventMap.isOpen()) {
            eventMap.close();
        }
    }

    @Override
    public String backendName() {
        return "ChronicleMap";
    }

    /**
     * Creates a unique key for Chronicle Map storage.
     * Format: INSTRUMENT-TIMEFRAME-EPOCHMILLIS
     */
    private String createKey(Candle candle) {
        return candle.series().toKeyPrefix() + candle.time().toEpochMilli();
    }

    private <T> T guarded(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (ChronicleHashClosedException e) {
            throw new StoreUnavailableException(operation + " failed: Chronicle Map closed", e);
        } catch (RuntimeException e) {
            log.error("{} failed", operation, e);
            throw new StoreException(operation + " failed", e);
        }
    }

    /**
     * Like {@link #guarded}, but a write that fails on an open map (full segment tiers,
     * value larger than the configured size) loses the batch instead of the connection.
     */
    private <T> T guardedWrite(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (ChronicleHashClosedException e) {
            throw new StoreUnavailableException(operation + " failed: Chronicle Map closed", e);
        } catch (RuntimeException e) {
            log.error("{} failed", operation, e);
            throw new StorageIntegrityException(operation + " failed: " + e.getMessage(), e);
        }
    }
}
