package com.fintech.candlesync.sync;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.connection.ConnectionSupervisor;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.Chunk;
import com.fintech.candlesync.domain.Gap;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.source.InstrumentNotFoundException;
import com.fintech.candlesync.source.RejectedRecord;
import com.fintech.candlesync.source.SourceErrorKind;
import com.fintech.candlesync.source.SourceException;
import com.fintech.candlesync.source.SourceGateway;
import com.fintech.candlesync.storage.CandleRepository;
import com.fintech.candlesync.storage.StorageIntegrityException;
import com.fintech.candlesync.storage.StoreUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

/**
 * Synchronization engine: keeps each stored series complete and current.
 *
 * <p>Three entry points, all idempotent and safe to re-run:
 * <ul>
 *   <li>{@link #backfill} resumes from the high-water mark minus an overlap, or from the lookback horizon</li>
 *   <li>{@link #repairGaps} re-fetches every hole found in a bounded window</li>
 *   <li>{@link #collectLive} inserts the newest closed candles</li>
 * </ul>
 *
 * <p>Both supervisors are consulted before any work. Every failure is contained to the series
 * it happened in: it is logged with the series and yields an empty result. Only closed candles
 * are stored; the bar still forming at {@code now} is left for a later pass.
 */
@Service
public class CandleSyncService {

    private static final Logger log = LoggerFactory.getLogger(CandleSyncService.class);

    private final SourceGateway gateway;
    private final CandleRepository repository;
    private final ChunkPlanner chunkPlanner;
    private final GapDetector gapDetector;
    private final ConnectionSupervisor sourceSupervisor;
    private final ConnectionSupervisor storeSupervisor;
    private final CollectionEventLog events;
    private final SyncProperties properties;
    private final Clock clock;

    private final AtomicLong fetchedTotal = new AtomicLong(0);
    private final AtomicLong insertedTotal = new AtomicLong(0);
    private final AtomicLong gapsRepairedTotal = new AtomicLong(0);
    private final AtomicLong skippedUnits = new AtomicLong(0);

    public CandleSyncService(
            SourceGateway gateway,
            CandleRepository repository,
            ChunkPlanner chunkPlanner,
            GapDetector gapDetector,
            @Qualifier("sourceSupervisor") ConnectionSupervisor sourceSupervisor,
            @Qualifier("storeSupervisor") ConnectionSupervisor storeSupervisor,
            CollectionEventLog events,
            SyncProperties properties,
            Clock clock,
            MeterRegistry meterRegistry) {
        this.gateway = gateway;
        this.repository = repository;
        this.chunkPlanner = chunkPlanner;
        this.gapDetector = gapDetector;
        this.sourceSupervisor = sourceSupervisor;
        this.storeSupervisor = storeSupervisor;
        this.events = events;
        this.properties = properties;
        this.clock = clock;

        meterRegistry.gauge("candle.sync.fetched.total", fetchedTotal);
        meterRegistry.gauge("candle.sync.inserted.total", insertedTotal);
        meterRegistry.gauge("candle.sync.gaps.repaired.total", gapsRepairedTotal);
        meterRegistry.gauge("candle.sync.units.skipped", skippedUnits);
    }

    // ---------------------------------------------------------------------
    // Backfill
    // ---------------------------------------------------------------------

    public SyncResult backfill(SeriesKey series) {
        return backfill(series, properties.getLookbackDays());
    }

    /**
     * Fetches {@code [resume, start of the forming bar)} in chunks and inserts what is new.
     * Resume is the high-water mark minus the backfill overlap, or {@code now - lookbackDays}
     * for an empty series.
     */
    public SyncResult backfill(SeriesKey series, int lookbackDays) {
        if (!connected(series, "backfill")) {
            return SyncResult.EMPTY;
        }
        try {
            String nativeSymbol = gateway.resolveInstrument(series.instrument());
            Instant now = clock.instant();
            Instant end = series.timeframe().alignDown(now);
            Instant resume = resumePoint(series, lookbackDays, now);
            if (!resume.isBefore(end)) {
                return SyncResult.EMPTY;
            }

            List<Candle> candles = closedOnly(
                chunkPlanner.fetchInChunks(series, resume, end,
                    chunk -> gateway.fetchRange(series, nativeSymbol, chunk.start(), chunk.end())),
                now);
            if (candles.isEmpty()) {
                events.warning(series, "No historical data to sync", Map.of(
                    "from", resume.toString(),
                    "to", end.toString()));
                return SyncResult.EMPTY;
            }

            int inserted = store(candles);
            events.info(series, "Historical sync complete: " + inserted + " new candles inserted", Map.of(
                "inserted", inserted,
                "total_fetched", candles.size()));
            return new SyncResult(candles.size(), inserted);
        } catch (RuntimeException e) {
            handleFailure(series, "Backfill", e);
            return SyncResult.EMPTY;
        } finally {
            reportRejected();
        }
    }

    /**
     * Start of the next backfill window for {@code series}.
     */
    Instant resumePoint(SeriesKey series, int lookbackDays, Instant now) {
        Optional<Instant> highWater = repository.findLatestTime(series);
        if (highWater.isPresent()) {
            Instant resume = highWater.get().minus(properties.getBackfillOverlap());
            log.info("{}: resuming from last candle {} (fetching from {})", series, highWater.get(), resume);
            return resume;
        }
        Instant start = now.minus(Duration.ofDays(lookbackDays));
        log.info("{}: no existing data, fetching from {}", series, start);
        return start;
    }

    // ---------------------------------------------------------------------
    // Gap repair
    // ---------------------------------------------------------------------

    /**
     * Detects gaps in {@code [highWater - gapLookback, now)} and re-fetches each one.
     * Gaps are repaired independently: one failing gap does not stop the others.
     */
    public GapRepairResult repairGaps(SeriesKey series) {
        if (!connected(series, "gap repair")) {
            return GapRepairResult.EMPTY;
        }
        try {
            Optional<Instant> highWater = repository.findLatestTime(series);
            if (highWater.isEmpty()) {
                log.info("{}: no data exists for gap detection", series);
                return GapRepairResult.EMPTY;
            }

            Instant now = clock.instant();
            Instant windowStart = highWater.get().minus(properties.getGapLookback());
            List<Gap> gaps = gapDetector.detect(series, windowStart, now);
            if (gaps.isEmpty()) {
                log.info("{}: no gaps detected since {}", series, windowStart);
                return GapRepairResult.EMPTY;
            }

            events.warning(series, "Detected " + gaps.size() + " gaps in data", Map.of("gap_count", gaps.size()));
            String nativeSymbol = gateway.resolveInstrument(series.instrument());

            int repaired = 0;
            int failed = 0;
            int insertedCount = 0;
            for (Gap gap : gaps) {
                try {
                    int inserted = fillGap(series, nativeSymbol, gap, now);
                    repaired++;
                    insertedCount += inserted;
                } catch (RuntimeException e) {
                    failed++;
                    handleFailure(series, "Repair of gap " + gap.start() + " .. " + gap.end(), e);
                }
            }
            gapsRepairedTotal.addAndGet(repaired);

            if (failed > 0) {
                log.warn("{}: {} of {} gaps could not be repaired", series, failed, gaps.size());
            }
            return new GapRepairResult(gaps.size(), repaired, failed, insertedCount);
        } catch (RuntimeException e) {
            handleFailure(series, "Gap repair", e);
            return GapRepairResult.EMPTY;
        } finally {
            reportRejected();
        }
    }

    private int fillGap(SeriesKey series, String nativeSymbol, Gap gap, Instant now) {
        // Both ends are stored already; fetch only the bars between them
        Chunk missing = new Chunk(gap.start().plus(series.timeframe().duration()), gap.end());
        log.info("{}: filling gap from {} to {}", series, gap.start(), gap.end());

        List<Candle> candles = closedOnly(
            chunkPlanner.fetchInChunks(series, missing.start(), missing.end(),
                chunk -> gateway.fetchRange(series, nativeSymbol, chunk.start(), chunk.end())),
            now);
        if (candles.isEmpty()) {
            log.info("{}: source has no candles between {} and {}", series, gap.start(), gap.end());
            return 0;
        }

        int inserted = store(candles);
        events.info(series, "Gap filled: " + inserted + " candles inserted", Map.of(
            "gap_start", gap.start().toString(),
            "gap_end", gap.end().toString(),
            "inserted", inserted));
        return inserted;
    }

    // ---------------------------------------------------------------------
    // Live collection
    // ---------------------------------------------------------------------

    public SyncResult collectLive(SeriesKey series) {
        return collectLive(series, properties.getLiveOverlapCount());
    }

    /**
     * Fetches the latest {@code count} candles and inserts the new ones. The overlap with
     * the previous cycle absorbs a tail candle that was still forming last time.
     */
    public SyncResult collectLive(SeriesKey series, int count) {
        if (!connected(series, "live collection")) {
            return SyncResult.EMPTY;
        }
        try {
            String nativeSymbol = gateway.resolveInstrument(series.instrument());
            Instant now = clock.instant();
            List<Candle> candles = closedOnly(gateway.fetchLatest(series, nativeSymbol, count), now);
            if (candles.isEmpty()) {
                events.warning(series, "No live data collected", null);
                return SyncResult.EMPTY;
            }

            int inserted = store(candles);
            if (inserted > 0) {
                events.info(series, "Live data collected: " + inserted + " new candles", Map.of("inserted", inserted));
            }
            return new SyncResult(candles.size(), inserted);
        } catch (RuntimeException e) {
            handleFailure(series, "Live collection", e);
            return SyncResult.EMPTY;
        } finally {
            reportRejected();
        }
    }

    // ---------------------------------------------------------------------
    // Status
    // ---------------------------------------------------------------------

    /**
     * Returns the stored count and high-water mark of a series.
     *
     * @throws com.fintech.candlesync.storage.StoreException if the store cannot be read
     */
    public SeriesStatus seriesStatus(SeriesKey series) {
        long count = repository.count(series);
        Instant highWater = repository.findLatestTime(series).orElse(null);
        return new SeriesStatus(series.instrument(), series.timeframe(), count, highWater);
    }

    // ---------------------------------------------------------------------
    // Helpers
    // ---------------------------------------------------------------------

    private boolean connected(SeriesKey series, String operation) {
        if (!storeSupervisor.ensureConnected()) {
            skippedUnits.incrementAndGet();
            log.error("{}: skipping {}, store unavailable", series, operation);
            return false;
        }
        if (!sourceSupervisor.ensureConnected()) {
            skippedUnits.incrementAndGet();
            events.error(series, "Skipping " + operation + ": source unavailable", null);
            return false;
        }
        return true;
    }

    private int store(List<Candle> candles) {
        int inserted = repository.insertIgnore(candles);
        fetchedTotal.addAndGet(candles.size());
        insertedTotal.addAndGet(inserted);
        return inserted;
    }

    /**
     * Records each source bar dropped as malformed, so a hole that repair can never fill
     * is explained in the collection log.
     */
    private void reportRejected() {
        for (RejectedRecord record : gateway.drainRejected()) {
            Map<String, Object> details = new LinkedHashMap<>();
            details.put("time", record.time() != null ? record.time().toString() : null);
            details.put("reason", record.reason());
            events.warning(record.series(), "Rejected malformed source record", details);
        }
    }

    private static List<Candle> closedOnly(List<Candle> candles, Instant now) {
        return candles.stream()
            .filter(candle -> !candle.closeTime().isAfter(now))
            .collect(Collectors.toList());
    }

    /**
     * Logs a contained failure and marks the failing side for reconnection.
     */
    private void handleFailure(SeriesKey series, String operation, RuntimeException e) {
        skippedUnits.incrementAndGet();
        if (e instanceof InstrumentNotFoundException) {
            // Reported once when the resolution failed
            log.debug("{}: {} skipped, instrument not available", series, operation);
            return;
        }
        if (e instanceof SourceException sourceError) {
            if (sourceError.kind() == SourceErrorKind.CONNECTIVITY) {
                sourceSupervisor.markDisconnected();
            }
            events.error(series, operation + " failed: " + e.getMessage(), Map.of("kind", sourceError.kind().name()));
            return;
        }
        if (e instanceof StoreUnavailableException) {
            storeSupervisor.markDisconnected();
            events.error(series, operation + " failed, store unavailable: " + e.getMessage(), null);
            return;
        }
        if (e instanceof StorageIntegrityException) {
            events.error(series, operation + " failed, batch lost: " + e.getMessage(), null);
            return;
        }
        log.error("{}: {} failed unexpectedly", series, operation, e);
        events.error(series, operation + " failed: " + e, null);
    }
}
