package com.fintech.candlesync.sync;

import com.fintech.candlesync.domain.Chunk;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.source.SourceErrorKind;
import com.fintech.candlesync.source.SourceException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits a fetch window into chunks the source accepts in one call.
 *
 * <p>The initial chunk span is {@code timeframe duration x maxBarsPerCall}. When the source
 * rejects a chunk as an invalid range, the span is halved (never below {@code minChunkSpan})
 * and the same start is retried; the smaller span is kept for the rest of the window. A chunk
 * that is still rejected at the floor is skipped with a warning.
 */
public class ChunkPlanner {

    private static final Logger log = LoggerFactory.getLogger(ChunkPlanner.class);

    /**
     * Fetches one chunk.
     */
    @FunctionalInterface
    public interface ChunkFetcher<T> {
        List<T> fetch(Chunk chunk);
    }

    private final int maxBarsPerCall;
    private final Duration minChunkSpan;

    public ChunkPlanner(int maxBarsPerCall, Duration minChunkSpan) {
        if (maxBarsPerCall <= 0) {
            throw new IllegalArgumentException("maxBarsPerCall must be positive: " + maxBarsPerCall);
        }
        if (minChunkSpan.isNegative() || minChunkSpan.isZero()) {
            throw new IllegalArgumentException("minChunkSpan must be positive: " + minChunkSpan);
        }
        this.maxBarsPerCall = maxBarsPerCall;
        this.minChunkSpan = minChunkSpan;
    }

    public Duration chunkSpan(Timeframe timeframe) {
        return timeframe.duration().multipliedBy(maxBarsPerCall);
    }

    /**
     * Returns the chunks tiling {@code [start, end)} for the timeframe's initial span.
     */
    public List<Chunk> plan(Timeframe timeframe, Instant start, Instant end) {
        return plan(start, end, chunkSpan(timeframe));
    }

    /**
     * Returns consecutive chunks {@code [cursor, min(end, cursor + span))} covering
     * {@code [start, end)} without overlap. Empty when {@code start >= end}.
     */
    public static List<Chunk> plan(Instant start, Instant end, Duration span) {
        if (span.isNegative() || span.isZero()) {
            throw new IllegalArgumentException("Chunk span must be positive: " + span);
        }
        List<Chunk> chunks = new ArrayList<>();
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            Instant chunkEnd = min(end, cursor.plus(span));
            chunks.add(new Chunk(cursor, chunkEnd));
            cursor = chunkEnd;
        }
        return chunks;
    }

    /**
     * Walks {@code [start, end)} chunk by chunk and concatenates what {@code fetcher} returns.
     *
     * @throws SourceException for any source error other than an invalid range
     */
    public <T> List<T> fetchInChunks(SeriesKey series, Instant start, Instant end, ChunkFetcher<T> fetcher) {
        Duration span = chunkSpan(series.timeframe());
        // A configured span already below the floor is never shrunk
        Duration floor = span.compareTo(minChunkSpan) < 0 ? span : minChunkSpan;

        List<T> results = new ArrayList<>();
        int skipped = 0;
        Instant cursor = start;
        while (cursor.isBefore(end)) {
            Chunk chunk = new Chunk(cursor, min(end, cursor.plus(span)));
            try {
                results.addAll(fetcher.fetch(chunk));
            } catch (SourceException e) {
                if (e.kind() != SourceErrorKind.INVALID_RANGE) {
                    throw e;
                }
                if (span.compareTo(floor) > 0) {
                    Duration halved = span.dividedBy(2);
                    span = halved.compareTo(floor) < 0 ? floor : halved;
                    log.info("{}: source rejected chunk {} .. {}, shrinking chunk span to {}",
                            series, chunk.start(), chunk.end(), span);
                    continue;
                }
                skipped++;
                log.warn("{}: skipping {} .. {}, source rejects it even at the minimum chunk span {}: {}",
                        series, chunk.start(), chunk.end(), floor, e.getMessage());
            }
            cursor = chunk.end();
        }

        if (skipped > 0) {
            log.warn("{}: {} chunk(s) skipped in {} .. {}", series, skipped, start, end);
        }
        return results;
    }

    private static Instant min(Instant a, Instant b) {
        return a.isBefore(b) ? a : b;
    }
}
