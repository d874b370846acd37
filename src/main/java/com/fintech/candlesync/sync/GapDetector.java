package com.fintech.candlesync.sync;

import com.fintech.candlesync.domain.Gap;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.storage.CandleRepository;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Finds holes in stored series.
 *
 * <p>Two adjacent stored candles further apart than {@code tolerance x timeframe duration} form a
 * {@link Gap}. Exactly {@code tolerance x duration} apart is not a gap. Read-only.
 */
public class GapDetector {

    private final CandleRepository repository;
    private final double tolerance;

    public GapDetector(CandleRepository repository, double tolerance) {
        if (tolerance < 1.0) {
            throw new IllegalArgumentException("Gap tolerance must be at least 1.0: " + tolerance);
        }
        this.repository = repository;
        this.tolerance = tolerance;
    }

    /**
     * Reports gaps between stored candles of {@code series} in {@code [windowStart, windowEnd)}.
     */
    public List<Gap> detect(SeriesKey series, Instant windowStart, Instant windowEnd) {
        List<Instant> times = repository.findTimes(series, windowStart, windowEnd);
        return findGaps(times, series.timeframe(), tolerance);
    }

    /**
     * @param times Stored times, ascending
     */
    static List<Gap> findGaps(List<Instant> times, Timeframe timeframe, double tolerance) {
        List<Gap> gaps = new ArrayList<>();
        if (times.size() < 2) {
            return gaps;
        }
        long maxSpacingMillis = (long) Math.floor(tolerance * timeframe.toMillis());

        Instant previous = times.get(0);
        for (int i = 1; i < times.size(); i++) {
            Instant current = times.get(i);
            if (Duration.between(previous, current).toMillis() > maxSpacingMillis) {
                gaps.add(new Gap(previous, current));
            }
            previous = current;
        }
        return gaps;
    }
}
