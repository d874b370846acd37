package com.fintech.candlesync.source;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.connection.ManagedConnection;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import io.micrometer.core.instrument.MeterRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Queue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Front door to the market data source.
 *
 * Responsibilities:
 * - Instrument resolution with a process-lifetime cache (hits and misses)
 * - Session handling and liveness probing, as a supervised connection
 * - Range and latest-N fetches normalized into UTC {@link Candle}s
 *
 * Never touches the store.
 */
@Service
public class SourceGateway implements ManagedConnection {

    private static final Logger log = LoggerFactory.getLogger(SourceGateway.class);

    private final MarketDataSource source;
    private final SyncProperties.Source settings;
    private final SymbolResolver resolver = new SymbolResolver();

    // Lower-case instrument -> native symbol, empty when the provider has no match
    private final Map<String, Optional<String>> resolutions = new ConcurrentHashMap<>();

    // Malformed records awaiting drainRejected()
    private final Queue<RejectedRecord> rejected = new ConcurrentLinkedQueue<>();

    private final AtomicLong fetchedRecords = new AtomicLong(0);
    private final AtomicLong malformedRecords = new AtomicLong(0);

    public SourceGateway(MarketDataSource source, SyncProperties properties, MeterRegistry meterRegistry) {
        this.source = source;
        this.settings = properties.getSource();

        meterRegistry.gauge("candle.sync.source.records.fetched", fetchedRecords);
        meterRegistry.gauge("candle.sync.source.records.malformed", malformedRecords);
    }

    // ---------------------------------------------------------------------
    // Connection
    // ---------------------------------------------------------------------

    @Override
    public String name() {
        return "source";
    }

    /**
     * Opens a session with the configured account. With no login configured the terminal's
     * current session is used as is.
     */
    @Override
    public void connect() {
        if (settings.getLogin() > 0) {
            source.login(settings.getLogin(), settings.getPassword(), settings.getServer());
        }
        AccountInfo account = source.accountInfo();
        log.info("Connected to MT5 account {} on {} (balance {} {})",
                account.login(), account.server(), account.balance(), account.currency());
    }

    @Override
    public void disconnect() {
        source.logout();
        log.info("Disconnected from MT5");
    }

    /**
     * Returns true iff the source answers an account query.
     */
    @Override
    public boolean probe() {
        try {
            source.accountInfo();
            return true;
        } catch (SourceException e) {
            log.debug("Source probe failed: {}", e.getMessage());
            return false;
        }
    }

    /**
     * Logs the terminal and account the service is attached to.
     */
    public void logIdentity() {
        TerminalInfo terminal = source.terminalInfo();
        AccountInfo account = source.accountInfo();
        log.info("MT5 terminal: name={}, company={}, path={}; account={} on {}",
                terminal.name(), terminal.company(), terminal.path(), account.login(), account.server());
    }

    // ---------------------------------------------------------------------
    // Instrument resolution
    // ---------------------------------------------------------------------

    /**
     * Maps a user-facing instrument to the provider's native symbol and selects it in
     * Market Watch. Results are cached for the process lifetime; an instrument that does not
     * resolve, or whose symbol the terminal refuses to select, is never retried.
     *
     * @throws InstrumentNotFoundException if no native symbol matches or it cannot be selected
     * @throws SourceException if the symbol directory cannot be read (not cached)
     */
    public String resolveInstrument(String instrument) {
        String key = instrument.trim().toLowerCase(Locale.ROOT);
        Optional<String> resolution = resolutions.get(key);
        if (resolution == null) {
            resolution = resolver.resolve(instrument, source.symbols());
            if (resolution.isPresent() && !select(resolution.get())) {
                log.error("Source symbol {} for {} cannot be selected, skipping it until restart",
                        resolution.get(), instrument);
                resolution = Optional.empty();
            } else if (resolution.isPresent()) {
                log.info("Resolved instrument {} to source symbol {}", instrument, resolution.get());
            } else {
                log.error("Instrument {} not available from source, skipping it until restart", instrument);
            }
            resolutions.put(key, resolution);
        }
        return resolution.orElseThrow(() -> new InstrumentNotFoundException(instrument));
    }

    // NOT_FOUND is as final as a refusal; anything else is left to the caller uncached
    private boolean select(String nativeSymbol) {
        try {
            return source.selectSymbol(nativeSymbol);
        } catch (SourceException e) {
            if (e.kind() == SourceErrorKind.NOT_FOUND) {
                return false;
            }
            throw e;
        }
    }

    // ---------------------------------------------------------------------
    // Fetching
    // ---------------------------------------------------------------------

    /**
     * Fetches candles of {@code series} with open time in {@code [start, end)}.
     *
     * @param nativeSymbol Symbol returned by {@link #resolveInstrument(String)}
     * @throws SourceException with kind {@link SourceErrorKind#INVALID_RANGE} if the provider rejects the window
     */
    public List<Candle> fetchRange(SeriesKey series, String nativeSymbol, Instant start, Instant end) {
        Duration offset = settings.getServerTimeOffset();
        List<RawRate> rates = source.ratesRange(nativeSymbol, series.timeframe(), start.plus(offset), end.plus(offset));
        return normalize(series, rates, start, end);
    }

    /**
     * Fetches the most recent {@code count} candles of {@code series}, oldest first.
     */
    public List<Candle> fetchLatest(SeriesKey series, String nativeSymbol, int count) {
        List<RawRate> rates = source.ratesLatest(nativeSymbol, series.timeframe(), count);
        return normalize(series, rates, null, null);
    }

    /**
     * Converts raw records into candles. A malformed record is logged and skipped; records
     * outside {@code [start, end)} are dropped when a window is given.
     */
    List<Candle> normalize(SeriesKey series, List<RawRate> rates, Instant start, Instant end) {
        List<Candle> candles = new ArrayList<>(rates.size());
        int outsideWindow = 0;
        for (RawRate rate : rates) {
            Candle candle;
            try {
                candle = toCandle(series, rate);
            } catch (RuntimeException e) {
                malformedRecords.incrementAndGet();
                log.warn("Skipping malformed {} record {}: {}", series, rate, e.getMessage());
                rejected.add(new RejectedRecord(series, serverTimeToUtc(rate), String.valueOf(e.getMessage())));
                continue;
            }
            if (start != null && (candle.time().isBefore(start) || !candle.time().isBefore(end))) {
                outsideWindow++;
                continue;
            }
            candles.add(candle);
        }
        fetchedRecords.addAndGet(candles.size());

        if (outsideWindow > 0 && log.isDebugEnabled()) {
            log.debug("Dropped {} {} records outside [{}, {})", outsideWindow, series, start, end);
        }
        return candles;
    }

    /**
     * Returns and forgets the records skipped by fetches since the last call.
     */
    public List<RejectedRecord> drainRejected() {
        List<RejectedRecord> drained = new ArrayList<>();
        RejectedRecord record;
        while ((record = rejected.poll()) != null) {
            drained.add(record);
        }
        return drained;
    }

    private Instant serverTimeToUtc(RawRate rate) {
        if (rate == null || rate.time() == null) {
            return null;
        }
        return Instant.ofEpochSecond(rate.time()).minus(settings.getServerTimeOffset());
    }

    private Candle toCandle(SeriesKey series, RawRate rate) {
        Objects.requireNonNull(rate, "record is null");
        Objects.requireNonNull(rate.time(), "time missing");
        Objects.requireNonNull(rate.tickVolume(), "tick_volume missing");

        // Provider times are on the broker server clock
        Instant time = serverTimeToUtc(rate);
        Timeframe timeframe = series.timeframe();
        return new Candle(
            series.instrument(),
            timeframe,
            time,
            Objects.requireNonNull(rate.open(), "open missing"),
            Objects.requireNonNull(rate.high(), "high missing"),
            Objects.requireNonNull(rate.low(), "low missing"),
            Objects.requireNonNull(rate.close(), "close missing"),
            rate.tickVolume()
        );
    }
}
