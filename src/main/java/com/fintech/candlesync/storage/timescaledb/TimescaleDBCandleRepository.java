package com.fintech.candlesync.storage.timescaledb;

import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.CollectionEvent;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.storage.CandleRepository;
import com.fintech.candlesync.storage.StorageIntegrityException;
import com.fintech.candlesync.storage.StoreException;
import com.fintech.candlesync.storage.StoreUnavailableException;
import com.zaxxer.hikari.HikariDataSource;
import com.zaxxer.hikari.HikariPoolMXBean;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.RecoverableDataAccessException;
import org.springframework.dao.TransientDataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

import javax.sql.DataSource;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import java.util.stream.Collectors;

/**
 * TimescaleDB (PostgreSQL) implementation of CandleRepository.
 *
 * Inserts go through a native {@code ON CONFLICT DO NOTHING} statement so overlapping
 * fetches are safe to write repeatedly. Each batch runs in one transaction: a failure
 * other than a duplicate key rolls the whole batch back.
 */
@Repository
@ConditionalOnProperty(name = "candle-sync.storage.type", havingValue = "timescaledb", matchIfMissing = true)
public class TimescaleDBCandleRepository implements CandleRepository {

    private static final Logger log = LoggerFactory.getLogger(TimescaleDBCandleRepository.class);

    private final CandleJpaRepository candleJpaRepository;
    private final CollectionEventJpaRepository eventJpaRepository;
    private final JdbcTemplate jdbcTemplate;
    private final DataSource dataSource;
    private final TransactionTemplate transactionTemplate;
    private final Clock clock;

    private final AtomicLong insertedCounter = new AtomicLong(0);
    private final AtomicLong ignoredCounter = new AtomicLong(0);
    private final AtomicLong writeErrorCounter = new AtomicLong(0);
    private final Timer writeTimer;
    private final Timer readTimer;

    public TimescaleDBCandleRepository(
            CandleJpaRepository candleJpaRepository,
            CollectionEventJpaRepository eventJpaRepository,
            JdbcTemplate jdbcTemplate,
            DataSource dataSource,
            PlatformTransactionManager transactionManager,
            MeterRegistry meterRegistry,
            Clock clock) {
        this.candleJpaRepository = candleJpaRepository;
        this.eventJpaRepository = eventJpaRepository;
        this.jdbcTemplate = jdbcTemplate;
        this.dataSource = dataSource;
        this.transactionTemplate = new TransactionTemplate(transactionManager);
        this.clock = clock;

        meterRegistry.gauge("timescaledb.candles.inserted.total", insertedCounter);
        meterRegistry.gauge("timescaledb.candles.ignored.total", ignoredCounter);
        meterRegistry.gauge("timescaledb.candles.write.errors", writeErrorCounter);

        this.writeTimer = meterRegistry.timer("timescaledb.candles.write.latency");
        this.readTimer = meterRegistry.timer("timescaledb.candles.read.latency");

        log.info("TimescaleDB candle repository initialized");
    }

    @Override
    public int insertIgnore(List<Candle> candles) {
        if (candles.isEmpty()) {
            return 0;
        }
        return writeTimer.record(() -> {
            try {
                Integer inserted = transactionTemplate.execute(status -> {
                    long now = clock.millis();
                    int count = 0;
                    for (Candle candle : candles) {
                        count += insertOne(candle, now);
                    }
                    return count;
                });
                int result = inserted != null ? inserted : 0;
                insertedCounter.addAndGet(result);
                ignoredCounter.addAndGet(candles.size() - result);

                if (log.isDebugEnabled()) {
                    log.debug("TimescaleDB insert: batch={}, inserted={}", candles.size(), result);
                }
                return result;
            } catch (RuntimeException e) {
                writeErrorCounter.incrementAndGet();
                log.error("Failed to insert candle batch into TimescaleDB: size={}", candles.size(), e);
                throw translate("Insert of " + candles.size() + " candles", e, true);
            }
        });
    }

    private int insertOne(Candle candle, long now) {
        String timeframe = candle.timeframe().name();
        long openTime = candle.time().toEpochMilli();
        return candleJpaRepository.insertIgnore(
            CandleEntity.generateId(candle.instrument(), timeframe, openTime),
            candle.instrument(),
            timeframe,
            openTime,
            candle.open(),
            candle.high(),
            candle.low(),
            candle.close(),
            candle.volume(),
            now
        );
    }

    @Override
    public Optional<Instant> findLatestTime(SeriesKey series) {
        return read("Latest time lookup for " + series, () ->
            candleJpaRepository.findLatestOpenTime(series.instrument(), series.timeframe().name())
                .map(Instant::ofEpochMilli));
    }

    @Override
    public List<Candle> findByRange(SeriesKey series, Instant from, Instant to) {
        return read("Range query for " + series, () -> {
            List<CandleEntity> entities = candleJpaRepository.findByRange(
                series.instrument(),
                series.timeframe().name(),
                from.toEpochMilli(),
                to.toEpochMilli()
            );

            if (log.isDebugEnabled()) {
                log.debug("TimescaleDB range query: series={}, from={}, to={}, results={}",
                         series, from, to, entities.size());
            }

            return entities.stream()
                .map(this::fromEntity)
                .collect(Collectors.toList());
        });
    }

    @Override
    public List<Instant> findTimes(SeriesKey series, Instant from, Instant to) {
        return read("Time scan for " + series, () ->
            candleJpaRepository.findOpenTimes(
                    series.instrument(),
                    series.timeframe().name(),
                    from.toEpochMilli(),
                    to.toEpochMilli())
                .stream()
                .map(Instant::ofEpochMilli)
                .collect(Collectors.toList()));
    }

    @Override
    public long count(SeriesKey series) {
        return read("Count for " + series, () ->
            candleJpaRepository.countByInstrumentAndTimeframe(series.instrument(), series.timeframe().name()));
    }

    @Override
    public void logEvent(CollectionEvent event) {
        try {
            eventJpaRepository.save(CollectionEventEntity.builder()
                .loggedAt(event.timestamp())
                .level(event.level().name())
                .instrument(event.instrument())
                .timeframe(event.timeframe() != null ? event.timeframe().name() : null)
                .message(event.message())
                .details(event.details())
                .build());
        } catch (RuntimeException e) {
            throw translate("Event log write", e, false);
        }
    }

    @Override
    public boolean isHealthy() {
        try {
            Integer one = jdbcTemplate.queryForObject("SELECT 1", Integer.class);
            return one != null && one == 1;
        } catch (Exception e) {
            log.warn("TimescaleDB health check failed: {}", e.getMessage());
            return false;
        }
    }

    @Override
    public void reconnect() {
        evictPooledConnections();
        if (!isHealthy()) {
            throw new StoreUnavailableException("TimescaleDB did not answer after reconnect", null);
        }
        log.info("TimescaleDB connection pool refreshed");
    }

    @Override
    public void close() {
        // The pool itself belongs to Spring and is closed with the context
        evictPooledConnections();
    }

    @Override
    public String backendName() {
        return "TimescaleDB";
    }

    /**
     * Drops pooled connections so the next borrow opens a fresh socket.
     * Connections that report themselves open but no longer answer are discarded this way.
     */
    private void evictPooledConnections() {
        try {
            if (dataSource.isWrapperFor(HikariDataSource.class)) {
                HikariPoolMXBean pool = dataSource.unwrap(HikariDataSource.class).getHikariPoolMXBean();
                if (pool != null) {
                    pool.softEvictConnections();
                }
            }
        } catch (SQLException e) {
            log.warn("Could not evict pooled connections: {}", e.getMessage());
        }
    }

    private <T> T read(String operation, Supplier<T> query) {
        return readTimer.record(() -> {
            try {
                return query.get();
            } catch (RuntimeException e) {
                log.error("{} failed", operation, e);
                throw translate(operation, e, false);
            }
        });
    }

    /**
     * Maps Spring's data access hierarchy onto the store taxonomy:
     * connectivity problems are retryable, everything else on a write is an integrity failure.
     */
    static StoreException translate(String operation, RuntimeException e, boolean write) {
        if (e instanceof DataAccessResourceFailureException
                || e instanceof TransientDataAccessException
                || e instanceof RecoverableDataAccessException
                || e instanceof CannotCreateTransactionException) {
            return new StoreUnavailableException(operation + " failed: store unreachable", e);
        }
        if (write) {
            return new StorageIntegrityException(operation + " failed", e);
        }
        return new StoreException(operation + " failed", e);
    }

    private Candle fromEntity(CandleEntity entity) {
        return new Candle(
            entity.getInstrument(),
            Timeframe.valueOf(entity.getTimeframe()),
            Instant.ofEpochMilli(entity.getOpenTime()),
            entity.getOpen(),
            entity.getHigh(),
            entity.getLow(),
            entity.getClose(),
            entity.getVolume()
        );
    }
}
