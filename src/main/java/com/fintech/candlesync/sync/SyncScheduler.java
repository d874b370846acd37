package com.fintech.candlesync.sync;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.connection.ConnectionSupervisor;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.source.SourceGateway;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.context.SmartLifecycle;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.util.List;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * Drives the collector on a single worker thread.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>Connect store and source. Failing here is the only fatal error: the context is closed
 *       and the process exits with status 1.</li>
 *   <li>Initial pass: backfill and gap repair for every configured series.</li>
 *   <li>Live loop: collect every series each cycle, repair gaps every Nth cycle, then wait
 *       for the collection interval.</li>
 *   <li>On context shutdown the wait is cut short, the loop exits between cycles and both
 *       connections are closed.</li>
 * </ol>
 */
@Component
@ConditionalOnProperty(name = "candle-sync.scheduler.enabled", havingValue = "true", matchIfMissing = true)
public class SyncScheduler implements SmartLifecycle {

    private static final Logger log = LoggerFactory.getLogger(SyncScheduler.class);

    private static final Duration SHUTDOWN_WAIT = Duration.ofSeconds(25);

    private final CandleSyncService syncService;
    private final SourceGateway gateway;
    private final ConnectionSupervisor sourceSupervisor;
    private final ConnectionSupervisor storeSupervisor;
    private final CollectionEventLog events;
    private final SyncProperties properties;
    private final ConfigurableApplicationContext context;

    private final CountDownLatch stopSignal = new CountDownLatch(1);
    private volatile boolean running = false;
    private volatile Thread worker;

    public SyncScheduler(
            CandleSyncService syncService,
            SourceGateway gateway,
            @Qualifier("sourceSupervisor") ConnectionSupervisor sourceSupervisor,
            @Qualifier("storeSupervisor") ConnectionSupervisor storeSupervisor,
            CollectionEventLog events,
            SyncProperties properties,
            ConfigurableApplicationContext context) {
        this.syncService = syncService;
        this.gateway = gateway;
        this.sourceSupervisor = sourceSupervisor;
        this.storeSupervisor = storeSupervisor;
        this.events = events;
        this.properties = properties;
        this.context = context;
    }

    @Override
    public void start() {
        running = true;
        worker = new Thread(this::run, "candle-sync-worker");
        worker.start();
        log.info("Candle sync scheduler started: series={}, interval={}",
                properties.series(), properties.getCollectionInterval());
    }

    @Override
    public void stop() {
        running = false;
        stopSignal.countDown();
        Thread current = worker;
        if (current != null && current != Thread.currentThread()) {
            try {
                current.join(SHUTDOWN_WAIT.toMillis());
                if (current.isAlive()) {
                    log.warn("Sync worker still busy after {}, leaving it to finish its call", SHUTDOWN_WAIT);
                }
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
        }
    }

    @Override
    public boolean isRunning() {
        return running;
    }

    private void run() {
        try {
            if (!startup()) {
                terminate();
                return;
            }
            initialPass();
            liveLoop();
        } catch (RuntimeException e) {
            log.error("Sync worker crashed", e);
        } finally {
            events.info("Stopping service...");
            sourceSupervisor.shutdown();
            storeSupervisor.shutdown();
            log.info("Service stopped");
            running = false;
        }
    }

    /**
     * Establishes both connections and logs the terminal identity.
     *
     * @return false if either connection could not be established
     */
    boolean startup() {
        if (!storeSupervisor.ensureConnected()) {
            log.error("Failed to connect to the candle store at startup");
            return false;
        }
        events.info("Service starting...");
        if (!sourceSupervisor.ensureConnected()) {
            events.error("Failed to connect to MT5 at startup");
            return false;
        }
        try {
            gateway.logIdentity();
        } catch (RuntimeException e) {
            events.error("MT5 connection test failed: " + e.getMessage());
            return false;
        }
        events.info("Initialization complete: instruments=" + properties.getInstruments()
            + ", timeframes=" + properties.getTimeframes()
            + ", collection interval=" + properties.getCollectionInterval());
        return true;
    }

    /**
     * Backfill then gap repair for every series, logging what each already holds.
     */
    void initialPass() {
        events.info("Starting initial historical data sync...");
        for (SeriesKey series : properties.series()) {
            if (stopRequested()) {
                return;
            }
            try {
                long existing = syncService.seriesStatus(series).storedCandles();
                log.info("{}: {} existing candles", series, existing);
            } catch (RuntimeException e) {
                log.warn("{}: could not count existing candles: {}", series, e.getMessage());
            }
            syncService.backfill(series);
            syncService.repairGaps(series);
        }
        events.info("Initial sync completed");
    }

    private void liveLoop() {
        events.info("Starting live data collection...");
        int cycle = 0;
        while (!stopRequested()) {
            cycle++;
            try {
                runCycle(cycle);
            } catch (RuntimeException e) {
                log.error("Error in live collection cycle {}", cycle, e);
            }
            if (awaitStop(properties.getCollectionInterval())) {
                break;
            }
        }
        log.info("Live collection stopped after {} cycles", cycle);
    }

    /**
     * One live cycle: collect every series, and repair gaps on every Nth cycle.
     */
    void runCycle(int cycle) {
        log.info("Collection cycle {} starting...", cycle);
        List<SeriesKey> allSeries = properties.series();
        int inserted = 0;
        for (SeriesKey series : allSeries) {
            inserted += syncService.collectLive(series).inserted();
        }

        int every = properties.getGapRepairEveryCycles();
        if (every > 0 && cycle % every == 0) {
            log.info("Running gap detection...");
            for (SeriesKey series : allSeries) {
                syncService.repairGaps(series);
            }
        }
        log.info("Collection cycle {} completed: {} new candles, waiting {}",
                cycle, inserted, properties.getCollectionInterval());
    }

    /**
     * Waits for the interval or until stop is signalled.
     *
     * @return true if stop was signalled
     */
    private boolean awaitStop(Duration interval) {
        try {
            return stopSignal.await(interval.toMillis(), TimeUnit.MILLISECONDS);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return true;
        }
    }

    private boolean stopRequested() {
        return stopSignal.getCount() == 0;
    }

    private void terminate() {
        log.error("Startup connectivity failed, shutting down");
        running = false;
        int exitCode = SpringApplication.exit(context, () -> 1);
        System.exit(exitCode);
    }
}
