package com.fintech.candlesync.support;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.connection.ConnectionSupervisor;
import com.fintech.candlesync.connection.StoreConnection;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.source.SourceGateway;
import com.fintech.candlesync.sync.CandleSyncService;
import com.fintech.candlesync.sync.ChunkPlanner;
import com.fintech.candlesync.sync.CollectionEventLog;
import com.fintech.candlesync.sync.GapDetector;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

/**
 * Wires the sync engine by hand around an in-memory store and a fake source.
 */
public class SyncEngineFixture {

    /** A Monday, on an hour boundary. */
    public static final Instant NOW = Instant.parse("2024-03-11T12:00:00Z");

    public final Clock clock;
    public final SyncProperties properties;
    public final InMemoryCandleRepository repository;
    public final FakeMarketDataSource source;
    public final SimpleMeterRegistry meterRegistry;
    public final SourceGateway gateway;
    public final ConnectionSupervisor sourceSupervisor;
    public final ConnectionSupervisor storeSupervisor;
    public final CollectionEventLog events;
    public final ChunkPlanner chunkPlanner;
    public final CandleSyncService syncService;

    public SyncEngineFixture() {
        this(defaultProperties(), NOW);
    }

    public SyncEngineFixture(SyncProperties properties, Instant now) {
        this.clock = Clock.fixed(now, ZoneOffset.UTC);
        this.properties = properties;
        this.repository = new InMemoryCandleRepository();
        this.source = new FakeMarketDataSource(clock);
        this.meterRegistry = new SimpleMeterRegistry();

        RetryRegistry retryRegistry = RetryRegistry.of(RetryConfig.<Boolean>custom()
            .maxAttempts(2)
            .waitDuration(Duration.ofMillis(1))
            .retryOnResult(connected -> !connected)
            .build());

        this.gateway = new SourceGateway(source, properties, meterRegistry);
        this.sourceSupervisor = new ConnectionSupervisor(gateway, retryRegistry, meterRegistry);
        this.storeSupervisor = new ConnectionSupervisor(new StoreConnection(repository), retryRegistry, meterRegistry);
        this.events = new CollectionEventLog(repository, new ObjectMapper().findAndRegisterModules(), clock);
        this.chunkPlanner = new ChunkPlanner(properties.getMaxBarsPerCall(), properties.getMinChunkSpan());
        GapDetector gapDetector = new GapDetector(repository, properties.getGapTolerance());
        this.syncService = new CandleSyncService(gateway, repository, chunkPlanner, gapDetector,
            sourceSupervisor, storeSupervisor, events, properties, clock, meterRegistry);
    }

    public static SyncProperties defaultProperties() {
        SyncProperties properties = new SyncProperties();
        properties.setInstruments(List.of("US30"));
        properties.setTimeframes(List.of(Timeframe.H1));
        properties.setLookbackDays(5);
        properties.setBackfillOverlap(Duration.ofDays(1));
        properties.setLiveOverlapCount(10);
        properties.setGapLookback(Duration.ofDays(30));
        properties.setGapTolerance(1.5);
        properties.setMaxBarsPerCall(50_000);
        properties.setMinChunkSpan(Duration.ofDays(1));
        properties.setMaxReconnectAttempts(2);
        properties.setReconnectDelay(Duration.ofMillis(1));
        return properties;
    }
}
