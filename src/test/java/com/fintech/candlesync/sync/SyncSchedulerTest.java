package com.fintech.candlesync.sync;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.connection.ConnectionSupervisor;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.source.SourceErrorKind;
import com.fintech.candlesync.source.SourceException;
import com.fintech.candlesync.source.SourceGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.InOrder;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.mockito.junit.jupiter.MockitoSettings;
import org.mockito.quality.Strictness;
import org.springframework.context.ConfigurableApplicationContext;

import java.time.Duration;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.inOrder;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.timeout;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
@MockitoSettings(strictness = Strictness.LENIENT)
@DisplayName("SyncScheduler Tests")
class SyncSchedulerTest {

    private static final SeriesKey US30_H1 = new SeriesKey("US30", Timeframe.H1);
    private static final SeriesKey US30_D1 = new SeriesKey("US30", Timeframe.D1);

    @Mock
    private CandleSyncService syncService;

    @Mock
    private SourceGateway gateway;

    @Mock
    private ConnectionSupervisor sourceSupervisor;

    @Mock
    private ConnectionSupervisor storeSupervisor;

    @Mock
    private CollectionEventLog events;

    @Mock
    private ConfigurableApplicationContext context;

    private SyncProperties properties;
    private SyncScheduler scheduler;

    @BeforeEach
    void setUp() {
        properties = new SyncProperties();
        properties.setInstruments(List.of("US30"));
        properties.setTimeframes(List.of(Timeframe.H1, Timeframe.D1));
        properties.setGapRepairEveryCycles(3);
        properties.setCollectionInterval(Duration.ofMillis(10));

        when(syncService.collectLive(any())).thenReturn(new SyncResult(10, 1));
        when(syncService.seriesStatus(any())).thenReturn(new SeriesStatus("US30", Timeframe.H1, 0, null));

        scheduler = new SyncScheduler(syncService, gateway, sourceSupervisor, storeSupervisor,
            events, properties, context);
    }

    @Test
    @DisplayName("Startup should connect the store before the source")
    void testStartupOrder() {
        when(storeSupervisor.ensureConnected()).thenReturn(true);
        when(sourceSupervisor.ensureConnected()).thenReturn(true);

        assertThat(scheduler.startup()).isTrue();

        InOrder order = inOrder(storeSupervisor, sourceSupervisor, gateway);
        order.verify(storeSupervisor).ensureConnected();
        order.verify(sourceSupervisor).ensureConnected();
        order.verify(gateway).logIdentity();
    }

    @Test
    @DisplayName("Startup should fail when the store cannot be reached")
    void testStartupStoreFailure() {
        when(storeSupervisor.ensureConnected()).thenReturn(false);

        assertThat(scheduler.startup()).isFalse();
        verify(sourceSupervisor, never()).ensureConnected();
    }

    @Test
    @DisplayName("Startup should fail when the source cannot be reached")
    void testStartupSourceFailure() {
        when(storeSupervisor.ensureConnected()).thenReturn(true);
        when(sourceSupervisor.ensureConnected()).thenReturn(false);

        assertThat(scheduler.startup()).isFalse();
        verify(events).error("Failed to connect to MT5 at startup");
    }

    @Test
    @DisplayName("Startup should fail when the terminal identity cannot be read")
    void testStartupIdentityFailure() {
        when(storeSupervisor.ensureConnected()).thenReturn(true);
        when(sourceSupervisor.ensureConnected()).thenReturn(true);
        doThrow(new SourceException(SourceErrorKind.CONNECTIVITY, "terminal gone")).when(gateway).logIdentity();

        assertThat(scheduler.startup()).isFalse();
    }

    @Test
    @DisplayName("Initial pass should backfill then repair every series in order")
    void testInitialPass() {
        scheduler.initialPass();

        InOrder order = inOrder(syncService);
        order.verify(syncService).backfill(US30_H1);
        order.verify(syncService).repairGaps(US30_H1);
        order.verify(syncService).backfill(US30_D1);
        order.verify(syncService).repairGaps(US30_D1);
    }

    @Test
    @DisplayName("Initial pass should continue when a series cannot be counted")
    void testInitialPassCountFailure() {
        when(syncService.seriesStatus(US30_H1)).thenThrow(new IllegalStateException("store closed"));

        scheduler.initialPass();

        verify(syncService).backfill(US30_H1);
        verify(syncService).backfill(US30_D1);
    }

    @Test
    @DisplayName("Gap repair should run only on every Nth cycle")
    void testGapRepairCadence() {
        scheduler.runCycle(1);
        scheduler.runCycle(2);
        verify(syncService, never()).repairGaps(any());

        scheduler.runCycle(3);
        verify(syncService).repairGaps(US30_H1);
        verify(syncService).repairGaps(US30_D1);
        verify(syncService, times(3)).collectLive(US30_H1);
    }

    @Test
    @DisplayName("Gap repair cadence of zero should disable periodic repair")
    void testGapRepairDisabled() {
        properties.setGapRepairEveryCycles(0);

        scheduler.runCycle(10);

        verify(syncService, never()).repairGaps(any());
    }

    @Test
    @DisplayName("Stop should end the worker and close both connections")
    void testStartStop() {
        when(storeSupervisor.ensureConnected()).thenReturn(true);
        when(sourceSupervisor.ensureConnected()).thenReturn(true);

        scheduler.start();
        assertThat(scheduler.isRunning()).isTrue();
        verify(syncService, timeout(2000).atLeastOnce()).collectLive(US30_H1);

        scheduler.stop();

        assertThat(scheduler.isRunning()).isFalse();
        verify(sourceSupervisor).shutdown();
        verify(storeSupervisor).shutdown();
        verify(events).info("Stopping service...");
    }

    @Test
    @DisplayName("Initial pass should stop early once stop was requested")
    void testInitialPassAfterStop() {
        scheduler.stop();

        scheduler.initialPass();

        verify(syncService, never()).backfill(any());
    }
}
