package com.fintech.candlesync.api;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.connection.ConnectionSupervisor;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.storage.CandleRepository;
import com.fintech.candlesync.sync.CandleSyncService;
import com.fintech.candlesync.sync.SeriesStatus;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.tags.Tag;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;
import java.util.Map;

/**
 * Collection status: what each configured series holds and how both connections are doing.
 */
@RestController
@RequestMapping("/api/v1")
@Tag(name = "Monitoring", description = "Collector status")
public class SeriesStatusController {

    private final CandleSyncService syncService;
    private final CandleRepository repository;
    private final ConnectionSupervisor sourceSupervisor;
    private final ConnectionSupervisor storeSupervisor;
    private final SyncProperties properties;

    public SeriesStatusController(
            CandleSyncService syncService,
            CandleRepository repository,
            @Qualifier("sourceSupervisor") ConnectionSupervisor sourceSupervisor,
            @Qualifier("storeSupervisor") ConnectionSupervisor storeSupervisor,
            SyncProperties properties) {
        this.syncService = syncService;
        this.repository = repository;
        this.sourceSupervisor = sourceSupervisor;
        this.storeSupervisor = storeSupervisor;
        this.properties = properties;
    }

    @Operation(
        summary = "Get status of every configured series",
        description = "Stored candle count and latest candle time per series, plus connection states."
    )
    @GetMapping("/series")
    public ResponseEntity<StatusResponse> getSeries() {
        List<SeriesStatus> series = properties.series().stream()
            .map(syncService::seriesStatus)
            .toList();

        return ResponseEntity.ok(new StatusResponse(
            repository.backendName(),
            Map.of(
                sourceSupervisor.name(), sourceSupervisor.state().name(),
                storeSupervisor.name(), storeSupervisor.state().name()),
            series));
    }

    @Schema(description = "Collector status")
    public record StatusResponse(
        @Schema(description = "Active store backend", example = "TimescaleDB")
        String backend,

        @Schema(description = "Connection state by connection name", example = "{\"source\": \"CONNECTED\", \"store\": \"CONNECTED\"}")
        Map<String, String> connections,

        @Schema(description = "One entry per configured instrument and timeframe")
        List<SeriesStatus> series
    ) {}
}
