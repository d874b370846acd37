package com.fintech.candlesync.config;

import com.fintech.candlesync.connection.ConnectionSupervisor;
import com.fintech.candlesync.connection.StoreConnection;
import com.fintech.candlesync.source.SourceGateway;
import com.fintech.candlesync.storage.CandleRepository;
import com.fintech.candlesync.sync.ChunkPlanner;
import com.fintech.candlesync.sync.GapDetector;
import io.github.resilience4j.retry.RetryConfig;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import org.springframework.boot.web.client.RestTemplateBuilder;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.web.client.RestTemplate;

import java.time.Clock;

/**
 * Spring configuration for core application beans.
 */
@Configuration
public class ApplicationConfig {

    @Bean
    public Clock clock() {
        return Clock.systemUTC();
    }

    @Bean
    public ChunkPlanner chunkPlanner(SyncProperties properties) {
        return new ChunkPlanner(properties.getMaxBarsPerCall(), properties.getMinChunkSpan());
    }

    @Bean
    public GapDetector gapDetector(CandleRepository repository, SyncProperties properties) {
        return new GapDetector(repository, properties.getGapTolerance());
    }

    @Bean
    public RestTemplate mt5RestTemplate(RestTemplateBuilder builder, SyncProperties properties) {
        SyncProperties.Source source = properties.getSource();
        return builder
            .rootUri(source.getBaseUrl())
            .setConnectTimeout(source.getConnectTimeout())
            .setReadTimeout(source.getReadTimeout())
            .build();
    }

    /**
     * Reconnect policy shared by both supervisors: a fixed delay between attempts,
     * retrying while the attempt reports {@code false}.
     */
    @Bean
    public RetryRegistry retryRegistry(SyncProperties properties) {
        RetryConfig config = RetryConfig.<Boolean>custom()
            .maxAttempts(Math.max(1, properties.getMaxReconnectAttempts()))
            .waitDuration(properties.getReconnectDelay())
            .retryOnResult(connected -> !connected)
            .build();
        return RetryRegistry.of(config);
    }

    @Bean
    public ConnectionSupervisor sourceSupervisor(SourceGateway gateway, RetryRegistry retryRegistry,
                                                 MeterRegistry meterRegistry) {
        return new ConnectionSupervisor(gateway, retryRegistry, meterRegistry);
    }

    @Bean
    public ConnectionSupervisor storeSupervisor(CandleRepository repository, RetryRegistry retryRegistry,
                                                MeterRegistry meterRegistry) {
        return new ConnectionSupervisor(new StoreConnection(repository), retryRegistry, meterRegistry);
    }
}
