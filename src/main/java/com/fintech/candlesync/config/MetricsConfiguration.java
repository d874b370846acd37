package com.fintech.candlesync.config;

import io.micrometer.core.instrument.Meter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.config.MeterFilter;
import io.micrometer.core.instrument.distribution.DistributionStatisticConfig;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.actuate.autoconfigure.metrics.MeterRegistryCustomizer;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.Arrays;

/**
 * Common tags and latency buckets for the collector's timers.
 *
 * Store timers cover single batch writes and range reads; API timers wrap a
 * whole history request including the store read.
 */
@Configuration
public class MetricsConfiguration {

    private static final long[] STORE_BUCKETS_MS = {1, 5, 25, 100, 500, 2_000, 10_000};
    private static final long[] API_BUCKETS_MS = {5, 25, 100, 250, 1_000, 5_000};

    @Bean
    public MeterRegistryCustomizer<MeterRegistry> candleSyncMeterCustomizer(
            @Value("${spring.application.name:candle-sync-service}") String application,
            @Value("${candle-sync.storage.type:timescaledb}") String storage) {
        return registry -> registry.config()
            .commonTags("application", application, "storage", storage)
            .meterFilter(latencyBuckets("timescaledb.", STORE_BUCKETS_MS))
            .meterFilter(latencyBuckets("api.", API_BUCKETS_MS));
    }

    private static MeterFilter latencyBuckets(String prefix, long[] bucketsMs) {
        return new MeterFilter() {
            @Override
            public DistributionStatisticConfig configure(Meter.Id id, DistributionStatisticConfig config) {
                if (id.getType() != Meter.Type.TIMER || !id.getName().startsWith(prefix)) {
                    return config;
                }
                double[] slos = Arrays.stream(bucketsMs)
                    .mapToDouble(ms -> Duration.ofMillis(ms).toNanos())
                    .toArray();
                return DistributionStatisticConfig.builder()
                    .percentiles(0.5, 0.95, 0.99)
                    .serviceLevelObjectives(slos)
                    .percentilesHistogram(true)
                    // a few collection cycles
                    .expiry(Duration.ofMinutes(5))
                    .bufferLength(3)
                    .build()
                    .merge(config);
            }
        };
    }
}
