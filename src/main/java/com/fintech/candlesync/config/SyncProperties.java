package com.fintech.candlesync.config;

import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;

/**
 * Externalized configuration for the candle sync service.
 * Maps to 'candle-sync.*' properties in application.yml.
 */
@Data
@Configuration
@ConfigurationProperties(prefix = "candle-sync")
public class SyncProperties {

    private List<String> instruments = new ArrayList<>(List.of("US30", "USTech"));
    private List<Timeframe> timeframes = new ArrayList<>(EnumSet.allOf(Timeframe.class));

    private Duration collectionInterval = Duration.ofSeconds(60);
    private int maxReconnectAttempts = 5;
    private Duration reconnectDelay = Duration.ofSeconds(10);

    private int lookbackDays = 365;
    private Duration backfillOverlap = Duration.ofDays(1);
    private int liveOverlapCount = 10;

    private int gapRepairEveryCycles = 10;
    private Duration gapLookback = Duration.ofDays(30);
    private double gapTolerance = 1.5;

    private int maxBarsPerCall = 50_000;
    private Duration minChunkSpan = Duration.ofDays(1);

    private Scheduler scheduler = new Scheduler();
    private Source source = new Source();
    private Storage storage = new Storage();

    /**
     * Expands the configured instruments and timeframes into series, instrument-major.
     */
    public List<SeriesKey> series() {
        List<SeriesKey> series = new ArrayList<>(instruments.size() * timeframes.size());
        for (String instrument : instruments) {
            for (Timeframe timeframe : timeframes) {
                series.add(new SeriesKey(instrument, timeframe));
            }
        }
        return series;
    }

    @Data
    public static class Scheduler {
        private boolean enabled = true;
    }

    @Data
    public static class Source {
        private String baseUrl = "http://localhost:8228";
        private long login;
        private String password = "";
        private String server = "";
        // Broker server clock minus UTC; MT5 reports bar times on the server clock
        private Duration serverTimeOffset = Duration.ZERO;
        private Duration connectTimeout = Duration.ofSeconds(5);
        private Duration readTimeout = Duration.ofSeconds(60);
    }

    @Data
    public static class Storage {
        private String type = "timescaledb";
        private Chronicle chronicle = new Chronicle();

        @Data
        public static class Chronicle {
            private String path = "data/candles.dat";
            private String eventsPath = "data/collection-events.dat";
            private long entries = 5_000_000L;
            private long eventEntries = 1_000_000L;
        }
    }
}
