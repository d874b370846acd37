package com.fintech.candlesync.config;

import io.swagger.v3.oas.models.OpenAPI;
import io.swagger.v3.oas.models.info.Info;
import io.swagger.v3.oas.models.servers.Server;
import io.swagger.v3.oas.models.tags.Tag;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.List;

/**
 * Describes the read API served next to the collector.
 */
@Configuration
public class OpenApiConfig {

    @Bean
    public OpenAPI candleSyncOpenAPI(@Value("${server.port:8080}") int port,
                                     @Value("${candle-sync.storage.type:timescaledb}") String backend) {
        return new OpenAPI()
                .info(new Info()
                        .title("Candle Sync API")
                        .description("""
                                Closed OHLCV candles mirrored from an MT5 terminal into the %s store.

                                Candles are written only after the bar has closed, so the most recent
                                bar of each series lags the wall clock by at most one timeframe plus
                                one collection cycle. `/api/v1/series` reports how far each series has
                                been filled and whether the source and store connections are up.
                                """.formatted(backend))
                        .version("1.0.0"))
                .tags(List.of(
                        new Tag().name("Candle Data").description("Stored candles by instrument and timeframe"),
                        new Tag().name("Monitoring").description("Collector status")))
                .servers(List.of(new Server()
                        .url("http://localhost:" + port)
                        .description("Local collector")));
    }
}
