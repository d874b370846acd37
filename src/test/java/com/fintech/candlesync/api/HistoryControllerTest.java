package com.fintech.candlesync.api;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.storage.CandleRepository;
import com.fintech.candlesync.storage.StoreUnavailableException;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.context.TestConfiguration;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.context.annotation.Bean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.hasSize;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(HistoryController.class)
@DisplayName("HistoryController Tests")
class HistoryControllerTest {

    private static final long FROM = 1704067200L; // 2024-01-01T00:00:00Z
    private static final long TO = FROM + 7200;

    @TestConfiguration
    static class MetricsTestConfig {
        @Bean
        MeterRegistry meterRegistry() {
            return new SimpleMeterRegistry();
        }
    }

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CandleRepository repository;

    @MockBean
    private SyncProperties properties;

    @BeforeEach
    void setUp() {
        when(properties.getInstruments()).thenReturn(List.of("US30", "USTech"));
    }

    @Test
    @DisplayName("Should return candles in columnar format")
    void testValidRequest() throws Exception {
        SeriesKey series = new SeriesKey("US30", Timeframe.H1);
        Instant from = Instant.ofEpochSecond(FROM);
        when(repository.findByRange(series, from, Instant.ofEpochSecond(TO))).thenReturn(List.of(
            new Candle("US30", Timeframe.H1, from, 37689.5, 37720.0, 37680.2, 37702.1, 1250L),
            new Candle("US30", Timeframe.H1, from.plusSeconds(3600), 37702.1, 37711.4, 37690.0, 37695.3, 980L)));

        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "US30")
                .param("timeframe", "H1")
                .param("from", String.valueOf(FROM))
                .param("to", String.valueOf(TO)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.s").value("ok"))
            .andExpect(jsonPath("$.t", hasSize(2)))
            .andExpect(jsonPath("$.t[0]").value(FROM))
            .andExpect(jsonPath("$.t[1]").value(FROM + 3600))
            .andExpect(jsonPath("$.o[0]").value(37689.5))
            .andExpect(jsonPath("$.c[1]").value(37695.3))
            .andExpect(jsonPath("$.v[0]").value(1250));
    }

    @Test
    @DisplayName("Should accept other instrument casings and timeframe spellings")
    void testCanonicalizesInstrument() throws Exception {
        when(repository.findByRange(any(), any(), any())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "ustech")
                .param("timeframe", "15m")
                .param("from", String.valueOf(FROM))
                .param("to", String.valueOf(TO)))
            .andExpect(status().isOk());

        verify(repository).findByRange(new SeriesKey("USTech", Timeframe.M15),
            Instant.ofEpochSecond(FROM), Instant.ofEpochSecond(TO));
    }

    @Test
    @DisplayName("Should answer no_data for an empty range")
    void testNoData() throws Exception {
        when(repository.findByRange(any(), any(), any())).thenReturn(List.of());

        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "US30")
                .param("timeframe", "H1")
                .param("from", String.valueOf(FROM))
                .param("to", String.valueOf(TO)))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.s").value("no_data"))
            .andExpect(jsonPath("$.t", hasSize(0)));
    }

    @Test
    @DisplayName("Should reject an instrument that is not collected")
    void testUnknownInstrument() throws Exception {
        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "BTCUSD")
                .param("timeframe", "H1")
                .param("from", String.valueOf(FROM))
                .param("to", String.valueOf(TO)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"))
            .andExpect(jsonPath("$.message", containsString("Unsupported instrument")));

        verify(repository, never()).findByRange(any(), any(), any());
    }

    @Test
    @DisplayName("Should reject an unsupported timeframe")
    void testUnsupportedTimeframe() throws Exception {
        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "US30")
                .param("timeframe", "W1")
                .param("from", String.valueOf(FROM))
                .param("to", String.valueOf(TO)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("INVALID_ARGUMENT"));
    }

    @Test
    @DisplayName("Should reject from >= to")
    void testInvertedRange() throws Exception {
        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "US30")
                .param("timeframe", "H1")
                .param("from", String.valueOf(TO))
                .param("to", String.valueOf(FROM)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString("must be less than")));
    }

    @Test
    @DisplayName("Should reject ranges with too many bars")
    void testRangeTooLarge() throws Exception {
        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "US30")
                .param("timeframe", "M1")
                .param("from", String.valueOf(FROM))
                .param("to", String.valueOf(FROM + 60L * 50_001)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.message", containsString("Time range too large")));
    }

    @Test
    @DisplayName("Should report a missing parameter")
    void testMissingParameter() throws Exception {
        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "US30")
                .param("from", String.valueOf(FROM))
                .param("to", String.valueOf(TO)))
            .andExpect(status().isBadRequest())
            .andExpect(jsonPath("$.error").value("MISSING_PARAMETER"));
    }

    @Test
    @DisplayName("Should answer 503 while the store is unavailable")
    void testStoreUnavailable() throws Exception {
        when(repository.findByRange(any(), any(), any()))
            .thenThrow(new StoreUnavailableException("Range query failed: store unreachable", null));

        mockMvc.perform(get("/api/v1/history")
                .param("instrument", "US30")
                .param("timeframe", "H1")
                .param("from", String.valueOf(FROM))
                .param("to", String.valueOf(TO)))
            .andExpect(status().isServiceUnavailable())
            .andExpect(jsonPath("$.error").value("STORE_UNAVAILABLE"));
    }
}
