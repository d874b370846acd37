package com.fintech.candlesync.api;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.connection.ConnectionState;
import com.fintech.candlesync.connection.ConnectionSupervisor;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.storage.CandleRepository;
import com.fintech.candlesync.sync.CandleSyncService;
import com.fintech.candlesync.sync.SeriesStatus;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;

import static org.hamcrest.Matchers.hasSize;
import static org.hamcrest.Matchers.nullValue;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(SeriesStatusController.class)
@DisplayName("SeriesStatusController Tests")
class SeriesStatusControllerTest {

    @Autowired
    private MockMvc mockMvc;

    @MockBean
    private CandleSyncService syncService;

    @MockBean
    private CandleRepository repository;

    @MockBean(name = "sourceSupervisor")
    private ConnectionSupervisor sourceSupervisor;

    @MockBean(name = "storeSupervisor")
    private ConnectionSupervisor storeSupervisor;

    @MockBean
    private SyncProperties properties;

    @Test
    @DisplayName("Should report every configured series and both connections")
    void testSeriesStatus() throws Exception {
        SeriesKey h1 = new SeriesKey("US30", Timeframe.H1);
        SeriesKey d1 = new SeriesKey("US30", Timeframe.D1);
        when(properties.series()).thenReturn(List.of(h1, d1));
        when(syncService.seriesStatus(h1))
            .thenReturn(new SeriesStatus("US30", Timeframe.H1, 120, Instant.parse("2024-03-11T11:00:00Z")));
        when(syncService.seriesStatus(d1)).thenReturn(new SeriesStatus("US30", Timeframe.D1, 0, null));
        when(repository.backendName()).thenReturn("TimescaleDB");
        when(sourceSupervisor.name()).thenReturn("source");
        when(sourceSupervisor.state()).thenReturn(ConnectionState.CONNECTED);
        when(storeSupervisor.name()).thenReturn("store");
        when(storeSupervisor.state()).thenReturn(ConnectionState.DISCONNECTED);

        mockMvc.perform(get("/api/v1/series"))
            .andExpect(status().isOk())
            .andExpect(jsonPath("$.backend").value("TimescaleDB"))
            .andExpect(jsonPath("$.connections.source").value("CONNECTED"))
            .andExpect(jsonPath("$.connections.store").value("DISCONNECTED"))
            .andExpect(jsonPath("$.series", hasSize(2)))
            .andExpect(jsonPath("$.series[0].timeframe").value("H1"))
            .andExpect(jsonPath("$.series[0].storedCandles").value(120))
            .andExpect(jsonPath("$.series[1].highWaterMark").value(nullValue()));
    }
}
