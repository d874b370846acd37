package com.fintech.candlesync.api;

import com.fintech.candlesync.config.SyncProperties;
import com.fintech.candlesync.domain.Candle;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.storage.CandleRepository;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.media.Content;
import io.swagger.v3.oas.annotations.media.ExampleObject;
import io.swagger.v3.oas.annotations.media.Schema;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.responses.ApiResponses;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.time.Instant;
import java.util.List;

/**
 * REST API for querying collected candles.
 * Returns data in TradingView Lightweight Charts compatible format.
 */
@RestController
@RequestMapping("/api/v1")
@Validated
@Tag(name = "Candle Data", description = "Historical OHLC candle data API")
public class HistoryController {

    private static final Logger log = LoggerFactory.getLogger(HistoryController.class);
    private static final long MAX_BARS_PER_REQUEST = 50_000;
    private static final long MAX_TIMESTAMP = 9999999999L; // Year 2286

    private final CandleRepository repository;
    private final SyncProperties properties;
    private final MeterRegistry meterRegistry;

    public HistoryController(CandleRepository repository, SyncProperties properties, MeterRegistry meterRegistry) {
        this.repository = repository;
        this.properties = properties;
        this.meterRegistry = meterRegistry;
    }

    /**
     * GET /api/v1/history
     *
     * @param instrument Configured instrument (case-insensitive, e.g. "US30")
     * @param timeframe Timeframe ("H1", "1h", "60")
     * @param from Start timestamp in Unix seconds, inclusive
     * @param to End timestamp in Unix seconds, exclusive
     * @return TradingView-compatible OHLC data
     */
    @Operation(
        summary = "Get historical OHLC candle data",
        description = """
            Retrieves stored candles of one instrument and timeframe with open time in [from, to).

            **Timeframes:** M1, M5, M15, M30, H1, H4, D1

            **Example Request:**
            ```
            GET /api/v1/history?instrument=US30&timeframe=H1&from=1704067200&to=1704153600
            ```
            """
    )
    @ApiResponses(value = {
        @ApiResponse(
            responseCode = "200",
            description = "Successfully retrieved candle data",
            content = @Content(
                mediaType = "application/json",
                schema = @Schema(implementation = HistoryResponse.class),
                examples = @ExampleObject(
                    name = "Sample Response",
                    value = """
                        {
                          "s": "ok",
                          "t": [1704067200, 1704070800],
                          "o": [37689.5, 37702.1],
                          "h": [37720.0, 37711.4],
                          "l": [37680.2, 37690.0],
                          "c": [37702.1, 37695.3],
                          "v": [1250, 980]
                        }
                        """
                )
            )
        ),
        @ApiResponse(
            responseCode = "400",
            description = "Invalid request parameters",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        ),
        @ApiResponse(
            responseCode = "503",
            description = "Store unavailable",
            content = @Content(mediaType = "application/json", schema = @Schema(implementation = ErrorResponse.class))
        )
    })
    @GetMapping("/history")
    public ResponseEntity<HistoryResponse> getHistory(
            @Parameter(description = "Instrument (e.g., US30, USTech)", example = "US30", required = true)
            @RequestParam
            @NotBlank(message = "Instrument is required and cannot be blank")
            String instrument,

            @Parameter(description = "Timeframe: M1, M5, M15, M30, H1, H4, D1", example = "H1", required = true)
            @RequestParam
            @NotBlank(message = "Timeframe is required and cannot be blank")
            String timeframe,

            @Parameter(description = "Start time (Unix timestamp in seconds)", example = "1704067200", required = true)
            @RequestParam
            @NotNull(message = "From timestamp is required")
            @Positive(message = "From timestamp must be positive")
            Long from,

            @Parameter(description = "End time (Unix timestamp in seconds)", example = "1704153600", required = true)
            @RequestParam
            @NotNull(message = "To timestamp is required")
            @Positive(message = "To timestamp must be positive")
            Long to) {

        Timer.Sample sample = Timer.start(meterRegistry);
        String timeframeTag = timeframe;
        try {
            String canonicalInstrument = canonicalInstrument(instrument);
            Timeframe parsedTimeframe = Timeframe.parse(timeframe);
            timeframeTag = parsedTimeframe.name();

            if (from > MAX_TIMESTAMP || to > MAX_TIMESTAMP) {
                throw new IllegalArgumentException(
                    String.format("Timestamps must not exceed %d", MAX_TIMESTAMP));
            }
            if (from >= to) {
                throw new IllegalArgumentException(
                    String.format("Invalid time range: 'from' (%d) must be less than 'to' (%d)", from, to));
            }
            long bars = (to - from) / (parsedTimeframe.minutes() * 60L);
            if (bars > MAX_BARS_PER_REQUEST) {
                throw new IllegalArgumentException(
                    String.format("Time range too large: %d %s bars. Maximum allowed: %d",
                        bars, parsedTimeframe, MAX_BARS_PER_REQUEST));
            }

            List<Candle> candles = repository.findByRange(
                new SeriesKey(canonicalInstrument, parsedTimeframe),
                Instant.ofEpochSecond(from),
                Instant.ofEpochSecond(to));

            log.debug("History query: instrument={}, timeframe={}, from={}, to={}, results={}",
                     canonicalInstrument, parsedTimeframe, from, to, candles.size());

            return ResponseEntity.ok(HistoryResponse.fromCandles(candles));
        } finally {
            sample.stop(meterRegistry.timer("api.history.request.time", "timeframe", timeframeTag));
        }
    }

    /**
     * Maps the requested instrument onto the configured spelling, which is the stored one.
     */
    private String canonicalInstrument(String instrument) {
        String requested = instrument.trim();
        return properties.getInstruments().stream()
            .filter(configured -> configured.equalsIgnoreCase(requested))
            .findFirst()
            .orElseThrow(() -> new IllegalArgumentException(
                String.format("Unsupported instrument '%s'. Allowed: %s",
                    requested, String.join(", ", properties.getInstruments()))));
    }
}
