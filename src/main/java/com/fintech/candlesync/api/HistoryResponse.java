package com.fintech.candlesync.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fintech.candlesync.domain.Candle;

import java.util.List;
import java.util.function.Function;

/**
 * Columnar candle history, one array per OHLCV component, times in Unix seconds.
 * <pre>
 * {"s": "ok", "t": [1704067200], "o": [37689.5], "h": [37720.0], "l": [37680.2], "c": [37702.1], "v": [1250]}
 * </pre>
 * An empty range answers {@code "s": "no_data"} with empty arrays.
 */
public record HistoryResponse(
    @JsonProperty("s") String status,
    @JsonProperty("t") List<Long> time,
    @JsonProperty("o") List<Double> open,
    @JsonProperty("h") List<Double> high,
    @JsonProperty("l") List<Double> low,
    @JsonProperty("c") List<Double> close,
    @JsonProperty("v") List<Long> volume
) {

    private static final HistoryResponse NO_DATA =
        new HistoryResponse("no_data", List.of(), List.of(), List.of(), List.of(), List.of(), List.of());

    /**
     * @param candles closed candles in ascending time order
     */
    public static HistoryResponse fromCandles(List<Candle> candles) {
        if (candles.isEmpty()) {
            return NO_DATA;
        }
        return new HistoryResponse("ok",
            column(candles, candle -> candle.time().getEpochSecond()),
            column(candles, Candle::open),
            column(candles, Candle::high),
            column(candles, Candle::low),
            column(candles, Candle::close),
            column(candles, Candle::volume));
    }

    public static HistoryResponse noData() {
        return NO_DATA;
    }

    private static <T> List<T> column(List<Candle> candles, Function<Candle, T> component) {
        return candles.stream().map(component).toList();
    }
}
