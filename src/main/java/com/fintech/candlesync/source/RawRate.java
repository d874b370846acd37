package com.fintech.candlesync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One bar as delivered by the provider, before normalization.
 * Fields are boxed so a record with a missing field is detectable and can be skipped.
 *
 * @param time Bar open time in epoch seconds on the provider's server clock
 * @param tickVolume Number of ticks in the bar, stored as the candle volume
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record RawRate(
    Long time,
    Double open,
    Double high,
    Double low,
    Double close,
    @JsonProperty("tick_volume") Long tickVolume,
    Integer spread,
    @JsonProperty("real_volume") Long realVolume
) {
}
