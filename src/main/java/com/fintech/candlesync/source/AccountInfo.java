package com.fintech.candlesync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Trading account the terminal is logged into.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AccountInfo(
    long login,
    String server,
    String name,
    double balance,
    String currency
) {
}
