package com.fintech.candlesync.source;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

/**
 * Identity of the MT5 terminal behind the bridge.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record TerminalInfo(
    String name,
    String company,
    String path,
    boolean connected
) {
}
