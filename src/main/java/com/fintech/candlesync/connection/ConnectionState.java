package com.fintech.candlesync.connection;

/**
 * Lifecycle of a supervised connection.
 * {@code CONNECTED} falls back to {@code DISCONNECTED} when a liveness probe fails.
 */
public enum ConnectionState {
    DISCONNECTED,
    CONNECTING,
    CONNECTED
}
