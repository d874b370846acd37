package com.fintech.candlesync.connection;

import io.github.resilience4j.retry.Retry;
import io.github.resilience4j.retry.RetryRegistry;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tags;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Owns the reconnect policy of one {@link ManagedConnection}.
 *
 * <p>State machine: {@code DISCONNECTED -> CONNECTING -> CONNECTED}, and
 * {@code CONNECTED -> DISCONNECTED} when the liveness probe fails. The reconnect loop is a
 * Resilience4j {@link Retry} that retries on a {@code false} result with a fixed wait,
 * so exhausting the attempts yields {@code false} instead of an exception.
 *
 * <p>Callers treat {@code false} as "skip this unit of work"; it is never fatal.
 */
public class ConnectionSupervisor {

    private static final Logger log = LoggerFactory.getLogger(ConnectionSupervisor.class);

    private final ManagedConnection connection;
    private final Retry retry;
    private final AtomicReference<ConnectionState> state = new AtomicReference<>(ConnectionState.DISCONNECTED);

    private final AtomicLong stateGauge = new AtomicLong(ConnectionState.DISCONNECTED.ordinal());
    private final AtomicLong reconnectAttempts = new AtomicLong(0);
    private final AtomicLong reconnectFailures = new AtomicLong(0);
    private final AtomicLong probeFailures = new AtomicLong(0);

    public ConnectionSupervisor(ManagedConnection connection, RetryRegistry retryRegistry, MeterRegistry meterRegistry) {
        this.connection = connection;
        this.retry = retryRegistry.retry("connection-" + connection.name());

        Tags tags = Tags.of("connection", connection.name());
        meterRegistry.gauge("connection.state", tags, stateGauge);
        meterRegistry.gauge("connection.reconnect.attempts", tags, reconnectAttempts);
        meterRegistry.gauge("connection.reconnect.failures", tags, reconnectFailures);
        meterRegistry.gauge("connection.probe.failures", tags, probeFailures);

        retry.getEventPublisher()
            .onRetry(event ->
                log.warn("Reconnection attempt {} to {} failed, waiting {}ms",
                    event.getNumberOfRetryAttempts(), connection.name(), event.getWaitInterval().toMillis())
            );
    }

    /**
     * Returns true once the connection is known to answer.
     * A connected connection is probed first; on probe failure, or when not connected,
     * the reconnect policy runs until it succeeds or the attempts are exhausted.
     */
    public synchronized boolean ensureConnected() {
        if (state.get() == ConnectionState.CONNECTED) {
            if (probeQuietly()) {
                return true;
            }
            probeFailures.incrementAndGet();
            log.warn("{} connection lost: liveness probe failed, reconnecting", connection.name());
            transition(ConnectionState.DISCONNECTED);
            disconnectQuietly();
        }

        int maxAttempts = retry.getRetryConfig().getMaxAttempts();
        boolean connected;
        try {
            connected = retry.executeSupplier(this::attemptConnect);
        } catch (RuntimeException e) {
            log.error("Reconnect loop for {} aborted: {}", connection.name(), e.getMessage());
            connected = false;
        }

        if (!connected) {
            reconnectFailures.incrementAndGet();
            transition(ConnectionState.DISCONNECTED);
            log.error("Failed to connect to {} after {} attempts", connection.name(), maxAttempts);
        }
        return connected;
    }

    private boolean attemptConnect() {
        reconnectAttempts.incrementAndGet();
        transition(ConnectionState.CONNECTING);
        try {
            connection.connect();
            if (connection.probe()) {
                transition(ConnectionState.CONNECTED);
                log.info("Connected to {}", connection.name());
                return true;
            }
            log.warn("{} accepted the connection but did not answer the probe", connection.name());
        } catch (RuntimeException e) {
            log.warn("Connection to {} failed: {}", connection.name(), e.getMessage());
        }
        transition(ConnectionState.DISCONNECTED);
        return false;
    }

    /**
     * Marks the connection as lost without probing, so the next {@link #ensureConnected()}
     * reconnects. Used after an operation failed with a connectivity error.
     */
    public synchronized void markDisconnected() {
        if (state.get() != ConnectionState.DISCONNECTED) {
            log.warn("{} marked disconnected after a connectivity failure", connection.name());
            transition(ConnectionState.DISCONNECTED);
        }
    }

    /**
     * Closes the connection and returns to {@code DISCONNECTED}.
     */
    public synchronized void shutdown() {
        disconnectQuietly();
        transition(ConnectionState.DISCONNECTED);
        log.info("{} connection closed", connection.name());
    }

    public ConnectionState state() {
        return state.get();
    }

    public String name() {
        return connection.name();
    }

    private boolean probeQuietly() {
        try {
            return connection.probe();
        } catch (RuntimeException e) {
            log.debug("{} probe threw: {}", connection.name(), e.getMessage());
            return false;
        }
    }

    private void disconnectQuietly() {
        try {
            connection.disconnect();
        } catch (RuntimeException e) {
            log.warn("Error while disconnecting {}: {}", connection.name(), e.getMessage());
        }
    }

    private void transition(ConnectionState next) {
        ConnectionState previous = state.getAndSet(next);
        stateGauge.set(next.ordinal());
        if (previous != next && log.isDebugEnabled()) {
            log.debug("{} connection state {} -> {}", connection.name(), previous, next);
        }
    }
}
