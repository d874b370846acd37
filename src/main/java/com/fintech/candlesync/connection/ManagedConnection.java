package com.fintech.candlesync.connection;

/**
 * A remote resource whose connectivity is owned by a {@link ConnectionSupervisor}.
 */
public interface ManagedConnection {

    /**
     * Short name used in logs, metrics and the status API ("source", "store").
     */
    String name();

    /**
     * Opens (or reopens) the connection.
     *
     * @throws RuntimeException if the connection cannot be established
     */
    void connect();

    /**
     * Releases the connection. Must not throw for an already closed connection.
     */
    void disconnect();

    /**
     * Issues a trivial call against the remote side.
     * Implementations must really talk to the remote, never answer from a cached flag.
     *
     * @return true if the remote answered
     */
    boolean probe();
}
