package com.fintech.candlesync.connection;

import com.fintech.candlesync.storage.CandleRepository;

/**
 * Exposes the active {@link CandleRepository} as a supervised connection.
 */
public class StoreConnection implements ManagedConnection {

    private final CandleRepository repository;

    public StoreConnection(CandleRepository repository) {
        this.repository = repository;
    }

    @Override
    public String name() {
        return "store";
    }

    @Override
    public void connect() {
        repository.reconnect();
    }

    @Override
    public void disconnect() {
        repository.close();
    }

    @Override
    public boolean probe() {
        return repository.isHealthy();
    }
}
