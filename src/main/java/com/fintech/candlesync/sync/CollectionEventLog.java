package com.fintech.candlesync.sync;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlesync.domain.CollectionEvent;
import com.fintech.candlesync.domain.EventLevel;
import com.fintech.candlesync.domain.SeriesKey;
import com.fintech.candlesync.storage.CandleRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.util.Map;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Operational history: every event goes to the application log and is appended to the
 * store's collection log with its details as JSON.
 *
 * <p>A failed store write is logged and dropped. Recording an event never throws.
 */
@Component
public class CollectionEventLog {

    private static final Logger log = LoggerFactory.getLogger(CollectionEventLog.class);

    private final CandleRepository repository;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final AtomicLong droppedEvents = new AtomicLong(0);

    public CollectionEventLog(CandleRepository repository, ObjectMapper objectMapper, Clock clock) {
        this.repository = repository;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    public void info(SeriesKey series, String message, Map<String, ?> details) {
        record(EventLevel.INFO, series, message, details);
    }

    public void info(String message) {
        record(EventLevel.INFO, null, message, null);
    }

    public void warning(SeriesKey series, String message, Map<String, ?> details) {
        record(EventLevel.WARNING, series, message, details);
    }

    public void error(SeriesKey series, String message, Map<String, ?> details) {
        record(EventLevel.ERROR, series, message, details);
    }

    public void error(String message) {
        record(EventLevel.ERROR, null, message, null);
    }

    /**
     * Logs the event and appends it to the store.
     *
     * @param series Related series, or null for service-wide events
     * @param details Structured details, or null
     */
    public void record(EventLevel level, SeriesKey series, String message, Map<String, ?> details) {
        String text = series != null ? "[" + series + "] " + message : message;
        switch (level) {
            case ERROR -> log.error(text);
            case WARNING -> log.warn(text);
            default -> log.info(text);
        }

        try {
            repository.logEvent(new CollectionEvent(
                clock.instant(),
                level,
                series != null ? series.instrument() : null,
                series != null ? series.timeframe() : null,
                message,
                toJson(details)
            ));
        } catch (RuntimeException e) {
            droppedEvents.incrementAndGet();
            log.warn("Failed to write collection event to store: {}", e.getMessage());
        }
    }

    public long droppedEvents() {
        return droppedEvents.get();
    }

    private String toJson(Map<String, ?> details) {
        if (details == null || details.isEmpty()) {
            return null;
        }
        try {
            return objectMapper.writeValueAsString(details);
        } catch (JsonProcessingException e) {
            log.warn("Could not serialize event details {}: {}", details, e.getMessage());
            return null;
        }
    }
}
