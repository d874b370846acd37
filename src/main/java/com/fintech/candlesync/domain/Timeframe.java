package com.fintech.candlesync.domain;

import java.time.Duration;
import java.time.Instant;
import java.util.Locale;

/**
 * Fixed bar intervals supported by the collector.
 * Each timeframe knows its duration and the native interval code of the MT5 terminal.
 */
public enum Timeframe {

    M1(1),
    M5(5),
    M15(15),
    M30(30),
    H1(60),
    H4(240),
    D1(1440);

    // MT5 encodes hourly and daily periods as 0x4000 | hours
    private static final int MT5_HOURLY_FLAG = 0x4000;

    private final int minutes;

    Timeframe(int minutes) {
        this.minutes = minutes;
    }

    /** Returns bar duration in minutes. */
    public int minutes() {
        return minutes;
    }

    /** Returns bar duration. */
    public Duration duration() {
        return Duration.ofMinutes(minutes);
    }

    /** Returns bar duration in milliseconds. */
    public long toMillis() {
        return minutes * 60_000L;
    }

    /**
     * Returns the MT5 {@code TIMEFRAME_*} constant for this interval.
     * Intraday minute frames map to their minute count, hour and day frames to {@code 0x4000 | hours}.
     */
    public int mt5Code() {
        if (minutes < 60) {
            return minutes;
        }
        return MT5_HOURLY_FLAG | (minutes / 60);
    }

    /**
     * Aligns an instant down to the start of the bar containing it (epoch-aligned).
     */
    public Instant alignDown(Instant instant) {
        long millis = instant.toEpochMilli();
        return Instant.ofEpochMilli(Math.floorDiv(millis, toMillis()) * toMillis());
    }

    /**
     * Parses a timeframe from its name ("H1"), a suffixed form ("1h", "15m", "1d")
     * or a plain minute count ("60").
     *
     * @throws IllegalArgumentException if the value matches no timeframe
     */
    public static Timeframe parse(String value) {
        if (value == null || value.isBlank()) {
            throw new IllegalArgumentException("Timeframe cannot be blank");
        }
        String normalized = value.trim().toUpperCase(Locale.ROOT);
        for (Timeframe timeframe : values()) {
            if (timeframe.name().equals(normalized)) {
                return timeframe;
            }
        }

        int minutes;
        try {
            if (normalized.endsWith("M")) {
                minutes = Integer.parseInt(normalized.substring(0, normalized.length() - 1));
            } else if (normalized.endsWith("H")) {
                minutes = Integer.parseInt(normalized.substring(0, normalized.length() - 1)) * 60;
            } else if (normalized.endsWith("D")) {
                minutes = Integer.parseInt(normalized.substring(0, normalized.length() - 1)) * 1440;
            } else {
                minutes = Integer.parseInt(normalized);
            }
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Unsupported timeframe: " + value, e);
        }
        return ofMinutes(minutes);
    }

    /**
     * Looks up a timeframe by its duration in minutes.
     *
     * @throws IllegalArgumentException if no timeframe has that duration
     */
    public static Timeframe ofMinutes(int minutes) {
        for (Timeframe timeframe : values()) {
            if (timeframe.minutes == minutes) {
                return timeframe;
            }
        }
        throw new IllegalArgumentException("Unsupported timeframe: " + minutes + " minutes");
    }
}
