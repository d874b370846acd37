package com.fintech.candlesync.source;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("SymbolResolver Tests")
class SymbolResolverTest {

    private static final List<String> BROKER_SYMBOLS = List.of(
        "EURUSD", "EURUSD.pro", "GBPUSD", "NAS100", "US30", "US30.cash", "GER40", "XAUUSD");

    private final SymbolResolver resolver = new SymbolResolver();

    @ParameterizedTest(name = "{0} resolves to {1}")
    @CsvSource({
        "US30, US30",
        "us30, US30",
        "USTech, NAS100",
        "eurusd, EURUSD",
        "GER40, GER40",
        "XAU, XAUUSD"
    })
    @DisplayName("Should pick the best native symbol")
    void testResolve(String instrument, String expected) {
        assertThat(resolver.resolve(instrument, BROKER_SYMBOLS)).contains(expected);
    }

    @Test
    @DisplayName("Exact match should beat a longer prefix match")
    void testExactBeatsPrefix() {
        assertThat(resolver.resolve("US30", List.of("US30.cash", "US30"))).contains("US30");
    }

    @Test
    @DisplayName("Prefix match should beat substring match")
    void testPrefixBeatsSubstring() {
        assertThat(resolver.resolve("US30", List.of("MINIUS30", "US30m"))).contains("US30m");
    }

    @Test
    @DisplayName("Shorter name should win within the same tier")
    void testShortestWithinTier() {
        assertThat(resolver.resolve("US30", List.of("US30.cash", "US30m", "US30.c"))).contains("US30m");
    }

    @Test
    @DisplayName("Alias prefix should resolve broker suffixed spellings")
    void testAliasPrefix() {
        assertThat(resolver.resolve("USTech", List.of("EURUSD", "USTEC.cash"))).contains("USTEC.cash");
    }

    @Test
    @DisplayName("Exact alias should beat alias prefix")
    void testAliasExactBeatsPrefix() {
        assertThat(resolver.resolve("USTech", List.of("NAS100.cash", "US100"))).contains("US100");
    }

    @Test
    @DisplayName("Unknown or blank instruments should not resolve")
    void testNoMatch() {
        assertThat(resolver.resolve("BTCUSD", List.of("EURUSD", "US30"))).isEmpty();
        assertThat(resolver.resolve("  ", List.of("EURUSD"))).isEmpty();
        assertThat(resolver.resolve("US30", List.of())).isEmpty();
    }
}
