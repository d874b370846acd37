package com.fintech.candlesync.source;

import com.fintech.candlesync.domain.Timeframe;

import java.time.Instant;
import java.util.List;

/**
 * Raw access to a market data provider.
 *
 * <p>All methods are blocking remote calls. Failures surface as {@link SourceException}
 * carrying a {@link SourceErrorKind}. Times exchanged here are on the provider's server clock;
 * {@link SourceGateway} converts them to UTC.
 */
public interface MarketDataSource {

    /**
     * Opens a session for the given trading account.
     */
    void login(long login, String password, String server);

    /**
     * Closes the current session. Does nothing if no session is open.
     */
    void logout();

    AccountInfo accountInfo();

    TerminalInfo terminalInfo();

    /**
     * Lists every symbol name the provider offers to this account.
     */
    List<String> symbols();

    /**
     * Makes {@code symbol} visible in the terminal's Market Watch. Rates of a hidden symbol
     * cannot be requested.
     *
     * @return false if the terminal refuses to show the symbol
     */
    boolean selectSymbol(String symbol);

    /**
     * Fetches bars whose open time lies in {@code [from, to]}.
     *
     * @param symbol Provider-native symbol
     * @throws SourceException with {@link SourceErrorKind#INVALID_RANGE} if the request is too large
     */
    List<RawRate> ratesRange(String symbol, Timeframe timeframe, Instant from, Instant to);

    /**
     * Fetches the most recent {@code count} bars, oldest first.
     */
    List<RawRate> ratesLatest(String symbol, Timeframe timeframe, int count);
}
