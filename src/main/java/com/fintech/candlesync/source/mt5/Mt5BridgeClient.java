package com.fintech.candlesync.source.mt5;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fintech.candlesync.domain.Timeframe;
import com.fintech.candlesync.source.AccountInfo;
import com.fintech.candlesync.source.MarketDataSource;
import com.fintech.candlesync.source.RawRate;
import com.fintech.candlesync.source.SourceErrorKind;
import com.fintech.candlesync.source.SourceException;
import com.fintech.candlesync.source.TerminalInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClientException;
import org.springframework.web.client.RestTemplate;

import java.time.Instant;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.function.Supplier;

/**
 * {@link MarketDataSource} backed by the HTTP bridge in front of an MT5 terminal.
 *
 * <p>The bridge answers failures with {@code {"error":{"code":int,"message":string}}} where
 * {@code code} is the terminal's {@code last_error()} value. Codes are mapped to
 * {@link SourceErrorKind} here and nowhere else.
 */
@Component
public class Mt5BridgeClient implements MarketDataSource {

    private static final Logger log = LoggerFactory.getLogger(Mt5BridgeClient.class);

    // MT5 last_error() codes relevant to classification
    static final int ERR_INVALID_PARAMS = -2;
    static final int ERR_NOT_FOUND = -4;
    static final int ERR_TOO_MANY_BARS = -7;
    static final int ERR_IPC_FIRST = -10005;
    static final int ERR_IPC_LAST = -10001;

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;

    public Mt5BridgeClient(@Qualifier("mt5RestTemplate") RestTemplate restTemplate, ObjectMapper objectMapper) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
    }

    @Override
    public void login(long login, String password, String server) {
        Map<String, Object> body = Map.of(
            "login", login,
            "password", password,
            "server", server
        );
        AccountInfo account = call("Login", () ->
            restTemplate.postForObject("/api/session", body, AccountInfo.class));
        log.info("MT5 session opened: account={}, server={}",
                account != null ? account.login() : login, server);
    }

    @Override
    public void logout() {
        call("Logout", () -> {
            restTemplate.delete("/api/session");
            return null;
        });
    }

    @Override
    public AccountInfo accountInfo() {
        AccountInfo account = call("Account info", () ->
            restTemplate.getForObject("/api/account", AccountInfo.class));
        if (account == null) {
            throw new SourceException(SourceErrorKind.CONNECTIVITY, "Account info: empty response");
        }
        return account;
    }

    @Override
    public TerminalInfo terminalInfo() {
        TerminalInfo terminal = call("Terminal info", () ->
            restTemplate.getForObject("/api/terminal", TerminalInfo.class));
        if (terminal == null) {
            throw new SourceException(SourceErrorKind.CONNECTIVITY, "Terminal info: empty response");
        }
        return terminal;
    }

    @Override
    public List<String> symbols() {
        String[] symbols = call("Symbol list", () ->
            restTemplate.getForObject("/api/symbols", String[].class));
        return symbols != null ? Arrays.asList(symbols) : Collections.emptyList();
    }

    @Override
    public boolean selectSymbol(String symbol) {
        JsonNode result = call("Select symbol " + symbol, () ->
            restTemplate.postForObject("/api/symbols/{symbol}/select", null, JsonNode.class, symbol));
        return result != null && result.path("visible").asBoolean(false);
    }

    @Override
    public List<RawRate> ratesRange(String symbol, Timeframe timeframe, Instant from, Instant to) {
        RawRate[] rates = call("Rates range " + symbol + " " + timeframe, () ->
            restTemplate.getForObject(
                "/api/rates/range?symbol={symbol}&timeframe={timeframe}&from={from}&to={to}",
                RawRate[].class,
                symbol, timeframe.mt5Code(), from.getEpochSecond(), to.getEpochSecond()));
        return rates != null ? Arrays.asList(rates) : Collections.emptyList();
    }

    @Override
    public List<RawRate> ratesLatest(String symbol, Timeframe timeframe, int count) {
        RawRate[] rates = call("Latest rates " + symbol + " " + timeframe, () ->
            restTemplate.getForObject(
                "/api/rates/latest?symbol={symbol}&timeframe={timeframe}&count={count}",
                RawRate[].class,
                symbol, timeframe.mt5Code(), count));
        return rates != null ? Arrays.asList(rates) : Collections.emptyList();
    }

    private <T> T call(String operation, Supplier<T> request) {
        try {
            return request.get();
        } catch (HttpStatusCodeException e) {
            throw fromErrorResponse(operation, e);
        } catch (ResourceAccessException e) {
            throw new SourceException(SourceErrorKind.CONNECTIVITY,
                operation + " failed: bridge unreachable (" + e.getMessage() + ")", e);
        } catch (RestClientException e) {
            throw new SourceException(SourceErrorKind.UNKNOWN, operation + " failed: " + e.getMessage(), e);
        }
    }

    private SourceException fromErrorResponse(String operation, HttpStatusCodeException e) {
        String body = e.getResponseBodyAsString();
        try {
            JsonNode error = objectMapper.readTree(body).path("error");
            if (error.has("code")) {
                int code = error.get("code").asInt();
                String message = error.path("message").asText("");
                return new SourceException(classify(code),
                    operation + " failed: MT5 error " + code + " " + message, e);
            }
        } catch (JsonProcessingException parseError) {
            log.debug("{}: bridge error body is not JSON: {}", operation, body);
        }
        return new SourceException(classify(e.getStatusCode().value()),
            operation + " failed: HTTP " + e.getStatusCode().value(), e);
    }

    /**
     * Maps an MT5 error code, or an HTTP status when the bridge sent no code, to an error kind.
     */
    static SourceErrorKind classify(int code) {
        if (code == ERR_INVALID_PARAMS || code == ERR_TOO_MANY_BARS) {
            return SourceErrorKind.INVALID_RANGE;
        }
        if (code == ERR_NOT_FOUND || code == HttpStatus.NOT_FOUND.value()) {
            return SourceErrorKind.NOT_FOUND;
        }
        if ((code >= ERR_IPC_FIRST && code <= ERR_IPC_LAST)
                || code == HttpStatus.BAD_GATEWAY.value()
                || code == HttpStatus.SERVICE_UNAVAILABLE.value()
                || code == HttpStatus.GATEWAY_TIMEOUT.value()) {
            return SourceErrorKind.CONNECTIVITY;
        }
        return SourceErrorKind.UNKNOWN;
    }
}
