package com.fintech.candlesync.storage.timescaledb;

import com.fintech.candlesync.storage.StorageIntegrityException;
import com.fintech.candlesync.storage.StoreException;
import com.fintech.candlesync.storage.StoreUnavailableException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.dao.QueryTimeoutException;
import org.springframework.transaction.CannotCreateTransactionException;

import static org.assertj.core.api.Assertions.assertThat;

@DisplayName("Store error translation Tests")
class StoreErrorTranslationTest {

    @Test
    @DisplayName("Connectivity failures should be reported as store unavailable")
    void testConnectivityFailures() {
        assertThat(TimescaleDBCandleRepository.translate("Insert", new DataAccessResourceFailureException("down"), true))
            .isInstanceOf(StoreUnavailableException.class);
        assertThat(TimescaleDBCandleRepository.translate("Count", new QueryTimeoutException("slow"), false))
            .isInstanceOf(StoreUnavailableException.class);
        assertThat(TimescaleDBCandleRepository.translate("Insert", new CannotCreateTransactionException("no pool"), true))
            .isInstanceOf(StoreUnavailableException.class);
    }

    @Test
    @DisplayName("Other write failures should be integrity failures")
    void testWriteFailures() {
        StoreException translated = TimescaleDBCandleRepository.translate(
            "Insert of 3 candles", new DataIntegrityViolationException("value too long"), true);

        assertThat(translated)
            .isInstanceOf(StorageIntegrityException.class)
            .hasMessage("Insert of 3 candles failed")
            .hasCauseInstanceOf(DataIntegrityViolationException.class);
    }

    @Test
    @DisplayName("Other read failures should be plain store errors")
    void testReadFailures() {
        StoreException translated = TimescaleDBCandleRepository.translate(
            "Range query", new DataIntegrityViolationException("bad"), false);

        assertThat(translated)
            .isExactlyInstanceOf(StoreException.class);
    }
}
